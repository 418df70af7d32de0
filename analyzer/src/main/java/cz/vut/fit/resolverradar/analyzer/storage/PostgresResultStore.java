package cz.vut.fit.resolverradar.analyzer.storage;

import cz.vut.fit.resolverradar.models.MeasurementHost;
import cz.vut.fit.resolverradar.models.QueryLogEntry;
import cz.vut.fit.resolverradar.models.ServerResult;
import cz.vut.fit.resolverradar.models.WhoisInfo;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A {@link ResultStore} backed by PostgreSQL. The schema is created on open if it does not exist.
 * Each operation runs in its own transaction that is rolled back on failure.
 */
@SuppressWarnings("SqlNoDataSourceInspection")
public class PostgresResultStore implements ResultStore {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(PostgresResultStore.class);

    private static final String[] SCHEMA = {
            "CREATE TABLE IF NOT EXISTS dns_query_logs (" +
                    " id SERIAL PRIMARY KEY, server_ip INET NOT NULL, system_hostname VARCHAR(255)," +
                    " query_type VARCHAR(10) NOT NULL, query_name VARCHAR(255) NOT NULL, query_flags TEXT," +
                    " response_rcode VARCHAR(50) NOT NULL, response_flags TEXT, response_answer TEXT," +
                    " response_ttl BIGINT, response_time_ms NUMERIC(10, 3), timestamp TIMESTAMPTZ NOT NULL," +
                    " test_type VARCHAR(50) NOT NULL, created_at TIMESTAMPTZ DEFAULT NOW()," +
                    " UNIQUE(server_ip, query_type, query_name, test_type, timestamp))",
            "ALTER TABLE dns_query_logs ADD COLUMN IF NOT EXISTS system_hostname VARCHAR(255)",
            "CREATE INDEX IF NOT EXISTS idx_dns_logs_server_ip ON dns_query_logs(server_ip)",
            "CREATE INDEX IF NOT EXISTS idx_dns_logs_timestamp ON dns_query_logs(timestamp)",
            "CREATE INDEX IF NOT EXISTS idx_dns_logs_test_type ON dns_query_logs(test_type)",
            "CREATE INDEX IF NOT EXISTS idx_dns_logs_ttl ON dns_query_logs(response_ttl)",

            "CREATE TABLE IF NOT EXISTS whois_cache (" +
                    " id SERIAL PRIMARY KEY, server_ip INET NOT NULL UNIQUE, organization VARCHAR(255)," +
                    " asn VARCHAR(20), asn_description TEXT, country VARCHAR(10)," +
                    " last_updated TIMESTAMPTZ DEFAULT NOW(), created_at TIMESTAMPTZ DEFAULT NOW())",
            "CREATE INDEX IF NOT EXISTS idx_whois_cache_last_updated ON whois_cache(last_updated)",

            "CREATE TABLE IF NOT EXISTS server_analysis_results (" +
                    " id SERIAL PRIMARY KEY, server_ip INET NOT NULL, system_hostname VARCHAR(255)," +
                    " public_ip INET, timestamp TIMESTAMPTZ NOT NULL, is_recursive BOOLEAN NOT NULL," +
                    " ra_flag_set BOOLEAN NOT NULL, latency_ms NUMERIC(10, 3), organization VARCHAR(255)," +
                    " asn VARCHAR(20), asn_description TEXT, country VARCHAR(10), dnssec_enabled BOOLEAN," +
                    " ad_flag_set BOOLEAN, dnssec_rcode VARCHAR(50), malicious_blocking BOOLEAN," +
                    " malicious_rcode VARCHAR(50), is_isp_assigned BOOLEAN DEFAULT FALSE," +
                    " server_responsive BOOLEAN DEFAULT TRUE, test_reliability VARCHAR(50) DEFAULT 'RELIABLE'," +
                    " failure_reason TEXT, traceroute_status VARCHAR(50), cache_ttl BIGINT," +
                    " cache_ttl_rcode VARCHAR(50), created_at TIMESTAMPTZ DEFAULT NOW()," +
                    " updated_at TIMESTAMPTZ DEFAULT NOW(), UNIQUE(server_ip, timestamp))",
            "ALTER TABLE server_analysis_results ADD COLUMN IF NOT EXISTS traceroute_status VARCHAR(50)",
            "ALTER TABLE server_analysis_results ADD COLUMN IF NOT EXISTS cache_ttl BIGINT",
            "ALTER TABLE server_analysis_results ADD COLUMN IF NOT EXISTS cache_ttl_rcode VARCHAR(50)",
            "CREATE INDEX IF NOT EXISTS idx_server_results_server_ip ON server_analysis_results(server_ip)",
            "CREATE INDEX IF NOT EXISTS idx_server_results_timestamp ON server_analysis_results(timestamp)",
            "CREATE INDEX IF NOT EXISTS idx_server_results_recursive ON server_analysis_results(is_recursive)",
            "CREATE INDEX IF NOT EXISTS idx_server_results_system_hostname" +
                    " ON server_analysis_results(system_hostname)",
            "CREATE INDEX IF NOT EXISTS idx_server_results_public_ip ON server_analysis_results(public_ip)",
            "CREATE INDEX IF NOT EXISTS idx_server_results_is_isp_assigned" +
                    " ON server_analysis_results(is_isp_assigned)",
            "CREATE INDEX IF NOT EXISTS idx_server_results_test_reliability" +
                    " ON server_analysis_results(test_reliability)",
            "CREATE INDEX IF NOT EXISTS idx_server_results_server_responsive" +
                    " ON server_analysis_results(server_responsive)",

            "CREATE TABLE IF NOT EXISTS measurement_hosts (" +
                    " id SERIAL PRIMARY KEY, system_hostname VARCHAR(255) NOT NULL, public_ip INET NOT NULL," +
                    " organization VARCHAR(255), asn VARCHAR(20), asn_description TEXT, country VARCHAR(10)," +
                    " first_seen TIMESTAMPTZ DEFAULT NOW(), last_seen TIMESTAMPTZ DEFAULT NOW()," +
                    " UNIQUE(system_hostname, public_ip))",
            "CREATE INDEX IF NOT EXISTS idx_hosts_hostname ON measurement_hosts(system_hostname)",
            "CREATE INDEX IF NOT EXISTS idx_hosts_public_ip ON measurement_hosts(public_ip)"
    };

    @FunctionalInterface
    private interface SqlAction<T> {
        T run() throws SQLException;
    }

    private final Connection _connection;
    private final PreparedStatement _insertQueryLog;
    private final PreparedStatement _upsertServerResult;
    private final PreparedStatement _selectWhois;
    private final PreparedStatement _upsertWhois;
    private final PreparedStatement _upsertHost;
    private final PreparedStatement _countAnalyzed;
    private final PreparedStatement _countCached;
    private final PreparedStatement _selectWithoutWhois;

    /**
     * Opens a connection to the database and creates the schema if needed.
     *
     * @throws IOException If the connection or the schema creation fails.
     */
    public static PostgresResultStore open(@NotNull String dbUrl, @NotNull String dbUser, @NotNull String dbPassword)
            throws IOException {
        final Connection connection;
        try {
            Logger.debug("Opening connection");
            connection = DriverManager.getConnection(dbUrl, dbUser, dbPassword);
        } catch (SQLException e) {
            throw new IOException("Cannot connect to " + dbUrl, e);
        }

        try {
            return new PostgresResultStore(connection);
        } catch (IOException e) {
            try {
                connection.close();
            } catch (SQLException closeException) {
                e.addSuppressed(closeException);
            }
            throw e;
        }
    }

    PostgresResultStore(@NotNull Connection connection) throws IOException {
        _connection = connection;
        try {
            _connection.setAutoCommit(false);
            createSchema();

            _insertQueryLog = _connection.prepareStatement(
                    "INSERT INTO dns_query_logs(server_ip, system_hostname, query_type, query_name, query_flags," +
                            " response_rcode, response_flags, response_answer, response_ttl, response_time_ms," +
                            " timestamp, test_type)" +
                            " VALUES (?::inet, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)" +
                            " ON CONFLICT (server_ip, query_type, query_name, test_type, timestamp) DO NOTHING");
            _upsertServerResult = _connection.prepareStatement(
                    "INSERT INTO server_analysis_results(server_ip, system_hostname, public_ip, timestamp," +
                            " is_recursive, ra_flag_set, latency_ms, organization, asn, asn_description, country," +
                            " dnssec_enabled, ad_flag_set, dnssec_rcode, malicious_blocking, malicious_rcode," +
                            " is_isp_assigned, server_responsive, test_reliability, failure_reason," +
                            " traceroute_status, cache_ttl, cache_ttl_rcode)" +
                            " VALUES (?::inet, ?, ?::inet, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)" +
                            " ON CONFLICT (server_ip, timestamp) DO UPDATE SET" +
                            " system_hostname=EXCLUDED.system_hostname, public_ip=EXCLUDED.public_ip," +
                            " is_recursive=EXCLUDED.is_recursive, ra_flag_set=EXCLUDED.ra_flag_set," +
                            " latency_ms=EXCLUDED.latency_ms, organization=EXCLUDED.organization," +
                            " asn=EXCLUDED.asn, asn_description=EXCLUDED.asn_description," +
                            " country=EXCLUDED.country, dnssec_enabled=EXCLUDED.dnssec_enabled," +
                            " ad_flag_set=EXCLUDED.ad_flag_set, dnssec_rcode=EXCLUDED.dnssec_rcode," +
                            " malicious_blocking=EXCLUDED.malicious_blocking," +
                            " malicious_rcode=EXCLUDED.malicious_rcode, is_isp_assigned=EXCLUDED.is_isp_assigned," +
                            " server_responsive=EXCLUDED.server_responsive," +
                            " test_reliability=EXCLUDED.test_reliability, failure_reason=EXCLUDED.failure_reason," +
                            " traceroute_status=EXCLUDED.traceroute_status, cache_ttl=EXCLUDED.cache_ttl," +
                            " cache_ttl_rcode=EXCLUDED.cache_ttl_rcode, updated_at=NOW()");
            _selectWhois = _connection.prepareStatement(
                    "SELECT organization, asn, asn_description, country FROM whois_cache WHERE server_ip = ?::inet");
            _upsertWhois = _connection.prepareStatement(
                    "INSERT INTO whois_cache(server_ip, organization, asn, asn_description, country)" +
                            " VALUES (?::inet, ?, ?, ?, ?)" +
                            " ON CONFLICT (server_ip) DO UPDATE SET organization=EXCLUDED.organization," +
                            " asn=EXCLUDED.asn, asn_description=EXCLUDED.asn_description," +
                            " country=EXCLUDED.country, last_updated=NOW()");
            _upsertHost = _connection.prepareStatement(
                    "INSERT INTO measurement_hosts(system_hostname, public_ip, organization, asn, asn_description," +
                            " country) VALUES (?, ?::inet, ?, ?, ?, ?)" +
                            " ON CONFLICT (system_hostname, public_ip) DO UPDATE SET" +
                            " organization=EXCLUDED.organization, asn=EXCLUDED.asn," +
                            " asn_description=EXCLUDED.asn_description, country=EXCLUDED.country, last_seen=NOW()");
            _countAnalyzed = _connection.prepareStatement(
                    "SELECT COUNT(DISTINCT server_ip) FROM server_analysis_results");
            _countCached = _connection.prepareStatement(
                    "SELECT COUNT(DISTINCT r.server_ip) FROM server_analysis_results r" +
                            " JOIN whois_cache w ON w.server_ip = r.server_ip");
            _selectWithoutWhois = _connection.prepareStatement(
                    "SELECT DISTINCT r.server_ip::text FROM server_analysis_results r" +
                            " WHERE NOT EXISTS (SELECT 1 FROM whois_cache w WHERE w.server_ip = r.server_ip)" +
                            " LIMIT ?");
        } catch (SQLException e) {
            rollbackAfter(e);
            throw new IOException("Cannot prepare the database", e);
        }
    }

    private void createSchema() throws SQLException {
        try (var statement = _connection.createStatement()) {
            for (var sql : SCHEMA) {
                statement.execute(sql);
            }
        }
        _connection.commit();
        Logger.trace("Schema ready");
    }

    @Override
    public void logQueries(@NotNull List<QueryLogEntry> entries) throws IOException {
        if (entries.isEmpty())
            return;

        inTransaction("store the query logs", () -> {
            for (var entry : entries) {
                _insertQueryLog.setString(1, entry.serverIp());
                _insertQueryLog.setString(2, entry.systemHostname());
                _insertQueryLog.setString(3, entry.queryType());
                _insertQueryLog.setString(4, entry.queryName());
                _insertQueryLog.setString(5, entry.queryFlags());
                _insertQueryLog.setString(6, entry.responseRcode());
                _insertQueryLog.setString(7, entry.responseFlags());
                _insertQueryLog.setString(8, entry.responseAnswer());
                setNullableLong(_insertQueryLog, 9, entry.responseTtl());
                setNullableDouble(_insertQueryLog, 10, entry.responseTimeMs());
                _insertQueryLog.setObject(11, entry.timestamp());
                _insertQueryLog.setString(12, entry.testType().tag());
                _insertQueryLog.addBatch();
            }
            return _insertQueryLog.executeBatch();
        });
        Logger.debug("Stored {} query log entries", entries.size());
    }

    @Override
    public void saveServerResult(@NotNull ServerResult result) throws IOException {
        inTransaction("store the result of " + result.serverIp(), () -> {
            final var s = _upsertServerResult;
            s.setString(1, result.serverIp());
            s.setString(2, result.systemHostname());
            s.setString(3, result.publicIp());
            s.setObject(4, result.timestamp());
            s.setBoolean(5, result.isRecursive());
            s.setBoolean(6, result.raFlagSet());
            setNullableDouble(s, 7, result.latencyMs());
            s.setString(8, result.organization());
            s.setString(9, result.asn());
            s.setString(10, result.asnDescription());
            s.setString(11, result.country());
            setNullableBoolean(s, 12, result.dnssecEnabled());
            s.setBoolean(13, result.adFlagSet());
            s.setString(14, result.dnssecRcode());
            setNullableBoolean(s, 15, result.maliciousBlocking());
            s.setString(16, result.maliciousRcode());
            s.setBoolean(17, result.isIspAssigned());
            s.setBoolean(18, result.serverResponsive());
            s.setString(19, result.testReliability().name());
            s.setString(20, result.failureReason());
            s.setString(21, result.tracerouteStatus());
            setNullableLong(s, 22, result.cacheTtl());
            s.setString(23, result.cacheTtlRcode());
            return s.executeUpdate();
        });
    }

    @Override
    public @NotNull Optional<WhoisInfo> findWhois(@NotNull String address) throws IOException {
        return inTransaction("read the WHOIS cache", () -> {
            _selectWhois.setString(1, address);
            try (var rs = _selectWhois.executeQuery()) {
                if (!rs.next())
                    return Optional.empty();

                return Optional.of(new WhoisInfo(rs.getString(1), rs.getString(2),
                        rs.getString(3), rs.getString(4)));
            }
        });
    }

    @Override
    public void saveWhois(@NotNull String address, @NotNull WhoisInfo whois) throws IOException {
        inTransaction("store the WHOIS data of " + address, () -> {
            _upsertWhois.setString(1, address);
            _upsertWhois.setString(2, whois.organization());
            _upsertWhois.setString(3, whois.asn());
            _upsertWhois.setString(4, whois.asnDescription());
            _upsertWhois.setString(5, whois.country());
            return _upsertWhois.executeUpdate();
        });
    }

    @Override
    public void upsertMeasurementHost(@NotNull MeasurementHost host) throws IOException {
        inTransaction("store the measurement host", () -> {
            _upsertHost.setString(1, host.systemHostname());
            _upsertHost.setString(2, host.publicIp());
            _upsertHost.setString(3, host.whois().organization());
            _upsertHost.setString(4, host.whois().asn());
            _upsertHost.setString(5, host.whois().asnDescription());
            _upsertHost.setString(6, host.whois().country());
            return _upsertHost.executeUpdate();
        });
    }

    @Override
    public @NotNull WhoisStats whoisStats() throws IOException {
        return inTransaction("read the WHOIS cache statistics", () -> {
            final var total = count(_countAnalyzed);
            final var cached = count(_countCached);
            return new WhoisStats(total, cached, Math.max(0, total - cached));
        });
    }

    @Override
    public @NotNull List<String> addressesWithoutWhois(int limit) throws IOException {
        return inTransaction("list the addresses without WHOIS data", () -> {
            _selectWithoutWhois.setInt(1, limit);
            final var addresses = new ArrayList<String>();
            try (var rs = _selectWithoutWhois.executeQuery()) {
                while (rs.next()) {
                    addresses.add(rs.getString(1));
                }
            }
            return addresses;
        });
    }

    @Override
    public void close() throws IOException {
        try {
            Logger.debug("Closing connection");
            _connection.close();
        } catch (SQLException e) {
            throw new IOException(e);
        }
    }

    private <T> T inTransaction(String description, SqlAction<T> action) throws IOException {
        try {
            final var result = action.run();
            _connection.commit();
            return result;
        } catch (SQLException e) {
            rollbackAfter(e);
            throw new IOException("Failed to " + description, e);
        }
    }

    private void rollbackAfter(SQLException cause) {
        try {
            Logger.warn("Rolling back due to an error: {}", cause.getMessage());
            _connection.rollback();
        } catch (SQLException e) {
            Logger.error("Rollback failed", e);
            cause.addSuppressed(e);
        }
    }

    private static long count(PreparedStatement statement) throws SQLException {
        try (var rs = statement.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    private static void setNullableLong(PreparedStatement statement, int index, @Nullable Long value)
            throws SQLException {
        if (value == null)
            statement.setNull(index, Types.BIGINT);
        else
            statement.setLong(index, value);
    }

    private static void setNullableDouble(PreparedStatement statement, int index, @Nullable Double value)
            throws SQLException {
        if (value == null)
            statement.setNull(index, Types.NUMERIC);
        else
            statement.setDouble(index, value);
    }

    private static void setNullableBoolean(PreparedStatement statement, int index, @Nullable Boolean value)
            throws SQLException {
        if (value == null)
            statement.setNull(index, Types.BOOLEAN);
        else
            statement.setBoolean(index, value);
    }
}
