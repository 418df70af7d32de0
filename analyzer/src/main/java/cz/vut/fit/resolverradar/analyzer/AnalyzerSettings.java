package cz.vut.fit.resolverradar.analyzer;

import cz.vut.fit.resolverradar.AnalyzerConfig;
import cz.vut.fit.resolverradar.Common;
import org.jetbrains.annotations.NotNull;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Properties;
import java.util.Set;

/**
 * The immutable configuration of an analysis run. Created once from the loaded {@link Properties}
 * and passed to every component that needs it.
 */
public record AnalyzerSettings(
        @NotNull Duration dnsTimeout,
        int dnssecUdpPayload,
        @NotNull String recursionDomain,
        @NotNull String latencyDomain,
        @NotNull String dnssecDomain,
        @NotNull String maliciousDomain,
        @NotNull String cacheTtlDomain,
        int cacheTtlInitialProbes,
        int cacheTtlFineProbes,
        @NotNull Duration cacheTtlInterval,
        long cacheTtlThreshold,
        boolean tracerouteEnabled,
        int tracerouteMaxHops,
        int tracerouteHopTimeoutSeconds,
        @NotNull Duration tracerouteTimeout,
        @NotNull Duration resolverDelay,
        int progressInterval,
        @NotNull Set<String> excludedAddresses,
        boolean discoveryEnabled,
        boolean utcTimestamps,
        @NotNull String storageType,
        @NotNull String jsonlPath,
        @NotNull String dbUrl,
        @NotNull String dbUser,
        @NotNull String dbPassword,
        @NotNull String rdapBaseUrl,
        @NotNull Duration whoisTimeout,
        double whoisRate,
        int whoisMaxLookupsPerCycle,
        @NotNull List<String> publicIpServices,
        @NotNull Duration publicIpTimeout
) {
    public AnalyzerSettings {
        excludedAddresses = Set.copyOf(excludedAddresses);
        publicIpServices = List.copyOf(publicIpServices);
    }

    /**
     * Creates the settings from the given properties, using the defaults from {@link AnalyzerConfig}
     * for the missing keys.
     *
     * @param properties The loaded properties.
     * @return The settings.
     * @throws NumberFormatException If a numeric property has an invalid value.
     */
    public static AnalyzerSettings fromProperties(@NotNull Properties properties) {
        return new AnalyzerSettings(
                Duration.ofMillis(getLong(properties, AnalyzerConfig.DNS_TIMEOUT_MS_CONFIG,
                        AnalyzerConfig.DNS_TIMEOUT_MS_DEFAULT)),
                getInt(properties, AnalyzerConfig.DNSSEC_UDP_PAYLOAD_CONFIG, AnalyzerConfig.DNSSEC_UDP_PAYLOAD_DEFAULT),
                get(properties, AnalyzerConfig.RECURSION_DOMAIN_CONFIG, AnalyzerConfig.RECURSION_DOMAIN_DEFAULT),
                get(properties, AnalyzerConfig.LATENCY_DOMAIN_CONFIG, AnalyzerConfig.LATENCY_DOMAIN_DEFAULT),
                get(properties, AnalyzerConfig.DNSSEC_DOMAIN_CONFIG, AnalyzerConfig.DNSSEC_DOMAIN_DEFAULT),
                get(properties, AnalyzerConfig.MALICIOUS_DOMAIN_CONFIG, AnalyzerConfig.MALICIOUS_DOMAIN_DEFAULT),
                get(properties, AnalyzerConfig.CACHE_TTL_DOMAIN_CONFIG, AnalyzerConfig.CACHE_TTL_DOMAIN_DEFAULT),
                getInt(properties, AnalyzerConfig.CACHE_TTL_INITIAL_PROBES_CONFIG,
                        AnalyzerConfig.CACHE_TTL_INITIAL_PROBES_DEFAULT),
                getInt(properties, AnalyzerConfig.CACHE_TTL_FINE_PROBES_CONFIG,
                        AnalyzerConfig.CACHE_TTL_FINE_PROBES_DEFAULT),
                Duration.ofMillis(getLong(properties, AnalyzerConfig.CACHE_TTL_INTERVAL_MS_CONFIG,
                        AnalyzerConfig.CACHE_TTL_INTERVAL_MS_DEFAULT)),
                getLong(properties, AnalyzerConfig.CACHE_TTL_THRESHOLD_CONFIG, AnalyzerConfig.CACHE_TTL_THRESHOLD_DEFAULT),
                Boolean.parseBoolean(get(properties, AnalyzerConfig.TRACEROUTE_ENABLED_CONFIG,
                        AnalyzerConfig.TRACEROUTE_ENABLED_DEFAULT)),
                getInt(properties, AnalyzerConfig.TRACEROUTE_MAX_HOPS_CONFIG, AnalyzerConfig.TRACEROUTE_MAX_HOPS_DEFAULT),
                getInt(properties, AnalyzerConfig.TRACEROUTE_HOP_TIMEOUT_S_CONFIG,
                        AnalyzerConfig.TRACEROUTE_HOP_TIMEOUT_S_DEFAULT),
                Duration.ofSeconds(getLong(properties, AnalyzerConfig.TRACEROUTE_TIMEOUT_S_CONFIG,
                        AnalyzerConfig.TRACEROUTE_TIMEOUT_S_DEFAULT)),
                Duration.ofMillis(getLong(properties, AnalyzerConfig.RESOLVER_DELAY_MS_CONFIG,
                        AnalyzerConfig.RESOLVER_DELAY_MS_DEFAULT)),
                Math.max(1, getInt(properties, AnalyzerConfig.PROGRESS_INTERVAL_CONFIG,
                        AnalyzerConfig.PROGRESS_INTERVAL_DEFAULT)),
                Set.copyOf(Common.splitCommaSeparated(properties.getProperty(
                        AnalyzerConfig.EXCLUDED_ADDRESSES_CONFIG, AnalyzerConfig.EXCLUDED_ADDRESSES_DEFAULT))),
                Boolean.parseBoolean(get(properties, AnalyzerConfig.DISCOVERY_ENABLED_CONFIG,
                        AnalyzerConfig.DISCOVERY_ENABLED_DEFAULT)),
                Boolean.parseBoolean(get(properties, AnalyzerConfig.TIMESTAMPS_UTC_CONFIG,
                        AnalyzerConfig.TIMESTAMPS_UTC_DEFAULT)),
                get(properties, AnalyzerConfig.STORAGE_TYPE_CONFIG, AnalyzerConfig.STORAGE_TYPE_DEFAULT),
                get(properties, AnalyzerConfig.JSONL_PATH_CONFIG, AnalyzerConfig.JSONL_PATH_DEFAULT),
                get(properties, AnalyzerConfig.DB_URL_CONFIG, AnalyzerConfig.DB_URL_DEFAULT),
                get(properties, AnalyzerConfig.DB_USER_CONFIG, AnalyzerConfig.DB_USER_DEFAULT),
                properties.getProperty(AnalyzerConfig.DB_PASSWORD_CONFIG, AnalyzerConfig.DB_PASSWORD_DEFAULT),
                get(properties, AnalyzerConfig.WHOIS_RDAP_URL_CONFIG, AnalyzerConfig.WHOIS_RDAP_URL_DEFAULT),
                Duration.ofSeconds(getLong(properties, AnalyzerConfig.WHOIS_TIMEOUT_S_CONFIG,
                        AnalyzerConfig.WHOIS_TIMEOUT_S_DEFAULT)),
                Double.parseDouble(get(properties, AnalyzerConfig.WHOIS_RATE_CONFIG, AnalyzerConfig.WHOIS_RATE_DEFAULT)),
                getInt(properties, AnalyzerConfig.WHOIS_MAX_LOOKUPS_CONFIG, AnalyzerConfig.WHOIS_MAX_LOOKUPS_DEFAULT),
                Common.splitCommaSeparated(properties.getProperty(AnalyzerConfig.PUBLIC_IP_SERVICES_CONFIG,
                        AnalyzerConfig.PUBLIC_IP_SERVICES_DEFAULT)),
                Duration.ofSeconds(getLong(properties, AnalyzerConfig.PUBLIC_IP_TIMEOUT_S_CONFIG,
                        AnalyzerConfig.PUBLIC_IP_TIMEOUT_S_DEFAULT))
        );
    }

    /**
     * Creates the settings using only the default values.
     */
    public static AnalyzerSettings defaults() {
        return fromProperties(new Properties());
    }

    /**
     * Returns the clock used for all the timestamps recorded during the run.
     */
    public @NotNull Clock clock() {
        return utcTimestamps ? Clock.systemUTC() : Clock.systemDefaultZone();
    }

    private static String get(Properties properties, String key, String defaultValue) {
        return properties.getProperty(key, defaultValue).trim();
    }

    private static int getInt(Properties properties, String key, String defaultValue) {
        return Integer.parseInt(get(properties, key, defaultValue));
    }

    private static long getLong(Properties properties, String key, String defaultValue) {
        return Long.parseLong(get(properties, key, defaultValue));
    }
}
