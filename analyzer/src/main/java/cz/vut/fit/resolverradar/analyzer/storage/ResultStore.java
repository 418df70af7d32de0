package cz.vut.fit.resolverradar.analyzer.storage;

import cz.vut.fit.resolverradar.models.MeasurementHost;
import cz.vut.fit.resolverradar.models.QueryLogEntry;
import cz.vut.fit.resolverradar.models.ServerResult;
import cz.vut.fit.resolverradar.models.WhoisInfo;
import org.jetbrains.annotations.NotNull;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * The persistent storage of the analysis results. An instance is opened for the analysis of a single resolver
 * and closed afterwards. Every operation is atomic.
 */
public interface ResultStore extends Closeable {
    /**
     * Stores a batch of query log entries. Entries that are already stored are ignored.
     */
    void logQueries(@NotNull List<QueryLogEntry> entries) throws IOException;

    /**
     * Stores the result of a resolver analysis, replacing a previous result with the same address and timestamp.
     */
    void saveServerResult(@NotNull ServerResult result) throws IOException;

    @NotNull Optional<WhoisInfo> findWhois(@NotNull String address) throws IOException;

    void saveWhois(@NotNull String address, @NotNull WhoisInfo whois) throws IOException;

    /**
     * Stores the identity of the measuring host, updating the record with the same host name and public address.
     */
    void upsertMeasurementHost(@NotNull MeasurementHost host) throws IOException;

    @NotNull WhoisStats whoisStats() throws IOException;

    /**
     * Returns up to {@code limit} analyzed resolver addresses that have no cached WHOIS data.
     */
    @NotNull List<String> addressesWithoutWhois(int limit) throws IOException;
}
