package cz.vut.fit.resolverradar.analyzer.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import cz.vut.fit.resolverradar.Common;
import cz.vut.fit.resolverradar.models.MeasurementHost;
import cz.vut.fit.resolverradar.models.QueryLogEntry;
import cz.vut.fit.resolverradar.models.ServerResult;
import cz.vut.fit.resolverradar.models.WhoisInfo;
import org.jetbrains.annotations.NotNull;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Optional;

/**
 * A file-based {@link ResultStore} for runs without a database. Each analysis result is appended to the file
 * as one JSON object per line, with its query log embedded. There is no WHOIS cache.
 */
public class JsonLinesResultStore implements ResultStore {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(JsonLinesResultStore.class);
    private static final ObjectMapper Mapper = Common.makeMapper().build();

    private final Path _path;

    public JsonLinesResultStore(@NotNull Path path) {
        _path = path;
    }

    @Override
    public void logQueries(@NotNull List<QueryLogEntry> entries) {
        // The entries are written as a part of the server result
    }

    @Override
    public void saveServerResult(@NotNull ServerResult result) throws IOException {
        final var line = Mapper.writeValueAsString(result) + System.lineSeparator();
        Files.writeString(_path, line, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        Logger.trace("Appended the result of {} to {}", result.serverIp(), _path);
    }

    @Override
    public @NotNull Optional<WhoisInfo> findWhois(@NotNull String address) {
        return Optional.empty();
    }

    @Override
    public void saveWhois(@NotNull String address, @NotNull WhoisInfo whois) {
        Logger.trace("No WHOIS cache, dropping the data of {}", address);
    }

    @Override
    public void upsertMeasurementHost(@NotNull MeasurementHost host) {
        Logger.info("Measuring from {} ({}), {} / AS{} / {}", host.systemHostname(), host.publicIp(),
                host.whois().organization(), host.whois().asn(), host.whois().country());
    }

    @Override
    public @NotNull WhoisStats whoisStats() {
        return WhoisStats.empty();
    }

    @Override
    public @NotNull List<String> addressesWithoutWhois(int limit) {
        return List.of();
    }

    @Override
    public void close() {
        // Nothing is held open between writes
    }
}
