package cz.vut.fit.resolverradar.analyzer.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import cz.vut.fit.resolverradar.Common;
import cz.vut.fit.resolverradar.models.MeasurementHost;
import cz.vut.fit.resolverradar.models.WhoisInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static cz.vut.fit.resolverradar.analyzer.storage.StorageFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class JsonLinesResultStoreTest {
    private static final ObjectMapper Mapper = Common.makeMapper().build();

    @Test
    void resultsAreAppendedOnePerLine(@TempDir Path directory) throws Exception {
        final var file = directory.resolve("results.jsonl");

        try (var store = new JsonLinesResultStore(file)) {
            store.logQueries(timedOutResult("8.8.8.8").queryLogs());
            store.saveServerResult(timedOutResult("8.8.8.8"));
        }
        try (var store = new JsonLinesResultStore(file)) {
            store.saveServerResult(timedOutResult("1.1.1.1"));
        }

        final var lines = Files.readAllLines(file);
        assertEquals(2, lines.size());

        final var first = Mapper.readTree(lines.get(0));
        assertEquals("8.8.8.8", first.get("server_ip").asText());
        assertEquals("UNRELIABLE_TIMEOUT", first.get("test_reliability").asText());
        assertTrue(first.get("dnssec_enabled").isNull());
        assertTrue(first.get("latency_ms").isNull());
        assertEquals("2024-05-01T12:00:00Z", first.get("timestamp").asText());

        final var logs = first.get("query_logs");
        assertEquals(2, logs.size());
        assertEquals("latency", logs.get(0).get("test_type").asText());
        assertEquals("TIMEOUT", logs.get(1).get("response_rcode").asText());

        assertEquals("1.1.1.1", Mapper.readTree(lines.get(1)).get("server_ip").asText());
    }

    @Test
    void thereIsNoWhoisCache(@TempDir Path directory) throws Exception {
        final var store = new JsonLinesResultStore(directory.resolve("results.jsonl"));
        final var whois = new WhoisInfo("Example ISP", "64500", "EXAMPLE-AS", "CZ");

        store.saveWhois("198.51.100.1", whois);
        store.upsertMeasurementHost(new MeasurementHost("probe-host", "198.51.100.1", whois));

        assertEquals(Optional.empty(), store.findWhois("198.51.100.1"));
        assertEquals(WhoisStats.empty(), store.whoisStats());
        assertEquals(List.of(), store.addressesWithoutWhois(10));
        assertFalse(Files.exists(directory.resolve("results.jsonl")));
    }
}
