package cz.vut.fit.resolverradar.analyzer;

import cz.vut.fit.resolverradar.AnalyzerConfig;
import cz.vut.fit.resolverradar.analyzer.discovery.ResolverDiscovery;
import cz.vut.fit.resolverradar.analyzer.host.HostIdentity;
import cz.vut.fit.resolverradar.analyzer.storage.ResultStore;
import cz.vut.fit.resolverradar.analyzer.storage.WhoisStats;
import cz.vut.fit.resolverradar.analyzer.whois.CachedWhoisLookup;
import cz.vut.fit.resolverradar.models.*;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.*;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AnalysisCycleTest {
    private static final WhoisInfo HOST_WHOIS = new WhoisInfo("Example ISP", "64500", "EXAMPLE-AS", "CZ");

    @Mock
    private ResolverAnalyzer _analyzer;
    @Mock
    private CachedWhoisLookup _whois;
    @Mock
    private HostIdentity _host;

    private final List<InMemoryStore> _stores = new ArrayList<>();
    private final RecordingPacer _pacer = new RecordingPacer();
    private Set<String> _systemResolvers = Set.of();
    private Set<String> _dhcpServers = Set.of();
    private boolean _failSaves = false;

    @BeforeEach
    void setUp() throws Exception {
        when(_host.hostname()).thenReturn("probe-host");
        when(_host.publicIp()).thenReturn(Optional.of("203.0.113.7"));
        when(_whois.lookupLive("203.0.113.7")).thenReturn(HOST_WHOIS);
        when(_whois.boundTo(any())).thenReturn(address -> WhoisInfo.notAvailable());
        when(_analyzer.analyze(anyString(), anyBoolean(), anyString(), any(), any()))
                .thenAnswer(invocation -> result(invocation.getArgument(0)));
    }

    private AnalysisCycle cycle(Properties overrides) {
        final var properties = new Properties();
        properties.setProperty(AnalyzerConfig.RESOLVER_DELAY_MS_CONFIG, "250");
        properties.setProperty(AnalyzerConfig.PROGRESS_INTERVAL_CONFIG, "2");
        properties.putAll(overrides);

        final var discovery = new ResolverDiscovery() {
            @Override
            public @NotNull Set<String> systemResolvers() {
                return _systemResolvers;
            }

            @Override
            public @NotNull Set<String> dhcpServers() {
                return _dhcpServers;
            }
        };

        return new AnalysisCycle(_analyzer, () -> {
            final var store = new InMemoryStore(_failSaves);
            _stores.add(store);
            return store;
        }, _whois, discovery, _host, AnalyzerSettings.fromProperties(properties), _pacer,
                StepTicker.ofMicros(1_000));
    }

    private AnalysisCycle cycle() {
        return cycle(new Properties());
    }

    private static ServerResult result(String address) {
        return new ServerResult(address, "probe-host", "203.0.113.7",
                OffsetDateTime.of(2024, 5, 1, 12, 0, 0, 0, ZoneOffset.UTC),
                true, true, 12.5, "N/A", "N/A", "N/A", "N/A", true, true, "NOERROR", true, "NXDOMAIN",
                false, true, TestReliability.RELIABLE, null, null, null, null,
                List.of(new QueryLogEntry(address, "probe-host", "A", "google.com", TestType.LATENCY, "RD",
                        "NOERROR", "0x8180 (RD|RA)", null, 300L, 12.5,
                        OffsetDateTime.of(2024, 5, 1, 12, 0, 0, 0, ZoneOffset.UTC))));
    }

    private List<InMemoryStore> resolverStores() {
        return _stores.stream().filter(store -> !store.results.isEmpty() || store.failedSaves > 0)
                .collect(Collectors.toList());
    }

    @Test
    void everyResolverIsAnalyzedAndStored() throws Exception {
        final var summary = cycle().run(List.of("8.8.8.8", "1.1.1.1", "9.9.9.9"));

        assertEquals(new CycleSummary(3, 3, 0, summary.elapsed()), summary);
        final var stored = resolverStores();
        assertEquals(3, stored.size());
        assertEquals("8.8.8.8", stored.get(0).results.get(0).serverIp());
        assertEquals(1, stored.get(0).queryLogs.size());
        verify(_whois).startCycle();
    }

    @Test
    void eachStoreIsClosed() throws Exception {
        cycle().run(List.of("8.8.8.8", "1.1.1.1"));

        // Measurement host, WHOIS statistics and one per resolver
        assertEquals(4, _stores.size());
        assertTrue(_stores.stream().allMatch(store -> store.closed));
    }

    @Test
    void failureOfOneResolverDoesNotStopTheCycle() throws Exception {
        when(_analyzer.analyze(eq("1.1.1.1"), anyBoolean(), anyString(), any(), any()))
                .thenThrow(new IllegalStateException("Unexpected"));

        final var summary = cycle().run(List.of("8.8.8.8", "1.1.1.1", "9.9.9.9"));

        assertEquals(3, summary.total());
        assertEquals(2, summary.successful());
        assertEquals(1, summary.failed());
        assertTrue(_stores.stream().allMatch(store -> store.closed));
        verify(_analyzer).analyze(eq("9.9.9.9"), anyBoolean(), anyString(), any(), any());
    }

    @Test
    void storageFailureIsCountedAndTheStoreClosed() throws Exception {
        _failSaves = true;

        final var summary = cycle().run(List.of("8.8.8.8", "1.1.1.1"));

        assertEquals(0, summary.successful());
        assertEquals(2, summary.failed());
        assertTrue(_stores.stream().allMatch(store -> store.closed));
    }

    @Test
    void delayIsAppliedBetweenResolversOnly() throws Exception {
        cycle().run(List.of("8.8.8.8", "1.1.1.1", "9.9.9.9"));

        assertEquals(List.of(Duration.ofMillis(250), Duration.ofMillis(250)), _pacer.pauses());
    }

    @Test
    void singleResolverIsNotFollowedByADelay() throws Exception {
        cycle().run(List.of("8.8.8.8"));

        assertTrue(_pacer.pauses().isEmpty());
    }

    @Test
    void interruptEndsTheCycle() throws Exception {
        when(_analyzer.analyze(eq("1.1.1.1"), anyBoolean(), anyString(), any(), any()))
                .thenThrow(new InterruptedException());

        final var cycle = cycle();
        assertThrows(InterruptedException.class, () -> cycle.run(List.of("8.8.8.8", "1.1.1.1", "9.9.9.9")));

        verify(_analyzer, never()).analyze(eq("9.9.9.9"), anyBoolean(), anyString(), any(), any());
        assertTrue(_stores.stream().allMatch(store -> store.closed));
    }

    @Test
    void discoveredAddressesArePrependedAndMarked() throws Exception {
        _systemResolvers = Set.of("192.168.1.1", "8.8.8.8");
        _dhcpServers = Set.of("10.0.0.1");

        final var summary = cycle().run(List.of("8.8.8.8", "1.1.1.1"));

        assertEquals(4, summary.total());
        final var inOrder = inOrder(_analyzer);
        inOrder.verify(_analyzer).analyze(eq("10.0.0.1"), eq(true), anyString(), any(), any());
        inOrder.verify(_analyzer).analyze(eq("192.168.1.1"), eq(true), anyString(), any(), any());
        inOrder.verify(_analyzer).analyze(eq("8.8.8.8"), eq(true), anyString(), any(), any());
        inOrder.verify(_analyzer).analyze(eq("1.1.1.1"), eq(false), anyString(), any(), any());
    }

    @Test
    void excludedAddressesAreSkipped() throws Exception {
        final var overrides = new Properties();
        overrides.setProperty(AnalyzerConfig.EXCLUDED_ADDRESSES_CONFIG, "1.1.1.1");

        final var summary = cycle(overrides).run(List.of("8.8.8.8", "1.1.1.1"));

        assertEquals(1, summary.total());
        verify(_analyzer, never()).analyze(eq("1.1.1.1"), anyBoolean(), anyString(), any(), any());
    }

    @Test
    void measurementHostIsRecorded() throws Exception {
        cycle().run(List.of("8.8.8.8"));

        final var hosts = _stores.stream().flatMap(store -> store.hosts.stream())
                .collect(Collectors.toList());
        assertEquals(List.of(new MeasurementHost("probe-host", "203.0.113.7", HOST_WHOIS)), hosts);
        verify(_analyzer).analyze(eq("8.8.8.8"), eq(false), eq("probe-host"), eq("203.0.113.7"), any());
    }

    @Test
    void unknownPublicAddressSkipsTheMeasurementHost() throws Exception {
        when(_host.publicIp()).thenReturn(Optional.empty());

        cycle().run(List.of("8.8.8.8"));

        assertTrue(_stores.stream().allMatch(store -> store.hosts.isEmpty()));
        verify(_whois, never()).lookupLive(anyString());
        verify(_analyzer).analyze(eq("8.8.8.8"), eq(false), eq("probe-host"), isNull(), any());
    }

    /**
     * A store keeping everything in memory.
     */
    private static class InMemoryStore implements ResultStore {
        final List<QueryLogEntry> queryLogs = new ArrayList<>();
        final List<ServerResult> results = new ArrayList<>();
        final List<MeasurementHost> hosts = new ArrayList<>();
        final boolean failSaves;
        int failedSaves = 0;
        boolean closed = false;

        InMemoryStore(boolean failSaves) {
            this.failSaves = failSaves;
        }

        @Override
        public void logQueries(@NotNull List<QueryLogEntry> entries) {
            queryLogs.addAll(entries);
        }

        @Override
        public void saveServerResult(@NotNull ServerResult result) throws IOException {
            if (failSaves) {
                failedSaves++;
                throw new IOException("Database is gone");
            }
            results.add(result);
        }

        @Override
        public @NotNull Optional<WhoisInfo> findWhois(@NotNull String address) {
            return Optional.empty();
        }

        @Override
        public void saveWhois(@NotNull String address, @NotNull WhoisInfo whois) {
        }

        @Override
        public void upsertMeasurementHost(@NotNull MeasurementHost host) {
            hosts.add(host);
        }

        @Override
        public @NotNull WhoisStats whoisStats() {
            return new WhoisStats(10, 7, 3);
        }

        @Override
        public @NotNull List<String> addressesWithoutWhois(int limit) {
            return List.of();
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
