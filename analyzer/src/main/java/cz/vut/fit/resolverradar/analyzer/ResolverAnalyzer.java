package cz.vut.fit.resolverradar.analyzer;

import cz.vut.fit.resolverradar.analyzer.checks.*;
import cz.vut.fit.resolverradar.analyzer.probe.ProbeEngine;
import cz.vut.fit.resolverradar.analyzer.probe.ProbeRequest;
import cz.vut.fit.resolverradar.analyzer.probe.QueryLog;
import cz.vut.fit.resolverradar.analyzer.whois.WhoisLookup;
import cz.vut.fit.resolverradar.models.ResponseCodes;
import cz.vut.fit.resolverradar.models.ServerResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Runs the complete probe pipeline against one resolver and folds the outcomes into a {@link ServerResult}.
 * <p>
 * The probes run sequentially: recursion, latency, DNSSEC, malicious domain, traceroute and, for private
 * resolvers related to this host's network provider, cache TTL sampling. The latency probe decides whether
 * the resolver is healthy enough for the DNSSEC and malicious-domain results to be reported.
 */
public class ResolverAnalyzer {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(ResolverAnalyzer.class);

    private final ProbeEngine _engine;
    private final CacheTtlProber _cacheTtlProber;
    private final @Nullable TracerouteProbe _traceroute;
    private final AnalyzerSettings _settings;
    private final Clock _clock;

    /**
     * @param engine         The engine to send the probes with.
     * @param cacheTtlProber The cache TTL sampler.
     * @param traceroute     The traceroute probe, null to skip traceroute.
     * @param settings       The analysis settings.
     * @param clock          The clock for the timestamps.
     */
    public ResolverAnalyzer(@NotNull ProbeEngine engine, @NotNull CacheTtlProber cacheTtlProber,
                            @Nullable TracerouteProbe traceroute, @NotNull AnalyzerSettings settings,
                            @NotNull Clock clock) {
        _engine = engine;
        _cacheTtlProber = cacheTtlProber;
        _traceroute = traceroute;
        _settings = settings;
        _clock = clock;
    }

    /**
     * Analyzes one resolver.
     *
     * @param address     The resolver address.
     * @param ispAssigned True if the resolver is one of this host's system resolvers or DHCP servers.
     * @param hostname    The host name of the measuring machine.
     * @param publicIp    The public address of the measuring machine, null if unknown.
     * @param whois       The source of the resolver's registration data.
     * @return The result, including the log of every exchange made.
     * @throws InterruptedException If interrupted while probing.
     */
    public @NotNull ServerResult analyze(@NotNull String address, boolean ispAssigned, @NotNull String hostname,
                                         @Nullable String publicIp, @NotNull WhoisLookup whois)
            throws InterruptedException {
        Logger.debug("Analyzing {}", address);
        final var log = new QueryLog(address, hostname, _clock);

        final var recursionRequest = ProbeRequest.recursion(_settings);
        final var recursionOutcome = _engine.probe(address, recursionRequest);
        log.record(recursionRequest, recursionOutcome);
        final var recursion = RecursionCheck.from(recursionOutcome);

        final var latencyRequest = ProbeRequest.latency(_settings);
        final var latencyOutcome = _engine.probe(address, latencyRequest);
        log.record(latencyRequest, latencyOutcome);
        final var latency = LatencyCheck.from(latencyOutcome);

        final var reliability = ReliabilityClassifier.classify(latencyOutcome);
        if (!reliability.serverResponsive()) {
            Logger.warn("{}: {}", address, reliability.failureReason());
        }

        final var whoisInfo = whois.lookup(address);

        final var dnssecRequest = ProbeRequest.dnssec(_settings);
        final var dnssecOutcome = _engine.probe(address, dnssecRequest);
        log.record(dnssecRequest, dnssecOutcome);
        final var dnssec = DnssecCheck.from(dnssecOutcome);

        final var maliciousRequest = ProbeRequest.malicious(_settings);
        final var maliciousOutcome = _engine.probe(address, maliciousRequest);
        log.record(maliciousRequest, maliciousOutcome);
        final var malicious = MaliciousCheck.from(maliciousOutcome);

        String tracerouteStatus = null;
        if (_traceroute != null) {
            final var trace = _traceroute.trace(address);
            log.recordTraceroute(trace.status(), trace.output(), trace.elapsedMs());
            tracerouteStatus = trace.status();
        }

        Long cacheTtl = null;
        String cacheTtlRcode = null;
        if (CacheTtlProber.isApplicable(address, ispAssigned)) {
            final var observation = _cacheTtlProber.probe(address, log);
            cacheTtl = observation.lastTtl();
            cacheTtlRcode = observation.lastRcode();
        } else {
            Logger.trace("{}: cache TTL sampling skipped", address);
        }

        final var dnssecEnabled = ReliabilityClassifier.gateDnssec(reliability, dnssec);
        final var maliciousBlocking = ReliabilityClassifier.gateMaliciousBlocking(reliability, malicious);

        Logger.info("{}: recursive={}, latency_ms={}, dnssec={}, blocks_malicious={}, traceroute={}, " +
                        "cache_ttl={}, org={}, country={}, reliability={}",
                address, recursion.isRecursive(),
                latency.latencyMs() == null ? ResponseCodes.NOT_AVAILABLE : latency.latencyMs(),
                dnssecEnabled, maliciousBlocking, tracerouteStatus,
                cacheTtl == null ? ResponseCodes.NOT_AVAILABLE : cacheTtl,
                whoisInfo.organization(), whoisInfo.country(), reliability.reliability());

        return new ServerResult(address, hostname, publicIp, OffsetDateTime.now(_clock),
                recursion.isRecursive(), recursion.raFlagSet(), latency.latencyMs(),
                whoisInfo.organization(), whoisInfo.asn(), whoisInfo.asnDescription(), whoisInfo.country(),
                dnssecEnabled, dnssec.adFlagSet(), dnssec.rcode(),
                maliciousBlocking, malicious.rcode(),
                ispAssigned, reliability.serverResponsive(), reliability.reliability(), reliability.failureReason(),
                tracerouteStatus, cacheTtl, cacheTtlRcode, log.entries());
    }
}
