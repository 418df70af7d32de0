package cz.vut.fit.resolverradar.analyzer.checks;

import cz.vut.fit.resolverradar.analyzer.Addresses;
import cz.vut.fit.resolverradar.analyzer.AnalyzerSettings;
import cz.vut.fit.resolverradar.analyzer.Pacer;
import cz.vut.fit.resolverradar.analyzer.probe.DnsMessages;
import cz.vut.fit.resolverradar.analyzer.probe.ProbeEngine;
import cz.vut.fit.resolverradar.analyzer.probe.ProbeOutcome;
import cz.vut.fit.resolverradar.analyzer.probe.ProbeRequest;
import cz.vut.fit.resolverradar.analyzer.probe.QueryLog;
import cz.vut.fit.resolverradar.models.ResponseCodes;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.LoggerFactory;
import org.xbill.DNS.Rcode;

import java.time.Duration;

/**
 * Observes how a caching resolver handles the expiry of a cached entry.
 * <p>
 * The first phase sends a few probes for the test domain, one per pacing interval, and tracks the TTL and
 * response code of the last one. If the last TTL shows that the cached entry is about to expire, a second
 * phase keeps sampling at the same pacing to capture whether the TTL decays to zero and resets, resets
 * early, or never resets. Probes are never retried.
 */
public class CacheTtlProber {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(CacheTtlProber.class);

    private final ProbeEngine _engine;
    private final Pacer _pacer;
    private final ProbeRequest _request;
    private final int _initialProbes;
    private final int _fineProbes;
    private final Duration _interval;
    private final long _threshold;

    public CacheTtlProber(@NotNull ProbeEngine engine, @NotNull AnalyzerSettings settings, @NotNull Pacer pacer) {
        _engine = engine;
        _pacer = pacer;
        _request = ProbeRequest.cacheTtl(settings);
        _initialProbes = settings.cacheTtlInitialProbes();
        _fineProbes = settings.cacheTtlFineProbes();
        _interval = settings.cacheTtlInterval();
        _threshold = settings.cacheTtlThreshold();
    }

    /**
     * Cache TTL sampling only targets resolvers on a private network that this host got from its system
     * configuration or from DHCP.
     *
     * @param address    The resolver address.
     * @param ispRelated True if the address is one of this host's system resolvers or DHCP servers.
     * @return True if the resolver should be sampled.
     */
    public static boolean isApplicable(@NotNull String address, boolean ispRelated) {
        return ispRelated && Addresses.isPrivate(address);
    }

    /**
     * Runs the sampling. Every probe is appended to the query log.
     *
     * @param server The resolver address.
     * @param log    The query log of the resolver.
     * @return The last observation.
     * @throws InterruptedException If interrupted while probing or pacing.
     */
    public @NotNull CacheTtlObservation probe(@NotNull String server, @NotNull QueryLog log)
            throws InterruptedException {
        final var state = new SamplingState();
        runPhase(server, log, _initialProbes, state);

        final var fine = state.lastTtl != null
                && state.lastTtl <= _threshold
                && Rcode.string(Rcode.NOERROR).equals(state.lastRcode);
        if (fine) {
            Logger.debug("{}: cached TTL {} is about to expire, sampling {} more times",
                    server, state.lastTtl, _fineProbes);
            // The second phase starts right after the last first-phase probe.
            runPhase(server, log, _fineProbes, state);
        }

        Logger.debug("{}: cache TTL sampling done after {} probes, last TTL {}, last RCODE {}",
                server, state.sent, state.lastTtl, state.lastRcode);
        return new CacheTtlObservation(state.lastTtl, state.lastRcode, state.sent, fine);
    }

    private void runPhase(String server, QueryLog log, int probes, SamplingState state)
            throws InterruptedException {
        for (var i = 0; i < probes; i++) {
            final var outcome = _engine.probe(server, _request);
            log.record(_request, outcome);
            state.observe(outcome);

            if (i < probes - 1) {
                _pacer.pause(_interval);
            }
        }
    }

    private static class SamplingState {
        @Nullable Long lastTtl = null;
        String lastRcode = ResponseCodes.NOT_AVAILABLE;
        int sent = 0;

        void observe(ProbeOutcome outcome) {
            sent++;
            lastRcode = outcome.rcode();
            lastTtl = outcome instanceof ProbeOutcome.Answered answered
                    ? DnsMessages.firstAnswerTtl(answered.response())
                    : null;
        }
    }
}
