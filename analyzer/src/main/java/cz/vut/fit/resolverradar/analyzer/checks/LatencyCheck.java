package cz.vut.fit.resolverradar.analyzer.checks;

import cz.vut.fit.resolverradar.analyzer.probe.ProbeOutcome;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The interpretation of the latency probe. The round-trip time is kept for any parsed response,
 * whatever its response code.
 *
 * @param latencyMs The round-trip time in milliseconds, null if no response was received.
 * @param rcode     The response code, or a sentinel.
 */
public record LatencyCheck(@Nullable Double latencyMs, @NotNull String rcode) {
    public static LatencyCheck from(@NotNull ProbeOutcome outcome) {
        if (outcome instanceof ProbeOutcome.Answered answered) {
            return new LatencyCheck(Math.round(answered.rttMs() * 1000.0) / 1000.0, outcome.rcode());
        }

        return new LatencyCheck(null, outcome.rcode());
    }
}
