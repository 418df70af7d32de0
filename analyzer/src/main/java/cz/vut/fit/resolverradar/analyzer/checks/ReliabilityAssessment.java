package cz.vut.fit.resolverradar.analyzer.checks;

import cz.vut.fit.resolverradar.models.TestReliability;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The health of a resolver derived from its latency probe.
 *
 * @param serverResponsive True if the latency probe was answered with NOERROR.
 * @param reliability      The reliability class.
 * @param failureReason    A human-readable reason, null if the resolver is reliable.
 */
public record ReliabilityAssessment(boolean serverResponsive,
                                    @NotNull TestReliability reliability,
                                    @Nullable String failureReason) {
}
