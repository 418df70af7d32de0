package cz.vut.fit.resolverradar.analyzer.checks;

import cz.vut.fit.resolverradar.analyzer.probe.ProbeOutcome;
import cz.vut.fit.resolverradar.models.ResponseCodes;
import cz.vut.fit.resolverradar.models.TestReliability;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.xbill.DNS.Rcode;

import java.util.Set;

/**
 * Derives the health of a resolver from its latency probe and decides which of the dependent results
 * can be reported.
 */
public final class ReliabilityClassifier {
    public static final String REASON_TIMEOUT = "Server timeout - not responding to queries";
    public static final String REASON_REFUSED = "Server refused queries - access denied or policy restriction";
    public static final String REASON_SERVFAIL = "Server failure - internal server error";
    public static final String REASON_OTHER_PREFIX = "Server not responding properly - RCODE: ";

    // Response codes of the malicious-domain probe that cannot be told apart from a degraded resolver
    private static final Set<String> AMBIGUOUS_MALICIOUS_RCODES = Set.of(
            Rcode.string(Rcode.REFUSED), Rcode.string(Rcode.SERVFAIL), ResponseCodes.TIMEOUT);

    private ReliabilityClassifier() {
    }

    public static @NotNull ReliabilityAssessment classify(@NotNull ProbeOutcome latencyOutcome) {
        if (latencyOutcome instanceof ProbeOutcome.TimedOut) {
            return new ReliabilityAssessment(false, TestReliability.UNRELIABLE_TIMEOUT, REASON_TIMEOUT);
        }

        if (latencyOutcome instanceof ProbeOutcome.Answered answered) {
            switch (answered.response().getRcode()) {
                case Rcode.NOERROR:
                    return new ReliabilityAssessment(true, TestReliability.RELIABLE, null);
                case Rcode.REFUSED:
                    return new ReliabilityAssessment(false, TestReliability.UNRELIABLE_REFUSED, REASON_REFUSED);
                case Rcode.SERVFAIL:
                    return new ReliabilityAssessment(false, TestReliability.UNRELIABLE_SERVER_DOWN, REASON_SERVFAIL);
                default:
                    break;
            }
        }

        return new ReliabilityAssessment(false, TestReliability.UNRELIABLE_SERVER_DOWN,
                REASON_OTHER_PREFIX + latencyOutcome.rcode());
    }

    /**
     * Returns the DNSSEC validation result that can be reported for the resolver.
     *
     * @return The raw result if the resolver is responsive, null otherwise.
     */
    public static @Nullable Boolean gateDnssec(@NotNull ReliabilityAssessment assessment,
                                               @NotNull DnssecCheck dnssec) {
        return assessment.serverResponsive() ? dnssec.validates() : null;
    }

    /**
     * Returns the malicious-domain filtering result that can be reported for the resolver.
     *
     * @return The raw result if the resolver is responsive and the malicious probe's response code is
     * not REFUSED, SERVFAIL or TIMEOUT; null otherwise.
     */
    public static @Nullable Boolean gateMaliciousBlocking(@NotNull ReliabilityAssessment assessment,
                                                          @NotNull MaliciousCheck malicious) {
        if (!assessment.serverResponsive() || AMBIGUOUS_MALICIOUS_RCODES.contains(malicious.rcode()))
            return null;

        return malicious.blocks();
    }
}
