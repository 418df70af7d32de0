package cz.vut.fit.resolverradar.analyzer.checks;

import cz.vut.fit.resolverradar.analyzer.probe.DnsMessages;
import cz.vut.fit.resolverradar.analyzer.probe.ProbeOutcome;
import org.jetbrains.annotations.NotNull;
import org.xbill.DNS.Rcode;

import java.util.Set;

/**
 * The raw interpretation of the malicious-domain probe, before reliability gating.
 *
 * @param blocks True if the response code is NXDOMAIN, SERVFAIL or REFUSED, or the answer is empty.
 * @param rcode  The response code, or a sentinel.
 */
public record MaliciousCheck(boolean blocks, @NotNull String rcode) {
    private static final Set<Integer> BLOCKING_RCODES = Set.of(Rcode.NXDOMAIN, Rcode.SERVFAIL, Rcode.REFUSED);

    public static MaliciousCheck from(@NotNull ProbeOutcome outcome) {
        if (outcome instanceof ProbeOutcome.Answered answered) {
            final var response = answered.response();
            final var blocks = BLOCKING_RCODES.contains(response.getRcode()) || !DnsMessages.hasAnswer(response);
            return new MaliciousCheck(blocks, outcome.rcode());
        }

        return new MaliciousCheck(false, outcome.rcode());
    }
}
