package cz.vut.fit.resolverradar.analyzer.checks;

import cz.vut.fit.resolverradar.analyzer.probe.DnsMessages;
import cz.vut.fit.resolverradar.analyzer.probe.ProbeOutcome;
import org.jetbrains.annotations.NotNull;
import org.xbill.DNS.Flags;
import org.xbill.DNS.Rcode;

/**
 * The interpretation of the recursion probe.
 *
 * @param isRecursive True if the resolver set RA, returned a non-empty answer and NOERROR.
 * @param raFlagSet   True if the response had the RA flag set.
 * @param rcode       The response code, or a sentinel.
 */
public record RecursionCheck(boolean isRecursive, boolean raFlagSet, @NotNull String rcode) {
    public static RecursionCheck from(@NotNull ProbeOutcome outcome) {
        if (outcome instanceof ProbeOutcome.Answered answered) {
            final var response = answered.response();
            final var ra = DnsMessages.hasFlag(response, Flags.RA);
            final var recursive = ra
                    && DnsMessages.hasAnswer(response)
                    && response.getRcode() == Rcode.NOERROR;
            return new RecursionCheck(recursive, ra, outcome.rcode());
        }

        return new RecursionCheck(false, false, outcome.rcode());
    }
}
