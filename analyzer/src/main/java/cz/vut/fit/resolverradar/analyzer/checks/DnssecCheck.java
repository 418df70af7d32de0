package cz.vut.fit.resolverradar.analyzer.checks;

import cz.vut.fit.resolverradar.analyzer.probe.DnsMessages;
import cz.vut.fit.resolverradar.analyzer.probe.ProbeOutcome;
import org.jetbrains.annotations.NotNull;
import org.xbill.DNS.Flags;
import org.xbill.DNS.Rcode;

/**
 * The raw interpretation of the DNSSEC probe, before reliability gating.
 *
 * @param validates True if the response had the AD flag set and NOERROR.
 * @param adFlagSet True if the response had the AD flag set.
 * @param rcode     The response code, or a sentinel.
 */
public record DnssecCheck(boolean validates, boolean adFlagSet, @NotNull String rcode) {
    public static DnssecCheck from(@NotNull ProbeOutcome outcome) {
        if (outcome instanceof ProbeOutcome.Answered answered) {
            final var response = answered.response();
            final var ad = DnsMessages.hasFlag(response, Flags.AD);
            return new DnssecCheck(ad && response.getRcode() == Rcode.NOERROR, ad, outcome.rcode());
        }

        return new DnssecCheck(false, false, outcome.rcode());
    }
}
