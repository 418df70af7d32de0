package cz.vut.fit.resolverradar.analyzer.probe;

import cz.vut.fit.resolverradar.models.ResponseCodes;
import org.jetbrains.annotations.NotNull;
import org.xbill.DNS.Message;

/**
 * The outcome of a single probe query.
 */
public sealed interface ProbeOutcome
        permits ProbeOutcome.Answered, ProbeOutcome.TimedOut, ProbeOutcome.TransportError {

    /**
     * Returns the response code mnemonic, or {@link ResponseCodes#TIMEOUT} / {@link ResponseCodes#ERROR}
     * when no response was received.
     */
    @NotNull String rcode();

    /**
     * A response was received and parsed.
     *
     * @param response The response message.
     * @param rttMs    The round-trip time in milliseconds.
     */
    record Answered(@NotNull Message response, double rttMs) implements ProbeOutcome {
        @Override
        public @NotNull String rcode() {
            return DnsMessages.rcode(response);
        }
    }

    /**
     * No response arrived within the timeout.
     *
     * @param waitedMs The time spent waiting, in milliseconds.
     */
    record TimedOut(double waitedMs) implements ProbeOutcome {
        @Override
        public @NotNull String rcode() {
            return ResponseCodes.TIMEOUT;
        }
    }

    /**
     * The exchange failed without a parsed response (send/receive failure, malformed response).
     *
     * @param message A description of the failure.
     */
    record TransportError(@NotNull String message) implements ProbeOutcome {
        @Override
        public @NotNull String rcode() {
            return ResponseCodes.ERROR;
        }
    }
}
