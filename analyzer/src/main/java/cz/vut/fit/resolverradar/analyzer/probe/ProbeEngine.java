package cz.vut.fit.resolverradar.analyzer.probe;

import com.google.common.base.Ticker;
import cz.vut.fit.resolverradar.analyzer.AnalyzerSettings;
import org.jetbrains.annotations.NotNull;
import org.slf4j.LoggerFactory;
import org.xbill.DNS.Message;
import org.xbill.DNS.TextParseException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Issues single probe queries and converts every way an exchange can end into a {@link ProbeOutcome}.
 * A probe is never retried.
 */
public class ProbeEngine {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(ProbeEngine.class);

    private final DnsTransport _transport;
    private final Duration _timeout;
    private final int _udpPayloadSize;
    private final Ticker _ticker;

    public ProbeEngine(@NotNull DnsTransport transport, @NotNull AnalyzerSettings settings) {
        this(transport, settings, Ticker.systemTicker());
    }

    public ProbeEngine(@NotNull DnsTransport transport, @NotNull AnalyzerSettings settings, @NotNull Ticker ticker) {
        _transport = transport;
        _timeout = settings.dnsTimeout();
        _udpPayloadSize = settings.dnssecUdpPayload();
        _ticker = ticker;
    }

    /**
     * Sends the probe query to the resolver and waits for the response.
     *
     * @param server  The resolver address.
     * @param request The probe to send.
     * @return The outcome of the exchange.
     * @throws InterruptedException If the calling thread was interrupted while waiting.
     */
    public @NotNull ProbeOutcome probe(@NotNull String server, @NotNull ProbeRequest request)
            throws InterruptedException {
        final Message query;
        try {
            query = request.toQuery(_udpPayloadSize);
        } catch (TextParseException e) {
            Logger.warn("Invalid probe name {}: {}", request.queryName(), e.getMessage());
            return new ProbeOutcome.TransportError("Invalid query name: " + e.getMessage());
        }

        final long start = _ticker.read();
        try {
            final var response = _transport.exchange(server, query, _timeout);
            final var rtt = millisSince(start);
            Logger.trace("{} {} {} answered in {} ms", server, request.testType(), request.queryName(), rtt);
            return new ProbeOutcome.Answered(response, rtt);
        } catch (IOException | RuntimeException e) {
            // A timed-out socket read is reported as an InterruptedIOException, so the interrupt is checked first
            if (Thread.interrupted()) {
                throw new InterruptedException("Interrupted while probing " + server);
            }

            if (isTimeout(e)) {
                Logger.debug("{} {} {} timed out", server, request.testType(), request.queryName());
                return new ProbeOutcome.TimedOut((double) _timeout.toMillis());
            }

            Logger.debug("{} {} {} failed: {}", server, request.testType(), request.queryName(), e.toString());
            return new ProbeOutcome.TransportError(e.getMessage() == null
                    ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    private double millisSince(long startNanos) {
        final var micros = (_ticker.read() - startNanos) / 1_000L;
        return micros / 1000.0;
    }

    private static boolean isTimeout(Throwable e) {
        for (var cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof SocketTimeoutException || cause instanceof TimeoutException)
                return true;
        }
        return false;
    }
}
