package cz.vut.fit.resolverradar.analyzer.probe;

import org.jetbrains.annotations.NotNull;
import org.xbill.DNS.Message;

import java.io.IOException;
import java.time.Duration;

/**
 * Sends a single DNS query to a resolver and waits for its response.
 */
@FunctionalInterface
public interface DnsTransport {
    /**
     * Sends the query and waits for the response.
     *
     * @param server  The resolver address.
     * @param query   The query message.
     * @param timeout The time to wait for the response.
     * @return The parsed response.
     * @throws java.net.SocketTimeoutException If no response arrives in time.
     * @throws IOException                     If the exchange fails in any other way.
     */
    @NotNull Message exchange(@NotNull String server, @NotNull Message query, @NotNull Duration timeout)
            throws IOException;
}
