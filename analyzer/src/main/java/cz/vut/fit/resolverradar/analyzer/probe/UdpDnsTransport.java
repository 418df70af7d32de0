package cz.vut.fit.resolverradar.analyzer.probe;

import com.google.common.net.InetAddresses;
import org.jetbrains.annotations.NotNull;
import org.xbill.DNS.Message;
import org.xbill.DNS.SimpleResolver;

import java.io.IOException;
import java.time.Duration;

/**
 * A {@link DnsTransport} that sends exactly one UDP datagram per query using dnsjava's {@link SimpleResolver}.
 * Truncated responses are accepted as they are, without falling back to TCP.
 */
public class UdpDnsTransport implements DnsTransport {
    @Override
    public @NotNull Message exchange(@NotNull String server, @NotNull Message query, @NotNull Duration timeout)
            throws IOException {
        final SimpleResolver resolver;
        try {
            resolver = new SimpleResolver(InetAddresses.forString(server));
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid resolver address: " + server, e);
        }

        resolver.setTCP(false);
        resolver.setIgnoreTruncation(true);
        resolver.setTimeout(timeout);

        return resolver.send(query);
    }
}
