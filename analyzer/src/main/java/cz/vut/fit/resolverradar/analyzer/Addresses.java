package cz.vut.fit.resolverradar.analyzer;

import com.google.common.net.InetAddresses;
import org.jetbrains.annotations.Nullable;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;

/**
 * Helpers for classifying textual IP addresses.
 */
public final class Addresses {
    private Addresses() {
    }

    /**
     * Checks whether the address belongs to a private range: IPv4 RFC 1918, loopback and link-local
     * addresses, and IPv6 loopback, link-local and unique local ({@code fc00::/7}) addresses.
     *
     * @param address The textual address.
     * @return True if the address is private; false if it is public or cannot be parsed.
     */
    public static boolean isPrivate(@Nullable String address) {
        final var parsed = parse(address);
        if (parsed == null)
            return false;

        if (parsed.isSiteLocalAddress() || parsed.isLoopbackAddress() || parsed.isLinkLocalAddress())
            return true;

        if (parsed instanceof Inet6Address) {
            return (parsed.getAddress()[0] & 0xFE) == 0xFC;
        }

        return false;
    }

    /**
     * Checks whether the string is a valid dotted-quad IPv4 address.
     */
    public static boolean isIPv4(@Nullable String address) {
        return parse(address) instanceof Inet4Address;
    }

    @Nullable
    private static InetAddress parse(@Nullable String address) {
        if (address == null)
            return null;

        try {
            return InetAddresses.forString(address.trim());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
