package cz.vut.fit.resolverradar.analyzer.whois;

import com.google.common.net.InetAddresses;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.xbill.DNS.*;
import org.xbill.DNS.lookup.LookupSession;
import org.xbill.DNS.lookup.NoSuchDomainException;
import org.xbill.DNS.lookup.NoSuchRRSetException;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Maps addresses to their origin autonomous systems using the Team Cymru IP-to-ASN DNS service.
 */
public class CymruAsnResolver {
    private static final String ORIGIN_V4_SUFFIX = "origin.asn.cymru.com";
    private static final String ORIGIN_V6_SUFFIX = "origin6.asn.cymru.com";
    private static final String AS_SUFFIX = "asn.cymru.com";

    /**
     * The origin of an address.
     *
     * @param asn         The AS number, as a string.
     * @param country     The country code of the allocation.
     * @param description The AS name, null if unknown.
     */
    public record AsnInfo(@NotNull String asn, @NotNull String country, @Nullable String description) {
    }

    private final LookupSession _session;
    private final Duration _timeout;

    public CymruAsnResolver(@NotNull Duration timeout) {
        final var resolver = new ExtendedResolver();
        resolver.setTimeout(timeout);
        _session = LookupSession.builder().resolver(resolver).build();
        _timeout = timeout;
    }

    /**
     * Looks up the origin AS of the address and its name.
     *
     * @return The origin, or an empty optional if the address is not announced.
     * @throws IOException If a lookup failed.
     */
    public @NotNull Optional<AsnInfo> lookup(@NotNull String address) throws IOException, InterruptedException {
        final var originText = queryText(originName(address));
        if (originText == null)
            return Optional.empty();

        final var origin = parseOrigin(originText);
        if (origin == null)
            return Optional.empty();

        final var asText = queryText("AS" + origin.asn() + "." + AS_SUFFIX);
        return Optional.of(new AsnInfo(origin.asn(), origin.country(),
                asText == null ? null : parseAsDescription(asText)));
    }

    /**
     * Returns the origin query name of an address, e.g. {@code 8.8.8.8.origin.asn.cymru.com}
     * for {@code 8.8.8.8}.
     *
     * @throws IllegalArgumentException If the address is not a valid IP address.
     */
    public static @NotNull String originName(@NotNull String address) {
        final var reverse = ReverseMap.fromAddress(InetAddresses.forString(address)).toString(true);
        if (reverse.endsWith(".in-addr.arpa"))
            return reverse.substring(0, reverse.length() - "in-addr.arpa".length()) + ORIGIN_V4_SUFFIX;

        return reverse.substring(0, reverse.length() - "ip6.arpa".length()) + ORIGIN_V6_SUFFIX;
    }

    /**
     * Parses an origin record, e.g. {@code 15169 | 8.8.8.0/24 | US | arin | 2014-03-14}.
     * If the prefix is announced by several AS, the first one is used.
     *
     * @return The AS number and the country, without a description; null if the record is malformed.
     */
    public static @Nullable AsnInfo parseOrigin(@NotNull String text) {
        final var fields = text.split("\\|");
        if (fields.length < 3)
            return null;

        final var asn = fields[0].trim().split("\\s+")[0];
        if (asn.isEmpty())
            return null;

        return new AsnInfo(asn, fields[2].trim(), null);
    }

    /**
     * Parses an AS description record, e.g. {@code 15169 | US | arin | 2000-03-30 | GOOGLE - Google LLC, US}.
     *
     * @return The AS name, null if the record is malformed.
     */
    public static @Nullable String parseAsDescription(@NotNull String text) {
        final var fields = text.split("\\|", 5);
        if (fields.length < 5)
            return null;

        final var description = fields[4].trim();
        return description.isEmpty() ? null : description;
    }

    private @Nullable String queryText(String name) throws IOException, InterruptedException {
        try {
            final var result = _session.lookupAsync(Name.fromString(name, Name.root), Type.TXT)
                    .toCompletableFuture()
                    .get(_timeout.toMillis(), TimeUnit.MILLISECONDS);

            return result.getRecords().stream()
                    .filter(record -> record.getType() == Type.TXT)
                    .map(record -> String.join("", ((TXTRecord) record).getStrings()))
                    .findFirst()
                    .orElse(null);
        } catch (ExecutionException e) {
            final var cause = e.getCause();
            if (cause instanceof NoSuchDomainException || cause instanceof NoSuchRRSetException)
                return null;

            throw new IOException("TXT lookup of " + name + " failed", cause);
        } catch (TimeoutException e) {
            throw new IOException("TXT lookup of " + name + " timed out", e);
        }
    }
}
