package cz.vut.fit.resolverradar.analyzer.whois;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import cz.vut.fit.resolverradar.Common;
import cz.vut.fit.resolverradar.analyzer.AnalyzerSettings;
import cz.vut.fit.resolverradar.models.ResponseCodes;
import cz.vut.fit.resolverradar.models.WhoisInfo;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Looks up the registration data of an address using RDAP for the network holder and Team Cymru for
 * the origin autonomous system.
 */
public class RdapWhoisClient implements LiveWhoisSource {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(RdapWhoisClient.class);

    /**
     * The parts of an RDAP IP network object that are used.
     *
     * @param name    The network name, null if missing.
     * @param country The country code of the network, null if missing.
     */
    public record RdapNetwork(@Nullable String name, @Nullable String country) {
    }

    private final HttpClient _client;
    private final ObjectMapper _mapper;
    private final String _baseUrl;
    private final Duration _timeout;
    private final CymruAsnResolver _asnResolver;

    public RdapWhoisClient(@NotNull AnalyzerSettings settings) {
        this(settings.rdapBaseUrl(), settings.whoisTimeout(), new CymruAsnResolver(settings.whoisTimeout()));
    }

    public RdapWhoisClient(@NotNull String baseUrl, @NotNull Duration timeout, @NotNull CymruAsnResolver asnResolver) {
        _baseUrl = baseUrl;
        _timeout = timeout;
        _asnResolver = asnResolver;
        _mapper = Common.makeMapper().build();

        // rdap.org answers with a redirect to the responsible registry
        _client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(_timeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    @Override
    public @NotNull WhoisInfo fetch(@NotNull String address) throws IOException, InterruptedException {
        final var network = fetchNetwork(address);
        final var asn = _asnResolver.lookup(address);

        final var organization = network.name() != null
                ? network.name()
                : asn.map(CymruAsnResolver.AsnInfo::description).orElse(null);
        final var country = asn.map(CymruAsnResolver.AsnInfo::country)
                .filter(c -> !c.isEmpty())
                .orElse(network.country());

        Logger.debug("WHOIS {}: org={}, asn={}, country={}", address, organization,
                asn.map(CymruAsnResolver.AsnInfo::asn).orElse(ResponseCodes.NOT_AVAILABLE), country);
        return new WhoisInfo(organization,
                asn.map(CymruAsnResolver.AsnInfo::asn).orElse(null),
                asn.map(CymruAsnResolver.AsnInfo::description).orElse(null),
                country);
    }

    private RdapNetwork fetchNetwork(String address) throws IOException, InterruptedException {
        final var request = HttpRequest.newBuilder()
                .uri(URI.create(_baseUrl + address))
                .timeout(_timeout)
                .header("Accept", "application/rdap+json, application/json")
                .GET()
                .build();

        final var response = _client.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new IOException("RDAP lookup of " + address + " failed: HTTP " + response.statusCode());
        }

        return parseNetwork(_mapper.readTree(response.body()));
    }

    /**
     * Extracts the network name and the country from an RDAP IP network object.
     */
    public static @NotNull RdapNetwork parseNetwork(@NotNull JsonNode root) {
        return new RdapNetwork(textOrNull(root.get("name")), textOrNull(root.get("country")));
    }

    private static @Nullable String textOrNull(@Nullable JsonNode node) {
        if (node == null || !node.isTextual())
            return null;

        final var text = node.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
