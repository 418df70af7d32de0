package cz.vut.fit.resolverradar.analyzer.host;

import com.google.common.net.InetAddresses;
import cz.vut.fit.resolverradar.analyzer.AnalyzerSettings;
import org.jetbrains.annotations.NotNull;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Reads the host name from the OS and asks public HTTP echo services for the public address.
 * The services are tried in order until one returns a valid address.
 */
public class SystemHostIdentity implements HostIdentity {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(SystemHostIdentity.class);
    public static final String UNKNOWN_HOSTNAME = "unknown";

    private final List<String> _services;
    private final Duration _timeout;
    private final HttpClient _client;

    public SystemHostIdentity(@NotNull AnalyzerSettings settings) {
        _services = settings.publicIpServices();
        _timeout = settings.publicIpTimeout();
        _client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(_timeout)
                .build();
    }

    @Override
    public @NotNull String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            Logger.warn("Cannot determine the host name: {}", e.getMessage());
            return UNKNOWN_HOSTNAME;
        }
    }

    @Override
    public @NotNull Optional<String> publicIp() throws InterruptedException {
        for (var service : _services) {
            try {
                final var request = HttpRequest.newBuilder()
                        .uri(URI.create(service))
                        .timeout(_timeout)
                        .GET()
                        .build();
                final var response = _client.send(request, HttpResponse.BodyHandlers.ofString());
                if (response.statusCode() != 200) {
                    Logger.debug("{} returned HTTP {}", service, response.statusCode());
                    continue;
                }

                final var address = response.body().trim();
                if (InetAddresses.isInetAddress(address))
                    return Optional.of(address);

                Logger.debug("{} returned an invalid address", service);
            } catch (IOException | IllegalArgumentException e) {
                Logger.debug("Public address lookup using {} failed: {}", service, e.getMessage());
            }
        }

        Logger.warn("Cannot determine the public address of this host");
        return Optional.empty();
    }
}
