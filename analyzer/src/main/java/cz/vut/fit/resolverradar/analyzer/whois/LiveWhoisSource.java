package cz.vut.fit.resolverradar.analyzer.whois;

import cz.vut.fit.resolverradar.models.WhoisInfo;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;

/**
 * Retrieves the registration data of an address from a remote registry.
 */
@FunctionalInterface
public interface LiveWhoisSource {
    /**
     * @param address The address to look up.
     * @return The registration data. Fields the registry did not provide are {@code N/A}.
     * @throws IOException If the lookup failed.
     */
    @NotNull WhoisInfo fetch(@NotNull String address) throws IOException, InterruptedException;
}
