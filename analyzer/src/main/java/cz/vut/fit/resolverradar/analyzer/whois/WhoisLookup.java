package cz.vut.fit.resolverradar.analyzer.whois;

import cz.vut.fit.resolverradar.models.WhoisInfo;
import org.jetbrains.annotations.NotNull;

/**
 * Provides the registration data of an address. Never fails; missing data is reported using
 * the {@link WhoisInfo} placeholders.
 */
@FunctionalInterface
public interface WhoisLookup {
    @NotNull WhoisInfo lookup(@NotNull String address) throws InterruptedException;
}
