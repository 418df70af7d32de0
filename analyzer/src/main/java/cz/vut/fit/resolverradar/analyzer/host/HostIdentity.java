package cz.vut.fit.resolverradar.analyzer.host;

import org.jetbrains.annotations.NotNull;

import java.util.Optional;

/**
 * The identity of the machine the measurements are taken from.
 */
public interface HostIdentity {
    @NotNull String hostname();

    /**
     * Determines the public address this host is seen under.
     *
     * @return The address, or an empty optional if it cannot be determined.
     */
    @NotNull Optional<String> publicIp() throws InterruptedException;
}
