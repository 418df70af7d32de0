package cz.vut.fit.resolverradar.analyzer.discovery;

import org.jetbrains.annotations.NotNull;

import java.util.Set;

/**
 * Detects the resolvers this host is configured to use and the DHCP servers it got its leases from.
 * Together, these are the addresses most likely operated by the network provider of this host.
 * Implementations never fail; they return what they could find.
 */
public interface ResolverDiscovery {
    @NotNull Set<String> systemResolvers();

    @NotNull Set<String> dhcpServers();

    /**
     * A discovery that finds nothing.
     */
    static ResolverDiscovery none() {
        return new ResolverDiscovery() {
            @Override
            public @NotNull Set<String> systemResolvers() {
                return Set.of();
            }

            @Override
            public @NotNull Set<String> dhcpServers() {
                return Set.of();
            }
        };
    }
}
