package cz.vut.fit.resolverradar.analyzer.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import cz.vut.fit.resolverradar.Common;
import org.jetbrains.annotations.NotNull;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads the resolver addresses to analyze from a JSON file and assembles the list for a cycle.
 * <p>
 * Three shapes of the file are accepted:
 * <ul>
 *     <li>a list of objects with an {@code ip} field: {@code [{"ip": "9.9.9.9"}, ...]};</li>
 *     <li>a list of objects with a {@code servers} array of strings or of objects with an {@code ip} field;</li>
 *     <li>an object with such a {@code servers} array.</li>
 * </ul>
 */
public final class ResolverListLoader {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(ResolverListLoader.class);
    private static final ObjectMapper Mapper = Common.makeMapper().build();

    private ResolverListLoader() {
    }

    /**
     * Reads the resolver addresses from a file.
     *
     * @return The trimmed, de-duplicated addresses in the order of their first occurrence.
     * @throws IOException If the file cannot be read or parsed, or contains no address.
     */
    public static @NotNull List<String> load(@NotNull Path path) throws IOException {
        final var addresses = parse(Mapper.readTree(path.toFile()));
        if (addresses.isEmpty()) {
            throw new IOException("No resolver addresses found in " + path);
        }

        Logger.info("Loaded {} resolver addresses from {}", addresses.size(), path);
        return addresses;
    }

    /**
     * Extracts the resolver addresses from a parsed resolver list.
     */
    public static @NotNull List<String> parse(@NotNull JsonNode root) {
        final var addresses = new LinkedHashSet<String>();
        if (root.isArray()) {
            final var first = root.size() > 0 ? root.get(0) : null;
            final var directList = first != null && first.has("ip");
            for (var item : root) {
                if (directList) {
                    addAddress(addresses, item.get("ip"));
                } else {
                    addServers(addresses, item.get("servers"));
                }
            }
        } else if (root.isObject()) {
            addServers(addresses, root.get("servers"));
        }

        return List.copyOf(addresses);
    }

    private static void addServers(Set<String> addresses, JsonNode servers) {
        if (servers == null || !servers.isArray())
            return;

        for (var server : servers) {
            addAddress(addresses, server.isObject() ? server.get("ip") : server);
        }
    }

    private static void addAddress(Set<String> addresses, JsonNode value) {
        if (value == null || !value.isTextual())
            return;

        final var address = value.asText().trim();
        if (!address.isEmpty()) {
            addresses.add(address);
        }
    }

    /**
     * Assembles the resolvers to analyze in a cycle. The DHCP servers and the system resolvers that are not
     * in the loaded list are put in front of it, and the excluded addresses are removed.
     *
     * @param loaded          The addresses from the resolver list file.
     * @param systemResolvers The discovered system resolvers.
     * @param dhcpServers     The discovered DHCP servers.
     * @param excluded        The addresses that must not be probed.
     * @return The ordered, de-duplicated addresses.
     */
    public static @NotNull List<String> assemble(@NotNull List<String> loaded,
                                                 @NotNull Set<String> systemResolvers,
                                                 @NotNull Set<String> dhcpServers,
                                                 @NotNull Set<String> excluded) {
        final var loadedSet = new HashSet<>(loaded);
        final var result = new LinkedHashSet<String>();

        new TreeSet<>(dhcpServers).stream()
                .filter(address -> !loadedSet.contains(address))
                .forEach(result::add);
        new TreeSet<>(systemResolvers).stream()
                .filter(address -> !loadedSet.contains(address))
                .forEach(result::add);
        result.addAll(loaded);
        result.removeAll(excluded);

        return List.copyOf(result);
    }
}
