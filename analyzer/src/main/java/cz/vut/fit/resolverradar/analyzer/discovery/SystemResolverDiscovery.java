package cz.vut.fit.resolverradar.analyzer.discovery;

import cz.vut.fit.resolverradar.analyzer.Addresses;
import org.jetbrains.annotations.NotNull;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Detects the system resolvers and DHCP servers from the OS configuration.
 * <ul>
 *     <li>Linux: {@code /etc/resolv.conf}; dhclient, dhcpcd and systemd-networkd lease files.</li>
 *     <li>Windows: the output of {@code ipconfig /all}.</li>
 *     <li>macOS: the output of {@code scutil --dns}; DHCP servers are not detected.</li>
 * </ul>
 * Only IPv4 addresses are reported.
 */
public class SystemResolverDiscovery implements ResolverDiscovery {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(SystemResolverDiscovery.class);

    /**
     * Runs an external command and returns its standard output.
     */
    @FunctionalInterface
    public interface CommandRunner {
        @NotNull String run(@NotNull List<String> command) throws IOException, InterruptedException;
    }

    public enum Platform {
        LINUX, WINDOWS, MACOS, OTHER;

        public static Platform current() {
            final var os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
            if (os.startsWith("windows"))
                return WINDOWS;
            if (os.startsWith("mac"))
                return MACOS;
            if (os.startsWith("linux"))
                return LINUX;
            return OTHER;
        }
    }

    private final Path _root;
    private final Platform _platform;
    private final CommandRunner _commandRunner;

    public SystemResolverDiscovery() {
        this(Path.of("/"), Platform.current(), SystemResolverDiscovery::runCommand);
    }

    /**
     * @param root          The file system root the OS configuration files are read relative to.
     * @param platform      The OS to detect the configuration of.
     * @param commandRunner The runner for the OS utilities.
     */
    public SystemResolverDiscovery(@NotNull Path root, @NotNull Platform platform,
                                   @NotNull CommandRunner commandRunner) {
        _root = root;
        _platform = platform;
        _commandRunner = commandRunner;
    }

    @Override
    public @NotNull Set<String> systemResolvers() {
        final Set<String> found;
        switch (_platform) {
            case LINUX:
                found = readLinuxResolvers();
                break;
            case WINDOWS:
                found = parseIpconfigDnsServers(command(List.of("ipconfig", "/all")));
                break;
            case MACOS:
                found = parseScutilNameservers(command(List.of("scutil", "--dns")));
                break;
            default:
                found = Set.of();
        }

        Logger.debug("System resolvers: {}", found);
        return found;
    }

    @Override
    public @NotNull Set<String> dhcpServers() {
        final Set<String> found;
        switch (_platform) {
            case LINUX:
                found = readLinuxDhcpServers();
                break;
            case WINDOWS:
                found = parseIpconfigDhcpServers(command(List.of("ipconfig", "/all")));
                break;
            default:
                found = Set.of();
        }

        Logger.debug("DHCP servers: {}", found);
        return found;
    }

    private Set<String> readLinuxResolvers() {
        final var resolvConf = _root.resolve("etc/resolv.conf");
        if (!Files.isRegularFile(resolvConf))
            return Set.of();

        try {
            return parseResolvConf(Files.readAllLines(resolvConf));
        } catch (IOException e) {
            Logger.warn("Cannot read {}: {}", resolvConf, e.getMessage());
            return Set.of();
        }
    }

    private Set<String> readLinuxDhcpServers() {
        final var servers = new TreeSet<String>();

        final var leaseFiles = new ArrayList<Path>();
        leaseFiles.addAll(list(_root.resolve("var/lib/dhcp"), "dhclient*.leases"));
        leaseFiles.addAll(list(_root.resolve("var/lib/dhcp3"), "dhclient*.leases"));
        leaseFiles.addAll(list(_root.resolve("var/lib/dhcpcd"), "*.lease"));
        for (var leaseFile : leaseFiles) {
            try {
                parseDhclientLease(Files.readAllLines(leaseFile)).ifPresent(servers::add);
            } catch (IOException e) {
                Logger.debug("Cannot read lease file {}: {}", leaseFile, e.getMessage());
            }
        }

        for (var leaseFile : list(_root.resolve("run/systemd/netif/leases"), "*")) {
            try {
                parseNetworkdLease(Files.readAllLines(leaseFile)).ifPresent(servers::add);
            } catch (IOException e) {
                Logger.debug("Cannot read lease file {}: {}", leaseFile, e.getMessage());
            }
        }

        return servers;
    }

    private static List<Path> list(Path directory, String glob) {
        if (!Files.isDirectory(directory))
            return List.of();

        final var files = new ArrayList<Path>();
        try (var stream = Files.newDirectoryStream(directory, glob)) {
            for (var path : stream) {
                if (Files.isRegularFile(path))
                    files.add(path);
            }
        } catch (IOException e) {
            Logger.debug("Cannot list {}: {}", directory, e.getMessage());
        }

        Collections.sort(files);
        return files;
    }

    private String command(List<String> command) {
        try {
            return _commandRunner.run(command);
        } catch (IOException e) {
            Logger.warn("Cannot run {}: {}", command.get(0), e.getMessage());
            return "";
        } catch (InterruptedException e) {
            // Keep the interrupt for the caller's next blocking operation
            Thread.currentThread().interrupt();
            return "";
        }
    }

    private static String runCommand(List<String> command) throws IOException, InterruptedException {
        final var process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .start();

        final String output;
        try (InputStream stdout = process.getInputStream()) {
            output = new String(stdout.readAllBytes(), Charset.defaultCharset());
        }

        process.waitFor();
        return output;
    }

    /**
     * Extracts the {@code nameserver} entries from a {@code resolv.conf} file.
     */
    public static @NotNull Set<String> parseResolvConf(@NotNull List<String> lines) {
        final var servers = new TreeSet<String>();
        for (var line : lines) {
            final var parts = line.trim().split("\\s+");
            if (parts.length == 2 && parts[0].equals("nameserver") && Addresses.isIPv4(parts[1])) {
                servers.add(parts[1]);
            }
        }
        return servers;
    }

    /**
     * Extracts the DNS server addresses from the output of {@code ipconfig /all}, including the additional
     * servers listed on the continuation lines that follow the {@code DNS Servers} line.
     */
    public static @NotNull Set<String> parseIpconfigDnsServers(@NotNull String output) {
        final var servers = new TreeSet<String>();
        var inDnsServers = false;
        for (var rawLine : output.split("\\R")) {
            final var line = rawLine.trim();
            if (line.contains("DNS Servers") || line.contains("DNS-Server")) {
                final var colon = line.indexOf(':');
                inDnsServers = true;
                if (colon >= 0) {
                    final var address = line.substring(colon + 1).trim();
                    if (Addresses.isIPv4(address))
                        servers.add(address);
                }
            } else if (inDnsServers && Addresses.isIPv4(line)) {
                servers.add(line);
            } else {
                inDnsServers = false;
            }
        }
        return servers;
    }

    /**
     * Extracts the {@code DHCP Server} addresses from the output of {@code ipconfig /all}.
     */
    public static @NotNull Set<String> parseIpconfigDhcpServers(@NotNull String output) {
        final var servers = new TreeSet<String>();
        for (var rawLine : output.split("\\R")) {
            final var line = rawLine.trim();
            if (line.startsWith("DHCP Server") || line.startsWith("DHCP-Server")) {
                final var colon = line.indexOf(':');
                if (colon >= 0) {
                    final var address = line.substring(colon + 1).trim();
                    if (Addresses.isIPv4(address))
                        servers.add(address);
                }
            }
        }
        return servers;
    }

    /**
     * Extracts the {@code nameserver[n] : address} entries from the output of {@code scutil --dns}.
     */
    public static @NotNull Set<String> parseScutilNameservers(@NotNull String output) {
        final var servers = new TreeSet<String>();
        for (var rawLine : output.split("\\R")) {
            final var line = rawLine.trim();
            if (!line.toLowerCase(Locale.ROOT).startsWith("nameserver"))
                continue;

            final var colon = line.indexOf(':');
            if (colon >= 0) {
                final var address = line.substring(colon + 1).trim();
                if (Addresses.isIPv4(address))
                    servers.add(address);
            }
        }
        return servers;
    }

    /**
     * Returns the server identifier of the last lease in a dhclient or dhcpcd lease file,
     * e.g. {@code option dhcp-server-identifier 192.0.2.1;}.
     */
    public static @NotNull Optional<String> parseDhclientLease(@NotNull List<String> lines) {
        String last = null;
        for (var line : lines) {
            if (!line.contains("dhcp-server-identifier"))
                continue;

            final var parts = line.replace(";", "").trim().split("\\s+");
            final var candidate = parts[parts.length - 1];
            if (Addresses.isIPv4(candidate))
                last = candidate;
        }
        return Optional.ofNullable(last);
    }

    /**
     * Returns the DHCP server of a systemd-networkd lease file. {@code DHCP_SERVER_IDENTIFIER} is preferred
     * over {@code SERVER_ADDRESS}.
     */
    public static @NotNull Optional<String> parseNetworkdLease(@NotNull List<String> lines) {
        String identifier = null, serverAddress = null;
        for (var rawLine : lines) {
            final var line = rawLine.trim();
            if (line.startsWith("DHCP_SERVER_IDENTIFIER=")) {
                final var value = line.substring("DHCP_SERVER_IDENTIFIER=".length()).trim();
                if (Addresses.isIPv4(value))
                    identifier = value;
            } else if (line.startsWith("SERVER_ADDRESS=")) {
                final var value = line.substring("SERVER_ADDRESS=".length()).trim();
                if (Addresses.isIPv4(value))
                    serverAddress = value;
            }
        }
        return Optional.ofNullable(identifier != null ? identifier : serverAddress);
    }
}
