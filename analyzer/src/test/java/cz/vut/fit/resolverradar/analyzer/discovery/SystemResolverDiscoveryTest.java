package cz.vut.fit.resolverradar.analyzer.discovery;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SystemResolverDiscoveryTest {
    private static final String IPCONFIG = String.join("\r\n",
            "Windows IP Configuration",
            "",
            "Ethernet adapter Ethernet:",
            "",
            "   DHCP Enabled. . . . . . . . . . . : Yes",
            "   IPv4 Address. . . . . . . . . . . : 192.168.1.23(Preferred)",
            "   DHCP Server . . . . . . . . . . . : 192.168.1.1",
            "   DNS Servers . . . . . . . . . . . : 192.168.1.1",
            "                                       8.8.8.8",
            "                                       fe80::1",
            "   NetBIOS over Tcpip. . . . . . . . : Enabled",
            "                                       10.9.9.9",
            "");

    private static final String SCUTIL = String.join("\n",
            "DNS configuration",
            "",
            "resolver #1",
            "  nameserver[0] : 192.168.0.1",
            "  nameserver[1] : 2001:db8::1",
            "  if_index : 6 (en0)",
            "resolver #2",
            "  nameserver[0] : 1.1.1.1");

    @Test
    void resolvConfNameservers() {
        final var servers = SystemResolverDiscovery.parseResolvConf(List.of(
                "# Generated by NetworkManager",
                "search example.org",
                "nameserver 192.168.1.1",
                "nameserver   8.8.8.8",
                "nameserver 2001:4860:4860::8888",
                "#nameserver 9.9.9.9",
                "options edns0"));

        assertEquals(Set.of("192.168.1.1", "8.8.8.8"), servers);
    }

    @Test
    void ipconfigDnsServersWithContinuationLines() {
        assertEquals(Set.of("192.168.1.1", "8.8.8.8"), SystemResolverDiscovery.parseIpconfigDnsServers(IPCONFIG));
    }

    @Test
    void ipconfigDhcpServers() {
        assertEquals(Set.of("192.168.1.1"), SystemResolverDiscovery.parseIpconfigDhcpServers(IPCONFIG));
    }

    @Test
    void scutilNameservers() {
        assertEquals(Set.of("192.168.0.1", "1.1.1.1"), SystemResolverDiscovery.parseScutilNameservers(SCUTIL));
    }

    @Test
    void dhclientLeaseUsesTheLastIdentifier() {
        final var lease = List.of(
                "lease {",
                "  interface \"eth0\";",
                "  option dhcp-server-identifier 192.168.1.1;",
                "}",
                "lease {",
                "  interface \"eth0\";",
                "  option dhcp-server-identifier 192.168.1.254;",
                "}");

        assertEquals(Optional.of("192.168.1.254"), SystemResolverDiscovery.parseDhclientLease(lease));
        assertEquals(Optional.empty(), SystemResolverDiscovery.parseDhclientLease(List.of("lease {", "}")));
    }

    @Test
    void networkdLeasePrefersTheServerIdentifier() {
        assertEquals(Optional.of("10.0.0.1"), SystemResolverDiscovery.parseNetworkdLease(List.of(
                "ADDRESS=10.0.0.23", "SERVER_ADDRESS=10.0.0.2", "DHCP_SERVER_IDENTIFIER=10.0.0.1")));
        assertEquals(Optional.of("10.0.0.2"), SystemResolverDiscovery.parseNetworkdLease(List.of(
                "ADDRESS=10.0.0.23", "SERVER_ADDRESS=10.0.0.2")));
    }

    @Test
    void linuxConfigurationIsReadRelativeToTheRoot(@TempDir Path root) throws IOException {
        Files.createDirectories(root.resolve("etc"));
        Files.writeString(root.resolve("etc/resolv.conf"), "nameserver 127.0.0.53\nnameserver 192.168.1.1\n");
        Files.createDirectories(root.resolve("var/lib/dhcp"));
        Files.writeString(root.resolve("var/lib/dhcp/dhclient.eth0.leases"),
                "lease {\n  option dhcp-server-identifier 192.168.1.1;\n}\n");
        Files.createDirectories(root.resolve("run/systemd/netif/leases"));
        Files.writeString(root.resolve("run/systemd/netif/leases/2"), "DHCP_SERVER_IDENTIFIER=10.0.0.1\n");

        final var discovery = new SystemResolverDiscovery(root, SystemResolverDiscovery.Platform.LINUX,
                command -> fail("No command expected on Linux"));

        assertEquals(Set.of("127.0.0.53", "192.168.1.1"), discovery.systemResolvers());
        assertEquals(Set.of("192.168.1.1", "10.0.0.1"), discovery.dhcpServers());
    }

    @Test
    void missingLinuxConfigurationFindsNothing(@TempDir Path root) {
        final var discovery = new SystemResolverDiscovery(root, SystemResolverDiscovery.Platform.LINUX,
                command -> fail("No command expected on Linux"));

        assertTrue(discovery.systemResolvers().isEmpty());
        assertTrue(discovery.dhcpServers().isEmpty());
    }

    @Test
    void windowsUsesIpconfig(@TempDir Path root) {
        final var commands = new ArrayList<List<String>>();
        final var discovery = new SystemResolverDiscovery(root, SystemResolverDiscovery.Platform.WINDOWS,
                command -> {
                    commands.add(command);
                    return IPCONFIG;
                });

        assertEquals(Set.of("192.168.1.1", "8.8.8.8"), discovery.systemResolvers());
        assertEquals(Set.of("192.168.1.1"), discovery.dhcpServers());
        assertEquals(List.of("ipconfig", "/all"), commands.get(0));
    }

    @Test
    void failingCommandFindsNothing(@TempDir Path root) {
        final var discovery = new SystemResolverDiscovery(root, SystemResolverDiscovery.Platform.MACOS,
                command -> {
                    throw new IOException("scutil: not found");
                });

        assertTrue(discovery.systemResolvers().isEmpty());
        assertTrue(discovery.dhcpServers().isEmpty());
    }
}
