package com.aicli.isolation.network;

import com.aicli.isolation.IsolationException;
import com.aicli.isolation.config.IsolationConfig;
import com.aicli.isolation.config.IsolationPolicy;
import com.github.dockerjava.api.command.CreateNetworkCmd;
import com.github.dockerjava.api.model.ExposedPort;
import com.github.dockerjava.api.model.InternetProtocol;
import com.github.dockerjava.api.model.Network;
import com.github.dockerjava.api.model.Ports;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class NetworkManagerTest {

    private NetworkManager manager;

    @BeforeEach
    void setUp() {
        manager = new NetworkManager(IsolationConfig.defaults());
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    @Nested
    @DisplayName("workspace networks")
    class WorkspaceNetworks {

        @Test
        void createBuildsIsolatedBridgeNetwork() {
            var info = manager.createWorkspaceNetwork("ws-1");

            assertEquals("net_ws-1", info.id());
            assertEquals("aicli-workspace-ws-1", info.name());
            assertEquals("ws-1", info.workspaceId());
            assertEquals(SubnetAllocator.allocate("ws-1"), info.subnet());
            assertEquals(SubnetAllocator.gatewayFor(info.subnet()), info.gateway());
            assertTrue(info.gateway().endsWith(".1"));
            assertEquals("bridge", info.driver());
            assertTrue(info.isolated());
            assertFalse(info.internal());
            assertEquals("ws-1", info.labels().get(NetworkManager.LABEL_WORKSPACE_ID));
            assertEquals("true", info.labels().get(NetworkManager.LABEL_MANAGED));
            assertEquals("false", info.options().get("com.docker.network.bridge.enable_icc"));
            assertEquals("1500", info.options().get("com.docker.network.driver.mtu"));
        }

        @Test
        void workspacesSharingAPrefixGetDistinctBridges() {
            var alpha = manager.createWorkspaceNetwork("workspace-alpha");
            var beta = manager.createWorkspaceNetwork("workspace-beta");

            String alphaBridge = alpha.options().get("com.docker.network.bridge.name");
            String betaBridge = beta.options().get("com.docker.network.bridge.name");
            assertNotEquals(alphaBridge, betaBridge);
            assertTrue(alphaBridge.startsWith("aicli-"));
            assertTrue(alphaBridge.length() <= 15);
            assertTrue(betaBridge.length() <= 15);
        }

        @Test
        void bridgeNameIsStablePerWorkspace() {
            assertEquals(NetworkManager.bridgeName("a-very-long-workspace-identifier"),
                    NetworkManager.bridgeName("a-very-long-workspace-identifier"));
            assertEquals("aicli-811c9dc5", NetworkManager.bridgeName(""));
        }

        @Test
        void rejectsBlankIds() {
            var ex = assertThrows(IsolationException.class, () -> manager.createWorkspaceNetwork(""));
            assertEquals("workspace ID cannot be empty", ex.getMessage());
            assertThrows(IsolationException.class, () -> manager.createWorkspaceNetwork(null));
            assertThrows(IsolationException.class, () -> manager.getWorkspaceNetwork(" "));
            assertThrows(IsolationException.class, () -> manager.deleteWorkspaceNetwork(""));
        }

        @Test
        void createIsIdempotent() {
            var first = manager.createWorkspaceNetwork("ws-1");
            var second = manager.createWorkspaceNetwork("ws-1");

            assertSame(first, second);
            assertEquals(1, manager.listWorkspaceNetworks().size());
        }

        @Test
        void registryLifecycle() {
            manager.createWorkspaceNetwork("ws-b");
            manager.createWorkspaceNetwork("ws-a");

            assertEquals(List.of("ws-a", "ws-b"),
                    manager.listWorkspaceNetworks().stream().map(NetworkInfo::workspaceId).toList());
            assertTrue(manager.deleteWorkspaceNetwork("ws-a"));
            assertFalse(manager.deleteWorkspaceNetwork("ws-a"));
            assertEquals(1, manager.listWorkspaceNetworks().size());
        }

        @Test
        void getRecomputesIdentityForUnknownWorkspace() {
            var info = manager.getWorkspaceNetwork("ws-9");

            assertEquals("aicli-workspace-ws-9", info.name());
            assertEquals(SubnetAllocator.allocate("ws-9"), info.subnet());
            assertTrue(manager.listWorkspaceNetworks().isEmpty());
        }

        @Test
        void reportsSubnetCollisions() {
            Map<String, String> seen = new HashMap<>();
            String first = null;
            String second = null;
            for (int i = 0; first == null; i++) {
                String id = "ws-" + i;
                String other = seen.putIfAbsent(SubnetAllocator.allocate(id), id);
                if (other != null) {
                    first = other;
                    second = id;
                }
            }

            manager.createWorkspaceNetwork(first);
            manager.createWorkspaceNetwork(second);

            var collisions = manager.findSubnetCollisions();
            assertEquals(1, collisions.size());
            var ids = collisions.get(SubnetAllocator.allocate(first));
            assertTrue(ids.contains(first));
            assertTrue(ids.contains(second));
            // Mapping stays deterministic despite the collision
            assertEquals(manager.getWorkspaceNetwork(first).subnet(), manager.getWorkspaceNetwork(second).subnet());
        }

        @Test
        void appliesDefinitionToCreateCommand() {
            var info = manager.createWorkspaceNetwork("ws-1");
            var cmd = mock(CreateNetworkCmd.class, RETURNS_SELF);

            manager.applyToNetworkCreate(info, cmd);

            verify(cmd).withName("aicli-workspace-ws-1");
            verify(cmd).withDriver("bridge");
            verify(cmd).withInternal(false);
            verify(cmd).withAttachable(false);
            verify(cmd).withLabels(info.labels());
            verify(cmd).withOptions(info.options());
            var ipam = ArgumentCaptor.forClass(Network.Ipam.class);
            verify(cmd).withIpam(ipam.capture());
            var config = ipam.getValue().getConfig().get(0);
            assertEquals(info.subnet(), config.getSubnet());
            assertEquals(info.gateway(), config.getGateway());
        }
    }

    @Nested
    @DisplayName("port mappings")
    class PortMappings {

        @Test
        void blockedHostPortRejected() {
            var ex = assertThrows(IsolationException.class,
                    () -> manager.validatePortMapping(Map.of("22", "22")));
            assertEquals(IsolationException.Category.POLICY_VIOLATION, ex.getCategory());
            assertTrue(ex.getMessage().contains("blocked"));
        }

        @Test
        void unblockedPortsAccepted() {
            var relaxed = new NetworkManager(IsolationConfig.defaults().withBlockedPorts(Set.of(22)));
            try {
                assertDoesNotThrow(() -> relaxed.validatePortMapping(Map.of("8080", "8000")));
            } finally {
                relaxed.close();
            }
        }

        @Test
        void outOfRangeRejected() {
            assertThrows(IsolationException.class, () -> manager.validatePortMapping(Map.of("0", "8000")));
            assertThrows(IsolationException.class, () -> manager.validatePortMapping(Map.of("65536", "8000")));
            assertThrows(IsolationException.class, () -> manager.validatePortMapping(Map.of("9000", "70000")));
            assertThrows(IsolationException.class, () -> manager.validatePortMapping(Map.of("abc", "8000")));
        }

        @Test
        void nullMapIsValid() {
            assertDoesNotThrow(() -> manager.validatePortMapping(null));
        }

        @Test
        void protocolSuffixesAccepted() {
            assertDoesNotThrow(() -> manager.validatePortMapping(Map.of("9000/tcp", "9000/udp")));
            assertThrows(IsolationException.class, () -> manager.validatePortMapping(Map.of("9000/sctp", "9000")));
        }

        @Test
        void blockedCheckUsesPolicy() {
            assertTrue(manager.isPortBlocked(443));
            assertFalse(manager.isPortBlocked(9443));
        }

        @Test
        void createExposesAndBindsOnHostIp() {
            var ports = new LinkedHashMap<String, String>();
            ports.put("9000", "3001");
            ports.put("9001", "5353/udp");

            var mapping = manager.createPortMapping(new PortMappingRequest(ports, "127.0.0.1", true));

            var tcp = new ExposedPort(3001, InternetProtocol.TCP);
            var udp = new ExposedPort(5353, InternetProtocol.UDP);
            assertEquals(List.of(tcp, udp), mapping.exposedPorts());
            Ports.Binding[] bindings = mapping.portBindings().getBindings().get(tcp);
            assertEquals(1, bindings.length);
            assertEquals("127.0.0.1", bindings[0].getHostIp());
            assertEquals("9000", bindings[0].getHostPortSpec());
        }

        @Test
        void createWithoutHostBindingOnlyExposes() {
            var mapping = manager.createPortMapping(new PortMappingRequest(Map.of("9000", "3001"), "", false));

            assertEquals(1, mapping.exposedPorts().size());
            assertTrue(mapping.portBindings().getBindings().isEmpty());
        }

        @Test
        void createRejectsInvalidMappingWithPrefix() {
            var ex = assertThrows(IsolationException.class,
                    () -> manager.createPortMapping(new PortMappingRequest(Map.of("22", "22"), "", true)));
            assertTrue(ex.getMessage().startsWith("invalid port mapping: "));
        }
    }

    @Nested
    @DisplayName("network security policy")
    class SecurityPolicy {

        private NetworkSecurityPolicy policy(List<FirewallRule> allow, List<FirewallRule> block) {
            return new NetworkSecurityPolicy("net_ws-1", 1_000_000, 100, allow, block, false, true);
        }

        @Test
        void validRulesAccepted() {
            var p = policy(
                    List.of(FirewallRule.allow("tcp", "10.0.0.0/8", "443"), FirewallRule.allow("icmp", "", "")),
                    List.of(FirewallRule.deny("udp", "192.168.1.10", "53"), FirewallRule.deny("tcp", "fd00::/8", "")));
            assertDoesNotThrow(() -> manager.validateNetworkSecurityPolicy(p));
        }

        @Test
        void negativeCeilingsRejected() {
            assertThrows(IsolationException.class, () -> manager.validateNetworkSecurityPolicy(
                    new NetworkSecurityPolicy("n", -1, 0, List.of(), List.of(), false, false)));
            assertThrows(IsolationException.class, () -> manager.validateNetworkSecurityPolicy(
                    new NetworkSecurityPolicy("n", 0, -1, List.of(), List.of(), false, false)));
        }

        @Test
        void invalidRulesRejected() {
            assertThrows(IsolationException.class,
                    () -> manager.validateFirewallRule(FirewallRule.allow("gre", "", "")));
            assertThrows(IsolationException.class,
                    () -> manager.validateFirewallRule(FirewallRule.allow("tcp", "", "70000")));
            assertThrows(IsolationException.class,
                    () -> manager.validateFirewallRule(FirewallRule.allow("tcp", "", "http")));
            assertThrows(IsolationException.class,
                    () -> manager.validateFirewallRule(FirewallRule.allow("tcp", "10.0.0.0/40", "")));
            assertThrows(IsolationException.class,
                    () -> manager.validateFirewallRule(FirewallRule.allow("tcp", "999.1.1.1", "")));
            assertThrows(IsolationException.class,
                    () -> manager.validateFirewallRule(null));
        }

        @Test
        void ipv6LiteralsAcceptedWithoutResolvingNames() {
            assertTrue(NetworkManager.isValidIp("::1"));
            assertTrue(NetworkManager.isValidIp("::"));
            assertTrue(NetworkManager.isValidIp("fe80::1"));
            assertTrue(NetworkManager.isValidIp("2001:0db8:0000:0000:0000:ff00:0042:8329"));
            assertTrue(NetworkManager.isValidIp("::ffff:192.0.2.1"));
            assertTrue(NetworkManager.isValidCidr("2001:db8::/32"));

            assertFalse(NetworkManager.isValidIp("host:1"));
            assertFalse(NetworkManager.isValidIp("localhost:8080"));
            assertFalse(NetworkManager.isValidIp("1::2::3"));
            assertFalse(NetworkManager.isValidIp("1:2:3:4:5:6:7:8:9"));
            assertFalse(NetworkManager.isValidIp("12345::1"));
            assertFalse(NetworkManager.isValidIp("fe80::1%eth0"));
            assertThrows(IsolationException.class,
                    () -> manager.validateFirewallRule(FirewallRule.allow("tcp", "host:1", "")));
        }

        @Test
        void invalidBlockRuleNamed() {
            var ex = assertThrows(IsolationException.class, () -> manager.validateNetworkSecurityPolicy(
                    policy(List.of(), List.of(FirewallRule.deny("tcp", "bad-ip", "")))));
            assertTrue(ex.getMessage().startsWith("invalid block rule: "));
        }

        @Test
        void applyRecordsPolicy() {
            var p = policy(List.of(), List.of());
            manager.applyNetworkSecurity("net_ws-1", p);

            assertEquals(p, manager.getAppliedPolicy("net_ws-1").orElseThrow());
        }

        @Test
        void applyRejectsMissingArguments() {
            assertThrows(IsolationException.class, () -> manager.applyNetworkSecurity("", policy(List.of(), List.of())));
            assertThrows(IsolationException.class, () -> manager.applyNetworkSecurity("net_ws-1", null));
            assertTrue(manager.getAppliedPolicy("net_ws-1").isEmpty());
        }
    }

    @Nested
    @DisplayName("usage monitoring")
    class UsageMonitoring {

        @Test
        void streamsSamplesUntilClosed() throws Exception {
            var calls = new AtomicInteger();
            NetworkStatsSource source = id -> new NetworkStats(id, calls.incrementAndGet(), 10, 1, 1, 2, Instant.now());
            var sampling = new NetworkManager(IsolationPolicy.defaults(), source, Duration.ofMillis(20));
            try (var stream = sampling.monitorNetworkUsage("net_ws-1")) {
                var first = stream.poll(Duration.ofSeconds(2));
                assertNotNull(first);
                assertEquals("net_ws-1", first.networkId());
                assertNotNull(stream.poll(Duration.ofSeconds(2)));

                stream.close();
                assertTrue(stream.isClosed());
                int afterClose = calls.get();
                Thread.sleep(100);
                assertTrue(calls.get() <= afterClose + 1);
            } finally {
                sampling.close();
            }
        }

        @Test
        void defaultSourceReportsZeroCounters() throws Exception {
            try (var stream = manager.monitorNetworkUsage("net_ws-2")) {
                var stats = stream.poll(Duration.ofSeconds(2));
                assertNotNull(stats);
                assertEquals(0, stats.rxBytes());
                assertEquals(0, stats.txBytes());
            }
        }

        @Test
        void rejectsEmptyNetworkId() {
            assertThrows(IsolationException.class, () -> manager.monitorNetworkUsage(""));
        }
    }
}
