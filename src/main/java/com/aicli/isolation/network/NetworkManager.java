package com.aicli.isolation.network;

import com.aicli.isolation.IsolationException;
import com.aicli.isolation.config.IsolationConfig;
import com.aicli.isolation.config.IsolationPolicy;
import com.github.dockerjava.api.command.CreateNetworkCmd;
import com.github.dockerjava.api.model.ExposedPort;
import com.github.dockerjava.api.model.InternetProtocol;
import com.github.dockerjava.api.model.Network;
import com.github.dockerjava.api.model.Ports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Allocates one isolated bridge network per workspace, builds port publications under the
 * blocked-port policy, and validates firewall-style network policies.
 *
 * <p>Networks are described declaratively; creating them on the runtime is done by whoever
 * receives the {@link NetworkInfo} (see {@link #applyToNetworkCreate}). The registry of
 * provisioned networks lives for the lifetime of the process only.
 */
public class NetworkManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NetworkManager.class);

    public static final String NETWORK_NAME_PREFIX = "aicli-workspace-";
    public static final String LABEL_WORKSPACE_ID = "aicli.workspace.id";
    public static final String LABEL_MANAGED = "aicli.managed";
    public static final String LABEL_ISOLATION = "aicli.isolation";
    public static final String LABEL_CREATED_AT = "aicli.created_at";

    private static final String DRIVER_BRIDGE = "bridge";
    private static final String BRIDGE_NAME_PREFIX = "aicli-";
    private static final String HEX_DIGITS = "0123456789abcdefABCDEF";
    private static final Set<String> FIREWALL_PROTOCOLS = Set.of("tcp", "udp", "icmp");

    private final IsolationPolicy policy;
    private final NetworkStatsSource statsSource;
    private final Duration statsInterval;

    private final Map<String, NetworkInfo> networks = new HashMap<>();
    private final Map<String, NetworkSecurityPolicy> appliedPolicies = new HashMap<>();
    private final ReadWriteLock registryLock = new ReentrantReadWriteLock();

    private final ScheduledExecutorService statsScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "network-usage");
        t.setDaemon(true);
        return t;
    });

    public NetworkManager(IsolationPolicy policy, NetworkStatsSource statsSource, Duration statsInterval) {
        this.policy = policy != null ? policy : IsolationPolicy.defaults();
        this.statsSource = statsSource != null ? statsSource : NetworkStatsSource.NONE;
        this.statsInterval = statsInterval != null ? statsInterval : Duration.ofSeconds(5);
    }

    public NetworkManager(IsolationConfig config) {
        this(new IsolationPolicy(config), NetworkStatsSource.NONE, Duration.ofSeconds(5));
    }

    public static String networkName(String workspaceId) {
        return NETWORK_NAME_PREFIX + workspaceId;
    }

    // -- Workspace networks --------------------------------------------------

    public NetworkInfo createWorkspaceNetwork(String workspaceId) {
        requireWorkspaceId(workspaceId);

        String subnet = SubnetAllocator.allocate(workspaceId);
        String gateway = SubnetAllocator.gatewayFor(subnet);
        if (gateway.isEmpty()) {
            throw IsolationException.invalidInput("cannot derive gateway for subnet " + subnet);
        }

        Instant now = Instant.now();
        var labels = new LinkedHashMap<String, String>();
        labels.put(LABEL_WORKSPACE_ID, workspaceId);
        labels.put(LABEL_MANAGED, "true");
        labels.put(LABEL_ISOLATION, "workspace");
        labels.put(LABEL_CREATED_AT, DateTimeFormatter.ISO_INSTANT.format(now));

        var info = new NetworkInfo(
                "net_" + workspaceId,
                networkName(workspaceId),
                workspaceId,
                subnet,
                gateway,
                DRIVER_BRIDGE,
                true,
                false,
                labels,
                bridgeOptions(workspaceId),
                now);

        registryLock.writeLock().lock();
        try {
            NetworkInfo existing = networks.get(workspaceId);
            if (existing != null) {
                log.debug("Network for workspace {} already provisioned ({})", workspaceId, existing.subnet());
                return existing;
            }
            for (NetworkInfo other : networks.values()) {
                if (other.subnet().equals(subnet)) {
                    log.warn("Subnet collision: workspace {} and workspace {} both map to {}",
                            workspaceId, other.workspaceId(), subnet);
                }
            }
            networks.put(workspaceId, info);
        } finally {
            registryLock.writeLock().unlock();
        }

        log.info("Provisioned network {} for workspace {} (subnet {}, gateway {})",
                info.name(), workspaceId, subnet, gateway);
        return info;
    }

    /**
     * Returns the registered network, or the deterministic identity when the workspace has not
     * been provisioned in this process.
     */
    public NetworkInfo getWorkspaceNetwork(String workspaceId) {
        requireWorkspaceId(workspaceId);
        registryLock.readLock().lock();
        try {
            NetworkInfo registered = networks.get(workspaceId);
            if (registered != null) {
                return registered;
            }
        } finally {
            registryLock.readLock().unlock();
        }
        String subnet = SubnetAllocator.allocate(workspaceId);
        return new NetworkInfo(
                "net_" + workspaceId,
                networkName(workspaceId),
                workspaceId,
                subnet,
                SubnetAllocator.gatewayFor(subnet),
                DRIVER_BRIDGE,
                true,
                false,
                Map.of(LABEL_WORKSPACE_ID, workspaceId, LABEL_MANAGED, "true", LABEL_ISOLATION, "workspace"),
                bridgeOptions(workspaceId),
                null);
    }

    /**
     * @return true when a registered network was removed
     */
    public boolean deleteWorkspaceNetwork(String workspaceId) {
        requireWorkspaceId(workspaceId);
        registryLock.writeLock().lock();
        try {
            NetworkInfo removed = networks.remove(workspaceId);
            if (removed != null) {
                appliedPolicies.remove(removed.id());
                log.info("Released network {} of workspace {}", removed.name(), workspaceId);
                return true;
            }
            return false;
        } finally {
            registryLock.writeLock().unlock();
        }
    }

    public List<NetworkInfo> listWorkspaceNetworks() {
        registryLock.readLock().lock();
        try {
            var result = new ArrayList<>(networks.values());
            result.sort(Comparator.comparing(NetworkInfo::workspaceId));
            return result;
        } finally {
            registryLock.readLock().unlock();
        }
    }

    /**
     * @return subnets held by more than one registered workspace, with the workspace IDs
     */
    public Map<String, List<String>> findSubnetCollisions() {
        var bySubnet = new TreeMap<String, List<String>>();
        registryLock.readLock().lock();
        try {
            for (NetworkInfo info : networks.values()) {
                bySubnet.computeIfAbsent(info.subnet(), k -> new ArrayList<>()).add(info.workspaceId());
            }
        } finally {
            registryLock.readLock().unlock();
        }
        bySubnet.values().removeIf(ids -> ids.size() < 2);
        bySubnet.values().forEach(Collections::sort);
        return bySubnet;
    }

    /**
     * Writes the declarative definition of a workspace network into a runtime create command.
     */
    public CreateNetworkCmd applyToNetworkCreate(NetworkInfo info, CreateNetworkCmd cmd) {
        if (info == null) {
            throw IsolationException.invalidInput("network info cannot be nil");
        }
        if (cmd == null) {
            throw IsolationException.invalidInput("network create command cannot be nil");
        }
        var ipam = new Network.Ipam()
                .withDriver("default")
                .withConfig(new Network.Ipam.Config()
                        .withSubnet(info.subnet())
                        .withGateway(info.gateway()));
        return cmd.withName(info.name())
                .withDriver(info.driver())
                .withInternal(info.internal())
                .withAttachable(false)
                .withIpam(ipam)
                .withOptions(info.options())
                .withLabels(info.labels());
    }

    /**
     * Linux bridge interface for the workspace network. Interface names are limited to 15
     * characters, so the name carries the FNV-1a hash of the ID rather than the ID itself.
     */
    static String bridgeName(String workspaceId) {
        return BRIDGE_NAME_PREFIX + Integer.toHexString(SubnetAllocator.fnv1a32(workspaceId));
    }

    private static Map<String, String> bridgeOptions(String workspaceId) {
        var options = new LinkedHashMap<String, String>();
        options.put("com.docker.network.bridge.name", bridgeName(workspaceId));
        options.put("com.docker.network.driver.mtu", "1500");
        options.put("com.docker.network.bridge.enable_icc", "false");
        options.put("com.docker.network.bridge.enable_ip_masquerade", "true");
        return options;
    }

    // -- Port mappings -------------------------------------------------------

    /**
     * Validates host-to-container port pairs. A {@code null} map is valid.
     *
     * @throws IsolationException for unparseable or out-of-range ports, or blocked host ports
     */
    public void validatePortMapping(Map<String, String> portMap) {
        if (portMap == null) {
            return;
        }
        for (Map.Entry<String, String> entry : portMap.entrySet()) {
            String hostPort = entry.getKey();
            PortSpec host = parsePort(hostPort, "host");
            if (isPortBlocked(host.number())) {
                throw IsolationException.policyViolation("port " + hostPort + " is blocked by security policy");
            }
            parsePort(entry.getValue(), "container");
        }
    }

    public PortMapping createPortMapping(PortMappingRequest request) {
        if (request == null) {
            throw IsolationException.invalidInput("port mapping request cannot be nil");
        }
        try {
            validatePortMapping(request.portMappings());
        } catch (IsolationException e) {
            throw new IsolationException(e.getCategory(), "invalid port mapping: " + e.getMessage(), e);
        }

        var exposedPorts = new ArrayList<ExposedPort>();
        var bindings = new Ports();
        if (request.portMappings() == null) {
            return new PortMapping(exposedPorts, bindings);
        }

        for (Map.Entry<String, String> entry : request.portMappings().entrySet()) {
            PortSpec host = parsePort(entry.getKey(), "host");
            PortSpec container = parsePort(entry.getValue(), "container");
            ExposedPort exposed = new ExposedPort(container.number(), container.protocol());
            if (!exposedPorts.contains(exposed)) {
                exposedPorts.add(exposed);
            }
            if (request.bindToHost()) {
                String hostIp = request.hostIp();
                Ports.Binding binding = hostIp == null || hostIp.isBlank()
                        ? Ports.Binding.bindPort(host.number())
                        : Ports.Binding.bindIpAndPort(hostIp, host.number());
                bindings.bind(exposed, binding);
            }
        }
        return new PortMapping(exposedPorts, bindings);
    }

    boolean isPortBlocked(int port) {
        return policy.current().isPortBlocked(port);
    }

    private record PortSpec(int number, InternetProtocol protocol) {}

    private static PortSpec parsePort(String value, String role) {
        if (value == null || value.isBlank()) {
            throw IsolationException.invalidInput("invalid " + role + " port: empty");
        }
        String[] parts = value.trim().split("/", -1);
        if (parts.length > 2) {
            throw IsolationException.invalidInput("invalid " + role + " port " + value);
        }
        InternetProtocol protocol = InternetProtocol.TCP;
        if (parts.length == 2) {
            if ("udp".equalsIgnoreCase(parts[1])) {
                protocol = InternetProtocol.UDP;
            } else if (!"tcp".equalsIgnoreCase(parts[1])) {
                throw IsolationException.invalidInput("invalid " + role + " port protocol " + value);
            }
        }
        int number;
        try {
            number = Integer.parseInt(parts[0]);
        } catch (NumberFormatException e) {
            throw new IsolationException(IsolationException.Category.INVALID_INPUT,
                    "invalid " + role + " port " + value, e);
        }
        if (number < 1 || number > 65535) {
            throw IsolationException.invalidInput(
                    role + " port " + number + " is out of valid range (1-65535)");
        }
        return new PortSpec(number, protocol);
    }

    // -- Usage monitoring ----------------------------------------------------

    /**
     * Starts sampling a network's counters: one sample immediately, then one per interval, until
     * the returned stream is closed. Samples that do not fit the stream's buffer are dropped.
     */
    public NetworkUsageStream monitorNetworkUsage(String networkId) {
        if (networkId == null || networkId.isBlank()) {
            throw IsolationException.invalidInput("network ID cannot be empty");
        }
        var stream = new NetworkUsageStream(networkId);
        var future = statsScheduler.scheduleAtFixedRate(() -> {
            if (stream.isClosed()) {
                return;
            }
            try {
                if (!stream.publish(statsSource.sample(networkId))) {
                    log.debug("Network usage buffer full for {}, sample dropped", networkId);
                }
            } catch (Exception e) {
                log.warn("Failed to sample network {}: {}", networkId, e.getMessage());
            }
        }, 0, statsInterval.toMillis(), TimeUnit.MILLISECONDS);
        stream.attach(future);
        return stream;
    }

    // -- Network security policy ---------------------------------------------

    /**
     * Validates a policy and records it as the active policy of the network.
     */
    public void applyNetworkSecurity(String networkId, NetworkSecurityPolicy securityPolicy) {
        if (networkId == null || networkId.isBlank()) {
            throw IsolationException.invalidInput("network ID cannot be empty");
        }
        if (securityPolicy == null) {
            throw IsolationException.invalidInput("network security policy cannot be nil");
        }
        validateNetworkSecurityPolicy(securityPolicy);

        registryLock.writeLock().lock();
        try {
            appliedPolicies.put(networkId, securityPolicy);
        } finally {
            registryLock.writeLock().unlock();
        }
        log.info("Network policy applied to {}: {} allow rule(s), {} block rule(s), max bandwidth {}",
                networkId, securityPolicy.allowRules().size(), securityPolicy.blockRules().size(),
                securityPolicy.maxBandwidth());
    }

    public Optional<NetworkSecurityPolicy> getAppliedPolicy(String networkId) {
        registryLock.readLock().lock();
        try {
            return Optional.ofNullable(appliedPolicies.get(networkId));
        } finally {
            registryLock.readLock().unlock();
        }
    }

    public void validateNetworkSecurityPolicy(NetworkSecurityPolicy securityPolicy) {
        if (securityPolicy == null) {
            throw IsolationException.invalidInput("network security policy cannot be nil");
        }
        if (securityPolicy.maxBandwidth() < 0) {
            throw IsolationException.invalidInput("max bandwidth cannot be negative");
        }
        if (securityPolicy.maxConnections() < 0) {
            throw IsolationException.invalidInput("max connections cannot be negative");
        }
        for (FirewallRule rule : securityPolicy.allowRules()) {
            try {
                validateFirewallRule(rule);
            } catch (IsolationException e) {
                throw new IsolationException(e.getCategory(), "invalid allow rule: " + e.getMessage(), e);
            }
        }
        for (FirewallRule rule : securityPolicy.blockRules()) {
            try {
                validateFirewallRule(rule);
            } catch (IsolationException e) {
                throw new IsolationException(e.getCategory(), "invalid block rule: " + e.getMessage(), e);
            }
        }
    }

    void validateFirewallRule(FirewallRule rule) {
        if (rule == null) {
            throw IsolationException.invalidInput("firewall rule cannot be nil");
        }
        if (rule.protocol() == null || !FIREWALL_PROTOCOLS.contains(rule.protocol())) {
            throw IsolationException.invalidInput("invalid protocol: " + rule.protocol());
        }
        if (rule.port() != null && !rule.port().isEmpty()) {
            int port;
            try {
                port = Integer.parseInt(rule.port());
            } catch (NumberFormatException e) {
                throw IsolationException.invalidInput("invalid port: " + rule.port());
            }
            if (port < 1 || port > 65535) {
                throw IsolationException.invalidInput("port out of range: " + port);
            }
        }
        String source = rule.source();
        if (source != null && !source.isEmpty()) {
            if (source.contains("/")) {
                if (!isValidCidr(source)) {
                    throw IsolationException.invalidInput("invalid CIDR: " + source);
                }
            } else if (!isValidIp(source)) {
                throw IsolationException.invalidInput("invalid IP address: " + source);
            }
        }
    }

    static boolean isValidCidr(String cidr) {
        int slash = cidr.indexOf('/');
        String address = cidr.substring(0, slash);
        int prefix;
        try {
            prefix = Integer.parseInt(cidr.substring(slash + 1));
        } catch (NumberFormatException e) {
            return false;
        }
        if (address.contains(":")) {
            return prefix >= 0 && prefix <= 128 && isValidIp(address);
        }
        return prefix >= 0 && prefix <= 32 && SubnetAllocator.parseIpv4(address) != null;
    }

    static boolean isValidIp(String address) {
        if (!address.contains(":")) {
            return SubnetAllocator.parseIpv4(address) != null;
        }
        return isIpv6Literal(address);
    }

    /**
     * Checks IPv6 literal syntax only, so host names such as {@code host:1} are rejected without a
     * name lookup. Accepts one {@code ::} and a trailing dotted IPv4 part; zone IDs are rejected.
     */
    static boolean isIpv6Literal(String address) {
        int doubleColon = address.indexOf("::");
        if (doubleColon >= 0 && address.indexOf("::", doubleColon + 1) >= 0) {
            return false;
        }
        String head = doubleColon >= 0 ? address.substring(0, doubleColon) : address;
        String tail = doubleColon >= 0 ? address.substring(doubleColon + 2) : "";
        int headGroups = countIpv6Groups(head, doubleColon < 0);
        int tailGroups = countIpv6Groups(tail, true);
        if (headGroups < 0 || tailGroups < 0) {
            return false;
        }
        int groups = headGroups + tailGroups;
        return doubleColon >= 0 ? groups <= 7 : groups == 8;
    }

    /** Returns the number of 16-bit groups in a colon-separated run, or -1 when malformed. */
    private static int countIpv6Groups(String run, boolean ipv4Allowed) {
        if (run.isEmpty()) {
            return 0;
        }
        String[] parts = run.split(":", -1);
        int groups = 0;
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            if (i == parts.length - 1 && ipv4Allowed && part.indexOf('.') >= 0) {
                if (SubnetAllocator.parseIpv4(part) == null) {
                    return -1;
                }
                groups += 2;
            } else if (isHexGroup(part)) {
                groups++;
            } else {
                return -1;
            }
        }
        return groups;
    }

    private static boolean isHexGroup(String part) {
        if (part.isEmpty() || part.length() > 4) {
            return false;
        }
        for (int i = 0; i < part.length(); i++) {
            if (HEX_DIGITS.indexOf(part.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }

    private static void requireWorkspaceId(String workspaceId) {
        if (workspaceId == null || workspaceId.isBlank()) {
            throw IsolationException.invalidInput("workspace ID cannot be empty");
        }
    }

    @Override
    public void close() {
        statsScheduler.shutdownNow();
    }
}
