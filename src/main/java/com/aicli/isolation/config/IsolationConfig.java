package com.aicli.isolation.config;

import java.util.List;
import java.util.Set;

/**
 * Process-wide isolation policy shared by the resource, network, isolation and monitoring
 * components. Immutable; replaced as a whole through {@link IsolationPolicy#replace}.
 *
 * @param enableNetworkIsolation give each workspace its own bridge network
 * @param allowedNetworks        networks workspaces may additionally join
 * @param blockedPorts           host ports that may never be published
 * @param defaultCpuLimit        default CPU ceiling in cores
 * @param defaultMemoryLimit     default memory ceiling in bytes
 * @param defaultDiskLimit       default disk quota in bytes
 * @param enableSeccomp          attach the default seccomp profile
 * @param enableAppArmor         attach the docker-default AppArmor profile
 * @param disablePrivileged      force privileged mode off
 * @param readOnlyRootFs         mount the root filesystem read-only
 * @param noNewPrivileges        set the no-new-privileges security option
 * @param enableAuditLog         enable filesystem access auditing in the monitor
 * @param monitorSystemCalls     enable syscall monitoring (off by default for performance)
 */
public record IsolationConfig(
    boolean enableNetworkIsolation,
    List<String> allowedNetworks,
    Set<Integer> blockedPorts,
    double defaultCpuLimit,
    long defaultMemoryLimit,
    long defaultDiskLimit,
    boolean enableSeccomp,
    boolean enableAppArmor,
    boolean disablePrivileged,
    boolean readOnlyRootFs,
    boolean noNewPrivileges,
    boolean enableAuditLog,
    boolean monitorSystemCalls
) {

    public static final long MIB = 1024L * 1024L;

    public IsolationConfig {
        allowedNetworks = allowedNetworks != null ? List.copyOf(allowedNetworks) : List.of();
        blockedPorts = blockedPorts != null ? Set.copyOf(blockedPorts) : Set.of();
    }

    public static IsolationConfig defaults() {
        return new IsolationConfig(
            true,
            List.of("aicli-network"),
            Set.of(22, 80, 443, 3000, 8000, 8080),
            1.0,
            512 * MIB,
            1024 * MIB,
            true,
            true,
            true,
            false,
            true,
            true,
            false
        );
    }

    public boolean isPortBlocked(int port) {
        return blockedPorts.contains(port);
    }

    public IsolationConfig withBlockedPorts(Set<Integer> ports) {
        return new IsolationConfig(enableNetworkIsolation, allowedNetworks, ports, defaultCpuLimit,
            defaultMemoryLimit, defaultDiskLimit, enableSeccomp, enableAppArmor, disablePrivileged,
            readOnlyRootFs, noNewPrivileges, enableAuditLog, monitorSystemCalls);
    }

    public IsolationConfig withEnableAuditLog(boolean auditLog) {
        return new IsolationConfig(enableNetworkIsolation, allowedNetworks, blockedPorts, defaultCpuLimit,
            defaultMemoryLimit, defaultDiskLimit, enableSeccomp, enableAppArmor, disablePrivileged,
            readOnlyRootFs, noNewPrivileges, auditLog, monitorSystemCalls);
    }
}
