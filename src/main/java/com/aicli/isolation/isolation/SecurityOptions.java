package com.aicli.isolation.isolation;

import java.util.List;

/**
 * Kernel-level hardening applied to a workspace container.
 *
 * @param seccompProfile  seccomp profile name, blank for none
 * @param appArmorProfile AppArmor profile name, blank for none
 * @param selinuxLabels   SELinux label options
 * @param capabilities    capabilities dropped and re-added
 * @param noNewPrivileges block privilege gain through setuid binaries
 * @param readOnlyRootFs  mount the root filesystem read-only
 */
public record SecurityOptions(
    String seccompProfile,
    String appArmorProfile,
    List<String> selinuxLabels,
    CapabilityConfig capabilities,
    boolean noNewPrivileges,
    boolean readOnlyRootFs
) {

    public SecurityOptions {
        selinuxLabels = selinuxLabels != null ? List.copyOf(selinuxLabels) : List.of();
    }

    /**
     * @param drop capabilities removed first ({@code ALL} removes every capability)
     * @param add  capabilities granted back after the drop
     */
    public record CapabilityConfig(List<String> drop, List<String> add) {

        public CapabilityConfig {
            drop = drop != null ? List.copyOf(drop) : List.of();
            add = add != null ? List.copyOf(add) : List.of();
        }
    }
}
