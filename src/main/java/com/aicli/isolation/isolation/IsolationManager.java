package com.aicli.isolation.isolation;

import com.aicli.isolation.IsolationException;
import com.aicli.isolation.config.IsolationConfig;
import com.aicli.isolation.config.IsolationPolicy;
import com.aicli.isolation.core.metrics.IsolationMetrics;
import com.aicli.isolation.network.NetworkManager;
import com.aicli.isolation.resource.ResourceLimitRequest;
import com.aicli.isolation.resource.ResourceLimits;
import com.aicli.isolation.resource.ResourceManager;
import com.github.dockerjava.api.command.CreateContainerCmd;
import com.github.dockerjava.api.model.Capability;
import com.github.dockerjava.api.model.HostConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;

/**
 * Builds the isolation profile of a workspace and renders it into the two records the
 * container runtime consumes at create time: the container definition and the host config.
 *
 * <p>Each workspace container:
 * <ul>
 *   <li>drops every capability and gets back CHOWN, DAC_OVERRIDE, SETGID and SETUID</li>
 *   <li>runs with the configured seccomp and AppArmor profiles and no-new-privileges</li>
 *   <li>has CPU, memory, PID and block I/O ceilings from the resource manager</li>
 *   <li>joins its dedicated {@code aicli-workspace-<id>} network</li>
 * </ul>
 */
public class IsolationManager {

    private static final Logger log = LoggerFactory.getLogger(IsolationManager.class);

    public static final String LABEL_ISOLATION_LEVEL = "aicli.isolation.level";

    static final List<String> DROPPED_CAPABILITIES = List.of("ALL");
    static final List<String> ADDED_CAPABILITIES = List.of("CHOWN", "DAC_OVERRIDE", "SETGID", "SETUID");
    static final String SECCOMP_PROFILE = "default";
    static final String APPARMOR_PROFILE = "docker-default";

    private final IsolationPolicy policy;
    private final ResourceManager resourceManager;
    private final IsolationMetrics metrics;

    public IsolationManager(IsolationPolicy policy, ResourceManager resourceManager, IsolationMetrics metrics) {
        this.policy = policy != null ? policy : IsolationPolicy.defaults();
        this.resourceManager = resourceManager != null ? resourceManager : new ResourceManager(this.policy);
        this.metrics = metrics;
    }

    public IsolationManager(IsolationConfig config) {
        this(new IsolationPolicy(config), null, null);
    }

    public IsolationManager() {
        this(IsolationConfig.defaults());
    }

    public WorkspaceIsolation createWorkspaceIsolation(WorkspaceHandle workspace) {
        return createWorkspaceIsolation(workspace, null);
    }

    /**
     * Builds a standard-level profile. With a request, the limits are the defaults overridden by
     * the request and must pass {@link ResourceManager#validateResourceLimits}.
     */
    public WorkspaceIsolation createWorkspaceIsolation(WorkspaceHandle workspace, ResourceLimitRequest request) {
        if (workspace == null) {
            throw IsolationException.invalidInput("workspace cannot be nil");
        }
        String workspaceId = workspace.workspaceId();
        if (workspaceId == null || workspaceId.isBlank()) {
            throw IsolationException.invalidInput("workspace ID cannot be empty");
        }

        ResourceLimits limits = request != null
                ? resourceManager.createCustomResourceLimits(request)
                : resourceManager.createResourceLimits();
        if (request != null) {
            resourceManager.validateResourceLimits(limits);
        }

        var isolation = new WorkspaceIsolation(
                workspaceId,
                WorkspaceIsolation.NETWORK_MODE_CUSTOM,
                NetworkManager.networkName(workspaceId),
                IsolationLevel.STANDARD,
                limits,
                createSecurityOptions(),
                createMonitoringConfig(),
                Instant.now());

        if (metrics != null) {
            metrics.recordProfileCreated(isolation.isolationLevel().value());
        }
        log.info("Created {} isolation profile for workspace {} ({} cores, {} MiB, network {})",
                isolation.isolationLevel().value(), workspaceId, limits.cpuCores(),
                limits.memory() / (1024 * 1024), isolation.networkName());
        return isolation;
    }

    SecurityOptions createSecurityOptions() {
        IsolationConfig config = policy.current();
        return new SecurityOptions(
                config.enableSeccomp() ? SECCOMP_PROFILE : "",
                config.enableAppArmor() ? APPARMOR_PROFILE : "",
                List.of(),
                new SecurityOptions.CapabilityConfig(DROPPED_CAPABILITIES, ADDED_CAPABILITIES),
                config.noNewPrivileges(),
                config.readOnlyRootFs());
    }

    MonitoringConfig createMonitoringConfig() {
        return new MonitoringConfig(
                true,
                true,
                policy.current().enableAuditLog(),
                "info",
                MonitoringConfig.AlertThresholds.defaults());
    }

    /**
     * Writes resource limits, security options, network mode and workspace labels. Every input is
     * checked before anything is written, so a failure leaves both records untouched.
     */
    public void applyToContainer(WorkspaceIsolation isolation, CreateContainerCmd containerConfig, HostConfig hostConfig) {
        if (isolation == null) {
            throw IsolationException.invalidInput("isolation config cannot be nil");
        }
        if (containerConfig == null) {
            throw IsolationException.invalidInput("container config cannot be nil");
        }
        if (hostConfig == null) {
            throw IsolationException.invalidInput("host config cannot be nil");
        }
        ResourceLimits limits = isolation.resourceLimits();
        if (limits == null) {
            throw IsolationException.invalidInput("failed to apply resource limits: resource limits cannot be nil");
        }
        SecurityOptions options = isolation.securityOptions();
        if (options == null) {
            throw IsolationException.invalidInput("failed to apply security options: security options cannot be nil");
        }
        Capability[] drop = toCapabilities(options.capabilities() != null ? options.capabilities().drop() : List.of());
        Capability[] add = toCapabilities(options.capabilities() != null ? options.capabilities().add() : List.of());

        resourceManager.toRuntimeResources(limits).applyTo(hostConfig);
        applySecurityOptions(options, drop, add, hostConfig);

        if (WorkspaceIsolation.NETWORK_MODE_CUSTOM.equals(isolation.networkMode())) {
            hostConfig.withNetworkMode(isolation.networkName());
        }

        var labels = new HashMap<String, String>();
        if (containerConfig.getLabels() != null) {
            labels.putAll(containerConfig.getLabels());
        }
        labels.put(NetworkManager.LABEL_WORKSPACE_ID, isolation.workspaceId());
        if (isolation.isolationLevel() != null) {
            labels.put(LABEL_ISOLATION_LEVEL, isolation.isolationLevel().value());
        }
        containerConfig.withLabels(labels);

        log.debug("Applied isolation for workspace {} to container config", isolation.workspaceId());
    }

    private void applySecurityOptions(SecurityOptions options, Capability[] drop, Capability[] add, HostConfig hostConfig) {
        var securityOpts = new ArrayList<String>();
        if (hostConfig.getSecurityOpts() != null) {
            securityOpts.addAll(hostConfig.getSecurityOpts());
        }
        if (options.noNewPrivileges()) {
            securityOpts.add("no-new-privileges:true");
        }
        if (options.seccompProfile() != null && !options.seccompProfile().isEmpty()) {
            securityOpts.add("seccomp=" + options.seccompProfile());
        }
        if (options.appArmorProfile() != null && !options.appArmorProfile().isEmpty()) {
            securityOpts.add("apparmor=" + options.appArmorProfile());
        }
        for (String label : options.selinuxLabels()) {
            securityOpts.add("label=" + label);
        }
        hostConfig.withSecurityOpts(securityOpts);

        if (options.readOnlyRootFs()) {
            hostConfig.withReadonlyRootfs(true);
        }
        if (drop.length > 0) {
            hostConfig.withCapDrop(drop);
        }
        if (add.length > 0) {
            hostConfig.withCapAdd(add);
        }
        if (policy.current().disablePrivileged()) {
            hostConfig.withPrivileged(false);
        }
    }

    private static Capability[] toCapabilities(List<String> names) {
        var capabilities = new Capability[names.size()];
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            try {
                capabilities[i] = Capability.valueOf(name.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new IsolationException(IsolationException.Category.INVALID_INPUT,
                        "failed to apply security options: unknown capability " + name, e);
            }
        }
        return capabilities;
    }

    /**
     * Gate before a profile is handed to the runtime.
     *
     * @throws IsolationException when a required part of the profile is missing
     */
    public void validateIsolation(WorkspaceIsolation isolation) {
        if (isolation == null) {
            throw IsolationException.invalidInput("isolation config cannot be nil");
        }
        if (isolation.workspaceId() == null || isolation.workspaceId().isEmpty()) {
            throw IsolationException.invalidInput("workspace ID cannot be empty");
        }
        if (isolation.networkMode() == null || isolation.networkMode().isEmpty()) {
            throw IsolationException.invalidInput("network mode cannot be empty");
        }
        if (isolation.resourceLimits() == null) {
            throw IsolationException.invalidInput("resource limits cannot be nil");
        }
        if (isolation.resourceLimits().memory() <= 0) {
            throw IsolationException.policyViolation("memory limit must be positive");
        }
        if (isolation.securityOptions() == null) {
            throw IsolationException.invalidInput("security options cannot be nil");
        }
    }

    public IsolationConfig getConfig() {
        return policy.current();
    }

    /**
     * Replaces the process-wide policy. Profiles built afterwards use the new config.
     */
    public void updateConfig(IsolationConfig config) {
        policy.replace(config);
        log.info("Isolation policy updated (seccomp={}, apparmor={}, blocked ports={})",
                config.enableSeccomp(), config.enableAppArmor(), config.blockedPorts());
    }
}
