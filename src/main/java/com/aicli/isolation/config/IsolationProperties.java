package com.aicli.isolation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Operator-supplied isolation policy and monitor tuning.
 *
 * <pre>
 * aicli:
 *   isolation:
 *     network:
 *       blocked-ports: [22, 80, 443]
 *     resources:
 *       default-cpu-limit: 1.0
 *       default-memory-limit-mb: 512
 *     monitor:
 *       interval: 30s
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "aicli.isolation")
public class IsolationProperties {

    private Network network = new Network();
    private Resources resources = new Resources();
    private Security security = new Security();
    private Audit audit = new Audit();
    private Monitor monitor = new Monitor();
    private Runtime runtime = new Runtime();

    /**
     * Converts the bound properties into the immutable policy record.
     */
    public IsolationConfig toIsolationConfig() {
        return new IsolationConfig(
            network.isolationEnabled,
            network.allowedNetworks,
            network.blockedPorts,
            resources.defaultCpuLimit,
            resources.defaultMemoryLimitMb * IsolationConfig.MIB,
            resources.defaultDiskLimitMb * IsolationConfig.MIB,
            security.seccompEnabled,
            security.appArmorEnabled,
            security.disablePrivileged,
            security.readOnlyRootFs,
            security.noNewPrivileges,
            audit.enabled,
            audit.monitorSystemCalls
        );
    }

    public Network getNetwork() { return network; }
    public void setNetwork(Network network) { this.network = network; }
    public Resources getResources() { return resources; }
    public void setResources(Resources resources) { this.resources = resources; }
    public Security getSecurity() { return security; }
    public void setSecurity(Security security) { this.security = security; }
    public Audit getAudit() { return audit; }
    public void setAudit(Audit audit) { this.audit = audit; }
    public Monitor getMonitor() { return monitor; }
    public void setMonitor(Monitor monitor) { this.monitor = monitor; }
    public Runtime getRuntime() { return runtime; }
    public void setRuntime(Runtime runtime) { this.runtime = runtime; }

    public static class Network {
        private boolean isolationEnabled = true;
        private List<String> allowedNetworks = new ArrayList<>(List.of("aicli-network"));
        private Set<Integer> blockedPorts = new LinkedHashSet<>(List.of(22, 80, 443, 3000, 8000, 8080));

        public boolean isIsolationEnabled() { return isolationEnabled; }
        public void setIsolationEnabled(boolean isolationEnabled) { this.isolationEnabled = isolationEnabled; }
        public List<String> getAllowedNetworks() { return allowedNetworks; }
        public void setAllowedNetworks(List<String> allowedNetworks) { this.allowedNetworks = allowedNetworks; }
        public Set<Integer> getBlockedPorts() { return blockedPorts; }
        public void setBlockedPorts(Set<Integer> blockedPorts) { this.blockedPorts = blockedPorts; }
    }

    public static class Resources {
        private double defaultCpuLimit = 1.0;
        private long defaultMemoryLimitMb = 512;
        private long defaultDiskLimitMb = 1024;

        public double getDefaultCpuLimit() { return defaultCpuLimit; }
        public void setDefaultCpuLimit(double defaultCpuLimit) { this.defaultCpuLimit = defaultCpuLimit; }
        public long getDefaultMemoryLimitMb() { return defaultMemoryLimitMb; }
        public void setDefaultMemoryLimitMb(long defaultMemoryLimitMb) { this.defaultMemoryLimitMb = defaultMemoryLimitMb; }
        public long getDefaultDiskLimitMb() { return defaultDiskLimitMb; }
        public void setDefaultDiskLimitMb(long defaultDiskLimitMb) { this.defaultDiskLimitMb = defaultDiskLimitMb; }
    }

    public static class Security {
        private boolean seccompEnabled = true;
        private boolean appArmorEnabled = true;
        private boolean disablePrivileged = true;
        private boolean readOnlyRootFs = false;
        private boolean noNewPrivileges = true;

        public boolean isSeccompEnabled() { return seccompEnabled; }
        public void setSeccompEnabled(boolean seccompEnabled) { this.seccompEnabled = seccompEnabled; }
        public boolean isAppArmorEnabled() { return appArmorEnabled; }
        public void setAppArmorEnabled(boolean appArmorEnabled) { this.appArmorEnabled = appArmorEnabled; }
        public boolean isDisablePrivileged() { return disablePrivileged; }
        public void setDisablePrivileged(boolean disablePrivileged) { this.disablePrivileged = disablePrivileged; }
        public boolean isReadOnlyRootFs() { return readOnlyRootFs; }
        public void setReadOnlyRootFs(boolean readOnlyRootFs) { this.readOnlyRootFs = readOnlyRootFs; }
        public boolean isNoNewPrivileges() { return noNewPrivileges; }
        public void setNoNewPrivileges(boolean noNewPrivileges) { this.noNewPrivileges = noNewPrivileges; }
    }

    public static class Audit {
        private boolean enabled = true;
        private boolean monitorSystemCalls = false;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public boolean isMonitorSystemCalls() { return monitorSystemCalls; }
        public void setMonitorSystemCalls(boolean monitorSystemCalls) { this.monitorSystemCalls = monitorSystemCalls; }
    }

    public static class Monitor {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(30);
        private int alertCapacity = 100;
        private int dispatchThreads = 4;
        private int dispatchQueueCapacity = 1000;
        private int maxViolationsPerWorkspace = 1000;
        private Duration networkStatsInterval = Duration.ofSeconds(5);

        public MonitorOptions toOptions() {
            return new MonitorOptions(interval, alertCapacity, dispatchThreads,
                    dispatchQueueCapacity, maxViolationsPerWorkspace, networkStatsInterval);
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
        public int getAlertCapacity() { return alertCapacity; }
        public void setAlertCapacity(int alertCapacity) { this.alertCapacity = alertCapacity; }
        public int getDispatchThreads() { return dispatchThreads; }
        public void setDispatchThreads(int dispatchThreads) { this.dispatchThreads = dispatchThreads; }
        public int getDispatchQueueCapacity() { return dispatchQueueCapacity; }
        public void setDispatchQueueCapacity(int dispatchQueueCapacity) { this.dispatchQueueCapacity = dispatchQueueCapacity; }
        public int getMaxViolationsPerWorkspace() { return maxViolationsPerWorkspace; }
        public void setMaxViolationsPerWorkspace(int maxViolationsPerWorkspace) { this.maxViolationsPerWorkspace = maxViolationsPerWorkspace; }
        public Duration getNetworkStatsInterval() { return networkStatsInterval; }
        public void setNetworkStatsInterval(Duration networkStatsInterval) { this.networkStatsInterval = networkStatsInterval; }
    }

    public static class Runtime {
        private String provider = "docker";

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
    }
}
