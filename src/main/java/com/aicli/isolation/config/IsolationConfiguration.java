package com.aicli.isolation.config;

import com.aicli.isolation.core.logging.SecurityAuditLog;
import com.aicli.isolation.core.metrics.IsolationMetrics;
import com.aicli.isolation.isolation.IsolationManager;
import com.aicli.isolation.monitor.ContainerRemediator;
import com.aicli.isolation.monitor.MonitoringLifecycle;
import com.aicli.isolation.monitor.SecurityMonitor;
import com.aicli.isolation.monitor.SecurityMonitorHealthIndicator;
import com.aicli.isolation.monitor.WorkspaceMetricsSource;
import com.aicli.isolation.monitor.detect.AnomalyDetector;
import com.aicli.isolation.monitor.detect.FileAccessEventSource;
import com.aicli.isolation.monitor.detect.NetworkTrafficDetector;
import com.aicli.isolation.monitor.detect.ProcessAnomalyDetector;
import com.aicli.isolation.monitor.detect.SensitiveFileAccessDetector;
import com.aicli.isolation.network.NetworkManager;
import com.aicli.isolation.network.NetworkStatsSource;
import com.aicli.isolation.resource.ResourceManager;
import com.aicli.isolation.runtime.DockerContainerRemediator;
import com.aicli.isolation.runtime.DockerNetworkProvisioner;
import com.aicli.isolation.runtime.DockerNetworkStatsSource;
import com.aicli.isolation.runtime.DockerWorkspaceMetricsSource;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class IsolationConfiguration {

    private static final String DEFAULT_UNIX_SOCKET = "unix:///var/run/docker.sock";

    @Bean
    public IsolationPolicy isolationPolicy(IsolationProperties properties) {
        return new IsolationPolicy(properties.toIsolationConfig());
    }

    @Bean
    public IsolationMetrics isolationMetrics(MeterRegistry registry) {
        return new IsolationMetrics(registry);
    }

    @Bean
    public SecurityAuditLog securityAuditLog(IsolationProperties properties) {
        var auditLog = new SecurityAuditLog();
        auditLog.setEnabled(properties.getAudit().isEnabled());
        return auditLog;
    }

    @Bean
    public ResourceManager resourceManager(IsolationPolicy policy) {
        return new ResourceManager(policy);
    }

    @Bean
    public NetworkManager networkManager(IsolationPolicy policy, IsolationProperties properties,
                                         @Autowired(required = false) NetworkStatsSource statsSource) {
        return new NetworkManager(policy,
                statsSource != null ? statsSource : NetworkStatsSource.NONE,
                properties.getMonitor().getNetworkStatsInterval());
    }

    @Bean
    public IsolationManager isolationManager(IsolationPolicy policy, ResourceManager resourceManager,
                                             @Autowired(required = false) IsolationMetrics metrics) {
        return new IsolationManager(policy, resourceManager, metrics);
    }

    // -- Detectors ------------------------------------------------------------

    @Bean
    public NetworkTrafficDetector networkTrafficDetector() {
        return new NetworkTrafficDetector();
    }

    @Bean
    public ProcessAnomalyDetector processAnomalyDetector() {
        return new ProcessAnomalyDetector();
    }

    @Bean
    public SensitiveFileAccessDetector sensitiveFileAccessDetector(
            @Autowired(required = false) FileAccessEventSource eventSource) {
        return new SensitiveFileAccessDetector(eventSource != null ? eventSource : FileAccessEventSource.NONE);
    }

    @Bean
    public SecurityMonitor securityMonitor(IsolationPolicy policy,
                                           ResourceManager resourceManager,
                                           IsolationProperties properties,
                                           List<AnomalyDetector> detectors,
                                           SecurityAuditLog auditLog,
                                           @Autowired(required = false) WorkspaceMetricsSource metricsSource,
                                           @Autowired(required = false) ContainerRemediator remediator,
                                           @Autowired(required = false) IsolationMetrics metrics) {
        return new SecurityMonitor(policy, resourceManager, properties.getMonitor().toOptions(),
                metricsSource, detectors, remediator, auditLog, metrics);
    }

    @Bean
    @ConditionalOnProperty(prefix = "aicli.isolation.monitor", name = "enabled", havingValue = "true", matchIfMissing = true)
    public MonitoringLifecycle monitoringLifecycle(SecurityMonitor monitor, SecurityAuditLog auditLog) {
        return new MonitoringLifecycle(monitor, auditLog);
    }

    @Bean("securityMonitorHealthIndicator")
    @ConditionalOnProperty(prefix = "aicli.isolation.monitor", name = "enabled", havingValue = "true", matchIfMissing = true)
    public SecurityMonitorHealthIndicator securityMonitorHealthIndicator(SecurityMonitor monitor) {
        return new SecurityMonitorHealthIndicator(monitor);
    }

    // -- Docker runtime -------------------------------------------------------

    @Bean
    @ConditionalOnProperty(name = "aicli.isolation.runtime.provider", havingValue = "docker", matchIfMissing = true)
    public DockerClient dockerClient() {
        String dockerHost = System.getenv().getOrDefault("DOCKER_HOST", DEFAULT_UNIX_SOCKET);
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    @ConditionalOnProperty(name = "aicli.isolation.runtime.provider", havingValue = "docker", matchIfMissing = true)
    public DockerNetworkStatsSource dockerNetworkStatsSource(DockerClient dockerClient) {
        return new DockerNetworkStatsSource(dockerClient);
    }

    @Bean
    @ConditionalOnProperty(name = "aicli.isolation.runtime.provider", havingValue = "docker", matchIfMissing = true)
    public DockerWorkspaceMetricsSource dockerWorkspaceMetricsSource(DockerClient dockerClient) {
        return new DockerWorkspaceMetricsSource(dockerClient);
    }

    @Bean
    @ConditionalOnProperty(name = "aicli.isolation.runtime.provider", havingValue = "docker", matchIfMissing = true)
    public DockerContainerRemediator dockerContainerRemediator(DockerClient dockerClient) {
        return new DockerContainerRemediator(dockerClient);
    }

    @Bean
    @ConditionalOnProperty(name = "aicli.isolation.runtime.provider", havingValue = "docker", matchIfMissing = true)
    public DockerNetworkProvisioner dockerNetworkProvisioner(DockerClient dockerClient, NetworkManager networkManager) {
        return new DockerNetworkProvisioner(dockerClient, networkManager);
    }
}
