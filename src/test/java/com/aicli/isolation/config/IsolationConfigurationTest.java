package com.aicli.isolation.config;

import com.aicli.isolation.isolation.IsolationManager;
import com.aicli.isolation.monitor.MonitoringLifecycle;
import com.aicli.isolation.monitor.SecurityMonitor;
import com.aicli.isolation.monitor.SecurityMonitorHealthIndicator;
import com.aicli.isolation.monitor.detect.AnomalyDetector;
import com.aicli.isolation.network.NetworkManager;
import com.aicli.isolation.runtime.DockerContainerRemediator;
import com.aicli.isolation.runtime.DockerNetworkProvisioner;
import com.github.dockerjava.api.DockerClient;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.*;

class IsolationConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
            .withUserConfiguration(IsolationConfiguration.class, IsolationProperties.class)
            .withBean(MeterRegistry.class, SimpleMeterRegistry::new);

    @Test
    void wiresCoreComponentsWithoutRuntime() {
        runner.withPropertyValues("aicli.isolation.runtime.provider=none")
                .run(context -> {
                    assertNotNull(context.getBean(IsolationManager.class));
                    assertNotNull(context.getBean(NetworkManager.class));
                    assertEquals(3, context.getBeansOfType(AnomalyDetector.class).size());
                    assertTrue(context.getBeansOfType(DockerClient.class).isEmpty());
                    assertTrue(context.getBean(SecurityMonitor.class).isRunning());
                    assertNotNull(context.getBean(SecurityMonitorHealthIndicator.class));
                });
    }

    @Test
    void boundPropertiesReachThePolicy() {
        runner.withPropertyValues(
                        "aicli.isolation.runtime.provider=none",
                        "aicli.isolation.network.blocked-ports=2375,2376",
                        "aicli.isolation.resources.default-memory-limit-mb=1024")
                .run(context -> {
                    IsolationConfig config = context.getBean(IsolationPolicy.class).current();
                    assertTrue(config.isPortBlocked(2375));
                    assertFalse(config.isPortBlocked(22));
                    assertEquals(1024 * IsolationConfig.MIB, config.defaultMemoryLimit());
                });
    }

    @Test
    void disabledMonitorIsNotStarted() {
        runner.withPropertyValues(
                        "aicli.isolation.runtime.provider=none",
                        "aicli.isolation.monitor.enabled=false")
                .run(context -> {
                    assertTrue(context.getBeansOfType(MonitoringLifecycle.class).isEmpty());
                    assertTrue(context.getBeansOfType(SecurityMonitorHealthIndicator.class).isEmpty());
                    assertFalse(context.getBean(SecurityMonitor.class).isRunning());
                });
    }

    @Test
    void dockerRuntimeIsDefault() {
        runner.withPropertyValues("aicli.isolation.monitor.enabled=false")
                .run(context -> {
                    assertNotNull(context.getBean(DockerClient.class));
                    assertNotNull(context.getBean(DockerContainerRemediator.class));
                    assertNotNull(context.getBean(DockerNetworkProvisioner.class));
                });
    }
}
