package com.aicli.isolation.runtime;

import com.aicli.isolation.IsolationException;
import com.aicli.isolation.resource.ResourceLimits;
import com.aicli.isolation.resource.ResourcePreset;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.DisconnectFromNetworkCmd;
import com.github.dockerjava.api.command.ListContainersCmd;
import com.github.dockerjava.api.command.PauseContainerCmd;
import com.github.dockerjava.api.command.UpdateContainerCmd;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.Container;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Docker's fluent commands are mocked one by one so each call in the chain can be verified.
 */
class DockerContainerRemediatorTest {

    private DockerClient dockerClient;
    private ListContainersCmd listCmd;
    private DockerContainerRemediator remediator;

    @BeforeEach
    void setUp() {
        dockerClient = mock(DockerClient.class);
        listCmd = mock(ListContainersCmd.class, RETURNS_SELF);
        when(dockerClient.listContainersCmd()).thenReturn(listCmd);
        remediator = new DockerContainerRemediator(dockerClient);
    }

    private void mockContainers(String... ids) {
        List<Container> containers = new ArrayList<>();
        for (String id : ids) {
            var container = mock(Container.class);
            when(container.getId()).thenReturn(id);
            containers.add(container);
        }
        when(listCmd.exec()).thenReturn(containers);
    }

    @Test
    void containersAreFoundByWorkspaceLabel() {
        mockContainers("c1");

        var containers = remediator.containersFor("ws-1", "pause");

        assertEquals(1, containers.size());
        verify(listCmd).withShowAll(true);
        verify(listCmd).withLabelFilter(Map.of("aicli.workspace.id", "ws-1"));
    }

    @Test
    void missingContainersFailTheOperation() {
        mockContainers();

        var ex = assertThrows(RuntimeOperationException.class, () -> remediator.pauseWorkspace("ws-1"));

        assertEquals("pause", ex.getOperation());
        assertEquals("ws-1", ex.getTarget());
        assertEquals("pause failed for ws-1: no containers labelled for workspace", ex.getMessage());
    }

    @Test
    void pausePausesEveryContainer() {
        mockContainers("c1", "c2");
        var pause1 = mock(PauseContainerCmd.class);
        var pause2 = mock(PauseContainerCmd.class);
        when(dockerClient.pauseContainerCmd("c1")).thenReturn(pause1);
        when(dockerClient.pauseContainerCmd("c2")).thenReturn(pause2);

        remediator.pauseWorkspace("ws-1");

        verify(pause1).exec();
        verify(pause2).exec();
    }

    @Test
    void pauseFailureIsWrapped() {
        mockContainers("c1");
        var pause = mock(PauseContainerCmd.class);
        when(dockerClient.pauseContainerCmd("c1")).thenReturn(pause);
        when(pause.exec()).thenThrow(new DockerException("conflict", 409));

        var ex = assertThrows(RuntimeOperationException.class, () -> remediator.pauseWorkspace("ws-1"));

        assertInstanceOf(DockerException.class, ex.getCause());
    }

    @Test
    void restrictDisconnectsFromWorkspaceNetwork() {
        mockContainers("c1");
        var disconnect = mock(DisconnectFromNetworkCmd.class, RETURNS_SELF);
        when(dockerClient.disconnectFromNetworkCmd()).thenReturn(disconnect);

        remediator.restrictNetwork("ws-1");

        verify(disconnect).withNetworkId("aicli-workspace-ws-1");
        verify(disconnect).withContainerId("c1");
        verify(disconnect).withForce(true);
        verify(disconnect).exec();
    }

    @Test
    void restrictToleratesDetachedContainer() {
        mockContainers("c1");
        var disconnect = mock(DisconnectFromNetworkCmd.class, RETURNS_SELF);
        when(dockerClient.disconnectFromNetworkCmd()).thenReturn(disconnect);
        when(disconnect.exec()).thenThrow(new NotFoundException("not attached"));

        assertDoesNotThrow(() -> remediator.restrictNetwork("ws-1"));
    }

    @Test
    void applyResourceLimitsUpdatesContainer() {
        mockContainers("c1");
        var update = mock(UpdateContainerCmd.class, RETURNS_SELF);
        when(dockerClient.updateContainerCmd("c1")).thenReturn(update);
        var minimal = ResourcePreset.MINIMAL.toLimits();

        remediator.applyResourceLimits("ws-1", minimal);

        verify(update).withCpuQuota(Math.toIntExact(minimal.cpuQuota()));
        verify(update).withCpuPeriod(Math.toIntExact(minimal.cpuPeriod()));
        verify(update).withMemory(minimal.memory());
        verify(update).withMemorySwap(minimal.memorySwap());
        verify(update).exec();
    }

    @Test
    void cpuSharesBeyondIntRangeAreRejectedBeforeUpdating() {
        mockContainers("c1");
        var oversized = new ResourceLimits(3_000_000_000L, 100_000, 100_000,
                512L * 1024 * 1024, 512L * 1024 * 1024, 100, "100m", 1000);

        var ex = assertThrows(IsolationException.class,
                () -> remediator.applyResourceLimits("ws-1", oversized));

        assertEquals(IsolationException.Category.INVALID_INPUT, ex.getCategory());
        verify(dockerClient, never()).updateContainerCmd(anyString());
    }
}
