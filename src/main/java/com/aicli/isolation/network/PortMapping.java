package com.aicli.isolation.network;

import com.github.dockerjava.api.model.ExposedPort;
import com.github.dockerjava.api.model.Ports;

import java.util.List;

/**
 * Validated port configuration ready for a container-create call.
 *
 * @param exposedPorts container ports to expose
 * @param portBindings host bindings, empty unless binding to the host was requested
 */
public record PortMapping(
    List<ExposedPort> exposedPorts,
    Ports portBindings
) {

    public PortMapping {
        exposedPorts = exposedPorts != null ? List.copyOf(exposedPorts) : List.of();
        portBindings = portBindings != null ? portBindings : new Ports();
    }
}
