package com.aicli.isolation.network;

import java.util.Map;

/**
 * Requested port publications.
 *
 * @param portMappings host port to container port, each optionally suffixed {@code /tcp} or {@code /udp}
 * @param hostIp       interface to bind on the host, blank for all interfaces
 * @param bindToHost   publish the ports on the host, otherwise only expose them
 */
public record PortMappingRequest(
    Map<String, String> portMappings,
    String hostIp,
    boolean bindToHost
) {}
