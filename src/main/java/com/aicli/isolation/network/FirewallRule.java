package com.aicli.isolation.network;

/**
 * One allow or block rule of a {@link NetworkSecurityPolicy}.
 *
 * @param protocol    tcp, udp or icmp
 * @param source      IP address or CIDR, blank for any
 * @param destination IP address or CIDR, blank for any
 * @param port        port number, blank for any
 * @param action      allow or deny
 * @param priority    evaluation order, lower first
 */
public record FirewallRule(
    String protocol,
    String source,
    String destination,
    String port,
    String action,
    int priority
) {

    public static FirewallRule allow(String protocol, String source, String port) {
        return new FirewallRule(protocol, source, "", port, "allow", 0);
    }

    public static FirewallRule deny(String protocol, String source, String port) {
        return new FirewallRule(protocol, source, "", port, "deny", 0);
    }
}
