package com.aicli.isolation.network;

import java.nio.charset.StandardCharsets;

/**
 * Deterministic workspace-to-subnet mapping. The subnet is a pure function of the workspace ID,
 * so repeated lookups agree without an allocation table.
 *
 * <p>The ID is hashed with 32-bit FNV-1a and reduced to one of {@value #BUCKETS} buckets. Bucket
 * {@code n} maps to {@code 172.(20 + n / 256).(n % 256).0/24}, which keeps every bucket a distinct
 * /24 inside 172.20.0.0/14. A single 172.20.x.0/24 octet only has room for 256 buckets, so the
 * range deliberately spans 172.20 through 172.23 rather than staying within 172.20.0.0/16.
 * Distinct IDs can still share a bucket; {@link NetworkManager} reports such collisions.
 */
public final class SubnetAllocator {

    static final int BUCKETS = 1000;

    private static final int FNV_OFFSET_BASIS = 0x811c9dc5;
    private static final int FNV_PRIME = 0x01000193;

    private SubnetAllocator() {}

    public static String allocate(String workspaceId) {
        int bucket = bucket(workspaceId);
        return "172." + (20 + bucket / 256) + "." + (bucket % 256) + ".0/24";
    }

    static int bucket(String workspaceId) {
        return (int) (Integer.toUnsignedLong(fnv1a32(workspaceId)) % BUCKETS);
    }

    static int fnv1a32(String value) {
        int hash = FNV_OFFSET_BASIS;
        for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return hash;
    }

    /**
     * First host address of an IPv4 CIDR block, e.g. {@code 172.20.5.0/24 -> 172.20.5.1}.
     *
     * @return the gateway, or an empty string when the subnet cannot be parsed
     */
    public static String gatewayFor(String subnet) {
        if (subnet == null) {
            return "";
        }
        int slash = subnet.indexOf('/');
        if (slash <= 0 || slash == subnet.length() - 1) {
            return "";
        }
        int prefix;
        try {
            prefix = Integer.parseInt(subnet.substring(slash + 1));
        } catch (NumberFormatException e) {
            return "";
        }
        if (prefix < 0 || prefix > 32) {
            return "";
        }
        int[] octets = parseIpv4(subnet.substring(0, slash));
        if (octets == null) {
            return "";
        }
        long address = 0;
        for (int octet : octets) {
            address = (address << 8) | octet;
        }
        long mask = prefix == 0 ? 0 : (0xffffffffL << (32 - prefix)) & 0xffffffffL;
        long network = address & mask;
        long gateway = (network & 0xffffff00L) | 1;
        return ((gateway >> 24) & 0xff) + "." + ((gateway >> 16) & 0xff) + "."
                + ((gateway >> 8) & 0xff) + "." + (gateway & 0xff);
    }

    static int[] parseIpv4(String address) {
        String[] parts = address.split("\\.", -1);
        if (parts.length != 4) {
            return null;
        }
        int[] octets = new int[4];
        for (int i = 0; i < 4; i++) {
            String part = parts[i];
            if (part.isEmpty() || part.length() > 3 || !part.chars().allMatch(Character::isDigit)) {
                return null;
            }
            int value = Integer.parseInt(part);
            if (value > 255) {
                return null;
            }
            octets[i] = value;
        }
        return octets;
    }
}
