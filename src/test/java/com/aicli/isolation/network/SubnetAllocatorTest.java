package com.aicli.isolation.network;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class SubnetAllocatorTest {

    private static final Pattern SUBNET = Pattern.compile("172\\.(2[0-3])\\.(\\d{1,3})\\.0/24");

    @Test
    @DisplayName("FNV-1a matches the published test vectors")
    void fnvVectors() {
        assertEquals(0x811c9dc5, SubnetAllocator.fnv1a32(""));
        assertEquals(0xe40c292c, SubnetAllocator.fnv1a32("a"));
        assertEquals(0xbf9cf968, SubnetAllocator.fnv1a32("foobar"));
    }

    @Test
    @DisplayName("same ID always maps to the same /24")
    void deterministic() {
        for (int i = 0; i < 200; i++) {
            String id = "workspace-" + i;
            String first = SubnetAllocator.allocate(id);
            assertEquals(first, SubnetAllocator.allocate(id));
            assertTrue(first.endsWith("/24"));
            assertTrue(SUBNET.matcher(first).matches(), first);
        }
    }

    @Test
    @DisplayName("every bucket maps to a distinct subnet")
    void bucketsAreDistinct() {
        var subnets = new HashSet<String>();
        for (int i = 0; i < 5000; i++) {
            int bucket = SubnetAllocator.bucket("id-" + i);
            assertTrue(bucket >= 0 && bucket < SubnetAllocator.BUCKETS);
            subnets.add(SubnetAllocator.allocate("id-" + i));
        }
        // 5000 random IDs over 1000 buckets land in (almost) every bucket
        assertTrue(subnets.size() > 900, "distinct subnets: " + subnets.size());
        assertTrue(subnets.size() <= SubnetAllocator.BUCKETS);
    }

    @Test
    @DisplayName("buckets past 255 spill into the 172.21 to 172.23 octets")
    void rangeSpansFourSecondOctets() {
        var secondOctets = new HashSet<String>();
        for (int i = 0; i < 5000; i++) {
            var matcher = SUBNET.matcher(SubnetAllocator.allocate("id-" + i));
            assertTrue(matcher.matches());
            secondOctets.add(matcher.group(1));
        }
        assertEquals(Set.of("20", "21", "22", "23"), secondOctets);
    }

    @Test
    @DisplayName("gateway is the .1 host of the network address")
    void gateway() {
        assertEquals("172.20.5.1", SubnetAllocator.gatewayFor("172.20.5.0/24"));
        assertEquals("172.21.232.1", SubnetAllocator.gatewayFor("172.21.232.0/24"));
        assertEquals("10.0.0.1", SubnetAllocator.gatewayFor("10.0.0.77/24"));
    }

    @Test
    @DisplayName("malformed subnets yield an empty gateway")
    void malformedGateway() {
        assertEquals("", SubnetAllocator.gatewayFor(null));
        assertEquals("", SubnetAllocator.gatewayFor("not-a-subnet"));
        assertEquals("", SubnetAllocator.gatewayFor("172.20.5.0"));
        assertEquals("", SubnetAllocator.gatewayFor("172.20.5.0/"));
        assertEquals("", SubnetAllocator.gatewayFor("172.20.300.0/24"));
        assertEquals("", SubnetAllocator.gatewayFor("172.20.5.0/33"));
    }
}
