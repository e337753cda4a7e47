package com.aicli.isolation.monitor;

import com.aicli.isolation.core.model.Severity;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class BreachTypeTest {

    @Test
    void knownValuesResolve() {
        for (BreachType type : BreachType.values()) {
            assertEquals(type, BreachType.fromValue(type.value()));
        }
        assertEquals(BreachType.PRIVILEGE_ESCALATION, BreachType.fromValue("privilege_escalation"));
    }

    @Test
    void unknownOrMissingFallsBackToGeneric() {
        assertEquals(BreachType.GENERIC, BreachType.fromValue("crypto_mining"));
        assertEquals(BreachType.GENERIC, BreachType.fromValue(null));
    }

    @Test
    void breachCarriesWireTypeName() {
        var breach = SecurityBreach.of(BreachType.RESOURCE_EXHAUSTION, "fork bomb", null, Severity.ERROR);

        assertEquals("resource_exhaustion", breach.type());
        assertEquals(BreachType.RESOURCE_EXHAUSTION, breach.breachType());
        assertNotNull(breach.timestamp());
        assertEquals(BreachType.GENERIC,
                new SecurityBreach("other", "x", null, Severity.INFO, Instant.now()).breachType());
    }
}
