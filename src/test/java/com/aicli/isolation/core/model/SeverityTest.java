package com.aicli.isolation.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SeverityTest {

    @Test
    void orderedByImpact() {
        assertTrue(Severity.CRITICAL.isAtLeast(Severity.ERROR));
        assertTrue(Severity.WARNING.isAtLeast(Severity.WARNING));
        assertFalse(Severity.INFO.isAtLeast(Severity.WARNING));
    }

    @Test
    void parsesLowercaseValues() {
        assertEquals(Severity.ERROR, Severity.fromValue("error"));
        assertEquals(Severity.CRITICAL, Severity.fromValue(" Critical "));
        assertEquals(Severity.INFO, Severity.fromValue(null));
        assertThrows(IllegalArgumentException.class, () -> Severity.fromValue("fatal"));
    }

    @Test
    void serialisesAsLowercase() throws Exception {
        var mapper = new ObjectMapper();

        assertEquals("\"warning\"", mapper.writeValueAsString(Severity.WARNING));
        assertEquals(Severity.CRITICAL, mapper.readValue("\"critical\"", Severity.class));
    }
}
