package com.aicli.isolation.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity shared by resource violations, breaches and alerts. Declared in ascending order.
 */
public enum Severity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromValue(String value) {
        if (value == null || value.isBlank()) {
            return INFO;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
