package com.aicli.isolation.isolation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IsolationLevel {
    BASIC,
    STANDARD,
    STRICT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
