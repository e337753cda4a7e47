package com.aicli.isolation.monitor;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AlertType {
    RESOURCE_VIOLATION,
    SECURITY_BREACH,
    NETWORK_ANOMALY,
    PROCESS_ANOMALY;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
