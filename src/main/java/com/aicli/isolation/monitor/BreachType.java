package com.aicli.isolation.monitor;

import java.util.Locale;

/**
 * Breach classes with a dedicated response. Anything else is handled as {@link #GENERIC}.
 */
public enum BreachType {
    PRIVILEGE_ESCALATION,
    SUSPICIOUS_NETWORK_ACTIVITY,
    UNAUTHORIZED_FILE_ACCESS,
    RESOURCE_EXHAUSTION,
    GENERIC;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static BreachType fromValue(String value) {
        if (value == null) {
            return GENERIC;
        }
        for (BreachType type : values()) {
            if (type != GENERIC && type.value().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return type;
            }
        }
        return GENERIC;
    }
}
