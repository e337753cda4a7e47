package com.aicli.isolation.resource;

import java.util.Locale;

/**
 * Workload classification used to pick baseline limits.
 */
public enum WorkloadType {
    DEVELOPMENT,
    BUILD,
    TEST,
    PRODUCTION;

    /**
     * @return the matching type, or {@code null} for unknown names (callers keep the defaults)
     */
    public static WorkloadType fromName(String name) {
        if (name == null) {
            return null;
        }
        for (WorkloadType type : values()) {
            if (type.name().equals(name.trim().toUpperCase(Locale.ROOT))) {
                return type;
            }
        }
        return null;
    }
}
