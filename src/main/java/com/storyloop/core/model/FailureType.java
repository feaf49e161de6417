package com.storyloop.core.model;

import java.util.Locale;

/**
 * Category of a failed worker attempt. Transient categories are worth retrying;
 * the others indicate a defect that needs human or agent correction first.
 */
public enum FailureType {
    API_ERROR("api_error", true),
    TIMEOUT("timeout", true),
    RESOURCE_EXHAUSTION("resource_exhaustion", true),
    COORDINATOR_ERROR("coordinator_error", true),
    BUG("bug", false),
    LOGIC_ERROR("logic_error", false),
    QUALITY_GATE_FAILURE("quality_gate_failure", false),
    UNKNOWN("unknown", true);

    private final String code;
    private final boolean transientFailure;

    FailureType(String code, boolean transientFailure) {
        this.code = code;
        this.transientFailure = transientFailure;
    }

    /** Wire name used in the retry log, e.g. {@code "logic_error"}. */
    public String code() {
        return code;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    /**
     * Resolves a wire name or enum name. Unrecognised values map to {@link #UNKNOWN},
     * which is retried.
     */
    public static FailureType fromCode(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (FailureType type : values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
