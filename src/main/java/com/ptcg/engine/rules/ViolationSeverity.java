package com.ptcg.engine.rules;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How serious a rule violation is. Ordered from least to most severe.
 */
public enum ViolationSeverity {
    /** Reported, but the action may go ahead. */
    WARNING("warning"),
    ERROR("error"),
    FATAL("fatal");

    private final String jsonValue;

    ViolationSeverity(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    /**
     * ERROR and FATAL stop an action.
     */
    public boolean isBlocking() {
        return this != WARNING;
    }

    public boolean isAtLeast(ViolationSeverity other) {
        return compareTo(other) >= 0;
    }
}
