package com.ptcg.engine.rules;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Why a rule objects to an action.
 */
public record RuleViolation(
    @JsonProperty("rule_name") String ruleName,
    @JsonProperty("message") String message,
    @JsonProperty("severity") ViolationSeverity severity
) {
    public static RuleViolation error(String ruleName, String message) {
        return new RuleViolation(ruleName, message, ViolationSeverity.ERROR);
    }

    public static RuleViolation warning(String ruleName, String message) {
        return new RuleViolation(ruleName, message, ViolationSeverity.WARNING);
    }

    @JsonIgnore
    public boolean isBlocking() {
        return severity.isBlocking();
    }
}
