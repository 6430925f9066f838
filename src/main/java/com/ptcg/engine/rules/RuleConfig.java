package com.ptcg.engine.rules;

/**
 * Rule engine behaviour.
 *
 * @param stopOnFirstViolation stop validating at the first reported violation
 * @param autoApplyEffects     run rule effect hooks when an action is applied
 * @param minSeverity          violations below this severity are dropped
 */
public record RuleConfig(boolean stopOnFirstViolation, boolean autoApplyEffects, ViolationSeverity minSeverity) {

    public RuleConfig {
        if (minSeverity == null) {
            minSeverity = ViolationSeverity.WARNING;
        }
    }

    public static RuleConfig defaults() {
        return new RuleConfig(false, true, ViolationSeverity.WARNING);
    }
}
