package com.ptcg.engine.rules;

import java.util.List;

/**
 * Outcome of submitting an action. An accepted action may still carry warnings.
 */
public record ActionResult(boolean accepted, List<RuleViolation> violations) {
    public ActionResult {
        violations = List.copyOf(violations);
    }

    public static ActionResult accepted(List<RuleViolation> warnings) {
        return new ActionResult(true, warnings);
    }

    public static ActionResult rejected(List<RuleViolation> violations) {
        return new ActionResult(false, violations);
    }

    public static ActionResult rejected(RuleViolation violation) {
        return new ActionResult(false, List.of(violation));
    }

    public boolean hasViolation(String ruleName) {
        return violations.stream().anyMatch(v -> v.ruleName().equals(ruleName));
    }
}
