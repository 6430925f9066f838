package com.ptcg.engine.rules;

import com.ptcg.engine.game.Game;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered set of rules checked against every action.
 */
public class RuleEngine {
    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final List<Rule> rules = new ArrayList<>();
    private final RuleConfig config;

    public RuleEngine() {
        this(RuleConfig.defaults());
    }

    public RuleEngine(RuleConfig config) {
        this.config = config;
    }

    public void addRule(Rule rule) {
        rules.add(rule);
    }

    /**
     * Remove every rule with the given name.
     */
    public boolean removeRule(String ruleName) {
        return rules.removeIf(rule -> rule.name().equals(ruleName));
    }

    /**
     * Run every rule in order and collect violations at or above the configured minimum severity.
     */
    public List<RuleViolation> validateAction(Game game, GameAction action) {
        List<RuleViolation> violations = new ArrayList<>();
        for (Rule rule : rules) {
            Optional<RuleViolation> violation = rule.validate(game, action);
            if (violation.isEmpty() || !violation.get().severity().isAtLeast(config.minSeverity())) {
                continue;
            }
            violations.add(violation.get());
            if (config.stopOnFirstViolation()) {
                break;
            }
        }
        return violations;
    }

    /**
     * Validate without running any hook. Any ERROR or FATAL violation rejects the action.
     */
    public ActionResult checkAction(Game game, GameAction action) {
        List<RuleViolation> violations = validateAction(game, action);
        if (violations.stream().anyMatch(RuleViolation::isBlocking)) {
            log.debug("action-rejected action={} violations={}", action.getClass().getSimpleName(), violations);
            return ActionResult.rejected(violations);
        }
        return ActionResult.accepted(violations);
    }

    /**
     * Run the rules' effect hooks in order, when the config enables them.
     *
     * @return the first hook failure; hooks after it do not run
     */
    public Optional<RuleViolation> applyEffects(Game game, GameAction action) {
        if (!config.autoApplyEffects()) {
            return Optional.empty();
        }
        for (Rule rule : rules) {
            Optional<RuleViolation> failure = rule.applyEffect(game, action);
            if (failure.isPresent()) {
                log.debug("rule-effect-failed action={} rule={}", action.getClass().getSimpleName(), rule.name());
                return failure;
            }
        }
        return Optional.empty();
    }

    /**
     * Validate, then run the rules' effect hooks.
     * A blocking violation rejects the action before any hook runs;
     * a failing hook rejects it with that violation alone.
     */
    public ActionResult applyAction(Game game, GameAction action) {
        ActionResult checked = checkAction(game, action);
        if (!checked.accepted()) {
            return checked;
        }
        Optional<RuleViolation> failure = applyEffects(game, action);
        if (failure.isPresent()) {
            return ActionResult.rejected(failure.get());
        }
        return checked;
    }

    public List<String> getRuleNames() {
        List<String> names = new ArrayList<>(rules.size());
        for (Rule rule : rules) {
            names.add(rule.name());
        }
        return names;
    }

    public boolean hasRule(String ruleName) {
        return rules.stream().anyMatch(rule -> rule.name().equals(ruleName));
    }

    public RuleConfig getConfig() {
        return config;
    }
}
