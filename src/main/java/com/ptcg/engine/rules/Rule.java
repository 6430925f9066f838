package com.ptcg.engine.rules;

import com.ptcg.engine.game.Game;

import java.util.Optional;

/**
 * One independent check on a prospective action.
 */
public interface Rule {

    /**
     * Unique name, used as the violation's rule name.
     */
    String name();

    /**
     * Check an action. Must not change the game.
     * @return the violation, or empty if the rule has no objection
     */
    Optional<RuleViolation> validate(Game game, GameAction action);

    /**
     * Side effect run after every rule has accepted the action and before the action is carried out.
     * {@link com.ptcg.engine.game.ActionExecutor} runs hooks only once the live-state checks pass.
     * A hook that reports a violation must leave the game unchanged.
     */
    default Optional<RuleViolation> applyEffect(Game game, GameAction action) {
        return Optional.empty();
    }
}
