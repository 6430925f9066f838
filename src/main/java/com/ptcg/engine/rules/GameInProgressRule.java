package com.ptcg.engine.rules;

import com.ptcg.engine.game.Game;

import java.util.Optional;

/**
 * Actions are only accepted while the match is being played.
 */
public class GameInProgressRule implements Rule {
    public static final String NAME = "GameInProgress";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<RuleViolation> validate(Game game, GameAction action) {
        if (game.isInProgress()) {
            return Optional.empty();
        }
        return Optional.of(RuleViolation.error(NAME, "Game is not in progress (status " + game.getStatus() + ")"));
    }
}
