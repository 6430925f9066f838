package com.ptcg.engine.rules;

import com.ptcg.engine.game.Game;

import java.util.Optional;

/**
 * Only the current player may act.
 */
public class TurnOrderRule implements Rule {
    public static final String NAME = "TurnOrder";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<RuleViolation> validate(Game game, GameAction action) {
        if (game.isCurrentPlayer(action.playerId())) {
            return Optional.empty();
        }
        return Optional.of(RuleViolation.error(NAME, "Not your turn"));
    }
}
