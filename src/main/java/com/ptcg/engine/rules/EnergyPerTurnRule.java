package com.ptcg.engine.rules;

import com.ptcg.engine.game.Game;

import java.util.Optional;

/**
 * One energy attachment per turn.
 */
public class EnergyPerTurnRule implements Rule {
    public static final String NAME = "EnergyPerTurn";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<RuleViolation> validate(Game game, GameAction action) {
        if (!(action instanceof GameAction.AttachEnergy)) {
            return Optional.empty();
        }
        boolean alreadyAttached = game.findPlayer(action.playerId())
                .map(p -> p.isEnergyAttachedThisTurn())
                .orElse(false);
        if (alreadyAttached) {
            return Optional.of(RuleViolation.error(NAME, "Energy already attached this turn"));
        }
        return Optional.empty();
    }
}
