package com.ptcg.engine.rules;

import com.ptcg.engine.game.Game;
import com.ptcg.engine.player.Player;

import java.util.Optional;

/**
 * Refuses a draw once the hand has reached the configured maximum size. No limit when none is set.
 */
public class HandLimitRule implements Rule {
    public static final String NAME = "HandLimit";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<RuleViolation> validate(Game game, GameAction action) {
        Integer maxHandSize = game.getRules().maxHandSize();
        if (maxHandSize == null || !(action instanceof GameAction.DrawCard)) {
            return Optional.empty();
        }
        Optional<Player> player = game.findPlayer(action.playerId());
        if (player.isPresent() && player.get().getHand().size() >= maxHandSize) {
            return Optional.of(RuleViolation.error(NAME,
                    "Hand already holds " + player.get().getHand().size() + " cards (limit " + maxHandSize + ")"));
        }
        return Optional.empty();
    }
}
