package com.ptcg.engine.rules;

import com.ptcg.engine.card.Card;
import com.ptcg.engine.game.Game;
import com.ptcg.engine.player.Player;

import java.util.Optional;

/**
 * The attached card must be an Energy in the player's hand, going onto one of their Pokemon in play.
 */
public class EnergyAttachmentRule implements Rule {
    public static final String NAME = "EnergyAttachment";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<RuleViolation> validate(Game game, GameAction action) {
        if (!(action instanceof GameAction.AttachEnergy attach)) {
            return Optional.empty();
        }
        Optional<Player> found = game.findPlayer(attach.playerId());
        if (found.isEmpty()) {
            return Optional.of(RuleViolation.error(NAME, "Player not found"));
        }
        Player player = found.get();
        if (!player.getHand().contains(attach.energyId())) {
            return Optional.of(RuleViolation.error(NAME, "Energy card is not in hand"));
        }
        boolean isEnergy = game.getCardDatabase().findCard(attach.energyId()).map(Card::isEnergy).orElse(false);
        if (!isEnergy) {
            return Optional.of(RuleViolation.error(NAME, "Card is not an Energy card"));
        }
        if (!player.isInPlay(attach.pokemonId())) {
            return Optional.of(RuleViolation.error(NAME, "Target Pokemon is not in play"));
        }
        return Optional.empty();
    }
}
