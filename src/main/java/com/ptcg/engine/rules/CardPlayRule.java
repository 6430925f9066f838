package com.ptcg.engine.rules;

import com.ptcg.engine.card.Card;
import com.ptcg.engine.card.CardKind;
import com.ptcg.engine.card.TrainerType;
import com.ptcg.engine.game.Game;
import com.ptcg.engine.player.Player;

import java.util.Optional;

/**
 * Playing a card from the hand: Basic Pokemon go to a bench with room, Energy is
 * attached rather than played, and only one Supporter per turn.
 */
public class CardPlayRule implements Rule {
    public static final String NAME = "CardPlay";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<RuleViolation> validate(Game game, GameAction action) {
        if (!(action instanceof GameAction.PlayCard play)) {
            return Optional.empty();
        }
        Optional<Player> found = game.findPlayer(play.playerId());
        if (found.isEmpty()) {
            return Optional.of(RuleViolation.error(NAME, "Player not found"));
        }
        Player player = found.get();
        if (!player.getHand().contains(play.cardId())) {
            return Optional.of(RuleViolation.error(NAME, "Card is not in hand"));
        }
        Optional<Card> card = game.getCardDatabase().findCard(play.cardId());
        if (card.isEmpty()) {
            return Optional.of(RuleViolation.error(NAME, "Card not found in database"));
        }

        CardKind kind = card.get().getKind();
        if (kind instanceof CardKind.Pokemon) {
            if (!card.get().isBasicPokemon()) {
                return Optional.of(RuleViolation.error(NAME, card.get().getName() + " is not a Basic Pokemon"));
            }
            if (player.getBench().isFull()) {
                return Optional.of(RuleViolation.error(NAME, "Bench is full"));
            }
        } else if (kind instanceof CardKind.Energy) {
            return Optional.of(RuleViolation.error(NAME, "Energy cards are attached, not played"));
        } else if (kind instanceof CardKind.Trainer trainer) {
            if (trainer.trainerType() == TrainerType.SUPPORTER && player.isSupporterPlayedThisTurn()) {
                return Optional.of(RuleViolation.error(NAME, "A Supporter has already been played this turn"));
            }
        }
        return Optional.empty();
    }
}
