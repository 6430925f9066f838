package com.ptcg.engine.effects;

import com.ptcg.engine.card.Card;
import com.ptcg.engine.card.EnergyType;
import com.ptcg.engine.game.Game;
import com.ptcg.engine.player.Player;

import java.util.UUID;

/**
 * A condition a target card must meet for an effect to apply to it.
 * Zone and state checks read the given owner's copy of the card.
 */
public sealed interface TargetRequirement permits TargetRequirement.Pokemon, TargetRequirement.Energy,
        TargetRequirement.Trainer, TargetRequirement.InPlay, TargetRequirement.InHand, TargetRequirement.InDiscard,
        TargetRequirement.OwnedBy, TargetRequirement.HasEnergyType, TargetRequirement.MinHp,
        TargetRequirement.MinDamage {

    /**
     * @param owner the player whose copy is checked, null when no player holds the card
     */
    boolean isSatisfiedBy(Game game, UUID cardId, Player owner);

    /**
     * Check the copy held by {@link Game#findOwner(UUID)}.
     */
    default boolean isSatisfiedBy(Game game, UUID cardId) {
        return isSatisfiedBy(game, cardId, game.findOwner(cardId).orElse(null));
    }

    default boolean isSatisfiedBy(Game game, EffectTarget.Resolved target) {
        return isSatisfiedBy(game, target.cardId(), target.owner());
    }

    record Pokemon() implements TargetRequirement {
        @Override
        public boolean isSatisfiedBy(Game game, UUID cardId, Player owner) {
            return game.getCardDatabase().findCard(cardId).map(Card::isPokemon).orElse(false);
        }
    }

    record Energy() implements TargetRequirement {
        @Override
        public boolean isSatisfiedBy(Game game, UUID cardId, Player owner) {
            return game.getCardDatabase().findCard(cardId).map(Card::isEnergy).orElse(false);
        }
    }

    record Trainer() implements TargetRequirement {
        @Override
        public boolean isSatisfiedBy(Game game, UUID cardId, Player owner) {
            return game.getCardDatabase().findCard(cardId).map(Card::isTrainer).orElse(false);
        }
    }

    record InPlay() implements TargetRequirement {
        @Override
        public boolean isSatisfiedBy(Game game, UUID cardId, Player owner) {
            return owner != null && owner.isInPlay(cardId);
        }
    }

    record InHand() implements TargetRequirement {
        @Override
        public boolean isSatisfiedBy(Game game, UUID cardId, Player owner) {
            return owner != null && owner.getHand().contains(cardId);
        }
    }

    record InDiscard() implements TargetRequirement {
        @Override
        public boolean isSatisfiedBy(Game game, UUID cardId, Player owner) {
            return owner != null && owner.getDiscardPile().contains(cardId);
        }
    }

    record OwnedBy(UUID playerId) implements TargetRequirement {
        @Override
        public boolean isSatisfiedBy(Game game, UUID cardId, Player owner) {
            return owner != null && owner.getId().equals(playerId);
        }
    }

    /** The Pokemon has at least one energy of this type attached. */
    record HasEnergyType(EnergyType energyType) implements TargetRequirement {
        @Override
        public boolean isSatisfiedBy(Game game, UUID cardId, Player owner) {
            return owner != null && owner.isInPlay(cardId)
                    && owner.getAttachedEnergyTypes(cardId, game.getCardDatabase()).contains(energyType);
        }
    }

    record MinHp(int hp) implements TargetRequirement {
        @Override
        public boolean isSatisfiedBy(Game game, UUID cardId, Player owner) {
            return game.getCardDatabase().findCard(cardId).map(c -> c.getHp() >= hp).orElse(false);
        }
    }

    record MinDamage(int damage) implements TargetRequirement {
        @Override
        public boolean isSatisfiedBy(Game game, UUID cardId, Player owner) {
            return owner != null && owner.isInPlay(cardId) && owner.getDamage(cardId) >= damage;
        }
    }
}
