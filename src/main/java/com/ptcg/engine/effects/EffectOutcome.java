package com.ptcg.engine.effects;

import com.ptcg.engine.player.SpecialCondition;

import java.util.List;
import java.util.UUID;

/**
 * One change an effect made to the game.
 */
public sealed interface EffectOutcome permits EffectOutcome.DamageDealt, EffectOutcome.Healed,
        EffectOutcome.CardsDrawn, EffectOutcome.ConditionApplied, EffectOutcome.NoEffect {

    record DamageDealt(UUID pokemonId, int amount) implements EffectOutcome {}

    /** amount is the damage actually removed. */
    record Healed(UUID pokemonId, int amount) implements EffectOutcome {}

    record CardsDrawn(UUID playerId, List<UUID> cards) implements EffectOutcome {
        public CardsDrawn {
            cards = List.copyOf(cards);
        }
    }

    record ConditionApplied(UUID pokemonId, SpecialCondition condition) implements EffectOutcome {}

    record NoEffect(String reason) implements EffectOutcome {}
}
