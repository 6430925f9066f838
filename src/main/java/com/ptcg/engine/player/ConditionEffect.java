package com.ptcg.engine.player;

import java.util.UUID;

/**
 * What a special condition asks the game to do between turns.
 * Produced by {@link Player#updateSpecialConditions(int)}; the turn controller resolves them.
 */
public sealed interface ConditionEffect permits ConditionEffect.Damage, ConditionEffect.CoinFlip,
        ConditionEffect.ConditionRemoved, ConditionEffect.PreventAction {

    UUID pokemonId();

    /** Place damage on the Pokemon. */
    record Damage(UUID pokemonId, int amount, String source) implements ConditionEffect {}

    /** Flip a coin; on heads the condition is removed. */
    record CoinFlip(UUID pokemonId, SpecialCondition condition, String onSuccess) implements ConditionEffect {}

    /** The condition expired. */
    record ConditionRemoved(UUID pokemonId, SpecialCondition condition) implements ConditionEffect {}

    record PreventAction(UUID pokemonId, String action) implements ConditionEffect {}
}
