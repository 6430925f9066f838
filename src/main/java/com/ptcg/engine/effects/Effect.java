package com.ptcg.engine.effects;

import com.ptcg.engine.game.Game;

import java.util.List;
import java.util.UUID;

/**
 * Behaviour attached to cards that fires on game triggers.
 * Register with the game's {@link EffectManager}, then attach to one or more cards.
 */
public interface Effect {

    UUID id();

    String name();

    String description();

    /**
     * Triggers this effect responds to.
     */
    List<EffectTrigger> triggers();

    /**
     * Conditions every target card must satisfy.
     */
    List<TargetRequirement> targetRequirements();

    /**
     * Whether the effect may apply now. Must not change the game.
     */
    boolean canApply(Game game, EffectContext context);

    /**
     * Apply the effect.
     * @throws EffectException if it cannot be applied; the effect must not have changed the game in that case
     */
    List<EffectOutcome> apply(Game game, EffectContext context) throws EffectException;
}
