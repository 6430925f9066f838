package com.ptcg.engine.effects;

import java.util.List;
import java.util.UUID;

/**
 * What happened to one attached effect during a trigger.
 */
public sealed interface EffectApplication permits EffectApplication.Applied, EffectApplication.Skipped,
        EffectApplication.Failed {

    UUID effectId();

    UUID cardId();

    record Applied(UUID effectId, UUID cardId, List<EffectOutcome> outcomes) implements EffectApplication {
        public Applied {
            outcomes = List.copyOf(outcomes);
        }
    }

    /** The effect's canApply check returned false. */
    record Skipped(UUID effectId, UUID cardId) implements EffectApplication {}

    record Failed(UUID effectId, UUID cardId, EffectException.Reason reason, String message)
            implements EffectApplication {}
}
