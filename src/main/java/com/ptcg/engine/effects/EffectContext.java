package com.ptcg.engine.effects;

import java.util.Map;
import java.util.UUID;

/**
 * What an effect needs to know when it fires.
 *
 * @param sourceCard   card the effect is attached to; set by the manager for each effect, may be null
 * @param sourcePlayer player on whose behalf the effect fires, may be null
 * @param target       what the effect acts on
 * @param trigger      why the effect fired
 * @param data         extra values supplied by the caller
 */
public record EffectContext(
    UUID sourceCard,
    UUID sourcePlayer,
    EffectTarget target,
    EffectTrigger trigger,
    Map<String, String> data
) {
    public EffectContext {
        target = target == null ? new EffectTarget.None() : target;
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public static EffectContext of(UUID sourcePlayer, EffectTarget target, EffectTrigger trigger) {
        return new EffectContext(null, sourcePlayer, target, trigger, Map.of());
    }

    public EffectContext withSourceCard(UUID cardId) {
        return new EffectContext(cardId, sourcePlayer, target, trigger, data);
    }

    public EffectContext withTrigger(EffectTrigger newTrigger) {
        return new EffectContext(sourceCard, sourcePlayer, target, newTrigger, data);
    }
}
