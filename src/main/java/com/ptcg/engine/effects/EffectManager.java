package com.ptcg.engine.effects;

import com.ptcg.engine.game.Game;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Registry of effects and the index of which cards carry them.
 * <p>
 * A card's effects resolve in the order they were attached; the same effect may
 * be attached more than once, and to many cards. Triggering works on a snapshot
 * of the index, so effects may attach or detach others while firing.
 */
public class EffectManager {
    private static final Logger log = LoggerFactory.getLogger(EffectManager.class);

    private final Map<UUID, Effect> registry = new LinkedHashMap<>();
    private final Map<UUID, List<UUID>> attachments = new LinkedHashMap<>();

    /**
     * An effect attached to a card.
     */
    public record AttachedEffect(UUID cardId, Effect effect) {}

    public UUID registerEffect(Effect effect) {
        registry.put(effect.id(), effect);
        return effect.id();
    }

    /**
     * Remove an effect from the registry and from every card carrying it.
     */
    public boolean unregisterEffect(UUID effectId) {
        if (registry.remove(effectId) == null) {
            return false;
        }
        attachments.values().forEach(ids -> ids.removeIf(effectId::equals));
        attachments.values().removeIf(List::isEmpty);
        return true;
    }

    public Optional<Effect> getEffect(UUID effectId) {
        return Optional.ofNullable(registry.get(effectId));
    }

    /**
     * Attach a registered effect to a card.
     * @throws EffectException if the effect is not registered
     */
    public void attachEffect(UUID cardId, UUID effectId) throws EffectException {
        if (!registry.containsKey(effectId)) {
            throw new EffectException(EffectException.Reason.GENERAL, "Effect not registered: " + effectId);
        }
        attachments.computeIfAbsent(cardId, k -> new ArrayList<>()).add(effectId);
    }

    /**
     * Detach one attachment of an effect from a card.
     */
    public boolean detachEffect(UUID cardId, UUID effectId) {
        List<UUID> ids = attachments.get(cardId);
        if (ids == null || !ids.remove(effectId)) {
            return false;
        }
        if (ids.isEmpty()) {
            attachments.remove(cardId);
        }
        return true;
    }

    /**
     * Detach everything from a card.
     * @return the ids that were attached
     */
    public List<UUID> removeCardEffects(UUID cardId) {
        List<UUID> removed = attachments.remove(cardId);
        return removed == null ? List.of() : List.copyOf(removed);
    }

    /**
     * A card's effects in resolution order.
     */
    public List<Effect> getCardEffects(UUID cardId) {
        List<Effect> effects = new ArrayList<>();
        for (UUID effectId : attachments.getOrDefault(cardId, List.of())) {
            Effect effect = registry.get(effectId);
            if (effect != null) {
                effects.add(effect);
            }
        }
        return effects;
    }

    public boolean hasEffects(UUID cardId) {
        return !attachments.getOrDefault(cardId, List.of()).isEmpty();
    }

    /**
     * Every attached effect that responds to a trigger, in index order.
     */
    public List<AttachedEffect> getEffectsByTrigger(EffectTrigger trigger) {
        List<AttachedEffect> matching = new ArrayList<>();
        for (Map.Entry<UUID, List<UUID>> entry : attachments.entrySet()) {
            for (UUID effectId : entry.getValue()) {
                Effect effect = registry.get(effectId);
                if (effect != null && effect.triggers().contains(trigger)) {
                    matching.add(new AttachedEffect(entry.getKey(), effect));
                }
            }
        }
        return matching;
    }

    /**
     * Fire every attached effect that responds to the trigger. Each effect gets the
     * context with its own card as source; one effect failing does not stop the rest.
     */
    public List<EffectApplication> triggerEffects(Game game, EffectTrigger trigger, EffectContext context) {
        List<EffectApplication> results = new ArrayList<>();
        for (AttachedEffect attached : getEffectsByTrigger(trigger)) {
            Effect effect = attached.effect();
            EffectContext bound = context.withSourceCard(attached.cardId()).withTrigger(trigger);
            try {
                if (!effect.canApply(game, bound)) {
                    results.add(new EffectApplication.Skipped(effect.id(), attached.cardId()));
                    continue;
                }
                List<EffectOutcome> outcomes = effect.apply(game, bound);
                results.add(new EffectApplication.Applied(effect.id(), attached.cardId(), outcomes));
            } catch (EffectException e) {
                log.debug("effect-failed effect={} card={} reason={} message={}",
                        effect.name(), attached.cardId(), e.getReason(), e.getMessage());
                results.add(new EffectApplication.Failed(effect.id(), attached.cardId(), e.getReason(), e.getMessage()));
            } catch (RuntimeException e) {
                log.warn("effect-error effect={} card={}", effect.name(), attached.cardId(), e);
                results.add(new EffectApplication.Failed(effect.id(), attached.cardId(),
                        EffectException.Reason.GENERAL, String.valueOf(e.getMessage())));
            }
        }
        return results;
    }

    /**
     * Fire ON_TURN_START effects for the player whose turn begins.
     */
    public List<EffectApplication> onTurnStart(Game game, UUID playerId) {
        return triggerEffects(game, EffectTrigger.ON_TURN_START,
                EffectContext.of(playerId, new EffectTarget.Self(), EffectTrigger.ON_TURN_START));
    }

    /**
     * Fire ON_TURN_END effects for the player whose turn ends.
     */
    public List<EffectApplication> onTurnEnd(Game game, UUID playerId) {
        return triggerEffects(game, EffectTrigger.ON_TURN_END,
                EffectContext.of(playerId, new EffectTarget.Self(), EffectTrigger.ON_TURN_END));
    }

    public int registeredCount() {
        return registry.size();
    }
}
