package com.ptcg.engine.effects;

import com.ptcg.engine.events.GameEvent;
import com.ptcg.engine.game.Game;

import java.util.ArrayList;
import java.util.List;

/**
 * Puts a fixed amount of damage on each targeted Pokemon in play.
 * Knock-outs are left to the caller.
 */
public class DamageEffect extends BaseEffect {
    private final int amount;

    public DamageEffect(String name, int amount, List<EffectTrigger> triggers) {
        this(name, amount, triggers, List.of(new TargetRequirement.InPlay()));
    }

    public DamageEffect(String name, int amount, List<EffectTrigger> triggers,
                        List<TargetRequirement> targetRequirements) {
        super(name, "Deal " + amount + " damage", triggers, targetRequirements);
        if (amount < 0) {
            throw new IllegalArgumentException("amount must not be negative: " + amount);
        }
        this.amount = amount;
    }

    public int getAmount() {
        return amount;
    }

    @Override
    public List<EffectOutcome> apply(Game game, EffectContext context) throws EffectException {
        List<EffectOutcome> outcomes = new ArrayList<>();
        for (EffectTarget.Resolved target : inPlay(targetCards(game, context))) {
            target.owner().addDamage(target.cardId(), amount);
            game.recordEvent(new GameEvent.DamageDealt(target.owner().getId(), target.cardId(), amount, name()));
            outcomes.add(new EffectOutcome.DamageDealt(target.cardId(), amount));
        }
        return outcomes;
    }

    /**
     * Check that every target is in play on its owner's side, failing before any change if one is not.
     */
    static List<EffectTarget.Resolved> inPlay(List<EffectTarget.Resolved> targets) throws EffectException {
        if (targets.isEmpty()) {
            throw new EffectException(EffectException.Reason.INVALID_TARGET, "No target Pokemon");
        }
        for (EffectTarget.Resolved target : targets) {
            if (target.owner() == null || !target.owner().isInPlay(target.cardId())) {
                throw new EffectException(EffectException.Reason.INVALID_TARGET,
                        "Target " + target.cardId() + " is not a Pokemon in play");
            }
        }
        return targets;
    }
}
