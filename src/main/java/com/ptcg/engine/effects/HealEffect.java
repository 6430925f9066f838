package com.ptcg.engine.effects;

import com.ptcg.engine.game.Game;
import com.ptcg.engine.player.Player;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes up to a fixed amount of damage from each targeted Pokemon.
 */
public class HealEffect extends BaseEffect {
    private final int amount;

    public HealEffect(String name, int amount, List<EffectTrigger> triggers) {
        super(name, "Heal " + amount + " damage", triggers, List.of(new TargetRequirement.InPlay()));
        if (amount < 0) {
            throw new IllegalArgumentException("amount must not be negative: " + amount);
        }
        this.amount = amount;
    }

    @Override
    public List<EffectOutcome> apply(Game game, EffectContext context) throws EffectException {
        List<EffectOutcome> outcomes = new ArrayList<>();
        for (EffectTarget.Resolved target : DamageEffect.inPlay(targetCards(game, context))) {
            Player owner = target.owner();
            int before = owner.getDamage(target.cardId());
            owner.healDamage(target.cardId(), amount);
            outcomes.add(new EffectOutcome.Healed(target.cardId(), before - owner.getDamage(target.cardId())));
        }
        return outcomes;
    }
}
