package com.ptcg.engine.effects;

import com.ptcg.engine.events.GameEvent;
import com.ptcg.engine.game.Game;
import com.ptcg.engine.player.Player;
import com.ptcg.engine.player.SpecialCondition;
import com.ptcg.engine.player.SpecialConditionInstance;

import java.util.ArrayList;
import java.util.List;

/**
 * Inflicts a special condition on each targeted Pokemon in play.
 */
public class SpecialConditionEffect extends BaseEffect {
    private final SpecialCondition condition;
    private final int duration;

    public SpecialConditionEffect(String name, SpecialCondition condition, List<EffectTrigger> triggers) {
        this(name, condition, SpecialConditionInstance.PERMANENT, triggers);
    }

    public SpecialConditionEffect(String name, SpecialCondition condition, int duration, List<EffectTrigger> triggers) {
        super(name, "Inflict " + condition, triggers, List.of(new TargetRequirement.InPlay()));
        this.condition = condition;
        this.duration = duration;
    }

    @Override
    public List<EffectOutcome> apply(Game game, EffectContext context) throws EffectException {
        List<EffectOutcome> outcomes = new ArrayList<>();
        for (EffectTarget.Resolved target : DamageEffect.inPlay(targetCards(game, context))) {
            Player owner = target.owner();
            owner.addSpecialCondition(target.cardId(), condition, duration, game.getTurnNumber());
            game.recordEvent(new GameEvent.SpecialConditionApplied(owner.getId(), target.cardId(), condition));
            outcomes.add(new EffectOutcome.ConditionApplied(target.cardId(), condition));
        }
        return outcomes;
    }
}
