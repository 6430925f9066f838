package com.ptcg.engine.effects;

import com.ptcg.engine.game.Game;

import java.util.List;
import java.util.UUID;

/**
 * Common state for effects. By default an effect can apply when every card it
 * targets meets every target requirement.
 */
public abstract class BaseEffect implements Effect {
    private final UUID id;
    private final String name;
    private final String description;
    private final List<EffectTrigger> triggers;
    private final List<TargetRequirement> targetRequirements;

    protected BaseEffect(String name, String description, List<EffectTrigger> triggers,
                         List<TargetRequirement> targetRequirements) {
        this.id = UUID.randomUUID();
        this.name = name;
        this.description = description;
        this.triggers = List.copyOf(triggers);
        this.targetRequirements = List.copyOf(targetRequirements);
    }

    @Override
    public UUID id() {
        return id;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public List<EffectTrigger> triggers() {
        return triggers;
    }

    @Override
    public List<TargetRequirement> targetRequirements() {
        return targetRequirements;
    }

    @Override
    public boolean canApply(Game game, EffectContext context) {
        for (EffectTarget.Resolved target : targetCards(game, context)) {
            for (TargetRequirement requirement : targetRequirements) {
                if (!requirement.isSatisfiedBy(game, target)) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * The cards named by the context's target, each with the player whose copy is meant.
     */
    protected List<EffectTarget.Resolved> targetCards(Game game, EffectContext context) {
        return EffectTarget.resolve(context.target(), game, context);
    }

    @Override
    public String toString() {
        return name + " (" + id + ")";
    }
}
