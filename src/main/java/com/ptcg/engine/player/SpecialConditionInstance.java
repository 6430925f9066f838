package com.ptcg.engine.player;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * A special condition placed on a Pokemon.
 *
 * @param condition   the condition
 * @param duration    turns remaining, or {@link #PERMANENT} until cured
 * @param appliedTurn turn number on which it was applied
 * @param data        extra condition data
 */
public record SpecialConditionInstance(
    @JsonProperty("condition") SpecialCondition condition,
    @JsonProperty("duration") int duration,
    @JsonProperty("applied_turn") int appliedTurn,
    @JsonProperty("data") Map<String, String> data
) {
    public static final int PERMANENT = -1;

    public SpecialConditionInstance {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    @JsonIgnore
    public boolean isPermanent() {
        return duration < 0;
    }

    /**
     * Same instance with one turn less remaining. Permanent instances are unchanged.
     */
    public SpecialConditionInstance tick() {
        if (duration <= 0) {
            return this;
        }
        return new SpecialConditionInstance(condition, duration - 1, appliedTurn, data);
    }
}
