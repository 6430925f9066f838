package com.ptcg.engine.card;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ptcg.engine.player.SpecialCondition;

/**
 * A special condition an attack may inflict.
 *
 * @param condition   the condition to apply
 * @param probability chance in percent (0-100)
 * @param target      "defending" or "self"
 */
public record StatusEffect(
    @JsonProperty("condition") SpecialCondition condition,
    @JsonProperty("probability") int probability,
    @JsonProperty("target") String target
) {
    public static final String DEFENDING = "defending";
    public static final String SELF = "self";

    public static StatusEffect onDefending(SpecialCondition condition, int probability) {
        return new StatusEffect(condition, probability, DEFENDING);
    }
}
