package com.ptcg.engine.player;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Special conditions that can affect a Pokemon in play.
 * Conditions are compared by kind, so Poisoned(10) and Poisoned(20) are the same kind.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "type"
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = SpecialCondition.Poisoned.class, name = "poisoned"),
    @JsonSubTypes.Type(value = SpecialCondition.Burned.class, name = "burned"),
    @JsonSubTypes.Type(value = SpecialCondition.Paralyzed.class, name = "paralyzed"),
    @JsonSubTypes.Type(value = SpecialCondition.Asleep.class, name = "asleep"),
    @JsonSubTypes.Type(value = SpecialCondition.Confused.class, name = "confused"),
    @JsonSubTypes.Type(value = SpecialCondition.Trapped.class, name = "trapped"),
    @JsonSubTypes.Type(value = SpecialCondition.Custom.class, name = "custom")
})
public sealed interface SpecialCondition permits SpecialCondition.Poisoned, SpecialCondition.Burned,
        SpecialCondition.Paralyzed, SpecialCondition.Asleep, SpecialCondition.Confused,
        SpecialCondition.Trapped, SpecialCondition.Custom {

    /** Standard poison: 10 damage between turns. */
    SpecialCondition POISONED = new Poisoned(10);
    /** Standard burn: 20 damage between turns. */
    SpecialCondition BURNED = new Burned(20);
    SpecialCondition PARALYZED = new Paralyzed();
    SpecialCondition ASLEEP = new Asleep();
    SpecialCondition CONFUSED = new Confused();
    SpecialCondition TRAPPED = new Trapped();

    /**
     * Whether two conditions are of the same kind, ignoring their parameters.
     */
    default boolean sameKind(SpecialCondition other) {
        return other != null && getClass() == other.getClass();
    }

    record Poisoned(@JsonProperty("damage_per_turn") int damagePerTurn) implements SpecialCondition {}

    record Burned(@JsonProperty("damage_per_turn") int damagePerTurn) implements SpecialCondition {}

    /** Cannot attack. */
    record Paralyzed() implements SpecialCondition {}

    /** Cannot attack; flip to wake up. */
    record Asleep() implements SpecialCondition {}

    record Confused() implements SpecialCondition {}

    /** Cannot retreat. */
    record Trapped() implements SpecialCondition {}

    record Custom(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description
    ) implements SpecialCondition {}
}
