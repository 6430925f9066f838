package com.ptcg.engine.card;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A Pokemon ability. The text is descriptive only; behaviour comes from effects
 * registered with the game's effect manager.
 */
public record Ability(
    @JsonProperty("name") String name,
    @JsonProperty("effect") String effect,
    @JsonProperty("ability_type") String abilityType
) {}
