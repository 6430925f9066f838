package com.ptcg.engine.card;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * How an attack's damage grows beyond its printed base value.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "mode"
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = DamageMode.PerEnergy.class, name = "per_energy"),
    @JsonSubTypes.Type(value = DamageMode.CoinFlip.class, name = "coin_flip"),
    @JsonSubTypes.Type(value = DamageMode.PerPokemon.class, name = "per_pokemon"),
    @JsonSubTypes.Type(value = DamageMode.Variable.class, name = "variable")
})
public sealed interface DamageMode
        permits DamageMode.PerEnergy, DamageMode.CoinFlip, DamageMode.PerPokemon, DamageMode.Variable {

    /**
     * Extra damage for each attached energy, optionally of one type only (null = any).
     */
    record PerEnergy(
        @JsonProperty("per_energy") int perEnergy,
        @JsonProperty("energy_type") EnergyType energyType
    ) implements DamageMode {}

    /**
     * Extra damage for each heads out of {@code flips} coin flips.
     */
    record CoinFlip(
        @JsonProperty("per_heads") int perHeads,
        @JsonProperty("flips") int flips
    ) implements DamageMode {}

    /**
     * Extra damage for each Pokemon in a location ("bench", "opponent_bench", "in_play").
     */
    record PerPokemon(
        @JsonProperty("per_pokemon") int perPokemon,
        @JsonProperty("location") String location
    ) implements DamageMode {}

    record Variable(
        @JsonProperty("min") int min,
        @JsonProperty("max") int max
    ) implements DamageMode {}
}
