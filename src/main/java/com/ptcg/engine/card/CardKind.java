package com.ptcg.engine.card;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Kind-specific card data. A card is exactly one of Pokemon, Energy or Trainer.
 * Uses Jackson polymorphic deserialization based on the "type" field.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "type"
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = CardKind.Pokemon.class, name = "pokemon"),
    @JsonSubTypes.Type(value = CardKind.Energy.class, name = "energy"),
    @JsonSubTypes.Type(value = CardKind.Trainer.class, name = "trainer")
})
public sealed interface CardKind permits CardKind.Pokemon, CardKind.Energy, CardKind.Trainer {

    CardType cardType();

    /**
     * Pokemon card data. Weakness, resistance and evolvesFrom may be null.
     */
    record Pokemon(
        @JsonProperty("species") String species,
        @JsonProperty("hp") int hp,
        @JsonProperty("retreat_cost") int retreatCost,
        @JsonProperty("weakness") EnergyType weakness,
        @JsonProperty("resistance") EnergyType resistance,
        @JsonProperty("stage") EvolutionStage stage,
        @JsonProperty("evolves_from") String evolvesFrom
    ) implements CardKind {

        /**
         * Basic Pokemon with no weakness or resistance.
         */
        public static Pokemon basic(String species, int hp, int retreatCost) {
            return new Pokemon(species, hp, retreatCost, null, null, EvolutionStage.BASIC, null);
        }

        @Override
        public CardType cardType() {
            return CardType.POKEMON;
        }
    }

    record Energy(
        @JsonProperty("energy_type") EnergyType energyType,
        @JsonProperty("is_basic") boolean basic
    ) implements CardKind {

        @Override
        public CardType cardType() {
            return CardType.ENERGY;
        }
    }

    record Trainer(
        @JsonProperty("trainer_type") TrainerType trainerType
    ) implements CardKind {

        @Override
        public CardType cardType() {
            return CardType.TRAINER;
        }
    }
}
