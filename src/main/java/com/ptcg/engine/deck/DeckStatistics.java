package com.ptcg.engine.deck;

import com.ptcg.engine.card.EnergyType;

import java.util.Map;

/**
 * Card counts for a deck. Cards missing from the database are not counted.
 */
public record DeckStatistics(
    int totalCards,
    int uniqueCards,
    int pokemonCount,
    int energyCount,
    int trainerCount,
    int basicPokemonCount,
    Map<EnergyType, Integer> energyDistribution
) {
    public DeckStatistics {
        energyDistribution = Map.copyOf(energyDistribution);
    }
}
