package com.ptcg.engine.game.zones;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bench - up to {@link #MAX_SIZE} Pokemon waiting behind the active one.
 */
public class Bench {
    public static final int MAX_SIZE = 5;

    private final List<UUID> pokemon;

    public Bench() {
        this.pokemon = new ArrayList<>(MAX_SIZE);
    }

    public void clear() {
        pokemon.clear();
    }

    /**
     * Put a Pokemon on the bench.
     * @return false if the bench is already full
     */
    public boolean add(UUID cardId) {
        if (isFull()) {
            return false;
        }
        pokemon.add(cardId);
        return true;
    }

    public boolean remove(UUID cardId) {
        return pokemon.remove(cardId);
    }

    /**
     * Remove and return the first benched Pokemon, if any.
     */
    public Optional<UUID> removeFirst() {
        if (pokemon.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(pokemon.remove(0));
    }

    public boolean contains(UUID cardId) {
        return pokemon.contains(cardId);
    }

    public int indexOf(UUID cardId) {
        return pokemon.indexOf(cardId);
    }

    public int size() {
        return pokemon.size();
    }

    public int freeSlots() {
        return MAX_SIZE - pokemon.size();
    }

    public boolean isFull() {
        return pokemon.size() >= MAX_SIZE;
    }

    public boolean isEmpty() {
        return pokemon.isEmpty();
    }

    public List<UUID> getPokemon() {
        return List.copyOf(pokemon);
    }
}
