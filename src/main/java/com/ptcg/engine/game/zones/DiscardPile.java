package com.ptcg.engine.game.zones;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Discard pile (ordered stack).
 * Most recent cards are at the end.
 */
public class DiscardPile {
    private final List<UUID> cards;

    public DiscardPile() {
        this.cards = new ArrayList<>();
    }

    public void clear() {
        cards.clear();
    }

    public void add(UUID cardId) {
        cards.add(cardId);
    }

    public void addAll(Collection<UUID> cardIds) {
        cards.addAll(cardIds);
    }

    /**
     * Remove a card by index.
     * @return The removed card id, or null if index is out of bounds
     */
    public UUID remove(int index) {
        if (index >= 0 && index < cards.size()) {
            return cards.remove(index);
        }
        return null;
    }

    public boolean remove(UUID cardId) {
        return cards.remove(cardId);
    }

    public boolean contains(UUID cardId) {
        return cards.contains(cardId);
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    public List<UUID> getCards() {
        return List.copyOf(cards);
    }
}
