package com.ptcg.engine.game.zones;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Hand - card ids in a player's hand, in the order they arrived.
 */
public class Hand {
    private final List<UUID> cards;

    public Hand() {
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
     * @param index The index of the card to remove
     * @return The removed card id, or null if index is out of bounds
     */
    public UUID remove(int index) {
        if (index >= 0 && index < cards.size()) {
            return cards.remove(index);
        }
        return null;
    }

    /**
     * Remove a specific card from the hand.
     * @return true if the card was found and removed
     */
    public boolean remove(UUID cardId) {
        return cards.remove(cardId);
    }

    /**
     * Remove and return every card in the hand.
     */
    public List<UUID> removeAll() {
        List<UUID> removed = new ArrayList<>(cards);
        cards.clear();
        return removed;
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

    /**
     * Get an unmodifiable copy of the cards.
     */
    public List<UUID> getCards() {
        return List.copyOf(cards);
    }
}
