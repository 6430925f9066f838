package com.ptcg.engine.game.zones;

import com.ptcg.engine.rng.GameRng;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Draw pile (the player's deck in play) - ordered stack of card ids.
 * Top of the pile is at index 0.
 */
public class DrawPile {
    private Deque<UUID> cards;

    public DrawPile() {
        this.cards = new ArrayDeque<>();
    }

    public void clear() {
        cards.clear();
    }

    public void addCard(UUID cardId) {
        cards.addLast(cardId);
    }

    public void addAll(Collection<UUID> cardIds) {
        cards.addAll(cardIds);
    }

    public Optional<UUID> peekTop() {
        return Optional.ofNullable(cards.peekFirst());
    }

    /**
     * Draw the top card.
     * @return The drawn card id, or empty if the pile is empty
     */
    public Optional<UUID> draw() {
        return Optional.ofNullable(cards.pollFirst());
    }

    /**
     * Draw up to n cards from the top.
     * @return The drawn ids (fewer than n if the pile runs out)
     */
    public List<UUID> drawN(int n) {
        List<UUID> drawn = new ArrayList<>(Math.max(n, 0));
        for (int i = 0; i < n && !cards.isEmpty(); i++) {
            drawn.add(cards.removeFirst());
        }
        return drawn;
    }

    public void putOnTop(UUID cardId) {
        cards.addFirst(cardId);
    }

    public void putOnBottom(UUID cardId) {
        cards.addLast(cardId);
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

    /**
     * Shuffle the pile using the provided RNG.
     * Converts to list, shuffles, then rebuilds the deque.
     */
    public void shuffle(GameRng rng) {
        List<UUID> list = new ArrayList<>(cards);
        rng.shuffle(list);
        cards = new ArrayDeque<>(list);
    }

    /**
     * Get an unmodifiable copy of the cards, top first.
     */
    public List<UUID> getCards() {
        return List.copyOf(cards);
    }
}
