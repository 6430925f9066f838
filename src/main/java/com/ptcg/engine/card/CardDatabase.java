package com.ptcg.engine.card;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable card catalogue keyed by card id.
 * A single instance may be shared by any number of games.
 */
public final class CardDatabase {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<UUID, Card> cards;

    private CardDatabase(Map<UUID, Card> cards) {
        this.cards = Collections.unmodifiableMap(cards);
    }

    public static CardDatabase empty() {
        return new CardDatabase(new LinkedHashMap<>());
    }

    public static CardDatabase of(Card... cards) {
        return fromCardList(List.of(cards));
    }

    public static CardDatabase of(Collection<Card> cards) {
        return fromCardList(cards);
    }

    /**
     * Load cards from a classpath resource holding a JSON array of cards.
     */
    public static CardDatabase fromResource(String resourcePath) throws CardDatabaseException {
        try (InputStream is = CardDatabase.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new CardDatabaseException("Resource not found: " + resourcePath);
            }
            List<Card> cardList = MAPPER.readValue(is, new TypeReference<List<Card>>() {});
            return fromCardList(cardList);
        } catch (IOException e) {
            throw new CardDatabaseException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Load cards from a JSON string holding an array of cards.
     */
    public static CardDatabase fromJson(String json) throws CardDatabaseException {
        try {
            List<Card> cardList = MAPPER.readValue(json, new TypeReference<List<Card>>() {});
            return fromCardList(cardList);
        } catch (IOException e) {
            throw new CardDatabaseException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    private static CardDatabase fromCardList(Collection<Card> cardList) {
        Map<UUID, Card> cards = new LinkedHashMap<>();
        for (Card card : cardList) {
            cards.put(card.getId(), card);
        }
        return new CardDatabase(cards);
    }

    /**
     * Return a new database holding these cards plus the given ones.
     * Cards with an existing id replace the old entry.
     */
    public CardDatabase withCards(Collection<Card> additional) {
        Map<UUID, Card> merged = new LinkedHashMap<>(cards);
        for (Card card : additional) {
            merged.put(card.getId(), card);
        }
        return new CardDatabase(merged);
    }

    /**
     * Get a card by id.
     * @throws CardDatabaseException if the card is not found
     */
    public Card getCard(UUID id) throws CardDatabaseException {
        Card card = cards.get(id);
        if (card == null) {
            throw new CardDatabaseException("Card not found: " + id);
        }
        return card;
    }

    public Optional<Card> findCard(UUID id) {
        return Optional.ofNullable(cards.get(id));
    }

    /**
     * Find the first card with the given name.
     */
    public Optional<Card> findByName(String name) {
        return cards.values().stream()
                .filter(c -> c.getName().equals(name))
                .findFirst();
    }

    public Collection<Card> getCards() {
        return cards.values();
    }

    public int cardCount() {
        return cards.size();
    }

    public boolean hasCard(UUID id) {
        return cards.containsKey(id);
    }
}
