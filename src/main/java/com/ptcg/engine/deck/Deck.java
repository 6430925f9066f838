package com.ptcg.engine.deck;

import com.ptcg.engine.card.Card;
import com.ptcg.engine.card.CardDatabase;
import com.ptcg.engine.card.CardKind;
import com.ptcg.engine.card.EnergyType;
import com.ptcg.engine.rng.GameRng;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * A deck list: card id to number of copies, in the order cards were added.
 * <p>
 * The mutators accept any quantities; format legality is checked only by {@link #validate(CardDatabase)}.
 */
public class Deck {
    private final UUID id;
    private final String name;
    private final String format;
    private final Map<UUID, Integer> cards;
    private final Map<String, String> metadata;

    public Deck(String name, String format) {
        this.id = UUID.randomUUID();
        this.name = name;
        this.format = format;
        this.cards = new LinkedHashMap<>();
        this.metadata = new LinkedHashMap<>();
    }

    /**
     * Build a deck from a flat list of card ids, one entry per copy.
     */
    public static Deck fromCardList(String name, String format, Collection<UUID> cardIds) {
        Deck deck = new Deck(name, format);
        for (UUID cardId : cardIds) {
            deck.addCard(cardId, 1);
        }
        return deck;
    }

    public void addCard(UUID cardId, int quantity) {
        if (quantity <= 0) {
            return;
        }
        cards.merge(cardId, quantity, Integer::sum);
    }

    /**
     * Remove copies of a card. Removing more than are present removes the card entirely.
     */
    public void removeCard(UUID cardId, int quantity) {
        Integer current = cards.get(cardId);
        if (current == null || quantity <= 0) {
            return;
        }
        if (current <= quantity) {
            cards.remove(cardId);
        } else {
            cards.put(cardId, current - quantity);
        }
    }

    /**
     * Set the number of copies of a card. Zero removes it.
     */
    public void setCardQuantity(UUID cardId, int quantity) {
        if (quantity <= 0) {
            cards.remove(cardId);
        } else {
            cards.put(cardId, quantity);
        }
    }

    public int getCardQuantity(UUID cardId) {
        return cards.getOrDefault(cardId, 0);
    }

    public boolean containsCard(UUID cardId) {
        return cards.containsKey(cardId);
    }

    public int totalCards() {
        int total = 0;
        for (int count : cards.values()) {
            total += count;
        }
        return total;
    }

    public int uniqueCards() {
        return cards.size();
    }

    /**
     * Expand to one id per copy, in deck-list order.
     */
    public List<UUID> toCardList() {
        List<UUID> list = new ArrayList<>(totalCards());
        for (Map.Entry<UUID, Integer> entry : cards.entrySet()) {
            for (int i = 0; i < entry.getValue(); i++) {
                list.add(entry.getKey());
            }
        }
        return list;
    }

    /**
     * Expand to one id per copy and shuffle. The deck list itself is not changed.
     */
    public List<UUID> shuffle(GameRng rng) {
        List<UUID> list = toCardList();
        rng.shuffle(list);
        return list;
    }

    public DeckStatistics getStatistics(CardDatabase cardDatabase) {
        int total = 0;
        int unique = 0;
        int pokemon = 0;
        int energy = 0;
        int trainer = 0;
        int basicPokemon = 0;
        Map<EnergyType, Integer> distribution = new EnumMap<>(EnergyType.class);

        for (Map.Entry<UUID, Integer> entry : cards.entrySet()) {
            Optional<Card> found = cardDatabase.findCard(entry.getKey());
            if (found.isEmpty()) {
                continue;
            }
            Card card = found.get();
            int count = entry.getValue();
            total += count;
            unique++;

            CardKind kind = card.getKind();
            if (kind instanceof CardKind.Pokemon) {
                pokemon += count;
                if (card.isBasicPokemon()) {
                    basicPokemon += count;
                }
            } else if (kind instanceof CardKind.Energy energyKind) {
                energy += count;
                distribution.merge(energyKind.energyType(), count, Integer::sum);
            } else if (kind instanceof CardKind.Trainer) {
                trainer += count;
            }
        }

        return new DeckStatistics(total, unique, pokemon, energy, trainer, basicPokemon, distribution);
    }

    /**
     * Collect every legality problem for this deck's format.
     * Size is measured on the deck list; copy and Basic checks skip ids unknown to the database.
     */
    public List<DeckValidationError> findValidationErrors(CardDatabase cardDatabase) {
        List<DeckValidationError> errors = new ArrayList<>();
        DeckFormat deckFormat = DeckFormat.fromTag(format);

        int total = totalCards();
        if (total < deckFormat.getMinCards()) {
            errors.add(new DeckValidationError.TooFewCards(deckFormat.getMinCards(), total));
        }
        if (total > deckFormat.getMaxCards()) {
            errors.add(new DeckValidationError.TooManyCards(deckFormat.getMaxCards(), total));
        }

        for (Map.Entry<UUID, Integer> entry : cards.entrySet()) {
            Optional<Card> card = cardDatabase.findCard(entry.getKey());
            if (card.isPresent() && !card.get().isBasicEnergy() && entry.getValue() > DeckFormat.MAX_COPIES) {
                errors.add(new DeckValidationError.TooManyCopies(
                        entry.getKey(), card.get().getName(), DeckFormat.MAX_COPIES, entry.getValue()));
            }
        }

        if (getStatistics(cardDatabase).basicPokemonCount() == 0) {
            errors.add(new DeckValidationError.NoBasicPokemon());
        }
        return errors;
    }

    /**
     * Check this deck against its format.
     * @throws DeckValidationException listing every problem if the deck is not legal
     */
    public void validate(CardDatabase cardDatabase) throws DeckValidationException {
        List<DeckValidationError> errors = findValidationErrors(cardDatabase);
        if (!errors.isEmpty()) {
            throw new DeckValidationException(name, errors);
        }
    }

    public void addMetadata(String key, String value) {
        metadata.put(key, value);
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getFormat() {
        return format;
    }

    public Map<UUID, Integer> getCards() {
        return Map.copyOf(cards);
    }

    public Map<String, String> getMetadata() {
        return Map.copyOf(metadata);
    }
}
