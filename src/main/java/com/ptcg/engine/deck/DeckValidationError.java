package com.ptcg.engine.deck;

import java.util.UUID;

/**
 * One reason a deck is not legal in its format.
 */
public sealed interface DeckValidationError permits DeckValidationError.TooFewCards,
        DeckValidationError.TooManyCards, DeckValidationError.TooManyCopies, DeckValidationError.NoBasicPokemon {

    String describe();

    record TooFewCards(int minimum, int actual) implements DeckValidationError {
        @Override
        public String describe() {
            return "Deck has " + actual + " cards, needs at least " + minimum;
        }
    }

    record TooManyCards(int maximum, int actual) implements DeckValidationError {
        @Override
        public String describe() {
            return "Deck has " + actual + " cards, allows at most " + maximum;
        }
    }

    record TooManyCopies(UUID cardId, String cardName, int maximum, int actual) implements DeckValidationError {
        @Override
        public String describe() {
            return actual + " copies of " + cardName + ", at most " + maximum + " allowed";
        }
    }

    record NoBasicPokemon() implements DeckValidationError {
        @Override
        public String describe() {
            return "Deck has no Basic Pokemon";
        }
    }
}
