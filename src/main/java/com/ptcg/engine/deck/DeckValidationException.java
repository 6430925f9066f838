package com.ptcg.engine.deck;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a deck fails validation. Carries every problem found, not just the first.
 */
public class DeckValidationException extends Exception {
    private final List<DeckValidationError> errors;

    public DeckValidationException(String deckName, List<DeckValidationError> errors) {
        super("Deck '" + deckName + "' is not legal: "
                + errors.stream().map(DeckValidationError::describe).collect(Collectors.joining("; ")));
        this.errors = List.copyOf(errors);
    }

    public List<DeckValidationError> getErrors() {
        return errors;
    }
}
