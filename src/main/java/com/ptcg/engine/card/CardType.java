package com.ptcg.engine.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Top-level card categories.
 */
public enum CardType {
    POKEMON("pokemon"),
    ENERGY("energy"),
    TRAINER("trainer");

    private final String jsonValue;

    CardType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public static CardType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Card type cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "pokemon" -> POKEMON;
            case "energy" -> ENERGY;
            case "trainer" -> TRAINER;
            default -> throw new IllegalArgumentException("Unknown card type: " + value);
        };
    }
}
