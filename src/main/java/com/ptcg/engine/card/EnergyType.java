package com.ptcg.engine.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Energy types. Also used for Pokemon weakness and resistance.
 */
public enum EnergyType {
    GRASS("grass"),
    FIRE("fire"),
    WATER("water"),
    LIGHTNING("lightning"),
    PSYCHIC("psychic"),
    FIGHTING("fighting"),
    DARKNESS("darkness"),
    METAL("metal"),
    FAIRY("fairy"),
    DRAGON("dragon"),
    COLORLESS("colorless");

    private final String jsonValue;

    EnergyType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    /**
     * Parse an energy type from its JSON name (case-insensitive).
     * @throws IllegalArgumentException if the name is unknown
     */
    public static EnergyType fromString(String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Energy type cannot be null or empty");
        }
        for (EnergyType type : values()) {
            if (type.jsonValue.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown energy type: " + value);
    }
}
