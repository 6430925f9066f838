package com.ptcg.engine.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What an attack hits.
 */
public enum AttackTargetType {
    /** The defending active Pokemon */
    ACTIVE("active"),
    /** Any one of the opponent's Pokemon, chosen by the attacker */
    CHOOSE("choose"),
    /** All of the opponent's Pokemon */
    ALL("all"),
    /** One of the opponent's benched Pokemon */
    BENCH("bench"),
    /** The attacking Pokemon itself (healing and the like) */
    SELF("self");

    private final String jsonValue;

    AttackTargetType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
