package com.ptcg.engine.card;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CardRarity {
    COMMON("common"),
    UNCOMMON("uncommon"),
    RARE("rare"),
    RARE_HOLO("rare_holo"),
    ULTRA_RARE("ultra_rare"),
    SECRET_RARE("secret_rare"),
    PROMO("promo");

    private final String jsonValue;

    CardRarity(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
