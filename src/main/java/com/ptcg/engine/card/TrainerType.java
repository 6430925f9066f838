package com.ptcg.engine.card;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrainerType {
    ITEM("item"),
    SUPPORTER("supporter"),
    STADIUM("stadium"),
    TOOL("tool");

    private final String jsonValue;

    TrainerType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
