package com.ptcg.engine.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Evolution stages for Pokemon.
 */
public enum EvolutionStage {
    BASIC("basic"),
    STAGE1("stage1"),
    STAGE2("stage2"),
    MEGA("mega"),
    GX("gx"),
    EX("ex"),
    V("v"),
    VMAX("vmax");

    private final String jsonValue;

    EvolutionStage(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    /**
     * Only the Basic stage may be put into play without evolving.
     */
    public boolean isBasic() {
        return this == BASIC;
    }
}
