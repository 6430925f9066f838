package com.ptcg.engine.game;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Phases within a single turn.
 */
public enum GamePhase {
    BEGINNING_OF_TURN("beginning_of_turn"),
    MAIN("main"),
    ATTACK("attack"),
    END_OF_TURN("end_of_turn");

    private final String jsonValue;

    GamePhase(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    /**
     * The phase that follows this one. END_OF_TURN wraps to BEGINNING_OF_TURN of the next turn.
     */
    public GamePhase next() {
        return switch (this) {
            case BEGINNING_OF_TURN -> MAIN;
            case MAIN -> ATTACK;
            case ATTACK -> END_OF_TURN;
            case END_OF_TURN -> BEGINNING_OF_TURN;
        };
    }
}
