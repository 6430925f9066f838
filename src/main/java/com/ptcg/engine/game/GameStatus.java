package com.ptcg.engine.game;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall match lifecycle. SETUP moves one way to IN_PROGRESS; FINISHED and CANCELLED are terminal.
 */
public enum GameStatus {
    SETUP("setup"),
    IN_PROGRESS("in_progress"),
    FINISHED("finished"),
    CANCELLED("cancelled");

    private final String jsonValue;

    GameStatus(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public boolean isTerminal() {
        return this == FINISHED || this == CANCELLED;
    }
}
