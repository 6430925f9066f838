package com.ptcg.engine.game;

/**
 * Thrown when the match state machine is driven incorrectly: a call in the wrong
 * status, an unknown player, an illegal setup choice. The game is left unchanged.
 */
public class GameException extends Exception {
    public GameException(String message) {
        super(message);
    }

    public GameException(String message, Throwable cause) {
        super(message, cause);
    }
}
