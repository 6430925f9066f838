package com.ptcg.engine.effects;

/**
 * Thrown when an effect cannot be attached or applied.
 */
public class EffectException extends Exception {

    public enum Reason {
        INVALID_TARGET,
        INSUFFICIENT_RESOURCES,
        INVALID_GAME_STATE,
        REQUIREMENTS_NOT_MET,
        GENERAL
    }

    private final Reason reason;

    public EffectException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public EffectException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
