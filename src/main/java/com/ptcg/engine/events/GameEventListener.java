package com.ptcg.engine.events;

/**
 * Receives each event synchronously as it is recorded.
 */
@FunctionalInterface
public interface GameEventListener {
    void onEvent(GameEvent event);
}
