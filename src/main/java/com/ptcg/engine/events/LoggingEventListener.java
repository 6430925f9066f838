package com.ptcg.engine.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * Writes every event of one match to the log at DEBUG.
 */
public class LoggingEventListener implements GameEventListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingEventListener.class);

    private final UUID gameId;

    public LoggingEventListener(UUID gameId) {
        this.gameId = gameId;
    }

    @Override
    public void onEvent(GameEvent event) {
        log.debug("game-event gameId={} type={} event={}", gameId, event.getClass().getSimpleName(), event);
    }
}
