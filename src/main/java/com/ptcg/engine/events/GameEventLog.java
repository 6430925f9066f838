package com.ptcg.engine.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ptcg.engine.game.GameException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Append-only, totally ordered history of a match.
 * Listeners are called on the recording thread, in registration order, right after each event is stored.
 */
public class GameEventLog {
    private static final Logger log = LoggerFactory.getLogger(GameEventLog.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<GameEvent>> EVENT_LIST = new TypeReference<>() {};

    private final List<GameEvent> events = new ArrayList<>();
    private final List<GameEventListener> listeners = new ArrayList<>();

    public void addListener(GameEventListener listener) {
        listeners.add(listener);
    }

    public boolean removeListener(GameEventListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Record an event and notify listeners. A listener that throws does not stop
     * the others or undo the recording.
     */
    public void record(GameEvent event) {
        events.add(event);
        for (GameEventListener listener : List.copyOf(listeners)) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("event-listener-failed event={} listener={}", event.getClass().getSimpleName(), listener, e);
            }
        }
    }

    public List<GameEvent> getEvents() {
        return List.copyOf(events);
    }

    /**
     * All recorded events of one type, in order.
     */
    public <T extends GameEvent> List<T> eventsOfType(Class<T> type) {
        List<T> matching = new ArrayList<>();
        for (GameEvent event : events) {
            if (type.isInstance(event)) {
                matching.add(type.cast(event));
            }
        }
        return matching;
    }

    public Optional<GameEvent> lastEvent() {
        return events.isEmpty() ? Optional.empty() : Optional.of(events.get(events.size() - 1));
    }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    /**
     * Export the history as a JSON array.
     */
    public String toJson() throws GameException {
        try {
            return MAPPER.writerFor(EVENT_LIST).writeValueAsString(events);
        } catch (JsonProcessingException e) {
            throw new GameException("Failed to export event log: " + e.getMessage(), e);
        }
    }

    /**
     * Rebuild a history from {@link #toJson()} output. The result has no listeners.
     */
    public static GameEventLog fromJson(String json) throws GameException {
        try {
            GameEventLog eventLog = new GameEventLog();
            eventLog.events.addAll(MAPPER.readValue(json, EVENT_LIST));
            return eventLog;
        } catch (JsonProcessingException e) {
            throw new GameException("Failed to read event log: " + e.getMessage(), e);
        }
    }
}
