package com.ptcg.engine.events;

import com.ptcg.engine.game.GameException;
import com.ptcg.engine.game.GamePhase;
import com.ptcg.engine.player.SpecialCondition;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GameEventLog.
 */
class GameEventLogTest {

    private final UUID player = UUID.randomUUID();

    @Test
    void testEventsKeepOrder() {
        GameEventLog eventLog = new GameEventLog();
        assertTrue(eventLog.isEmpty());

        eventLog.record(new GameEvent.TurnStarted(player, 1));
        eventLog.record(new GameEvent.CardDrawn(player, null));
        eventLog.record(new GameEvent.TurnEnded(player, 1));

        assertEquals(3, eventLog.size());
        assertInstanceOf(GameEvent.TurnStarted.class, eventLog.getEvents().get(0));
        assertEquals(new GameEvent.TurnEnded(player, 1), eventLog.lastEvent().orElseThrow());
        assertEquals(1, eventLog.eventsOfType(GameEvent.CardDrawn.class).size());
    }

    @Test
    void testListenersNotifiedInOrder() {
        GameEventLog eventLog = new GameEventLog();
        List<String> seen = new ArrayList<>();
        eventLog.addListener(event -> seen.add("first"));
        eventLog.addListener(event -> seen.add("second"));

        eventLog.record(new GameEvent.TurnPassed(player));

        assertEquals(List.of("first", "second"), seen);
    }

    @Test
    void testFailingListenerDoesNotStopOthers() {
        GameEventLog eventLog = new GameEventLog();
        List<GameEvent> seen = new ArrayList<>();
        eventLog.addListener(event -> {
            throw new IllegalStateException("listener broke");
        });
        eventLog.addListener(seen::add);
        eventLog.addListener(new LoggingEventListener(UUID.randomUUID()));

        eventLog.record(new GameEvent.DeckShuffled(player));

        assertEquals(1, seen.size());
        assertEquals(1, eventLog.size());
    }

    @Test
    void testRemoveListener() {
        GameEventLog eventLog = new GameEventLog();
        List<GameEvent> seen = new ArrayList<>();
        GameEventListener listener = seen::add;
        eventLog.addListener(listener);

        assertTrue(eventLog.removeListener(listener));
        eventLog.record(new GameEvent.TurnPassed(player));
        assertTrue(seen.isEmpty());
    }

    @Test
    void testJsonReplay() throws GameException {
        UUID pokemon = UUID.randomUUID();
        GameEventLog eventLog = new GameEventLog();
        eventLog.record(new GameEvent.GameStarted(UUID.randomUUID(), List.of(player)));
        eventLog.record(new GameEvent.PhaseChanged(player, GamePhase.MAIN, GamePhase.ATTACK));
        eventLog.record(new GameEvent.DamageDealt(player, pokemon, 30, "Thunder Jolt"));
        eventLog.record(new GameEvent.SpecialConditionApplied(player, pokemon, SpecialCondition.POISONED));
        eventLog.record(new GameEvent.GameEnded(null, "draw"));

        String json = eventLog.toJson();
        assertTrue(json.contains("\"event\":\"damage_dealt\""));
        assertTrue(json.contains("\"to\":\"attack\""));

        GameEventLog replayed = GameEventLog.fromJson(json);
        assertEquals(eventLog.getEvents(), replayed.getEvents());
    }

    @Test
    void testInvalidJson() {
        assertThrows(GameException.class, () -> GameEventLog.fromJson("[{\"event\":\"unknown\"}]"));
    }
}
