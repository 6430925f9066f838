package com.ptcg.engine.game;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GameRules.
 */
class GameRulesTest {

    @Test
    void testDefaults() {
        GameRules rules = GameRules.defaults();
        assertEquals("Standard", rules.format());
        assertEquals(6, rules.prizeCards());
        assertNull(rules.maxHandSize());
        assertNull(rules.turnTimeLimit());
        assertTrue(rules.autoShuffle());
    }

    @Test
    void testWithers() {
        GameRules rules = GameRules.defaults().withPrizeCards(3).withMaxHandSize(12).withAutoShuffle(false);
        assertEquals(3, rules.prizeCards());
        assertEquals(12, rules.maxHandSize());
        assertFalse(rules.autoShuffle());
        assertEquals("Standard", rules.format());
    }

    @Test
    void testFromJsonFillsMissingFields() throws GameException {
        GameRules rules = GameRules.fromJson("{\"max_hand_size\": 9}");
        assertEquals("Standard", rules.format());
        assertEquals(6, rules.prizeCards());
        assertEquals(9, rules.maxHandSize());
        assertTrue(rules.autoShuffle());

        assertEquals(GameRules.defaults(), GameRules.fromJson("{}"));
    }

    @Test
    void testFromResource() throws GameException {
        GameRules rules = GameRules.fromResource("rules/tournament-rules.json");
        assertEquals(new GameRules("Expanded", 4, 10, null, false), rules);
    }

    @Test
    void testMissingResource() {
        GameException e = assertThrows(GameException.class, () -> GameRules.fromResource("rules/missing.json"));
        assertTrue(e.getMessage().contains("rules/missing.json"));
    }

    @Test
    void testInvalidRules() {
        assertThrows(GameException.class, () -> GameRules.fromJson("{\"prize_cards\": -1}"));
        assertThrows(GameException.class, () -> GameRules.fromJson("not json"));
        assertThrows(IllegalArgumentException.class, () -> GameRules.defaults().withMaxHandSize(-2));
    }
}
