package com.ptcg.engine.game.zones;

import com.ptcg.engine.rng.GameRng;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DrawPile.
 */
class DrawPileTest {

    @Test
    void testDrawOrder() {
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();
        UUID c = UUID.randomUUID();
        DrawPile pile = new DrawPile();
        pile.addAll(List.of(a, b));
        pile.putOnTop(c);

        assertEquals(c, pile.peekTop().orElseThrow());
        assertEquals(List.of(c, a), pile.drawN(2));
        assertEquals(b, pile.draw().orElseThrow());
        assertTrue(pile.draw().isEmpty());
        assertTrue(pile.drawN(3).isEmpty());
    }

    @Test
    void testShuffleKeepsCards() {
        List<UUID> ids = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            ids.add(UUID.randomUUID());
        }
        DrawPile first = new DrawPile();
        DrawPile second = new DrawPile();
        first.addAll(ids);
        second.addAll(ids);

        first.shuffle(new GameRng(99));
        second.shuffle(new GameRng(99));

        assertEquals(first.getCards(), second.getCards());
        assertEquals(20, first.size());
        assertTrue(first.getCards().containsAll(ids));
    }
}
