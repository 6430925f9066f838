package com.ptcg.engine.game.zones;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Bench.
 */
class BenchTest {

    @Test
    void testCapacity() {
        Bench bench = new Bench();
        for (int i = 0; i < Bench.MAX_SIZE; i++) {
            assertTrue(bench.add(UUID.randomUUID()));
        }
        assertTrue(bench.isFull());
        assertEquals(0, bench.freeSlots());
        assertFalse(bench.add(UUID.randomUUID()));
        assertEquals(Bench.MAX_SIZE, bench.size());
    }

    @Test
    void testRemoveFirstAndIndex() {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        Bench bench = new Bench();
        bench.add(first);
        bench.add(second);

        assertEquals(1, bench.indexOf(second));
        assertEquals(first, bench.removeFirst().orElseThrow());
        assertEquals(0, bench.indexOf(second));
        assertEquals(-1, bench.indexOf(first));
        assertTrue(bench.remove(second));
        assertTrue(bench.removeFirst().isEmpty());
    }
}
