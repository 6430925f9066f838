package com.ptcg.engine.rng;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Seeded random number generator for reproducible matches.
 * Uses the Mulberry32 PRNG so a match replayed with the same seed makes
 * the same shuffles, turn-order choice and coin flips.
 */
public class GameRng {
    private final long seed;
    private long state;

    /**
     * Create a new GameRng with the specified seed.
     * Only the lower 32 bits of the seed are used.
     */
    public GameRng(long seed) {
        this.seed = seed & 0xFFFFFFFFL;
        this.state = this.seed;
    }

    /**
     * Create a new GameRng with a random seed from SecureRandom.
     */
    public GameRng() {
        this(new SecureRandom().nextLong());
    }

    /**
     * Generate next random number in [0, 1).
     */
    public double next() {
        state = (state + 0x6D2B79F5L) & 0xFFFFFFFFL;
        long t = state;

        t = ((t ^ (t >>> 15)) * (t | 1)) & 0xFFFFFFFFL;
        t = (t ^ (t + ((t ^ (t >>> 7)) * (t | 61)) & 0xFFFFFFFFL)) & 0xFFFFFFFFL;

        long result = (t ^ (t >>> 14)) & 0xFFFFFFFFL;

        return result / 4294967296.0;
    }

    /**
     * Generate a random integer in range [0, bound).
     */
    public int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive: " + bound);
        }
        return (int) (next() * bound);
    }

    /**
     * One coin flip. true = heads.
     */
    public boolean flipCoin() {
        return next() < 0.5;
    }

    /**
     * Flip n coins.
     * @return results in flip order, true = heads
     */
    public List<Boolean> flipCoins(int n) {
        List<Boolean> results = new ArrayList<>(Math.max(n, 0));
        for (int i = 0; i < n; i++) {
            results.add(flipCoin());
        }
        return results;
    }

    /**
     * Roll against a percentage chance. 100 always succeeds, 0 never does.
     */
    public boolean rollPercent(int percent) {
        if (percent >= 100) {
            return true;
        }
        if (percent <= 0) {
            return false;
        }
        return nextInt(100) < percent;
    }

    /**
     * Fisher-Yates shuffle for a list.
     */
    public <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i >= 1; i--) {
            int j = (int) Math.floor(next() * (i + 1));
            Collections.swap(list, i, j);
        }
    }

    /**
     * The (32-bit) seed this generator was created with.
     */
    public long getSeed() {
        return seed;
    }

    /**
     * Get the current state (for debugging/testing).
     */
    public long getState() {
        return state;
    }
}
