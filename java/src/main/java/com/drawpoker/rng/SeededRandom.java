package com.drawpoker.rng;

import java.util.Collections;
import java.util.List;

/**
 * Seeded random number generator for reproducible deals.
 * The seed string is folded into a 32-bit hash which starts a 31-bit LCG.
 * The arithmetic MUST stay bit-for-bit stable: clients re-derive the same deck
 * from nothing but the seed.
 */
public class SeededRandom {
    private static final long MULTIPLIER = 1103515245L;
    private static final long INCREMENT = 12345L;
    private static final long MASK_31 = 0x7FFFFFFFL;
    private static final double MODULUS = 2147483648.0;

    private long state;

    /**
     * Create a generator whose state starts at the hash of the seed.
     */
    public SeededRandom(String seed) {
        this.state = hashSeed(seed);
    }

    /**
     * Rolling polynomial hash: h = 31 * h + c over UTF-16 code units,
     * wrapping at 32 bits. Same value as {@link String#hashCode()}.
     */
    public static int hashSeed(String seed) {
        int hash = 0;
        for (int i = 0; i < seed.length(); i++) {
            hash = 31 * hash + seed.charAt(i);
        }
        return hash;
    }

    /**
     * Generate next random number in [0, 1).
     */
    public double next() {
        // 64-bit product is exact for |state| < 2^32
        state = (state * MULTIPLIER + INCREMENT) & MASK_31;
        return state / MODULUS;
    }

    /**
     * Generate a random integer in range [0, bound).
     */
    public int nextInt(int bound) {
        return (int) Math.floor(next() * bound);
    }

    /**
     * Fisher-Yates shuffle, iterating from the last index down to 1.
     */
    public <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i >= 1; i--) {
            int j = nextInt(i + 1);
            Collections.swap(list, i, j);
        }
    }

    /**
     * Get the current state (for debugging/testing).
     */
    public long getState() {
        return state;
    }
}
