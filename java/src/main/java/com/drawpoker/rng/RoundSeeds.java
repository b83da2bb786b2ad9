package com.drawpoker.rng;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Produces fresh deck seeds for new rounds.
 * The engine never checks seed freshness; callers use these so that two rounds
 * do not replay the same shuffle.
 */
public final class RoundSeeds {
    private static final String PREFIX = "poker-";
    private static final int TOKEN_LENGTH = 13;
    private static final SecureRandom ENTROPY = new SecureRandom();

    private RoundSeeds() {
    }

    /**
     * Seed of the form {@code poker-<epochMillis>-<base36 token>}.
     */
    public static String generateRoundSeed() {
        return generateRoundSeed(System.currentTimeMillis(), ENTROPY);
    }

    public static String generateRoundSeed(long epochMillis, Random random) {
        StringBuilder token = new StringBuilder(TOKEN_LENGTH);
        for (int i = 0; i < TOKEN_LENGTH; i++) {
            token.append(Character.forDigit(random.nextInt(36), 36));
        }
        return PREFIX + epochMillis + "-" + token;
    }
}
