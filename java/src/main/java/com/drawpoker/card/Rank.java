package com.drawpoker.card;

/**
 * The thirteen card ranks, declared from lowest to highest.
 * Ace is high (14); the wheel straight treats it as low only while sequencing.
 */
public enum Rank {
    TWO("2", 2),
    THREE("3", 3),
    FOUR("4", 4),
    FIVE("5", 5),
    SIX("6", 6),
    SEVEN("7", 7),
    EIGHT("8", 8),
    NINE("9", 9),
    TEN("10", 10),
    JACK("J", 11),
    QUEEN("Q", 12),
    KING("K", 13),
    ACE("A", 14);

    private final String token;
    private final int value;

    Rank(String token, int value) {
        this.token = token;
        this.value = value;
    }

    /**
     * Get the rank part of a card token (2..10, J, Q, K, A).
     */
    public String getToken() {
        return token;
    }

    /**
     * Get the numeric value used for ordering, 2..14.
     */
    public int getValue() {
        return value;
    }

    /**
     * Look up a rank by its numeric value.
     * @param value 2..14
     * @throws IllegalArgumentException if the value is outside 2..14
     */
    public static Rank fromValue(int value) {
        if (value < 2 || value > 14) {
            throw new IllegalArgumentException("Invalid rank value: " + value);
        }
        return values()[value - 2];
    }

    /**
     * Parse the rank part of a card token, case-insensitive for face cards.
     * @throws InvalidCardTokenException if the token is not a known rank
     */
    public static Rank fromToken(String token) {
        return switch (token.toUpperCase()) {
            case "2" -> TWO;
            case "3" -> THREE;
            case "4" -> FOUR;
            case "5" -> FIVE;
            case "6" -> SIX;
            case "7" -> SEVEN;
            case "8" -> EIGHT;
            case "9" -> NINE;
            case "10" -> TEN;
            case "J" -> JACK;
            case "Q" -> QUEEN;
            case "K" -> KING;
            case "A" -> ACE;
            default -> throw new InvalidCardTokenException("Unknown rank: '" + token + "'");
        };
    }
}
