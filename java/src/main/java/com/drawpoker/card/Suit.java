package com.drawpoker.card;

/**
 * The four suits, in the order the standard deck is built.
 */
public enum Suit {
    HEARTS('H'),
    DIAMONDS('D'),
    CLUBS('C'),
    SPADES('S');

    private final char symbol;

    Suit(char symbol) {
        this.symbol = symbol;
    }

    /**
     * Get the upper-case initial used in card tokens (H/D/C/S).
     */
    public char getSymbol() {
        return symbol;
    }

    /**
     * Parse a suit from its initial.
     * @param c The character (H/D/C/S, case-insensitive)
     * @return The corresponding Suit
     * @throws InvalidCardTokenException if the character is not a suit initial
     */
    public static Suit fromChar(char c) {
        return switch (Character.toUpperCase(c)) {
            case 'H' -> HEARTS;
            case 'D' -> DIAMONDS;
            case 'C' -> CLUBS;
            case 'S' -> SPADES;
            default -> throw new InvalidCardTokenException("Unknown suit: '" + c + "'");
        };
    }
}
