package com.drawpoker.hand;

/**
 * Thrown when fewer than five cards are handed to the evaluator.
 */
public class InsufficientCardsException extends IllegalArgumentException {
    public InsufficientCardsException(int count) {
        super("Need at least 5 cards to evaluate a hand, got " + count);
    }
}
