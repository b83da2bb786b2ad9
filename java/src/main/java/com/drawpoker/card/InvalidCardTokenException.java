package com.drawpoker.card;

/**
 * Thrown when a card token such as "10H" or "AS" cannot be parsed.
 */
public class InvalidCardTokenException extends IllegalArgumentException {
    public InvalidCardTokenException(String message) {
        super(message);
    }
}
