package com.drawpoker.game;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * One of the two seats at a round.
 */
public enum Seat {
    PLAYER1("player1"),
    PLAYER2("player2");

    private final String id;

    Seat(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public Seat other() {
        return this == PLAYER1 ? PLAYER2 : PLAYER1;
    }

    /**
     * Parse "player1" or "player2", case-insensitive.
     * @throws IllegalArgumentException for anything else
     */
    @JsonCreator
    public static Seat fromId(String id) {
        for (Seat seat : values()) {
            if (seat.id.equalsIgnoreCase(id)) {
                return seat;
            }
        }
        throw new IllegalArgumentException("Unknown seat: " + id);
    }
}
