package com.drawpoker.game;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Winner of a round; NONE on a tie.
 */
public enum Winner {
    PLAYER1("player1"),
    PLAYER2("player2"),
    NONE("none");

    private final String id;

    Winner(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public static Winner of(Seat seat) {
        return seat == Seat.PLAYER1 ? PLAYER1 : PLAYER2;
    }
}
