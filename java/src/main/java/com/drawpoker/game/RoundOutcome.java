package com.drawpoker.game;

import com.drawpoker.hand.HandResult;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of comparing both players' best hands for one round.
 */
public record RoundOutcome(Winner winner, HandResult player1Hand, HandResult player2Hand) {

    @JsonProperty("isTie")
    public boolean isTie() {
        return winner == Winner.NONE;
    }
}
