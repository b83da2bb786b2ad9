package com.drawpoker.game;

import com.drawpoker.card.Card;

import java.util.List;

/**
 * Result of dealing one round: two 7-card hands and the 38-card reserve
 * that supplies draw-phase replacements.
 */
public record Deal(List<Card> player1, List<Card> player2, List<Card> reserve) {
    public Deal {
        player1 = List.copyOf(player1);
        player2 = List.copyOf(player2);
        reserve = List.copyOf(reserve);
    }
}
