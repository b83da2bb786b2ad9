package com.drawpoker.game;

import com.drawpoker.card.Card;
import com.drawpoker.hand.BestHandFinder;
import com.drawpoker.hand.HandComparator;
import com.drawpoker.hand.HandResult;

import java.util.List;

/**
 * Decides a round from the two final hands.
 */
public final class RoundResolver {

    private RoundResolver() {
    }

    /**
     * Find each side's best hand and compare them.
     * @throws com.drawpoker.hand.InsufficientCardsException if either side has fewer than 5 cards
     */
    public static RoundOutcome resolveRound(List<Card> player1Cards, List<Card> player2Cards) {
        HandResult player1Hand = BestHandFinder.bestHand(player1Cards);
        HandResult player2Hand = BestHandFinder.bestHand(player2Cards);

        int comparison = HandComparator.compareHands(player1Hand, player2Hand);
        Winner winner;
        if (comparison > 0) {
            winner = Winner.PLAYER1;
        } else if (comparison < 0) {
            winner = Winner.PLAYER2;
        } else {
            winner = Winner.NONE;
        }
        return new RoundOutcome(winner, player1Hand, player2Hand);
    }
}
