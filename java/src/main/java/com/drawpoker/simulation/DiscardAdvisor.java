package com.drawpoker.simulation;

import com.drawpoker.card.Card;
import com.drawpoker.game.MatchRules;
import com.drawpoker.hand.BestHandFinder;
import com.drawpoker.hand.HandResult;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Simple draw strategy: keep the five cards of the current best hand and
 * redraw everything else.
 */
public final class DiscardAdvisor {

    private DiscardAdvisor() {
    }

    /**
     * Indices, ascending, of the cards the best hand does not use.
     */
    public static List<Integer> suggestDiscards(List<Card> hand) {
        HandResult best = BestHandFinder.bestHand(hand);
        Set<Card> kept = new HashSet<>(best.cards());
        List<Integer> discards = new ArrayList<>();
        for (int i = 0; i < hand.size() && discards.size() < MatchRules.MAX_DISCARDS; i++) {
            if (!kept.contains(hand.get(i))) {
                discards.add(i);
            }
        }
        return List.copyOf(discards);
    }
}
