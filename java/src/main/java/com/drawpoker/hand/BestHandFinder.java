package com.drawpoker.hand;

import com.drawpoker.card.Card;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Picks the strongest 5-card hand out of a larger set.
 */
public final class BestHandFinder {

    private BestHandFinder() {
    }

    /**
     * Evaluate every 5-card subset and keep the best.
     * Exactly 5 cards are evaluated directly; 7 cards give 21 candidates.
     * Among equal candidates the first one enumerated is kept.
     *
     * @throws InsufficientCardsException if fewer than 5 cards are given
     */
    public static HandResult bestHand(List<Card> cards) {
        Objects.requireNonNull(cards, "cards");
        if (cards.size() < HandResult.HAND_SIZE) {
            throw new InsufficientCardsException(cards.size());
        }
        if (cards.size() == HandResult.HAND_SIZE) {
            return HandEvaluator.evaluate(cards);
        }

        HandResult best = null;
        for (List<Card> subset : fiveCardSubsets(cards)) {
            HandResult candidate = HandEvaluator.evaluate(subset);
            if (best == null || HandComparator.compareHands(candidate, best) > 0) {
                best = candidate;
            }
        }
        return best;
    }

    /**
     * All 5-card subsets in lexicographic order of their positions.
     */
    public static List<List<Card>> fiveCardSubsets(List<Card> cards) {
        int n = cards.size();
        int k = HandResult.HAND_SIZE;
        List<List<Card>> subsets = new ArrayList<>();
        if (n < k) {
            return subsets;
        }

        int[] idx = new int[k];
        for (int i = 0; i < k; i++) {
            idx[i] = i;
        }
        while (true) {
            List<Card> subset = new ArrayList<>(k);
            for (int i : idx) {
                subset.add(cards.get(i));
            }
            subsets.add(subset);

            // advance the rightmost position that still has room
            int pos = k - 1;
            while (pos >= 0 && idx[pos] == n - k + pos) {
                pos--;
            }
            if (pos < 0) {
                return subsets;
            }
            idx[pos]++;
            for (int i = pos + 1; i < k; i++) {
                idx[i] = idx[i - 1] + 1;
            }
        }
    }
}
