package com.drawpoker.hand;

import com.drawpoker.card.Card;
import com.drawpoker.card.Rank;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Straight detection in two explicit steps: a consecutive-run scan over the
 * distinct ranks from the top down, then the wheel (A-2-3-4-5) only if the
 * scan found nothing.
 */
final class StraightDetector {
    static final int RUN_LENGTH = 5;

    private static final List<Rank> WHEEL = List.of(Rank.FIVE, Rank.FOUR, Rank.THREE, Rank.TWO, Rank.ACE);

    private StraightDetector() {
    }

    /**
     * Find the highest straight among the cards.
     * @param sortedCards cards in {@link Card#BY_RANK_DESCENDING} order
     * @return the 5 cards, top card first (5-4-3-2-A for the wheel), or empty
     */
    static Optional<List<Card>> findStraight(List<Card> sortedCards) {
        // first card of each rank in canonical order represents it
        Map<Rank, Card> representatives = new EnumMap<>(Rank.class);
        List<Rank> distinct = new ArrayList<>();
        for (Card card : sortedCards) {
            if (representatives.putIfAbsent(card.rank(), card) == null) {
                distinct.add(card.rank());
            }
        }

        int start = highestRunStart(distinct);
        if (start >= 0) {
            return Optional.of(pick(representatives, distinct.subList(start, start + RUN_LENGTH)));
        }
        if (isWheel(representatives.keySet())) {
            return Optional.of(pick(representatives, WHEEL));
        }
        return Optional.empty();
    }

    /**
     * Index of the top rank of the first run of 5 consecutive values.
     * @param distinctDescending distinct ranks, highest first
     * @return the start index, or -1 if no run exists
     */
    static int highestRunStart(List<Rank> distinctDescending) {
        for (int i = 0; i + RUN_LENGTH <= distinctDescending.size(); i++) {
            boolean consecutive = true;
            for (int j = 0; j < RUN_LENGTH - 1; j++) {
                if (distinctDescending.get(i + j).getValue() - distinctDescending.get(i + j + 1).getValue() != 1) {
                    consecutive = false;
                    break;
                }
            }
            if (consecutive) {
                return i;
            }
        }
        return -1;
    }

    static boolean isWheel(Set<Rank> ranks) {
        return ranks.containsAll(EnumSet.copyOf(WHEEL));
    }

    private static List<Card> pick(Map<Rank, Card> representatives, List<Rank> ranks) {
        return ranks.stream().map(representatives::get).toList();
    }
}
