package com.drawpoker.hand;

import java.util.Comparator;
import java.util.List;

/**
 * Orders hands by category rank, then by tie-break keys element by element.
 * Hands whose keys match over their common length are equal.
 */
public final class HandComparator implements Comparator<HandResult> {
    public static final HandComparator INSTANCE = new HandComparator();

    private HandComparator() {
    }

    @Override
    public int compare(HandResult a, HandResult b) {
        int byRank = Integer.compare(a.rank(), b.rank());
        if (byRank != 0) {
            return byRank;
        }
        List<Integer> keysA = a.highCards();
        List<Integer> keysB = b.highCards();
        int common = Math.min(keysA.size(), keysB.size());
        for (int i = 0; i < common; i++) {
            int byKey = Integer.compare(keysA.get(i), keysB.get(i));
            if (byKey != 0) {
                return byKey;
            }
        }
        return 0;
    }

    /**
     * Positive if {@code a} beats {@code b}, negative if it loses, 0 on a tie.
     */
    public static int compareHands(HandResult a, HandResult b) {
        return INSTANCE.compare(a, b);
    }
}
