package com.drawpoker.game;

import com.drawpoker.card.Card;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Dealing and draw replacement.
 * Hands are never mutated in place; every operation returns a new list.
 */
public final class Dealer {

    private Dealer() {
    }

    /**
     * Shuffle a fresh deck with {@code seed} and split it into
     * [0,7) for player 1, [7,14) for player 2 and [14,52) as the reserve.
     */
    public static Deal dealHands(String seed) {
        Objects.requireNonNull(seed, "seed");
        List<Card> deck = StandardDeck.shuffled(seed);
        int handSize = MatchRules.HAND_SIZE;
        return new Deal(
                deck.subList(0, handSize),
                deck.subList(handSize, 2 * handSize),
                deck.subList(2 * handSize, deck.size()));
    }

    /**
     * Replace each listed position with the next reserve card, starting at
     * {@code reserveCursor} and consuming reserve cards in the order the
     * discards are listed.
     *
     * <p>A discard index outside [0,7), or one whose reserve position lies past
     * the end of the reserve, is skipped without error. The reserve position is
     * still consumed by the skipped entry.
     *
     * @return a new hand of the same size
     */
    public static List<Card> applyDraw(List<Card> hand, List<Integer> discardIndices,
                                       List<Card> reserve, int reserveCursor) {
        List<Card> newHand = new ArrayList<>(hand);
        for (int i = 0; i < discardIndices.size(); i++) {
            Integer index = discardIndices.get(i);
            int reservePos = reserveCursor + i;
            if (index != null && index >= 0 && index < MatchRules.HAND_SIZE && index < newHand.size()
                    && reservePos >= 0 && reservePos < reserve.size()) {
                newHand.set(index, reserve.get(reservePos));
            }
        }
        return List.copyOf(newHand);
    }

    /**
     * Reserve cursor for the player drawing second: the first player's
     * replacements come off the reserve before theirs.
     */
    public static int drawCursorFor(List<Integer> firstPlayerDiscards) {
        return firstPlayerDiscards.size();
    }
}
