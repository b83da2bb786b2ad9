package com.drawpoker.game;

import com.drawpoker.card.Card;
import com.drawpoker.card.Rank;
import com.drawpoker.card.Suit;
import com.drawpoker.rng.SeededRandom;

import java.util.ArrayList;
import java.util.List;

/**
 * The 52-card deck: canonical construction and seeded shuffling.
 */
public final class StandardDeck {
    public static final int SIZE = 52;

    private StandardDeck() {
    }

    /**
     * Build the deck suit-major, rank-minor: 2H..AH, 2D..AD, 2C..AC, 2S..AS.
     */
    public static List<Card> build() {
        List<Card> deck = new ArrayList<>(SIZE);
        for (Suit suit : Suit.values()) {
            for (Rank rank : Rank.values()) {
                deck.add(new Card(rank, suit));
            }
        }
        return List.copyOf(deck);
    }

    /**
     * Shuffle a copy of the deck with a generator seeded from {@code seed}.
     * The same seed always yields the same order.
     */
    public static List<Card> shuffle(List<Card> deck, String seed) {
        List<Card> shuffled = new ArrayList<>(deck);
        new SeededRandom(seed).shuffle(shuffled);
        return List.copyOf(shuffled);
    }

    /**
     * Build and shuffle in one step.
     */
    public static List<Card> shuffled(String seed) {
        return shuffle(build(), seed);
    }
}
