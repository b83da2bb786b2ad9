package com.drawpoker.hand;

import com.drawpoker.card.Card;
import com.drawpoker.card.Rank;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the run scan and the wheel check in isolation.
 */
class StraightDetectorTest {

    private static List<Card> sorted(String... tokens) {
        List<Card> cards = new ArrayList<>(Card.parseAll(List.of(tokens)));
        cards.sort(Card.BY_RANK_DESCENDING);
        return cards;
    }

    @Test
    void testRunStartFindsHighestRun() {
        List<Rank> ranks = List.of(Rank.KING, Rank.TEN, Rank.NINE, Rank.EIGHT, Rank.SEVEN, Rank.SIX, Rank.FIVE);
        assertEquals(1, StraightDetector.highestRunStart(ranks));
    }

    @Test
    void testRunStartWithoutRun() {
        List<Rank> ranks = List.of(Rank.ACE, Rank.KING, Rank.QUEEN, Rank.JACK, Rank.NINE);
        assertEquals(-1, StraightDetector.highestRunStart(ranks));
        assertEquals(-1, StraightDetector.highestRunStart(List.of(Rank.FIVE, Rank.FOUR)));
    }

    @Test
    void testRunScanDoesNotTreatAceAsLow() {
        List<Rank> ranks = List.of(Rank.ACE, Rank.FIVE, Rank.FOUR, Rank.THREE, Rank.TWO);
        assertEquals(-1, StraightDetector.highestRunStart(ranks));
    }

    @Test
    void testWheelCheck() {
        assertTrue(StraightDetector.isWheel(EnumSet.of(Rank.ACE, Rank.TWO, Rank.THREE, Rank.FOUR, Rank.FIVE)));
        assertTrue(StraightDetector.isWheel(EnumSet.of(Rank.ACE, Rank.TWO, Rank.THREE, Rank.FOUR, Rank.FIVE, Rank.NINE)));
        assertFalse(StraightDetector.isWheel(EnumSet.of(Rank.KING, Rank.TWO, Rank.THREE, Rank.FOUR, Rank.FIVE)));
    }

    @Test
    void testFindWheelOrdersAceLast() {
        Optional<List<Card>> straight = StraightDetector.findStraight(sorted("AS", "3C", "5S", "2H", "4D"));
        assertTrue(straight.isPresent());
        assertEquals(List.of("5S", "4D", "3C", "2H", "AS"), Card.toTokens(straight.get()));
    }

    @Test
    void testFindNothing() {
        assertTrue(StraightDetector.findStraight(sorted("AS", "KC", "QS", "JH", "9D")).isEmpty());
    }
}
