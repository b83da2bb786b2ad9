package com.drawpoker.hand;

import com.drawpoker.card.Card;
import com.drawpoker.card.Rank;
import com.drawpoker.game.Deal;
import com.drawpoker.game.Dealer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for single-hand classification.
 */
class HandEvaluatorTest {

    private static HandResult eval(String... tokens) {
        return HandEvaluator.evaluate(Card.parseAll(List.of(tokens)));
    }

    private static List<String> tokens(HandResult hand) {
        return Card.toTokens(hand.cards());
    }

    // ==================== KNOWN FIXTURES ====================

    @Test
    void testRoyalFlush() {
        HandResult hand = eval("AH", "KH", "QH", "JH", "10H");
        assertInstanceOf(HandResult.RoyalFlush.class, hand);
        assertEquals(10, hand.rank());
        assertEquals("Royal Flush", hand.name());
        assertEquals(List.of(14), hand.highCards());
    }

    @Test
    void testWheelStraight() {
        HandResult hand = eval("5S", "4D", "3C", "2H", "AS");
        assertEquals(HandCategory.STRAIGHT, hand.category());
        assertEquals(5, hand.rank());
        assertEquals(List.of(5), hand.highCards());
        assertEquals(List.of("5S", "4D", "3C", "2H", "AS"), tokens(hand));
    }

    @Test
    void testFullHouse() {
        HandResult hand = eval("7H", "7D", "7C", "2S", "2D");
        assertEquals(HandCategory.FULL_HOUSE, hand.category());
        assertEquals(7, hand.rank());
        assertEquals(List.of(7, 2), hand.highCards());
    }

    @Test
    void testFourOfAKind() {
        HandResult hand = eval("2H", "2D", "2C", "2S", "9H");
        assertEquals(HandCategory.FOUR_OF_A_KIND, hand.category());
        assertEquals(8, hand.rank());
        assertEquals(List.of(2, 9), hand.highCards());
        assertEquals("9H", tokens(hand).get(4));
    }

    // ==================== EACH CATEGORY ====================

    @Test
    void testStraightFlush() {
        HandResult hand = eval("9C", "5C", "8C", "6C", "7C");
        assertInstanceOf(HandResult.StraightFlush.class, hand);
        assertEquals(9, hand.rank());
        assertEquals(List.of(9), hand.highCards());
        assertEquals(List.of("9C", "8C", "7C", "6C", "5C"), tokens(hand));
    }

    @Test
    void testSteelWheelIsStraightFlushNotRoyal() {
        HandResult hand = eval("AH", "2H", "3H", "4H", "5H");
        assertEquals(HandCategory.STRAIGHT_FLUSH, hand.category());
        assertEquals(List.of(5), hand.highCards());
        assertEquals(Rank.FIVE, ((HandResult.StraightFlush) hand).high());
    }

    @Test
    void testFlush() {
        HandResult hand = eval("4H", "AH", "7H", "10H", "2H");
        assertEquals(HandCategory.FLUSH, hand.category());
        assertEquals(List.of(14, 10, 7, 4, 2), hand.highCards());
        assertEquals(List.of("AH", "10H", "7H", "4H", "2H"), tokens(hand));
    }

    @Test
    void testBroadwayStraight() {
        HandResult hand = eval("AS", "KD", "QC", "JH", "10S");
        assertEquals(HandCategory.STRAIGHT, hand.category());
        assertEquals(List.of(14), hand.highCards());
    }

    @Test
    void testNoWrapAroundStraight() {
        HandResult hand = eval("QS", "KD", "AC", "2H", "3S");
        assertEquals(HandCategory.HIGH_CARD, hand.category());
    }

    @Test
    void testThreeOfAKind() {
        HandResult hand = eval("QH", "3D", "QD", "9S", "QC");
        assertEquals(HandCategory.THREE_OF_A_KIND, hand.category());
        assertEquals(List.of(12, 9, 3), hand.highCards());
        assertEquals(List.of("QH", "QD", "QC", "9S", "3D"), tokens(hand));
    }

    @Test
    void testTwoPair() {
        HandResult hand = eval("4C", "KH", "9H", "KD", "4S");
        assertEquals(HandCategory.TWO_PAIR, hand.category());
        assertEquals(List.of(13, 4, 9), hand.highCards());
        assertEquals(List.of("KH", "KD", "4C", "4S", "9H"), tokens(hand));
    }

    @Test
    void testPair() {
        HandResult hand = eval("JH", "2D", "9C", "JD", "5S");
        assertEquals(HandCategory.PAIR, hand.category());
        assertEquals(List.of(11, 9, 5, 2), hand.highCards());
    }

    @Test
    void testHighCard() {
        HandResult hand = eval("2D", "AH", "9C", "JD", "5S");
        assertEquals(HandCategory.HIGH_CARD, hand.category());
        assertEquals(List.of(14, 11, 9, 5, 2), hand.highCards());
    }

    // ==================== LARGER SETS ====================

    @Test
    void testTwoTripsMakeFullHouse() {
        HandResult hand = eval("5S", "8H", "5D", "8D", "KH", "8C", "5C");
        assertEquals(HandCategory.FULL_HOUSE, hand.category());
        assertEquals(List.of(8, 5), hand.highCards());
        assertEquals(List.of("8H", "8D", "8C", "5D", "5C"), tokens(hand));
    }

    @Test
    void testTwoTripsLowerTripsIsThePair() {
        HandResult hand = eval("3H", "3D", "3C", "JS", "JD", "JC", "2H");
        assertEquals(List.of(11, 3), hand.highCards());
    }

    @Test
    void testTripsWithHigherPairThanSecondTrips() {
        HandResult hand = eval("9H", "9D", "9C", "5S", "5D", "KS", "KH");
        assertEquals(HandCategory.FULL_HOUSE, hand.category());
        assertEquals(List.of(9, 13), hand.highCards());
    }

    @Test
    void testTripsWithTwoPairsPicksHigherPair() {
        HandResult hand = eval("6H", "6D", "6C", "4S", "4D", "10S", "10H");
        assertEquals(List.of(6, 10), hand.highCards());
    }

    @Test
    void testFlushBeatsStraightInSevenCards() {
        HandResult hand = eval("2H", "5H", "7H", "9H", "JH", "8D", "10C");
        assertEquals(HandCategory.FLUSH, hand.category());
        assertEquals(List.of(11, 9, 7, 5, 2), hand.highCards());
    }

    @Test
    void testSixFlushCardsKeepsTopFive() {
        HandResult hand = eval("2S", "5S", "7S", "9S", "JS", "KS", "3D");
        assertEquals(List.of(13, 11, 9, 7, 5), hand.highCards());
    }

    @Test
    void testStraightWithPairedRank() {
        HandResult hand = eval("5S", "6D", "7C", "8H", "9S", "9D", "2C");
        assertEquals(HandCategory.STRAIGHT, hand.category());
        assertEquals(List.of(9), hand.highCards());
        // duplicate nine collapses to one representative, the earliest suit in deck order
        assertEquals(List.of("9D", "8H", "7C", "6D", "5S"), tokens(hand));
    }

    @Test
    void testHighestStraightPreferredOverWheel() {
        HandResult hand = eval("AH", "2D", "3C", "4S", "5H", "6D", "KC");
        assertEquals(HandCategory.STRAIGHT, hand.category());
        assertEquals(List.of(6), hand.highCards());
    }

    @Test
    void testLongRunTakesTopFive() {
        HandResult hand = eval("4D", "5S", "6D", "7C", "8H", "9S", "10D");
        assertEquals(List.of(10), hand.highCards());
    }

    @Test
    void testStraightFlushBeatsQuadsInLargerSet() {
        HandResult hand = eval("5H", "6H", "7H", "8H", "9H", "9S", "9D", "9C");
        assertEquals(HandCategory.STRAIGHT_FLUSH, hand.category());
        assertEquals(List.of(9), hand.highCards());
    }

    @Test
    void testStraightFlushNeedsRunInsideOneSuit() {
        // straight and flush both present but not in the same five cards
        HandResult hand = eval("4H", "5H", "6H", "7H", "9H", "8D", "2C");
        assertEquals(HandCategory.FLUSH, hand.category());
    }

    @Test
    void testThreePairsUsesTopTwoAndBestKicker() {
        HandResult hand = eval("QH", "QD", "8C", "8S", "5D", "5C", "3H");
        assertEquals(HandCategory.TWO_PAIR, hand.category());
        assertEquals(List.of(12, 8, 5), hand.highCards());
    }

    @Test
    void testQuadsKickerIsBestRemaining() {
        HandResult hand = eval("7H", "7D", "7C", "7S", "2H", "KD", "KC");
        assertEquals(List.of(7, 13), hand.highCards());
    }

    // ==================== ERRORS AND INPUT ORDER ====================

    @Test
    void testTooFewCards() {
        InsufficientCardsException e = assertThrows(InsufficientCardsException.class,
                () -> eval("AH", "KH", "QH", "JH"));
        assertTrue(e.getMessage().contains("4"));
        assertThrows(InsufficientCardsException.class, () -> HandEvaluator.evaluate(List.of()));
    }

    @Test
    void testResultAlwaysHoldsFiveCards() {
        for (int i = 0; i < 200; i++) {
            Deal deal = Dealer.dealHands("five-" + i);
            assertEquals(5, HandEvaluator.evaluate(deal.player1()).cards().size());
        }
    }

    @Test
    void testEvaluationIgnoresInputOrder() {
        Random random = new Random(20240101L);
        for (int i = 0; i < 300; i++) {
            Deal deal = Dealer.dealHands("order-" + i);
            HandResult expected = HandEvaluator.evaluate(deal.player1());

            List<Card> reordered = new ArrayList<>(deal.player1());
            Collections.shuffle(reordered, random);
            assertEquals(expected, HandEvaluator.evaluate(reordered), "Seed order-" + i);
        }
    }

    @Test
    void testEvaluationDoesNotModifyInput() {
        List<Card> input = new ArrayList<>(Card.parseAll(List.of("2D", "AH", "9C", "JD", "5S")));
        List<Card> copy = List.copyOf(input);
        HandEvaluator.evaluate(input);
        assertEquals(copy, input);
    }
}
