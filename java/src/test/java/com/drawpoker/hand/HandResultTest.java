package com.drawpoker.hand;

import com.drawpoker.card.Card;
import com.drawpoker.card.Rank;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the per-category result records.
 */
class HandResultTest {

    private static List<Card> cards(String... tokens) {
        return Card.parseAll(List.of(tokens));
    }

    @Test
    void testRejectsWrongCardCount() {
        assertThrows(IllegalArgumentException.class,
                () -> new HandResult.HighCard(cards("AH", "KD", "QC", "JS")));
        assertThrows(IllegalArgumentException.class,
                () -> new HandResult.Flush(cards("AH", "KH", "QH", "JH", "9H", "2H")));
    }

    @Test
    void testRejectsWrongKickerCount() {
        assertThrows(IllegalArgumentException.class, () -> new HandResult.Pair(Rank.JACK,
                List.of(Rank.NINE, Rank.FIVE), cards("JH", "JD", "9C", "5S", "2D")));
        assertThrows(IllegalArgumentException.class, () -> new HandResult.ThreeOfAKind(Rank.QUEEN,
                List.of(Rank.NINE), cards("QH", "QD", "QC", "9S", "3D")));
    }

    @Test
    void testKeysFollowPayload() {
        HandResult twoPair = new HandResult.TwoPair(Rank.KING, Rank.FOUR, Rank.NINE,
                cards("KH", "KD", "4C", "4S", "9H"));
        assertEquals(List.of(13, 4, 9), twoPair.highCards());
        assertEquals(3, twoPair.rank());
        assertEquals("Two Pair", twoPair.name());
    }

    @Test
    void testCategoryRanks() {
        assertEquals(1, HandCategory.HIGH_CARD.getRank());
        assertEquals(10, HandCategory.ROYAL_FLUSH.getRank());
        for (HandCategory category : HandCategory.values()) {
            assertEquals(category.ordinal() + 1, category.getRank());
        }
    }

    @Test
    void testJson() throws Exception {
        HandResult hand = HandEvaluator.evaluate(cards("AH", "KH", "QH", "JH", "10H"));
        JsonNode json = new ObjectMapper().valueToTree(hand);

        assertEquals("ROYAL_FLUSH", json.get("category").asText());
        assertEquals(10, json.get("rank").asInt());
        assertEquals("Royal Flush", json.get("name").asText());
        assertEquals("10H", json.get("cards").get(4).asText());
        assertEquals(14, json.get("highCards").get(0).asInt());
    }
}
