package com.drawpoker.hand;

import com.drawpoker.card.Card;
import com.drawpoker.card.Rank;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An evaluated five-card hand. One record per category, each carrying the
 * tie-break payload that category needs; {@link #highCards()} flattens that
 * payload into the ordered key compared by {@link HandComparator}.
 * {@link #cards()} always holds exactly the 5 substantiating cards, primary
 * grouping first, kickers descending.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "category"
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = HandResult.RoyalFlush.class, name = "ROYAL_FLUSH"),
    @JsonSubTypes.Type(value = HandResult.StraightFlush.class, name = "STRAIGHT_FLUSH"),
    @JsonSubTypes.Type(value = HandResult.FourOfAKind.class, name = "FOUR_OF_A_KIND"),
    @JsonSubTypes.Type(value = HandResult.FullHouse.class, name = "FULL_HOUSE"),
    @JsonSubTypes.Type(value = HandResult.Flush.class, name = "FLUSH"),
    @JsonSubTypes.Type(value = HandResult.Straight.class, name = "STRAIGHT"),
    @JsonSubTypes.Type(value = HandResult.ThreeOfAKind.class, name = "THREE_OF_A_KIND"),
    @JsonSubTypes.Type(value = HandResult.TwoPair.class, name = "TWO_PAIR"),
    @JsonSubTypes.Type(value = HandResult.Pair.class, name = "PAIR"),
    @JsonSubTypes.Type(value = HandResult.HighCard.class, name = "HIGH_CARD")
})
@JsonPropertyOrder({"rank", "name", "cards", "highCards"})
public sealed interface HandResult extends Comparable<HandResult>
        permits HandResult.RoyalFlush, HandResult.StraightFlush, HandResult.FourOfAKind,
                HandResult.FullHouse, HandResult.Flush, HandResult.Straight,
                HandResult.ThreeOfAKind, HandResult.TwoPair, HandResult.Pair, HandResult.HighCard {

    int HAND_SIZE = 5;

    HandCategory category();

    List<Card> cards();

    /**
     * Ordered tie-break key compared lexicographically within a category.
     */
    @JsonProperty("highCards")
    List<Integer> highCards();

    /**
     * Category rank, 1 (high card) to 10 (royal flush).
     */
    @JsonProperty("rank")
    default int rank() {
        return category().getRank();
    }

    @JsonProperty("name")
    default String name() {
        return category().getDisplayName();
    }

    @Override
    default int compareTo(HandResult other) {
        return HandComparator.INSTANCE.compare(this, other);
    }

    private static List<Card> fiveCards(List<Card> cards) {
        Objects.requireNonNull(cards, "cards");
        if (cards.size() != HAND_SIZE) {
            throw new IllegalArgumentException("A hand result holds exactly 5 cards, got " + cards.size());
        }
        return List.copyOf(cards);
    }

    private static List<Rank> ranks(List<Rank> ranks, int expected) {
        if (ranks.size() != expected) {
            throw new IllegalArgumentException("Expected " + expected + " kickers, got " + ranks.size());
        }
        return List.copyOf(ranks);
    }

    private static List<Integer> keys(Rank first, List<Rank> rest) {
        List<Integer> keys = new ArrayList<>(rest.size() + 1);
        keys.add(first.getValue());
        rest.forEach(r -> keys.add(r.getValue()));
        return List.copyOf(keys);
    }

    private static List<Integer> cardValues(List<Card> cards) {
        return cards.stream().map(Card::value).toList();
    }

    /**
     * A-K-Q-J-10 of one suit.
     */
    record RoyalFlush(List<Card> cards) implements HandResult {
        public RoyalFlush {
            cards = fiveCards(cards);
        }

        @Override
        public HandCategory category() {
            return HandCategory.ROYAL_FLUSH;
        }

        @Override
        public List<Integer> highCards() {
            return List.of(Rank.ACE.getValue());
        }
    }

    /**
     * Five suited cards in sequence. {@code high} is FIVE for the wheel.
     */
    record StraightFlush(Rank high, List<Card> cards) implements HandResult {
        public StraightFlush {
            Objects.requireNonNull(high, "high");
            cards = fiveCards(cards);
        }

        @Override
        public HandCategory category() {
            return HandCategory.STRAIGHT_FLUSH;
        }

        @Override
        public List<Integer> highCards() {
            return List.of(high.getValue());
        }
    }

    record FourOfAKind(Rank quad, Rank kicker, List<Card> cards) implements HandResult {
        public FourOfAKind {
            Objects.requireNonNull(quad, "quad");
            Objects.requireNonNull(kicker, "kicker");
            cards = fiveCards(cards);
        }

        @Override
        public HandCategory category() {
            return HandCategory.FOUR_OF_A_KIND;
        }

        @Override
        public List<Integer> highCards() {
            return keys(quad, List.of(kicker));
        }
    }

    record FullHouse(Rank trips, Rank pair, List<Card> cards) implements HandResult {
        public FullHouse {
            Objects.requireNonNull(trips, "trips");
            Objects.requireNonNull(pair, "pair");
            cards = fiveCards(cards);
        }

        @Override
        public HandCategory category() {
            return HandCategory.FULL_HOUSE;
        }

        @Override
        public List<Integer> highCards() {
            return keys(trips, List.of(pair));
        }
    }

    /**
     * Five cards of one suit, highest first; every card is a tie-break key.
     */
    record Flush(List<Card> cards) implements HandResult {
        public Flush {
            cards = fiveCards(cards);
        }

        @Override
        public HandCategory category() {
            return HandCategory.FLUSH;
        }

        @Override
        public List<Integer> highCards() {
            return cardValues(cards);
        }
    }

    record Straight(Rank high, List<Card> cards) implements HandResult {
        public Straight {
            Objects.requireNonNull(high, "high");
            cards = fiveCards(cards);
        }

        @Override
        public HandCategory category() {
            return HandCategory.STRAIGHT;
        }

        @Override
        public List<Integer> highCards() {
            return List.of(high.getValue());
        }
    }

    record ThreeOfAKind(Rank trips, List<Rank> kickers, List<Card> cards) implements HandResult {
        public ThreeOfAKind {
            Objects.requireNonNull(trips, "trips");
            kickers = ranks(kickers, 2);
            cards = fiveCards(cards);
        }

        @Override
        public HandCategory category() {
            return HandCategory.THREE_OF_A_KIND;
        }

        @Override
        public List<Integer> highCards() {
            return keys(trips, kickers);
        }
    }

    record TwoPair(Rank highPair, Rank lowPair, Rank kicker, List<Card> cards) implements HandResult {
        public TwoPair {
            Objects.requireNonNull(highPair, "highPair");
            Objects.requireNonNull(lowPair, "lowPair");
            Objects.requireNonNull(kicker, "kicker");
            cards = fiveCards(cards);
        }

        @Override
        public HandCategory category() {
            return HandCategory.TWO_PAIR;
        }

        @Override
        public List<Integer> highCards() {
            return keys(highPair, List.of(lowPair, kicker));
        }
    }

    record Pair(Rank pair, List<Rank> kickers, List<Card> cards) implements HandResult {
        public Pair {
            Objects.requireNonNull(pair, "pair");
            kickers = ranks(kickers, 3);
            cards = fiveCards(cards);
        }

        @Override
        public HandCategory category() {
            return HandCategory.PAIR;
        }

        @Override
        public List<Integer> highCards() {
            return keys(pair, kickers);
        }
    }

    record HighCard(List<Card> cards) implements HandResult {
        public HighCard {
            cards = fiveCards(cards);
        }

        @Override
        public HandCategory category() {
            return HandCategory.HIGH_CARD;
        }

        @Override
        public List<Integer> highCards() {
            return cardValues(cards);
        }
    }
}
