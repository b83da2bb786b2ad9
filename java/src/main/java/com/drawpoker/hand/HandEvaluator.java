package com.drawpoker.hand;

import com.drawpoker.card.Card;
import com.drawpoker.card.Rank;
import com.drawpoker.card.Suit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Classifies a set of five or more cards into one of the ten hand categories.
 *
 * <p>Categories are tried from strongest to weakest and the first match wins:
 * straight/royal flush, four of a kind, full house, flush, straight, three of a
 * kind, two pair, pair, high card. Input is sorted with
 * {@link Card#BY_RANK_DESCENDING} before anything else, so the result does not
 * depend on the order the cards arrive in.
 */
public final class HandEvaluator {

    private HandEvaluator() {
    }

    /**
     * Evaluate the cards as a single hand.
     * @throws InsufficientCardsException if fewer than 5 cards are given
     */
    public static HandResult evaluate(List<Card> cards) {
        Objects.requireNonNull(cards, "cards");
        if (cards.size() < HandResult.HAND_SIZE) {
            throw new InsufficientCardsException(cards.size());
        }
        List<Card> sorted = new ArrayList<>(cards);
        sorted.sort(Card.BY_RANK_DESCENDING);

        Optional<HandResult> straightFlush = straightFlush(sorted);
        if (straightFlush.isPresent()) {
            return straightFlush.get();
        }

        Map<Rank, List<Card>> byRank = groupByRank(sorted);
        List<Rank> quads = ranksWithAtLeast(byRank, 4);
        List<Rank> trips = ranksWithAtLeast(byRank, 3);
        List<Rank> pairs = ranksWithAtLeast(byRank, 2);

        if (!quads.isEmpty()) {
            Rank quad = quads.get(0);
            Card kicker = kickers(sorted, List.of(quad), 1).get(0);
            List<Card> hand = new ArrayList<>(byRank.get(quad).subList(0, 4));
            hand.add(kicker);
            return new HandResult.FourOfAKind(quad, kicker.rank(), hand);
        }

        if (!trips.isEmpty()) {
            Rank tripRank = trips.get(0);
            // another trips can fill the pair role, so look at every rank with 2+
            Optional<Rank> pairRank = pairs.stream().filter(r -> r != tripRank).findFirst();
            if (pairRank.isPresent()) {
                List<Card> hand = new ArrayList<>(byRank.get(tripRank).subList(0, 3));
                hand.addAll(byRank.get(pairRank.get()).subList(0, 2));
                return new HandResult.FullHouse(tripRank, pairRank.get(), hand);
            }
        }

        Optional<List<Card>> flush = flushCards(sorted);
        if (flush.isPresent()) {
            return new HandResult.Flush(flush.get());
        }

        Optional<List<Card>> straight = StraightDetector.findStraight(sorted);
        if (straight.isPresent()) {
            List<Card> hand = straight.get();
            return new HandResult.Straight(hand.get(0).rank(), hand);
        }

        if (!trips.isEmpty()) {
            Rank tripRank = trips.get(0);
            List<Card> kickers = kickers(sorted, List.of(tripRank), 2);
            List<Card> hand = new ArrayList<>(byRank.get(tripRank).subList(0, 3));
            hand.addAll(kickers);
            return new HandResult.ThreeOfAKind(tripRank, ranksOf(kickers), hand);
        }

        if (pairs.size() >= 2) {
            Rank highPair = pairs.get(0);
            Rank lowPair = pairs.get(1);
            Card kicker = kickers(sorted, List.of(highPair, lowPair), 1).get(0);
            List<Card> hand = new ArrayList<>(byRank.get(highPair));
            hand.addAll(byRank.get(lowPair));
            hand.add(kicker);
            return new HandResult.TwoPair(highPair, lowPair, kicker.rank(), hand);
        }

        if (pairs.size() == 1) {
            Rank pair = pairs.get(0);
            List<Card> kickers = kickers(sorted, List.of(pair), 3);
            List<Card> hand = new ArrayList<>(byRank.get(pair));
            hand.addAll(kickers);
            return new HandResult.Pair(pair, ranksOf(kickers), hand);
        }

        return new HandResult.HighCard(sorted.subList(0, HandResult.HAND_SIZE));
    }

    /**
     * Straight flush in any suit holding 5+ cards; the highest one wins when
     * several suits qualify. A-high is a royal flush, the wheel is 5-high.
     */
    private static Optional<HandResult> straightFlush(List<Card> sorted) {
        List<Card> best = null;
        for (Suit suit : Suit.values()) {
            List<Card> suited = suited(sorted, suit);
            if (suited.size() < HandResult.HAND_SIZE) {
                continue;
            }
            Optional<List<Card>> run = StraightDetector.findStraight(suited);
            if (run.isPresent() && (best == null || topValue(run.get()) > topValue(best))) {
                best = run.get();
            }
        }
        if (best == null) {
            return Optional.empty();
        }
        Rank high = best.get(0).rank();
        if (high == Rank.ACE) {
            return Optional.of(new HandResult.RoyalFlush(best));
        }
        return Optional.of(new HandResult.StraightFlush(high, best));
    }

    /**
     * Top five cards of the suit with the strongest five, or empty if no suit
     * holds five cards.
     */
    private static Optional<List<Card>> flushCards(List<Card> sorted) {
        List<Card> best = null;
        for (Suit suit : Suit.values()) {
            List<Card> suited = suited(sorted, suit);
            if (suited.size() < HandResult.HAND_SIZE) {
                continue;
            }
            List<Card> top = suited.subList(0, HandResult.HAND_SIZE);
            if (best == null || compareValues(top, best) > 0) {
                best = top;
            }
        }
        return Optional.ofNullable(best);
    }

    private static List<Card> suited(List<Card> sorted, Suit suit) {
        return sorted.stream().filter(c -> c.suit() == suit).toList();
    }

    private static int topValue(List<Card> straight) {
        return straight.get(0).value();
    }

    private static int compareValues(List<Card> a, List<Card> b) {
        for (int i = 0; i < a.size(); i++) {
            int cmp = Integer.compare(a.get(i).value(), b.get(i).value());
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    /**
     * Cards grouped by rank, highest rank first.
     */
    private static Map<Rank, List<Card>> groupByRank(List<Card> sorted) {
        Map<Rank, List<Card>> groups = new LinkedHashMap<>();
        for (Card card : sorted) {
            groups.computeIfAbsent(card.rank(), r -> new ArrayList<>()).add(card);
        }
        return groups;
    }

    private static List<Rank> ranksWithAtLeast(Map<Rank, List<Card>> byRank, int count) {
        return byRank.entrySet().stream()
                .filter(e -> e.getValue().size() >= count)
                .map(Map.Entry::getKey)
                .toList();
    }

    /**
     * Highest {@code count} cards whose rank is not in {@code excluded}.
     */
    private static List<Card> kickers(List<Card> sorted, List<Rank> excluded, int count) {
        return sorted.stream()
                .filter(c -> !excluded.contains(c.rank()))
                .limit(count)
                .toList();
    }

    private static List<Rank> ranksOf(List<Card> cards) {
        return cards.stream().map(Card::rank).toList();
    }
}
