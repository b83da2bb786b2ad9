package com.drawpoker.simulation;

import com.drawpoker.card.Card;
import com.drawpoker.game.Deal;
import com.drawpoker.game.Dealer;
import com.drawpoker.game.RoundOutcome;
import com.drawpoker.game.RoundResolver;
import com.drawpoker.game.Seat;

import java.util.List;

/**
 * Replays a recorded round from its seed and discards.
 * The first player draws from reserve position 0; the second player continues
 * where the first left off.
 */
public final class RoundReplayer {

    private RoundReplayer() {
    }

    /**
     * Final hands of both players and the resolved outcome.
     */
    public record ReplayResult(List<Card> player1Hand, List<Card> player2Hand, RoundOutcome outcome) {
    }

    public static ReplayResult replay(RoundRecord record) {
        Deal deal = Dealer.dealHands(record.seed());
        Seat first = record.firstPlayer();
        List<Integer> firstDiscards = record.discardsFor(first);
        List<Integer> secondDiscards = record.discardsFor(first.other());

        List<Card> firstHand = Dealer.applyDraw(handOf(deal, first), firstDiscards, deal.reserve(), 0);
        List<Card> secondHand = Dealer.applyDraw(handOf(deal, first.other()), secondDiscards,
                deal.reserve(), Dealer.drawCursorFor(firstDiscards));

        List<Card> player1Hand = first == Seat.PLAYER1 ? firstHand : secondHand;
        List<Card> player2Hand = first == Seat.PLAYER1 ? secondHand : firstHand;
        return new ReplayResult(player1Hand, player2Hand, RoundResolver.resolveRound(player1Hand, player2Hand));
    }

    private static List<Card> handOf(Deal deal, Seat seat) {
        return seat == Seat.PLAYER1 ? deal.player1() : deal.player2();
    }
}
