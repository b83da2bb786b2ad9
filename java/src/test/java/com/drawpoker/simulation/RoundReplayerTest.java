package com.drawpoker.simulation;

import com.drawpoker.card.Card;
import com.drawpoker.game.Deal;
import com.drawpoker.game.Dealer;
import com.drawpoker.game.Seat;
import com.drawpoker.game.Winner;
import com.drawpoker.hand.HandCategory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for replaying recorded rounds.
 */
class RoundReplayerTest {

    @Test
    void testSecondPlayerContinuesFromSharedCursor() throws RoundRecordException {
        RoundReplayer.ReplayResult result = RoundReplayer.replay(RoundRecord.fromResource("rounds/sample-round.json"));

        // player 2 drew first: reserve 4C and QS; player 1 then gets 7S
        assertEquals(List.of("4C", "KC", "6C", "KS", "QS", "7D", "8D"), Card.toTokens(result.player2Hand()));
        assertEquals(List.of("4S", "AC", "9H", "10H", "QD", "7S", "6H"), Card.toTokens(result.player1Hand()));

        assertEquals(Winner.PLAYER2, result.outcome().winner());
        assertEquals(HandCategory.PAIR, result.outcome().player2Hand().category());
        assertEquals(List.of(13, 12, 8, 7), result.outcome().player2Hand().highCards());
        assertEquals(List.of(14, 12, 10, 9, 7), result.outcome().player1Hand().highCards());
    }

    @Test
    void testPlayer1FirstUsesCursorZero() {
        RoundRecord record = new RoundRecord("test-seed", Seat.PLAYER1, List.of(5), List.of(0, 4));
        RoundReplayer.ReplayResult result = RoundReplayer.replay(record);

        assertEquals("4C", result.player1Hand().get(5).toToken());
        assertEquals("QS", result.player2Hand().get(0).toToken());
        assertEquals("7S", result.player2Hand().get(4).toToken());
    }

    @Test
    void testNoDiscardsKeepsDealtHands() {
        RoundRecord record = new RoundRecord("keep", null, null, null);
        Deal deal = Dealer.dealHands("keep");
        RoundReplayer.ReplayResult result = RoundReplayer.replay(record);

        assertEquals(deal.player1(), result.player1Hand());
        assertEquals(deal.player2(), result.player2Hand());
    }

    @Test
    void testReplayIsDeterministic() {
        RoundRecord record = new RoundRecord("det", Seat.PLAYER2, List.of(0, 1, 2), List.of(6));
        assertEquals(RoundReplayer.replay(record), RoundReplayer.replay(record));
    }
}
