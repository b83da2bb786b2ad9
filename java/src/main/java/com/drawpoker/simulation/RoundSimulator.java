package com.drawpoker.simulation;

import com.drawpoker.game.Deal;
import com.drawpoker.game.Dealer;
import com.drawpoker.game.RoundOutcome;
import com.drawpoker.game.Seat;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Plays independent seeded rounds where both players follow
 * {@link DiscardAdvisor} and player 1 draws first.
 */
public final class RoundSimulator {

    private RoundSimulator() {
    }

    /**
     * Seed used for round {@code index} of a run.
     */
    public static String roundSeed(String baseSeed, int index) {
        return baseSeed + "-" + index;
    }

    /**
     * Build the record an advised round would produce for this seed.
     */
    public static RoundRecord advisedRound(String seed) {
        Deal deal = Dealer.dealHands(seed);
        return new RoundRecord(seed, Seat.PLAYER1,
                DiscardAdvisor.suggestDiscards(deal.player1()),
                DiscardAdvisor.suggestDiscards(deal.player2()));
    }

    public static RoundOutcome playRound(String seed) {
        return RoundReplayer.replay(advisedRound(seed)).outcome();
    }

    /**
     * Run {@code rounds} rounds in parallel. Results are collected in round
     * order, so the summary only depends on the base seed.
     */
    public static SimulationSummary run(String baseSeed, int rounds) {
        List<RoundOutcome> outcomes = IntStream.range(0, rounds)
                .parallel()
                .mapToObj(i -> playRound(roundSeed(baseSeed, i)))
                .toList();
        return SimulationSummary.from(outcomes);
    }
}
