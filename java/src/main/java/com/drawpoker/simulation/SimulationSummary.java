package com.drawpoker.simulation;

import com.drawpoker.game.RoundOutcome;
import com.drawpoker.game.Winner;
import com.drawpoker.hand.HandCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated results of many simulated rounds.
 * {@code categoryCounts} counts the final best hand of both players, so it
 * sums to twice the number of rounds.
 */
public record SimulationSummary(int rounds, int player1Wins, int player2Wins, int ties,
                                Map<HandCategory, Long> categoryCounts) {

    public SimulationSummary {
        Map<HandCategory, Long> copy = new EnumMap<>(HandCategory.class);
        copy.putAll(categoryCounts);
        categoryCounts = Collections.unmodifiableMap(copy);
    }

    public static SimulationSummary from(List<RoundOutcome> outcomes) {
        int p1 = 0;
        int p2 = 0;
        int ties = 0;
        Map<HandCategory, Long> counts = new EnumMap<>(HandCategory.class);
        for (RoundOutcome outcome : outcomes) {
            if (outcome.winner() == Winner.PLAYER1) {
                p1++;
            } else if (outcome.winner() == Winner.PLAYER2) {
                p2++;
            } else {
                ties++;
            }
            counts.merge(outcome.player1Hand().category(), 1L, Long::sum);
            counts.merge(outcome.player2Hand().category(), 1L, Long::sum);
        }
        return new SimulationSummary(outcomes.size(), p1, p2, ties, counts);
    }

    public double player1WinRate() {
        return rounds == 0 ? 0.0 : (double) player1Wins / rounds;
    }

    public double player2WinRate() {
        return rounds == 0 ? 0.0 : (double) player2Wins / rounds;
    }

    public double tieRate() {
        return rounds == 0 ? 0.0 : (double) ties / rounds;
    }
}
