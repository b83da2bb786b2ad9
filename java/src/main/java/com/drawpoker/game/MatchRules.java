package com.drawpoker.game;

/**
 * Match-level rules. The session manager enforces them; the engine only
 * publishes the numbers and the points formula.
 */
public final class MatchRules {
    /** Round wins that end a match. */
    public static final int WINS_TO_WIN_MATCH = 10;
    /** Upper bound on rounds in a match. */
    public static final int MAX_ROUNDS = 19;
    /** Cards dealt to each player. */
    public static final int HAND_SIZE = 7;
    /** Largest discard request the session manager accepts. */
    public static final int MAX_DISCARDS = 5;

    private MatchRules() {
    }

    /**
     * Points for the match winner: the margin of round wins.
     * @throws IllegalArgumentException if a count is negative or the winner has fewer wins
     */
    public static int pointsAwarded(int winnerWins, int loserWins) {
        if (winnerWins < 0 || loserWins < 0) {
            throw new IllegalArgumentException("Win counts cannot be negative: " + winnerWins + ", " + loserWins);
        }
        if (winnerWins < loserWins) {
            throw new IllegalArgumentException(
                    "Winner has fewer wins than loser: " + winnerWins + " < " + loserWins);
        }
        return winnerWins - loserWins;
    }
}
