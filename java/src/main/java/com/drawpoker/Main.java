package com.drawpoker;

import com.drawpoker.card.Card;
import com.drawpoker.game.Deal;
import com.drawpoker.game.Dealer;
import com.drawpoker.game.RoundOutcome;
import com.drawpoker.game.RoundResolver;
import com.drawpoker.hand.BestHandFinder;
import com.drawpoker.hand.HandCategory;
import com.drawpoker.hand.HandResult;
import com.drawpoker.rng.RoundSeeds;
import com.drawpoker.simulation.RoundRecord;
import com.drawpoker.simulation.RoundRecordException;
import com.drawpoker.simulation.RoundReplayer;
import com.drawpoker.simulation.RoundSimulator;
import com.drawpoker.simulation.SimulationSummary;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Seven-card draw CLI - deal, evaluate and resolve rounds from the command line.
 */
@Command(name = "seven-card-draw",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "Deterministic 7-card draw poker engine",
        subcommands = {
                Main.DealCommand.class,
                Main.EvaluateCommand.class,
                Main.ResolveCommand.class,
                Main.ReplayCommand.class,
                Main.SimulateCommand.class
        })
public class Main implements Runnable {

    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // Show help if no subcommand
        CommandLine.usage(this, System.out);
    }

    // ========== DEAL COMMAND ==========
    @Command(name = "deal", description = "Deal two hands from a seed")
    static class DealCommand implements Callable<Integer> {
        @Option(names = {"-s", "--seed"},
                description = "Deck seed (a fresh one is generated if omitted)")
        String seed;

        @Option(names = {"--json"}, description = "Print JSON instead of text")
        boolean json;

        @Override
        public Integer call() throws Exception {
            String deckSeed = seed != null ? seed : RoundSeeds.generateRoundSeed();
            Deal deal = Dealer.dealHands(deckSeed);

            if (json) {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("seed", deckSeed);
                out.put("player1", deal.player1());
                out.put("player2", deal.player2());
                out.put("reserve", deal.reserve());
                printJson(out);
                return 0;
            }

            System.out.println("\n=== Deal ===\n");
            System.out.println("Seed:     " + deckSeed);
            System.out.println("Player 1: " + String.join(" ", Card.toTokens(deal.player1())));
            System.out.println("Player 2: " + String.join(" ", Card.toTokens(deal.player2())));
            System.out.println("Reserve:  " + deal.reserve().size() + " cards");
            return 0;
        }
    }

    // ========== EVALUATE COMMAND ==========
    @Command(name = "evaluate", description = "Find the best 5-card hand among the given cards")
    static class EvaluateCommand implements Callable<Integer> {
        @Parameters(arity = "1..*", paramLabel = "CARD", description = "Card tokens, e.g. AS 10H 2c")
        List<String> tokens;

        @Option(names = {"--json"}, description = "Print JSON instead of text")
        boolean json;

        @Override
        public Integer call() throws Exception {
            HandResult hand;
            try {
                hand = BestHandFinder.bestHand(Card.parseAll(tokens));
            } catch (IllegalArgumentException e) {
                System.err.println("✗ " + e.getMessage());
                return 1;
            }

            if (json) {
                printJson(hand);
            } else {
                System.out.println(describe(hand));
            }
            return 0;
        }
    }

    // ========== RESOLVE COMMAND ==========
    @Command(name = "resolve", description = "Compare two players' hands")
    static class ResolveCommand implements Callable<Integer> {
        @Option(names = {"--p1"}, required = true, split = ",",
                description = "Player 1 cards, comma separated")
        List<String> player1;

        @Option(names = {"--p2"}, required = true, split = ",",
                description = "Player 2 cards, comma separated")
        List<String> player2;

        @Option(names = {"--json"}, description = "Print JSON instead of text")
        boolean json;

        @Override
        public Integer call() throws Exception {
            RoundOutcome outcome;
            try {
                outcome = RoundResolver.resolveRound(Card.parseAll(player1), Card.parseAll(player2));
            } catch (IllegalArgumentException e) {
                System.err.println("✗ " + e.getMessage());
                return 1;
            }

            if (json) {
                printJson(outcome);
            } else {
                printOutcome(outcome);
            }
            return 0;
        }
    }

    // ========== REPLAY COMMAND ==========
    @Command(name = "replay", description = "Replay a recorded round from its seed and discards")
    static class ReplayCommand implements Callable<Integer> {
        @Option(names = {"-f", "--file"}, required = true,
                description = "Path to the round record JSON")
        String path;

        @Option(names = {"--json"}, description = "Print JSON instead of text")
        boolean json;

        @Override
        public Integer call() throws Exception {
            RoundRecord record;
            try {
                record = RoundRecord.fromFile(path);
            } catch (RoundRecordException e) {
                System.err.println("✗ Failed to load round '" + path + "': " + e.getMessage());
                return 1;
            }

            RoundReplayer.ReplayResult result = RoundReplayer.replay(record);
            if (json) {
                printJson(result);
                return 0;
            }

            System.out.println("\n=== Replay ===\n");
            System.out.println("Seed:         " + record.seed());
            System.out.println("First player: " + record.firstPlayer().getId());
            System.out.println("Player 1:     " + String.join(" ", Card.toTokens(result.player1Hand())));
            System.out.println("Player 2:     " + String.join(" ", Card.toTokens(result.player2Hand())));
            printOutcome(result.outcome());
            return 0;
        }
    }

    // ========== SIMULATE COMMAND ==========
    @Command(name = "simulate", description = "Simulate rounds where both players keep their best five")
    static class SimulateCommand implements Callable<Integer> {
        @Option(names = {"-n", "--num-rounds"}, defaultValue = "1000",
                description = "Number of rounds to simulate")
        int numRounds;

        @Option(names = {"-s", "--seed"},
                description = "Base seed (optional)")
        String seed;

        @Override
        public Integer call() throws Exception {
            if (numRounds <= 0) {
                System.err.println("✗ Number of rounds must be positive");
                return 1;
            }
            String baseSeed = seed != null ? seed : RoundSeeds.generateRoundSeed();

            System.out.println("\n=== Seven-Card Draw Simulation ===\n");
            System.out.println("Rounds: " + numRounds);
            System.out.println("Seed: " + baseSeed);
            System.out.println();

            long startTime = System.currentTimeMillis();
            SimulationSummary summary = RoundSimulator.run(baseSeed, numRounds);
            long elapsed = System.currentTimeMillis() - startTime;

            printSummary(summary, elapsed);
            return 0;
        }
    }

    // ========== HELPER METHODS ==========

    private static String describe(HandResult hand) {
        return String.format("%s (rank %d): %s  keys %s",
                hand.name(), hand.rank(), String.join(" ", Card.toTokens(hand.cards())), hand.highCards());
    }

    private static void printOutcome(RoundOutcome outcome) {
        System.out.println("\nPlayer 1 best: " + describe(outcome.player1Hand()));
        System.out.println("Player 2 best: " + describe(outcome.player2Hand()));
        System.out.println();
        if (outcome.isTie()) {
            System.out.println("Result: tie");
        } else {
            System.out.println("Result: " + outcome.winner().getId() + " wins");
        }
    }

    private static void printSummary(SimulationSummary summary, long elapsedMs) {
        System.out.println("=== Results ===\n");
        System.out.printf("Player 1 wins: %5.1f%% (%d)%n", summary.player1WinRate() * 100.0, summary.player1Wins());
        System.out.printf("Player 2 wins: %5.1f%% (%d)%n", summary.player2WinRate() * 100.0, summary.player2Wins());
        System.out.printf("Ties:          %5.1f%% (%d)%n", summary.tieRate() * 100.0, summary.ties());
        System.out.println();

        long hands = 2L * summary.rounds();
        System.out.println("Final hand distribution:");
        for (HandCategory category : HandCategory.values()) {
            long count = summary.categoryCounts().getOrDefault(category, 0L);
            double pct = (double) count / hands * 100.0;
            String bar = "█".repeat((int) (pct / 2.0));
            System.out.printf("  %-16s %5.1f%% %s (%d)%n", category.getDisplayName(), pct, bar, count);
        }

        System.out.println();
        double elapsedSec = elapsedMs / 1000.0;
        double roundsPerSec = elapsedSec > 0 ? summary.rounds() / elapsedSec : 0;
        System.out.printf("Simulation completed in %.2fs (%.0f rounds/sec)%n", elapsedSec, roundsPerSec);
    }

    private static void printJson(Object value) throws JsonProcessingException {
        System.out.println(JSON.writeValueAsString(value));
    }
}
