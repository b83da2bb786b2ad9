package com.drawpoker.simulation;

import com.drawpoker.game.Seat;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Everything needed to replay a round: the deck seed, who drew first and
 * each player's discard indices. Hands and reserve are re-derived from the seed.
 *
 * <pre>
 * { "seed": "poker-1700000000000-abc", "firstPlayer": "player2",
 *   "player1Discards": [0, 3], "player2Discards": [6] }
 * </pre>
 */
public record RoundRecord(String seed, Seat firstPlayer,
                          List<Integer> player1Discards, List<Integer> player2Discards) {

    public RoundRecord {
        firstPlayer = firstPlayer == null ? Seat.PLAYER1 : firstPlayer;
        player1Discards = player1Discards == null ? List.of() : List.copyOf(player1Discards);
        player2Discards = player2Discards == null ? List.of() : List.copyOf(player2Discards);
    }

    public List<Integer> discardsFor(Seat seat) {
        return seat == Seat.PLAYER1 ? player1Discards : player2Discards;
    }

    /**
     * Load a round record from a JSON file.
     */
    public static RoundRecord fromFile(String path) throws RoundRecordException {
        try {
            String content = Files.readString(Path.of(path));
            return fromJson(content);
        } catch (IOException e) {
            throw new RoundRecordException("IO error: " + e.getMessage(), e);
        }
    }

    /**
     * Load a round record from a classpath resource.
     */
    public static RoundRecord fromResource(String resourcePath) throws RoundRecordException {
        try (InputStream is = RoundRecord.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new RoundRecordException("Resource not found: " + resourcePath);
            }
            ObjectMapper mapper = new ObjectMapper();
            return validate(mapper.readValue(is, RoundRecord.class));
        } catch (IOException e) {
            throw new RoundRecordException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Load a round record from a JSON string.
     */
    public static RoundRecord fromJson(String json) throws RoundRecordException {
        try {
            ObjectMapper mapper = new ObjectMapper();
            return validate(mapper.readValue(json, RoundRecord.class));
        } catch (IOException e) {
            throw new RoundRecordException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    private static RoundRecord validate(RoundRecord record) throws RoundRecordException {
        if (record == null) {
            throw new RoundRecordException("Empty round record");
        }
        if (record.seed() == null || record.seed().isBlank()) {
            throw new RoundRecordException("Round record has no seed");
        }
        return record;
    }
}
