package com.ptcg.engine.game;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;

/**
 * Match configuration, fixed when the game is created.
 *
 * @param format        deck format tag, e.g. "Standard"
 * @param prizeCards    prizes each player sets aside
 * @param maxHandSize   hand size at which drawing is refused, or null for no limit
 * @param turnTimeLimit seconds per turn for a host to enforce, or null; the engine itself does not time turns
 * @param autoShuffle   shuffle decks when they are loaded into a game
 */
public record GameRules(
    @JsonProperty("format") String format,
    @JsonProperty("prize_cards") int prizeCards,
    @JsonProperty("max_hand_size") Integer maxHandSize,
    @JsonProperty("turn_time_limit") Integer turnTimeLimit,
    @JsonProperty("auto_shuffle") boolean autoShuffle
) {
    public static final String DEFAULT_FORMAT = "Standard";
    public static final int DEFAULT_PRIZE_CARDS = 6;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public GameRules {
        if (prizeCards < 0) {
            throw new IllegalArgumentException("prizeCards must not be negative: " + prizeCards);
        }
        if (maxHandSize != null && maxHandSize < 0) {
            throw new IllegalArgumentException("maxHandSize must not be negative: " + maxHandSize);
        }
    }

    public static GameRules defaults() {
        return new GameRules(DEFAULT_FORMAT, DEFAULT_PRIZE_CARDS, null, null, true);
    }

    /**
     * JSON entry point. Missing fields take their default values.
     */
    @JsonCreator
    static GameRules fromProperties(
            @JsonProperty("format") String format,
            @JsonProperty("prize_cards") Integer prizeCards,
            @JsonProperty("max_hand_size") Integer maxHandSize,
            @JsonProperty("turn_time_limit") Integer turnTimeLimit,
            @JsonProperty("auto_shuffle") Boolean autoShuffle) {
        return new GameRules(
                format != null ? format : DEFAULT_FORMAT,
                prizeCards != null ? prizeCards : DEFAULT_PRIZE_CARDS,
                maxHandSize,
                turnTimeLimit,
                autoShuffle == null || autoShuffle);
    }

    public GameRules withMaxHandSize(Integer maxHandSize) {
        return new GameRules(format, prizeCards, maxHandSize, turnTimeLimit, autoShuffle);
    }

    public GameRules withPrizeCards(int prizeCards) {
        return new GameRules(format, prizeCards, maxHandSize, turnTimeLimit, autoShuffle);
    }

    public GameRules withAutoShuffle(boolean autoShuffle) {
        return new GameRules(format, prizeCards, maxHandSize, turnTimeLimit, autoShuffle);
    }

    /**
     * Parse rules from a JSON object.
     */
    public static GameRules fromJson(String json) throws GameException {
        try {
            return MAPPER.readValue(json, GameRules.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new GameException("Invalid game rules: " + e.getMessage(), e);
        }
    }

    /**
     * Load rules from a classpath resource.
     */
    public static GameRules fromResource(String resourcePath) throws GameException {
        try (InputStream is = GameRules.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new GameException("Resource not found: " + resourcePath);
            }
            return MAPPER.readValue(is, GameRules.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new GameException("Invalid game rules in " + resourcePath + ": " + e.getMessage(), e);
        }
    }
}
