package com.drawpoker.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A playing card. Two cards are equal iff rank and suit match.
 * Serialized as its token ("10H", "AS") wherever hands cross the engine boundary.
 */
public record Card(Rank rank, Suit suit) {

    /**
     * Rank value descending, then suit in deck order.
     */
    public static final Comparator<Card> BY_RANK_DESCENDING =
            Comparator.comparing(Card::rank, Comparator.reverseOrder())
                    .thenComparing(Card::suit);

    public Card {
        Objects.requireNonNull(rank, "rank");
        Objects.requireNonNull(suit, "suit");
    }

    public int value() {
        return rank.getValue();
    }

    /**
     * Rank token followed by the upper-case suit initial.
     */
    @JsonValue
    public String toToken() {
        return rank.getToken() + suit.getSymbol();
    }

    /**
     * Parse a two or three character token: rank token plus suit initial.
     * @throws InvalidCardTokenException if the token is malformed
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Card parse(String token) {
        if (token == null || token.length() < 2 || token.length() > 3) {
            throw new InvalidCardTokenException("Invalid card token: '" + token + "'");
        }
        Suit suit = Suit.fromChar(token.charAt(token.length() - 1));
        Rank rank = Rank.fromToken(token.substring(0, token.length() - 1));
        return new Card(rank, suit);
    }

    public static List<Card> parseAll(List<String> tokens) {
        return tokens.stream().map(Card::parse).toList();
    }

    public static List<String> toTokens(List<Card> cards) {
        return cards.stream().map(Card::toToken).toList();
    }

    @Override
    public String toString() {
        return toToken();
    }
}
