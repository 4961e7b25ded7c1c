package org.tapeshift.converter.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The head movement of a transition.
 */
public enum Direction {
    /** Move one cell to the left. */
    LEFT("l"),
    /** Move one cell to the right. */
    RIGHT("r"),
    /** Keep the head on the current cell. */
    STAY("*");

    private final String token;

    Direction(String token) {
        this.token = token;
    }

    /**
     * @return The token used for this direction in a transition table.
     */
    public String token() {
        return token;
    }

    /**
     * Looks up the direction for a table token.
     * @param token The raw token, e.g. {@code "l"}.
     * @return The matching direction, or empty if the token is unknown.
     */
    public static Optional<Direction> fromToken(String token) {
        return Arrays.stream(values()).filter(d -> d.token.equals(token)).findFirst();
    }

    @Override
    public String toString() {
        return token;
    }
}
