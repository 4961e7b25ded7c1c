package org.tapeshift.converter.model;

import java.util.Objects;

/**
 * A single rule of a transition table: in {@code currentState} reading {@code currentSymbol},
 * write {@code newSymbol}, move in {@code direction} and continue in {@code newState}.
 * <p>
 * Transitions are immutable. Every conversion stage creates new instances.
 *
 * @param currentState  The state the rule applies to.
 * @param currentSymbol The symbol under the head; the wildcard symbol matches any symbol.
 * @param newSymbol     The symbol written before moving.
 * @param direction     The head movement.
 * @param newState      The state entered after moving.
 */
public record Transition(
        String currentState,
        char currentSymbol,
        char newSymbol,
        Direction direction,
        String newState
) {
    public Transition {
        Objects.requireNonNull(currentState, "currentState");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(newState, "newState");
    }

    /**
     * @param state The replacement target state.
     * @return A copy of this transition that continues in {@code state}.
     */
    public Transition withNewState(String state) {
        return new Transition(currentState, currentSymbol, newSymbol, direction, state);
    }

    /**
     * @param current The replacement current state.
     * @param next    The replacement target state.
     * @return A copy of this transition with both state labels replaced.
     */
    public Transition withStates(String current, String next) {
        return new Transition(current, currentSymbol, newSymbol, direction, next);
    }
}
