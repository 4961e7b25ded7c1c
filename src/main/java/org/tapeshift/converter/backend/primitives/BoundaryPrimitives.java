package org.tapeshift.converter.backend.primitives;

import org.tapeshift.converter.model.ConverterSettings;
import org.tapeshift.converter.model.Direction;
import org.tapeshift.converter.model.Transition;

import java.util.List;

/**
 * Reusable control clusters shared by both conversion pipelines.
 * <p>
 * Each method returns the transitions of one small sub-machine, wired to the state labels
 * passed in. The clusters only read and write the reserved symbols, the wildcard and the
 * binary digits {@code 0} and {@code 1}.
 */
public class BoundaryPrimitives {

    private final ConverterSettings settings;

    public BoundaryPrimitives(ConverterSettings settings) {
        this.settings = settings;
    }

    /**
     * Moves a binary string one cell to the right while sweeping right.
     * <p>
     * {@code carry0} remembers a {@code 0} from the previous cell, {@code carry1} a {@code 1}.
     * Each state writes what it remembers and picks up what it read. The sweep ends in
     * whichever carry state is active when a non-binary symbol is reached; callers add the
     * transitions that terminate it.
     *
     * @param carry0 The state carrying a {@code 0}.
     * @param carry1 The state carrying a {@code 1}.
     * @return The four sweep transitions.
     */
    public List<Transition> carrySweep(String carry0, String carry1) {
        return List.of(
                new Transition(carry0, '0', '0', Direction.RIGHT, carry0),
                new Transition(carry0, '1', '0', Direction.RIGHT, carry1),
                new Transition(carry1, '0', '1', Direction.RIGHT, carry0),
                new Transition(carry1, '1', '1', Direction.RIGHT, carry1));
    }

    /**
     * Scans left to the left wall, then steps onto the first cell after it.
     *
     * @param returnState The scanning state.
     * @param targetState The state entered on the first cell after the wall.
     * @return The two return transitions.
     */
    public List<Transition> returnHead(String returnState, String targetState) {
        final char any = settings.wildcard();
        final char wall = settings.leftWall();
        return List.of(
                new Transition(returnState, any, any, Direction.LEFT, returnState),
                new Transition(returnState, wall, wall, Direction.RIGHT, targetState));
    }

    /**
     * Tests the current cell for a trigger symbol without moving.
     * <p>
     * On the trigger symbol the cluster writes {@code writeSymbol}, moves in
     * {@code direction} and enters {@code hitState}. On any other symbol it stays in place
     * and continues in {@code defaultState}.
     *
     * @param checkState   The testing state.
     * @param defaultState The state entered when the trigger is absent.
     * @param trigger      The symbol that selects the special case.
     * @param writeSymbol  The symbol written over the trigger.
     * @param direction    The movement after writing over the trigger.
     * @param hitState     The state entered when the trigger is present.
     * @return The two check transitions.
     */
    public List<Transition> boundaryCheck(String checkState, String defaultState, char trigger,
                                          char writeSymbol, Direction direction, String hitState) {
        final char any = settings.wildcard();
        return List.of(
                new Transition(checkState, any, any, Direction.STAY, defaultState),
                new Transition(checkState, trigger, writeSymbol, direction, hitState));
    }
}
