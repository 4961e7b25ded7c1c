package org.tapeshift.converter.backend.sipser;

import org.tapeshift.converter.backend.ConversionPipeline;
import org.tapeshift.converter.backend.primitives.BoundaryPrimitives;
import org.tapeshift.converter.backend.primitives.ControlStates;
import org.tapeshift.converter.model.ConverterSettings;
import org.tapeshift.converter.model.Direction;
import org.tapeshift.converter.model.MachineType;
import org.tapeshift.converter.model.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts a table for a doubly-infinite tape into one for a tape with a fixed left end.
 * <p>
 * The generated machine keeps the simulated region between a left wall at cell 0 and a
 * right wall behind the last used cell:
 * <pre>
 *   # c0 c1 ... cn $
 * </pre>
 * Every source move is followed by a boundary check. Stepping onto the right wall moves the
 * wall one cell further. Stepping onto the left wall shifts the whole region one cell to the
 * right, which frees a blank cell in front of it.
 * <p>
 * The shift carries the binary digits {@code 0} and {@code 1} and the blank; the region is
 * expected to hold no other symbols.
 */
public class InfiniteToSipserPipeline implements ConversionPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(InfiniteToSipserPipeline.class);

    private final ConverterSettings settings;
    private final BoundaryPrimitives primitives;

    public InfiniteToSipserPipeline(ConverterSettings settings) {
        this.settings = settings;
        this.primitives = new BoundaryPrimitives(settings);
    }

    @Override
    public MachineType sourceType() {
        return MachineType.INFINITE;
    }

    @Override
    public List<Transition> convert(List<Transition> renamed) {
        final List<Transition> out = new ArrayList<>(setup(settings.simulatedStartState()));

        // Insertion order keeps the output deterministic.
        final Map<String, Set<Direction>> targets = new LinkedHashMap<>();
        for (Transition t : renamed) {
            warnOnMarker(t);
            out.add(rewrite(t, targets));
        }

        int clusters = 0;
        for (Map.Entry<String, Set<Direction>> entry : targets.entrySet()) {
            final String state = entry.getKey();
            if (entry.getValue().contains(Direction.RIGHT)) {
                out.addAll(checkRight(state));
                clusters++;
            }
            if (entry.getValue().contains(Direction.LEFT)) {
                out.addAll(checkLeft(state));
                clusters++;
            }
        }
        LOGGER.debug("Generated {} boundary clusters for {} target states", clusters, targets.size());
        return out;
    }

    /**
     * Writes the left wall over the first cell, shifts the input one cell to the right,
     * appends the right wall and returns the head to the first cell of the region.
     * An empty tape gets a single blank cell between the walls.
     *
     * @param simulatedStart The renamed start state of the embedded machine.
     * @return The setup cluster, starting in the table start state.
     */
    List<Transition> setup(String simulatedStart) {
        final String start = settings.startState();
        final char wall = settings.leftWall();
        final char blank = settings.blank();
        final List<Transition> out = new ArrayList<>();

        out.add(new Transition(start, '0', wall, Direction.RIGHT, ControlStates.SETUP_CARRY_0));
        out.add(new Transition(start, '1', wall, Direction.RIGHT, ControlStates.SETUP_CARRY_1));
        out.addAll(primitives.carrySweep(ControlStates.SETUP_CARRY_0, ControlStates.SETUP_CARRY_1));
        out.add(new Transition(ControlStates.SETUP_CARRY_0, blank, '0', Direction.RIGHT, ControlStates.SETUP_WRITE_END_MARKER));
        out.add(new Transition(ControlStates.SETUP_CARRY_1, blank, '1', Direction.RIGHT, ControlStates.SETUP_WRITE_END_MARKER));
        out.add(new Transition(ControlStates.SETUP_WRITE_END_MARKER, blank, settings.rightWall(), Direction.LEFT,
                ControlStates.SETUP_RETURN_HEAD));
        out.addAll(primitives.returnHead(ControlStates.SETUP_RETURN_HEAD, simulatedStart));

        out.add(new Transition(start, blank, wall, Direction.RIGHT, ControlStates.SETUP_PAD_EMPTY));
        out.add(new Transition(ControlStates.SETUP_PAD_EMPTY, blank, blank, Direction.RIGHT,
                ControlStates.SETUP_WRITE_END_MARKER));
        return out;
    }

    private Transition rewrite(Transition t, Map<String, Set<Direction>> targets) {
        if (settings.isTerminal(t.currentState()) || settings.isTerminal(t.newState())) {
            return t;
        }
        return switch (t.direction()) {
            case STAY -> t;
            case RIGHT -> {
                targets.computeIfAbsent(t.newState(), k -> EnumSet.noneOf(Direction.class)).add(Direction.RIGHT);
                yield t.withNewState(ControlStates.checkRight(t.newState()));
            }
            case LEFT -> {
                targets.computeIfAbsent(t.newState(), k -> EnumSet.noneOf(Direction.class)).add(Direction.LEFT);
                yield t.withNewState(ControlStates.checkLeft(t.newState()));
            }
        };
    }

    /**
     * On the right wall: blank it, write a new wall one cell further and step back onto the
     * freed cell.
     */
    List<Transition> checkRight(String state) {
        final String check = ControlStates.checkRight(state);
        final String expand = ControlStates.expandRight(state);
        final List<Transition> out = new ArrayList<>(primitives.boundaryCheck(
                check, state, settings.rightWall(), settings.blank(), Direction.RIGHT, expand));
        out.add(new Transition(expand, settings.blank(), settings.rightWall(), Direction.LEFT, state));
        return out;
    }

    /**
     * On the left wall: shift the region one cell to the right and resume on the freed cell.
     */
    List<Transition> checkLeft(String state) {
        final String check = ControlStates.checkLeft(state);
        final String shiftStart = ControlStates.shiftStart(state);
        final List<Transition> out = new ArrayList<>(primitives.boundaryCheck(
                check, state, settings.leftWall(), settings.leftWall(), Direction.RIGHT, shiftStart));
        out.addAll(shift(state, shiftStart));
        return out;
    }

    /**
     * Moves every cell between the walls one position to the right, the right wall included.
     * Blank cells inside the region travel with the digits, so the simulated content keeps
     * its layout. The sweep always ends on the right wall.
     */
    private List<Transition> shift(String state, String shiftStart) {
        final String carry0 = ControlStates.shiftCarry0(state);
        final String carry1 = ControlStates.shiftCarry1(state);
        final String carryBlank = ControlStates.shiftCarryBlank(state);
        final String writeEnd = ControlStates.shiftWriteEnd(state);
        final String returnState = ControlStates.shiftReturn(state);
        final char blank = settings.blank();
        final char rightWall = settings.rightWall();
        final List<Transition> out = new ArrayList<>();

        out.add(new Transition(shiftStart, '0', blank, Direction.RIGHT, carry0));
        out.add(new Transition(shiftStart, '1', blank, Direction.RIGHT, carry1));
        out.add(new Transition(shiftStart, blank, blank, Direction.RIGHT, carryBlank));
        out.addAll(primitives.carrySweep(carry0, carry1));
        out.add(new Transition(carry0, blank, '0', Direction.RIGHT, carryBlank));
        out.add(new Transition(carry1, blank, '1', Direction.RIGHT, carryBlank));
        out.add(new Transition(carryBlank, '0', blank, Direction.RIGHT, carry0));
        out.add(new Transition(carryBlank, '1', blank, Direction.RIGHT, carry1));
        out.add(new Transition(carryBlank, blank, blank, Direction.RIGHT, carryBlank));
        out.add(new Transition(carry0, rightWall, '0', Direction.RIGHT, writeEnd));
        out.add(new Transition(carry1, rightWall, '1', Direction.RIGHT, writeEnd));
        out.add(new Transition(carryBlank, rightWall, blank, Direction.RIGHT, writeEnd));
        // Empty region: the wall itself moves.
        out.add(new Transition(shiftStart, rightWall, blank, Direction.RIGHT, writeEnd));
        out.add(new Transition(writeEnd, blank, rightWall, Direction.LEFT, returnState));
        out.addAll(primitives.returnHead(returnState, state));
        return out;
    }

    private void warnOnMarker(Transition t) {
        if (isMarker(t.currentSymbol()) || isMarker(t.newSymbol())) {
            LOGGER.warn("Source transition '{} {} {}' uses a reserved boundary marker and may break the simulated walls",
                    t.currentState(), t.currentSymbol(), t.newSymbol());
        }
    }

    private boolean isMarker(char symbol) {
        return symbol == settings.leftWall() || symbol == settings.rightWall();
    }
}
