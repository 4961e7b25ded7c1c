package org.tapeshift.converter.backend.infinite;

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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Converts a table for a tape with a fixed left end into one for a doubly-infinite tape.
 * <p>
 * The doubly-infinite tape never runs out of room, so the only thing to reproduce is the
 * left end. A left wall is written in front of the input once; every left move of the source
 * machine is followed by a check, and reaching the wall sends the machine to the terminal
 * state. The source machine is assumed to move past its left end only to finish.
 */
public class SipserToInfinitePipeline implements ConversionPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(SipserToInfinitePipeline.class);

    private final ConverterSettings settings;
    private final BoundaryPrimitives primitives;

    public SipserToInfinitePipeline(ConverterSettings settings) {
        this.settings = settings;
        this.primitives = new BoundaryPrimitives(settings);
    }

    @Override
    public MachineType sourceType() {
        return MachineType.SIPSER;
    }

    @Override
    public List<Transition> convert(List<Transition> renamed) {
        final List<Transition> out = new ArrayList<>(setup(settings.simulatedStartState()));
        final Set<String> targets = new LinkedHashSet<>();

        for (Transition t : renamed) {
            if (t.direction() == Direction.LEFT && !settings.isTerminal(t.newState())) {
                targets.add(t.newState());
                out.add(t.withNewState(ControlStates.checkLeftWall(t.newState())));
            } else {
                out.add(t);
            }
        }

        for (String state : targets) {
            out.addAll(primitives.boundaryCheck(ControlStates.checkLeftWall(state), state,
                    settings.leftWall(), settings.leftWall(), Direction.STAY, settings.terminalState()));
        }
        LOGGER.debug("Generated {} left wall checks", targets.size());
        return out;
    }

    /**
     * Moves left to the first blank cell, writes the left wall there and steps back right.
     *
     * @param simulatedStart The renamed start state of the embedded machine.
     * @return The setup cluster, starting in the table start state.
     */
    List<Transition> setup(String simulatedStart) {
        final char any = settings.wildcard();
        final String writeWall = ControlStates.SETUP_WRITE_WALL;
        return List.of(
                new Transition(settings.startState(), any, any, Direction.LEFT, writeWall),
                new Transition(writeWall, settings.blank(), settings.leftWall(), Direction.RIGHT, simulatedStart),
                new Transition(writeWall, any, any, Direction.LEFT, writeWall));
    }
}
