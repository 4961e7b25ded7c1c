package org.tapeshift.converter.api;

import org.tapeshift.converter.model.MachineType;
import org.tapeshift.converter.model.Transition;

import java.util.List;

/**
 * The outcome of a successful conversion.
 *
 * @param sourceType            The tape model the input table was written for.
 * @param startState            The start state of the generated table.
 * @param sourceTransitionCount The number of transitions parsed from the input.
 * @param transitions           The generated transitions, in output order.
 */
public record ConversionResult(
        MachineType sourceType,
        String startState,
        int sourceTransitionCount,
        List<Transition> transitions
) {
    public ConversionResult {
        transitions = List.copyOf(transitions);
    }

    /**
     * @return The tape model the generated table runs on.
     */
    public MachineType targetType() {
        return sourceType.target();
    }
}
