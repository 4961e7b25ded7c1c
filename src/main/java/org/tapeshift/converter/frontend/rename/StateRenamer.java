package org.tapeshift.converter.frontend.rename;

import org.tapeshift.converter.model.ConverterSettings;
import org.tapeshift.converter.model.Transition;

import java.util.List;

/**
 * Moves every non-terminal state of a source table into the simulation namespace.
 * <p>
 * Control states generated by the converter never start with the simulation prefix,
 * so after renaming the embedded machine cannot collide with them. Terminal states keep
 * their label.
 */
public class StateRenamer {

    private final ConverterSettings settings;

    public StateRenamer(ConverterSettings settings) {
        this.settings = settings;
    }

    /**
     * @param transitions The source transitions.
     * @return New transitions with both state labels renamed.
     */
    public List<Transition> rename(List<Transition> transitions) {
        return transitions.stream()
                .map(t -> t.withStates(rename(t.currentState()), rename(t.newState())))
                .toList();
    }

    /**
     * @param state A source state label.
     * @return The label inside the simulation namespace, or the label itself if it is terminal.
     */
    public String rename(String state) {
        return settings.isTerminal(state) ? state : settings.simulationPrefix() + state;
    }
}
