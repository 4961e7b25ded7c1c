package org.tapeshift.converter.backend;

import org.tapeshift.converter.model.MachineType;
import org.tapeshift.converter.model.Transition;

import java.util.List;

/**
 * Generates a table for the opposite tape model from a renamed source table.
 * <p>
 * Implementations are pure: they never modify their input and never fail, since every
 * table they produce is well formed by construction.
 */
public interface ConversionPipeline {

    /**
     * @return The tape model this pipeline accepts as input.
     */
    MachineType sourceType();

    /**
     * Builds the complete output table.
     *
     * @param renamed The source transitions after renaming into the simulation namespace.
     * @return The setup cluster, the rewritten source transitions and the generated control
     *         clusters, in output order.
     */
    List<Transition> convert(List<Transition> renamed);
}
