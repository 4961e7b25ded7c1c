package org.tapeshift.converter.backend.emit;

import org.tapeshift.converter.api.ConversionResult;
import org.tapeshift.converter.model.ConverterSettings;
import org.tapeshift.converter.model.Transition;

import java.util.List;

/**
 * Renders transitions in the five token table format.
 * <p>
 * A written symbol equal to the symbol read and a target state equal to the current state
 * are both printed as the wildcard.
 */
public class TransitionSerializer {

    private final ConverterSettings settings;

    public TransitionSerializer(ConverterSettings settings) {
        this.settings = settings;
    }

    /**
     * @param t The transition to render.
     * @return A single line without line terminator.
     */
    public String render(Transition t) {
        final String newSymbol = t.newSymbol() == t.currentSymbol()
                ? String.valueOf(settings.wildcard())
                : String.valueOf(t.newSymbol());
        final String newState = t.newState().equals(t.currentState())
                ? String.valueOf(settings.wildcard())
                : t.newState();
        return String.join(" ", t.currentState(), String.valueOf(t.currentSymbol()), newSymbol,
                t.direction().token(), newState);
    }

    /**
     * @param result A conversion result.
     * @return The two comment lines describing the conversion.
     */
    public List<String> headerComments(ConversionResult result) {
        final char comment = settings.commentDelimiter();
        return List.of(
                String.format("%c --- %s-to-%s Simulation ---", comment,
                        result.sourceType().displayName(), result.targetType().displayName()),
                String.format("%c Start state: %s", comment, result.startState()));
    }

    /**
     * Renders a complete output table.
     *
     * @param result A conversion result.
     * @return The header comments followed by one line per transition, each line ending in {@code \n}.
     */
    public String render(ConversionResult result) {
        final StringBuilder sb = new StringBuilder();
        headerComments(result).forEach(line -> sb.append(line).append('\n'));
        result.transitions().forEach(t -> sb.append(render(t)).append('\n'));
        return sb.toString();
    }
}
