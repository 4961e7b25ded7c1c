package org.tapeshift.converter.api;

import java.util.List;

/**
 * The public entry point of the transition table converter.
 */
public interface IConverter {

    /**
     * Converts a transition table to the opposite tape model.
     * <p>
     * The first line must be a machine type header; every following line is either a
     * transition, a comment or blank.
     *
     * @param sourceLines The lines of the input table, header included.
     * @param sourceName  A logical name of the input, used in error messages.
     * @return The converted table.
     * @throws ConversionException if the header or any transition line is invalid.
     */
    ConversionResult convert(List<String> sourceLines, String sourceName) throws ConversionException;
}
