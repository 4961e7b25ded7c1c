package org.tapeshift.converter.api;

/**
 * Defines unique, testable error codes for all errors that can abort a conversion.
 * This decouples the test logic from the exact wording of error messages.
 */
public enum ConversionErrorCode {
    // region Header Errors
    /** The input file contained no lines at all. */
    EMPTY_FILE,
    /** The first line was neither of the two machine type headers. */
    INVALID_HEADER,
    // endregion

    // region Line Parser Errors
    /** A transition line did not consist of exactly five tokens. */
    INVALID_PART_COUNT,
    /** A symbol token was not exactly one character long. */
    INVALID_SYMBOL,
    /** The direction token was not one of the three known directions. */
    INVALID_DIRECTION,
    // endregion

    // region File Errors
    /** The input path does not carry the required input extension. */
    INVALID_INPUT_EXTENSION,
    /** An I/O error occurred while reading the input file. */
    IO_ERROR_READING_FILE,
    /** An I/O error occurred while writing the output file. */
    IO_ERROR_WRITING_FILE
    // endregion
}
