package org.tapeshift.converter.api;

/**
 * Identifies the origin of a transition line.
 *
 * @param fileName   The logical name of the file the line was read from.
 * @param lineNumber The 1-based line number within that file.
 */
public record SourceInfo(String fileName, int lineNumber) {

    @Override
    public String toString() {
        return fileName + ":" + lineNumber;
    }
}
