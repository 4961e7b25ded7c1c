package org.tapeshift.converter.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The tape model a transition table is written for. Selected by the header line.
 */
public enum MachineType {
    /** A tape that extends indefinitely in both directions. */
    INFINITE(";I", "Infinite"),
    /** A tape with a fixed left end, marked by the left wall symbol. */
    SIPSER(";S", "Sipser");

    private final String header;
    private final String displayName;

    MachineType(String header, String displayName) {
        this.header = header;
        this.displayName = displayName;
    }

    public String header() {
        return header;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * @return The model a table of this type is converted to.
     */
    public MachineType target() {
        return this == INFINITE ? SIPSER : INFINITE;
    }

    /**
     * Looks up the machine type for a header line.
     * @param header The header text, already stripped of surrounding whitespace.
     * @return The matching machine type, or empty if the header is unknown.
     */
    public static Optional<MachineType> fromHeader(String header) {
        return Arrays.stream(values()).filter(t -> t.header.equals(header)).findFirst();
    }
}
