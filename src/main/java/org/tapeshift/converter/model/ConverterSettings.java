package org.tapeshift.converter.model;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * The reserved symbols and labels the converter works with.
 * <p>
 * The defaults match the table format understood by common online Turing machine
 * simulators. All values can be overridden under {@code tapeshift} in HOCON:
 * <pre>
 * tapeshift {
 *   symbols { left-wall = "#", right-wall = "$", blank = "_", wildcard = "*", comment = ";" }
 *   states  { start = "0", halt-prefix = "halt", simulation-prefix = "sim_" }
 *   files   { input-extension = "in", output-extension = "out" }
 * }
 * </pre>
 *
 * @param leftWall         Marks the left end of a bounded tape.
 * @param rightWall        Marks the right end of the simulated region.
 * @param blank            The symbol of an empty cell.
 * @param wildcard         Matches any symbol when read, means "unchanged" when written.
 * @param commentDelimiter Starts a comment that runs to the end of the line.
 * @param startState       The start state of every table.
 * @param haltPrefix       Labels starting with this prefix are terminal; the prefix itself is the reserved terminal state.
 * @param simulationPrefix The namespace every non-terminal source state is moved into.
 * @param inputExtension   The extension an input file must have.
 * @param outputExtension  The extension that replaces it for the output file.
 */
public record ConverterSettings(
        char leftWall,
        char rightWall,
        char blank,
        char wildcard,
        char commentDelimiter,
        String startState,
        String haltPrefix,
        String simulationPrefix,
        String inputExtension,
        String outputExtension
) {
    private static final String ROOT_PATH = "tapeshift";

    /**
     * @return The settings used when no configuration is given.
     */
    public static ConverterSettings defaults() {
        return new ConverterSettings('#', '$', '_', '*', ';', "0", "halt", "sim_", "in", "out");
    }

    /**
     * Reads the settings from the {@code tapeshift} section of a configuration.
     * Missing keys fall back to {@link #defaults()}.
     *
     * @param config The resolved application configuration.
     * @return The settings.
     * @throws ConfigException.BadValue if a symbol is not exactly one character.
     */
    public static ConverterSettings fromConfig(Config config) {
        final ConverterSettings d = defaults();
        if (!config.hasPath(ROOT_PATH)) {
            return d;
        }
        final Config c = config.getConfig(ROOT_PATH);
        return new ConverterSettings(
                symbol(c, "symbols.left-wall", d.leftWall()),
                symbol(c, "symbols.right-wall", d.rightWall()),
                symbol(c, "symbols.blank", d.blank()),
                symbol(c, "symbols.wildcard", d.wildcard()),
                symbol(c, "symbols.comment", d.commentDelimiter()),
                string(c, "states.start", d.startState()),
                string(c, "states.halt-prefix", d.haltPrefix()),
                string(c, "states.simulation-prefix", d.simulationPrefix()),
                string(c, "files.input-extension", d.inputExtension()),
                string(c, "files.output-extension", d.outputExtension()));
    }

    /**
     * @param state A state label.
     * @return {@code true} if the label names a terminal state.
     */
    public boolean isTerminal(String state) {
        return state.startsWith(haltPrefix);
    }

    /**
     * @return The terminal state entered by engine generated halting transitions.
     */
    public String terminalState() {
        return haltPrefix;
    }

    /**
     * @return The label the source start state carries after renaming.
     */
    public String simulatedStartState() {
        return simulationPrefix + startState;
    }

    private static char symbol(Config c, String path, char fallback) {
        if (!c.hasPath(path)) {
            return fallback;
        }
        final String value = c.getString(path);
        if (value.length() != 1) {
            throw new ConfigException.BadValue(c.origin(), path, "must be a single character, got '" + value + "'");
        }
        return value.charAt(0);
    }

    private static String string(Config c, String path, String fallback) {
        return c.hasPath(path) ? c.getString(path) : fallback;
    }
}
