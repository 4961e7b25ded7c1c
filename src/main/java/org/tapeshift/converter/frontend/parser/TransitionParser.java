package org.tapeshift.converter.frontend.parser;

import org.tapeshift.converter.api.ConversionErrorCode;
import org.tapeshift.converter.api.ConversionException;
import org.tapeshift.converter.api.SourceInfo;
import org.tapeshift.converter.model.ConverterSettings;
import org.tapeshift.converter.model.Direction;
import org.tapeshift.converter.model.Transition;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns the body lines of a table into {@link Transition}s.
 * <p>
 * A line is cut at the first comment delimiter and trimmed. What remains must be
 * empty, in which case the line is skipped, or consist of exactly five whitespace
 * separated tokens: {@code <state> <symbol> <new_symbol> <direction> <new_state>}.
 * <p>
 * A wildcard in the new-symbol position is expanded to the symbol read and a wildcard in
 * the new-state position to the current state, so every parsed transition names its
 * write and its target explicitly.
 * <p>
 * Tokens are separated by any character {@link Character#isWhitespace(char)} accepts. A symbol
 * is a single UTF-16 code unit, so characters outside the Basic Multilingual Plane are
 * rejected as invalid symbols.
 */
public class TransitionParser {

    private static final int PART_COUNT = 5;
    // Same whitespace class as String.strip()
    private static final Pattern SEPARATOR = Pattern.compile("\\p{javaWhitespace}+");

    private final ConverterSettings settings;
    private final String fileName;

    /**
     * Creates a new parser.
     * @param settings The reserved symbols, used for comments and wildcards.
     * @param fileName The name of the file being parsed, for error reporting.
     */
    public TransitionParser(ConverterSettings settings, String fileName) {
        this.settings = settings;
        this.fileName = fileName;
    }

    /**
     * Parses a sequence of lines, stopping at the first invalid one.
     *
     * @param lines           The lines to parse.
     * @param firstLineNumber The 1-based line number of the first element, for error reporting.
     * @return The parsed transitions in input order; blank and comment-only lines are omitted.
     * @throws ConversionException on the first invalid line.
     */
    public List<Transition> parseLines(List<String> lines, int firstLineNumber) throws ConversionException {
        final List<Transition> transitions = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            final Optional<Transition> parsed = parseLine(lines.get(i), firstLineNumber + i);
            parsed.ifPresent(transitions::add);
        }
        return transitions;
    }

    /**
     * Parses a single line.
     *
     * @param line       The raw line.
     * @param lineNumber The 1-based line number, for error reporting.
     * @return The transition, or empty if the line holds nothing but whitespace and comments.
     * @throws ConversionException if the line is not a valid transition.
     */
    public Optional<Transition> parseLine(String line, int lineNumber) throws ConversionException {
        final String content = stripComment(line).strip();
        if (content.isEmpty()) {
            return Optional.empty();
        }

        final SourceInfo source = new SourceInfo(fileName, lineNumber);
        final String[] parts = SEPARATOR.split(content);
        if (parts.length != PART_COUNT) {
            throw new ConversionException(ConversionErrorCode.INVALID_PART_COUNT,
                    "Invalid number of parts, expected 5, got " + parts.length, content, source);
        }

        final String currentState = parts[0];
        final char currentSymbol = symbol(parts[1], source);
        final char writtenSymbol = symbol(parts[2], source);
        final Direction direction = Direction.fromToken(parts[3])
                .orElseThrow(() -> new ConversionException(ConversionErrorCode.INVALID_DIRECTION,
                        "Invalid direction: " + parts[3], parts[3], source));
        final String targetState = parts[4];

        final char newSymbol = writtenSymbol == settings.wildcard() ? currentSymbol : writtenSymbol;
        final String newState = targetState.equals(String.valueOf(settings.wildcard())) ? currentState : targetState;
        return Optional.of(new Transition(currentState, currentSymbol, newSymbol, direction, newState));
    }

    private String stripComment(String line) {
        final int comment = line.indexOf(settings.commentDelimiter());
        return comment < 0 ? line : line.substring(0, comment);
    }

    private char symbol(String token, SourceInfo source) throws ConversionException {
        if (token.length() != 1) {
            throw new ConversionException(ConversionErrorCode.INVALID_SYMBOL,
                    "Invalid symbol, must be a single char: '" + token + "'", token, source);
        }
        return token.charAt(0);
    }
}
