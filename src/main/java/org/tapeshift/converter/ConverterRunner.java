package org.tapeshift.converter;

import org.tapeshift.converter.api.ConversionErrorCode;
import org.tapeshift.converter.api.ConversionException;
import org.tapeshift.converter.api.ConversionResult;
import org.tapeshift.converter.backend.emit.TransitionSerializer;
import org.tapeshift.converter.model.ConverterSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Converts a table file on disk and writes the result next to it.
 * <p>
 * The output file has the same name as the input with the input extension replaced by the
 * output extension. It is only created once the conversion has succeeded.
 */
public class ConverterRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConverterRunner.class);

    private final ConverterSettings settings;
    private final Converter converter;
    private final TransitionSerializer serializer;

    public ConverterRunner(ConverterSettings settings) {
        this.settings = settings;
        this.converter = new Converter(settings);
        this.serializer = new TransitionSerializer(settings);
    }

    /**
     * The paths and the result of a completed file conversion.
     *
     * @param inputPath  The table that was read.
     * @param outputPath The table that was written.
     * @param result     The conversion result.
     */
    public record Report(Path inputPath, Path outputPath, ConversionResult result) {}

    /**
     * Reads, converts and writes a table.
     *
     * @param inputPath The input table.
     * @return The report of the conversion.
     * @throws ConversionException if the path has the wrong extension, cannot be read or written,
     *                             or holds an invalid table.
     */
    public Report run(Path inputPath) throws ConversionException {
        final Path outputPath = outputPathFor(inputPath);

        final List<String> lines;
        try {
            lines = Files.readAllLines(inputPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConversionException(ConversionErrorCode.IO_ERROR_READING_FILE,
                    "I/O error: cannot read " + inputPath + ": " + e.getMessage(), e);
        }

        final ConversionResult result = converter.convert(lines, inputPath.getFileName().toString());

        try {
            Files.writeString(outputPath, serializer.render(result), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConversionException(ConversionErrorCode.IO_ERROR_WRITING_FILE,
                    "I/O error: cannot write " + outputPath + ": " + e.getMessage(), e);
        }

        LOGGER.info("Converted {} -> {}: {} source transitions, {} generated transitions ({} to {} model)",
                inputPath, outputPath, result.sourceTransitionCount(), result.transitions().size(),
                result.sourceType().displayName(), result.targetType().displayName());
        return new Report(inputPath, outputPath, result);
    }

    /**
     * Derives the output path from an input path.
     *
     * @param inputPath The input table.
     * @return The input path with its extension replaced.
     * @throws ConversionException if the input path does not carry the input extension.
     */
    public Path outputPathFor(Path inputPath) throws ConversionException {
        final Path fileName = inputPath.getFileName();
        final String suffix = "." + settings.inputExtension();
        final String name = fileName == null ? "" : fileName.toString();
        if (name.length() <= suffix.length() || !name.endsWith(suffix)) {
            throw new ConversionException(ConversionErrorCode.INVALID_INPUT_EXTENSION,
                    "Input file name must end with '" + suffix + "': " + inputPath, inputPath.toString());
        }
        final String stem = name.substring(0, name.length() - suffix.length());
        return inputPath.resolveSibling(stem + "." + settings.outputExtension());
    }
}
