package org.tapeshift.converter;

import org.tapeshift.converter.api.ConversionErrorCode;
import org.tapeshift.converter.api.ConversionException;
import org.tapeshift.converter.model.ConverterSettings;
import org.tapeshift.converter.model.MachineType;
import org.tapeshift.junit.extensions.logging.ExpectLog;
import org.tapeshift.junit.extensions.logging.LogLevel;
import org.tapeshift.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Integration tests for the {@link ConverterRunner}, working on real files in a temporary
 * directory. Every failing run must leave the directory as it was.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
public class ConverterRunnerTest {

    @TempDir
    Path tempDir;

    private final ConverterRunner runner = new ConverterRunner(ConverterSettings.defaults());

    @Test
    @ExpectLog(level = LogLevel.INFO, loggerPattern = ".*ConverterRunner", messagePattern = "Converted .*: 2 source transitions.*")
    void testWritesOutputNextToInput() throws IOException, ConversionException {
        // Arrange
        Path input = tempDir.resolve("machine.in");
        Files.write(input, List.of(";S", "0 0 1 r 0", "0 _ _ l halt"), StandardCharsets.UTF_8);

        // Act
        ConverterRunner.Report report = runner.run(input);

        // Assert
        assertThat(report.outputPath()).isEqualTo(tempDir.resolve("machine.out"));
        assertThat(report.result().targetType()).isEqualTo(MachineType.INFINITE);
        assertThat(Files.readAllLines(report.outputPath())).containsExactly(
                "; --- Sipser-to-Infinite Simulation ---",
                "; Start state: 0",
                "0 * * l q_write_wall",
                "q_write_wall _ # r sim_0",
                "q_write_wall * * l *",
                "sim_0 0 1 r *",
                "sim_0 _ * l halt");
    }

    @Test
    void testOutputPathReplacesExtension() throws ConversionException {
        assertThat(runner.outputPathFor(Path.of("dir", "a.b.in"))).isEqualTo(Path.of("dir", "a.b.out"));
        assertThat(runner.outputPathFor(Path.of("example.in"))).isEqualTo(Path.of("example.out"));
    }

    /**
     * Verifies that an input without the required extension is rejected before anything is
     * read or written.
     */
    @Test
    void testWrongExtensionIsRejectedWithoutWriting() throws IOException {
        // Arrange
        Path input = tempDir.resolve("machine.txt");
        Files.write(input, List.of(";S", "0 0 1 r halt"), StandardCharsets.UTF_8);

        // Act
        ConversionException e = catchThrowableOfType(() -> runner.run(input), ConversionException.class);

        // Assert
        assertThat(e.getErrorCode()).isEqualTo(ConversionErrorCode.INVALID_INPUT_EXTENSION);
        assertThat(e.getMessage()).startsWith("Input file name must end with '.in'");
        try (var files = Files.list(tempDir)) {
            assertThat(files).containsExactly(input);
        }
    }

    @Test
    void testBareExtensionIsNotAName() {
        ConversionException e = catchThrowableOfType(() -> runner.outputPathFor(Path.of(".in")), ConversionException.class);

        assertThat(e.getErrorCode()).isEqualTo(ConversionErrorCode.INVALID_INPUT_EXTENSION);
    }

    /**
     * Verifies that a missing input file is reported as a read error that keeps the cause.
     */
    @Test
    void testMissingInputIsAnIoError() {
        // Act
        ConversionException e = catchThrowableOfType(() -> runner.run(tempDir.resolve("absent.in")), ConversionException.class);

        // Assert
        assertThat(e.getErrorCode()).isEqualTo(ConversionErrorCode.IO_ERROR_READING_FILE);
        assertThat(e.getCause()).isInstanceOf(IOException.class);
    }

    /**
     * Verifies that a parse error in a later line aborts the run without an output file.
     */
    @Test
    void testParseErrorLeavesNoOutput() throws IOException {
        // Arrange
        Path input = tempDir.resolve("broken.in");
        Files.write(input, List.of(";I", "0 0 1 r 1", "1 0 1 sideways 0"), StandardCharsets.UTF_8);

        // Act
        ConversionException e = catchThrowableOfType(() -> runner.run(input), ConversionException.class);

        // Assert
        assertThat(e.getErrorCode()).isEqualTo(ConversionErrorCode.INVALID_DIRECTION);
        assertThat(tempDir.resolve("broken.out")).doesNotExist();
    }

    /**
     * Verifies that a directory in place of the output file is reported as a write error.
     */
    @Test
    void testUnwritableOutputIsAnIoError() throws IOException {
        // Arrange
        Path input = tempDir.resolve("blocked.in");
        Files.write(input, List.of(";I", "0 0 1 r halt"), StandardCharsets.UTF_8);
        Files.createDirectory(tempDir.resolve("blocked.out"));

        // Act
        ConversionException e = catchThrowableOfType(() -> runner.run(input), ConversionException.class);

        // Assert
        assertThat(e.getErrorCode()).isEqualTo(ConversionErrorCode.IO_ERROR_WRITING_FILE);
    }
}
