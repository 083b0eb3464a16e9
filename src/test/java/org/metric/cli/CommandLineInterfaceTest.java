package org.metric.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives the command line end to end against programs written to a temporary directory.
 */
public class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int execute(String... args) {
        CommandLineInterface cli = new CommandLineInterface(
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        return CommandLineInterface.createCommandLine(cli).execute(args);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    @Tag("integration")
    void testRunPrintsOutputAndOperationCount() throws IOException {
        // Arrange
        Path program = write("sum.metric", "let x integer = 5\nlet y integer = 10\nprint x + y");

        // Act
        int exitCode = execute("--no-color", "run", program.toString());

        // Assert
        assertThat(exitCode).isZero();
        assertThat(stdout()).startsWith("15" + System.lineSeparator());
        assertThat(stdout()).containsPattern("Execution time: \\d+\\.\\d{4} seconds");
        assertThat(stdout()).contains("Operation count: 6");
        assertThat(stderr()).isEmpty();
    }

    @Test
    @Tag("integration")
    void testCheckDoesNotExecute() throws IOException {
        Path program = write("check.metric", "print 42");

        int exitCode = execute("check", program.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout()).isEqualTo("OK" + System.lineSeparator());
    }

    @Test
    @Tag("integration")
    void testAstPrintsJson() throws IOException {
        Path program = write("ast.metric", "print 1 + 2");

        int exitCode = execute("ast", program.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout())
                .contains("\"node\": \"Program\"")
                .contains("\"node\": \"Print\"")
                .contains("\"operator\": \"+\"");
    }

    @Test
    @Tag("integration")
    void testWrongExtensionIsRejected() throws IOException {
        Path program = write("program.txt", "print 1");

        int exitCode = execute("--no-color", "run", program.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr())
                .contains("Error: File '" + program + "' does not have .metric extension")
                .contains("Metric programs should use the .metric file extension");
        assertThat(stdout()).isEmpty();
    }

    @Test
    @Tag("integration")
    void testMissingFileIsReported() {
        Path missing = tempDir.resolve("missing.metric");

        int exitCode = execute("--no-color", "run", missing.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("Error: File '" + missing + "' not found");
    }

    /**
     * Verifies that pipeline errors are printed in the uniform format and give exit code 1.
     */
    @Test
    @Tag("integration")
    void testPipelineErrorIsFormatted() throws IOException {
        Path program = write("bad.metric", "let x integer = 5\nprint x + true");

        int exitCode = execute("--no-color", "run", program.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).startsWith("[Line 2, Column 7] TypeCheck Error | ");
    }

    @Test
    @Tag("integration")
    void testErrorsAreColouredByDefault() throws IOException {
        Path program = write("bad.metric", "print 1 / 0");

        int exitCode = execute("run", program.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).startsWith("\u001B[31m[Line 1, Column 7] Evaluation Error | Division by zero");
    }

    @Test
    @Tag("integration")
    void testConfigFileCanDisableStyleAndTiming() throws IOException {
        Path config = write("custom.conf", "metric { style.enabled = false, cli.show-timing = false }");
        Path program = write("loose.metric", "print 1+ 2");

        int exitCode = execute("--config", config.toString(), "run", program.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout()).isEqualTo("3" + System.lineSeparator());
    }

    @Test
    @Tag("integration")
    void testMissingConfigFileIsReported() throws IOException {
        Path program = write("ok.metric", "print 1");
        Path config = tempDir.resolve("absent.conf");

        int exitCode = execute("--no-color", "--config", config.toString(), "run", program.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("Error: Configuration file not found: " + config);
    }

    @Test
    @Tag("unit")
    void testNoSubcommandPrintsUsage() {
        int exitCode = execute();

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("Usage: metric").contains("run").contains("check").contains("ast");
    }
}
