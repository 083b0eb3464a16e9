package org.metric.compiler;

import org.metric.compiler.api.EvaluationException;
import org.metric.compiler.api.ParseException;
import org.metric.compiler.api.StyleException;
import org.metric.compiler.api.TokenizerException;
import org.metric.compiler.api.TypeCheckException;
import org.metric.runtime.ExecutionResult;
import org.metric.runtime.Value;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs complete programs through every pipeline stage.
 */
public class MetricRunnerTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final MetricRunner runner = new MetricRunner(new PrintStream(buffer, true, StandardCharsets.UTF_8), true);

    private static String program(String... lines) {
        return String.join("\n", lines);
    }

    @Test
    @Tag("integration")
    void testArithmeticProgram() {
        // Act
        ExecutionResult result = runner.run(program("let x integer = 5", "let y integer = 10", "print x + y"));

        // Assert
        assertThat(result.printResults()).containsExactly(Value.of(15));
        assertThat(result.cost()).isEqualTo(6);
        assertThat(buffer.toString(StandardCharsets.UTF_8)).isEqualTo("15" + System.lineSeparator());
    }

    @Test
    @Tag("integration")
    void testListProgram() {
        ExecutionResult result = runner.run(program(
                "let nums list of integer = [1, 2, 3]",
                "set nums[1] = 99",
                "print nums"));

        assertThat(result.renderedOutput()).containsExactly("[1, 99, 3]");
        assertThat(result.cost()).isEqualTo(5);
    }

    @Test
    @Tag("integration")
    void testFunctionProgram() {
        ExecutionResult result = runner.run(program(
                "def add(x integer, y integer) returns integer",
                "    return x + y",
                "print add(3, 4)"));

        assertThat(result.renderedOutput()).containsExactly("7");
        assertThat(result.cost()).isEqualTo(5);
    }

    @Test
    @Tag("integration")
    void testLargeAndSmallFloatsPrintPositionally() {
        runner.run(program("print 10000000.0", "print 0.0001"));

        assertThat(buffer.toString(StandardCharsets.UTF_8))
                .isEqualTo("10000000.0" + System.lineSeparator() + "0.0001" + System.lineSeparator());
    }

    @Test
    @Tag("integration")
    void testTypeErrorStopsBeforeExecution() {
        assertThatThrownBy(() -> runner.run(program("let x integer = 5", "print x + true")))
                .isInstanceOf(TypeCheckException.class);
        assertThat(buffer.size()).isZero();
    }

    @Test
    @Tag("integration")
    void testRuntimeErrorIsPositioned() {
        assertThatThrownBy(() -> runner.run(program("let nums list of integer = [1, 2, 3]", "print nums[5]")))
                .isInstanceOfSatisfying(EvaluationException.class, e -> assertThat(e.formatted())
                        .isEqualTo("[Line 2, Column 7] Evaluation Error | List index 5 out of bounds (length 3)"));
    }

    @Test
    @Tag("integration")
    void testTokenizerErrorComesFirst() {
        assertThatThrownBy(() -> runner.run(program("if true", "   print 1")))
                .isInstanceOfSatisfying(TokenizerException.class, e -> assertThat(e.formatted())
                        .isEqualTo("[Line 2, Column 1] Tokenizer Error | Invalid indentation: expected multiples of 4 spaces"));
    }

    @Test
    @Tag("integration")
    void testStyleIsValidatedBeforeParsing() {
        assertThatThrownBy(() -> runner.check("print 1+ 2"))
                .isInstanceOf(StyleException.class)
                .hasMessage("Expected space before operator '+'");
    }

    @Test
    @Tag("integration")
    void testStyleCanBeDisabled() {
        MetricRunner lenient = new MetricRunner(new PrintStream(buffer, true, StandardCharsets.UTF_8), false);

        ExecutionResult result = lenient.run("print 1+ 2");

        assertThat(result.renderedOutput()).containsExactly("3");
    }

    @Test
    @Tag("integration")
    void testParseError() {
        assertThatThrownBy(() -> runner.check("let x integer"))
                .isInstanceOf(ParseException.class);
    }
}
