package org.metric.compiler.frontend.style;

import org.metric.compiler.api.StyleException;
import org.metric.compiler.frontend.lexer.Lexer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link StyleValidator}. Each test pins the message and the
 * position of one rule.
 */
public class StyleValidatorTest {

    private final StyleValidator validator = new StyleValidator();

    private void assertViolation(String source, String message, int line, int column) {
        assertThatThrownBy(() -> validator.validate(source, List.of()))
                .as(source)
                .isInstanceOfSatisfying(StyleException.class, e -> {
                    assertThat(e.getMessage()).isEqualTo(message);
                    assertThat(e.line()).as("line").isEqualTo(line);
                    assertThat(e.column()).as("column").isEqualTo(column);
                });
    }

    /**
     * Verifies that a well-formed program with blocks, calls and comments passes.
     */
    @Test
    @Tag("unit")
    void testWellFormedProgramPasses() {
        // Arrange
        String source = String.join("\n",
                "# Sum the first numbers",
                "def add(x integer, y integer) returns integer",
                "    return x + y",
                "",
                "let total integer = add(1, -2) # trailing comment",
                "print total");

        // Act & Assert
        assertThatCode(() -> validator.validate(source, Lexer.tokenize(source))).doesNotThrowAnyException();
    }

    @Test
    @Tag("unit")
    void testStructuralRules() {
        assertViolation("", "Program must not be empty", 1, 1);
        assertViolation("  \n ", "Program must not be empty", 1, 1);
        assertViolation("print 1\r\nprint 2", "Carriage return newlines not allowed; use \\n only", 1, 8);
        assertViolation("\nprint 1", "Leading newlines not allowed", 1, 1);
        assertViolation("print 1\nprint 2\n", "Trailing newlines not allowed", 3, 1);
        assertViolation("print 1\n\n\nprint 2", "Too many consecutive newlines: maximum 2 allowed", 3, 1);
    }

    @Test
    @Tag("unit")
    void testLineWhitespaceRules() {
        assertViolation("print 1 ", "Trailing spaces not allowed", 1, 8);
        assertViolation("if true\n      print 1", "Indentation must be in multiples of 4 spaces", 2, 5);
    }

    @Test
    @Tag("unit")
    void testOneStatementPerLine() {
        assertViolation("let x integer = 5 print x", "Statements must be separated by a newline", 1, 19);
    }

    @Test
    @Tag("unit")
    void testTokenSpacingRules() {
        assertViolation("print 1  + 2", "Multiple spaces not allowed between tokens", 1, 8);
        assertViolation("print x+ 1", "Expected space before operator '+'", 1, 8);
        assertViolation("print x1", "Expected space after identifier 'x'", 1, 8);
        assertViolation("print 5x", "Expected space after number '5'", 1, 8);
    }

    @Test
    @Tag("unit")
    void testCommentSpacing() {
        assertViolation("print 1#note", "Comments must be separated from code by exactly one space", 1, 8);
    }

    /**
     * Verifies that a comment on its own indented line counts as preceded by more than one space.
     */
    @Test
    @Tag("unit")
    void testIndentedCommentLineIsRejected() {
        assertViolation("if true\n    # note\n    print 1",
                "Comments must be separated from code by exactly one space", 2, 5);
    }

    @Test
    @Tag("unit")
    void testCommaSpacing() {
        assertViolation("print f(1 , 2)", "Space before comma not allowed", 1, 11);
        assertViolation("print f(1,2)", "Space required after comma", 1, 10);
    }
}
