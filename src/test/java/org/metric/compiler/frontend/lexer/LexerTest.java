package org.metric.compiler.frontend.lexer;

import org.metric.compiler.api.MetricException;
import org.metric.compiler.api.TokenizerException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.metric.compiler.frontend.lexer.TokenType.*;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that source text is turned into the expected token stream, including
 * the indentation pseudo-tokens, and that malformed input is rejected with a positioned error.
 */
public class LexerTest {

    /**
     * Verifies that a simple declaration is tokenized into keywords, an identifier and a literal.
     */
    @Test
    @Tag("unit")
    void testLetStatement() {
        // Act
        List<Token> tokens = Lexer.tokenize("let x integer = 5");

        // Assert
        assertThat(tokens).containsExactly(
                Token.of(LET), Token.identifier("x"), Token.of(INTEGER_TYPE), Token.of(EQUALS), Token.integer(5));
        assertThat(tokens.get(1)).extracting(Token::line, Token::column).containsExactly(1, 5);
        assertThat(tokens.get(4)).extracting(Token::text, Token::value).containsExactly("5", 5L);
    }

    /**
     * Verifies INDENT, DEDENT and STATEMENT_SEPARATOR placement around an indented block.
     */
    @Test
    @Tag("unit")
    void testIndentationProducesLayoutTokens() {
        // Arrange
        String source = String.join("\n",
                "if true",
                "    print 1",
                "print 2");

        // Act
        List<Token> tokens = Lexer.tokenize(source);

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                IF, TRUE, STATEMENT_SEPARATOR, INDENT, PRINT, INTEGER, STATEMENT_SEPARATOR, DEDENT, PRINT, INTEGER);
    }

    /**
     * Verifies that open blocks are closed with one DEDENT per level at the end of input.
     */
    @Test
    @Tag("unit")
    void testDedentsAtEndOfInput() {
        // Arrange
        String source = String.join("\n",
                "while true",
                "    if false",
                "        print 1");

        // Act
        List<Token> tokens = Lexer.tokenize(source);

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                WHILE, TRUE, STATEMENT_SEPARATOR, INDENT, IF, FALSE, STATEMENT_SEPARATOR, INDENT, PRINT, INTEGER,
                DEDENT, DEDENT);
    }

    /**
     * Verifies that blank lines produce no tokens but still count for line numbers.
     */
    @Test
    @Tag("unit")
    void testBlankLinesAreSkipped() {
        // Act
        List<Token> tokens = Lexer.tokenize("print 1\n\n   \nprint 2");

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(PRINT, INTEGER, STATEMENT_SEPARATOR, PRINT, INTEGER);
        assertThat(tokens.get(3).line()).isEqualTo(4);
    }

    @Test
    @Tag("unit")
    void testEmptyInputYieldsNoTokens() {
        assertThat(Lexer.tokenize("")).isEmpty();
        assertThat(Lexer.tokenize("\n    \n")).isEmpty();
    }

    /**
     * Verifies that a minus directly before a digit becomes part of the literal, while a
     * spaced minus stays an operator.
     */
    @Test
    @Tag("unit")
    void testNegativeLiteralsAndMinusOperator() {
        // Act
        List<Token> negative = Lexer.tokenize("print -5");
        List<Token> subtraction = Lexer.tokenize("print x - 2.5");

        // Assert
        assertThat(negative).containsExactly(Token.of(PRINT), Token.integer(-5));
        assertThat(subtraction).containsExactly(Token.of(PRINT), Token.identifier("x"), Token.of(MINUS), Token.floating(2.5));
    }

    @Test
    @Tag("unit")
    void testOperatorsAndPunctuation() {
        // Act
        List<Token> tokens = Lexer.tokenize("print a == b != c <= d >= e < f > g + h * i / j % k and l or not m");

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                PRINT, IDENTIFIER, EQUAL_EQUAL, IDENTIFIER, NOT_EQUAL, IDENTIFIER, LESS_THAN_OR_EQUAL, IDENTIFIER,
                GREATER_THAN_OR_EQUAL, IDENTIFIER, LESS_THAN, IDENTIFIER, GREATER_THAN, IDENTIFIER, PLUS, IDENTIFIER,
                MULTIPLY, IDENTIFIER, DIVIDE, IDENTIFIER, MODULUS, IDENTIFIER, AND, IDENTIFIER, OR, NOT, IDENTIFIER);
    }

    @Test
    @Tag("unit")
    void testListAndFunctionKeywords() {
        // Act
        List<Token> tokens = Lexer.tokenize("def f(xs list of float) returns integer");
        List<Token> builtins = Lexer.tokenize("print len(repeat(true, 3))");

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                DEF, IDENTIFIER, LEFT_PARENTHESIS, IDENTIFIER, LIST, OF, FLOAT_TYPE, RIGHT_PARENTHESIS, RETURNS, INTEGER_TYPE);
        assertThat(builtins).extracting(Token::type).containsExactly(
                PRINT, LEN, LEFT_PARENTHESIS, REPEAT, LEFT_PARENTHESIS, TRUE, COMMA, INTEGER, RIGHT_PARENTHESIS, RIGHT_PARENTHESIS);
    }

    /**
     * Verifies that a comment ends the scanned content of its line and becomes a single token.
     */
    @Test
    @Tag("unit")
    void testCommentEndsLine() {
        // Act
        List<Token> trailing = Lexer.tokenize("print 1 # the rest is ignored: @!");
        List<Token> alone = Lexer.tokenize("# just a comment");

        // Assert
        assertThat(trailing).extracting(Token::type).containsExactly(PRINT, INTEGER, COMMENT);
        assertThat(alone).extracting(Token::type).containsExactly(COMMENT);
    }

    @Test
    @Tag("unit")
    void testTrailingSpacesAreIgnored() {
        assertThat(Lexer.tokenize("print 1   ")).containsExactly(Token.of(PRINT), Token.integer(1));
    }

    /**
     * Verifies the classic malformed-indentation case: a three-space indent.
     */
    @Test
    @Tag("unit")
    void testIndentationNotMultipleOfFour() {
        assertThatThrownBy(() -> Lexer.tokenize("let x integer = 5\n   print x"))
                .isInstanceOf(TokenizerException.class)
                .hasMessage("Invalid indentation: expected multiples of 4 spaces")
                .extracting(e -> ((MetricException) e).line())
                .isEqualTo(2);
    }

    @Test
    @Tag("unit")
    void testIndentationJump() {
        assertThatThrownBy(() -> Lexer.tokenize("if true\n        print 1"))
                .isInstanceOf(TokenizerException.class)
                .hasMessage("Invalid indentation: expected 4 spaces");
    }

    @Test
    @Tag("unit")
    void testUnexpectedCharacter() {
        assertThatThrownBy(() -> Lexer.tokenize("print @"))
                .isInstanceOf(TokenizerException.class)
                .hasMessage("Unexpected character: @")
                .extracting(e -> ((MetricException) e).column())
                .isEqualTo(7);
    }

    @Test
    @Tag("unit")
    void testTabIsRejected() {
        assertThatThrownBy(() -> Lexer.tokenize("print\t1"))
                .isInstanceOf(TokenizerException.class)
                .hasMessage("Unexpected character: \\t");
    }

    @Test
    @Tag("unit")
    void testBangWithoutEquals() {
        assertThatThrownBy(() -> Lexer.tokenize("print !x"))
                .isInstanceOf(TokenizerException.class)
                .hasMessage("Unexpected character: !");
    }

    @Test
    @Tag("unit")
    void testMalformedNumbers() {
        assertThatThrownBy(() -> Lexer.tokenize("print 1."))
                .isInstanceOf(TokenizerException.class)
                .hasMessage("Invalid float: missing digits after decimal point");
        assertThatThrownBy(() -> Lexer.tokenize("print 99999999999999999999"))
                .isInstanceOf(TokenizerException.class)
                .hasMessage("Invalid number format: 99999999999999999999");
    }

    /**
     * Verifies the uniform error rendering used on the command line.
     */
    @Test
    @Tag("unit")
    void testFormattedError() {
        assertThatThrownBy(() -> Lexer.tokenize("print @"))
                .isInstanceOfSatisfying(TokenizerException.class, e -> assertThat(e.formatted())
                        .isEqualTo("[Line 1, Column 7] Tokenizer Error | Unexpected character: @"));
    }
}
