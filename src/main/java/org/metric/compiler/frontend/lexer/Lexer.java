package org.metric.compiler.frontend.lexer;

import org.metric.compiler.api.TokenizerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * Metric source code into a flat sequence of tokens.
 * <p>
 * Indentation is significant: leading spaces are measured in units of four and turned into
 * {@link TokenType#INDENT} and {@link TokenType#DEDENT} pseudo-tokens, and consecutive
 * non-empty lines are separated by {@link TokenType#STATEMENT_SEPARATOR}. Blank lines are
 * ignored completely. The first malformed character aborts tokenization with a
 * {@link TokenizerException}.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    /** Width of one indentation level in spaces. */
    public static final int INDENT_WIDTH = 4;

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("let", TokenType.LET),
            Map.entry("print", TokenType.PRINT),
            Map.entry("true", TokenType.TRUE),
            Map.entry("false", TokenType.FALSE),
            Map.entry("if", TokenType.IF),
            Map.entry("while", TokenType.WHILE),
            Map.entry("set", TokenType.SET),
            Map.entry("integer", TokenType.INTEGER_TYPE),
            Map.entry("boolean", TokenType.BOOLEAN_TYPE),
            Map.entry("float", TokenType.FLOAT_TYPE),
            Map.entry("def", TokenType.DEF),
            Map.entry("returns", TokenType.RETURNS),
            Map.entry("return", TokenType.RETURN),
            Map.entry("list", TokenType.LIST),
            Map.entry("of", TokenType.OF),
            Map.entry("repeat", TokenType.REPEAT),
            Map.entry("len", TokenType.LEN),
            Map.entry("and", TokenType.AND),
            Map.entry("or", TokenType.OR),
            Map.entry("not", TokenType.NOT)
    );

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indentStack = new ArrayDeque<>();

    // Per-line scanning state.
    private String lineText = "";
    private int line = 0;
    private int lineEnd = 0;
    private int start = 0;
    private int current = 0;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this.source = source;
    }

    /**
     * Convenience entry point that tokenizes a whole program.
     * @param source The source code.
     * @return The token sequence.
     * @throws TokenizerException on malformed input.
     */
    public static List<Token> tokenize(String source) {
        return new Lexer(source).scanTokens();
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens; empty for blank input.
     * @throws TokenizerException on malformed input.
     */
    public List<Token> scanTokens() {
        String[] lines = source.split("\n", -1);
        int lastContentLine = -1;
        for (int i = 0; i < lines.length; i++) {
            if (!lines[i].isBlank()) lastContentLine = i;
        }

        indentStack.clear();
        indentStack.push(0);

        for (int i = 0; i < lines.length; i++) {
            if (lines[i].isBlank()) continue;
            line = i + 1;
            lineText = lines[i];
            scanLine();
            if (i < lastContentLine) {
                addLayoutToken(TokenType.STATEMENT_SEPARATOR, lineEnd + 1);
            }
        }

        while (indentStack.size() > 1) {
            indentStack.pop();
            addLayoutToken(TokenType.DEDENT, 1);
        }

        LOG.debug("Tokenized {} line(s) into {} token(s)", lines.length, tokens.size());
        return tokens;
    }

    private void scanLine() {
        int spaces = 0;
        while (spaces < lineText.length() && lineText.charAt(spaces) == ' ') spaces++;
        handleIndentation(spaces);

        lineEnd = lineText.length();
        while (lineEnd > spaces && lineText.charAt(lineEnd - 1) == ' ') lineEnd--;

        current = spaces;
        while (current < lineEnd) {
            start = current;
            if (scanToken()) {
                // A comment swallows the rest of the line.
                return;
            }
        }
    }

    private void handleIndentation(int spaces) {
        if (spaces % INDENT_WIDTH != 0) {
            throw error("Invalid indentation: expected multiples of " + INDENT_WIDTH + " spaces", 1);
        }
        int depth = spaces / INDENT_WIDTH;
        int top = indentStack.peek();

        if (depth == top + 1) {
            indentStack.push(depth);
            addLayoutToken(TokenType.INDENT, 1);
        } else if (depth > top) {
            throw error("Invalid indentation: expected " + (top + 1) * INDENT_WIDTH + " spaces", 1);
        } else if (depth < top) {
            while (indentStack.size() > 1 && indentStack.peek() > depth) {
                indentStack.pop();
                addLayoutToken(TokenType.DEDENT, 1);
            }
            if (indentStack.peek() != depth) {
                throw error("Invalid indentation: expected " + indentStack.peek() * INDENT_WIDTH + " spaces", 1);
            }
        }
    }

    /**
     * Scans one token starting at {@code start}.
     * @return true if a comment was found and the rest of the line must be skipped.
     */
    private boolean scanToken() {
        char c = advance();
        switch (c) {
            case ' ':
                break;
            case '#':
                addToken(TokenType.COMMENT);
                return true;
            case '=':
                addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUALS);
                break;
            case '!':
                if (!match('=')) throw error("Unexpected character: !", start + 1);
                addToken(TokenType.NOT_EQUAL);
                break;
            case '<':
                addToken(match('=') ? TokenType.LESS_THAN_OR_EQUAL : TokenType.LESS_THAN);
                break;
            case '>':
                addToken(match('=') ? TokenType.GREATER_THAN_OR_EQUAL : TokenType.GREATER_THAN);
                break;
            case '-':
                // A minus directly followed by a digit is part of a negative literal.
                if (isDigit(peek())) {
                    number();
                } else {
                    addToken(TokenType.MINUS);
                }
                break;
            case '+': addToken(TokenType.PLUS); break;
            case '*': addToken(TokenType.MULTIPLY); break;
            case '/': addToken(TokenType.DIVIDE); break;
            case '%': addToken(TokenType.MODULUS); break;
            case '(': addToken(TokenType.LEFT_PARENTHESIS); break;
            case ')': addToken(TokenType.RIGHT_PARENTHESIS); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case '\t':
                throw error("Unexpected character: \\t", start + 1);
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    throw error("Unexpected character: " + c, start + 1);
                }
                break;
        }
        return false;
    }

    private void identifier() {
        while (isAlpha(peek())) advance();
        String text = lineText.substring(start, current);
        TokenType keyword = KEYWORDS.get(text);
        if (keyword != null) {
            addToken(keyword);
        } else {
            addToken(TokenType.IDENTIFIER, text);
        }
    }

    private void number() {
        while (isDigit(peek())) advance();

        if (peek() == '.') {
            advance(); // consume the '.'
            if (!isDigit(peek())) {
                throw error("Invalid float: missing digits after decimal point", current + 1);
            }
            while (isDigit(peek())) advance();
            String text = lineText.substring(start, current);
            addToken(TokenType.FLOAT, Double.parseDouble(text));
            return;
        }

        String text = lineText.substring(start, current);
        try {
            addToken(TokenType.INTEGER, Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw error("Invalid number format: " + text, start + 1);
        }
    }

    private char advance() {
        return lineText.charAt(current++);
    }

    private boolean match(char expected) {
        if (peek() != expected) return false;
        current++;
        return true;
    }

    private char peek() {
        if (current >= lineEnd) return '\0';
        return lineText.charAt(current);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object value) {
        String text = lineText.substring(start, current);
        tokens.add(new Token(type, text, value, line, start + 1));
    }

    private void addLayoutToken(TokenType type, int column) {
        tokens.add(new Token(type, "", null, line, column));
    }

    private TokenizerException error(String message, int column) {
        return new TokenizerException(message, line, column);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return Character.isLetter(c);
    }
}
