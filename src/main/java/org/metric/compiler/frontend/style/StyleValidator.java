package org.metric.compiler.frontend.style;

import org.metric.compiler.api.StyleException;
import org.metric.compiler.frontend.lexer.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Enforces the whitespace and layout rules of Metric source code.
 * <p>
 * Runs after tokenization and before parsing. The checks work on the raw text, line by line,
 * and run in a fixed order; the first violation throws a {@link StyleException}.
 */
public class StyleValidator {

    private static final Logger LOG = LoggerFactory.getLogger(StyleValidator.class);

    private static final Set<String> STATEMENT_KEYWORDS = Set.of("let", "print", "if", "while", "set", "def", "return");
    private static final String OPERATOR_CHARACTERS = "+-*/%=<>!";
    private static final int INDENT_WIDTH = 4;
    private static final int MAX_CONSECUTIVE_NEWLINES = 2;

    /**
     * Validates a program.
     * @param source The original source text.
     * @param tokens The tokens the lexer produced for it.
     * @throws StyleException on the first violation.
     */
    public void validate(String source, List<Token> tokens) {
        validateNotEmpty(source);
        validateLineEndings(source);
        validateLeadingTrailingNewlines(source);
        validateConsecutiveNewlines(source);

        String[] lines = source.split("\n", -1);
        validateLineWhitespace(lines);
        validateOneStatementPerLine(lines);
        validateTokenSpacing(lines);
        validateCommentSpacing(lines);
        validateCommaSpacing(lines);

        LOG.debug("Style check passed for {} line(s), {} token(s)", lines.length, tokens.size());
    }

    private static void validateNotEmpty(String source) {
        if (source.isBlank()) {
            throw new StyleException("Program must not be empty", 1, 1);
        }
    }

    private static void validateLineEndings(String source) {
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\r') {
                throw new StyleException("Carriage return newlines not allowed; use \\n only", line, i - lineStart + 1);
            }
            if (c == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
    }

    private static void validateLeadingTrailingNewlines(String source) {
        if (source.startsWith("\n")) {
            throw new StyleException("Leading newlines not allowed", 1, 1);
        }
        if (source.endsWith("\n")) {
            throw new StyleException("Trailing newlines not allowed", countNewlines(source) + 1, 1);
        }
    }

    private static void validateConsecutiveNewlines(String source) {
        int consecutive = 0;
        int line = 1;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                consecutive++;
                if (consecutive > MAX_CONSECUTIVE_NEWLINES) {
                    throw new StyleException("Too many consecutive newlines: maximum " + MAX_CONSECUTIVE_NEWLINES + " allowed", line, 1);
                }
                line++;
            } else {
                consecutive = 0;
            }
        }
    }

    private static void validateLineWhitespace(String[] lines) {
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            int lineNumber = i + 1;

            if (line.endsWith(" ")) {
                throw new StyleException("Trailing spaces not allowed", lineNumber, line.stripTrailing().length() + 1);
            }

            int leading = leadingSpaces(line);
            if (leading % INDENT_WIDTH != 0) {
                throw new StyleException("Indentation must be in multiples of " + INDENT_WIDTH + " spaces",
                        lineNumber, (leading / INDENT_WIDTH) * INDENT_WIDTH + 1);
            }
        }
    }

    private static void validateOneStatementPerLine(String[] lines) {
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            String code = codePart(line).strip();
            if (code.isEmpty()) {
                continue;
            }

            int keywords = 0;
            int searchFrom = 0;
            for (String word : code.split("\\s+")) {
                int position = line.indexOf(word, searchFrom);
                if (STATEMENT_KEYWORDS.contains(word) && ++keywords == 2) {
                    throw new StyleException("Statements must be separated by a newline", i + 1, position + 1);
                }
                searchFrom = position + word.length();
            }
        }
    }

    private static void validateTokenSpacing(String[] lines) {
        for (int i = 0; i < lines.length; i++) {
            String code = codePart(lines[i]);
            if (code.isBlank()) {
                continue;
            }
            checkMultipleSpaces(code, i + 1);
            checkOperatorSpacing(code, i + 1);
            checkIdentifierNumberSpacing(code, i + 1);
        }
    }

    private static void checkMultipleSpaces(String code, int lineNumber) {
        for (int i = leadingSpaces(code); i < code.length() - 1; i++) {
            if (code.charAt(i) == ' ' && code.charAt(i + 1) == ' ') {
                throw new StyleException("Multiple spaces not allowed between tokens", lineNumber, i + 1);
            }
        }
    }

    private static void checkOperatorSpacing(String code, int lineNumber) {
        for (int i = 1; i < code.length(); i++) {
            char c = code.charAt(i);
            if (OPERATOR_CHARACTERS.indexOf(c) >= 0 && Character.isLetterOrDigit(code.charAt(i - 1))) {
                throw new StyleException("Expected space before operator '" + c + "'", lineNumber, i + 1);
            }
        }
    }

    private static void checkIdentifierNumberSpacing(String code, int lineNumber) {
        int i = 0;
        while (i < code.length()) {
            char c = code.charAt(i);
            if (Character.isLetter(c)) {
                int start = i;
                while (i < code.length() && Character.isLetter(code.charAt(i))) i++;
                if (i < code.length() && Character.isLetterOrDigit(code.charAt(i))) {
                    throw new StyleException("Expected space after identifier '" + code.substring(start, i) + "'", lineNumber, i + 1);
                }
            } else if (Character.isDigit(c)) {
                int start = i;
                while (i < code.length() && (Character.isDigit(code.charAt(i)) || code.charAt(i) == '.')) i++;
                if (i < code.length() && Character.isLetterOrDigit(code.charAt(i))) {
                    throw new StyleException("Expected space after number '" + code.substring(start, i) + "'", lineNumber, i + 1);
                }
            } else {
                i++;
            }
        }
    }

    private static void validateCommentSpacing(String[] lines) {
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            int hash = line.indexOf('#');
            if (hash <= 0) {
                continue;
            }
            if (line.charAt(hash - 1) != ' ' || (hash > 1 && line.charAt(hash - 2) == ' ')) {
                throw new StyleException("Comments must be separated from code by exactly one space", i + 1, hash + 1);
            }
        }
    }

    private static void validateCommaSpacing(String[] lines) {
        for (int i = 0; i < lines.length; i++) {
            String code = codePart(lines[i]);
            for (int j = 0; j < code.length(); j++) {
                if (code.charAt(j) != ',') {
                    continue;
                }
                if (j > 0 && code.charAt(j - 1) == ' ') {
                    throw new StyleException("Space before comma not allowed", i + 1, j + 1);
                }
                if (j + 1 >= code.length() || code.charAt(j + 1) != ' ') {
                    throw new StyleException("Space required after comma", i + 1, j + 1);
                }
            }
        }
    }

    private static String codePart(String line) {
        int hash = line.indexOf('#');
        return hash < 0 ? line : line.substring(0, hash);
    }

    private static int leadingSpaces(String line) {
        int count = 0;
        while (count < line.length() && line.charAt(count) == ' ') count++;
        return count;
    }

    private static int countNewlines(String source) {
        int count = 0;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') count++;
        }
        return count;
    }
}
