package org.metric.compiler;

import org.metric.compiler.api.MetricException;
import org.metric.compiler.frontend.lexer.Lexer;
import org.metric.compiler.frontend.lexer.Token;
import org.metric.compiler.frontend.parser.ParseResult;
import org.metric.compiler.frontend.parser.Parser;
import org.metric.compiler.frontend.semantics.TypeChecker;
import org.metric.compiler.frontend.style.StyleValidator;
import org.metric.runtime.Evaluator;
import org.metric.runtime.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.List;

/**
 * Runs Metric source code through the pipeline: tokenize, validate style, parse, type check,
 * execute. Each stage fails fast by throwing its {@link MetricException} subclass.
 */
public class MetricRunner {

    private static final Logger LOG = LoggerFactory.getLogger(MetricRunner.class);

    private final PrintStream out;
    private final boolean styleEnabled;
    private final StyleValidator styleValidator = new StyleValidator();

    /**
     * Creates a runner that prints to standard output and validates style.
     */
    public MetricRunner() {
        this(System.out, true);
    }

    /**
     * @param out The stream {@code print} writes to.
     * @param styleEnabled Whether {@link #run} and {@link #check} run the style validator.
     */
    public MetricRunner(PrintStream out, boolean styleEnabled) {
        this.out = out;
        this.styleEnabled = styleEnabled;
    }

    public List<Token> tokenize(String source) {
        return Lexer.tokenize(source);
    }

    public void validateStyle(String source, List<Token> tokens) {
        styleValidator.validate(source, tokens);
    }

    public ParseResult parse(List<Token> tokens) {
        return Parser.parse(tokens);
    }

    public void typeCheck(ParseResult program) {
        TypeChecker.check(program);
    }

    public ExecutionResult execute(ParseResult program) {
        return new Evaluator(out).execute(program);
    }

    /**
     * Runs every stage except execution.
     * @param source The program text.
     * @return The checked program.
     * @throws MetricException on the first error.
     */
    public ParseResult check(String source) {
        List<Token> tokens = tokenize(source);
        if (styleEnabled) {
            validateStyle(source, tokens);
        } else {
            LOG.debug("Style validation disabled");
        }
        ParseResult program = parse(tokens);
        typeCheck(program);
        return program;
    }

    /**
     * Runs the whole pipeline.
     * @param source The program text.
     * @return The printed values and the operation cost.
     * @throws MetricException on the first error.
     */
    public ExecutionResult run(String source) {
        return execute(check(source));
    }
}
