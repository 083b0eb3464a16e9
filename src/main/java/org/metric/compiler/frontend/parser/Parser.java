package org.metric.compiler.frontend.parser;

import org.metric.compiler.api.ParseException;
import org.metric.compiler.api.SourcePosition;
import org.metric.compiler.frontend.lexer.Token;
import org.metric.compiler.frontend.lexer.TokenType;
import org.metric.compiler.frontend.parser.ast.*;
import org.metric.compiler.types.ListType;
import org.metric.compiler.types.ScalarType;
import org.metric.compiler.types.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * The parser for the Metric language. It consumes the tokens produced by the
 * {@link org.metric.compiler.frontend.lexer.Lexer} and builds the Abstract Syntax Tree.
 * <p>
 * Expressions are parsed by recursive descent with one method per precedence level, from
 * {@code or} (lowest) down to factors. Statements are dispatched on their leading keyword.
 * There is no error recovery: the first mismatch throws a {@link ParseException}.
 */
public class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    static final String EXPECTED_STATEMENT =
            "Expected 'let', 'print', 'if', 'while', 'set', 'def', 'return', or comment statement";
    static final String EXPECTED_FACTOR =
            "Expected integer, float, identifier, boolean, or opening parenthesis";

    private static final Map<TokenType, BinaryOperator> COMPARISON_OPERATORS = new EnumMap<>(Map.of(
            TokenType.LESS_THAN, BinaryOperator.LESS_THAN,
            TokenType.GREATER_THAN, BinaryOperator.GREATER_THAN,
            TokenType.LESS_THAN_OR_EQUAL, BinaryOperator.LESS_THAN_OR_EQUAL,
            TokenType.GREATER_THAN_OR_EQUAL, BinaryOperator.GREATER_THAN_OR_EQUAL,
            TokenType.EQUAL_EQUAL, BinaryOperator.EQUAL_EQUAL,
            TokenType.NOT_EQUAL, BinaryOperator.NOT_EQUAL
    ));
    private static final Map<TokenType, BinaryOperator> ADDITIVE_OPERATORS = new EnumMap<>(Map.of(
            TokenType.PLUS, BinaryOperator.ADDITION,
            TokenType.MINUS, BinaryOperator.SUBTRACTION
    ));
    private static final Map<TokenType, BinaryOperator> MULTIPLICATIVE_OPERATORS = new EnumMap<>(Map.of(
            TokenType.MULTIPLY, BinaryOperator.MULTIPLICATION,
            TokenType.DIVIDE, BinaryOperator.DIVISION,
            TokenType.MODULUS, BinaryOperator.MODULUS
    ));
    private static final Map<TokenType, BinaryOperator> AND_OPERATOR = new EnumMap<>(Map.of(TokenType.AND, BinaryOperator.AND));
    private static final Map<TokenType, BinaryOperator> OR_OPERATOR = new EnumMap<>(Map.of(TokenType.OR, BinaryOperator.OR));

    private final List<Token> tokens;
    private final Map<TokenType, Supplier<Statement>> statementParsers = new EnumMap<>(TokenType.class);
    private final Map<AstNode, SourcePosition> positions = new IdentityHashMap<>();
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse.
     */
    public Parser(List<Token> tokens) {
        this.tokens = tokens;
        statementParsers.put(TokenType.LET, this::letStatement);
        statementParsers.put(TokenType.PRINT, this::printStatement);
        statementParsers.put(TokenType.IF, this::ifStatement);
        statementParsers.put(TokenType.WHILE, this::whileStatement);
        statementParsers.put(TokenType.SET, this::setStatement);
        statementParsers.put(TokenType.COMMENT, this::commentStatement);
        statementParsers.put(TokenType.DEF, this::functionDeclaration);
        statementParsers.put(TokenType.RETURN, this::returnStatement);
    }

    /**
     * Convenience entry point that parses a whole token stream.
     * @param tokens The tokens.
     * @return The parsed program.
     * @throws ParseException on the first syntax error.
     */
    public static ParseResult parse(List<Token> tokens) {
        return new Parser(tokens).parseProgram();
    }

    /**
     * Parses the entire token stream.
     * @return The top-level statements with their positions.
     * @throws ParseException on the first syntax error.
     */
    public ParseResult parseProgram() {
        List<Statement> statements = new ArrayList<>();
        while (!isAtEnd()) {
            if (match(TokenType.STATEMENT_SEPARATOR)) {
                continue;
            }
            statements.add(statement());
            match(TokenType.STATEMENT_SEPARATOR);
        }
        LOG.debug("Parsed {} top-level statement(s)", statements.size());
        return new ParseResult(statements, positions);
    }

    // region Statements

    /**
     * Parses a single statement, dispatching on its leading keyword.
     * @return The parsed statement.
     */
    public Statement statement() {
        if (isAtEnd()) {
            throw error(EXPECTED_STATEMENT);
        }
        Supplier<Statement> parser = statementParsers.get(peek().type());
        if (parser == null) {
            throw error(EXPECTED_STATEMENT);
        }
        return parser.get();
    }

    private Statement letStatement() {
        Token keyword = peek();
        if (remaining() < 5 || !checkNext(TokenType.IDENTIFIER)) {
            throw error("Expected 'let identifier type = expression'");
        }
        advance(); // 'let'
        String name = identifierName(advance());
        Type type = type();
        consume(TokenType.EQUALS, "Expected '=' after type annotation");
        Expression expression = expression();
        return at(new Let(name, type, expression), keyword);
    }

    private Statement printStatement() {
        Token keyword = advance();
        return at(new Print(expression()), keyword);
    }

    private Statement setStatement() {
        Token keyword = peek();
        if (remaining() < 4 || !checkNext(TokenType.IDENTIFIER)) {
            throw error("Expected 'set identifier = expression'");
        }
        advance(); // 'set'
        String name = identifierName(advance());

        if (match(TokenType.LEFT_BRACKET)) {
            Expression index = expression();
            consume(TokenType.RIGHT_BRACKET, "Expected ']' after list index");
            consume(TokenType.EQUALS, "Expected '=' after list index");
            Expression value = expression();
            return at(new ListAssignment(name, index, value), keyword);
        }
        if (match(TokenType.EQUALS)) {
            return at(new SetStatement(name, expression()), keyword);
        }
        throw error("Expected 'set identifier = expression'");
    }

    private Statement commentStatement() {
        Token comment = consume(TokenType.COMMENT, "Expected comment");
        return at(new Comment(), comment);
    }

    private Statement ifStatement() {
        Token keyword = peek();
        ControlFlowParts parts = controlFlow(TokenType.IF, "if");
        return at(new If(parts.condition(), parts.body()), keyword);
    }

    private Statement whileStatement() {
        Token keyword = peek();
        ControlFlowParts parts = controlFlow(TokenType.WHILE, "while");
        return at(new While(parts.condition(), parts.body()), keyword);
    }

    private record ControlFlowParts(Expression condition, List<Statement> body) {}

    private ControlFlowParts controlFlow(TokenType keyword, String name) {
        consume(keyword, "Expected '" + name + "'");
        if (isAtEnd()) {
            throw error("Expected expression after '" + name + "'");
        }
        Expression condition = expression();
        consume(TokenType.STATEMENT_SEPARATOR, "Expected newline after '" + name + "' condition");
        consume(TokenType.INDENT, "Expected indented block after '" + name + "'");
        List<Statement> body = block();
        consume(TokenType.DEDENT, "Expected dedent after '" + name + "' body");
        return new ControlFlowParts(condition, body);
    }

    /**
     * Parses the statements of an indented block up to (not including) its DEDENT.
     * Stray separators and nested indents are skipped.
     */
    private List<Statement> block() {
        List<Statement> statements = new ArrayList<>();
        while (!isAtEnd() && !check(TokenType.DEDENT)) {
            if (match(TokenType.STATEMENT_SEPARATOR) || match(TokenType.INDENT)) {
                continue;
            }
            statements.add(statement());
        }
        return statements;
    }

    private Statement functionDeclaration() {
        Token keyword = peek();
        if (remaining() < 6) {
            throw error("Expected 'def identifier(parameters) returns type'");
        }
        consume(TokenType.DEF, "Expected 'def'");
        String name = identifierName(consume(TokenType.IDENTIFIER, "Expected function name"));
        consume(TokenType.LEFT_PARENTHESIS, "Expected '(' after function name");
        List<Parameter> parameters = parameterList();
        consume(TokenType.RIGHT_PARENTHESIS, "Expected ')' after parameters");
        consume(TokenType.RETURNS, "Expected 'returns'");
        if (isAtEnd()) {
            throw error("Expected return type");
        }
        Type returnType = type();
        consume(TokenType.STATEMENT_SEPARATOR, "Expected newline after function signature");
        consume(TokenType.INDENT, "Expected indented function body");
        List<Statement> body = block();
        consume(TokenType.DEDENT, "Expected dedent after function body");
        return at(new FunctionDeclaration(name, parameters, returnType, body), keyword);
    }

    private List<Parameter> parameterList() {
        List<Parameter> parameters = new ArrayList<>();
        if (check(TokenType.RIGHT_PARENTHESIS)) {
            return parameters;
        }
        parameters.add(parameter("Expected parameter name"));
        while (match(TokenType.COMMA)) {
            parameters.add(parameter("Expected parameter name after comma"));
        }
        return parameters;
    }

    private Parameter parameter(String missingNameMessage) {
        String name = identifierName(consume(TokenType.IDENTIFIER, missingNameMessage));
        if (isAtEnd()) {
            throw error("Expected parameter type");
        }
        return new Parameter(name, type());
    }

    private Statement returnStatement() {
        Token keyword = peek();
        if (remaining() < 2) {
            throw error("Expected 'return expression'");
        }
        advance();
        return at(new Return(expression()), keyword);
    }

    // endregion

    // region Types

    /**
     * Parses a type: a scalar keyword or {@code list of <scalar>}.
     * @return The parsed type.
     */
    public Type type() {
        if (isAtEnd()) {
            throw error("Expected type");
        }
        if (check(TokenType.LIST)) {
            if (remaining() < 3 || !checkNext(TokenType.OF)) {
                throw error("Expected 'of' after 'list'");
            }
            advance(); // 'list'
            advance(); // 'of'
            return new ListType(scalarType());
        }
        return scalarType();
    }

    private ScalarType scalarType() {
        if (match(TokenType.INTEGER_TYPE)) return ScalarType.INTEGER;
        if (match(TokenType.BOOLEAN_TYPE)) return ScalarType.BOOLEAN;
        if (match(TokenType.FLOAT_TYPE)) return ScalarType.FLOAT;
        throw error("Expected type annotation (integer, boolean, or float)");
    }

    // endregion

    // region Expressions

    /**
     * Parses an expression at the lowest precedence level.
     * @return The parsed expression.
     */
    public Expression expression() {
        return logicalOr();
    }

    private Expression logicalOr() {
        return binaryRest(logicalAnd(), OR_OPERATOR, this::logicalAnd);
    }

    private Expression logicalAnd() {
        return binaryRest(unaryLogical(), AND_OPERATOR, this::unaryLogical);
    }

    private Expression unaryLogical() {
        if (check(TokenType.NOT)) {
            Token not = advance();
            return at(new UnaryExpression(UnaryOperator.NOT, unaryLogical()), not);
        }
        return comparison();
    }

    private Expression comparison() {
        return binaryRest(additive(), COMPARISON_OPERATORS, this::additive);
    }

    private Expression additive() {
        return binaryRest(multiplicative(), ADDITIVE_OPERATORS, this::multiplicative);
    }

    private Expression multiplicative() {
        return binaryRest(factor(), MULTIPLICATIVE_OPERATORS, this::factor);
    }

    /**
     * Folds a left-associative chain of operators of one precedence level.
     */
    private Expression binaryRest(Expression left, Map<TokenType, BinaryOperator> operators, Supplier<Expression> operand) {
        while (!isAtEnd() && operators.containsKey(peek().type())) {
            Token operatorToken = advance();
            Expression right = operand.get();
            SourcePosition leftPosition = positions.getOrDefault(left, operatorToken.position());
            left = new BinaryExpression(left, operators.get(operatorToken.type()), right);
            positions.put(left, leftPosition);
        }
        return left;
    }

    private Expression factor() {
        if (isAtEnd()) {
            throw error(EXPECTED_FACTOR);
        }
        Token token = peek();
        switch (token.type()) {
            case INTEGER:
                advance();
                return at(new IntegerLiteral((Long) token.value()), token);
            case FLOAT:
                advance();
                return at(new FloatLiteral((Double) token.value()), token);
            case TRUE:
                advance();
                return at(new BooleanLiteral(true), token);
            case FALSE:
                advance();
                return at(new BooleanLiteral(false), token);
            case IDENTIFIER:
                return identifierExpression();
            case LEFT_PARENTHESIS: {
                advance();
                Expression inner = expression();
                consume(TokenType.RIGHT_PARENTHESIS, "Expected closing parenthesis");
                return inner;
            }
            case LEFT_BRACKET:
                return listLiteral();
            case REPEAT:
                return repeatCall();
            case LEN:
                return lenCall();
            default:
                throw error(EXPECTED_FACTOR);
        }
    }

    private Expression identifierExpression() {
        Token identifier = advance();
        String name = identifierName(identifier);

        if (match(TokenType.LEFT_PARENTHESIS)) {
            List<Expression> arguments = new ArrayList<>();
            if (!isAtEnd() && !check(TokenType.RIGHT_PARENTHESIS)) {
                arguments.add(expression());
                while (match(TokenType.COMMA)) {
                    arguments.add(expression());
                }
            }
            consume(TokenType.RIGHT_PARENTHESIS, "Expected ')' after function arguments");
            return at(new FunctionCall(name, arguments), identifier);
        }

        if (match(TokenType.LEFT_BRACKET)) {
            Expression index = expression();
            consume(TokenType.RIGHT_BRACKET, "Expected ']' after list index");
            Variable list = at(new Variable(name), identifier);
            return at(new ListAccess(list, index), identifier);
        }

        return at(new Variable(name), identifier);
    }

    private Expression listLiteral() {
        Token open = advance();
        List<Expression> elements = new ArrayList<>();
        if (match(TokenType.RIGHT_BRACKET)) {
            return at(new ListLiteral(elements), open);
        }
        if (!isAtEnd()) {
            elements.add(expression());
            while (match(TokenType.COMMA)) {
                elements.add(expression());
            }
        }
        consume(TokenType.RIGHT_BRACKET, "Expected ']' after list elements");
        return at(new ListLiteral(elements), open);
    }

    private Expression repeatCall() {
        Token keyword = peek();
        if (remaining() < 2 || !checkNext(TokenType.LEFT_PARENTHESIS)) {
            throw error("Expected '(' after 'repeat'");
        }
        advance(); // 'repeat'
        advance(); // '('
        Expression value = expression();
        consume(TokenType.COMMA, "Expected ',' after repeat value");
        Expression count = expression();
        consume(TokenType.RIGHT_PARENTHESIS, "Expected ')' after repeat arguments");
        return at(new RepeatCall(value, count), keyword);
    }

    private Expression lenCall() {
        Token keyword = peek();
        if (remaining() < 2 || !checkNext(TokenType.LEFT_PARENTHESIS)) {
            throw error("Expected '(' after 'len'");
        }
        advance(); // 'len'
        advance(); // '('
        Expression list = expression();
        consume(TokenType.RIGHT_PARENTHESIS, "Expected ')' after len argument");
        return at(new LenCall(list), keyword);
    }

    // endregion

    // region Token stream

    /**
     * Consumes the current token if it matches any of the given types.
     * @param types The token types to match.
     * @return true if a token was consumed.
     */
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    /**
     * Checks the type of the current token without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    public boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    /**
     * Checks the type of the next token without consuming it.
     * @param type The token type to check.
     * @return true if the next token is of the given type, false otherwise.
     */
    public boolean checkNext(TokenType type) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
    }

    public Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    public boolean isAtEnd() {
        return current >= tokens.size();
    }

    public Token peek() {
        return tokens.get(current);
    }

    public Token previous() {
        return tokens.get(current - 1);
    }

    /**
     * Consumes the current token if it is of the expected type.
     * @param type The expected token type.
     * @param errorMessage The message of the {@link ParseException} thrown on mismatch.
     * @return The consumed token.
     */
    public Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        throw error(errorMessage);
    }

    private int remaining() {
        return tokens.size() - current;
    }

    /**
     * Builds an error positioned at the current token, or at the last token once input ran out.
     */
    private ParseException error(String message) {
        SourcePosition position;
        if (!isAtEnd()) {
            position = peek().position();
        } else if (!tokens.isEmpty()) {
            position = tokens.get(tokens.size() - 1).position();
        } else {
            position = new SourcePosition(1, 1);
        }
        return new ParseException(message, position);
    }

    private <N extends AstNode> N at(N node, Token token) {
        positions.put(node, token.position());
        return node;
    }

    private static String identifierName(Token token) {
        return (String) token.value();
    }

    // endregion
}
