package org.metric.runtime;

import org.metric.compiler.api.EvaluationException;
import org.metric.compiler.frontend.parser.ParseResult;
import org.metric.compiler.frontend.parser.ast.*;
import org.metric.runtime.Value.BooleanValue;
import org.metric.runtime.Value.FloatValue;
import org.metric.runtime.Value.IntegerValue;
import org.metric.runtime.Value.ListValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Executes a Metric program by walking its AST, counting one unit of cost for every
 * meaningful operation.
 * <p>
 * The evaluator re-validates operand kinds before every risky operation, so it stays safe
 * on ASTs that never went through the type checker: every violation surfaces as an
 * {@link EvaluationException}. Printed values are written to the configured stream and
 * collected into the {@link ExecutionResult}.
 * <p>
 * Instances are not thread-safe.
 */
public class Evaluator {

    private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

    private final PrintStream out;
    private ParseResult program = ParseResult.of(List.of());
    private List<Value> printResults = new ArrayList<>();

    /**
     * Creates an evaluator that prints to standard output.
     */
    public Evaluator() {
        this(System.out);
    }

    /**
     * Creates an evaluator.
     * @param out The stream {@code print} writes to.
     */
    public Evaluator(PrintStream out) {
        this.out = out;
    }

    /**
     * Executes a parsed program from an empty environment.
     * @param program The program; its position table is used for error locations.
     * @return The printed values and the total cost.
     * @throws EvaluationException on the first runtime violation.
     */
    public ExecutionResult execute(ParseResult program) {
        this.program = program;
        this.printResults = new ArrayList<>();

        Environment environment = Environment.empty();
        Frame frame = new Frame(environment);
        for (Statement statement : program.statements()) {
            StatementOutcome outcome = frame.execute(statement);
            if (outcome instanceof StatementOutcome.Returned) {
                throw error(statement, "Return statement must be inside a function");
            }
        }

        long cost = frame.environment.cost();
        LOG.debug("Executed {} statement(s), {} print(s), cost {}", program.statements().size(), printResults.size(), cost);
        return new ExecutionResult(printResults, cost);
    }

    /**
     * Executes statements that did not come from the parser; errors carry no position.
     * @param statements The statements.
     * @return The printed values and the total cost.
     */
    public ExecutionResult execute(List<Statement> statements) {
        return execute(ParseResult.of(statements));
    }

    private EvaluationException error(AstNode node, String message) {
        return new EvaluationException(message, program.positionOf(node));
    }

    /**
     * The execution state of one function body or of the top level. Statements thread the
     * environment forward; expressions read it.
     */
    private final class Frame implements StatementVisitor<StatementOutcome>, ExpressionVisitor<Value> {

        private Environment environment;

        Frame(Environment environment) {
            this.environment = environment;
        }

        StatementOutcome execute(Statement statement) {
            StatementOutcome outcome;
            try {
                outcome = statement.accept(this);
            } catch (EvaluationException e) {
                throw e.at(program.positionOf(statement));
            }
            if (outcome instanceof StatementOutcome.Next next) {
                environment = next.environment();
            }
            return outcome;
        }

        /**
         * Runs a block, stopping at the first {@code return}.
         */
        StatementOutcome executeBlock(List<Statement> body) {
            for (Statement statement : body) {
                StatementOutcome outcome = execute(statement);
                if (outcome instanceof StatementOutcome.Returned) {
                    return outcome;
                }
            }
            return StatementOutcome.next(environment);
        }

        // region Statements

        @Override
        public StatementOutcome visitLet(Let node) {
            if (environment.isBound(node.name())) {
                throw error(node, "Variable already bound: " + node.name());
            }
            Value value = evaluate(node.expression());
            Environment updated = environment.add(node.name(), value);
            updated.incrementCost();
            return StatementOutcome.next(updated);
        }

        @Override
        public StatementOutcome visitSet(SetStatement node) {
            if (!environment.isBound(node.name())) {
                throw error(node, "Cannot set undefined variable: " + node.name());
            }
            Value value = evaluate(node.expression());
            Environment updated = environment.set(node.name(), value);
            updated.incrementCost();
            return StatementOutcome.next(updated);
        }

        @Override
        public StatementOutcome visitListAssignment(ListAssignment node) {
            if (!environment.isBound(node.listName())) {
                throw error(node, "Cannot set undefined variable: " + node.listName());
            }
            Value index = evaluate(node.index());
            if (!(index instanceof IntegerValue integerIndex)) {
                throw error(node.index(), "List index must be integer");
            }
            Value value = evaluate(node.value());
            Environment updated = environment.setListElement(node.listName(), integerIndex.value(), value);
            updated.incrementCost();
            return StatementOutcome.next(updated);
        }

        @Override
        public StatementOutcome visitPrint(Print node) {
            Value value = evaluate(node.expression());
            environment.incrementCost();
            out.println(value.render());
            printResults.add(value);
            return StatementOutcome.next(environment);
        }

        @Override
        public StatementOutcome visitIf(If node) {
            boolean condition = testCondition(node.condition(), "If");
            if (!condition) {
                return StatementOutcome.next(environment);
            }
            return executeBlock(node.body());
        }

        @Override
        public StatementOutcome visitWhile(While node) {
            while (testCondition(node.condition(), "While")) {
                StatementOutcome outcome = executeBlock(node.body());
                if (outcome instanceof StatementOutcome.Returned) {
                    return outcome;
                }
            }
            return StatementOutcome.next(environment);
        }

        private boolean testCondition(Expression condition, String statementName) {
            Value value = evaluate(condition);
            if (!(value instanceof BooleanValue bool)) {
                throw error(condition, statementName + " condition must be boolean");
            }
            environment.incrementCost();
            return bool.value();
        }

        @Override
        public StatementOutcome visitComment(Comment node) {
            return StatementOutcome.next(environment);
        }

        @Override
        public StatementOutcome visitFunctionDeclaration(FunctionDeclaration node) {
            if (environment.hasFunction(node.name())) {
                throw error(node, "Function already declared: " + node.name());
            }
            return StatementOutcome.next(environment.addFunction(node));
        }

        @Override
        public StatementOutcome visitReturn(Return node) {
            return StatementOutcome.returned(evaluate(node.expression()));
        }

        // endregion

        // region Expressions

        Value evaluate(Expression expression) {
            return expression.accept(this);
        }

        @Override
        public Value visitIntegerLiteral(IntegerLiteral node) {
            return new IntegerValue(node.value());
        }

        @Override
        public Value visitFloatLiteral(FloatLiteral node) {
            return new FloatValue(node.value());
        }

        @Override
        public Value visitBooleanLiteral(BooleanLiteral node) {
            return BooleanValue.of(node.value());
        }

        @Override
        public Value visitVariable(Variable node) {
            environment.incrementCost();
            return environment.find(node.name())
                    .orElseThrow(() -> error(node, "Undefined variable: " + node.name()));
        }

        @Override
        public Value visitUnaryExpression(UnaryExpression node) {
            Value operand = evaluate(node.operand());
            environment.incrementCost();
            return BooleanValue.of(!requireBoolean(node, operand));
        }

        @Override
        public Value visitBinaryExpression(BinaryExpression node) {
            Value left = evaluate(node.left());
            BinaryOperator operator = node.operator();

            if (operator == BinaryOperator.AND || operator == BinaryOperator.OR) {
                boolean leftValue = requireBoolean(node, left);
                boolean shortCircuit = operator == BinaryOperator.AND ? !leftValue : leftValue;
                if (shortCircuit) {
                    environment.incrementCost();
                    return BooleanValue.of(leftValue);
                }
                boolean rightValue = requireBoolean(node, evaluate(node.right()));
                environment.incrementCost();
                return BooleanValue.of(rightValue);
            }

            Value right = evaluate(node.right());
            environment.incrementCost();
            return Operations.apply(operator, left, right, message -> error(node, message));
        }

        private boolean requireBoolean(AstNode node, Value value) {
            if (!(value instanceof BooleanValue bool)) {
                throw error(node, "Expected boolean, got " + value.typeName());
            }
            return bool.value();
        }

        @Override
        public Value visitFunctionCall(FunctionCall node) {
            FunctionDeclaration function = environment.function(node.name())
                    .orElseThrow(() -> error(node, "Undefined function: " + node.name()));

            List<Value> arguments = new ArrayList<>(node.arguments().size());
            for (Expression argument : node.arguments()) {
                arguments.add(evaluate(argument));
            }
            if (arguments.size() != function.parameters().size()) {
                throw error(node, "Function '" + node.name() + "' expects " + function.parameters().size()
                        + " arguments, got " + arguments.size());
            }
            environment.incrementCost();

            Environment callEnvironment = environment.childForCall();
            for (int i = 0; i < arguments.size(); i++) {
                callEnvironment = callEnvironment.add(function.parameters().get(i).name(), arguments.get(i));
            }

            StatementOutcome outcome = new Frame(callEnvironment).executeBlock(function.body());
            if (outcome instanceof StatementOutcome.Returned returned) {
                return returned.value();
            }
            throw error(node, "Function '" + node.name() + "' did not return a value");
        }

        @Override
        public Value visitListLiteral(ListLiteral node) {
            environment.incrementCost();
            List<Value> elements = new ArrayList<>(node.elements().size());
            for (Expression element : node.elements()) {
                Value value = evaluate(element);
                if (value instanceof ListValue) {
                    throw error(element, "List elements must be integer, boolean, or float, got list");
                }
                elements.add(value);
            }
            return new ListValue(elements);
        }

        @Override
        public Value visitListAccess(ListAccess node) {
            Value list = evaluate(node.list());
            Value index = evaluate(node.index());
            if (!(list instanceof ListValue listValue)) {
                throw error(node, "Cannot index into non-list value");
            }
            if (!(index instanceof IntegerValue integerIndex)) {
                throw error(node.index(), "List index must be integer");
            }
            long i = integerIndex.value();
            if (i < 0 || i >= listValue.size()) {
                throw error(node, "List index " + i + " out of bounds (length " + listValue.size() + ")");
            }
            environment.incrementCost();
            return listValue.elements().get((int) i);
        }

        @Override
        public Value visitRepeatCall(RepeatCall node) {
            Value value = evaluate(node.value());
            Value count = evaluate(node.count());
            if (!(count instanceof IntegerValue integerCount)) {
                throw error(node.count(), "Repeat count must be integer");
            }
            if (integerCount.value() < 0) {
                throw error(node.count(), "Repeat count cannot be negative");
            }
            if (integerCount.value() > Integer.MAX_VALUE) {
                throw error(node.count(), "Repeat count too large: " + integerCount.value());
            }
            if (value instanceof ListValue) {
                throw error(node.value(), "Repeat value must be integer, boolean, or float, got list");
            }
            environment.incrementCost();
            return new ListValue(Collections.nCopies((int) integerCount.value(), value));
        }

        @Override
        public Value visitLenCall(LenCall node) {
            Value list = evaluate(node.list());
            if (!(list instanceof ListValue listValue)) {
                throw error(node.list(), "Expected list, got " + list.typeName());
            }
            environment.incrementCost();
            return new IntegerValue(listValue.size());
        }

        // endregion
    }
}
