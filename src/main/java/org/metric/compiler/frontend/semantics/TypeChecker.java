package org.metric.compiler.frontend.semantics;

import org.metric.compiler.api.TypeCheckException;
import org.metric.compiler.frontend.TreeWalker;
import org.metric.compiler.frontend.parser.ParseResult;
import org.metric.compiler.frontend.parser.ast.*;
import org.metric.compiler.types.ListType;
import org.metric.compiler.types.ScalarType;
import org.metric.compiler.types.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Statically checks a parsed program. Expressions are visited for their {@link Type};
 * statements are visited for their effect on the {@link SymbolTable} and function table.
 * <p>
 * There is no implicit conversion anywhere: {@code integer} is never widened to
 * {@code float} on assignment, argument passing or return. The first violation throws a
 * {@link TypeCheckException} positioned at the offending node.
 */
public class TypeChecker implements ExpressionVisitor<Type>, StatementVisitor<Void> {

    private static final Logger LOG = LoggerFactory.getLogger(TypeChecker.class);

    private final ParseResult program;
    private final SymbolTable symbolTable = new SymbolTable();
    private final Map<String, FunctionSignature> functions = new HashMap<>();
    private Type currentReturnType = null;

    /**
     * Constructs a type checker for a parsed program.
     * @param program The program, whose position table is used for error locations.
     */
    public TypeChecker(ParseResult program) {
        this.program = program;
    }

    /**
     * Type checks a parsed program.
     * @param program The program.
     * @throws TypeCheckException on the first violation.
     */
    public static void check(ParseResult program) {
        new TypeChecker(program).checkProgram();
    }

    /**
     * Type checks statements that did not come from the parser; errors carry no position.
     * @param statements The statements.
     * @throws TypeCheckException on the first violation.
     */
    public static void check(List<Statement> statements) {
        check(ParseResult.of(statements));
    }

    /**
     * Checks every top-level statement in order.
     */
    public void checkProgram() {
        for (Statement statement : program.statements()) {
            statement.accept(this);
        }
        LOG.debug("Type checked {} statement(s), {} function(s)", program.statements().size(), functions.size());
    }

    // region Statements

    @Override
    public Void visitLet(Let node) {
        if (symbolTable.isDefined(node.name())) {
            throw error(node, "Variable '" + node.name() + "' is already declared");
        }
        Type expressionType = node.expression().accept(this);
        if (!expressionType.equals(node.type())) {
            throw error(node, "Type mismatch: cannot assign " + expressionType.displayName()
                    + " to variable '" + node.name() + "' of type " + node.type().displayName());
        }
        symbolTable.define(node.name(), node.type());
        return null;
    }

    @Override
    public Void visitSet(SetStatement node) {
        Type variableType = symbolTable.resolve(node.name())
                .orElseThrow(() -> error(node, "Variable '" + node.name() + "' is not declared"));
        Type expressionType = node.expression().accept(this);
        if (!expressionType.equals(variableType)) {
            throw error(node, "Type mismatch: cannot assign " + expressionType.displayName()
                    + " to variable '" + node.name() + "' of type " + variableType.displayName());
        }
        return null;
    }

    @Override
    public Void visitListAssignment(ListAssignment node) {
        Type variableType = symbolTable.resolve(node.listName())
                .orElseThrow(() -> error(node, "Variable '" + node.listName() + "' is not declared"));
        if (!(variableType instanceof ListType listType)) {
            throw error(node, "Cannot index into non-list variable '" + node.listName()
                    + "' of type " + variableType.displayName());
        }
        Type indexType = node.index().accept(this);
        if (indexType != ScalarType.INTEGER) {
            throw error(node.index(), "List index must be integer, got " + indexType.displayName());
        }
        Type valueType = node.value().accept(this);
        if (!valueType.equals(listType.elementType())) {
            throw error(node, "Type mismatch: cannot assign " + valueType.displayName()
                    + " to list element of type " + listType.elementType().displayName());
        }
        return null;
    }

    @Override
    public Void visitPrint(Print node) {
        node.expression().accept(this);
        return null;
    }

    @Override
    public Void visitIf(If node) {
        checkCondition(node.condition(), "If");
        checkBody(node.body());
        return null;
    }

    @Override
    public Void visitWhile(While node) {
        checkCondition(node.condition(), "While");
        checkBody(node.body());
        return null;
    }

    @Override
    public Void visitComment(Comment node) {
        return null;
    }

    @Override
    public Void visitFunctionDeclaration(FunctionDeclaration node) {
        if (functions.containsKey(node.name())) {
            throw error(node, "Function '" + node.name() + "' is already declared");
        }
        List<Type> parameterTypes = node.parameters().stream().map(Parameter::type).toList();
        // Registered before the body so that recursive calls resolve.
        functions.put(node.name(), new FunctionSignature(parameterTypes, node.returnType()));

        symbolTable.enterScope();
        Type savedReturnType = currentReturnType;
        try {
            for (Parameter parameter : node.parameters()) {
                if (symbolTable.isDefined(parameter.name())) {
                    throw error(node, "Parameter '" + parameter.name() + "' conflicts with existing variable");
                }
                symbolTable.define(parameter.name(), parameter.type());
            }

            currentReturnType = node.returnType();
            checkBody(node.body());

            if (!TreeWalker.contains(node.body(), Return.class, Set.of(FunctionDeclaration.class))) {
                throw error(node, "Function '" + node.name() + "' must have a return statement");
            }
        } finally {
            currentReturnType = savedReturnType;
            symbolTable.leaveScope();
        }
        return null;
    }

    @Override
    public Void visitReturn(Return node) {
        if (currentReturnType == null) {
            throw error(node, "Return statement must be inside a function");
        }
        Type expressionType = node.expression().accept(this);
        if (!expressionType.equals(currentReturnType)) {
            throw error(node, "Return type mismatch: expected " + currentReturnType.displayName()
                    + ", got " + expressionType.displayName());
        }
        return null;
    }

    private void checkCondition(Expression condition, String statementName) {
        Type conditionType = condition.accept(this);
        if (conditionType != ScalarType.BOOLEAN) {
            throw error(condition, statementName + " condition must be boolean, got " + conditionType.displayName());
        }
    }

    private void checkBody(List<Statement> body) {
        for (Statement statement : body) {
            statement.accept(this);
        }
    }

    // endregion

    // region Expressions

    @Override
    public Type visitIntegerLiteral(IntegerLiteral node) {
        return ScalarType.INTEGER;
    }

    @Override
    public Type visitFloatLiteral(FloatLiteral node) {
        return ScalarType.FLOAT;
    }

    @Override
    public Type visitBooleanLiteral(BooleanLiteral node) {
        return ScalarType.BOOLEAN;
    }

    @Override
    public Type visitVariable(Variable node) {
        return symbolTable.resolve(node.name())
                .orElseThrow(() -> error(node, "Variable '" + node.name() + "' is not declared"));
    }

    @Override
    public Type visitUnaryExpression(UnaryExpression node) {
        Type operandType = node.operand().accept(this);
        if (operandType != ScalarType.BOOLEAN) {
            throw error(node, "Operator 'not' requires boolean operand, got " + operandType.displayName());
        }
        return ScalarType.BOOLEAN;
    }

    @Override
    public Type visitBinaryExpression(BinaryExpression node) {
        Type left = node.left().accept(this);
        Type right = node.right().accept(this);
        BinaryOperator operator = node.operator();

        switch (operator.category()) {
            case ARITHMETIC:
                requireNumeric(node, left, right);
                return left == ScalarType.FLOAT || right == ScalarType.FLOAT ? ScalarType.FLOAT : ScalarType.INTEGER;
            case MODULUS:
                if (left != ScalarType.INTEGER || right != ScalarType.INTEGER) {
                    throw error(node, "Operator " + operator.symbol() + " requires integer operands");
                }
                return ScalarType.INTEGER;
            case ORDERING:
                requireNumeric(node, left, right);
                return ScalarType.BOOLEAN;
            case EQUALITY:
                if (!left.equals(right)) {
                    throw error(node, "Operator " + operator.symbol() + " requires operands of same type");
                }
                return ScalarType.BOOLEAN;
            case LOGICAL:
                if (left != ScalarType.BOOLEAN || right != ScalarType.BOOLEAN) {
                    throw error(node, "Operator " + operator.symbol() + " requires boolean operands");
                }
                return ScalarType.BOOLEAN;
            default:
                throw new IllegalStateException("Unhandled operator category: " + operator.category());
        }
    }

    private void requireNumeric(BinaryExpression node, Type left, Type right) {
        if (!left.isNumeric() || !right.isNumeric()) {
            throw error(node, "Operator " + node.operator().symbol() + " requires numeric operands");
        }
    }

    @Override
    public Type visitFunctionCall(FunctionCall node) {
        FunctionSignature signature = functions.get(node.name());
        if (signature == null) {
            throw error(node, "Function '" + node.name() + "' is not declared");
        }
        List<Expression> arguments = node.arguments();
        if (arguments.size() != signature.arity()) {
            throw error(node, "Function '" + node.name() + "' expects " + signature.arity()
                    + " arguments, got " + arguments.size());
        }
        for (int i = 0; i < arguments.size(); i++) {
            Type expected = signature.parameterTypes().get(i);
            Type actual = arguments.get(i).accept(this);
            if (!actual.equals(expected)) {
                throw error(arguments.get(i), "Argument " + (i + 1) + " to function '" + node.name()
                        + "': expected " + expected.displayName() + ", got " + actual.displayName());
            }
        }
        return signature.returnType();
    }

    @Override
    public Type visitListLiteral(ListLiteral node) {
        List<Expression> elements = node.elements();
        if (elements.isEmpty()) {
            throw error(node, "Cannot infer type of empty list literal");
        }
        Type first = elements.get(0).accept(this);
        for (int i = 1; i < elements.size(); i++) {
            Type element = elements.get(i).accept(this);
            if (!element.equals(first)) {
                throw error(elements.get(i), "List elements must be homogeneous: element 0 is "
                        + first.displayName() + ", element " + i + " is " + element.displayName());
            }
        }
        if (!(first instanceof ScalarType scalar)) {
            throw error(node, "Nested lists are not supported");
        }
        return new ListType(scalar);
    }

    @Override
    public Type visitListAccess(ListAccess node) {
        Type listType = node.list().accept(this);
        if (!(listType instanceof ListType list)) {
            throw error(node, "Cannot index into non-list expression of type " + listType.displayName());
        }
        Type indexType = node.index().accept(this);
        if (indexType != ScalarType.INTEGER) {
            throw error(node.index(), "List index must be integer, got " + indexType.displayName());
        }
        return list.elementType();
    }

    @Override
    public Type visitRepeatCall(RepeatCall node) {
        Type valueType = node.value().accept(this);
        if (!(valueType instanceof ScalarType scalar)) {
            throw error(node, "Cannot repeat a list value");
        }
        Type countType = node.count().accept(this);
        if (countType != ScalarType.INTEGER) {
            throw error(node.count(), "Repeat count must be integer, got " + countType.displayName());
        }
        return new ListType(scalar);
    }

    @Override
    public Type visitLenCall(LenCall node) {
        Type listType = node.list().accept(this);
        if (!(listType instanceof ListType)) {
            throw error(node, "Cannot get length of non-list expression of type " + listType.displayName());
        }
        return ScalarType.INTEGER;
    }

    // endregion

    private TypeCheckException error(AstNode node, String message) {
        return new TypeCheckException(message, program.positionOf(node));
    }
}
