package org.metric.compiler.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.metric.compiler.api.SourcePosition;
import org.metric.compiler.frontend.parser.ParseResult;
import org.metric.compiler.frontend.parser.ast.*;

import java.util.List;

/**
 * Serializes a parsed program to JSON for inspection. Every node becomes an object whose
 * {@code node} member names its kind; nodes with a known source position also carry
 * {@code line} and {@code column}.
 */
public final class AstJsonWriter implements ExpressionVisitor<JsonObject>, StatementVisitor<JsonObject> {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private final ParseResult program;

    private AstJsonWriter(ParseResult program) {
        this.program = program;
    }

    /**
     * @param program The parsed program.
     * @return The program as a JSON object with a {@code statements} array.
     */
    public static JsonObject toJsonTree(ParseResult program) {
        AstJsonWriter writer = new AstJsonWriter(program);
        JsonObject root = new JsonObject();
        root.addProperty("node", "Program");
        root.add("statements", writer.statements(program.statements()));
        return root;
    }

    /**
     * @param program The parsed program.
     * @return Pretty-printed JSON.
     */
    public static String toJson(ParseResult program) {
        return GSON.toJson(toJsonTree(program));
    }

    private JsonArray statements(List<Statement> statements) {
        JsonArray array = new JsonArray();
        for (Statement statement : statements) {
            array.add(statement.accept(this));
        }
        return array;
    }

    private JsonArray expressions(List<Expression> expressions) {
        JsonArray array = new JsonArray();
        for (Expression expression : expressions) {
            array.add(expression.accept(this));
        }
        return array;
    }

    private JsonObject node(AstNode node, String kind) {
        JsonObject json = new JsonObject();
        json.addProperty("node", kind);
        SourcePosition position = program.positionOf(node);
        if (!SourcePosition.UNKNOWN.equals(position)) {
            json.addProperty("line", position.line());
            json.addProperty("column", position.column());
        }
        return json;
    }

    // region Statements

    @Override
    public JsonObject visitLet(Let node) {
        JsonObject json = node(node, "Let");
        json.addProperty("name", node.name());
        json.addProperty("type", node.type().displayName());
        json.add("expression", node.expression().accept(this));
        return json;
    }

    @Override
    public JsonObject visitSet(SetStatement node) {
        JsonObject json = node(node, "Set");
        json.addProperty("name", node.name());
        json.add("expression", node.expression().accept(this));
        return json;
    }

    @Override
    public JsonObject visitListAssignment(ListAssignment node) {
        JsonObject json = node(node, "ListAssignment");
        json.addProperty("name", node.listName());
        json.add("index", node.index().accept(this));
        json.add("value", node.value().accept(this));
        return json;
    }

    @Override
    public JsonObject visitPrint(Print node) {
        JsonObject json = node(node, "Print");
        json.add("expression", node.expression().accept(this));
        return json;
    }

    @Override
    public JsonObject visitIf(If node) {
        JsonObject json = node(node, "If");
        json.add("condition", node.condition().accept(this));
        json.add("body", statements(node.body()));
        return json;
    }

    @Override
    public JsonObject visitWhile(While node) {
        JsonObject json = node(node, "While");
        json.add("condition", node.condition().accept(this));
        json.add("body", statements(node.body()));
        return json;
    }

    @Override
    public JsonObject visitComment(Comment node) {
        return node(node, "Comment");
    }

    @Override
    public JsonObject visitFunctionDeclaration(FunctionDeclaration node) {
        JsonObject json = node(node, "FunctionDeclaration");
        json.addProperty("name", node.name());
        JsonArray parameters = new JsonArray();
        for (Parameter parameter : node.parameters()) {
            JsonObject p = new JsonObject();
            p.addProperty("name", parameter.name());
            p.addProperty("type", parameter.type().displayName());
            parameters.add(p);
        }
        json.add("parameters", parameters);
        json.addProperty("returns", node.returnType().displayName());
        json.add("body", statements(node.body()));
        return json;
    }

    @Override
    public JsonObject visitReturn(Return node) {
        JsonObject json = node(node, "Return");
        json.add("expression", node.expression().accept(this));
        return json;
    }

    // endregion

    // region Expressions

    @Override
    public JsonObject visitIntegerLiteral(IntegerLiteral node) {
        JsonObject json = node(node, "IntegerLiteral");
        json.addProperty("value", node.value());
        return json;
    }

    @Override
    public JsonObject visitFloatLiteral(FloatLiteral node) {
        JsonObject json = node(node, "FloatLiteral");
        json.addProperty("value", node.value());
        return json;
    }

    @Override
    public JsonObject visitBooleanLiteral(BooleanLiteral node) {
        JsonObject json = node(node, "BooleanLiteral");
        json.addProperty("value", node.value());
        return json;
    }

    @Override
    public JsonObject visitVariable(Variable node) {
        JsonObject json = node(node, "Variable");
        json.addProperty("name", node.name());
        return json;
    }

    @Override
    public JsonObject visitUnaryExpression(UnaryExpression node) {
        JsonObject json = node(node, "UnaryExpression");
        json.addProperty("operator", node.operator().symbol());
        json.add("operand", node.operand().accept(this));
        return json;
    }

    @Override
    public JsonObject visitBinaryExpression(BinaryExpression node) {
        JsonObject json = node(node, "BinaryExpression");
        json.addProperty("operator", node.operator().symbol());
        json.add("left", node.left().accept(this));
        json.add("right", node.right().accept(this));
        return json;
    }

    @Override
    public JsonObject visitFunctionCall(FunctionCall node) {
        JsonObject json = node(node, "FunctionCall");
        json.addProperty("name", node.name());
        json.add("arguments", expressions(node.arguments()));
        return json;
    }

    @Override
    public JsonObject visitListLiteral(ListLiteral node) {
        JsonObject json = node(node, "ListLiteral");
        json.add("elements", expressions(node.elements()));
        return json;
    }

    @Override
    public JsonObject visitListAccess(ListAccess node) {
        JsonObject json = node(node, "ListAccess");
        json.add("list", node.list().accept(this));
        json.add("index", node.index().accept(this));
        return json;
    }

    @Override
    public JsonObject visitRepeatCall(RepeatCall node) {
        JsonObject json = node(node, "RepeatCall");
        json.add("value", node.value().accept(this));
        json.add("count", node.count().accept(this));
        return json;
    }

    @Override
    public JsonObject visitLenCall(LenCall node) {
        JsonObject json = node(node, "LenCall");
        json.add("list", node.list().accept(this));
        return json;
    }

    // endregion
}
