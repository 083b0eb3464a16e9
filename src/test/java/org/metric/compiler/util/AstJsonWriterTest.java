package org.metric.compiler.util;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.metric.compiler.frontend.lexer.Lexer;
import org.metric.compiler.frontend.parser.ParseResult;
import org.metric.compiler.frontend.parser.Parser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class AstJsonWriterTest {

    private static ParseResult parse(String source) {
        return Parser.parse(Lexer.tokenize(source));
    }

    @Test
    @Tag("unit")
    void testStatementsCarryKindAndPosition() {
        // Act
        JsonObject root = AstJsonWriter.toJsonTree(parse("let x integer = 1\nprint x * 2"));

        // Assert
        assertThat(root.get("node").getAsString()).isEqualTo("Program");
        JsonArray statements = root.getAsJsonArray("statements");
        assertThat(statements).hasSize(2);

        JsonObject let = statements.get(0).getAsJsonObject();
        assertThat(let.get("node").getAsString()).isEqualTo("Let");
        assertThat(let.get("name").getAsString()).isEqualTo("x");
        assertThat(let.get("type").getAsString()).isEqualTo("integer");
        assertThat(let.get("line").getAsInt()).isEqualTo(1);
        assertThat(let.get("column").getAsInt()).isEqualTo(1);

        JsonObject product = statements.get(1).getAsJsonObject().getAsJsonObject("expression");
        assertThat(product.get("node").getAsString()).isEqualTo("BinaryExpression");
        assertThat(product.get("operator").getAsString()).isEqualTo("*");
        assertThat(product.getAsJsonObject("right").get("value").getAsLong()).isEqualTo(2);
    }

    @Test
    @Tag("unit")
    void testFunctionDeclaration() {
        JsonObject root = AstJsonWriter.toJsonTree(parse(
                "def twice(n integer) returns integer\n    return n * 2"));

        JsonObject function = root.getAsJsonArray("statements").get(0).getAsJsonObject();
        assertThat(function.get("node").getAsString()).isEqualTo("FunctionDeclaration");
        assertThat(function.get("returns").getAsString()).isEqualTo("integer");
        assertThat(function.getAsJsonArray("parameters").get(0).getAsJsonObject().get("name").getAsString())
                .isEqualTo("n");
        assertThat(function.getAsJsonArray("body").get(0).getAsJsonObject().get("node").getAsString())
                .isEqualTo("Return");
    }

    @Test
    @Tag("unit")
    void testPrettyPrintedOutputIsValidJson() {
        String json = AstJsonWriter.toJson(parse("print [1, 2]"));

        JsonObject reparsed = JsonParser.parseString(json).getAsJsonObject();
        assertThat(json).contains("\n");
        assertThat(reparsed).isEqualTo(AstJsonWriter.toJsonTree(parse("print [1, 2]")));
    }
}
