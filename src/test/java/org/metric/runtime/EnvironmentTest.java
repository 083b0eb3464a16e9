package org.metric.runtime;

import org.metric.compiler.api.EvaluationException;
import org.metric.compiler.frontend.parser.ast.FunctionDeclaration;
import org.metric.compiler.frontend.parser.ast.IntegerLiteral;
import org.metric.compiler.frontend.parser.ast.Return;
import org.metric.compiler.types.ScalarType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class EnvironmentTest {

    /**
     * Verifies that binding returns a new environment and leaves the original untouched.
     */
    @Test
    @Tag("unit")
    void testBindingIsPersistent() {
        // Arrange
        Environment base = Environment.empty();

        // Act
        Environment withX = base.add("x", Value.of(1));
        Environment updated = withX.set("x", Value.of(2));

        // Assert
        assertThat(base.isBound("x")).isFalse();
        assertThat(withX.find("x")).contains(Value.of(1));
        assertThat(updated.find("x")).contains(Value.of(2));
    }

    @Test
    @Tag("unit")
    void testCostIsSharedAcrossDerivedEnvironments() {
        Environment base = Environment.empty();
        Environment derived = base.add("x", Value.of(1));
        Environment call = derived.childForCall();

        base.incrementCost();
        derived.incrementCost();
        call.incrementCost();

        assertThat(base.cost()).isEqualTo(3);
        assertThat(call.cost()).isEqualTo(3);
    }

    @Test
    @Tag("unit")
    void testCallEnvironmentKeepsFunctionsButNotVariables() {
        FunctionDeclaration f = new FunctionDeclaration("f", List.of(), ScalarType.INTEGER,
                List.of(new Return(new IntegerLiteral(1))));
        Environment caller = Environment.empty().add("x", Value.of(1)).addFunction(f);

        Environment call = caller.childForCall();

        assertThat(call.isBound("x")).isFalse();
        assertThat(call.function("f")).contains(f);
        assertThat(caller.hasFunction("g")).isFalse();
    }

    @Test
    @Tag("unit")
    void testSetListElementCopiesTheList() {
        Environment original = Environment.empty().add("xs", Value.of(Value.of(1), Value.of(2), Value.of(3)));

        Environment updated = original.setListElement("xs", 1, Value.of(99));

        assertThat(original.find("xs")).contains(Value.of(Value.of(1), Value.of(2), Value.of(3)));
        assertThat(updated.find("xs")).contains(Value.of(Value.of(1), Value.of(99), Value.of(3)));
    }

    @Test
    @Tag("unit")
    void testSetErrors() {
        Environment env = Environment.empty()
                .add("n", Value.of(1))
                .add("xs", Value.of(Value.of(1), Value.of(2)));

        assertThatThrownBy(() -> env.set("missing", Value.of(1)))
                .isInstanceOf(EvaluationException.class)
                .hasMessage("Cannot set undefined variable: missing");
        assertThatThrownBy(() -> env.setListElement("missing", 0, Value.of(1)))
                .hasMessage("Cannot set undefined variable: missing");
        assertThatThrownBy(() -> env.setListElement("n", 0, Value.of(1)))
                .hasMessage("Variable 'n' is not a list");
        assertThatThrownBy(() -> env.setListElement("xs", -1, Value.of(1)))
                .hasMessage("List index -1 out of bounds (list length: 2)");
        assertThatThrownBy(() -> env.setListElement("xs", 0, Value.of(Value.of(1))))
                .hasMessage("Cannot assign list to list element");
    }
}
