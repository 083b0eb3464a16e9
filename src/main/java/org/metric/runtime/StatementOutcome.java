package org.metric.runtime;

/**
 * How execution continues after a statement: with the next statement in an updated
 * environment, or by leaving the enclosing function with a value.
 */
public sealed interface StatementOutcome permits StatementOutcome.Next, StatementOutcome.Returned {

    /**
     * Continue with the following statement.
     * @param environment The environment after the statement.
     */
    record Next(Environment environment) implements StatementOutcome {}

    /**
     * A {@code return} was executed.
     * @param value The returned value.
     */
    record Returned(Value value) implements StatementOutcome {}

    static StatementOutcome next(Environment environment) {
        return new Next(environment);
    }

    static StatementOutcome returned(Value value) {
        return new Returned(value);
    }
}
