package org.metric.runtime;

import org.metric.compiler.api.EvaluationException;
import org.metric.compiler.frontend.parser.ast.BinaryOperator;
import org.metric.runtime.Value.BooleanValue;
import org.metric.runtime.Value.FloatValue;
import org.metric.runtime.Value.IntegerValue;
import org.metric.runtime.Value.ListValue;

import java.util.List;
import java.util.function.Function;

/**
 * The arithmetic, ordering and equality operators on runtime values.
 * <p>
 * Integer operands stay integers: division floors and modulus takes the sign of the divisor.
 * As soon as one operand is a float the operation is carried out in floating point.
 */
final class Operations {

    private Operations() {}

    /**
     * Applies a non-logical binary operator.
     * @param operator The operator; {@code and} and {@code or} are handled by the evaluator.
     * @param left The left operand.
     * @param right The right operand.
     * @param errors Creates the exception for a runtime violation from its message.
     * @return The result.
     */
    static Value apply(BinaryOperator operator, Value left, Value right, Function<String, EvaluationException> errors) {
        switch (operator) {
            case EQUAL_EQUAL:
                return BooleanValue.of(valuesEqual(left, right));
            case NOT_EQUAL:
                return BooleanValue.of(!valuesEqual(left, right));
            default:
                break;
        }

        requireNumber(left, errors);
        requireNumber(right, errors);

        if (left instanceof IntegerValue l && right instanceof IntegerValue r) {
            return applyIntegers(operator, l.value(), r.value(), errors);
        }
        return applyFloats(operator, asDouble(left), asDouble(right), errors);
    }

    private static Value applyIntegers(BinaryOperator operator, long l, long r, Function<String, EvaluationException> errors) {
        try {
            switch (operator) {
                case ADDITION: return new IntegerValue(Math.addExact(l, r));
                case SUBTRACTION: return new IntegerValue(Math.subtractExact(l, r));
                case MULTIPLICATION: return new IntegerValue(Math.multiplyExact(l, r));
                case DIVISION:
                    if (r == 0) throw errors.apply("Division by zero");
                    // floorDiv wraps on this single pair instead of throwing.
                    if (l == Long.MIN_VALUE && r == -1) throw new ArithmeticException("long overflow");
                    return new IntegerValue(Math.floorDiv(l, r));
                case MODULUS:
                    if (r == 0) throw errors.apply("Modulus by zero");
                    return new IntegerValue(Math.floorMod(l, r));
                case LESS_THAN: return BooleanValue.of(l < r);
                case GREATER_THAN: return BooleanValue.of(l > r);
                case LESS_THAN_OR_EQUAL: return BooleanValue.of(l <= r);
                case GREATER_THAN_OR_EQUAL: return BooleanValue.of(l >= r);
                default:
                    throw errors.apply("Unknown binary operator: " + operator.symbol());
            }
        } catch (ArithmeticException e) {
            throw errors.apply("Integer overflow in " + l + " " + operator.symbol() + " " + r);
        }
    }

    private static Value applyFloats(BinaryOperator operator, double l, double r, Function<String, EvaluationException> errors) {
        switch (operator) {
            case ADDITION: return new FloatValue(l + r);
            case SUBTRACTION: return new FloatValue(l - r);
            case MULTIPLICATION: return new FloatValue(l * r);
            case DIVISION:
                if (r == 0.0) throw errors.apply("Division by zero");
                return new FloatValue(l / r);
            case MODULUS:
                if (r == 0.0) throw errors.apply("Modulus by zero");
                return new FloatValue(floorModulus(l, r));
            case LESS_THAN: return BooleanValue.of(l < r);
            case GREATER_THAN: return BooleanValue.of(l > r);
            case LESS_THAN_OR_EQUAL: return BooleanValue.of(l <= r);
            case GREATER_THAN_OR_EQUAL: return BooleanValue.of(l >= r);
            default:
                throw errors.apply("Unknown binary operator: " + operator.symbol());
        }
    }

    /**
     * Float remainder with the sign of the divisor.
     */
    static double floorModulus(double l, double r) {
        double remainder = l % r;
        if (remainder != 0.0 && (remainder < 0) != (r < 0)) {
            remainder += r;
        }
        return remainder;
    }

    /**
     * Structural equality; integers and floats compare by numeric value.
     */
    static boolean valuesEqual(Value left, Value right) {
        if (isNumber(left) && isNumber(right)) {
            if (left instanceof IntegerValue l && right instanceof IntegerValue r) {
                return l.value() == r.value();
            }
            return asDouble(left) == asDouble(right);
        }
        if (left instanceof ListValue l && right instanceof ListValue r) {
            List<Value> a = l.elements();
            List<Value> b = r.elements();
            if (a.size() != b.size()) return false;
            for (int i = 0; i < a.size(); i++) {
                if (!valuesEqual(a.get(i), b.get(i))) return false;
            }
            return true;
        }
        return left.equals(right);
    }

    private static void requireNumber(Value value, Function<String, EvaluationException> errors) {
        if (!isNumber(value)) {
            throw errors.apply("Expected number, got " + value.typeName());
        }
    }

    private static boolean isNumber(Value value) {
        return value instanceof IntegerValue || value instanceof FloatValue;
    }

    private static double asDouble(Value value) {
        if (value instanceof IntegerValue i) return i.value();
        return ((FloatValue) value).value();
    }
}
