package org.metric.runtime;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A runtime value of a Metric program. Scalars are integers, floats and booleans;
 * a list holds scalars only.
 */
public sealed interface Value permits Value.IntegerValue, Value.FloatValue, Value.BooleanValue, Value.ListValue {

    /**
     * @return The form {@code print} writes: booleans lower case, floats with a decimal point,
     *         lists as {@code [e0, e1, ...]}.
     */
    String render();

    /**
     * @return The runtime type name used in diagnostics.
     */
    String typeName();

    /**
     * A 64-bit signed integer.
     * @param value The value.
     */
    record IntegerValue(long value) implements Value {
        @Override
        public String render() {
            return Long.toString(value);
        }

        @Override
        public String typeName() {
            return "integer";
        }
    }

    /**
     * A 64-bit IEEE-754 float.
     * @param value The value.
     */
    record FloatValue(double value) implements Value {

        private static final int MIN_POSITIONAL_EXPONENT = -4;
        private static final int MAX_POSITIONAL_EXPONENT = 15;

        /**
         * Renders the shortest decimal form of the value. Decimal exponents from -4 to 15 are
         * written positionally with at least one fractional digit ({@code 10000000.0},
         * {@code 0.0001}); others use a signed, two-digit exponent ({@code 1e-05}, {@code 1.5e+16}).
         */
        @Override
        public String render() {
            if (Double.isNaN(value)) return "nan";
            if (Double.isInfinite(value)) return value > 0 ? "inf" : "-inf";
            if (value == 0.0) return Double.toString(value);

            BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
            int exponent = decimal.precision() - decimal.scale() - 1;
            if (exponent >= MIN_POSITIONAL_EXPONENT && exponent <= MAX_POSITIONAL_EXPONENT) {
                String plain = decimal.toPlainString();
                return plain.indexOf('.') < 0 ? plain + ".0" : plain;
            }

            String digits = decimal.unscaledValue().abs().toString();
            StringBuilder sb = new StringBuilder();
            if (decimal.signum() < 0) sb.append('-');
            sb.append(digits.charAt(0));
            if (digits.length() > 1) sb.append('.').append(digits, 1, digits.length());
            sb.append('e').append(exponent < 0 ? '-' : '+');
            String magnitude = Integer.toString(Math.abs(exponent));
            if (magnitude.length() < 2) sb.append('0');
            return sb.append(magnitude).toString();
        }

        @Override
        public String typeName() {
            return "float";
        }
    }

    /**
     * A boolean.
     * @param value The value.
     */
    record BooleanValue(boolean value) implements Value {

        public static final BooleanValue TRUE = new BooleanValue(true);
        public static final BooleanValue FALSE = new BooleanValue(false);

        public static BooleanValue of(boolean value) {
            return value ? TRUE : FALSE;
        }

        @Override
        public String render() {
            return value ? "true" : "false";
        }

        @Override
        public String typeName() {
            return "boolean";
        }
    }

    /**
     * An immutable list of scalar values.
     * @param elements The elements.
     */
    record ListValue(List<Value> elements) implements Value {

        public ListValue {
            elements = List.copyOf(elements);
        }

        public int size() {
            return elements.size();
        }

        @Override
        public String render() {
            return elements.stream().map(Value::render).collect(Collectors.joining(", ", "[", "]"));
        }

        @Override
        public String typeName() {
            return "list";
        }
    }

    static IntegerValue of(long value) {
        return new IntegerValue(value);
    }

    static FloatValue of(double value) {
        return new FloatValue(value);
    }

    static BooleanValue of(boolean value) {
        return BooleanValue.of(value);
    }

    static ListValue of(Value... elements) {
        return new ListValue(List.of(elements));
    }
}
