package de.upb.sse.opweave.runtime;

import java.util.Objects;

/**
 * Built-in operator semantics over boxed values, used by the deferred entry points
 * when no user operator is registered. Operands go through binary numeric
 * promotion the way the compiler would have applied it to the unboxed values.
 */
final class BoxedArithmetic {

    private enum Promoted { INT, LONG, FLOAT, DOUBLE }

    private static final int UNORDERED = Integer.MIN_VALUE;

    private BoxedArithmetic() {
    }

    static Object apply(String operator, Object left, Object right) {
        if ("+".equals(operator) && (left instanceof String || right instanceof String)) {
            return String.valueOf(left) + right;
        }
        Number l = numeric(operator, left);
        Number r = numeric(operator, right);
        switch (promote(l, r)) {
            case INT:
                return applyInt(operator, l.intValue(), r.intValue());
            case LONG:
                return applyLong(operator, l.longValue(), r.longValue());
            case FLOAT:
                return applyFloat(operator, l.floatValue(), r.floatValue());
            default:
                return applyDouble(operator, l.doubleValue(), r.doubleValue());
        }
    }

    static boolean compare(String operator, Object left, Object right) {
        if ("==".equals(operator) || "!=".equals(operator)) {
            boolean equal = isNumeric(left) && isNumeric(right)
                    ? compareNumbers(numeric(operator, left), numeric(operator, right)) == 0
                    : left == right;
            return "==".equals(operator) == equal;
        }
        int order = compareNumbers(numeric(operator, left), numeric(operator, right));
        if (order == UNORDERED) return false;
        switch (operator) {
            case "<":
                return order < 0;
            case ">":
                return order > 0;
            case "<=":
                return order <= 0;
            case ">=":
                return order >= 0;
            default:
                throw new IllegalArgumentException("not a comparison operator: " + operator);
        }
    }

    static Object negate(Object operand) {
        Number n = numeric("-", operand);
        switch (promote(n, n)) {
            case INT:
                return -n.intValue();
            case LONG:
                return -n.longValue();
            case FLOAT:
                return -n.floatValue();
            default:
                return -n.doubleValue();
        }
    }

    static Object plus(Object operand) {
        Number n = numeric("+", operand);
        switch (promote(n, n)) {
            case INT:
                return n.intValue();
            case LONG:
                return n.longValue();
            case FLOAT:
                return n.floatValue();
            default:
                return n.doubleValue();
        }
    }

    static Object complement(Object operand) {
        Number n = numeric("~", operand);
        switch (promote(n, n)) {
            case INT:
                return ~n.intValue();
            case LONG:
                return ~n.longValue();
            default:
                throw new IllegalArgumentException("operator ~ not applicable to " + operand.getClass().getName());
        }
    }

    /**
     * Narrows or widens a numeric result to the element type it is stored into, as
     * the implicit cast of a compound assignment does. Non-numeric targets get the
     * value unchanged.
     */
    static Object convert(Object value, Class<?> target) {
        if (!isNumeric(value)) return value;
        Number n = value instanceof Character ? Integer.valueOf((Character) value) : (Number) value;
        if (target == int.class || target == Integer.class) return n.intValue();
        if (target == long.class || target == Long.class) return n.longValue();
        if (target == double.class || target == Double.class) return n.doubleValue();
        if (target == float.class || target == Float.class) return n.floatValue();
        if (target == short.class || target == Short.class) return n.shortValue();
        if (target == byte.class || target == Byte.class) return n.byteValue();
        if (target == char.class || target == Character.class) return (char) n.intValue();
        return value;
    }

    private static boolean isNumeric(Object value) {
        return value instanceof Number || value instanceof Character;
    }

    private static Number numeric(String operator, Object value) {
        Objects.requireNonNull(value, () -> "null operand of " + operator);
        if (value instanceof Character) return (int) (Character) value;
        if (value instanceof Number) return (Number) value;
        throw new IllegalArgumentException("operator " + operator + " not applicable to " + value.getClass().getName());
    }

    private static Promoted promote(Number left, Number right) {
        if (left instanceof Double || right instanceof Double) return Promoted.DOUBLE;
        if (left instanceof Float || right instanceof Float) return Promoted.FLOAT;
        if (left instanceof Long || right instanceof Long) return Promoted.LONG;
        return Promoted.INT;
    }

    private static int compareNumbers(Number left, Number right) {
        switch (promote(left, right)) {
            case INT:
                return Integer.compare(left.intValue(), right.intValue());
            case LONG:
                return Long.compare(left.longValue(), right.longValue());
            case FLOAT:
                return compareFloating(left.floatValue(), right.floatValue());
            default:
                return compareFloating(left.doubleValue(), right.doubleValue());
        }
    }

    // NaN is unordered: every comparison but != is false
    private static int compareFloating(double left, double right) {
        if (left < right) return -1;
        if (left > right) return 1;
        if (left == right) return 0;
        return UNORDERED;
    }

    private static Object applyInt(String operator, int l, int r) {
        switch (operator) {
            case "+": return l + r;
            case "-": return l - r;
            case "*": return l * r;
            case "/": return l / r;
            case "%": return l % r;
            default: throw unsupported(operator);
        }
    }

    private static Object applyLong(String operator, long l, long r) {
        switch (operator) {
            case "+": return l + r;
            case "-": return l - r;
            case "*": return l * r;
            case "/": return l / r;
            case "%": return l % r;
            default: throw unsupported(operator);
        }
    }

    private static Object applyFloat(String operator, float l, float r) {
        switch (operator) {
            case "+": return l + r;
            case "-": return l - r;
            case "*": return l * r;
            case "/": return l / r;
            case "%": return l % r;
            default: throw unsupported(operator);
        }
    }

    private static Object applyDouble(String operator, double l, double r) {
        switch (operator) {
            case "+": return l + r;
            case "-": return l - r;
            case "*": return l * r;
            case "/": return l / r;
            case "%": return l % r;
            default: throw unsupported(operator);
        }
    }

    private static IllegalArgumentException unsupported(String operator) {
        return new IllegalArgumentException("not an arithmetic operator: " + operator);
    }
}
