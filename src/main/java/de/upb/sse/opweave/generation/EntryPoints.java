package de.upb.sse.opweave.generation;

import java.util.Map;

/**
 * Names of the runtime methods generated code calls. A deferred entry point is
 * the concrete name with a {@code maybe} prefix, e.g. {@code add -> maybeAdd}.
 */
public final class EntryPoints {
    public static final String SUBSCRIPT = "subscript";
    public static final String ASSIGN = "assign";

    private static final Map<String, String> BINARY = Map.ofEntries(
            Map.entry("+", "add"),
            Map.entry("-", "sub"),
            Map.entry("*", "mul"),
            Map.entry("/", "div"),
            Map.entry("%", "rem"),
            Map.entry("==", "eq"),
            Map.entry("!=", "ne"),
            Map.entry("<", "lt"),
            Map.entry(">", "gt"),
            Map.entry("<=", "le"),
            Map.entry(">=", "ge"));

    private static final Map<String, String> UNARY = Map.of(
            "-", "neg",
            "+", "pos",
            "~", "not");

    private EntryPoints() {
    }

    public static String binary(String operator) {
        String name = operator == null ? null : BINARY.get(operator);
        if (name == null) throw new IllegalArgumentException("no entry point for binary operator " + operator);
        return name;
    }

    public static String unary(String operator) {
        String name = operator == null ? null : UNARY.get(operator);
        if (name == null) throw new IllegalArgumentException("no entry point for unary operator " + operator);
        return name;
    }

    /** {@code "=" -> assign}, {@code "+=" -> addAssign}, ... */
    public static String elementAssignment(String operator) {
        if ("=".equals(operator)) return ASSIGN;
        if (operator == null || operator.length() < 2 || !operator.endsWith("=")) {
            throw new IllegalArgumentException("no entry point for assignment operator " + operator);
        }
        return binary(operator.substring(0, operator.length() - 1)) + "Assign";
    }

    public static String deferred(String concreteName) {
        return "maybe" + Character.toUpperCase(concreteName.charAt(0)) + concreteName.substring(1);
    }
}
