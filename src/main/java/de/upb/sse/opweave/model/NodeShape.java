package de.upb.sse.opweave.model;

/**
 * Structural shape of a {@link SyntaxNode}, as reported by the front end.
 */
public enum NodeShape {
    INDEX_ACCESS,
    BINARY_OPERATOR,
    UNARY_OPERATOR,
    /** Operator written in operator syntax but resolved to a call. */
    OPERATOR_CALL,
    ADDRESS_OF,
    /** A construct whose operand is never evaluated (size-of and friends). */
    UNEVALUATED_OPERAND,
    /** Prefix or postfix {@code ++}/{@code --}. */
    INCREMENT_DECREMENT,
    /** Parentheses. */
    GROUPING,
    LITERAL,
    OTHER
}
