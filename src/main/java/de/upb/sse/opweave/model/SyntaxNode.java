package de.upb.sse.opweave.model;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of a node in an externally owned, fully typed syntax tree.
 * <p>
 * Implementations are supplied by a front end. Nothing in the rewriting pipeline
 * mutates a node or keeps it beyond the processing of its file.
 */
public interface SyntaxNode {

    NodeShape getShape();

    /** Operator symbol ({@code "+"}, {@code "+="}, {@code "[]"}, ...), or {@code null} when the node has none. */
    String getOperator();

    /** Span of the whole node; empty when the front end could not attribute one. */
    Optional<SourceSpan> getSpan();

    /** Operands in evaluation order. Empty for non-operator nodes. */
    List<SyntaxNode> getOperands();

    /** All syntactic children in source order, operands included. */
    List<SyntaxNode> getChildren();

    Optional<SyntaxNode> getParent();

    /** Type of the node's value, or {@code null} when the node has no value. */
    TypeDescriptor getType();

    boolean isInSystemOrigin();

    /** The operator syntax resolves to a user-supplied operator implementation. */
    boolean isOperatorOverloadCall();

    /** The node lies in a region that must stay a compile-time constant. */
    boolean isInConstantContext();
}
