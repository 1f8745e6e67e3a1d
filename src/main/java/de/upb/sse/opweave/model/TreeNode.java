package de.upb.sse.opweave.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Mutable {@link SyntaxNode} used by front ends to assemble a tree. Once handed to
 * the pipeline it is only read.
 */
public class TreeNode implements SyntaxNode {
    @Getter private final NodeShape shape;
    @Getter private String operator;
    @Getter private TypeDescriptor type;
    @Getter private boolean inSystemOrigin;
    @Getter private boolean operatorOverloadCall;
    @Getter private boolean inConstantContext;

    private SourceSpan span;
    private TreeNode parent;
    private final List<SyntaxNode> operands = new ArrayList<>();
    private final List<SyntaxNode> children = new ArrayList<>();

    public TreeNode(NodeShape shape) {
        this.shape = shape;
    }

    public static TreeNode of(NodeShape shape, String operator, int start, int end) {
        return new TreeNode(shape).withOperator(operator).withSpan(start, end);
    }

    public TreeNode withOperator(String operator) {
        this.operator = operator;
        return this;
    }

    public TreeNode withSpan(SourceSpan span) {
        this.span = span;
        return this;
    }

    public TreeNode withSpan(int start, int end) {
        return withSpan(new SourceSpan(start, end));
    }

    public TreeNode withType(TypeDescriptor type) {
        this.type = type;
        return this;
    }

    public TreeNode markSystemOrigin() {
        this.inSystemOrigin = true;
        return this;
    }

    public TreeNode markOperatorOverloadCall() {
        this.operatorOverloadCall = true;
        return this;
    }

    public TreeNode markConstantContext() {
        this.inConstantContext = true;
        return this;
    }

    /** Appends {@code child} as the next operand, which also makes it a child. */
    public TreeNode addOperand(TreeNode child) {
        operands.add(child);
        return addChild(child);
    }

    public TreeNode addChild(TreeNode child) {
        if (child.parent != null && child.parent != this) {
            throw new IllegalArgumentException("node already has a parent");
        }
        child.parent = this;
        children.add(child);
        return this;
    }

    @Override
    public Optional<SourceSpan> getSpan() {
        return Optional.ofNullable(span);
    }

    @Override
    public List<SyntaxNode> getOperands() {
        return Collections.unmodifiableList(operands);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public Optional<SyntaxNode> getParent() {
        return Optional.ofNullable(parent);
    }

    @Override
    public String toString() {
        return shape + (operator != null ? " '" + operator + "'" : "") + (span != null ? " " + span : "");
    }
}
