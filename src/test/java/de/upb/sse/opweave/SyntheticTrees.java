package de.upb.sse.opweave;

import de.upb.sse.opweave.model.BasicTypeDescriptor;
import de.upb.sse.opweave.model.NodeShape;
import de.upb.sse.opweave.model.SourceSpan;
import de.upb.sse.opweave.model.TreeNode;
import de.upb.sse.opweave.model.TypeDescriptor;

/**
 * Builds {@link TreeNode} trees over a source buffer for tests that do not go
 * through the JavaParser front end.
 */
public class SyntheticTrees {
    public static final BasicTypeDescriptor INT = BasicTypeDescriptor.primitive("int");
    public static final BasicTypeDescriptor LONG = BasicTypeDescriptor.primitive("long");
    public static final BasicTypeDescriptor DOUBLE = BasicTypeDescriptor.primitive("double");
    public static final BasicTypeDescriptor BOOLEAN = BasicTypeDescriptor.primitive("boolean");
    public static final BasicTypeDescriptor INT_ARRAY = BasicTypeDescriptor.arrayOf(INT);
    public static final BasicTypeDescriptor STRING = BasicTypeDescriptor.reference("java.lang.String");
    public static final BasicTypeDescriptor T = BasicTypeDescriptor.typeVariable("T");
    public static final BasicTypeDescriptor T_ARRAY = BasicTypeDescriptor.arrayOf(T);

    private final String buffer;

    public SyntheticTrees(String buffer) {
        this.buffer = buffer;
    }

    public String getBuffer() {
        return buffer;
    }

    /** Leaf covering the first occurrence of {@code text} at or after {@code from}. */
    public TreeNode name(String text, int from, TypeDescriptor type) {
        int start = buffer.indexOf(text, from);
        if (start < 0) throw new IllegalArgumentException("'" + text + "' not in buffer after " + from);
        return new TreeNode(NodeShape.OTHER).withSpan(start, start + text.length()).withType(type);
    }

    public TreeNode name(String text, TypeDescriptor type) {
        return name(text, 0, type);
    }

    public TreeNode literal(String text, int from, TypeDescriptor type) {
        int start = buffer.indexOf(text, from);
        return new TreeNode(NodeShape.LITERAL).withSpan(start, start + text.length()).withType(type);
    }

    /** {@code base[index]}; the span ends after the closing bracket. */
    public TreeNode index(TreeNode base, TreeNode index, TypeDescriptor type) {
        int end = buffer.indexOf(']', spanOf(index).getEnd()) + 1;
        return new TreeNode(NodeShape.INDEX_ACCESS).withOperator("[]")
                .withSpan(spanOf(base).getStart(), end)
                .withType(type)
                .addOperand(base)
                .addOperand(index);
    }

    public TreeNode binary(String operator, TreeNode left, TreeNode right, TypeDescriptor type) {
        return new TreeNode(NodeShape.BINARY_OPERATOR).withOperator(operator)
                .withSpan(spanOf(left).getStart(), spanOf(right).getEnd())
                .withType(type)
                .addOperand(left)
                .addOperand(right);
    }

    /** Prefix operator directly in front of its operand. */
    public TreeNode unary(String operator, TreeNode operand, TypeDescriptor type) {
        return new TreeNode(NodeShape.UNARY_OPERATOR).withOperator(operator)
                .withSpan(spanOf(operand).getStart() - operator.length(), spanOf(operand).getEnd())
                .withType(type)
                .addOperand(operand);
    }

    /** A construct of the given shape whose span starts {@code prefix} characters before the child. */
    public TreeNode wrap(NodeShape shape, String operator, TreeNode child, int prefix, int suffix) {
        SourceSpan span = spanOf(child);
        return new TreeNode(shape).withOperator(operator)
                .withSpan(span.getStart() - prefix, span.getEnd() + suffix)
                .addOperand(child);
    }

    public TreeNode grouping(TreeNode inner) {
        return wrap(NodeShape.GROUPING, null, inner, 1, 1);
    }

    public TreeNode root(TreeNode... children) {
        TreeNode root = new TreeNode(NodeShape.OTHER).withSpan(0, buffer.length());
        for (TreeNode child : children) {
            root.addChild(child);
        }
        return root;
    }

    private static SourceSpan spanOf(TreeNode node) {
        return node.getSpan().orElseThrow(() -> new IllegalArgumentException(node + " has no span"));
    }
}
