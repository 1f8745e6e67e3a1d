package de.upb.sse.opweave.analysis;

import de.upb.sse.opweave.model.*;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Matches tree nodes against the instrumentable operator shapes.
 * <p>
 * The match looks at the node alone (shape, operator symbol, flags and the
 * shape of its direct operands) and never at the surrounding code, so the
 * same node always yields the same result.
 */
public class ExpressionClassifier {
    public static final String INDEX_OPERATOR = "[]";
    public static final Set<String> ARITHMETIC_OPERATORS = Set.of("+", "-", "*", "/", "%");
    public static final Set<String> COMPARISON_OPERATORS = Set.of("==", "!=", "<", ">", "<=", ">=");
    public static final Set<String> ASSIGNMENT_OPERATORS = Set.of("=", "+=", "-=", "*=", "/=", "%=");
    public static final Set<String> UNARY_OPERATORS = Set.of("-", "+", "~");

    public Optional<CandidateExpression> classify(SyntaxNode node) {
        if (node == null) return Optional.empty();
        Optional<SourceSpan> span = node.getSpan();
        if (span.isEmpty()) return Optional.empty();

        List<SyntaxNode> operands = node.getOperands();
        String op = node.getOperator();
        switch (node.getShape()) {
            case INDEX_ACCESS:
                if (operands.size() != 2) return Optional.empty();
                return Optional.of(candidate(node, CandidateKind.INDEX_ACCESS, OperatorCategory.INDEX_ACCESS,
                        INDEX_OPERATOR, span.get(), operands, false));
            case BINARY_OPERATOR:
                return classifyBinary(node, op, span.get(), operands);
            case UNARY_OPERATOR:
                if (operands.size() != 1 || op == null || !UNARY_OPERATORS.contains(op)) return Optional.empty();
                // a signed literal is still a literal
                if (operands.get(0).getShape() == NodeShape.LITERAL) return Optional.empty();
                return Optional.of(candidate(node, CandidateKind.UNARY_ARITHMETIC, OperatorCategory.UNARY,
                        op, span.get(), operands, false));
            case OPERATOR_CALL:
                return categoryOfSymbol(op, operands.size())
                        .map(category -> candidate(node, CandidateKind.OVERLOADED_OPERATOR_CALL, category,
                                op, span.get(), operands, false));
            default:
                return Optional.empty();
        }
    }

    private Optional<CandidateExpression> classifyBinary(SyntaxNode node, String op, SourceSpan span,
                                                         List<SyntaxNode> operands) {
        if (operands.size() != 2 || op == null) return Optional.empty();
        if (ARITHMETIC_OPERATORS.contains(op)) {
            return Optional.of(candidate(node, CandidateKind.ARITHMETIC_BINARY, OperatorCategory.ARITHMETIC,
                    op, span, operands, false));
        }
        if (COMPARISON_OPERATORS.contains(op)) {
            return Optional.of(candidate(node, CandidateKind.COMPARISON_BINARY, OperatorCategory.COMPARISON,
                    op, span, operands, false));
        }
        if (ASSIGNMENT_OPERATORS.contains(op)) {
            SyntaxNode target = unwrapGrouping(operands.get(0));
            if (target.getShape() == NodeShape.INDEX_ACCESS && target.getOperands().size() == 2) {
                List<SyntaxNode> flattened = List.of(target.getOperands().get(0), target.getOperands().get(1),
                        operands.get(1));
                return Optional.of(candidate(node, CandidateKind.ASSIGNMENT_BINARY, OperatorCategory.ASSIGNMENT,
                        op, span, flattened, true));
            }
            return Optional.of(candidate(node, CandidateKind.ASSIGNMENT_BINARY, OperatorCategory.ASSIGNMENT,
                    op, span, operands, false));
        }
        // logical, bitwise, shift and type-test operators are never instrumented
        return Optional.empty();
    }

    private CandidateExpression candidate(SyntaxNode node, CandidateKind kind, OperatorCategory category,
                                          String operator, SourceSpan span, List<SyntaxNode> operands,
                                          boolean elementAssignment) {
        return CandidateExpression.builder()
                .node(node)
                .kind(kind)
                .category(category)
                .operator(operator)
                .span(span)
                .operands(operands)
                .overloaded(kind == CandidateKind.OVERLOADED_OPERATOR_CALL && node.isOperatorOverloadCall())
                .dependentType(isDependent(node, operands))
                .inSystemOrigin(node.isInSystemOrigin())
                .elementAssignment(elementAssignment)
                .build();
    }

    private static boolean isDependent(SyntaxNode node, List<SyntaxNode> operands) {
        if (node.getType() != null && node.getType().isDependent()) return true;
        for (SyntaxNode operand : operands) {
            TypeDescriptor type = operand.getType();
            if (type != null && type.isDependent()) return true;
        }
        return false;
    }

    /** Category an operator-call symbol stands for, if it is one this tool knows. */
    public static Optional<OperatorCategory> categoryOfSymbol(String op, int arity) {
        if (op == null) return Optional.empty();
        if (arity == 1) {
            return UNARY_OPERATORS.contains(op) ? Optional.of(OperatorCategory.UNARY) : Optional.empty();
        }
        if (arity != 2) return Optional.empty();
        if (INDEX_OPERATOR.equals(op)) return Optional.of(OperatorCategory.INDEX_ACCESS);
        if (ARITHMETIC_OPERATORS.contains(op)) return Optional.of(OperatorCategory.ARITHMETIC);
        if (COMPARISON_OPERATORS.contains(op)) return Optional.of(OperatorCategory.COMPARISON);
        if (ASSIGNMENT_OPERATORS.contains(op)) return Optional.of(OperatorCategory.ASSIGNMENT);
        return Optional.empty();
    }

    static SyntaxNode unwrapGrouping(SyntaxNode node) {
        SyntaxNode current = node;
        while (current.getShape() == NodeShape.GROUPING && current.getOperands().size() == 1) {
            current = current.getOperands().get(0);
        }
        return current;
    }
}
