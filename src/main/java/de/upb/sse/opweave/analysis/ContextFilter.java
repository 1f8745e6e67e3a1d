package de.upb.sse.opweave.analysis;

import de.upb.sse.opweave.configuration.OpWeaveConfiguration;
import de.upb.sse.opweave.model.*;

import java.util.Optional;

/**
 * Rejects candidates whose position makes a wrapping call change the program's meaning.
 * <p>
 * Only the nearest enclosing construct is inspected. Parentheses are looked
 * through, so {@code &(a[i])} is treated like {@code &a[i]}.
 * <p>
 * A call that dispatches to a user-written operator implementation is skipped whatever
 * its category. Wrapping it would bypass the user's operator, so enabling a category
 * instruments only the built-in operator of that category.
 */
public class ContextFilter {
    private final OpWeaveConfiguration config;

    public ContextFilter(OpWeaveConfiguration config) {
        this.config = config;
    }

    public FilterDecision check(CandidateExpression candidate) {
        return check(candidate, candidate.getNode().getParent().orElse(null));
    }

    public FilterDecision check(CandidateExpression candidate, SyntaxNode parent) {
        SyntaxNode node = candidate.getNode();

        if (candidate.isInSystemOrigin() && config.isSkipSystemOrigin()) {
            return FilterDecision.reject(RejectionReason.SYSTEM_ORIGIN);
        }
        if (node.isInConstantContext()) {
            return FilterDecision.reject(RejectionReason.CONSTANT_CONTEXT);
        }
        if (candidate.getKind() == CandidateKind.OVERLOADED_OPERATOR_CALL && candidate.isOverloaded()) {
            return FilterDecision.reject(RejectionReason.USER_OVERLOAD);
        }
        if (candidate.getCategory() == OperatorCategory.ASSIGNMENT && !candidate.isElementAssignment()) {
            return FilterDecision.reject(RejectionReason.UNADDRESSABLE_TARGET);
        }
        if (parent == null) {
            return FilterDecision.pass();
        }

        SyntaxNode child = node;
        SyntaxNode enclosing = parent;
        while (enclosing.getShape() == NodeShape.GROUPING) {
            Optional<SyntaxNode> next = enclosing.getParent();
            if (next.isEmpty()) return FilterDecision.pass();
            child = enclosing;
            enclosing = next.get();
        }

        switch (enclosing.getShape()) {
            case ADDRESS_OF:
                return FilterDecision.reject(RejectionReason.ADDRESS_OF_OPERAND);
            case UNEVALUATED_OPERAND:
                return FilterDecision.reject(RejectionReason.UNEVALUATED_OPERAND);
            case INCREMENT_DECREMENT:
                return FilterDecision.reject(RejectionReason.LVALUE_POSITION);
            case BINARY_OPERATOR:
            case OPERATOR_CALL:
                if (isAssignmentTarget(enclosing, child)) {
                    return FilterDecision.reject(RejectionReason.LVALUE_POSITION);
                }
                return FilterDecision.pass();
            default:
                return FilterDecision.pass();
        }
    }

    private static boolean isAssignmentTarget(SyntaxNode assignment, SyntaxNode child) {
        String op = assignment.getOperator();
        if (op == null || !ExpressionClassifier.ASSIGNMENT_OPERATORS.contains(op)) return false;
        return !assignment.getOperands().isEmpty() && assignment.getOperands().get(0) == child;
    }
}
