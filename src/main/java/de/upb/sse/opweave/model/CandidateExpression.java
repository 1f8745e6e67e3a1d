package de.upb.sse.opweave.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node that structurally matches one of the instrumentable operator shapes.
 * <p>
 * For an assignment into an array element the operands are flattened to
 * {@code [array, index, value]}; {@link #isElementAssignment()} is set.
 * An entry of {@link #getOperandSpans()} is {@code null} when the front end
 * did not attribute a span to that operand.
 */
@Getter
@ToString(exclude = {"node", "operands"})
public class CandidateExpression {
    private final SyntaxNode node;
    private final CandidateKind kind;
    private final OperatorCategory category;
    private final String operator;
    private final SourceSpan span;
    private final List<SyntaxNode> operands;
    private final List<SourceSpan> operandSpans;
    private final boolean overloaded;
    private final boolean dependentType;
    private final boolean inSystemOrigin;
    private final boolean elementAssignment;

    @Builder
    private CandidateExpression(SyntaxNode node, CandidateKind kind, OperatorCategory category, String operator,
                                SourceSpan span, List<SyntaxNode> operands, boolean overloaded,
                                boolean dependentType, boolean inSystemOrigin, boolean elementAssignment) {
        this.node = node;
        this.kind = kind;
        this.category = category;
        this.operator = operator;
        this.span = span;
        this.operands = operands == null ? List.of() : List.copyOf(operands);
        List<SourceSpan> spans = new ArrayList<>();
        for (SyntaxNode operand : this.operands) {
            spans.add(operand.getSpan().orElse(null));
        }
        this.operandSpans = Collections.unmodifiableList(spans);
        this.overloaded = overloaded;
        this.dependentType = dependentType;
        this.inSystemOrigin = inSystemOrigin;
        this.elementAssignment = elementAssignment;
    }

    public int operandCount() {
        return operands.size();
    }

    public SyntaxNode getOperand(int index) {
        return operands.get(index);
    }

    public boolean isUnary() {
        return operands.size() == 1;
    }
}
