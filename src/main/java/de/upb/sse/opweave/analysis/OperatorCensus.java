package de.upb.sse.opweave.analysis;

import de.upb.sse.opweave.model.CandidateExpression;
import de.upb.sse.opweave.model.CandidateKind;
import de.upb.sse.opweave.model.SyntaxNode;
import de.upb.sse.opweave.model.TypeDescriptor;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Counts operator usages in a tree without rewriting anything. Used to size up a
 * code base before switching categories on.
 */
public class OperatorCensus {
    private final ExpressionClassifier classifier;

    public OperatorCensus() {
        this(new ExpressionClassifier());
    }

    public OperatorCensus(ExpressionClassifier classifier) {
        this.classifier = classifier;
    }

    public CensusReport survey(SyntaxNode root) {
        CensusReport report = new CensusReport();
        Deque<SyntaxNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            SyntaxNode node = pending.pop();
            node.getChildren().forEach(pending::push);

            Optional<CandidateExpression> candidate = classifier.classify(node);
            if (candidate.isEmpty()) continue;
            CandidateExpression c = candidate.get();
            report.incrementKind(c.getKind());
            if (c.isDependentType()) report.incrementDependentCandidates();
            if (c.isInSystemOrigin()) report.incrementSystemOriginCandidates();
            if (c.getKind() == CandidateKind.INDEX_ACCESS) {
                TypeDescriptor base = c.getOperand(0).getType();
                if (base != null && base.isPointerLike()) {
                    report.incrementArrayIndexAccesses();
                } else {
                    report.incrementNonArrayIndexAccesses();
                }
            }
        }
        return report;
    }
}
