package de.upb.sse.opweave.analysis;

import de.upb.sse.opweave.model.DependencyClassification;

import java.util.Optional;

/**
 * Outcome of {@link TypeDependencyAnalyzer#analyze}: a classification, or the
 * reason the operand types rule out instrumentation.
 */
public final class TypeAnalysis {
    private final DependencyClassification classification;
    private final RejectionReason rejection;

    private TypeAnalysis(DependencyClassification classification, RejectionReason rejection) {
        this.classification = classification;
        this.rejection = rejection;
    }

    public static TypeAnalysis of(DependencyClassification classification) {
        return new TypeAnalysis(classification, null);
    }

    public static TypeAnalysis rejected(RejectionReason reason) {
        return new TypeAnalysis(null, reason);
    }

    public boolean isAccepted() {
        return classification != null;
    }

    public DependencyClassification getClassification() {
        if (classification == null) {
            throw new IllegalStateException("rejected analysis has no classification: " + rejection);
        }
        return classification;
    }

    public Optional<RejectionReason> getRejection() {
        return Optional.ofNullable(rejection);
    }

    @Override
    public String toString() {
        return isAccepted() ? classification.toString() : "rejected(" + rejection + ")";
    }
}
