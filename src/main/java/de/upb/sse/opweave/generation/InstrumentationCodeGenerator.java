package de.upb.sse.opweave.generation;

import de.upb.sse.opweave.configuration.OpWeaveConfiguration;
import de.upb.sse.opweave.model.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Produces the replacement expression for one candidate.
 * <p>
 * Operand text is copied verbatim from the original buffer, in evaluation order,
 * each operand exactly once. Concrete candidates call an entry point that receives
 * the resolved operand types as class literals:
 * <pre>
 *   R.subscript(int[].class, values, i)
 *   R.add(int.class, long.class, a, b)
 * </pre>
 * Deferred candidates call the dispatching entry point with the unresolved type
 * expressions as explicit type arguments:
 * <pre>
 *   R.&lt;T&gt;maybeSubscript(items, i)
 *   ((long) R.&lt;T, java.lang.Long&gt;maybeAdd(t, l))
 * </pre>
 */
public class InstrumentationCodeGenerator {
    private final String runtimeClass;

    public InstrumentationCodeGenerator(OpWeaveConfiguration config) {
        this(config.getRuntimeClass());
    }

    public InstrumentationCodeGenerator(String runtimeClass) {
        this.runtimeClass = runtimeClass;
    }

    public String generate(CandidateExpression candidate, DependencyClassification classification, String buffer)
            throws ExtractionException {
        List<String> operands = extractOperands(candidate, buffer);
        String entryPoint = entryPointFor(candidate);

        switch (classification.getKind()) {
            case CONCRETE:
                return concreteCall(entryPoint, ((DependencyClassification.Concrete) classification).getTypeNames(),
                        operands);
            case DEFERRED:
                return deferredCall(candidate, entryPoint, (DependencyClassification.Deferred) classification,
                        operands);
            default:
                throw new IllegalArgumentException("unknown classification " + classification);
        }
    }

    /**
     * Takes the text of every operand out of {@code buffer}. Fails without partial
     * result when a span is missing, outside the buffer or the candidate, out of
     * evaluation order, or blank.
     */
    public List<String> extractOperands(CandidateExpression candidate, String buffer) throws ExtractionException {
        SourceSpan whole = candidate.getSpan();
        if (whole == null) {
            throw new ExtractionException("candidate has no span");
        }
        if (!whole.fitsIn(buffer.length())) {
            throw new ExtractionException("candidate span " + whole + " exceeds buffer of length " + buffer.length());
        }

        List<String> texts = new ArrayList<>();
        int previousEnd = whole.getStart();
        List<SourceSpan> spans = candidate.getOperandSpans();
        for (int i = 0; i < spans.size(); i++) {
            SourceSpan span = spans.get(i);
            if (span == null) {
                throw new ExtractionException("operand " + i + " has no span");
            }
            if (!whole.contains(span)) {
                throw new ExtractionException("operand " + i + " span " + span + " lies outside candidate " + whole);
            }
            if (span.getStart() < previousEnd) {
                throw new ExtractionException("operand " + i + " span " + span + " overlaps or precedes operand "
                        + (i - 1));
            }
            String text = span.slice(buffer);
            if (text.isBlank()) {
                throw new ExtractionException("operand " + i + " text is blank");
            }
            texts.add(text);
            previousEnd = span.getEnd();
        }
        if (texts.isEmpty()) {
            throw new ExtractionException("candidate has no operands");
        }
        return texts;
    }

    private static String entryPointFor(CandidateExpression candidate) {
        switch (candidate.getCategory()) {
            case INDEX_ACCESS:
                return EntryPoints.SUBSCRIPT;
            case ASSIGNMENT:
                if (!candidate.isElementAssignment()) {
                    throw new IllegalArgumentException("only array element assignments have an entry point");
                }
                return EntryPoints.elementAssignment(candidate.getOperator());
            case UNARY:
                return EntryPoints.unary(candidate.getOperator());
            default:
                return EntryPoints.binary(candidate.getOperator());
        }
    }

    private String concreteCall(String entryPoint, List<String> typeNames, List<String> operands) {
        List<String> arguments = new ArrayList<>();
        for (String typeName : typeNames) {
            arguments.add(typeName + ".class");
        }
        arguments.addAll(operands);
        return runtimeClass + "." + entryPoint + "(" + String.join(", ", arguments) + ")";
    }

    private String deferredCall(CandidateExpression candidate, String entryPoint,
                                DependencyClassification.Deferred classification, List<String> operands) {
        String call = runtimeClass + ".<" + String.join(", ", classification.getTypeExpressions()) + ">"
                + EntryPoints.deferred(entryPoint) + "(" + String.join(", ", operands) + ")";

        OperatorCategory category = candidate.getCategory();
        if (category != OperatorCategory.ARITHMETIC && category != OperatorCategory.UNARY) {
            return call;
        }
        // the dispatcher returns Object; restore the static type the expression had
        Optional<TypeDescriptor> result = classification.getResultType();
        if (result.isEmpty()) return call;
        TypeDescriptor type = result.get();
        String castType = type.isPrimitive() ? type.getName() : type.getTypeExpression();
        return "((" + castType + ") " + call + ")";
    }
}
