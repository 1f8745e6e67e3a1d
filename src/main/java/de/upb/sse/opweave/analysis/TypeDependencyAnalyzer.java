package de.upb.sse.opweave.analysis;

import de.upb.sse.opweave.model.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides between the concrete and the deferred instrumentation form and gates
 * candidates whose operand types make a wrapping call unsafe.
 */
public class TypeDependencyAnalyzer {
    private static final Map<String, Set<String>> WIDENS_TO = Map.of(
            "byte", Set.of("byte", "short", "int", "long", "float", "double"),
            "short", Set.of("short", "int", "long", "float", "double"),
            "char", Set.of("char", "int", "long", "float", "double"),
            "int", Set.of("int", "long", "float", "double"),
            "long", Set.of("long", "float", "double"),
            "float", Set.of("float", "double"),
            "double", Set.of("double"),
            "boolean", Set.of("boolean"));

    private static final Set<String> COMPOUND_ELEMENT_TYPES = Set.of("int", "long", "float", "double");

    public TypeAnalysis analyze(CandidateExpression candidate) {
        List<TypeDescriptor> types = new ArrayList<>();
        for (SyntaxNode operand : candidate.getOperands()) {
            TypeDescriptor type = operand.getType();
            if (type != null && type.isVolatileQualified()) {
                return TypeAnalysis.rejected(RejectionReason.VOLATILE_OPERAND);
            }
            if (type == null || !type.isComplete()) {
                return TypeAnalysis.rejected(RejectionReason.INCOMPLETE_TYPE);
            }
            types.add(type);
        }
        boolean dependent = candidate.isDependentType() || types.stream().anyMatch(TypeDescriptor::isDependent);

        switch (candidate.getCategory()) {
            case INDEX_ACCESS:
                return analyzeIndexAccess(candidate, types, dependent);
            case ASSIGNMENT:
                if (!candidate.isElementAssignment()) {
                    return TypeAnalysis.rejected(RejectionReason.UNADDRESSABLE_TARGET);
                }
                return analyzeElementAssignment(candidate, types, dependent);
            default:
                return analyzeOperator(candidate, types, dependent);
        }
    }

    private TypeAnalysis analyzeIndexAccess(CandidateExpression candidate, List<TypeDescriptor> types,
                                            boolean dependent) {
        TypeDescriptor base = types.get(0);
        TypeDescriptor resultType = resolvedResultType(candidate);
        if (dependent) {
            return TypeAnalysis.of(DependencyClassification.deferred(List.of(elementExpression(base)), resultType));
        }
        Optional<RejectionReason> baseProblem = checkConcreteBase(base);
        if (baseProblem.isPresent()) return TypeAnalysis.rejected(baseProblem.get());
        return TypeAnalysis.of(DependencyClassification.concrete(List.of(base.getLiteralName()), resultType));
    }

    private TypeAnalysis analyzeElementAssignment(CandidateExpression candidate, List<TypeDescriptor> types,
                                                  boolean dependent) {
        TypeDescriptor base = types.get(0);
        TypeDescriptor value = types.get(2);
        if (base.isConstQualified()) {
            return TypeAnalysis.rejected(RejectionReason.CONST_TARGET);
        }
        TypeDescriptor resultType = resolvedResultType(candidate);
        if (dependent) {
            return TypeAnalysis.of(DependencyClassification.deferred(List.of(elementExpression(base)), resultType));
        }
        Optional<RejectionReason> baseProblem = checkConcreteBase(base);
        if (baseProblem.isPresent()) return TypeAnalysis.rejected(baseProblem.get());

        TypeDescriptor element = base.getComponentType().orElse(null);
        if (element == null) return TypeAnalysis.rejected(RejectionReason.NON_ARRAY_BASE);

        if ("=".equals(candidate.getOperator())) {
            if (element.isPrimitive() && !widens(value, element.getName())) {
                return TypeAnalysis.rejected(RejectionReason.NARROWING_ASSIGNMENT);
            }
            if (!element.isPrimitive() && !boxesTo(value, element)) {
                return TypeAnalysis.rejected(RejectionReason.NARROWING_ASSIGNMENT);
            }
        } else {
            if (!element.isPrimitive()) {
                return TypeAnalysis.rejected(RejectionReason.NON_ARITHMETIC_OPERAND);
            }
            // compound operators narrow implicitly; only the widening cases have an entry point
            if (!COMPOUND_ELEMENT_TYPES.contains(element.getName()) || !widens(value, element.getName())) {
                return TypeAnalysis.rejected(RejectionReason.NARROWING_ASSIGNMENT);
            }
        }
        return TypeAnalysis.of(DependencyClassification.concrete(List.of(base.getLiteralName()), resultType));
    }

    private TypeAnalysis analyzeOperator(CandidateExpression candidate, List<TypeDescriptor> types,
                                         boolean dependent) {
        for (TypeDescriptor type : types) {
            if (!type.isDependent() && type.hasUserArithmeticOverload()) {
                return TypeAnalysis.rejected(RejectionReason.USER_OVERLOAD);
            }
        }
        TypeDescriptor resultType = resolvedResultType(candidate);
        if (!dependent) {
            for (TypeDescriptor type : types) {
                if (!type.isArithmetic()) return TypeAnalysis.rejected(RejectionReason.NON_ARITHMETIC_OPERAND);
            }
            List<String> names = new ArrayList<>();
            types.forEach(t -> names.add(t.getLiteralName()));
            return TypeAnalysis.of(DependencyClassification.concrete(names, resultType));
        }

        boolean anyPrimitive = false;
        for (TypeDescriptor type : types) {
            if (type.isDependent()) continue;
            if (!type.isArithmetic() && !isBoxedNumeric(type)) {
                return TypeAnalysis.rejected(RejectionReason.NON_ARITHMETIC_OPERAND);
            }
            anyPrimitive |= type.isArithmetic();
        }
        // with both sides boxed at the call, == could no longer tell identity from value comparison
        if (isEquality(candidate.getOperator()) && !anyPrimitive) {
            return TypeAnalysis.rejected(RejectionReason.NON_ARITHMETIC_OPERAND);
        }
        List<String> expressions = new ArrayList<>();
        types.forEach(t -> expressions.add(t.getTypeExpression()));
        return TypeAnalysis.of(DependencyClassification.deferred(expressions, resultType));
    }

    private static Optional<RejectionReason> checkConcreteBase(TypeDescriptor base) {
        if (base.hasUserIndexOverload()) return Optional.of(RejectionReason.USER_OVERLOAD);
        if (!base.isPointerLike()) return Optional.of(RejectionReason.NON_ARRAY_BASE);
        return Optional.empty();
    }

    private static String elementExpression(TypeDescriptor base) {
        return base.getComponentType()
                .map(TypeDescriptor::getTypeExpression)
                .orElse(base.getTypeExpression());
    }

    private static TypeDescriptor resolvedResultType(CandidateExpression candidate) {
        TypeDescriptor type = candidate.getNode().getType();
        if (type == null || !type.isComplete() || type.isDependent()) return null;
        return type;
    }

    /** Whether a value of {@code value}'s type converts to primitive {@code target} in an invocation context. */
    static boolean widens(TypeDescriptor value, String target) {
        String source = value.isPrimitive()
                ? value.getName()
                : BasicTypeDescriptor.unboxedName(value.getLiteralName()).orElse(null);
        if (source == null) return false;
        Set<String> targets = WIDENS_TO.get(source);
        return targets != null && targets.contains(target);
    }

    /**
     * For an element of box type the stored value must already be that box or its
     * primitive. A narrowed constant such as {@code 5} into {@code Short[]} would be
     * boxed as {@code Integer} once it passes through a generic parameter.
     */
    static boolean boxesTo(TypeDescriptor value, TypeDescriptor element) {
        Optional<String> unboxed = BasicTypeDescriptor.unboxedName(element.getLiteralName());
        if (unboxed.isEmpty() || "null".equals(value.getName())) return true;
        if (value.isPrimitive()) return unboxed.get().equals(value.getName());
        return element.getLiteralName().equals(value.getLiteralName());
    }

    private static boolean isBoxedNumeric(TypeDescriptor type) {
        return BasicTypeDescriptor.unboxedName(type.getLiteralName())
                .filter(p -> !"boolean".equals(p))
                .isPresent();
    }

    private static boolean isEquality(String op) {
        return "==".equals(op) || "!=".equals(op);
    }
}
