package de.upb.sse.opweave.model;

import java.util.List;
import java.util.Optional;

/**
 * Whether the operand types of a candidate are fully resolved ({@link Concrete})
 * or still depend on a generic parameter ({@link Deferred}).
 */
public abstract class DependencyClassification {

    public enum Kind { CONCRETE, DEFERRED }

    private final List<String> typeNames;
    private final TypeDescriptor resultType;

    private DependencyClassification(List<String> typeNames, TypeDescriptor resultType) {
        this.typeNames = List.copyOf(typeNames);
        this.resultType = resultType;
    }

    public static Concrete concrete(List<String> literalNames, TypeDescriptor resultType) {
        return new Concrete(literalNames, resultType);
    }

    public static Deferred deferred(List<String> typeExpressions, TypeDescriptor resultType) {
        return new Deferred(typeExpressions, resultType);
    }

    public abstract Kind getKind();

    /** Type of the value the original expression produces, when it is known and resolved. */
    public Optional<TypeDescriptor> getResultType() {
        return Optional.ofNullable(resultType);
    }

    protected List<String> names() {
        return typeNames;
    }

    /** Resolved operand types, as names usable in class literals. */
    public static final class Concrete extends DependencyClassification {
        private Concrete(List<String> literalNames, TypeDescriptor resultType) {
            super(literalNames, resultType);
        }

        @Override
        public Kind getKind() {
            return Kind.CONCRETE;
        }

        public List<String> getTypeNames() {
            return names();
        }

        @Override
        public String toString() {
            return "Concrete" + names();
        }
    }

    /** Unresolved operand types, kept as type argument expressions. */
    public static final class Deferred extends DependencyClassification {
        private Deferred(List<String> typeExpressions, TypeDescriptor resultType) {
            super(typeExpressions, resultType);
        }

        @Override
        public Kind getKind() {
            return Kind.DEFERRED;
        }

        public List<String> getTypeExpressions() {
            return names();
        }

        @Override
        public String toString() {
            return "Deferred" + names();
        }
    }
}
