package de.upb.sse.opweave.frontend;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.nodeTypes.NodeWithTypeParameters;
import com.github.javaparser.resolution.types.ResolvedReferenceType;
import com.github.javaparser.resolution.types.ResolvedType;
import com.github.javaparser.resolution.types.ResolvedWildcard;
import de.upb.sse.opweave.model.BasicTypeDescriptor;
import de.upb.sse.opweave.model.TypeDescriptor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Describes JavaParser's resolved types as {@link TypeDescriptor}s.
 * <p>
 * A type that mentions a type variable of an enclosing declaration is dependent.
 * A type variable that is not in scope at the expression (one inferred for a
 * called generic method) cannot be named in generated code, so such a type is
 * reported as incomplete.
 */
public final class JavaTypeDescriptors {
    private static final Logger logger = Logger.getLogger(JavaTypeDescriptors.class.getName());

    private JavaTypeDescriptors() {
    }

    public static BasicTypeDescriptor describe(Expression expression) {
        ResolvedType resolved;
        try {
            resolved = expression.calculateResolvedType();
        } catch (RuntimeException e) {
            logger.fine(() -> "Could not resolve type of '" + expression + "': " + e.getMessage());
            return BasicTypeDescriptor.incomplete(expression.toString());
        }
        try {
            return describe(resolved, typeVariablesInScope(expression));
        } catch (RuntimeException e) {
            logger.fine(() -> "Could not describe type of '" + expression + "': " + e.getMessage());
            return BasicTypeDescriptor.incomplete(expression.toString());
        }
    }

    static BasicTypeDescriptor describe(ResolvedType type, Set<String> typeVariablesInScope) {
        if (type.isPrimitive()) {
            return BasicTypeDescriptor.primitive(type.asPrimitive().describe());
        }
        if (type.isArray()) {
            return BasicTypeDescriptor.arrayOf(describe(type.asArrayType().getComponentType(), typeVariablesInScope));
        }
        if (type.isTypeVariable()) {
            String name = type.asTypeParameter().getName();
            if (!typeVariablesInScope.contains(name)) {
                throw new IllegalStateException("type variable " + name + " is not in scope");
            }
            return BasicTypeDescriptor.typeVariable(name);
        }
        if (type.isReferenceType()) {
            return describeReference(type.asReferenceType(), typeVariablesInScope);
        }
        if (type.isWildcard()) {
            ResolvedWildcard wildcard = type.asWildcard();
            if (!wildcard.isBounded()) {
                return BasicTypeDescriptor.reference("?", "java.lang.Object");
            }
            TypeDescriptor bound = describe(wildcard.getBoundedType(), typeVariablesInScope);
            String name = (wildcard.isExtends() ? "? extends " : "? super ") + bound.getTypeExpression();
            return BasicTypeDescriptor.reference(name, "java.lang.Object").toBuilder()
                    .dependent(bound.isDependent())
                    .build();
        }
        if (type.isNull()) {
            return BasicTypeDescriptor.reference("null", "java.lang.Object");
        }
        throw new IllegalStateException("unsupported type " + type.describe());
    }

    private static BasicTypeDescriptor describeReference(ResolvedReferenceType type, Set<String> typeVariablesInScope) {
        String erasure = type.getQualifiedName();
        List<String> arguments = new ArrayList<>();
        boolean dependent = false;
        for (ResolvedType argument : type.typeParametersValues()) {
            TypeDescriptor described = describe(argument, typeVariablesInScope);
            dependent |= described.isDependent();
            arguments.add(described.getTypeExpression());
        }
        String name = arguments.isEmpty() ? erasure : erasure + "<" + String.join(", ", arguments) + ">";
        return BasicTypeDescriptor.reference(name, erasure).toBuilder()
                .dependent(dependent)
                .build();
    }

    static Set<String> typeVariablesInScope(Node node) {
        Set<String> names = new HashSet<>();
        Optional<Node> current = node.getParentNode();
        while (current.isPresent()) {
            Node ancestor = current.get();
            if (ancestor instanceof NodeWithTypeParameters) {
                ((NodeWithTypeParameters<?>) ancestor).getTypeParameters()
                        .forEach(p -> names.add(p.getNameAsString()));
            }
            current = ancestor.getParentNode();
        }
        return names;
    }
}
