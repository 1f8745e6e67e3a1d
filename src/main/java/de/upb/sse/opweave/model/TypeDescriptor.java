package de.upb.sse.opweave.model;

import java.util.Optional;

/**
 * Type information the front end attaches to a node.
 */
public interface TypeDescriptor {

    /** Human readable name, e.g. {@code int[]} or {@code java.util.List<T>}. */
    String getName();

    /** Erased name usable in a class literal, e.g. {@code int[]} or {@code java.util.List}. */
    String getLiteralName();

    /** Name usable as an explicit type argument; primitives are boxed. */
    String getTypeExpression();

    /** Element type of an array-like type. */
    Optional<TypeDescriptor> getComponentType();

    /** Depends on a generic parameter that is not substituted yet. */
    boolean isDependent();

    /** Array-like: supports built-in indexing. */
    boolean isPointerLike();

    /** Primitive numeric type, {@code char} included. */
    boolean isArithmetic();

    boolean isPrimitive();

    boolean isConstQualified();

    boolean isVolatileQualified();

    /** False when the front end could not resolve the type. */
    boolean isComplete();

    boolean hasUserIndexOverload();

    boolean hasUserArithmeticOverload();
}
