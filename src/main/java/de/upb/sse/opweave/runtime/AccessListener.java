package de.upb.sse.opweave.runtime;

/**
 * Observes every call into {@link Primops}. Methods are invoked before the
 * operation runs, so an index can be inspected before it is used.
 */
public interface AccessListener {

    AccessListener NONE = new AccessListener() {
    };

    default void onIndexAccess(String entryPoint, Class<?> arrayType, int length, int index) {
    }

    /** {@code rightType} is {@code null} for unary operators. */
    default void onOperator(String entryPoint, Class<?> leftType, Class<?> rightType) {
    }

    default void onDeferredDispatch(String entryPoint, Class<?> receiverType, boolean userOverload) {
    }
}
