package de.upb.sse.opweave.runtime;

import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logs instrumented operations and warns about out-of-bounds indices before the
 * access fails.
 */
public class LoggingAccessListener implements AccessListener {
    private static final Logger logger = Logger.getLogger(LoggingAccessListener.class.getName());

    private final AtomicLong indexAccesses = new AtomicLong();
    private final AtomicLong outOfBounds = new AtomicLong();
    private final AtomicLong operations = new AtomicLong();
    private final AtomicLong dispatches = new AtomicLong();

    @Override
    public void onIndexAccess(String entryPoint, Class<?> arrayType, int length, int index) {
        indexAccesses.incrementAndGet();
        if (index < 0 || index >= length) {
            outOfBounds.incrementAndGet();
            logger.warning(entryPoint + ": index " + index + " out of bounds for " + arrayType.getSimpleName()
                    + " of length " + length);
        } else if (logger.isLoggable(Level.FINE)) {
            logger.fine(entryPoint + ": " + arrayType.getSimpleName() + "[" + index + "] of length " + length);
        }
    }

    @Override
    public void onOperator(String entryPoint, Class<?> leftType, Class<?> rightType) {
        operations.incrementAndGet();
        logger.finer(() -> entryPoint + "(" + leftType.getSimpleName()
                + (rightType != null ? ", " + rightType.getSimpleName() : "") + ")");
    }

    @Override
    public void onDeferredDispatch(String entryPoint, Class<?> receiverType, boolean userOverload) {
        dispatches.incrementAndGet();
        logger.fine(() -> entryPoint + " on " + receiverType.getName()
                + (userOverload ? " -> user operator" : " -> built-in"));
    }

    public long getIndexAccesses() {
        return indexAccesses.get();
    }

    public long getOutOfBounds() {
        return outOfBounds.get();
    }

    public long getOperations() {
        return operations.get();
    }

    public long getDispatches() {
        return dispatches.get();
    }
}
