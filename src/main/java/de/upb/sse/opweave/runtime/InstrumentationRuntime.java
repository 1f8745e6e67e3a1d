package de.upb.sse.opweave.runtime;

/**
 * Holds the {@link AccessListener} instrumented code reports to.
 */
public final class InstrumentationRuntime {
    private static volatile AccessListener listener = AccessListener.NONE;

    private InstrumentationRuntime() {
    }

    public static AccessListener listener() {
        return listener;
    }

    public static void install(AccessListener newListener) {
        listener = newListener != null ? newListener : AccessListener.NONE;
    }

    public static void reset() {
        listener = AccessListener.NONE;
    }
}
