package de.upb.sse.opweave.runtime;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LoggingAccessListenerTest {
    private LoggingAccessListener listener;

    @BeforeEach
    void setup() {
        listener = new LoggingAccessListener();
        InstrumentationRuntime.install(listener);
    }

    @AfterEach
    void tearDown() {
        InstrumentationRuntime.reset();
    }

    @Test
    @DisplayName("Counts accesses and flags out-of-bounds indices")
    void counts() {
        long[] values = {1L, 2L};
        Primops.subscript(long[].class, values, 0);
        assertThrows(ArrayIndexOutOfBoundsException.class, () -> Primops.subscript(long[].class, values, -1));
        Primops.sub(long.class, long.class, 3L, 1L);
        Primops.maybeNeg(2);

        assertEquals(2, listener.getIndexAccesses());
        assertEquals(1, listener.getOutOfBounds());
        assertEquals(1, listener.getOperations());
        assertEquals(1, listener.getDispatches());
    }

    @Test
    @DisplayName("Installing null restores the silent listener")
    void install_null() {
        InstrumentationRuntime.install(null);
        assertSame(AccessListener.NONE, InstrumentationRuntime.listener());
    }
}
