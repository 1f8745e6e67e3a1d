package de.upb.sse.opweave.runtime;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PrimopsTest {

    private final List<String> events = new ArrayList<>();

    @BeforeEach
    void setup() {
        InstrumentationRuntime.install(new AccessListener() {
            @Override
            public void onIndexAccess(String entryPoint, Class<?> arrayType, int length, int index) {
                events.add(entryPoint + " " + arrayType.getSimpleName() + " " + length + " " + index);
            }

            @Override
            public void onOperator(String entryPoint, Class<?> leftType, Class<?> rightType) {
                events.add(entryPoint + " " + leftType.getSimpleName()
                        + (rightType != null ? " " + rightType.getSimpleName() : ""));
            }

            @Override
            public void onDeferredDispatch(String entryPoint, Class<?> receiverType, boolean userOverload) {
                events.add(entryPoint + " " + receiverType.getSimpleName() + (userOverload ? " user" : " builtin"));
            }
        });
    }

    @AfterEach
    void tearDown() {
        InstrumentationRuntime.reset();
        OperatorOverloads.clear();
    }

    @Test
    @DisplayName("Subscript returns the element and reports the access first")
    void subscript() {
        int[] values = {4, 5, 6};
        assertEquals(5, Primops.subscript(int[].class, values, 1));
        assertEquals(List.of("subscript int[] 3 1"), events);

        String[] names = {"a", "b"};
        String name = Primops.subscript(String[].class, names, 0);
        assertEquals("a", name);
    }

    @Test
    @DisplayName("Out-of-range subscript still throws after being reported")
    void subscript_out_of_bounds() {
        int[] values = {1, 2};
        assertThrows(ArrayIndexOutOfBoundsException.class, () -> Primops.subscript(int[].class, values, 2));
        assertEquals(List.of("subscript int[] 2 2"), events);
    }

    @Test
    @DisplayName("Element assignments yield the stored value")
    void assignments() {
        double[] d = {1.0, 2.0};
        assertEquals(7.5, Primops.assign(double[].class, d, 0, 7.5));
        assertEquals(2.5, Primops.addAssign(double[].class, d, 1, 0.5));
        assertArrayEquals(new double[]{7.5, 2.5}, d);

        int[] i = {7};
        assertEquals(1, Primops.remAssign(int[].class, i, 0, 3));
        assertEquals(1, i[0]);
    }

    @Test
    @DisplayName("Concrete arithmetic keeps Java overflow and division semantics")
    void arithmetic() {
        assertEquals(Integer.MIN_VALUE, Primops.add(int.class, int.class, Integer.MAX_VALUE, 1));
        assertEquals(-2, Primops.div(int.class, int.class, -7, 3));
        assertEquals(-1, Primops.rem(int.class, int.class, -7, 3));
        assertThrows(ArithmeticException.class, () -> Primops.div(int.class, int.class, 1, 0));
        assertTrue(Double.isInfinite(Primops.div(double.class, double.class, 1.0, 0.0)));
        assertEquals(6L, Primops.mul(int.class, long.class, 2, 3L));
        assertEquals("mul int long", events.get(events.size() - 1));
    }

    @Test
    @DisplayName("Comparisons treat NaN as unordered")
    void comparisons() {
        assertTrue(Primops.lt(int.class, int.class, 1, 2));
        assertFalse(Primops.ge(int.class, int.class, 1, 2));
        assertFalse(Primops.lt(double.class, double.class, Double.NaN, 1.0));
        assertFalse(Primops.eq(double.class, double.class, Double.NaN, Double.NaN));
        assertTrue(Primops.ne(double.class, double.class, Double.NaN, Double.NaN));
    }

    @Test
    @DisplayName("Unary operators report a single operand type")
    void unary() {
        assertEquals(-3, Primops.neg(int.class, 3));
        assertEquals(~5L, Primops.not(long.class, 5L));
        assertEquals(List.of("neg int", "not long"), events);
    }

    @Test
    @DisplayName("Deferred subscript falls back to the built-in access")
    void maybe_subscript_builtin() {
        Integer[] boxed = {10, 20};
        Integer value = Primops.maybeSubscript(boxed, 1);
        assertEquals(20, value);
        assertEquals(List.of("maybeSubscript Integer[] builtin", "maybeSubscript Integer[] 2 1"), events);
    }

    @Test
    @DisplayName("Deferred operators use a registered user operator")
    void maybe_user_operator() {
        OperatorOverloads.register(BigInteger.class, "+", (l, r) -> ((BigInteger) l).add((BigInteger) r));
        OperatorOverloads.register(BigInteger.class, "<", (l, r) -> ((BigInteger) l).compareTo((BigInteger) r) < 0);

        assertEquals(BigInteger.valueOf(5), Primops.maybeAdd(BigInteger.TWO, BigInteger.valueOf(3)));
        assertTrue(Primops.maybeLt(BigInteger.ONE, BigInteger.TEN));
        assertEquals(List.of("maybeAdd BigInteger user", "maybeLt BigInteger user"), events);
    }

    @Test
    @DisplayName("Deferred operators on boxed numbers apply numeric promotion")
    void maybe_builtin_operator() {
        assertEquals(3.5, Primops.maybeAdd(1, 2.5));
        assertEquals(6L, Primops.maybeMul(2, 3L));
        assertEquals("x1", Primops.maybeAdd("x", 1));
        assertEquals(-4, Primops.maybeNeg(4));
        assertTrue(Primops.maybeEq(1, 1L));
        assertFalse(Primops.maybeGt(Double.NaN, 0));
        assertThrows(IllegalArgumentException.class, () -> Primops.maybeSub(new Object(), 1));
    }

    @Test
    @DisplayName("Deferred compound assignment narrows to the element type")
    void maybe_compound_narrowing() {
        Short[] shorts = {(short) 32767};
        Short result = Primops.maybeAddAssign(shorts, 0, 1);
        assertEquals((short) -32768, result);
        assertEquals((short) -32768, shorts[0]);

        int[] ints = {10};
        Integer quotient = Primops.maybeDivAssign(ints, 0, 4);
        assertEquals(2, quotient);
        assertEquals(2, ints[0]);
    }

    @Test
    @DisplayName("Deferred assignment uses a registered index store")
    void maybe_assign_store() {
        List<Object> stored = new ArrayList<>();
        OperatorOverloads.registerIndexStore(ArrayList.class, (base, index, value) -> {
            stored.add(index + "=" + value);
            return value;
        });

        assertEquals("v", Primops.maybeAssign(new ArrayList<String>(), 3, "v"));
        assertEquals(List.of("3=v"), stored);

        Object[] plain = new Object[1];
        assertEquals("w", Primops.maybeAssign(plain, 0, "w"));
        assertEquals("w", plain[0]);
    }
}
