package de.upb.sse.opweave.runtime;

import java.lang.reflect.Array;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Entry points called by instrumented code.
 * <p>
 * The concrete forms take the static operand types as leading {@code Class}
 * arguments and perform the operation exactly as the original expression did.
 * The {@code maybe*} forms are emitted where an operand type depends on a type
 * parameter; they look up a user operator for the runtime type in
 * {@link OperatorOverloads} and fall back to the built-in operation.
 * <p>
 * Every call is reported to {@link InstrumentationRuntime#listener()} before the
 * operation runs.
 */
public final class Primops {

    private Primops() {
    }
    // index reads

    public static boolean subscript(Class<?> arrayType, boolean[] array, int index) {
        indexAccess("subscript", arrayType, array.length, index);
        return array[index];
    }

    public static byte subscript(Class<?> arrayType, byte[] array, int index) {
        indexAccess("subscript", arrayType, array.length, index);
        return array[index];
    }

    public static short subscript(Class<?> arrayType, short[] array, int index) {
        indexAccess("subscript", arrayType, array.length, index);
        return array[index];
    }

    public static char subscript(Class<?> arrayType, char[] array, int index) {
        indexAccess("subscript", arrayType, array.length, index);
        return array[index];
    }

    public static int subscript(Class<?> arrayType, int[] array, int index) {
        indexAccess("subscript", arrayType, array.length, index);
        return array[index];
    }

    public static long subscript(Class<?> arrayType, long[] array, int index) {
        indexAccess("subscript", arrayType, array.length, index);
        return array[index];
    }

    public static float subscript(Class<?> arrayType, float[] array, int index) {
        indexAccess("subscript", arrayType, array.length, index);
        return array[index];
    }

    public static double subscript(Class<?> arrayType, double[] array, int index) {
        indexAccess("subscript", arrayType, array.length, index);
        return array[index];
    }

    public static <E> E subscript(Class<?> arrayType, E[] array, int index) {
        indexAccess("subscript", arrayType, array.length, index);
        return array[index];
    }

    // element assignment; the assigned value is the result, as for the original expression

    public static boolean assign(Class<?> arrayType, boolean[] array, int index, boolean value) {
        indexAccess("assign", arrayType, array.length, index);
        array[index] = value;
        return value;
    }

    public static byte assign(Class<?> arrayType, byte[] array, int index, byte value) {
        indexAccess("assign", arrayType, array.length, index);
        array[index] = value;
        return value;
    }

    public static short assign(Class<?> arrayType, short[] array, int index, short value) {
        indexAccess("assign", arrayType, array.length, index);
        array[index] = value;
        return value;
    }

    public static char assign(Class<?> arrayType, char[] array, int index, char value) {
        indexAccess("assign", arrayType, array.length, index);
        array[index] = value;
        return value;
    }

    public static int assign(Class<?> arrayType, int[] array, int index, int value) {
        indexAccess("assign", arrayType, array.length, index);
        array[index] = value;
        return value;
    }

    public static long assign(Class<?> arrayType, long[] array, int index, long value) {
        indexAccess("assign", arrayType, array.length, index);
        array[index] = value;
        return value;
    }

    public static float assign(Class<?> arrayType, float[] array, int index, float value) {
        indexAccess("assign", arrayType, array.length, index);
        array[index] = value;
        return value;
    }

    public static double assign(Class<?> arrayType, double[] array, int index, double value) {
        indexAccess("assign", arrayType, array.length, index);
        array[index] = value;
        return value;
    }

    public static <E> E assign(Class<?> arrayType, E[] array, int index, E value) {
        indexAccess("assign", arrayType, array.length, index);
        array[index] = value;
        return value;
    }

    // compound element assignment; the value is evaluated before the index is checked

    public static int addAssign(Class<?> arrayType, int[] array, int index, int value) {
        indexAccess("addAssign", arrayType, array.length, index);
        return array[index] += value;
    }

    public static long addAssign(Class<?> arrayType, long[] array, int index, long value) {
        indexAccess("addAssign", arrayType, array.length, index);
        return array[index] += value;
    }

    public static float addAssign(Class<?> arrayType, float[] array, int index, float value) {
        indexAccess("addAssign", arrayType, array.length, index);
        return array[index] += value;
    }

    public static double addAssign(Class<?> arrayType, double[] array, int index, double value) {
        indexAccess("addAssign", arrayType, array.length, index);
        return array[index] += value;
    }

    public static int subAssign(Class<?> arrayType, int[] array, int index, int value) {
        indexAccess("subAssign", arrayType, array.length, index);
        return array[index] -= value;
    }

    public static long subAssign(Class<?> arrayType, long[] array, int index, long value) {
        indexAccess("subAssign", arrayType, array.length, index);
        return array[index] -= value;
    }

    public static float subAssign(Class<?> arrayType, float[] array, int index, float value) {
        indexAccess("subAssign", arrayType, array.length, index);
        return array[index] -= value;
    }

    public static double subAssign(Class<?> arrayType, double[] array, int index, double value) {
        indexAccess("subAssign", arrayType, array.length, index);
        return array[index] -= value;
    }

    public static int mulAssign(Class<?> arrayType, int[] array, int index, int value) {
        indexAccess("mulAssign", arrayType, array.length, index);
        return array[index] *= value;
    }

    public static long mulAssign(Class<?> arrayType, long[] array, int index, long value) {
        indexAccess("mulAssign", arrayType, array.length, index);
        return array[index] *= value;
    }

    public static float mulAssign(Class<?> arrayType, float[] array, int index, float value) {
        indexAccess("mulAssign", arrayType, array.length, index);
        return array[index] *= value;
    }

    public static double mulAssign(Class<?> arrayType, double[] array, int index, double value) {
        indexAccess("mulAssign", arrayType, array.length, index);
        return array[index] *= value;
    }

    public static int divAssign(Class<?> arrayType, int[] array, int index, int value) {
        indexAccess("divAssign", arrayType, array.length, index);
        return array[index] /= value;
    }

    public static long divAssign(Class<?> arrayType, long[] array, int index, long value) {
        indexAccess("divAssign", arrayType, array.length, index);
        return array[index] /= value;
    }

    public static float divAssign(Class<?> arrayType, float[] array, int index, float value) {
        indexAccess("divAssign", arrayType, array.length, index);
        return array[index] /= value;
    }

    public static double divAssign(Class<?> arrayType, double[] array, int index, double value) {
        indexAccess("divAssign", arrayType, array.length, index);
        return array[index] /= value;
    }

    public static int remAssign(Class<?> arrayType, int[] array, int index, int value) {
        indexAccess("remAssign", arrayType, array.length, index);
        return array[index] %= value;
    }

    public static long remAssign(Class<?> arrayType, long[] array, int index, long value) {
        indexAccess("remAssign", arrayType, array.length, index);
        return array[index] %= value;
    }

    public static float remAssign(Class<?> arrayType, float[] array, int index, float value) {
        indexAccess("remAssign", arrayType, array.length, index);
        return array[index] %= value;
    }

    public static double remAssign(Class<?> arrayType, double[] array, int index, double value) {
        indexAccess("remAssign", arrayType, array.length, index);
        return array[index] %= value;
    }

    // binary arithmetic

    public static int add(Class<?> leftType, Class<?> rightType, int left, int right) {
        operator("add", leftType, rightType);
        return left + right;
    }

    public static long add(Class<?> leftType, Class<?> rightType, long left, long right) {
        operator("add", leftType, rightType);
        return left + right;
    }

    public static float add(Class<?> leftType, Class<?> rightType, float left, float right) {
        operator("add", leftType, rightType);
        return left + right;
    }

    public static double add(Class<?> leftType, Class<?> rightType, double left, double right) {
        operator("add", leftType, rightType);
        return left + right;
    }

    public static int sub(Class<?> leftType, Class<?> rightType, int left, int right) {
        operator("sub", leftType, rightType);
        return left - right;
    }

    public static long sub(Class<?> leftType, Class<?> rightType, long left, long right) {
        operator("sub", leftType, rightType);
        return left - right;
    }

    public static float sub(Class<?> leftType, Class<?> rightType, float left, float right) {
        operator("sub", leftType, rightType);
        return left - right;
    }

    public static double sub(Class<?> leftType, Class<?> rightType, double left, double right) {
        operator("sub", leftType, rightType);
        return left - right;
    }

    public static int mul(Class<?> leftType, Class<?> rightType, int left, int right) {
        operator("mul", leftType, rightType);
        return left * right;
    }

    public static long mul(Class<?> leftType, Class<?> rightType, long left, long right) {
        operator("mul", leftType, rightType);
        return left * right;
    }

    public static float mul(Class<?> leftType, Class<?> rightType, float left, float right) {
        operator("mul", leftType, rightType);
        return left * right;
    }

    public static double mul(Class<?> leftType, Class<?> rightType, double left, double right) {
        operator("mul", leftType, rightType);
        return left * right;
    }

    public static int div(Class<?> leftType, Class<?> rightType, int left, int right) {
        operator("div", leftType, rightType);
        return left / right;
    }

    public static long div(Class<?> leftType, Class<?> rightType, long left, long right) {
        operator("div", leftType, rightType);
        return left / right;
    }

    public static float div(Class<?> leftType, Class<?> rightType, float left, float right) {
        operator("div", leftType, rightType);
        return left / right;
    }

    public static double div(Class<?> leftType, Class<?> rightType, double left, double right) {
        operator("div", leftType, rightType);
        return left / right;
    }

    public static int rem(Class<?> leftType, Class<?> rightType, int left, int right) {
        operator("rem", leftType, rightType);
        return left % right;
    }

    public static long rem(Class<?> leftType, Class<?> rightType, long left, long right) {
        operator("rem", leftType, rightType);
        return left % right;
    }

    public static float rem(Class<?> leftType, Class<?> rightType, float left, float right) {
        operator("rem", leftType, rightType);
        return left % right;
    }

    public static double rem(Class<?> leftType, Class<?> rightType, double left, double right) {
        operator("rem", leftType, rightType);
        return left % right;
    }

    // comparison

    public static boolean eq(Class<?> leftType, Class<?> rightType, int left, int right) {
        operator("eq", leftType, rightType);
        return left == right;
    }

    public static boolean eq(Class<?> leftType, Class<?> rightType, long left, long right) {
        operator("eq", leftType, rightType);
        return left == right;
    }

    public static boolean eq(Class<?> leftType, Class<?> rightType, float left, float right) {
        operator("eq", leftType, rightType);
        return left == right;
    }

    public static boolean eq(Class<?> leftType, Class<?> rightType, double left, double right) {
        operator("eq", leftType, rightType);
        return left == right;
    }

    public static boolean ne(Class<?> leftType, Class<?> rightType, int left, int right) {
        operator("ne", leftType, rightType);
        return left != right;
    }

    public static boolean ne(Class<?> leftType, Class<?> rightType, long left, long right) {
        operator("ne", leftType, rightType);
        return left != right;
    }

    public static boolean ne(Class<?> leftType, Class<?> rightType, float left, float right) {
        operator("ne", leftType, rightType);
        return left != right;
    }

    public static boolean ne(Class<?> leftType, Class<?> rightType, double left, double right) {
        operator("ne", leftType, rightType);
        return left != right;
    }

    public static boolean lt(Class<?> leftType, Class<?> rightType, int left, int right) {
        operator("lt", leftType, rightType);
        return left < right;
    }

    public static boolean lt(Class<?> leftType, Class<?> rightType, long left, long right) {
        operator("lt", leftType, rightType);
        return left < right;
    }

    public static boolean lt(Class<?> leftType, Class<?> rightType, float left, float right) {
        operator("lt", leftType, rightType);
        return left < right;
    }

    public static boolean lt(Class<?> leftType, Class<?> rightType, double left, double right) {
        operator("lt", leftType, rightType);
        return left < right;
    }

    public static boolean gt(Class<?> leftType, Class<?> rightType, int left, int right) {
        operator("gt", leftType, rightType);
        return left > right;
    }

    public static boolean gt(Class<?> leftType, Class<?> rightType, long left, long right) {
        operator("gt", leftType, rightType);
        return left > right;
    }

    public static boolean gt(Class<?> leftType, Class<?> rightType, float left, float right) {
        operator("gt", leftType, rightType);
        return left > right;
    }

    public static boolean gt(Class<?> leftType, Class<?> rightType, double left, double right) {
        operator("gt", leftType, rightType);
        return left > right;
    }

    public static boolean le(Class<?> leftType, Class<?> rightType, int left, int right) {
        operator("le", leftType, rightType);
        return left <= right;
    }

    public static boolean le(Class<?> leftType, Class<?> rightType, long left, long right) {
        operator("le", leftType, rightType);
        return left <= right;
    }

    public static boolean le(Class<?> leftType, Class<?> rightType, float left, float right) {
        operator("le", leftType, rightType);
        return left <= right;
    }

    public static boolean le(Class<?> leftType, Class<?> rightType, double left, double right) {
        operator("le", leftType, rightType);
        return left <= right;
    }

    public static boolean ge(Class<?> leftType, Class<?> rightType, int left, int right) {
        operator("ge", leftType, rightType);
        return left >= right;
    }

    public static boolean ge(Class<?> leftType, Class<?> rightType, long left, long right) {
        operator("ge", leftType, rightType);
        return left >= right;
    }

    public static boolean ge(Class<?> leftType, Class<?> rightType, float left, float right) {
        operator("ge", leftType, rightType);
        return left >= right;
    }

    public static boolean ge(Class<?> leftType, Class<?> rightType, double left, double right) {
        operator("ge", leftType, rightType);
        return left >= right;
    }

    // unary

    public static int neg(Class<?> operandType, int operand) {
        operator("neg", operandType, null);
        return -operand;
    }

    public static long neg(Class<?> operandType, long operand) {
        operator("neg", operandType, null);
        return -operand;
    }

    public static float neg(Class<?> operandType, float operand) {
        operator("neg", operandType, null);
        return -operand;
    }

    public static double neg(Class<?> operandType, double operand) {
        operator("neg", operandType, null);
        return -operand;
    }

    public static int pos(Class<?> operandType, int operand) {
        operator("pos", operandType, null);
        return +operand;
    }

    public static long pos(Class<?> operandType, long operand) {
        operator("pos", operandType, null);
        return +operand;
    }

    public static float pos(Class<?> operandType, float operand) {
        operator("pos", operandType, null);
        return +operand;
    }

    public static double pos(Class<?> operandType, double operand) {
        operator("pos", operandType, null);
        return +operand;
    }

    public static int not(Class<?> operandType, int operand) {
        operator("not", operandType, null);
        return ~operand;
    }

    public static long not(Class<?> operandType, long operand) {
        operator("not", operandType, null);
        return ~operand;
    }

    // deferred dispatch

    @SuppressWarnings("unchecked")
    public static <E> E maybeSubscript(Object base, int index) {
        Class<?> type = base.getClass();
        Optional<BiFunction<Object, Object, Object>> overload = OperatorOverloads.findBinary(type, "[]");
        InstrumentationRuntime.listener().onDeferredDispatch("maybeSubscript", type, overload.isPresent());
        if (overload.isPresent()) {
            return (E) overload.get().apply(base, index);
        }
        indexAccess("maybeSubscript", type, Array.getLength(base), index);
        return (E) Array.get(base, index);
    }

    @SuppressWarnings("unchecked")
    public static <E> E maybeAssign(Object base, int index, E value) {
        Class<?> type = base.getClass();
        Optional<OperatorOverloads.IndexStore> store = OperatorOverloads.findIndexStore(type);
        InstrumentationRuntime.listener().onDeferredDispatch("maybeAssign", type, store.isPresent());
        if (store.isPresent()) {
            return (E) store.get().store(base, index, value);
        }
        indexAccess("maybeAssign", type, Array.getLength(base), index);
        storeElement(base, index, value);
        return value;
    }

    public static <E> E maybeAddAssign(Object base, int index, Object value) {
        return compoundAssign("maybeAddAssign", "+", base, index, value);
    }

    public static <E> E maybeSubAssign(Object base, int index, Object value) {
        return compoundAssign("maybeSubAssign", "-", base, index, value);
    }

    public static <E> E maybeMulAssign(Object base, int index, Object value) {
        return compoundAssign("maybeMulAssign", "*", base, index, value);
    }

    public static <E> E maybeDivAssign(Object base, int index, Object value) {
        return compoundAssign("maybeDivAssign", "/", base, index, value);
    }

    public static <E> E maybeRemAssign(Object base, int index, Object value) {
        return compoundAssign("maybeRemAssign", "%", base, index, value);
    }

    public static <L, R> Object maybeAdd(L left, R right) {
        return binary("maybeAdd", "+", left, right);
    }

    public static <L, R> Object maybeSub(L left, R right) {
        return binary("maybeSub", "-", left, right);
    }

    public static <L, R> Object maybeMul(L left, R right) {
        return binary("maybeMul", "*", left, right);
    }

    public static <L, R> Object maybeDiv(L left, R right) {
        return binary("maybeDiv", "/", left, right);
    }

    public static <L, R> Object maybeRem(L left, R right) {
        return binary("maybeRem", "%", left, right);
    }

    public static <L, R> boolean maybeEq(L left, R right) {
        return comparison("maybeEq", "==", left, right);
    }

    public static <L, R> boolean maybeNe(L left, R right) {
        return comparison("maybeNe", "!=", left, right);
    }

    public static <L, R> boolean maybeLt(L left, R right) {
        return comparison("maybeLt", "<", left, right);
    }

    public static <L, R> boolean maybeGt(L left, R right) {
        return comparison("maybeGt", ">", left, right);
    }

    public static <L, R> boolean maybeLe(L left, R right) {
        return comparison("maybeLe", "<=", left, right);
    }

    public static <L, R> boolean maybeGe(L left, R right) {
        return comparison("maybeGe", ">=", left, right);
    }

    public static <T> Object maybeNeg(T operand) {
        return unary("maybeNeg", "-", operand);
    }

    public static <T> Object maybePos(T operand) {
        return unary("maybePos", "+", operand);
    }

    public static <T> Object maybeNot(T operand) {
        return unary("maybeNot", "~", operand);
    }

    private static void indexAccess(String entryPoint, Class<?> arrayType, int length, int index) {
        InstrumentationRuntime.listener().onIndexAccess(entryPoint, arrayType, length, index);
    }

    private static void operator(String entryPoint, Class<?> leftType, Class<?> rightType) {
        InstrumentationRuntime.listener().onOperator(entryPoint, leftType, rightType);
    }

    private static void storeElement(Object base, int index, Object value) {
        if (base instanceof Object[]) {
            ((Object[]) base)[index] = value;
        } else {
            Array.set(base, index, value);
        }
    }

    @SuppressWarnings("unchecked")
    private static <E> E compoundAssign(String entryPoint, String operator, Object base, int index, Object value) {
        Class<?> type = base.getClass();
        indexAccess(entryPoint, type, Array.getLength(base), index);
        Object current = Array.get(base, index);
        Object result = binary(entryPoint, operator, current, value);
        Object converted = BoxedArithmetic.convert(result, type.getComponentType());
        storeElement(base, index, converted);
        return (E) converted;
    }

    private static Object binary(String entryPoint, String operator, Object left, Object right) {
        Optional<BiFunction<Object, Object, Object>> overload = findBinary(left, operator);
        InstrumentationRuntime.listener().onDeferredDispatch(entryPoint, runtimeType(left), overload.isPresent());
        if (overload.isPresent()) {
            return overload.get().apply(left, right);
        }
        return BoxedArithmetic.apply(operator, left, right);
    }

    private static boolean comparison(String entryPoint, String operator, Object left, Object right) {
        Optional<BiFunction<Object, Object, Object>> overload = findBinary(left, operator);
        InstrumentationRuntime.listener().onDeferredDispatch(entryPoint, runtimeType(left), overload.isPresent());
        if (overload.isPresent()) {
            return (Boolean) overload.get().apply(left, right);
        }
        return BoxedArithmetic.compare(operator, left, right);
    }

    private static Object unary(String entryPoint, String operator, Object operand) {
        Optional<Function<Object, Object>> overload = operand == null
                ? Optional.empty()
                : OperatorOverloads.findUnary(operand.getClass(), operator);
        InstrumentationRuntime.listener().onDeferredDispatch(entryPoint, runtimeType(operand), overload.isPresent());
        if (overload.isPresent()) {
            return overload.get().apply(operand);
        }
        switch (operator) {
            case "-":
                return BoxedArithmetic.negate(operand);
            case "+":
                return BoxedArithmetic.plus(operand);
            default:
                return BoxedArithmetic.complement(operand);
        }
    }

    private static Optional<BiFunction<Object, Object, Object>> findBinary(Object left, String operator) {
        return left == null ? Optional.empty() : OperatorOverloads.findBinary(left.getClass(), operator);
    }

    private static Class<?> runtimeType(Object value) {
        return value == null ? Void.class : value.getClass();
    }
}
