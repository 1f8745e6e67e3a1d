package de.upb.sse.opweave.runtime;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Registry of user-supplied operator implementations, keyed by the runtime class of
 * the left operand (or the indexed value). The deferred entry points of
 * {@link Primops} consult it before falling back to the built-in operation.
 * <p>
 * Lookup walks superclasses and interfaces, so an implementation registered for
 * an interface applies to every implementor.
 */
public final class OperatorOverloads {

    /** Stores {@code value} at {@code index} of {@code base} and returns the stored value. */
    @FunctionalInterface
    public interface IndexStore {
        Object store(Object base, int index, Object value);
    }

    private static final Map<Class<?>, Map<String, BiFunction<Object, Object, Object>>> BINARY = new ConcurrentHashMap<>();
    private static final Map<Class<?>, Map<String, Function<Object, Object>>> UNARY = new ConcurrentHashMap<>();
    private static final Map<Class<?>, IndexStore> INDEX_STORES = new ConcurrentHashMap<>();

    private OperatorOverloads() {
    }

    /**
     * @param operator a binary operator symbol, or {@code "[]"} for index reads
     *                 (the right operand is then the boxed index)
     */
    public static void register(Class<?> type, String operator, BiFunction<Object, Object, Object> implementation) {
        BINARY.computeIfAbsent(type, t -> new ConcurrentHashMap<>()).put(operator, implementation);
    }

    public static void registerUnary(Class<?> type, String operator, Function<Object, Object> implementation) {
        UNARY.computeIfAbsent(type, t -> new ConcurrentHashMap<>()).put(operator, implementation);
    }

    public static void registerIndexStore(Class<?> type, IndexStore store) {
        INDEX_STORES.put(type, store);
    }

    public static Optional<BiFunction<Object, Object, Object>> findBinary(Class<?> type, String operator) {
        return lookup(type, t -> {
            Map<String, BiFunction<Object, Object, Object>> byOperator = BINARY.get(t);
            return byOperator == null ? null : byOperator.get(operator);
        });
    }

    public static Optional<Function<Object, Object>> findUnary(Class<?> type, String operator) {
        return lookup(type, t -> {
            Map<String, Function<Object, Object>> byOperator = UNARY.get(t);
            return byOperator == null ? null : byOperator.get(operator);
        });
    }

    public static Optional<IndexStore> findIndexStore(Class<?> type) {
        return lookup(type, INDEX_STORES::get);
    }

    public static void clear() {
        BINARY.clear();
        UNARY.clear();
        INDEX_STORES.clear();
    }

    private static <V> Optional<V> lookup(Class<?> type, Function<Class<?>, V> finder) {
        if (type == null) return Optional.empty();
        Deque<Class<?>> pending = new ArrayDeque<>();
        Set<Class<?>> seen = new HashSet<>();
        pending.add(type);
        while (!pending.isEmpty()) {
            Class<?> current = pending.poll();
            if (!seen.add(current)) continue;
            V found = finder.apply(current);
            if (found != null) return Optional.of(found);
            if (current.getSuperclass() != null) pending.add(current.getSuperclass());
            for (Class<?> itf : current.getInterfaces()) {
                pending.add(itf);
            }
        }
        return Optional.empty();
    }
}
