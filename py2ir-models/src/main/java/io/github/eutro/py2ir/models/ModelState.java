package io.github.eutro.py2ir.models;

import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;
import java.util.*;

/**
 * The abstract heap the builtins operate on.
 * <p>
 * Every allocation gets a fresh address. Objects have string-keyed fields, which hold the entries
 * of dicts, the elements of tuples, and the name of an unresolved module.
 * Not thread-safe.
 */
public final class ModelState {
    private int nextAddress = 0;
    private final Map<Integer, Map<String, AbstractValue>> fields = new HashMap<>();
    private final Set<AbstractValue> awaited = new LinkedHashSet<>();
    private final Set<AbstractValue> awaitables = new LinkedHashSet<>();
    private final List<String> misses = new ArrayList<>();
    private final Map<String, CallTarget> targets = new HashMap<>();

    public AbstractValue allocate(Shape shape, @Nullable Object payload) {
        AbstractValue value = new AbstractValue(nextAddress++, shape, payload);
        if (shape == Shape.DICT || shape == Shape.TUPLE || shape == Shape.UNRESOLVED_MODULE) {
            fields.put(value.address, new LinkedHashMap<>());
        }
        return value;
    }

    public AbstractValue fresh() {
        return allocate(Shape.FRESH, null);
    }

    /**
     * Allocate a value for a constant, tagging integers with the integer type.
     *
     * @param constant The constant.
     * @return The value.
     */
    public AbstractValue constant(@Nullable Object constant) {
        if (constant == null) return allocate(Shape.NONE, null);
        if (constant instanceof Integer || constant instanceof Long || constant instanceof BigInteger) {
            return allocate(Shape.INT, constant);
        }
        return allocate(Shape.CONSTANT, constant);
    }

    public AbstractValue closure(String target, List<AbstractValue> captured) {
        return allocate(Shape.CLOSURE, new Closure(target, captured));
    }

    /**
     * Get the fields of an object.
     *
     * @param object The object.
     * @return The fields, or empty if the value has no known fields.
     */
    public Optional<Map<String, AbstractValue>> fieldsOf(AbstractValue object) {
        return Optional.ofNullable(fields.get(object.address));
    }

    public void markAwaited(AbstractValue value) {
        awaited.add(value);
    }

    public boolean isAwaited(AbstractValue value) {
        return awaited.contains(value);
    }

    public void markAwaitable(AbstractValue value) {
        awaitables.add(value);
    }

    public boolean isAwaitable(AbstractValue value) {
        return awaitables.contains(value);
    }

    /**
     * Get the awaitables that were created but never awaited.
     *
     * @return The values.
     */
    public Set<AbstractValue> unawaited() {
        Set<AbstractValue> result = new LinkedHashSet<>(awaitables);
        result.removeAll(awaited);
        return result;
    }

    void recordMiss(String miss) {
        misses.add(miss);
    }

    /**
     * Get the descriptions of every place a builtin had to produce a fresh value for lack of information.
     *
     * @return The misses, in order.
     */
    public List<String> getMisses() {
        return Collections.unmodifiableList(misses);
    }

    public void registerTarget(String qualifiedName, CallTarget target) {
        targets.put(qualifiedName, target);
    }

    public Optional<CallTarget> findTarget(String qualifiedName) {
        return Optional.ofNullable(targets.get(qualifiedName));
    }
}
