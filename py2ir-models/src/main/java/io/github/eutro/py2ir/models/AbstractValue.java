package io.github.eutro.py2ir.models;

import io.github.eutro.py2ir.code.Constants;
import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;
import java.util.Optional;

/**
 * A heap address, with the shape of the value it holds.
 * <p>
 * Two abstract values are the same value exactly when their addresses are equal.
 */
public final class AbstractValue {
    public final int address;
    public final Shape shape;
    /**
     * The constant for {@link Shape#CONSTANT} and {@link Shape#INT},
     * the {@link Closure} for {@link Shape#CLOSURE}, otherwise null.
     */
    @Nullable
    public final Object payload;

    AbstractValue(int address, Shape shape, @Nullable Object payload) {
        this.address = address;
        this.shape = shape;
        this.payload = payload;
    }

    public Optional<String> constantString() {
        return shape == Shape.CONSTANT && payload instanceof String
                ? Optional.of((String) payload)
                : Optional.empty();
    }

    public Optional<BigInteger> constantInt() {
        if ((shape == Shape.INT || shape == Shape.CONSTANT) && Constants.isInt(payload)) {
            return Optional.of(Constants.toBigInteger(payload));
        }
        return Optional.empty();
    }

    public Closure closure() {
        if (shape != Shape.CLOSURE) {
            throw new ModelException("not a closure: " + this);
        }
        return (Closure) payload;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AbstractValue && ((AbstractValue) o).address == address;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(address);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("v").append(address).append(':').append(shape);
        if (payload != null) {
            sb.append('(').append(payload instanceof Closure ? payload : Constants.repr(payload)).append(')');
        }
        return sb.toString();
    }
}
