package io.github.eutro.py2ir.ssa;

import io.github.eutro.py2ir.code.Constants;
import org.jetbrains.annotations.Nullable;

/**
 * A constant literal, inlined as an argument.
 *
 * @see Constants
 */
public final class Const extends Value {
    public static final Const NONE = new Const(null);

    @Nullable
    public final Object value;

    private Const(@Nullable Object value) {
        this.value = value;
    }

    public static Const of(@Nullable Object value) {
        return value == null ? NONE : new Const(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Const)) return false;
        return Constants.sameConstant(value, ((Const) o).value);
    }

    @Override
    public int hashCode() {
        return Constants.constantHash(value);
    }

    @Override
    public String toString() {
        return Constants.repr(value);
    }
}
