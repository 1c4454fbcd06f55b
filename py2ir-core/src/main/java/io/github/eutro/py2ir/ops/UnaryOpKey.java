package io.github.eutro.py2ir.ops;

import java.util.Objects;
import java.util.function.Function;

/**
 * An operation key with a single immediate of type {@code T}, such as the attribute name of
 * {@code $CallMethod} or the scoped name of a load.
 * <p>
 * The printer renders the immediate as a suffix of the mnemonic, so
 * {@code $Binary} with the printer {@code s -> "." + s} renders as {@code $Binary.Add}.
 * By default the immediate is rendered in brackets, as in {@code $CallMethod[append]}.
 *
 * @param <T> The type of the immediate.
 */
public class UnaryOpKey<T> extends OpKey {
    private final Function<T, String> printer;

    public UnaryOpKey(String mnemonic, Function<T, String> printer) {
        super(mnemonic);
        this.printer = printer;
    }

    public UnaryOpKey(String mnemonic) {
        this(mnemonic, imm -> "[" + imm + "]");
    }

    /**
     * An op of this key. Two such ops are equal when their immediates are.
     */
    public final class UnaryOp extends Op {
        public final T arg;

        private UnaryOp(T arg) {
            super(UnaryOpKey.this);
            this.arg = arg;
        }

        @Override
        public String toString() {
            return mnemonic + printer.apply(arg);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof UnaryOpKey.UnaryOp)) return false;
            UnaryOpKey<?>.UnaryOp other = (UnaryOpKey<?>.UnaryOp) o;
            return key == other.key && Objects.equals(arg, other.arg);
        }

        @Override
        public int hashCode() {
            return 31 * System.identityHashCode(key) + Objects.hashCode(arg);
        }
    }

    /**
     * View an op as one of this key, to read its immediate.
     *
     * @param op The op.
     * @return The op, as an op of this key.
     * @throws IllegalArgumentException If the op has a different key.
     */
    @SuppressWarnings("unchecked")
    public UnaryOp cast(Op op) {
        if (op.key != this) {
            throw new IllegalArgumentException("expected a " + mnemonic + " op, got " + op);
        }
        return (UnaryOp) op;
    }

    public UnaryOp create(T arg) {
        if (arg == null) {
            throw new IllegalArgumentException(mnemonic + " needs an immediate");
        }
        return new UnaryOp(arg);
    }
}
