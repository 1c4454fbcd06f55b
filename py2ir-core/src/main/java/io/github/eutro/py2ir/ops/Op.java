package io.github.eutro.py2ir.ops;

import io.github.eutro.py2ir.ssa.Insn;
import io.github.eutro.py2ir.ssa.Value;

import java.util.Arrays;
import java.util.List;

/**
 * An operation: an {@link OpKey} together with its immediates, if the key has any.
 * Ops of a {@link SimpleOpKey} are shared; ops of a {@link UnaryOpKey} compare by their immediate.
 */
public class Op {
    public final OpKey key;

    protected Op(OpKey key) {
        this.key = key;
    }

    public boolean is(OpKey key) {
        return this.key == key;
    }

    /**
     * Apply this operation to arguments, producing an instruction which is not yet in any block.
     *
     * @param args The arguments.
     * @return The instruction.
     */
    public Insn apply(List<? extends Value> args) {
        return new Insn(this, args);
    }

    public Insn apply(Value... args) {
        return apply(Arrays.asList(args));
    }

    @Override
    public String toString() {
        return key.mnemonic;
    }
}
