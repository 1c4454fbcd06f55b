package io.github.eutro.py2ir.ssa;

import io.github.eutro.py2ir.ext.ExtHolder;
import io.github.eutro.py2ir.ops.PyOps;
import org.jetbrains.annotations.Nullable;

/**
 * A non-control instruction: an {@link Insn} and the temporary it assigns, if any.
 */
public final class Effect extends ExtHolder {
    @Nullable
    private final Var assignsTo;
    private final Insn insn;

    Effect(@Nullable Var assignsTo, Insn insn) {
        if ((assignsTo == null) != PyOps.isStore(insn.op)) {
            throw new IllegalArgumentException(assignsTo == null
                    ? insn.op + " must assign a temporary"
                    : insn.op + " cannot assign a temporary");
        }
        this.assignsTo = assignsTo;
        this.insn = insn;
    }

    @Nullable
    public Var getAssignsTo() {
        return assignsTo;
    }

    public Insn insn() {
        return insn;
    }

    @Override
    public String toString() {
        return assignsTo == null ? insn.toString() : assignsTo + " <- " + insn;
    }
}
