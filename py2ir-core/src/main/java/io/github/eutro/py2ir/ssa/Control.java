package io.github.eutro.py2ir.ssa;

import io.github.eutro.py2ir.ext.ExtHolder;
import io.github.eutro.py2ir.ops.PyOps;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A control instruction, encapsulating a raw {@link Insn instruction}
 * and the outgoing {@link Jump edges}.
 */
public final class Control extends ExtHolder {
    private final Insn insn;
    /**
     * The edges of this instruction. For {@link PyOps#COND} the first is taken if the condition holds.
     */
    public final List<Jump> targets;

    Control(Insn insn, List<Jump> targets) {
        this.insn = insn;
        this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
    }

    /**
     * Construct an unconditional jump to a block.
     *
     * @param target The jump target.
     * @return The jump instruction.
     */
    public static Control jmp(Jump target) {
        return PyOps.JMP.apply().jumpsTo(target);
    }

    public static Control cond(Value cond, Jump ifTrue, Jump ifFalse) {
        return PyOps.COND.apply(cond).jumpsTo(ifTrue, ifFalse);
    }

    public static Control ret(Value value) {
        return PyOps.RETURN.apply(value).jumpsTo();
    }

    public static Control raise(Value value) {
        return PyOps.THROW.apply(value).jumpsTo();
    }

    public Insn insn() {
        return insn;
    }

    @Override
    public String toString() {
        if (insn.op == PyOps.JMP) {
            return "jmp " + targets.get(0);
        } else if (insn.op == PyOps.COND) {
            return "if " + insn.args().get(0) + " then jmp " + targets.get(0) + " else jmp " + targets.get(1);
        }
        return insn.op + " " + insn.args().get(0);
    }
}
