package io.github.eutro.py2ir.ssa;

import io.github.eutro.py2ir.ops.Op;

import java.util.List;

/**
 * Appends instructions to the end of a block of a procedure.
 * The translator moves one builder from block to block as it simulates them.
 */
public class IRBuilder {
    public final Function func;
    private BasicBlock block;

    public IRBuilder(Function func, BasicBlock block) {
        this.func = func;
        this.block = block;
    }

    public BasicBlock getBlock() {
        return block;
    }

    public void moveTo(BasicBlock block) {
        this.block = block;
    }

    /**
     * Append an instruction, assigning its result to the next temporary of the procedure.
     *
     * @param op   The operation.
     * @param args The arguments.
     * @return The new temporary.
     */
    public Var assign(Op op, List<? extends Value> args) {
        Var result = func.newVar();
        block.addEffect(op.apply(args).assignTo(result));
        return result;
    }

    /**
     * Append an instruction whose result is discarded, such as a store.
     *
     * @param op   The operation.
     * @param args The arguments.
     */
    public void perform(Op op, List<? extends Value> args) {
        block.addEffect(op.apply(args).store());
    }

    public void terminate(Control control) {
        if (block.getControl() != null) {
            throw new IllegalStateException(block.toLabelString() + " is already terminated");
        }
        block.setControl(control);
    }
}
