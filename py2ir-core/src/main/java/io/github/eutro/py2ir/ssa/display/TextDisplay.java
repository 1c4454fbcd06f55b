package io.github.eutro.py2ir.ssa.display;

import io.github.eutro.py2ir.ops.Op;
import io.github.eutro.py2ir.ops.PyOps;
import io.github.eutro.py2ir.passes.IRPass;
import io.github.eutro.py2ir.ssa.*;
import io.github.eutro.py2ir.ssa.Module;

import java.util.List;

/**
 * Renders a module as text, in the format used by the golden tests.
 * <pre>
 * module dummy:
 *
 *   toplevel:
 *     b0:
 *       n0 &lt;- $MakeFunction["f", "dummy.f"](None, None, None, None)
 *       TOPLEVEL[f] &lt;- n0
 *       return None
 * </pre>
 * Scoped loads and stores, attributes and subscript stores are rendered in a short form,
 * every other instruction as its operation applied to its arguments.
 */
public class TextDisplay implements IRPass<Module, String> {
    /**
     * A singleton instance of this pass.
     */
    public static final TextDisplay INSTANCE = new TextDisplay();

    private static final String PROC_INDENT = "  ";
    private static final String BLOCK_INDENT = "    ";
    private static final String INSN_INDENT = "      ";

    @Override
    public String run(Module module) {
        StringBuilder sb = new StringBuilder();
        sb.append("module ").append(module.name).append(":\n");
        for (Function func : module.getProcedures()) {
            sb.append('\n');
            display(sb, func, func == module.getToplevel());
        }
        return sb.toString();
    }

    /**
     * Render a single procedure.
     *
     * @param func     The procedure.
     * @param toplevel Whether it is the module body, which is labelled {@code toplevel}.
     * @return The rendered procedure.
     */
    public String display(Function func, boolean toplevel) {
        StringBuilder sb = new StringBuilder();
        display(sb, func, toplevel);
        return sb.toString();
    }

    private static void display(StringBuilder sb, Function func, boolean toplevel) {
        sb.append(PROC_INDENT).append(toplevel ? "toplevel" : func.qualifiedName).append(":\n");
        List<BasicBlock> blocks = func.getBlocks();
        for (int i = 0; i < blocks.size(); i++) {
            if (i != 0) sb.append('\n');
            BasicBlock block = blocks.get(i);
            sb.append(BLOCK_INDENT).append(block.toLabelString()).append(":\n");
            for (Effect effect : block.getEffects()) {
                sb.append(INSN_INDENT).append(displayEffect(effect)).append('\n');
            }
            sb.append(INSN_INDENT).append(block.getControl()).append('\n');
        }
    }

    public static String displayEffect(Effect effect) {
        Insn insn = effect.insn();
        Op op = insn.op;
        List<Value> args = insn.args();
        Var assignee = effect.getAssignsTo();
        if (assignee == null) {
            if (op.is(PyOps.STORE)) {
                return PyOps.STORE.cast(op).arg + " <- " + args.get(0);
            } else if (op.is(PyOps.DELETE)) {
                return "del " + PyOps.DELETE.cast(op).arg;
            } else if (op.is(PyOps.STORE_ATTR)) {
                return args.get(0) + "." + PyOps.STORE_ATTR.cast(op).arg + " <- " + args.get(1);
            } else if (op == PyOps.STORE_SUBSCRIPT) {
                return args.get(0) + "[" + args.get(1) + "] <- " + args.get(2);
            }
            return insn.toString();
        }
        String rhs;
        if (op.is(PyOps.LOAD)) {
            rhs = PyOps.LOAD.cast(op).arg.toString();
        } else if (op.is(PyOps.LOAD_ATTR)) {
            rhs = args.get(0) + "." + PyOps.LOAD_ATTR.cast(op).arg;
        } else {
            rhs = insn.toString();
        }
        return assignee + " <- " + rhs;
    }
}
