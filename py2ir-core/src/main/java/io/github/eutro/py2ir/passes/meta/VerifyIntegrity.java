package io.github.eutro.py2ir.passes.meta;

import io.github.eutro.py2ir.passes.InPlaceIRPass;
import io.github.eutro.py2ir.ssa.*;

import java.util.*;

/**
 * Checks the structural invariants of a procedure, throwing an {@link IllegalStateException}
 * describing the first violation found:
 * <ul>
 *     <li>every block is terminated, and only jumps to blocks of the procedure;</li>
 *     <li>the entry block has no parameters and is never jumped to;</li>
 *     <li>every jump passes as many arguments as its target declares parameters;</li>
 *     <li>every temporary is assigned exactly once;</li>
 *     <li>every use of a temporary is dominated by its assignment.</li>
 * </ul>
 */
public class VerifyIntegrity implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final VerifyIntegrity INSTANCE = new VerifyIntegrity();

    @Override
    public void runInPlace(Function function) {
        List<BasicBlock> blocks = function.getBlocks();
        Set<BasicBlock> blockSet = new HashSet<>(blocks);
        if (blockSet.size() != blocks.size()) {
            throw new IllegalStateException("function contains duplicate blocks");
        }
        if (!function.getEntry().getParams().isEmpty()) {
            throw new IllegalStateException("entry block declares parameters");
        }

        // var -> (block, position); params have position -1
        Map<Var, BasicBlock> defBlock = new HashMap<>();
        Map<Var, Integer> defPos = new HashMap<>();
        for (BasicBlock block : blocks) {
            if (block.getControl() == null) {
                throw new IllegalStateException(String.format(
                        "block not terminated\n  in block: %s",
                        block));
            }
            for (Var param : block.getParams()) {
                define(defBlock, defPos, param, block, -1);
            }
            int i = 0;
            for (Effect effect : block.getEffects()) {
                Var assigned = effect.getAssignsTo();
                if (assigned != null) define(defBlock, defPos, assigned, block, i);
                i++;
            }
            for (Jump target : block.getControl().targets) {
                if (!blockSet.contains(target.target)) {
                    throw new IllegalStateException(String.format(
                            "jump to block not in function\n  target: b%d\n  in block: %s",
                            target.target.id,
                            block));
                }
                if (target.target == function.getEntry()) {
                    throw new IllegalStateException(String.format(
                            "jump to the entry block\n  in block: %s",
                            block));
                }
                if (target.getArgs().size() != target.target.getParams().size()) {
                    throw new IllegalStateException(String.format(
                            "jump arity mismatch, passing %d arguments to %s\n  in block: %s",
                            target.getArgs().size(),
                            target.target.toLabelString(),
                            block));
                }
            }
        }

        ComputeDoms.INSTANCE.runInPlace(function);
        for (BasicBlock block : blocks) {
            int i = 0;
            for (Effect effect : block.getEffects()) {
                for (Value arg : effect.insn().args()) {
                    checkUse(defBlock, defPos, arg, block, i, effect);
                }
                i++;
            }
            Control control = block.getControl();
            for (Value arg : control.insn().args()) {
                checkUse(defBlock, defPos, arg, block, i, control);
            }
            for (Jump target : control.targets) {
                for (Value arg : target.getArgs()) {
                    checkUse(defBlock, defPos, arg, block, i, control);
                }
            }
        }
    }

    private static void define(
            Map<Var, BasicBlock> defBlock,
            Map<Var, Integer> defPos,
            Var var,
            BasicBlock block,
            int pos
    ) {
        BasicBlock prev = defBlock.put(var, block);
        if (prev != null) {
            throw new IllegalStateException(String.format(
                    "%s assigned more than once\n  first in: b%d\n  again in: b%d",
                    var,
                    prev.id,
                    block.id));
        }
        defPos.put(var, pos);
    }

    private static void checkUse(
            Map<Var, BasicBlock> defBlock,
            Map<Var, Integer> defPos,
            Value arg,
            BasicBlock block,
            int pos,
            Object insn
    ) {
        if (!(arg instanceof Var)) return;
        Var var = (Var) arg;
        BasicBlock def = defBlock.get(var);
        if (def == null) {
            throw new IllegalStateException(String.format(
                    "%s used but never assigned\n  instruction: %s\n  in block: %s",
                    var,
                    insn,
                    block));
        }
        boolean ok = def == block
                ? defPos.get(var) < pos
                : ComputeDoms.dominates(def, block);
        if (!ok) {
            throw new IllegalStateException(String.format(
                    "%s used where its assignment does not dominate\n  instruction: %s\n  in block: %s",
                    var,
                    insn,
                    block));
        }
    }
}
