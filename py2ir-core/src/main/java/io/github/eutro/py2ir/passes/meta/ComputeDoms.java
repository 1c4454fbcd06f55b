package io.github.eutro.py2ir.passes.meta;

import io.github.eutro.py2ir.ext.CommonExts;
import io.github.eutro.py2ir.passes.InPlaceIRPass;
import io.github.eutro.py2ir.ssa.BasicBlock;
import io.github.eutro.py2ir.ssa.Function;
import io.github.eutro.py2ir.util.GraphWalker;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes {@link CommonExts#IDOM} for each reachable block (except the entry),
 * and {@link CommonExts#PREDS} as a by-product.
 * <p>
 * This is the iterative algorithm of Cooper, Harvey and Kennedy, "A Simple, Fast Dominance Algorithm",
 * which converges in a couple of iterations over the reverse post-order for the reducible
 * graphs that structured bytecode produces.
 */
public class ComputeDoms implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeDoms INSTANCE = new ComputeDoms();

    @Override
    public void runInPlace(Function func) {
        ComputePreds.INSTANCE.runInPlace(func);
        List<BasicBlock> rpo = GraphWalker.blockWalker(func).reversePostOrder();
        Map<BasicBlock, Integer> order = new HashMap<>();
        for (int i = 0; i < rpo.size(); i++) {
            order.put(rpo.get(i), i);
        }

        BasicBlock[] idoms = new BasicBlock[rpo.size()];
        BasicBlock entry = rpo.get(0);
        idoms[0] = entry;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int i = 1; i < rpo.size(); i++) {
                BasicBlock block = rpo.get(i);
                BasicBlock newIdom = null;
                for (BasicBlock pred : block.getExtOrThrow(CommonExts.PREDS)) {
                    Integer predIdx = order.get(pred);
                    if (predIdx == null || idoms[predIdx] == null) continue;
                    newIdom = newIdom == null ? pred : intersect(pred, newIdom, rpo, idoms, order);
                }
                if (newIdom != idoms[i]) {
                    idoms[i] = newIdom;
                    changed = true;
                }
            }
        }

        entry.removeExt(CommonExts.IDOM);
        for (int i = 1; i < rpo.size(); i++) {
            rpo.get(i).attachExt(CommonExts.IDOM, idoms[i]);
        }
    }

    private static BasicBlock intersect(
            BasicBlock a,
            BasicBlock b,
            List<BasicBlock> rpo,
            BasicBlock[] idoms,
            Map<BasicBlock, Integer> order
    ) {
        int ia = order.get(a);
        int ib = order.get(b);
        while (ia != ib) {
            while (ia > ib) ia = order.get(idoms[ia]);
            while (ib > ia) ib = order.get(idoms[ib]);
        }
        return rpo.get(ia);
    }

    /**
     * Check whether {@code a} dominates {@code b}, using {@link CommonExts#IDOM}.
     *
     * @param a The possible dominator.
     * @param b The block.
     * @return Whether every path from the entry to {@code b} passes through {@code a}.
     */
    public static boolean dominates(BasicBlock a, BasicBlock b) {
        BasicBlock cur = b;
        while (cur != null) {
            if (cur == a) return true;
            cur = cur.getNullable(CommonExts.IDOM);
        }
        return false;
    }
}
