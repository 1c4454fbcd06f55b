package io.github.eutro.py2ir.passes.meta;

import io.github.eutro.py2ir.ext.CommonExts;
import io.github.eutro.py2ir.passes.InPlaceIRPass;
import io.github.eutro.py2ir.ssa.BasicBlock;
import io.github.eutro.py2ir.ssa.Function;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes {@link CommonExts#PREDS} for each block, in block order.
 * <p>
 * A block appears once in a predecessor list per edge, so a conditional jump with
 * both edges to the same block contributes it twice. Jumps to blocks outside the
 * procedure are ignored here and reported by {@link VerifyIntegrity}.
 */
public class ComputePreds implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputePreds INSTANCE = new ComputePreds();

    @Override
    public void runInPlace(Function func) {
        Map<BasicBlock, List<BasicBlock>> preds = new IdentityHashMap<>();
        for (BasicBlock block : func.getBlocks()) {
            preds.put(block, new ArrayList<>());
        }
        for (BasicBlock block : func.getBlocks()) {
            for (BasicBlock succ : block.successors()) {
                List<BasicBlock> into = preds.get(succ);
                if (into != null) into.add(block);
            }
        }
        for (Map.Entry<BasicBlock, List<BasicBlock>> entry : preds.entrySet()) {
            entry.getKey().attachExt(CommonExts.PREDS, Collections.unmodifiableList(entry.getValue()));
        }
    }
}
