package io.github.eutro.py2ir.ext;

import io.github.eutro.py2ir.ssa.BasicBlock;

import java.util.List;

/**
 * The exts attached to blocks by the translator and the analysis passes.
 */
public final class CommonExts {
    private CommonExts() {
    }

    /**
     * The immediate dominator of a block. Absent on the entry block.
     *
     * @see io.github.eutro.py2ir.passes.meta.ComputeDoms
     */
    public static final Ext<BasicBlock> IDOM = Ext.named("IDOM");

    /**
     * The predecessors of a block, once per incoming edge.
     *
     * @see io.github.eutro.py2ir.passes.meta.ComputePreds
     */
    public static final Ext<List<BasicBlock>> PREDS = Ext.named("PREDS");

    /**
     * The bytecode offset a block was translated from.
     */
    public static final Ext<Integer> SOURCE_OFFSET = Ext.named("SOURCE_OFFSET");
}
