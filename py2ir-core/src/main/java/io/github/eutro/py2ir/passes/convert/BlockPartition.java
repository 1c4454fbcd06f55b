package io.github.eutro.py2ir.passes.convert;

import io.github.eutro.py2ir.code.Instruction;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The reachable basic blocks of a code object, as ranges of its instructions.
 *
 * @see CfgBuilder
 */
public final class BlockPartition {
    /**
     * A straight-line run of instructions.
     */
    public static final class Range {
        /**
         * The id of the block, equal to its index in {@link #getRanges()}.
         */
        public final int id;
        public final List<Instruction> instructions;
        /**
         * The ids of the normal successors, in ascending offset order.
         */
        List<Integer> successors;
        /**
         * The offset of the instruction after this range, or -1 if there is none.
         */
        final int nextOffset;

        Range(int id, List<Instruction> instructions, int nextOffset) {
            this.id = id;
            this.instructions = instructions;
            this.nextOffset = nextOffset;
        }

        /**
         * Get the offset of the first instruction of this block, or of the block it falls into
         * if this is a {@link #isPreHeader() pre-header}.
         *
         * @return The offset.
         */
        public int startOffset() {
            return isPreHeader() ? nextOffset : instructions.get(0).offset;
        }

        /**
         * Get whether this is the empty block inserted before a loop header at offset 0.
         *
         * @return Whether this block has no instructions.
         */
        public boolean isPreHeader() {
            return instructions.isEmpty();
        }

        public Instruction last() {
            return instructions.get(instructions.size() - 1);
        }

        public List<Integer> getSuccessors() {
            return Collections.unmodifiableList(successors);
        }

        @Override
        public String toString() {
            return "b" + id + "@" + startOffset() + "->" + successors;
        }
    }

    private final List<Range> ranges;
    private final Map<Integer, Range> byOffset;

    BlockPartition(List<Range> ranges, Map<Integer, Range> byOffset) {
        this.ranges = Collections.unmodifiableList(ranges);
        this.byOffset = Collections.unmodifiableMap(byOffset);
    }

    public List<Range> getRanges() {
        return ranges;
    }

    /**
     * Get the block starting at an offset.
     *
     * @param offset The offset.
     * @return The block.
     * @throws IllegalArgumentException If no reachable block starts there.
     */
    public Range at(int offset) {
        Range range = byOffset.get(offset);
        if (range == null) {
            throw new IllegalArgumentException("No reachable block at offset " + offset);
        }
        return range;
    }
}
