package io.github.eutro.py2ir.passes.convert;

import io.github.eutro.py2ir.code.CodeObject;
import io.github.eutro.py2ir.code.Instruction;
import io.github.eutro.py2ir.passes.IRPass;

import java.util.*;

/**
 * Partitions the instructions of a code object into basic blocks.
 * <p>
 * Blocks start at offset 0, at every jump target (including exception handlers), and after every
 * jump or terminator. Only blocks reachable from the entry by normal control flow are kept, so
 * exception handlers and dead code after a return are dropped. Kept blocks are numbered in offset order.
 * <p>
 * If the block at offset 0 is itself a jump target, an empty pre-header is put before it, so that
 * the entry block never has predecessors.
 */
public class CfgBuilder implements IRPass<CodeObject, BlockPartition> {
    /**
     * A singleton instance of this pass.
     */
    public static final CfgBuilder INSTANCE = new CfgBuilder();

    @Override
    public BlockPartition run(CodeObject code) {
        List<Instruction> insns = code.instructions;
        if (insns.isEmpty()) {
            throw new TranslationException("code object " + code.name + " has no instructions");
        }
        Map<Integer, Integer> indexOf = new HashMap<>();
        for (int i = 0; i < insns.size(); i++) {
            Instruction insn = insns.get(i);
            if (i > 0 && insn.offset <= insns.get(i - 1).offset) {
                throw new TranslationException(insn, "offsets are not increasing");
            }
            indexOf.put(insn.offset, i);
        }

        TreeSet<Integer> leaders = new TreeSet<>();
        leaders.add(0);
        for (int i = 0; i < insns.size(); i++) {
            Instruction insn = insns.get(i);
            if (insn.opcode.isJump()) {
                Integer target = indexOf.get(insn.jumpTarget());
                if (target == null) {
                    throw new TranslationException(insn, "jump to offset " + insn.jumpTarget()
                            + ", which is not an instruction boundary");
                }
                leaders.add(target);
            }
            if (insn.opcode.endsBlock() && i + 1 < insns.size()) {
                leaders.add(i + 1);
            }
        }

        // all candidate blocks, keyed by start index
        Map<Integer, List<Instruction>> candidates = new TreeMap<>();
        Integer[] starts = leaders.toArray(new Integer[0]);
        for (int i = 0; i < starts.length; i++) {
            int end = i + 1 < starts.length ? starts[i + 1] : insns.size();
            candidates.put(starts[i], insns.subList(starts[i], end));
        }

        Map<Integer, List<Integer>> succs = new HashMap<>();
        for (Map.Entry<Integer, List<Instruction>> entry : candidates.entrySet()) {
            List<Instruction> block = entry.getValue();
            Instruction last = block.get(block.size() - 1);
            int endIndex = entry.getKey() + block.size();
            List<Integer> out = new ArrayList<>(2);
            if (last.opcode.fallsThrough()) {
                out.add(endIndex);
            }
            if (last.opcode.hasNormalTarget()) {
                out.add(indexOf.get(last.jumpTarget()));
            }
            succs.put(entry.getKey(), out);
        }

        Set<Integer> reachable = new TreeSet<>();
        Deque<Integer> todo = new ArrayDeque<>();
        todo.push(0);
        reachable.add(0);
        while (!todo.isEmpty()) {
            int start = todo.pop();
            for (int succ : succs.get(start)) {
                if (succ >= insns.size()) {
                    List<Instruction> block = candidates.get(start);
                    throw new TranslationException(block.get(block.size() - 1),
                            "control falls off the end of the code");
                }
                if (reachable.add(succ)) todo.push(succ);
            }
        }

        boolean preHeader = false;
        for (int start : reachable) {
            preHeader |= succs.get(start).contains(0);
        }
        Map<Integer, Integer> idOf = new HashMap<>();
        for (int start : reachable) {
            idOf.put(start, idOf.size() + (preHeader ? 1 : 0));
        }
        List<BlockPartition.Range> ranges = new ArrayList<>();
        Map<Integer, BlockPartition.Range> byOffset = new HashMap<>();
        if (preHeader) {
            BlockPartition.Range range = new BlockPartition.Range(0, Collections.emptyList(), insns.get(0).offset);
            range.successors = Collections.singletonList(1);
            ranges.add(range);
        }
        for (int start : reachable) {
            List<Instruction> block = candidates.get(start);
            int endIndex = start + block.size();
            BlockPartition.Range range = new BlockPartition.Range(
                    ranges.size(),
                    block,
                    endIndex < insns.size() ? insns.get(endIndex).offset : -1);
            List<Integer> succIds = new ArrayList<>();
            for (int succ : succs.get(start)) {
                succIds.add(idOf.get(succ));
            }
            Collections.sort(succIds);
            range.successors = succIds;
            ranges.add(range);
            byOffset.put(range.startOffset(), range);
        }
        return new BlockPartition(ranges, byOffset);
    }
}
