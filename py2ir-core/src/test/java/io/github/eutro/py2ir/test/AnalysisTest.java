package io.github.eutro.py2ir.test;

import io.github.eutro.py2ir.code.CodeBuilder;
import io.github.eutro.py2ir.code.CodeObject;
import io.github.eutro.py2ir.ext.CommonExts;
import io.github.eutro.py2ir.passes.meta.ComputeDoms;
import io.github.eutro.py2ir.passes.meta.VerifyIntegrity;
import io.github.eutro.py2ir.scope.ProcedureKind;
import io.github.eutro.py2ir.ssa.BasicBlock;
import io.github.eutro.py2ir.ssa.Control;
import io.github.eutro.py2ir.ssa.Function;
import io.github.eutro.py2ir.ssa.Jump;
import io.github.eutro.py2ir.util.GraphWalker;
import org.junit.jupiter.api.Test;

import java.util.*;

import static io.github.eutro.py2ir.code.Opcode.*;
import static io.github.eutro.py2ir.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class AnalysisTest {
    @Test
    void testGraphWalkerOrders() throws Throwable {
        // 0 -> 1 -> 3, 0 -> 2 -> 3, 3 -> 0
        Map<Integer, List<Integer>> graph = new HashMap<>();
        graph.put(0, Arrays.asList(1, 2));
        graph.put(1, Collections.singletonList(3));
        graph.put(2, Collections.singletonList(3));
        graph.put(3, Collections.singletonList(0));
        GraphWalker<Integer> walker = new GraphWalker<>(0, graph::get);
        assertEquals(Arrays.asList(0, 1, 3, 2), walker.preOrder());
        assertEquals(Arrays.asList(3, 1, 2, 0), walker.postOrder());
        assertEquals(Arrays.asList(0, 2, 1, 3), walker.reversePostOrder());
    }

    @Test
    void testDominators() throws Throwable {
        CodeObject f = CodeBuilder.function("f")
                .args("x", "y", "z", "t")
                .op(LOAD_FAST, "x")
                .jump(POP_JUMP_IF_FALSE, "z")
                .op(LOAD_FAST, "y")
                .jump(JUMP_IF_TRUE_OR_POP, "ret")
                .label("z")
                .op(LOAD_FAST, "z")
                .jump(JUMP_IF_FALSE_OR_POP, "ret")
                .op(LOAD_FAST, "t")
                .label("ret")
                .op(RETURN_VALUE)
                .build();
        Function func = translate(TranslateTest.moduleDefining(f))
                .findProcedure("dummy.f")
                .orElseThrow(AssertionError::new);
        ComputeDoms.INSTANCE.run(func);
        List<BasicBlock> blocks = func.getBlocks();
        BasicBlock b0 = blocks.get(0), b1 = blocks.get(1), b2 = blocks.get(2), b3 = blocks.get(3), b4 = blocks.get(4);

        assertNull(b0.getNullable(CommonExts.IDOM));
        assertSame(b0, b1.getExtOrThrow(CommonExts.IDOM));
        assertSame(b0, b2.getExtOrThrow(CommonExts.IDOM));
        assertSame(b2, b3.getExtOrThrow(CommonExts.IDOM));
        assertSame(b0, b4.getExtOrThrow(CommonExts.IDOM));
        assertEquals(3, b4.getExtOrThrow(CommonExts.PREDS).size());

        assertTrue(ComputeDoms.dominates(b2, b3));
        assertTrue(ComputeDoms.dominates(b0, b4));
        assertFalse(ComputeDoms.dominates(b2, b4));
        assertFalse(ComputeDoms.dominates(b1, b2));
    }

    @Test
    void testSourceOffsets() throws Throwable {
        Function func = translate(MergeTest.loopCarried()).getToplevel();
        List<Integer> offsets = new ArrayList<>();
        for (BasicBlock block : func.getBlocks()) {
            offsets.add(block.getExtOrThrow(CommonExts.SOURCE_OFFSET));
        }
        assertEquals(Arrays.asList(0, 2, 6, 14), offsets);
    }

    @Test
    void testVerifyRejectsUnterminatedBlock() throws Throwable {
        Function func = new Function("broken", "broken", ProcedureKind.FUNCTION, Collections.emptyList());
        func.newBb();
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> VerifyIntegrity.INSTANCE.run(func));
        assertTrue(e.getMessage().startsWith("block not terminated"), e::getMessage);
    }

    @Test
    void testVerifyRejectsUnassignedTemporary() throws Throwable {
        Function func = new Function("broken", "broken", ProcedureKind.FUNCTION, Collections.emptyList());
        BasicBlock entry = func.newBb();
        entry.setControl(Control.ret(func.newVar()));
        assertThrows(IllegalStateException.class, () -> VerifyIntegrity.INSTANCE.run(func));
    }

    @Test
    void testVerifyRejectsJumpToEntry() throws Throwable {
        Function func = new Function("broken", "broken", ProcedureKind.FUNCTION, Collections.emptyList());
        BasicBlock entry = func.newBb();
        entry.setControl(Control.jmp(new Jump(entry)));
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> VerifyIntegrity.INSTANCE.run(func));
        assertTrue(e.getMessage().startsWith("jump to the entry block"), e::getMessage);
    }
}
