package io.github.eutro.py2ir.test;

import io.github.eutro.py2ir.code.CodeBuilder;
import io.github.eutro.py2ir.code.CodeObject;
import io.github.eutro.py2ir.passes.convert.BlockPartition;
import io.github.eutro.py2ir.passes.convert.CfgBuilder;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.github.eutro.py2ir.code.Opcode.*;
import static org.junit.jupiter.api.Assertions.*;

public class CfgBuilderTest {
    static List<Integer> starts(BlockPartition partition) {
        List<Integer> starts = new ArrayList<>();
        for (BlockPartition.Range range : partition.getRanges()) {
            starts.add(range.startOffset());
        }
        return starts;
    }

    @Test
    void testLoop() throws Throwable {
        CodeObject code = CodeBuilder.module()
                .op(LOAD_NAME, "xs").op(GET_ITER)
                .label("loop")
                .jump(FOR_ITER, "end")
                .op(STORE_NAME, "x")
                .jump(JUMP_ABSOLUTE, "loop")
                .label("end")
                .op(LOAD_CONST, null).op(RETURN_VALUE)
                .build();
        BlockPartition partition = CfgBuilder.INSTANCE.run(code);
        assertEquals(Arrays.asList(0, 4, 6, 10), starts(partition));
        List<BlockPartition.Range> ranges = partition.getRanges();
        assertEquals(Collections.singletonList(1), ranges.get(0).getSuccessors());
        assertEquals(Arrays.asList(2, 3), ranges.get(1).getSuccessors());
        assertEquals(Collections.singletonList(1), ranges.get(2).getSuccessors());
        assertEquals(Collections.emptyList(), ranges.get(3).getSuccessors());
        assertSame(ranges.get(2), partition.at(6));
        assertEquals(JUMP_ABSOLUTE, ranges.get(2).last().opcode);
    }

    @Test
    void testUnreachableCodeIsElided() throws Throwable {
        CodeObject code = CodeBuilder.module()
                .op(LOAD_CONST, null).op(RETURN_VALUE)
                .label("dead")
                .op(LOAD_CONST, 1).jump(JUMP_ABSOLUTE, "dead")
                .build();
        BlockPartition partition = CfgBuilder.INSTANCE.run(code);
        assertEquals(Collections.singletonList(0), starts(partition));
        assertThrows(IllegalArgumentException.class, () -> partition.at(4));
    }

    @Test
    void testHandlersAreNotSuccessors() throws Throwable {
        CodeObject code = CodeBuilder.function("f")
                .op(LOAD_GLOBAL, "a").jump(SETUP_WITH, "handler").op(POP_TOP)
                .op(POP_BLOCK).op(LOAD_CONST, null).op(DUP_TOP).op(DUP_TOP)
                .op(CALL_FUNCTION, 3).op(POP_TOP)
                .op(LOAD_CONST, null).op(RETURN_VALUE)
                .label("handler")
                .op(WITH_EXCEPT_START).op(RERAISE, 1)
                .build();
        BlockPartition partition = CfgBuilder.INSTANCE.run(code);
        assertEquals(1, partition.getRanges().size());
        assertEquals(11, partition.getRanges().get(0).instructions.size());
    }

    // while True:
    //     f()
    @Test
    void testLoopAtEntryGetsPreHeader() throws Throwable {
        CodeObject code = CodeBuilder.module()
                .label("loop")
                .op(LOAD_NAME, "f").op(CALL_FUNCTION, 0).op(POP_TOP)
                .jump(JUMP_ABSOLUTE, "loop")
                .build();
        BlockPartition partition = CfgBuilder.INSTANCE.run(code);
        List<BlockPartition.Range> ranges = partition.getRanges();
        assertEquals(2, ranges.size());
        assertTrue(ranges.get(0).isPreHeader());
        assertEquals(Collections.singletonList(1), ranges.get(0).getSuccessors());
        assertFalse(ranges.get(1).isPreHeader());
        assertEquals(Collections.singletonList(1), ranges.get(1).getSuccessors());
        assertSame(ranges.get(1), partition.at(0));
    }
}
