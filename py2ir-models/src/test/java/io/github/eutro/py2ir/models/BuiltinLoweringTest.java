package io.github.eutro.py2ir.models;

import io.github.eutro.py2ir.code.ConstCollection;
import io.github.eutro.py2ir.ops.MakeFunctionInfo;
import io.github.eutro.py2ir.ops.PyOps;
import io.github.eutro.py2ir.scope.Scope;
import io.github.eutro.py2ir.scope.ScopedName;
import io.github.eutro.py2ir.ssa.Const;
import io.github.eutro.py2ir.ssa.Insn;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Collections;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class BuiltinLoweringTest {
    static Optional<Builtin> lower(Insn insn) {
        return BuiltinLowering.of(insn);
    }

    @Test
    void testScopedNames() throws Throwable {
        ScopedName local = new ScopedName(Scope.LOCAL, "x");
        ScopedName global = new ScopedName(Scope.GLOBAL, "x");
        ScopedName toplevel = new ScopedName(Scope.TOPLEVEL, "x");
        ScopedName cell = new ScopedName(Scope.deref(0), "x");

        assertEquals(Optional.of(Builtin.LOAD_FAST), lower(new Insn(PyOps.LOAD.create(local))));
        assertEquals(Optional.of(Builtin.LOAD_GLOBAL), lower(new Insn(PyOps.LOAD.create(global))));
        assertEquals(Optional.of(Builtin.LOAD_NAME), lower(new Insn(PyOps.LOAD.create(toplevel))));
        assertEquals(Optional.empty(), lower(new Insn(PyOps.LOAD.create(cell))));

        assertEquals(Optional.of(Builtin.STORE_FAST), lower(new Insn(PyOps.STORE.create(local), Const.NONE)));
        assertEquals(Optional.of(Builtin.STORE_GLOBAL), lower(new Insn(PyOps.STORE.create(global), Const.NONE)));
        assertEquals(Optional.of(Builtin.STORE_NAME), lower(new Insn(PyOps.STORE.create(toplevel), Const.NONE)));

        assertEquals(Optional.of(Builtin.NULLIFY_LOCALS), lower(new Insn(PyOps.DELETE.create(local))));
        assertEquals(Optional.empty(), lower(new Insn(PyOps.DELETE.create(global))));
    }

    @Test
    void testOperations() throws Throwable {
        assertEquals(Optional.of(Builtin.CALL), lower(new Insn(PyOps.CALL, Const.NONE)));
        assertEquals(Optional.of(Builtin.CALL_METHOD), lower(new Insn(PyOps.CALL_METHOD.create("m"), Const.NONE)));
        assertEquals(Optional.of(Builtin.BUILD_TUPLE), lower(new Insn(PyOps.BUILD_TUPLE)));
        assertEquals(Optional.of(Builtin.MAKE_DICTIONARY), lower(new Insn(PyOps.BUILD_MAP)));
        assertEquals(Optional.of(Builtin.IMPORT_NAME),
                lower(new Insn(PyOps.IMPORT_NAME.create("os"), Const.NONE, Const.of(0))));
        assertEquals(Optional.of(Builtin.IMPORT_FROM), lower(new Insn(PyOps.IMPORT_FROM.create("path"), Const.NONE)));
        assertEquals(Optional.of(Builtin.MAKE_FUNCTION), lower(new Insn(PyOps.MAKE_FUNCTION.create(
                new MakeFunctionInfo("f", "m.f", Collections.emptyList())),
                Const.NONE, Const.NONE, Const.NONE, Const.NONE)));
        assertEquals(Optional.of(Builtin.SUBSCRIPT), lower(new Insn(PyOps.SUBSCRIPT, Const.NONE, Const.of(0))));
        assertEquals(Optional.of(Builtin.GET_AWAITABLE), lower(new Insn(PyOps.GET_AWAITABLE, Const.NONE)));
        assertEquals(Optional.of(Builtin.GEN_START_COROUTINE), lower(new Insn(PyOps.GEN_START_COROUTINE)));
        assertEquals(Optional.of(Builtin.YIELD_FROM), lower(new Insn(PyOps.YIELD_FROM, Const.NONE, Const.NONE)));

        assertEquals(Optional.empty(), lower(new Insn(PyOps.BINARY.create("Add"), Const.of(1), Const.of(2))));
        assertEquals(Optional.empty(), lower(new Insn(PyOps.BUILD_LIST)));
    }

    @Test
    void testConstants() throws Throwable {
        assertEquals(Optional.of(Builtin.MAKE_NONE), BuiltinLowering.ofConstant(Const.NONE));
        assertEquals(Optional.of(Builtin.MAKE_INT), BuiltinLowering.ofConstant(Const.of(3)));
        assertEquals(Optional.of(Builtin.MAKE_INT), BuiltinLowering.ofConstant(Const.of(BigInteger.TEN.pow(30))));
        assertEquals(Optional.empty(), BuiltinLowering.ofConstant(Const.of("s")));
        assertEquals(Optional.empty(), BuiltinLowering.ofConstant(Const.of(ConstCollection.tuple(1))));
    }

    @Test
    void testModelNames() throws Throwable {
        assertEquals(20, Builtin.values().length);
        assertEquals("call_method", Builtin.CALL_METHOD.modelName);
        assertEquals("gen_start_coroutine", Builtin.GEN_START_COROUTINE.toString());
    }
}
