package io.github.eutro.py2ir.test;

import io.github.eutro.py2ir.code.CodeBuilder;
import io.github.eutro.py2ir.code.CodeObject;
import io.github.eutro.py2ir.ops.MakeFunctionInfo;
import io.github.eutro.py2ir.ops.PyOps;
import io.github.eutro.py2ir.scope.ProcedureKind;
import io.github.eutro.py2ir.scope.Scope;
import io.github.eutro.py2ir.scope.ScopedName;
import io.github.eutro.py2ir.ssa.Effect;
import io.github.eutro.py2ir.ssa.Function;
import io.github.eutro.py2ir.ssa.Module;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static io.github.eutro.py2ir.code.Opcode.*;
import static io.github.eutro.py2ir.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class TranslateTest {
    // def my_fun(x, y):
    //     print(x)
    //     print(y)
    //     z = x + y
    //     return z
    //
    // a = 10
    // z = my_fun(42, a)
    // print(z)
    static CodeObject myFunModule() {
        CodeObject myFun = CodeBuilder.function("my_fun")
                .args("x", "y")
                .op(LOAD_GLOBAL, "print").op(LOAD_FAST, "x").op(CALL_FUNCTION, 1).op(POP_TOP)
                .op(LOAD_GLOBAL, "print").op(LOAD_FAST, "y").op(CALL_FUNCTION, 1).op(POP_TOP)
                .op(LOAD_FAST, "x").op(LOAD_FAST, "y").op(BINARY_ADD).op(STORE_FAST, "z")
                .op(LOAD_FAST, "z").op(RETURN_VALUE)
                .build();
        return CodeBuilder.module()
                .op(LOAD_CONST, myFun).op(LOAD_CONST, "my_fun").op(MAKE_FUNCTION, 0).op(STORE_NAME, "my_fun")
                .op(LOAD_CONST, 10).op(STORE_NAME, "a")
                .op(LOAD_NAME, "my_fun").op(LOAD_CONST, 42).op(LOAD_NAME, "a").op(CALL_FUNCTION, 2)
                .op(STORE_NAME, "z")
                .op(LOAD_NAME, "print").op(LOAD_NAME, "z").op(CALL_FUNCTION, 1).op(POP_TOP)
                .op(LOAD_CONST, null).op(RETURN_VALUE)
                .build();
    }

    @Test
    void testMyFun() throws Throwable {
        assertEquals(module(
                proc("toplevel",
                        "b0:",
                        "n0 <- $MakeFunction[\"my_fun\", \"dummy.my_fun\"](None, None, None, None)",
                        "TOPLEVEL[my_fun] <- n0",
                        "TOPLEVEL[a] <- 10",
                        "n1 <- TOPLEVEL[my_fun]",
                        "n2 <- TOPLEVEL[a]",
                        "n3 <- $Call(n1, 42, n2)",
                        "TOPLEVEL[z] <- n3",
                        "n4 <- TOPLEVEL[print]",
                        "n5 <- TOPLEVEL[z]",
                        "n6 <- $Call(n4, n5)",
                        "return None"),
                proc("dummy.my_fun",
                        "b0:",
                        "n0 <- GLOBAL[print]",
                        "n1 <- LOCAL[x]",
                        "n2 <- $Call(n0, n1)",
                        "n3 <- GLOBAL[print]",
                        "n4 <- LOCAL[y]",
                        "n5 <- $Call(n3, n4)",
                        "n6 <- LOCAL[x]",
                        "n7 <- LOCAL[y]",
                        "n8 <- $Binary.Add(n6, n7)",
                        "LOCAL[z] <- n8",
                        "n9 <- LOCAL[z]",
                        "return n9")
        ), display(myFunModule()));
    }

    @Test
    void testProcedureMetadata() throws Throwable {
        Module module = translate(myFunModule());
        assertEquals("dummy", module.name);
        assertEquals(2, module.getProcedures().size());
        assertSame(module.getToplevel(), module.getProcedures().get(0));
        assertEquals(ProcedureKind.MODULE, module.getToplevel().kind);

        Function myFun = module.findProcedure("dummy.my_fun").orElseThrow(AssertionError::new);
        assertEquals("my_fun", myFun.localName);
        assertEquals(ProcedureKind.FUNCTION, myFun.kind);
        assertEquals(Arrays.asList("x", "y"), myFun.params);
        assertTrue(myFun.isFrozen());
    }

    // def f(x, y):
    //     if coin():
    //         return x
    //     else:
    //         return y
    @Test
    void testIfElse() throws Throwable {
        CodeObject f = CodeBuilder.function("f")
                .args("x", "y")
                .op(LOAD_GLOBAL, "coin").op(CALL_FUNCTION, 0)
                .jump(POP_JUMP_IF_FALSE, "else")
                .op(LOAD_FAST, "x").op(RETURN_VALUE)
                .label("else")
                .op(LOAD_FAST, "y").op(RETURN_VALUE)
                .build();
        Module module = translate(moduleDefining(f));
        assertEquals(proc("dummy.f",
                "b0:",
                "n0 <- GLOBAL[coin]",
                "n1 <- $Call(n0)",
                "if n1 then jmp b1 else jmp b2",
                "",
                "b1:",
                "n2 <- LOCAL[x]",
                "return n2",
                "",
                "b2:",
                "n3 <- LOCAL[y]",
                "return n3"
        ), display(module, "dummy.f"));
    }

    // for x in xs:
    //     print(x)
    @Test
    void testForLoop() throws Throwable {
        CodeObject body = CodeBuilder.module()
                .op(LOAD_NAME, "xs").op(GET_ITER)
                .label("loop")
                .jump(FOR_ITER, "end")
                .op(STORE_NAME, "x")
                .op(LOAD_NAME, "print").op(LOAD_NAME, "x").op(CALL_FUNCTION, 1).op(POP_TOP)
                .jump(JUMP_ABSOLUTE, "loop")
                .label("end")
                .op(LOAD_CONST, null).op(RETURN_VALUE)
                .build();
        assertEquals(module(proc("toplevel",
                "b0:",
                "n0 <- TOPLEVEL[xs]",
                "n1 <- $GetIter(n0)",
                "jmp b1",
                "",
                "b1:",
                "n2 <- $NextIter(n1)",
                "n3 <- $HasNextIter(n1)",
                "if n3 then jmp b2 else jmp b3",
                "",
                "b2:",
                "TOPLEVEL[x] <- n2",
                "n4 <- TOPLEVEL[print]",
                "n5 <- TOPLEVEL[x]",
                "n6 <- $Call(n4, n5)",
                "jmp b1",
                "",
                "b3:",
                "return None"
        )), display(body));
    }

    // while True:
    //     f()
    @Test
    void testLoopAtEntry() throws Throwable {
        CodeObject body = CodeBuilder.module()
                .label("loop")
                .op(LOAD_NAME, "f").op(CALL_FUNCTION, 0).op(POP_TOP)
                .jump(JUMP_ABSOLUTE, "loop")
                .build();
        assertEquals(module(proc("toplevel",
                "b0:",
                "jmp b1",
                "",
                "b1:",
                "n0 <- TOPLEVEL[f]",
                "n1 <- $Call(n0)",
                "jmp b1"
        )), display(body));
    }

    // def f(x, y, z, t):
    //     return (x and y) or (z and t)
    @Test
    void testShortCircuit() throws Throwable {
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
        Module module = translate(moduleDefining(f));
        assertEquals(proc("dummy.f",
                "b0:",
                "n0 <- LOCAL[x]",
                "if n0 then jmp b1 else jmp b2",
                "",
                "b1:",
                "n1 <- LOCAL[y]",
                "if n1 then jmp b4(n1) else jmp b2",
                "",
                "b2:",
                "n2 <- LOCAL[z]",
                "if n2 then jmp b3 else jmp b4(n2)",
                "",
                "b3:",
                "n3 <- LOCAL[t]",
                "jmp b4(n3)",
                "",
                "b4(n4):",
                "return n4"
        ), display(module, "dummy.f"));
    }

    // def f():
    //     with a as x:
    //         with b as y:
    //             return g()
    @Test
    void testNestedWithReturn() throws Throwable {
        CodeObject f = CodeBuilder.function("f")
                .op(LOAD_GLOBAL, "a").jump(SETUP_WITH, "outerHandler").op(STORE_FAST, "x")
                .op(LOAD_GLOBAL, "b").jump(SETUP_WITH, "innerHandler").op(STORE_FAST, "y")
                .op(LOAD_GLOBAL, "g").op(CALL_FUNCTION, 0)
                .op(POP_BLOCK).op(ROT_TWO).op(LOAD_CONST, null).op(DUP_TOP).op(DUP_TOP)
                .op(CALL_FUNCTION, 3).op(POP_TOP)
                .op(POP_BLOCK).op(ROT_TWO).op(LOAD_CONST, null).op(DUP_TOP).op(DUP_TOP)
                .op(CALL_FUNCTION, 3).op(POP_TOP)
                .op(RETURN_VALUE)
                .label("innerHandler")
                .op(WITH_EXCEPT_START).op(RERAISE, 1)
                .label("outerHandler")
                .op(WITH_EXCEPT_START).op(RERAISE, 1)
                .build();
        Module module = translate(moduleDefining(f));
        assertEquals(proc("dummy.f",
                "b0:",
                "n0 <- GLOBAL[a]",
                "n1 <- $CallMethod[__enter__](n0)",
                "LOCAL[x] <- n1",
                "n2 <- GLOBAL[b]",
                "n3 <- $CallMethod[__enter__](n2)",
                "LOCAL[y] <- n3",
                "n4 <- GLOBAL[g]",
                "n5 <- $Call(n4)",
                "n6 <- $CallMethod[__exit__](n2, None, None, None)",
                "n7 <- $CallMethod[__exit__](n0, None, None, None)",
                "return n5"
        ), display(module, "dummy.f"));
    }

    // def f():
    //     with a:
    //         pass
    @Test
    void testWithNormalExit() throws Throwable {
        CodeObject f = CodeBuilder.function("f")
                .op(LOAD_GLOBAL, "a").jump(SETUP_WITH, "handler").op(POP_TOP)
                .op(POP_BLOCK).op(LOAD_CONST, null).op(DUP_TOP).op(DUP_TOP)
                .op(CALL_FUNCTION, 3).op(POP_TOP)
                .op(LOAD_CONST, null).op(RETURN_VALUE)
                .label("handler")
                .op(WITH_EXCEPT_START).op(RERAISE, 1)
                .build();
        Module module = translate(moduleDefining(f));
        assertEquals(proc("dummy.f",
                "b0:",
                "n0 <- GLOBAL[a]",
                "n1 <- $CallMethod[__enter__](n0)",
                "n2 <- $CallMethod[__exit__](n0, None, None, None)",
                "return None"
        ), display(module, "dummy.f"));
    }

    // def f(xs):
    //     for x in xs:
    //         with a:
    //             with b:
    //                 if x:
    //                     continue
    //                 if g():
    //                     break
    @Test
    void testWithExitsInLoop() throws Throwable {
        CodeObject f = CodeBuilder.function("f")
                .args("xs")
                .op(LOAD_FAST, "xs").op(GET_ITER)
                .label("loop")
                .jump(FOR_ITER, "end")
                .op(STORE_FAST, "x")
                .op(LOAD_GLOBAL, "a").jump(SETUP_WITH, "outerHandler").op(POP_TOP)
                .op(LOAD_GLOBAL, "b").jump(SETUP_WITH, "innerHandler").op(POP_TOP)
                .op(LOAD_FAST, "x").jump(POP_JUMP_IF_FALSE, "notContinue")
                // continue
                .op(POP_BLOCK).op(LOAD_CONST, null).op(DUP_TOP).op(DUP_TOP).op(CALL_FUNCTION, 3).op(POP_TOP)
                .op(POP_BLOCK).op(LOAD_CONST, null).op(DUP_TOP).op(DUP_TOP).op(CALL_FUNCTION, 3).op(POP_TOP)
                .jump(JUMP_ABSOLUTE, "loop")
                .label("notContinue")
                .op(LOAD_GLOBAL, "g").op(CALL_FUNCTION, 0).jump(POP_JUMP_IF_FALSE, "notBreak")
                // break
                .op(POP_BLOCK).op(LOAD_CONST, null).op(DUP_TOP).op(DUP_TOP).op(CALL_FUNCTION, 3).op(POP_TOP)
                .op(POP_BLOCK).op(LOAD_CONST, null).op(DUP_TOP).op(DUP_TOP).op(CALL_FUNCTION, 3).op(POP_TOP)
                .op(POP_TOP)
                .jump(JUMP_ABSOLUTE, "end")
                .label("notBreak")
                .op(POP_BLOCK).op(LOAD_CONST, null).op(DUP_TOP).op(DUP_TOP).op(CALL_FUNCTION, 3).op(POP_TOP)
                .op(POP_BLOCK).op(LOAD_CONST, null).op(DUP_TOP).op(DUP_TOP).op(CALL_FUNCTION, 3).op(POP_TOP)
                .jump(JUMP_ABSOLUTE, "loop")
                .label("innerHandler")
                .op(WITH_EXCEPT_START).op(RERAISE, 1)
                .label("outerHandler")
                .op(WITH_EXCEPT_START).op(RERAISE, 1)
                .label("end")
                .op(LOAD_CONST, null).op(RETURN_VALUE)
                .build();
        Module module = translate(moduleDefining(f));
        assertEquals(0, module.getDiagnostics().size());
        assertEquals(proc("dummy.f",
                "b0:",
                "n0 <- LOCAL[xs]",
                "n1 <- $GetIter(n0)",
                "jmp b1",
                "",
                "b1:",
                "n2 <- $NextIter(n1)",
                "n3 <- $HasNextIter(n1)",
                "if n3 then jmp b2 else jmp b7",
                "",
                "b2:",
                "LOCAL[x] <- n2",
                "n4 <- GLOBAL[a]",
                "n5 <- $CallMethod[__enter__](n4)",
                "n6 <- GLOBAL[b]",
                "n7 <- $CallMethod[__enter__](n6)",
                "n8 <- LOCAL[x]",
                "if n8 then jmp b3 else jmp b4",
                "",
                "b3:",
                "n9 <- $CallMethod[__exit__](n6, None, None, None)",
                "n10 <- $CallMethod[__exit__](n4, None, None, None)",
                "jmp b1",
                "",
                "b4:",
                "n11 <- GLOBAL[g]",
                "n12 <- $Call(n11)",
                "if n12 then jmp b5 else jmp b6",
                "",
                "b5:",
                "n13 <- $CallMethod[__exit__](n6, None, None, None)",
                "n14 <- $CallMethod[__exit__](n4, None, None, None)",
                "jmp b7",
                "",
                "b6:",
                "n15 <- $CallMethod[__exit__](n6, None, None, None)",
                "n16 <- $CallMethod[__exit__](n4, None, None, None)",
                "jmp b1",
                "",
                "b7:",
                "return None"
        ), display(module, "dummy.f"));
    }

    // async def f():
    //     async with a as x:
    //         await g()
    @Test
    void testAsyncWith() throws Throwable {
        CodeObject f = CodeBuilder.function("f")
                .flags(CodeObject.CO_COROUTINE)
                .op(GEN_START, 1)
                .op(LOAD_GLOBAL, "a").op(BEFORE_ASYNC_WITH)
                .op(GET_AWAITABLE).op(LOAD_CONST, null).op(YIELD_FROM)
                .jump(SETUP_ASYNC_WITH, "handler").op(STORE_FAST, "x")
                .op(LOAD_GLOBAL, "g").op(CALL_FUNCTION, 0)
                .op(GET_AWAITABLE).op(LOAD_CONST, null).op(YIELD_FROM).op(POP_TOP)
                .op(POP_BLOCK).op(LOAD_CONST, null).op(DUP_TOP).op(DUP_TOP).op(CALL_FUNCTION, 3)
                .op(GET_AWAITABLE).op(LOAD_CONST, null).op(YIELD_FROM).op(POP_TOP)
                .op(LOAD_CONST, null).op(RETURN_VALUE)
                .label("handler")
                .op(WITH_EXCEPT_START).op(RERAISE, 1)
                .build();
        Module module = translate(moduleDefining(f));
        assertEquals(0, module.getDiagnostics().size());
        assertEquals(proc("dummy.f",
                "b0:",
                "n0 <- $GenStartCoroutine()",
                "n1 <- GLOBAL[a]",
                "n2 <- $CallMethod[__aenter__](n1)",
                "n3 <- $GetAwaitable(n2)",
                "n4 <- $YieldFrom(n3, None)",
                "LOCAL[x] <- n4",
                "n5 <- GLOBAL[g]",
                "n6 <- $Call(n5)",
                "n7 <- $GetAwaitable(n6)",
                "n8 <- $YieldFrom(n7, None)",
                "n9 <- $CallMethod[__aexit__](n1, None, None, None)",
                "n10 <- $GetAwaitable(n9)",
                "n11 <- $YieldFrom(n10, None)",
                "return None"
        ), display(module, "dummy.f"));
    }

    // def outer():
    //     x = 1
    //     class C:
    //         y = x
    //     def gen():
    //         yield x
    //     del x
    @Test
    void testClassDerefYieldAndDeleteDeref() throws Throwable {
        CodeObject classBody = CodeBuilder.classBody("C")
                .freevars("x")
                .op(LOAD_NAME, "__name__").op(STORE_NAME, "__module__")
                .op(LOAD_CONST, "outer.<locals>.C").op(STORE_NAME, "__qualname__")
                .op(LOAD_CLASSDEREF, "x").op(STORE_NAME, "y")
                .op(LOAD_CONST, null).op(RETURN_VALUE)
                .build();
        CodeObject gen = CodeBuilder.function("gen")
                .flags(CodeObject.CO_GENERATOR)
                .freevars("x")
                .op(GEN_START, 0)
                .op(LOAD_DEREF, "x").op(YIELD_VALUE).op(POP_TOP)
                .op(LOAD_CONST, null).op(RETURN_VALUE)
                .build();
        CodeObject outer = CodeBuilder.function("outer")
                .cellvars("x")
                .op(LOAD_CONST, 1).op(STORE_DEREF, "x")
                .op(LOAD_BUILD_CLASS)
                .op(LOAD_CLOSURE, "x").op(BUILD_TUPLE, 1)
                .op(LOAD_CONST, classBody).op(LOAD_CONST, "outer.<locals>.C").op(MAKE_FUNCTION, 0x08)
                .op(LOAD_CONST, "C").op(CALL_FUNCTION, 2)
                .op(STORE_FAST, "C")
                .op(LOAD_CLOSURE, "x").op(BUILD_TUPLE, 1)
                .op(LOAD_CONST, gen).op(LOAD_CONST, "outer.<locals>.gen").op(MAKE_FUNCTION, 0x08)
                .op(STORE_FAST, "gen")
                .op(DELETE_DEREF, "x")
                .op(LOAD_CONST, null).op(RETURN_VALUE)
                .build();
        Module module = translate(moduleDefining(outer));
        assertEquals(0, module.getDiagnostics().size());
        assertEquals(proc("dummy.outer",
                "b0:",
                "n0 <- $StoreDeref[0,\"x\"](1)",
                "n1 <- $LoadClosure[0,\"x\"]()",
                "n2 <- $BuildTuple(n1)",
                "n3 <- $MakeFunction[\"C\", \"dummy.outer.C\"](None, None, None, n2)",
                "n4 <- $BuildClass(n3, \"C\")",
                "LOCAL[C] <- n4",
                "n5 <- $LoadClosure[0,\"x\"]()",
                "n6 <- $BuildTuple(n5)",
                "n7 <- $MakeFunction[\"gen\", \"dummy.outer.gen\"](None, None, None, n6)",
                "LOCAL[gen] <- n7",
                "n8 <- $DeleteDeref[0,\"x\"]()",
                "return None"
        ), display(module, "dummy.outer"));
        assertEquals(proc("dummy.outer.C",
                "b0:",
                "n0 <- TOPLEVEL[__name__]",
                "TOPLEVEL[__module__] <- n0",
                "TOPLEVEL[__qualname__] <- \"outer.<locals>.C\"",
                "n1 <- $LoadClassDeref[0,\"x\"]()",
                "TOPLEVEL[y] <- n1",
                "return None"
        ), display(module, "dummy.outer.C"));
        assertEquals(proc("dummy.outer.gen",
                "b0:",
                "n0 <- $LoadDeref[0,\"x\"]()",
                "n1 <- $Yield(n0)",
                "return None"
        ), display(module, "dummy.outer.gen"));
    }

    // def outer():
    //     x = 1
    //     def inner():
    //         return x
    //     return inner
    @Test
    void testClosure() throws Throwable {
        CodeObject inner = CodeBuilder.function("inner")
                .freevars("x")
                .op(LOAD_DEREF, "x").op(RETURN_VALUE)
                .build();
        CodeObject outer = CodeBuilder.function("outer")
                .cellvars("x")
                .op(LOAD_CONST, 1).op(STORE_DEREF, "x")
                .op(LOAD_CLOSURE, "x").op(BUILD_TUPLE, 1)
                .op(LOAD_CONST, inner).op(LOAD_CONST, "outer.<locals>.inner").op(MAKE_FUNCTION, 0x08)
                .op(STORE_FAST, "inner")
                .op(LOAD_FAST, "inner").op(RETURN_VALUE)
                .build();
        Module module = translate(moduleDefining(outer));
        assertEquals(0, module.getDiagnostics().size());
        assertEquals(proc("dummy.outer",
                "b0:",
                "n0 <- $StoreDeref[0,\"x\"](1)",
                "n1 <- $LoadClosure[0,\"x\"]()",
                "n2 <- $BuildTuple(n1)",
                "n3 <- $MakeFunction[\"inner\", \"dummy.outer.inner\"](None, None, None, n2)",
                "LOCAL[inner] <- n3",
                "n4 <- LOCAL[inner]",
                "return n4"
        ), display(module, "dummy.outer"));
        assertEquals(proc("dummy.outer.inner",
                "b0:",
                "n0 <- $LoadDeref[0,\"x\"]()",
                "return n0"
        ), display(module, "dummy.outer.inner"));

        Effect make = module.findProcedure("dummy.outer").orElseThrow(AssertionError::new)
                .getEntry().getEffects().get(3);
        MakeFunctionInfo info = PyOps.MAKE_FUNCTION.cast(make.insn().op).arg;
        assertEquals("inner", info.localName);
        assertEquals("dummy.outer.inner", info.qualifiedName);
        assertEquals(Collections.singletonList(new ScopedName(Scope.deref(0), "x")), info.captured);
    }

    // r = [v for v in xs]
    @Test
    void testListComprehension() throws Throwable {
        CodeObject listcomp = CodeBuilder.function("<listcomp>")
                .args(".0")
                .op(BUILD_LIST, 0)
                .op(LOAD_FAST, ".0")
                .label("loop")
                .jump(FOR_ITER, "end")
                .op(STORE_FAST, "v")
                .op(LOAD_FAST, "v")
                .op(LIST_APPEND, 2)
                .jump(JUMP_ABSOLUTE, "loop")
                .label("end")
                .op(RETURN_VALUE)
                .build();
        CodeObject body = CodeBuilder.module()
                .op(LOAD_CONST, listcomp).op(LOAD_CONST, "<listcomp>").op(MAKE_FUNCTION, 0)
                .op(LOAD_NAME, "xs").op(GET_ITER).op(CALL_FUNCTION, 1)
                .op(STORE_NAME, "r")
                .op(LOAD_CONST, null).op(RETURN_VALUE)
                .build();
        assertEquals(module(
                proc("toplevel",
                        "b0:",
                        "n0 <- $MakeFunction[\"<listcomp>\", \"dummy.<listcomp>\"](None, None, None, None)",
                        "n1 <- TOPLEVEL[xs]",
                        "n2 <- $GetIter(n1)",
                        "n3 <- $Call(n0, n2)",
                        "TOPLEVEL[r] <- n3",
                        "return None"),
                proc("dummy.<listcomp>",
                        "b0:",
                        "n0 <- LOCAL[.0]",
                        "n1 <- $BuildList()",
                        "jmp b1",
                        "",
                        "b1:",
                        "n2 <- $NextIter(n0)",
                        "n3 <- $HasNextIter(n0)",
                        "if n3 then jmp b2 else jmp b3",
                        "",
                        "b2:",
                        "LOCAL[v] <- n2",
                        "n4 <- LOCAL[v]",
                        "n5 <- $ListAppend(n1, n4)",
                        "jmp b1",
                        "",
                        "b3:",
                        "return n1")
        ), display(body));
    }

    // class C(B):
    //     x = 1
    @Test
    void testClassDefinition() throws Throwable {
        CodeObject classBody = CodeBuilder.classBody("C")
                .op(LOAD_NAME, "__name__").op(STORE_NAME, "__module__")
                .op(LOAD_CONST, "C").op(STORE_NAME, "__qualname__")
                .op(LOAD_CONST, 1).op(STORE_NAME, "x")
                .op(LOAD_CONST, null).op(RETURN_VALUE)
                .build();
        CodeObject body = CodeBuilder.module()
                .op(LOAD_BUILD_CLASS)
                .op(LOAD_CONST, classBody).op(LOAD_CONST, "C").op(MAKE_FUNCTION, 0)
                .op(LOAD_CONST, "C").op(LOAD_NAME, "B").op(CALL_FUNCTION, 3)
                .op(STORE_NAME, "C")
                .op(LOAD_CONST, null).op(RETURN_VALUE)
                .build();
        Module module = translate(body);
        assertEquals(proc("toplevel",
                "b0:",
                "n0 <- $MakeFunction[\"C\", \"dummy.C\"](None, None, None, None)",
                "n1 <- TOPLEVEL[B]",
                "n2 <- $BuildClass(n0, \"C\", n1)",
                "TOPLEVEL[C] <- n2",
                "return None"
        ), display(module, "dummy"));
        assertEquals(proc("dummy.C",
                "b0:",
                "n0 <- TOPLEVEL[__name__]",
                "TOPLEVEL[__module__] <- n0",
                "TOPLEVEL[__qualname__] <- \"C\"",
                "TOPLEVEL[x] <- 1",
                "return None"
        ), display(module, "dummy.C"));
        assertEquals(ProcedureKind.CLASS_BODY,
                module.findProcedure("dummy.C").orElseThrow(AssertionError::new).kind);
    }

    /**
     * A module body which defines a single function and returns.
     */
    static CodeObject moduleDefining(CodeObject function) {
        return CodeBuilder.module()
                .op(LOAD_CONST, function).op(LOAD_CONST, function.name).op(MAKE_FUNCTION, 0)
                .op(STORE_NAME, function.name)
                .op(LOAD_CONST, null).op(RETURN_VALUE)
                .build();
    }
}
