package io.github.eutro.py2ir.models;

import io.github.eutro.py2ir.code.Constants;
import io.github.eutro.py2ir.ops.OpKey;
import io.github.eutro.py2ir.ops.PyOps;
import io.github.eutro.py2ir.scope.Scope;
import io.github.eutro.py2ir.scope.ScopedName;
import io.github.eutro.py2ir.ssa.Const;
import io.github.eutro.py2ir.ssa.Insn;

import java.util.Optional;

/**
 * Maps IR instructions to the builtins that give them meaning.
 * <p>
 * Instructions without a builtin, like arithmetic, are left to the consumer.
 */
public final class BuiltinLowering {
    private BuiltinLowering() {
    }

    public static Optional<Builtin> of(Insn insn) {
        OpKey key = insn.op.key;
        if (key == PyOps.LOAD) {
            return byScope(PyOps.LOAD.cast(insn.op).arg, Builtin.LOAD_FAST, Builtin.LOAD_GLOBAL, Builtin.LOAD_NAME);
        } else if (key == PyOps.STORE) {
            return byScope(PyOps.STORE.cast(insn.op).arg, Builtin.STORE_FAST, Builtin.STORE_GLOBAL, Builtin.STORE_NAME);
        } else if (key == PyOps.DELETE) {
            return PyOps.DELETE.cast(insn.op).arg.scope.kind == Scope.Kind.LOCAL
                    ? Optional.of(Builtin.NULLIFY_LOCALS)
                    : Optional.empty();
        } else if (key == PyOps.CALL.key) {
            return Optional.of(Builtin.CALL);
        } else if (key == PyOps.CALL_METHOD) {
            return Optional.of(Builtin.CALL_METHOD);
        } else if (key == PyOps.BUILD_TUPLE.key) {
            return Optional.of(Builtin.BUILD_TUPLE);
        } else if (key == PyOps.BUILD_MAP.key) {
            return Optional.of(Builtin.MAKE_DICTIONARY);
        } else if (key == PyOps.IMPORT_NAME) {
            return Optional.of(Builtin.IMPORT_NAME);
        } else if (key == PyOps.IMPORT_FROM) {
            return Optional.of(Builtin.IMPORT_FROM);
        } else if (key == PyOps.MAKE_FUNCTION) {
            return Optional.of(Builtin.MAKE_FUNCTION);
        } else if (key == PyOps.SUBSCRIPT.key) {
            return Optional.of(Builtin.SUBSCRIPT);
        } else if (key == PyOps.GET_AWAITABLE.key) {
            return Optional.of(Builtin.GET_AWAITABLE);
        } else if (key == PyOps.GEN_START_COROUTINE.key) {
            return Optional.of(Builtin.GEN_START_COROUTINE);
        } else if (key == PyOps.YIELD_FROM.key) {
            return Optional.of(Builtin.YIELD_FROM);
        }
        return Optional.empty();
    }

    private static Optional<Builtin> byScope(ScopedName name, Builtin local, Builtin global, Builtin toplevel) {
        switch (name.scope.kind) {
            case LOCAL:
                return Optional.of(local);
            case GLOBAL:
                return Optional.of(global);
            case TOPLEVEL:
                return Optional.of(toplevel);
            case DEREF:
                return Optional.empty();
        }
        throw new IllegalStateException("Unhandled scope " + name.scope);
    }

    /**
     * Get the builtin that materializes a constant operand, if it needs one.
     *
     * @param constant The constant.
     * @return {@link Builtin#MAKE_INT} for integers, {@link Builtin#MAKE_NONE} for None.
     */
    public static Optional<Builtin> ofConstant(Const constant) {
        if (constant.value == null) return Optional.of(Builtin.MAKE_NONE);
        if (Constants.isInt(constant.value)) return Optional.of(Builtin.MAKE_INT);
        return Optional.empty();
    }
}
