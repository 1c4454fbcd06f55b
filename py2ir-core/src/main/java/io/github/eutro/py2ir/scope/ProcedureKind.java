package io.github.eutro.py2ir.scope;

import io.github.eutro.py2ir.code.CodeObject;

/**
 * What kind of code a procedure was translated from.
 */
public enum ProcedureKind {
    /**
     * The body of a module.
     */
    MODULE,
    /**
     * The body of a class statement, executed once to build the class namespace.
     */
    CLASS_BODY,
    /**
     * A function, lambda, or comprehension body.
     */
    FUNCTION,
    ;

    public static ProcedureKind of(CodeObject code, boolean isModuleBody) {
        if (isModuleBody) return MODULE;
        return code.hasFlag(CodeObject.CO_OPTIMIZED) ? FUNCTION : CLASS_BODY;
    }
}
