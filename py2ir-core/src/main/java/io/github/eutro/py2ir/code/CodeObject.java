package io.github.eutro.py2ir.code;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A decoded code object: one procedure's instructions, constant pool and name tables.
 *
 * @see CodeBuilder
 */
public final class CodeObject {
    public static final int CO_OPTIMIZED = 0x1;
    public static final int CO_NEWLOCALS = 0x2;
    public static final int CO_VARARGS = 0x4;
    public static final int CO_VARKEYWORDS = 0x8;
    public static final int CO_NESTED = 0x10;
    public static final int CO_GENERATOR = 0x20;
    public static final int CO_COROUTINE = 0x80;
    public static final int CO_ITERABLE_COROUTINE = 0x100;
    public static final int CO_ASYNC_GENERATOR = 0x200;

    public final String name;
    public final int flags;
    public final int argcount;
    public final int posonlyargcount;
    public final int kwonlyargcount;
    public final List<String> varnames;
    public final List<String> names;
    public final List<String> cellvars;
    public final List<String> freevars;
    public final List<Object> consts;
    public final List<Instruction> instructions;

    public CodeObject(
            String name,
            int flags,
            int argcount,
            int posonlyargcount,
            int kwonlyargcount,
            List<String> varnames,
            List<String> names,
            List<String> cellvars,
            List<String> freevars,
            List<Object> consts,
            List<Instruction> instructions
    ) {
        this.name = name;
        this.flags = flags;
        this.argcount = argcount;
        this.posonlyargcount = posonlyargcount;
        this.kwonlyargcount = kwonlyargcount;
        this.varnames = Collections.unmodifiableList(new ArrayList<>(varnames));
        this.names = Collections.unmodifiableList(new ArrayList<>(names));
        this.cellvars = Collections.unmodifiableList(new ArrayList<>(cellvars));
        this.freevars = Collections.unmodifiableList(new ArrayList<>(freevars));
        this.consts = Collections.unmodifiableList(new ArrayList<>(consts));
        this.instructions = Collections.unmodifiableList(new ArrayList<>(instructions));
    }

    public boolean hasFlag(int flag) {
        return (flags & flag) != 0;
    }

    /**
     * Get the names of the formal parameters, in order: positional, keyword-only,
     * then the {@code *args} and {@code **kwargs} collectors if present.
     *
     * @return The parameter names.
     */
    public List<String> parameterNames() {
        int count = argcount + kwonlyargcount;
        if (hasFlag(CO_VARARGS)) count++;
        if (hasFlag(CO_VARKEYWORDS)) count++;
        return varnames.subList(0, Math.min(count, varnames.size()));
    }

    /**
     * Get the cell variables followed by the free variables, indexed by the closure instructions.
     *
     * @return The cell and free variable names.
     */
    public List<String> cellAndFreeVars() {
        List<String> all = new ArrayList<>(cellvars);
        all.addAll(freevars);
        return all;
    }

    /**
     * Get the code objects in the constant pool.
     *
     * @return The nested code objects.
     */
    public List<CodeObject> nestedCode() {
        List<CodeObject> nested = new ArrayList<>();
        for (Object k : consts) {
            if (k instanceof CodeObject) nested.add((CodeObject) k);
        }
        return nested;
    }

    @Override
    public String toString() {
        return "<code " + name + ">";
    }
}
