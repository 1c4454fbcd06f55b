package io.github.eutro.py2ir.ssa;

import io.github.eutro.py2ir.ops.Op;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An operation applied to its arguments.
 */
public final class Insn {
    public final Op op;
    private final List<Value> args;

    public Insn(Op op, List<? extends Value> args) {
        this.op = op;
        this.args = new ArrayList<>(args);
    }

    public Insn(Op op, Value... args) {
        this(op, Arrays.asList(args));
    }

    public List<Value> args() {
        return Collections.unmodifiableList(args);
    }

    public Effect assignTo(Var var) {
        return new Effect(var, this);
    }

    /**
     * Create an effect which assigns nothing. Only stores may do this.
     *
     * @return The effect.
     */
    public Effect store() {
        return new Effect(null, this);
    }

    public Control jumpsTo(Jump... targets) {
        return new Control(this, Arrays.asList(targets));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(op).append('(');
        for (int i = 0; i < args.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(args.get(i));
        }
        return sb.append(')').toString();
    }
}
