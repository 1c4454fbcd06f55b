package io.github.eutro.py2ir.ssa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An edge of a {@link Control} instruction: the target block and the arguments
 * bound to its parameters.
 */
public final class Jump {
    public final BasicBlock target;
    private List<Value> args = Collections.emptyList();

    public Jump(BasicBlock target) {
        this.target = target;
    }

    public Jump(BasicBlock target, List<? extends Value> args) {
        this.target = target;
        setArgs(args);
    }

    public List<Value> getArgs() {
        return args;
    }

    public void setArgs(List<? extends Value> args) {
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("b").append(target.id);
        if (!args.isEmpty()) {
            sb.append('(');
            for (int i = 0; i < args.size(); i++) {
                if (i != 0) sb.append(", ");
                sb.append(args.get(i));
            }
            sb.append(')');
        }
        return sb.toString();
    }
}
