package io.github.eutro.py2ir.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The payload of a {@link Shape#CLOSURE}: the procedure it calls and the cells it captured,
 * which are passed before the caller's arguments.
 */
public final class Closure {
    public final String target;
    public final List<AbstractValue> captured;

    public Closure(String target, List<AbstractValue> captured) {
        this.target = target;
        this.captured = Collections.unmodifiableList(new ArrayList<>(captured));
    }

    @Override
    public String toString() {
        return "<closure " + target + (captured.isEmpty() ? "" : " over " + captured) + ">";
    }
}
