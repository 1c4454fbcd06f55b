package io.github.eutro.py2ir.ssa;

/**
 * A temporary, assigned exactly once, either by an {@link Effect} or as a block parameter.
 * <p>
 * Ids are allocated by {@link Function#newVar()}, in production order.
 */
public final class Var extends Value {
    public final int id;

    Var(int id) {
        this.id = id;
    }

    @Override
    public String toString() {
        return "n" + id;
    }
}
