package io.github.eutro.py2ir.scope;

import java.util.Objects;

/**
 * The namespace a name reference resolves to.
 * <p>
 * {@link Kind#TOPLEVEL} and {@link Kind#GLOBAL} are module-wide, {@link Kind#LOCAL}
 * is per call frame, and {@link Kind#DEREF} addresses a closure cell by its index in
 * the procedure's cell variables followed by its free variables.
 */
public final class Scope {
    public enum Kind {
        TOPLEVEL,
        GLOBAL,
        LOCAL,
        DEREF,
    }

    public static final Scope TOPLEVEL = new Scope(Kind.TOPLEVEL, -1);
    public static final Scope GLOBAL = new Scope(Kind.GLOBAL, -1);
    public static final Scope LOCAL = new Scope(Kind.LOCAL, -1);

    public final Kind kind;
    /**
     * The cell index, or -1 if this is not a {@link Kind#DEREF} scope.
     */
    public final int index;

    private Scope(Kind kind, int index) {
        this.kind = kind;
        this.index = index;
    }

    public static Scope deref(int index) {
        if (index < 0) throw new IllegalArgumentException("Negative cell index " + index);
        return new Scope(Kind.DEREF, index);
    }

    public boolean isModuleLevel() {
        return kind == Kind.TOPLEVEL || kind == Kind.GLOBAL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Scope scope = (Scope) o;
        return index == scope.index && kind == scope.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, index);
    }

    @Override
    public String toString() {
        return kind == Kind.DEREF ? "DEREF(" + index + ")" : kind.name();
    }
}
