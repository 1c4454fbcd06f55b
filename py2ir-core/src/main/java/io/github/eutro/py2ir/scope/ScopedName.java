package io.github.eutro.py2ir.scope;

import java.util.Objects;

/**
 * A name together with the scope it was resolved to.
 */
public final class ScopedName {
    public final Scope scope;
    public final String name;

    public ScopedName(Scope scope, String name) {
        this.scope = Objects.requireNonNull(scope);
        this.name = Objects.requireNonNull(name);
    }

    /**
     * Render this as a closure cell reference, {@code [index,"name"]}.
     *
     * @return The rendered cell reference.
     */
    public String toCellString() {
        return "[" + scope.index + ",\"" + name + "\"]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScopedName that = (ScopedName) o;
        return scope.equals(that.scope) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scope, name);
    }

    @Override
    public String toString() {
        return scope.kind.name() + "[" + name + "]";
    }
}
