package io.github.eutro.py2ir.ops;

import io.github.eutro.py2ir.scope.ScopedName;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The immediate of {@link PyOps#MAKE_FUNCTION}: which hoisted procedure is instantiated,
 * and which cells of the defining procedure it captures.
 */
public final class MakeFunctionInfo {
    public final String localName;
    public final String qualifiedName;
    /**
     * The defining procedure's cells, in the order of the new procedure's free variables.
     */
    public final List<ScopedName> captured;

    public MakeFunctionInfo(String localName, String qualifiedName, List<ScopedName> captured) {
        this.localName = localName;
        this.qualifiedName = qualifiedName;
        this.captured = Collections.unmodifiableList(captured);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MakeFunctionInfo that = (MakeFunctionInfo) o;
        return localName.equals(that.localName)
                && qualifiedName.equals(that.qualifiedName)
                && captured.equals(that.captured);
    }

    @Override
    public int hashCode() {
        return Objects.hash(localName, qualifiedName, captured);
    }

    @Override
    public String toString() {
        return "[\"" + localName + "\", \"" + qualifiedName + "\"]";
    }
}
