package io.github.eutro.py2ir.passes.convert;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The chain of enclosing names of a procedure, starting with the module name. Immutable.
 * <p>
 * Qualified names are derived from this path alone, so hoisting needs no shared counter.
 */
public final class LexicalPath {
    private final List<String> segments;

    private LexicalPath(List<String> segments) {
        this.segments = Collections.unmodifiableList(segments);
    }

    public static LexicalPath root(String moduleName) {
        return new LexicalPath(Collections.singletonList(moduleName));
    }

    /**
     * Extend this path with the local name of a nested procedure.
     *
     * @param name The local name, like {@code f} or {@code <listcomp>}.
     * @return The path of the nested procedure.
     */
    public LexicalPath child(String name) {
        List<String> extended = new ArrayList<>(segments.size() + 1);
        extended.addAll(segments);
        extended.add(name);
        return new LexicalPath(extended);
    }

    public String localName() {
        return segments.get(segments.size() - 1);
    }

    public int depth() {
        return segments.size() - 1;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LexicalPath && segments.equals(((LexicalPath) o).segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    /**
     * @return The dotted qualified name.
     */
    @Override
    public String toString() {
        return String.join(".", segments);
    }
}
