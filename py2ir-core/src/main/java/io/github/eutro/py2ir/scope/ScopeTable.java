package io.github.eutro.py2ir.scope;

import java.util.*;

/**
 * The resolved scopes of every name a procedure references. Immutable.
 *
 * @see ScopeResolver
 */
public final class ScopeTable {
    private final Map<String, Scope> names;
    private final List<ScopedName> cells;

    ScopeTable(Map<String, Scope> names, List<ScopedName> cells) {
        this.names = Collections.unmodifiableMap(new LinkedHashMap<>(names));
        this.cells = Collections.unmodifiableList(new ArrayList<>(cells));
    }

    /**
     * Get the scope of a name accessed by a non-closure instruction.
     *
     * @param name The name.
     * @return The scoped name.
     * @throws IllegalArgumentException If the name was never referenced.
     */
    public ScopedName named(String name) {
        Scope scope = names.get(name);
        if (scope == null) {
            throw new IllegalArgumentException("Unresolved name " + name);
        }
        return new ScopedName(scope, name);
    }

    /**
     * Get the closure cell at an index, as used by the closure instructions.
     *
     * @param index The index into cell variables followed by free variables.
     * @return The scoped name.
     */
    public ScopedName cell(int index) {
        if (index < 0 || index >= cells.size()) {
            throw new IllegalArgumentException("No cell at index " + index);
        }
        return cells.get(index);
    }

    /**
     * Find the closure cell with a given name, used to capture it in a nested procedure.
     *
     * @param name The name.
     * @return The cell, if this procedure has one with that name.
     */
    public Optional<ScopedName> cellNamed(String name) {
        for (ScopedName cell : cells) {
            if (cell.name.equals(name)) return Optional.of(cell);
        }
        return Optional.empty();
    }

    public Map<String, Scope> getNames() {
        return names;
    }

    public List<ScopedName> getCells() {
        return cells;
    }

    @Override
    public String toString() {
        return "ScopeTable" + names + cells;
    }
}
