package io.github.eutro.py2ir.ssa;

import io.github.eutro.py2ir.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Represents the IR of a Python module.
 */
public final class Module extends ExtHolder {
    public final String name;
    @Nullable
    private Function toplevel;
    private final List<Function> procedures = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public Module(String name) {
        this.name = name;
    }

    /**
     * Get the procedure of the module body, or null if it could not be translated.
     *
     * @return The toplevel procedure.
     */
    @Nullable
    public Function getToplevel() {
        return toplevel;
    }

    public void setToplevel(Function toplevel) {
        this.toplevel = toplevel;
    }

    /**
     * Get every translated procedure, the toplevel first, then hoisted procedures
     * in depth-first order of definition.
     *
     * @return The procedures.
     */
    public List<Function> getProcedures() {
        return Collections.unmodifiableList(procedures);
    }

    public void addProcedure(Function function) {
        procedures.add(function);
    }

    /**
     * Find the first procedure with the given qualified name.
     *
     * @param qualifiedName The qualified name.
     * @return The procedure, if any.
     */
    public Optional<Function> findProcedure(String qualifiedName) {
        for (Function procedure : procedures) {
            if (procedure.qualifiedName.equals(qualifiedName)) return Optional.of(procedure);
        }
        return Optional.empty();
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public void addDiagnostic(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }
}
