package io.github.eutro.py2ir.ssa;

import org.jetbrains.annotations.Nullable;

/**
 * A record of a procedure which could not be translated.
 */
public final class Diagnostic {
    public final String procedure;
    /**
     * The offset of the offending instruction, or -1 if the failure was not at a single instruction.
     */
    public final int offset;
    @Nullable
    public final String operation;
    public final String reason;

    public Diagnostic(String procedure, int offset, @Nullable String operation, String reason) {
        this.procedure = procedure;
        this.offset = offset;
        this.operation = operation;
        this.reason = reason;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(procedure);
        if (offset >= 0) sb.append(" at offset ").append(offset);
        if (operation != null) sb.append(" (").append(operation).append(')');
        return sb.append(": ").append(reason).toString();
    }
}
