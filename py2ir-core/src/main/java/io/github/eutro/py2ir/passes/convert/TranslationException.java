package io.github.eutro.py2ir.passes.convert;

import io.github.eutro.py2ir.code.Instruction;
import io.github.eutro.py2ir.code.Opcode;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a procedure cannot be translated. Aborts the translation of that procedure only.
 */
public class TranslationException extends RuntimeException {
    private final int offset;
    @Nullable
    private final Opcode opcode;
    private final String reason;

    public TranslationException(int offset, @Nullable Opcode opcode, String reason) {
        super(format(offset, opcode, reason));
        this.offset = offset;
        this.opcode = opcode;
        this.reason = reason;
    }

    public TranslationException(Instruction insn, String reason) {
        this(insn.offset, insn.opcode, reason);
    }

    public TranslationException(String reason) {
        this(-1, null, reason);
    }

    private static String format(int offset, @Nullable Opcode opcode, String reason) {
        if (offset < 0) return reason;
        return "at offset " + offset + (opcode == null ? "" : " (" + opcode + ")") + ": " + reason;
    }

    /**
     * Get the offset of the offending instruction.
     *
     * @return The offset, or -1 if the failure was not at a single instruction.
     */
    public int getOffset() {
        return offset;
    }

    @Nullable
    public Opcode getOpcode() {
        return opcode;
    }

    public String getReason() {
        return reason;
    }
}
