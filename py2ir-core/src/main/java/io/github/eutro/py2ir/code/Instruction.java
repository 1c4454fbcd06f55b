package io.github.eutro.py2ir.code;

import org.jetbrains.annotations.Nullable;

/**
 * A decoded bytecode instruction.
 * <p>
 * The raw {@link #arg} is kept next to the resolved {@link #argval}: the constant,
 * name, jump target offset or comparison operator that it denotes.
 */
public final class Instruction {
    public final int offset;
    public final Opcode opcode;
    public final int arg;
    @Nullable
    public final Object argval;

    public Instruction(int offset, Opcode opcode, int arg, @Nullable Object argval) {
        this.offset = offset;
        this.opcode = opcode;
        this.arg = arg;
        this.argval = argval;
    }

    /**
     * Get the offset this instruction jumps to.
     *
     * @return The target offset.
     * @throws IllegalStateException If this is not a jump.
     */
    public int jumpTarget() {
        if (!opcode.isJump()) {
            throw new IllegalStateException(opcode + " is not a jump");
        }
        return (Integer) argval;
    }

    public String name() {
        return (String) argval;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(offset).append(' ').append(opcode);
        if (opcode.argKind != Opcode.ArgKind.NONE) {
            sb.append(' ').append(arg);
            if (opcode.argKind != Opcode.ArgKind.COUNT) {
                sb.append(" (").append(opcode.argKind == Opcode.ArgKind.CONST
                        ? Constants.repr(argval)
                        : argval).append(')');
            }
        }
        return sb.toString();
    }
}
