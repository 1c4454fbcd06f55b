package io.github.eutro.py2ir.code;

import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A fluent builder for {@link CodeObject}s.
 * <p>
 * Operands are given by value: {@code op(LOAD_FAST, "x")} enters {@code x} into the local
 * variable names and {@code op(LOAD_CONST, 1)} into the constant pool. Jumps refer to
 * {@link #label(String) labels}, which are resolved to offsets on {@link #build()};
 * every instruction takes two bytes, so the instruction at index {@code i} has offset {@code 2 * i}.
 */
public class CodeBuilder {
    private final String name;
    private int flags;
    private int argcount;
    private int posonlyargcount;
    private int kwonlyargcount;
    private final List<String> varnames = new ArrayList<>();
    private final List<String> names = new ArrayList<>();
    private final List<String> cellvars = new ArrayList<>();
    private final List<String> freevars = new ArrayList<>();
    private final List<Object> consts = new ArrayList<>();

    private final List<Pending> pending = new ArrayList<>();
    private final Map<String, Integer> labels = new HashMap<>();

    private static final class Pending {
        final Opcode opcode;
        final int arg;
        final Object argval;
        final String label;

        Pending(Opcode opcode, int arg, Object argval, String label) {
            this.opcode = opcode;
            this.arg = arg;
            this.argval = argval;
            this.label = label;
        }
    }

    public CodeBuilder(String name, int flags) {
        this.name = name;
        this.flags = flags;
    }

    /**
     * Start building a module body, named {@code <module>}.
     *
     * @return The builder.
     */
    public static CodeBuilder module() {
        return new CodeBuilder("<module>", 0);
    }

    /**
     * Start building a function body (also used for lambdas and comprehensions).
     *
     * @param name The name of the function.
     * @return The builder.
     */
    public static CodeBuilder function(String name) {
        return new CodeBuilder(name, CodeObject.CO_OPTIMIZED | CodeObject.CO_NEWLOCALS);
    }

    /**
     * Start building a class body.
     *
     * @param name The name of the class.
     * @return The builder.
     */
    public static CodeBuilder classBody(String name) {
        return new CodeBuilder(name, 0);
    }

    public CodeBuilder flags(int flags) {
        this.flags |= flags;
        return this;
    }

    /**
     * Declare positional parameters. They become the first local variables.
     *
     * @param args The parameter names.
     * @return This builder.
     */
    public CodeBuilder args(String... args) {
        if (!varnames.isEmpty()) {
            throw new IllegalStateException("Parameters must be declared before locals");
        }
        varnames.addAll(Arrays.asList(args));
        argcount = args.length;
        return this;
    }

    public CodeBuilder posonly(int count) {
        posonlyargcount = count;
        return this;
    }

    public CodeBuilder kwonlyArgs(String... args) {
        if (varnames.size() != argcount) {
            throw new IllegalStateException("Parameters must be declared before locals");
        }
        varnames.addAll(Arrays.asList(args));
        kwonlyargcount = args.length;
        return this;
    }

    public CodeBuilder cellvars(String... vars) {
        cellvars.addAll(Arrays.asList(vars));
        return this;
    }

    public CodeBuilder freevars(String... vars) {
        freevars.addAll(Arrays.asList(vars));
        return this;
    }

    /**
     * Append an instruction without an operand.
     *
     * @param opcode The opcode.
     * @return This builder.
     */
    public CodeBuilder op(Opcode opcode) {
        if (opcode.argKind != Opcode.ArgKind.NONE) {
            throw new IllegalArgumentException(opcode + " needs an operand");
        }
        pending.add(new Pending(opcode, 0, null, null));
        return this;
    }

    /**
     * Append an instruction with an operand.
     *
     * @param opcode  The opcode.
     * @param operand The operand: a constant, a name, a count or a comparison operator,
     *                depending on {@link Opcode#argKind}.
     * @return This builder.
     */
    public CodeBuilder op(Opcode opcode, @Nullable Object operand) {
        int arg;
        Object argval = operand;
        switch (opcode.argKind) {
            case CONST:
                arg = constIndex(operand);
                break;
            case NAME:
                arg = indexOrAdd(names, (String) operand);
                break;
            case LOCAL:
                arg = indexOrAdd(varnames, (String) operand);
                break;
            case FREE: {
                arg = cellAndFree().indexOf((String) operand);
                if (arg == -1) {
                    throw new IllegalArgumentException("Undeclared cell or free variable " + operand);
                }
                break;
            }
            case COMPARE:
                arg = Arrays.asList(Opcode.COMPARE_OPS).indexOf((String) operand);
                if (arg == -1) {
                    throw new IllegalArgumentException("Unknown comparison " + operand);
                }
                break;
            case COUNT:
            case FLAGS:
                arg = (Integer) operand;
                break;
            case JUMP:
                throw new IllegalArgumentException("Use jump() for " + opcode);
            default:
                throw new IllegalArgumentException(opcode + " takes no operand");
        }
        pending.add(new Pending(opcode, arg, argval, null));
        return this;
    }

    /**
     * Append a jump to a label.
     *
     * @param opcode The jump opcode.
     * @param label  The label of the target.
     * @return This builder.
     */
    public CodeBuilder jump(Opcode opcode, String label) {
        checkJump(opcode);
        pending.add(new Pending(opcode, 0, null, label));
        return this;
    }

    /**
     * Append a jump to a raw offset, which is not checked.
     *
     * @param opcode The jump opcode.
     * @param offset The target offset.
     * @return This builder.
     */
    public CodeBuilder jumpToOffset(Opcode opcode, int offset) {
        checkJump(opcode);
        pending.add(new Pending(opcode, offset / 2, offset, null));
        return this;
    }

    /**
     * Place a label at the next instruction.
     *
     * @param label The label.
     * @return This builder.
     */
    public CodeBuilder label(String label) {
        if (labels.put(label, pending.size() * 2) != null) {
            throw new IllegalArgumentException("Duplicate label " + label);
        }
        return this;
    }

    public CodeObject build() {
        List<Instruction> insns = new ArrayList<>(pending.size());
        int offset = 0;
        for (Pending p : pending) {
            if (p.label != null) {
                Integer target = labels.get(p.label);
                if (target == null) {
                    throw new IllegalArgumentException("Unknown label " + p.label);
                }
                insns.add(new Instruction(offset, p.opcode, target / 2, target));
            } else {
                insns.add(new Instruction(offset, p.opcode, p.arg, p.argval));
            }
            offset += 2;
        }
        return new CodeObject(name, flags, argcount, posonlyargcount, kwonlyargcount,
                varnames, names, cellvars, freevars, consts, insns);
    }

    private static void checkJump(Opcode opcode) {
        if (!opcode.isJump()) {
            throw new IllegalArgumentException(opcode + " is not a jump");
        }
    }

    private List<String> cellAndFree() {
        List<String> all = new ArrayList<>(cellvars);
        all.addAll(freevars);
        return all;
    }

    private int constIndex(@Nullable Object k) {
        for (int i = 0; i < consts.size(); i++) {
            Object c = consts.get(i);
            if (c instanceof CodeObject || k instanceof CodeObject
                    ? c == k
                    : Constants.sameConstant(c, k)) {
                return i;
            }
        }
        consts.add(k);
        return consts.size() - 1;
    }

    private static int indexOrAdd(List<String> list, String name) {
        int i = list.indexOf(name);
        if (i != -1) return i;
        list.add(name);
        return list.size() - 1;
    }
}
