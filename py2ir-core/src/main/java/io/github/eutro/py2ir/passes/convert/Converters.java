package io.github.eutro.py2ir.passes.convert;

import io.github.eutro.py2ir.code.CodeObject;
import io.github.eutro.py2ir.code.ConstCollection;
import io.github.eutro.py2ir.code.Instruction;
import io.github.eutro.py2ir.code.Opcode;
import io.github.eutro.py2ir.ops.MakeFunctionInfo;
import io.github.eutro.py2ir.ops.Op;
import io.github.eutro.py2ir.ops.PyOps;
import io.github.eutro.py2ir.ops.UnaryOpKey;
import io.github.eutro.py2ir.ssa.Const;
import io.github.eutro.py2ir.ssa.Control;
import io.github.eutro.py2ir.ssa.Value;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;

import static io.github.eutro.py2ir.code.Opcode.*;
import static io.github.eutro.py2ir.passes.convert.StackValues.*;

/**
 * The lowering of each opcode, as its effect on the simulated stack and the current block.
 * <p>
 * Opcodes without an entry have no lowering, and fail the translation of their procedure.
 */
final class Converters {
    interface Converter {
        void convert(ConvertState cs, Instruction insn);
    }

    static final EnumMap<Opcode, Converter> CONVERTERS = new EnumMap<>(Opcode.class);

    private static void put(Converter converter, Opcode... opcodes) {
        for (Opcode opcode : opcodes) {
            if (CONVERTERS.put(opcode, converter) != null) {
                throw new IllegalStateException("Duplicate converter for " + opcode);
            }
        }
    }

    private Converters() {
    }

    // stack manipulation
    static {
        put((cs, insn) -> {
        }, NOP, EXTENDED_ARG, SETUP_FINALLY, SETUP_ASYNC_WITH, POP_BLOCK);
        put((cs, insn) -> cs.pop(), POP_TOP);
        put((cs, insn) -> rotate(cs, 2), ROT_TWO);
        put((cs, insn) -> rotate(cs, 3), ROT_THREE);
        put((cs, insn) -> rotate(cs, 4), ROT_FOUR);
        put((cs, insn) -> rotate(cs, insn.arg), ROT_N);
        put((cs, insn) -> cs.push(cs.materializeAt(1)), DUP_TOP);
        put((cs, insn) -> {
            Value second = cs.materializeAt(2);
            Value first = cs.materializeAt(1);
            cs.push(second);
            cs.push(first);
        }, DUP_TOP_TWO);
        put((cs, insn) -> cs.push(Const.of(insn.argval)), LOAD_CONST);
    }

    // operators
    static {
        putOperator(PyOps.UNARY, "Positive", UNARY_POSITIVE);
        putOperator(PyOps.UNARY, "Negative", UNARY_NEGATIVE);
        putOperator(PyOps.UNARY, "Not", UNARY_NOT);
        putOperator(PyOps.UNARY, "Invert", UNARY_INVERT);

        putBinary("Power", BINARY_POWER, INPLACE_POWER);
        putBinary("Multiply", BINARY_MULTIPLY, INPLACE_MULTIPLY);
        putBinary("MatrixMultiply", BINARY_MATRIX_MULTIPLY, INPLACE_MATRIX_MULTIPLY);
        putBinary("FloorDivide", BINARY_FLOOR_DIVIDE, INPLACE_FLOOR_DIVIDE);
        putBinary("TrueDivide", BINARY_TRUE_DIVIDE, INPLACE_TRUE_DIVIDE);
        putBinary("Modulo", BINARY_MODULO, INPLACE_MODULO);
        putBinary("Add", BINARY_ADD, INPLACE_ADD);
        putBinary("Subtract", BINARY_SUBTRACT, INPLACE_SUBTRACT);
        putBinary("LShift", BINARY_LSHIFT, INPLACE_LSHIFT);
        putBinary("RShift", BINARY_RSHIFT, INPLACE_RSHIFT);
        putBinary("And", BINARY_AND, INPLACE_AND);
        putBinary("Xor", BINARY_XOR, INPLACE_XOR);
        putBinary("Or", BINARY_OR, INPLACE_OR);

        put((cs, insn) -> compare(cs, compareName((String) insn.argval)), COMPARE_OP);
        put((cs, insn) -> compare(cs, insn.arg == 0 ? "is" : "is_not"), IS_OP);
        put((cs, insn) -> compare(cs, insn.arg == 0 ? "in" : "not_in"), CONTAINS_OP);
    }

    private static void putOperator(UnaryOpKey<String> key, String name, Opcode opcode) {
        put((cs, insn) -> cs.push(cs.emit(key.create(name), cs.popValue())), opcode);
    }

    private static void putBinary(String name, Opcode binary, Opcode inplace) {
        put((cs, insn) -> binary(cs, PyOps.BINARY, name), binary);
        put((cs, insn) -> binary(cs, PyOps.INPLACE, name), inplace);
    }

    private static void binary(ConvertState cs, UnaryOpKey<String> key, String name) {
        Value rhs = cs.popValue();
        Value lhs = cs.popValue();
        cs.push(cs.emit(key.create(name), lhs, rhs));
    }

    private static void compare(ConvertState cs, String name) {
        binary(cs, PyOps.COMPARE, name);
    }

    private static String compareName(String op) {
        switch (op) {
            case "<":
                return "lt";
            case "<=":
                return "le";
            case "==":
                return "eq";
            case "!=":
                return "neq";
            case ">":
                return "gt";
            case ">=":
                return "ge";
            default:
                throw new IllegalArgumentException("Unknown comparison " + op);
        }
    }

    // names, attributes and subscripts
    static {
        put((cs, insn) -> cs.push(cs.emit(PyOps.LOAD.create(cs.scopes().named(insn.name())))),
                LOAD_NAME, LOAD_GLOBAL, LOAD_FAST);
        put((cs, insn) -> cs.store(PyOps.STORE.create(cs.scopes().named(insn.name())), cs.popValue()),
                STORE_NAME, STORE_GLOBAL, STORE_FAST);
        put((cs, insn) -> cs.store(PyOps.DELETE.create(cs.scopes().named(insn.name()))),
                DELETE_NAME, DELETE_GLOBAL, DELETE_FAST);

        put((cs, insn) -> cs.push(cs.emit(PyOps.LOAD_CLOSURE.create(cs.scopes().cell(insn.arg)))), LOAD_CLOSURE);
        put((cs, insn) -> cs.push(cs.emit(PyOps.LOAD_DEREF.create(cs.scopes().cell(insn.arg)))), LOAD_DEREF);
        put((cs, insn) -> cs.push(cs.emit(PyOps.LOAD_CLASS_DEREF.create(cs.scopes().cell(insn.arg)))),
                LOAD_CLASSDEREF);
        put((cs, insn) -> cs.emit(PyOps.STORE_DEREF.create(cs.scopes().cell(insn.arg)), cs.popValue()),
                STORE_DEREF);
        put((cs, insn) -> cs.emit(PyOps.DELETE_DEREF.create(cs.scopes().cell(insn.arg))), DELETE_DEREF);

        put((cs, insn) -> cs.push(cs.emit(PyOps.LOAD_ATTR.create(insn.name()), cs.popValue())), LOAD_ATTR);
        put((cs, insn) -> {
            Value obj = cs.popValue();
            Value value = cs.popValue();
            cs.store(PyOps.STORE_ATTR.create(insn.name()), obj, value);
        }, STORE_ATTR);
        put((cs, insn) -> cs.store(PyOps.DELETE_ATTR.create(insn.name()), cs.popValue()), DELETE_ATTR);

        put((cs, insn) -> {
            Value key = cs.popValue();
            Value container = cs.popValue();
            cs.push(cs.emit(PyOps.SUBSCRIPT, container, key));
        }, BINARY_SUBSCR);
        put((cs, insn) -> {
            Value key = cs.popValue();
            Value container = cs.popValue();
            Value value = cs.popValue();
            cs.store(PyOps.STORE_SUBSCRIPT, container, key, value);
        }, STORE_SUBSCR);
        put((cs, insn) -> {
            Value key = cs.popValue();
            Value container = cs.popValue();
            cs.store(PyOps.DELETE_SUBSCRIPT, container, key);
        }, DELETE_SUBSCR);

        put((cs, insn) -> {
            Value seq = cs.popValue();
            List<Value> items = new ArrayList<>(insn.arg);
            for (int i = 0; i < insn.arg; i++) {
                items.add(cs.emit(PyOps.SUBSCRIPT, seq, Const.of(i)));
            }
            for (int i = items.size() - 1; i >= 0; i--) {
                cs.push(items.get(i));
            }
        }, UNPACK_SEQUENCE);
    }

    // calls and definitions
    static {
        put((cs, insn) -> call(cs, cs.popValues(insn.arg)), CALL_FUNCTION);
        put((cs, insn) -> {
            Value names = cs.popValue();
            if (!(names instanceof Const) || !(((Const) names).value instanceof ConstCollection)) {
                throw cs.error("keyword names must be a constant tuple, found " + names);
            }
            List<Value> args = cs.popValues(insn.arg);
            args.add(names);
            call(cs, args);
        }, CALL_FUNCTION_KW);
        put((cs, insn) -> cs.push(new MethodRef(cs.popValue(), insn.name())), LOAD_METHOD);
        put((cs, insn) -> {
            List<Value> args = cs.popValues(insn.arg);
            Object callee = cs.pop();
            if (!(callee instanceof MethodRef)) {
                throw cs.error("expected a method reference, found " + callee);
            }
            MethodRef ref = (MethodRef) callee;
            args.add(0, ref.receiver);
            cs.push(cs.emit(PyOps.CALL_METHOD.create(ref.name), args));
        }, CALL_METHOD);

        put((cs, insn) -> cs.push(BuildClassMarker.INSTANCE), LOAD_BUILD_CLASS);
        put((cs, insn) -> {
            cs.pop(); // qualified name, recomputed from the lexical path
            Object code = cs.pop();
            if (!(code instanceof Const) || !(((Const) code).value instanceof CodeObject)) {
                throw cs.error("expected a code object, found " + code);
            }
            int flags = insn.arg;
            Value closure = (flags & 0x08) != 0 ? cs.popValue() : Const.NONE;
            Value annotations = (flags & 0x04) != 0 ? cs.popValue() : Const.NONE;
            Value kwdefaults = (flags & 0x02) != 0 ? cs.popValue() : Const.NONE;
            Value defaults = (flags & 0x01) != 0 ? cs.popValue() : Const.NONE;
            MakeFunctionInfo info = cs.hoist((CodeObject) ((Const) code).value);
            cs.push(cs.emit(PyOps.MAKE_FUNCTION.create(info), defaults, kwdefaults, annotations, closure));
        }, MAKE_FUNCTION);

        put((cs, insn) -> enterWith(cs, "__enter__", false), SETUP_WITH);
        put((cs, insn) -> enterWith(cs, "__aenter__", true), BEFORE_ASYNC_WITH);
    }

    private static void call(ConvertState cs, List<Value> args) {
        Object callee = cs.pop();
        if (callee instanceof Value) {
            args.add(0, (Value) callee);
            cs.push(cs.emit(PyOps.CALL, args));
        } else if (callee instanceof BuildClassMarker) {
            cs.push(cs.emit(PyOps.BUILD_CLASS, args));
        } else if (callee instanceof ExitMarker) {
            ExitMarker marker = (ExitMarker) callee;
            if (args.size() != 3) {
                throw cs.error("expected 3 arguments to " + marker + ", found " + args.size());
            }
            args.add(0, marker.manager);
            cs.push(cs.emit(PyOps.CALL_METHOD.create(marker.exitMethod()), args));
        } else {
            throw cs.error("cannot call " + callee);
        }
    }

    private static void enterWith(ConvertState cs, String method, boolean async) {
        Value manager = cs.popValue();
        cs.push(new ExitMarker(manager, async));
        cs.push(cs.emit(PyOps.CALL_METHOD.create(method), manager));
    }

    // collections
    static {
        put((cs, insn) -> {
            List<Value> items = cs.popValues(insn.arg);
            cs.push(allConst(items)
                    ? ConvertState.tupleOf(items)
                    : cs.emit(PyOps.BUILD_TUPLE, items));
        }, BUILD_TUPLE);
        put((cs, insn) -> buildCollection(cs, ConstCollection.Kind.LIST, cs.popValues(insn.arg)), BUILD_LIST);
        put((cs, insn) -> buildCollection(cs, ConstCollection.Kind.SET, cs.popValues(insn.arg)), BUILD_SET);
        put((cs, insn) -> buildCollection(cs, ConstCollection.Kind.DICT, cs.popValues(insn.arg * 2)), BUILD_MAP);
        put((cs, insn) -> {
            Value keys = cs.popValue();
            if (!(keys instanceof Const)
                    || !(((Const) keys).value instanceof ConstCollection)
                    || ((ConstCollection) ((Const) keys).value).size() != insn.arg) {
                throw cs.error("expected a constant tuple of " + insn.arg + " keys, found " + keys);
            }
            List<Object> keyList = ((ConstCollection) ((Const) keys).value).items;
            List<Value> values = cs.popValues(insn.arg);
            List<Value> items = new ArrayList<>(insn.arg * 2);
            for (int i = 0; i < insn.arg; i++) {
                items.add(Const.of(keyList.get(i)));
                items.add(values.get(i));
            }
            buildCollection(cs, ConstCollection.Kind.DICT, items);
        }, BUILD_CONST_KEY_MAP);
        put((cs, insn) -> cs.push(cs.emit(PyOps.BUILD_SLICE, cs.popValues(insn.arg))), BUILD_SLICE);

        put((cs, insn) -> {
            Value value = cs.popValue();
            cs.emit(PyOps.LIST_APPEND, cs.materializeAt(insn.arg), value);
        }, LIST_APPEND);
        put((cs, insn) -> {
            Value value = cs.popValue();
            cs.emit(PyOps.SET_ADD, cs.materializeAt(insn.arg), value);
        }, SET_ADD);
        put((cs, insn) -> {
            Value value = cs.popValue();
            Value key = cs.popValue();
            cs.emit(PyOps.DICT_SET_ITEM, cs.materializeAt(insn.arg), key, value);
        }, MAP_ADD);
        put((cs, insn) -> extend(cs, insn, PyOps.LIST_EXTEND), LIST_EXTEND);
        put((cs, insn) -> extend(cs, insn, PyOps.SET_UPDATE), SET_UPDATE);
        put((cs, insn) -> {
            Value value = cs.popValue();
            cs.emit(PyOps.DICT_UPDATE, cs.materializeAt(insn.arg), value);
        }, DICT_UPDATE);
        put((cs, insn) -> {
            Value value = cs.popValue();
            cs.emit(PyOps.DICT_MERGE, cs.materializeAt(insn.arg), value);
        }, DICT_MERGE);
        put((cs, insn) -> {
            Object list = cs.pop();
            if (list instanceof PendingCollection) {
                cs.push(Const.of(new ConstCollection(ConstCollection.Kind.TUPLE, ((PendingCollection) list).items)));
            } else {
                cs.push(cs.emit(PyOps.LIST_TO_TUPLE, cs.toValue(list)));
            }
        }, LIST_TO_TUPLE);
    }

    private static boolean allConst(List<Value> values) {
        for (Value value : values) {
            if (!(value instanceof Const)) return false;
        }
        return true;
    }

    private static void buildCollection(ConvertState cs, ConstCollection.Kind kind, List<Value> items) {
        if (allConst(items)) {
            List<Object> consts = new ArrayList<>(items.size());
            for (Value item : items) {
                consts.add(((Const) item).value);
            }
            cs.push(cs.pending(kind, consts));
            return;
        }
        switch (kind) {
            case LIST:
                cs.push(cs.emit(PyOps.BUILD_LIST, items));
                break;
            case SET:
                cs.push(cs.emit(PyOps.BUILD_SET, items));
                break;
            case DICT:
                cs.push(cs.emit(PyOps.BUILD_MAP, items));
                break;
            default:
                throw new IllegalArgumentException("Cannot build " + kind);
        }
    }

    private static void extend(ConvertState cs, Instruction insn, Op op) {
        Object value = cs.pop();
        Object target = cs.peek(insn.arg);
        if (target instanceof PendingCollection
                && value instanceof Const
                && ((Const) value).value instanceof ConstCollection) {
            ConstCollection extension = (ConstCollection) ((Const) value).value;
            if (extension.kind != ConstCollection.Kind.DICT) {
                cs.set(insn.arg, ((PendingCollection) target).extendedWith(insn.offset, extension.items));
                return;
            }
        }
        Value extension = cs.toValue(value);
        cs.emit(op, cs.materializeAt(insn.arg), extension);
    }

    // control flow
    static {
        put((cs, insn) -> cs.terminate(Control.ret(cs.popValue())), RETURN_VALUE);
        put((cs, insn) -> {
            Value exc;
            switch (insn.arg) {
                case 0:
                    exc = Const.NONE;
                    break;
                case 1:
                    exc = cs.popValue();
                    break;
                case 2:
                    cs.pop(); // the cause is not modelled
                    exc = cs.popValue();
                    break;
                default:
                    throw cs.error("bad raise argument count " + insn.arg);
            }
            cs.terminate(Control.raise(exc));
        }, RAISE_VARARGS);
        put((cs, insn) -> cs.terminate(Control.jmp(cs.edge(insn.jumpTarget(), cs.stackCopy()))),
                JUMP_FORWARD, JUMP_ABSOLUTE);
        put((cs, insn) -> {
            Value cond = cs.popValue();
            List<Object> stack = cs.stackCopy();
            cs.terminate(Control.cond(cond,
                    cs.edge(cs.fallthroughOffset(), stack),
                    cs.edge(insn.jumpTarget(), stack)));
        }, POP_JUMP_IF_FALSE);
        put((cs, insn) -> {
            Value cond = cs.popValue();
            List<Object> stack = cs.stackCopy();
            cs.terminate(Control.cond(cond,
                    cs.edge(insn.jumpTarget(), stack),
                    cs.edge(cs.fallthroughOffset(), stack)));
        }, POP_JUMP_IF_TRUE);
        put((cs, insn) -> {
            Value cond = cs.materializeAt(1);
            List<Object> kept = cs.stackCopy();
            cs.pop();
            List<Object> popped = cs.stackCopy();
            cs.terminate(Control.cond(cond,
                    cs.edge(cs.fallthroughOffset(), popped),
                    cs.edge(insn.jumpTarget(), kept)));
        }, JUMP_IF_FALSE_OR_POP);
        put((cs, insn) -> {
            Value cond = cs.materializeAt(1);
            List<Object> kept = cs.stackCopy();
            cs.pop();
            List<Object> popped = cs.stackCopy();
            cs.terminate(Control.cond(cond,
                    cs.edge(insn.jumpTarget(), kept),
                    cs.edge(cs.fallthroughOffset(), popped)));
        }, JUMP_IF_TRUE_OR_POP);

        put((cs, insn) -> cs.push(cs.emit(PyOps.GET_ITER, cs.popValue())), GET_ITER);
        put((cs, insn) -> cs.push(cs.emit(PyOps.GET_YIELD_FROM_ITER, cs.popValue())), GET_YIELD_FROM_ITER);
        put((cs, insn) -> {
            Value iter = cs.materializeAt(1);
            Value next = cs.emit(PyOps.NEXT_ITER, iter);
            Value hasNext = cs.emit(PyOps.HAS_NEXT_ITER, iter);
            List<Object> body = cs.stackCopy();
            body.add(next);
            cs.pop();
            List<Object> exit = cs.stackCopy();
            cs.terminate(Control.cond(hasNext,
                    cs.edge(cs.fallthroughOffset(), body),
                    cs.edge(insn.jumpTarget(), exit)));
        }, FOR_ITER);
    }

    // generators and coroutines
    static {
        put((cs, insn) -> cs.push(cs.emit(PyOps.GET_AWAITABLE, cs.popValue())), GET_AWAITABLE);
        put((cs, insn) -> {
            Value sent = cs.popValue();
            Value source = cs.popValue();
            cs.push(cs.emit(PyOps.YIELD_FROM, source, sent));
        }, YIELD_FROM);
        put((cs, insn) -> cs.push(cs.emit(PyOps.YIELD, cs.popValue())), YIELD_VALUE);
        put((cs, insn) -> {
            if (insn.arg == 1) {
                cs.emit(PyOps.GEN_START_COROUTINE);
            }
        }, GEN_START);
    }

    // imports, formatting and the rest
    static {
        put((cs, insn) -> {
            Value fromlist = cs.popValue();
            Value level = cs.popValue();
            cs.push(cs.emit(PyOps.IMPORT_NAME.create(insn.name()), fromlist, level));
        }, IMPORT_NAME);
        put((cs, insn) -> cs.push(cs.emit(PyOps.IMPORT_FROM.create(insn.name()), cs.materializeAt(1))),
                IMPORT_FROM);
        put((cs, insn) -> cs.emit(PyOps.IMPORT_STAR, cs.popValue()), IMPORT_STAR);

        put((cs, insn) -> {
            int flags = insn.arg;
            Value spec = (flags & 0x04) != 0 ? cs.popValue() : Const.NONE;
            Value value = cs.popValue();
            switch (flags & 0x03) {
                case 1:
                    value = cs.emit(PyOps.FORMAT_FN.create("str"), value);
                    break;
                case 2:
                    value = cs.emit(PyOps.FORMAT_FN.create("repr"), value);
                    break;
                case 3:
                    value = cs.emit(PyOps.FORMAT_FN.create("ascii"), value);
                    break;
            }
            cs.push(cs.emit(PyOps.FORMAT, value, spec));
        }, FORMAT_VALUE);
        put((cs, insn) -> cs.push(cs.emit(PyOps.CONCAT, cs.popValues(insn.arg))), BUILD_STRING);

        put((cs, insn) -> cs.push(cs.emit(PyOps.LOAD_ASSERTION_ERROR)), LOAD_ASSERTION_ERROR);
        put((cs, insn) -> cs.emit(PyOps.SETUP_ANNOTATIONS), SETUP_ANNOTATIONS);
    }

    /**
     * Move the top of the stack down to a depth, shifting the entries above it up.
     */
    private static void rotate(ConvertState cs, int depth) {
        Object top = cs.peek(1);
        for (int i = 1; i < depth; i++) {
            cs.set(i, cs.peek(i + 1));
        }
        cs.set(depth, top);
    }
}
