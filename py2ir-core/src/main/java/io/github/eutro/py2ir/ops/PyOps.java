package io.github.eutro.py2ir.ops;

import io.github.eutro.py2ir.scope.ScopedName;

/**
 * The {@link Op}s and {@link OpKey}s of the IR.
 * <p>
 * Mnemonics starting with {@code $} are builtin operations whose dynamic meaning is given by a consumer.
 */
public class PyOps {
    /**
     * Control: an unconditional jump to the single target.
     */
    public static final Op JMP = new SimpleOpKey("jmp").create();
    /**
     * Control: jumps to the first target if the argument is truthy, the second otherwise.
     */
    public static final Op COND = new SimpleOpKey("if").create();
    /**
     * Control: returns the argument from the procedure.
     */
    public static final Op RETURN = new SimpleOpKey("return").create();
    /**
     * Control: raises the argument.
     */
    public static final Op THROW = new SimpleOpKey("throw").create();

    /**
     * Effect: loads a name from its scope.
     */
    public static final UnaryOpKey<ScopedName> LOAD = new UnaryOpKey<>("load", n -> " " + n);
    /**
     * Effect: stores the argument to a name in its scope. Assigns nothing.
     */
    public static final UnaryOpKey<ScopedName> STORE = new UnaryOpKey<>("store", n -> " " + n);
    /**
     * Effect: unbinds a name. Assigns nothing.
     */
    public static final UnaryOpKey<ScopedName> DELETE = new UnaryOpKey<>("del", n -> " " + n);

    public static final UnaryOpKey<String> LOAD_ATTR = new UnaryOpKey<>("$LoadAttr");
    /**
     * Effect: {@code obj.attr <- value}, args are {@code (obj, value)}. Assigns nothing.
     */
    public static final UnaryOpKey<String> STORE_ATTR = new UnaryOpKey<>("$StoreAttr");
    public static final UnaryOpKey<String> DELETE_ATTR = new UnaryOpKey<>("$DeleteAttr");
    public static final Op SUBSCRIPT = new SimpleOpKey("$Subscript").create();
    /**
     * Effect: {@code obj[idx] <- value}, args are {@code (obj, idx, value)}. Assigns nothing.
     */
    public static final Op STORE_SUBSCRIPT = new SimpleOpKey("$StoreSubscript").create();
    public static final Op DELETE_SUBSCRIPT = new SimpleOpKey("$DeleteSubscript").create();

    /**
     * Effect: calls the first argument with the rest. If the call has keyword arguments,
     * the last argument is a constant tuple of their names.
     */
    public static final Op CALL = new SimpleOpKey("$Call").create();
    /**
     * Effect: calls the named method on the first argument.
     */
    public static final UnaryOpKey<String> CALL_METHOD = new UnaryOpKey<>("$CallMethod");
    /**
     * Effect: creates a closure over a hoisted procedure;
     * args are {@code (defaults, kwdefaults, annotations, closure)}.
     */
    public static final UnaryOpKey<MakeFunctionInfo> MAKE_FUNCTION = new UnaryOpKey<>("$MakeFunction", Object::toString);
    /**
     * Effect: runs a class body procedure and builds the class; args are {@code (body, name, bases...)}.
     */
    public static final Op BUILD_CLASS = new SimpleOpKey("$BuildClass").create();

    public static final UnaryOpKey<String> UNARY = new UnaryOpKey<>("$Unary", s -> "." + s);
    public static final UnaryOpKey<String> BINARY = new UnaryOpKey<>("$Binary", s -> "." + s);
    public static final UnaryOpKey<String> INPLACE = new UnaryOpKey<>("$Inplace", s -> "." + s);
    public static final UnaryOpKey<String> COMPARE = new UnaryOpKey<>("$Compare", s -> "." + s);

    public static final Op BUILD_TUPLE = new SimpleOpKey("$BuildTuple").create();
    public static final Op BUILD_LIST = new SimpleOpKey("$BuildList").create();
    public static final Op BUILD_SET = new SimpleOpKey("$BuildSet").create();
    /**
     * Effect: builds a dict from alternating keys and values.
     */
    public static final Op BUILD_MAP = new SimpleOpKey("$BuildMap").create();
    public static final Op BUILD_SLICE = new SimpleOpKey("$BuildSlice").create();
    public static final Op LIST_TO_TUPLE = new SimpleOpKey("$ListToTuple").create();

    public static final Op LIST_APPEND = new SimpleOpKey("$ListAppend").create();
    public static final Op SET_ADD = new SimpleOpKey("$SetAdd").create();
    /**
     * Effect: args are {@code (dict, key, value)}.
     */
    public static final Op DICT_SET_ITEM = new SimpleOpKey("$DictSetItem").create();
    public static final Op LIST_EXTEND = new SimpleOpKey("$ListExtend").create();
    public static final Op SET_UPDATE = new SimpleOpKey("$SetUpdate").create();
    public static final Op DICT_UPDATE = new SimpleOpKey("$DictUpdate").create();
    public static final Op DICT_MERGE = new SimpleOpKey("$DictMerge").create();

    public static final Op GET_ITER = new SimpleOpKey("$GetIter").create();
    public static final Op GET_YIELD_FROM_ITER = new SimpleOpKey("$GetYieldFromIter").create();
    /**
     * Effect: advances the iterator, returning the next element (unspecified if there is none).
     */
    public static final Op NEXT_ITER = new SimpleOpKey("$NextIter").create();
    /**
     * Effect: whether the last {@link #NEXT_ITER} on the iterator produced an element.
     */
    public static final Op HAS_NEXT_ITER = new SimpleOpKey("$HasNextIter").create();

    public static final Op GET_AWAITABLE = new SimpleOpKey("$GetAwaitable").create();
    /**
     * Effect: delegates to the awaitable or iterator until it is exhausted; args are {@code (source, sent)}.
     */
    public static final Op YIELD_FROM = new SimpleOpKey("$YieldFrom").create();
    public static final Op YIELD = new SimpleOpKey("$Yield").create();
    public static final Op GEN_START_COROUTINE = new SimpleOpKey("$GenStartCoroutine").create();

    /**
     * Effect: applies a conversion ({@code repr}, {@code str} or {@code ascii}) before formatting.
     */
    public static final UnaryOpKey<String> FORMAT_FN = new UnaryOpKey<>("$FormatFn", s -> "." + s);
    /**
     * Effect: args are {@code (value, spec)}, spec is None if absent.
     */
    public static final Op FORMAT = new SimpleOpKey("$Format").create();
    public static final Op CONCAT = new SimpleOpKey("$Concat").create();

    public static final UnaryOpKey<ScopedName> LOAD_CLOSURE = new UnaryOpKey<>("$LoadClosure", ScopedName::toCellString);
    public static final UnaryOpKey<ScopedName> LOAD_DEREF = new UnaryOpKey<>("$LoadDeref", ScopedName::toCellString);
    public static final UnaryOpKey<ScopedName> LOAD_CLASS_DEREF = new UnaryOpKey<>("$LoadClassDeref", ScopedName::toCellString);
    /**
     * Effect: stores the argument into a cell. Unlike scoped stores this assigns a result.
     */
    public static final UnaryOpKey<ScopedName> STORE_DEREF = new UnaryOpKey<>("$StoreDeref", ScopedName::toCellString);
    public static final UnaryOpKey<ScopedName> DELETE_DEREF = new UnaryOpKey<>("$DeleteDeref", ScopedName::toCellString);

    /**
     * Effect: args are {@code (fromlist, level)}.
     */
    public static final UnaryOpKey<String> IMPORT_NAME = new UnaryOpKey<>("$ImportName");
    public static final UnaryOpKey<String> IMPORT_FROM = new UnaryOpKey<>("$ImportFrom");
    public static final Op IMPORT_STAR = new SimpleOpKey("$ImportStar").create();

    public static final Op LOAD_ASSERTION_ERROR = new SimpleOpKey("$LoadAssertionError").create();
    public static final Op SETUP_ANNOTATIONS = new SimpleOpKey("$SetupAnnotations").create();

    /**
     * Whether an instruction with this op assigns no result.
     *
     * @param op The op.
     * @return Whether it is a store or delete.
     */
    public static boolean isStore(Op op) {
        OpKey key = op.key;
        return key == STORE
                || key == DELETE
                || key == STORE_ATTR
                || key == DELETE_ATTR
                || key == STORE_SUBSCRIPT.key
                || key == DELETE_SUBSCRIPT.key;
    }
}
