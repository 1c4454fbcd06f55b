package io.github.eutro.py2ir.code;

import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * The opcodes of the CPython 3.10 instruction set.
 */
public enum Opcode {
    POP_TOP(1),
    ROT_TWO(2),
    ROT_THREE(3),
    DUP_TOP(4),
    DUP_TOP_TWO(5),
    ROT_FOUR(6),
    NOP(9),
    UNARY_POSITIVE(10),
    UNARY_NEGATIVE(11),
    UNARY_NOT(12),
    UNARY_INVERT(15),
    BINARY_MATRIX_MULTIPLY(16),
    INPLACE_MATRIX_MULTIPLY(17),
    BINARY_POWER(19),
    BINARY_MULTIPLY(20),
    BINARY_MODULO(22),
    BINARY_ADD(23),
    BINARY_SUBTRACT(24),
    BINARY_SUBSCR(25),
    BINARY_FLOOR_DIVIDE(26),
    BINARY_TRUE_DIVIDE(27),
    INPLACE_FLOOR_DIVIDE(28),
    INPLACE_TRUE_DIVIDE(29),
    GET_LEN(30),
    MATCH_MAPPING(31),
    MATCH_SEQUENCE(32),
    MATCH_KEYS(33),
    COPY_DICT_WITHOUT_KEYS(34),
    WITH_EXCEPT_START(49),
    GET_AITER(50),
    GET_ANEXT(51),
    BEFORE_ASYNC_WITH(52),
    END_ASYNC_FOR(54),
    INPLACE_ADD(55),
    INPLACE_SUBTRACT(56),
    INPLACE_MULTIPLY(57),
    INPLACE_MODULO(59),
    STORE_SUBSCR(60),
    DELETE_SUBSCR(61),
    BINARY_LSHIFT(62),
    BINARY_RSHIFT(63),
    BINARY_AND(64),
    BINARY_XOR(65),
    BINARY_OR(66),
    INPLACE_POWER(67),
    GET_ITER(68),
    GET_YIELD_FROM_ITER(69),
    PRINT_EXPR(70),
    LOAD_BUILD_CLASS(71),
    YIELD_FROM(72),
    GET_AWAITABLE(73),
    LOAD_ASSERTION_ERROR(74),
    INPLACE_LSHIFT(75),
    INPLACE_RSHIFT(76),
    INPLACE_AND(77),
    INPLACE_XOR(78),
    INPLACE_OR(79),
    LIST_TO_TUPLE(82),
    RETURN_VALUE(83, ArgKind.NONE, Flow.TERMINATOR),
    IMPORT_STAR(84),
    SETUP_ANNOTATIONS(85),
    YIELD_VALUE(86),
    POP_BLOCK(87),
    POP_EXCEPT(89),
    STORE_NAME(90, ArgKind.NAME),
    DELETE_NAME(91, ArgKind.NAME),
    UNPACK_SEQUENCE(92, ArgKind.COUNT),
    FOR_ITER(93, ArgKind.JUMP, Flow.CONDITIONAL),
    UNPACK_EX(94, ArgKind.COUNT),
    STORE_ATTR(95, ArgKind.NAME),
    DELETE_ATTR(96, ArgKind.NAME),
    STORE_GLOBAL(97, ArgKind.NAME),
    DELETE_GLOBAL(98, ArgKind.NAME),
    ROT_N(99, ArgKind.COUNT),
    LOAD_CONST(100, ArgKind.CONST),
    LOAD_NAME(101, ArgKind.NAME),
    BUILD_TUPLE(102, ArgKind.COUNT),
    BUILD_LIST(103, ArgKind.COUNT),
    BUILD_SET(104, ArgKind.COUNT),
    BUILD_MAP(105, ArgKind.COUNT),
    LOAD_ATTR(106, ArgKind.NAME),
    COMPARE_OP(107, ArgKind.COMPARE),
    IMPORT_NAME(108, ArgKind.NAME),
    IMPORT_FROM(109, ArgKind.NAME),
    JUMP_FORWARD(110, ArgKind.JUMP, Flow.UNCONDITIONAL),
    JUMP_IF_FALSE_OR_POP(111, ArgKind.JUMP, Flow.CONDITIONAL),
    JUMP_IF_TRUE_OR_POP(112, ArgKind.JUMP, Flow.CONDITIONAL),
    JUMP_ABSOLUTE(113, ArgKind.JUMP, Flow.UNCONDITIONAL),
    POP_JUMP_IF_FALSE(114, ArgKind.JUMP, Flow.CONDITIONAL),
    POP_JUMP_IF_TRUE(115, ArgKind.JUMP, Flow.CONDITIONAL),
    LOAD_GLOBAL(116, ArgKind.NAME),
    IS_OP(117, ArgKind.COUNT),
    CONTAINS_OP(118, ArgKind.COUNT),
    RERAISE(119, ArgKind.COUNT, Flow.TERMINATOR),
    JUMP_IF_NOT_EXC_MATCH(121, ArgKind.JUMP, Flow.CONDITIONAL),
    SETUP_FINALLY(122, ArgKind.JUMP, Flow.HANDLER),
    LOAD_FAST(124, ArgKind.LOCAL),
    STORE_FAST(125, ArgKind.LOCAL),
    DELETE_FAST(126, ArgKind.LOCAL),
    GEN_START(129, ArgKind.COUNT),
    RAISE_VARARGS(130, ArgKind.COUNT, Flow.TERMINATOR),
    CALL_FUNCTION(131, ArgKind.COUNT),
    MAKE_FUNCTION(132, ArgKind.FLAGS),
    BUILD_SLICE(133, ArgKind.COUNT),
    LOAD_CLOSURE(135, ArgKind.FREE),
    LOAD_DEREF(136, ArgKind.FREE),
    STORE_DEREF(137, ArgKind.FREE),
    DELETE_DEREF(138, ArgKind.FREE),
    CALL_FUNCTION_KW(141, ArgKind.COUNT),
    CALL_FUNCTION_EX(142, ArgKind.FLAGS),
    SETUP_WITH(143, ArgKind.JUMP, Flow.HANDLER),
    EXTENDED_ARG(144, ArgKind.COUNT),
    LIST_APPEND(145, ArgKind.COUNT),
    SET_ADD(146, ArgKind.COUNT),
    MAP_ADD(147, ArgKind.COUNT),
    LOAD_CLASSDEREF(148, ArgKind.FREE),
    MATCH_CLASS(152, ArgKind.COUNT),
    SETUP_ASYNC_WITH(154, ArgKind.JUMP, Flow.HANDLER),
    FORMAT_VALUE(155, ArgKind.FLAGS),
    BUILD_CONST_KEY_MAP(156, ArgKind.COUNT),
    BUILD_STRING(157, ArgKind.COUNT),
    LOAD_METHOD(160, ArgKind.NAME),
    CALL_METHOD(161, ArgKind.COUNT),
    LIST_EXTEND(162, ArgKind.COUNT),
    SET_UPDATE(163, ArgKind.COUNT),
    DICT_MERGE(164, ArgKind.COUNT),
    DICT_UPDATE(165, ArgKind.COUNT),
    ;

    /**
     * How the argument of an instruction is interpreted.
     */
    public enum ArgKind {
        NONE,
        /**
         * Index into the constant pool.
         */
        CONST,
        /**
         * Index into the names of the code object.
         */
        NAME,
        /**
         * Index into the local variable names.
         */
        LOCAL,
        /**
         * Index into the cell variables followed by the free variables.
         */
        FREE,
        COUNT,
        /**
         * A jump target, resolved to a bytecode offset.
         */
        JUMP,
        /**
         * Index into {@link Opcode#COMPARE_OPS}.
         */
        COMPARE,
        FLAGS,
    }

    /**
     * How an instruction affects control flow.
     */
    public enum Flow {
        NEXT,
        /**
         * Continues either at the next instruction or at the jump target.
         */
        CONDITIONAL,
        /**
         * Always continues at the jump target.
         */
        UNCONDITIONAL,
        /**
         * Registers the jump target as an exception handler, and continues at the next instruction.
         */
        HANDLER,
        /**
         * Never continues within the procedure.
         */
        TERMINATOR,
    }

    /**
     * The comparison operators of {@link #COMPARE_OP}, by argument.
     */
    public static final String[] COMPARE_OPS = {"<", "<=", "==", "!=", ">", ">="};

    private static final Map<Integer, Opcode> BY_CODE = new HashMap<>();

    static {
        for (Opcode value : values()) {
            BY_CODE.put(value.code, value);
        }
    }

    public final int code;
    public final ArgKind argKind;
    public final Flow flow;

    Opcode(int code, ArgKind argKind, Flow flow) {
        this.code = code;
        this.argKind = argKind;
        this.flow = flow;
    }

    Opcode(int code, ArgKind argKind) {
        this(code, argKind, Flow.NEXT);
    }

    Opcode(int code) {
        this(code, ArgKind.NONE);
    }

    @Nullable
    public static Opcode byCode(int code) {
        return BY_CODE.get(code);
    }

    public boolean isJump() {
        return argKind == ArgKind.JUMP;
    }

    /**
     * Whether execution can continue at the following instruction.
     *
     * @return Whether this falls through.
     */
    public boolean fallsThrough() {
        return flow != Flow.UNCONDITIONAL && flow != Flow.TERMINATOR;
    }

    /**
     * Whether the jump target is reached by normal (non-exceptional) control flow.
     *
     * @return Whether the target is a normal successor.
     */
    public boolean hasNormalTarget() {
        return flow == Flow.CONDITIONAL || flow == Flow.UNCONDITIONAL;
    }

    /**
     * Whether this instruction ends a basic block.
     *
     * @return Whether the next instruction starts a new block.
     */
    public boolean endsBlock() {
        return flow == Flow.CONDITIONAL || flow == Flow.UNCONDITIONAL || flow == Flow.TERMINATOR;
    }
}
