package io.github.eutro.py2ir.models;

/**
 * The builtin call targets that give dynamic meaning to the IR.
 */
public enum Builtin {
    CALL("call"),
    CALL_METHOD("call_method"),
    BUILD_TUPLE("build_tuple"),
    IMPORT_NAME("import_name"),
    IMPORT_FROM("import_from"),
    LOAD_FAST("load_fast"),
    LOAD_GLOBAL("load_global"),
    LOAD_NAME("load_name"),
    STORE_FAST("store_fast"),
    STORE_GLOBAL("store_global"),
    STORE_NAME("store_name"),
    MAKE_DICTIONARY("make_dictionary"),
    MAKE_FUNCTION("make_function"),
    MAKE_INT("make_int"),
    MAKE_NONE("make_none"),
    NULLIFY_LOCALS("nullify_locals"),
    SUBSCRIPT("subscript"),
    GET_AWAITABLE("get_awaitable"),
    GEN_START_COROUTINE("gen_start_coroutine"),
    YIELD_FROM("yield_from"),
    ;

    /**
     * The name consumers refer to this builtin by.
     */
    public final String modelName;

    Builtin(String modelName) {
        this.modelName = modelName;
    }

    @Override
    public String toString() {
        return modelName;
    }
}
