package io.github.eutro.py2ir.models;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.*;

/**
 * The dynamic semantics of the {@link Builtin builtins}, over a {@link ModelState}.
 * <p>
 * Where the models lack information, such as a missing dict entry or a call to something
 * that is not a known closure, they produce a fresh value and record a miss rather than fail.
 * A {@link ModelException} is only thrown for arguments the IR never produces, like a name
 * which is not a constant string.
 */
public class BuiltinModels {
    private static final Logger LOGGER = LoggerFactory.getLogger(BuiltinModels.class);

    /**
     * The local name of the procedure of a module body, which {@link Builtin#IMPORT_NAME} looks
     * for under the module's name.
     */
    public static final String MODULE_BODY = "__module_body__";

    private final ModelState state;
    private final GlobalsOwnership ownership;

    public BuiltinModels(ModelState state, GlobalsOwnership ownership) {
        this.state = state;
        this.ownership = ownership;
    }

    public ModelState getState() {
        return state;
    }

    public GlobalsOwnership getOwnership() {
        return ownership;
    }

    /**
     * Apply a builtin.
     *
     * @param builtin The builtin.
     * @param args    The arguments, as the IR passes them.
     * @return The result, or empty if the builtin produces none.
     * @throws ModelException If the arguments violate the builtin's contract.
     */
    public Optional<AbstractValue> apply(Builtin builtin, List<AbstractValue> args) {
        switch (builtin) {
            case CALL:
                atLeast(builtin, args, 3);
                return Optional.of(call(args.get(0), args.get(1), args.get(2), args.subList(3, args.size())));
            case CALL_METHOD:
                atLeast(builtin, args, 3);
                return Optional.of(callMethod(args.get(0), args.get(1), args.get(2), args.subList(3, args.size())));
            case BUILD_TUPLE:
                return Optional.of(buildTuple(args));
            case IMPORT_NAME:
                exactly(builtin, args, 3);
                return Optional.of(importName(args.get(0)));
            case IMPORT_FROM:
                exactly(builtin, args, 2);
                return Optional.of(getField(args.get(1), nameOf(args.get(0))));
            case LOAD_FAST:
            case LOAD_GLOBAL:
                exactly(builtin, args, 2);
                return Optional.of(getField(args.get(1), nameOf(args.get(0))));
            case LOAD_NAME:
                exactly(builtin, args, 3);
                return Optional.of(getField(args.get(1), nameOf(args.get(0))));
            case STORE_FAST:
            case STORE_GLOBAL:
                exactly(builtin, args, 3);
                setField(args.get(1), nameOf(args.get(0)), args.get(2));
                return Optional.empty();
            case STORE_NAME:
                exactly(builtin, args, 4);
                setField(args.get(1), nameOf(args.get(0)), args.get(3));
                return Optional.empty();
            case MAKE_DICTIONARY:
                return Optional.of(makeDictionary(args));
            case MAKE_FUNCTION:
                exactly(builtin, args, 5);
                return Optional.of(args.get(0));
            case MAKE_INT:
                exactly(builtin, args, 1);
                return Optional.of(makeInt(args.get(0)));
            case MAKE_NONE:
                exactly(builtin, args, 0);
                return Optional.of(state.allocate(Shape.NONE, null));
            case NULLIFY_LOCALS:
                atLeast(builtin, args, 1);
                nullifyLocals(args.get(0), args.subList(1, args.size()));
                return Optional.empty();
            case SUBSCRIPT:
                exactly(builtin, args, 2);
                return Optional.of(subscript(args.get(0), args.get(1)));
            case GET_AWAITABLE:
                exactly(builtin, args, 1);
                state.markAwaited(args.get(0));
                return Optional.of(args.get(0));
            case GEN_START_COROUTINE:
                exactly(builtin, args, 0);
                return Optional.empty();
            case YIELD_FROM:
                exactly(builtin, args, 2);
                return Optional.empty();
        }
        throw new IllegalStateException("Unhandled builtin " + builtin);
    }

    private static void exactly(Builtin builtin, List<AbstractValue> args, int count) {
        if (args.size() != count) {
            throw new ModelException(String.format("%s expects %d arguments, got %d", builtin, count, args.size()));
        }
    }

    private static void atLeast(Builtin builtin, List<AbstractValue> args, int count) {
        if (args.size() < count) {
            throw new ModelException(String.format("%s expects at least %d arguments, got %d", builtin, count, args.size()));
        }
    }

    /**
     * Get the constant string a name argument must be.
     *
     * @param name The argument.
     * @return The string.
     * @throws ModelException If it is not a constant string.
     */
    public static String nameOf(AbstractValue name) {
        return name.constantString()
                .orElseThrow(() -> new ModelException("expecting constant string value, found " + name));
    }

    private AbstractValue miss(String format, Object... args) {
        String message = String.format(format, args);
        state.recordMiss(message);
        LOGGER.atDebug().setMessage("Model miss: {}").addArgument(message).log();
        return state.fresh();
    }

    public AbstractValue getField(AbstractValue object, String key) {
        Optional<Map<String, AbstractValue>> fields = state.fieldsOf(object);
        if (!fields.isPresent()) {
            return miss("load of %s from %s, which has no known fields", key, object);
        }
        AbstractValue value = fields.get().get(key);
        if (value == null) {
            return miss("load of missing key %s from %s", key, object);
        }
        return value;
    }

    public void setField(AbstractValue object, String key, AbstractValue value) {
        Optional<Map<String, AbstractValue>> fields = state.fieldsOf(object);
        if (fields.isPresent()) {
            fields.get().put(key, value);
        } else {
            miss("store of %s to %s, which has no known fields", key, object);
        }
    }

    public AbstractValue call(
            AbstractValue callee,
            AbstractValue globals,
            AbstractValue argNames,
            List<AbstractValue> args
    ) {
        switch (callee.shape) {
            case CLOSURE:
                return callClosure(callee.closure(), globals, keywordNames(argNames), args);
            case DICT:
            case TUPLE:
            case INT:
            case NONE:
            case CONSTANT:
            case UNRESOLVED_MODULE:
            case NULL:
            case FRESH:
                return miss("call of %s, which is not a closure", callee);
        }
        throw new IllegalStateException("Unhandled shape " + callee.shape);
    }

    private List<String> keywordNames(AbstractValue argNames) {
        switch (argNames.shape) {
            case NONE:
                return Collections.emptyList();
            case TUPLE: {
                Map<String, AbstractValue> fields = state.fieldsOf(argNames).orElseThrow(IllegalStateException::new);
                List<String> names = new ArrayList<>(fields.size());
                for (int i = 0; i < fields.size(); i++) {
                    AbstractValue name = fields.get("#" + i);
                    if (name == null) {
                        throw new ModelException("keyword names tuple is missing element " + i);
                    }
                    names.add(nameOf(name));
                }
                return names;
            }
            case DICT:
            case INT:
            case CONSTANT:
            case UNRESOLVED_MODULE:
            case CLOSURE:
            case NULL:
            case FRESH:
                throw new ModelException("expecting None or a tuple of keyword names, found " + argNames);
        }
        throw new IllegalStateException("Unhandled shape " + argNames.shape);
    }

    private AbstractValue callClosure(
            Closure closure,
            AbstractValue globals,
            List<String> keywords,
            List<AbstractValue> args
    ) {
        Optional<CallTarget> found = state.findTarget(closure.target);
        if (!found.isPresent()) {
            return miss("call of unknown procedure %s", closure.target);
        }
        if (keywords.size() > args.size()) {
            throw new ModelException(String.format(
                    "%d keyword names for %d arguments",
                    keywords.size(),
                    args.size()));
        }
        CallTarget target = found.get();
        List<String> params = target.parameters();
        int positionalCount = args.size() - keywords.size();
        List<AbstractValue> positional = new ArrayList<>(closure.captured);
        positional.addAll(args.subList(0, positionalCount));
        if (positional.size() > params.size()) {
            return miss("call of %s with %d positional arguments, which takes %d",
                    closure.target,
                    positional.size(),
                    params.size());
        }

        AbstractValue locals = state.allocate(Shape.DICT, null);
        for (int i = 0; i < positional.size(); i++) {
            setField(locals, params.get(i), positional.get(i));
        }
        for (int i = 0; i < keywords.size(); i++) {
            setField(locals, keywords.get(i), args.get(positionalCount + i));
        }

        List<AbstractValue> frame = new ArrayList<>(2);
        if (ownership == GlobalsOwnership.BY_MODULE) {
            frame.add(globals);
        }
        frame.add(locals);
        return target.invoke(this, frame);
    }

    public AbstractValue callMethod(
            AbstractValue name,
            AbstractValue receiver,
            AbstractValue argNames,
            List<AbstractValue> args
    ) {
        String method = nameOf(name);
        switch (receiver.shape) {
            case UNRESOLVED_MODULE:
                return callUnresolved(receiver, method, args);
            case DICT:
            case TUPLE:
            case INT:
            case NONE:
            case CONSTANT:
            case CLOSURE:
            case NULL:
            case FRESH:
                return call(getField(receiver, method), receiver, argNames, args);
        }
        throw new IllegalStateException("Unhandled shape " + receiver.shape);
    }

    private AbstractValue callUnresolved(AbstractValue module, String method, List<AbstractValue> args) {
        Optional<String> moduleName = state.fieldsOf(module)
                .map(fields -> fields.get("name"))
                .flatMap(AbstractValue::constantString);
        if (moduleName.isPresent() && moduleName.get().equals("asyncio")) {
            if (method.equals("run") && args.size() == 1) {
                LOGGER.atDebug().setMessage("Special method call (asyncio, run)").log();
                state.markAwaited(args.get(0));
                return state.fresh();
            } else if (method.equals("sleep")) {
                LOGGER.atDebug().setMessage("Special method call (asyncio, sleep)").log();
                AbstractValue awaitable = state.fresh();
                state.markAwaitable(awaitable);
                return awaitable;
            }
        }
        return miss("unknown special method call (%s, %s)", moduleName.orElse("?"), method);
    }

    public AbstractValue buildTuple(List<AbstractValue> elements) {
        AbstractValue tuple = state.allocate(Shape.TUPLE, null);
        for (int i = 0; i < elements.size(); i++) {
            setField(tuple, "#" + i, elements.get(i));
        }
        return tuple;
    }

    public AbstractValue importName(AbstractValue name) {
        String moduleName = nameOf(name);
        Optional<CallTarget> body = state.findTarget(moduleName + "." + MODULE_BODY);
        if (!body.isPresent()) {
            LOGGER.atDebug().setMessage("Module {} is unresolved").addArgument(moduleName).log();
            AbstractValue module = state.allocate(Shape.UNRESOLVED_MODULE, null);
            setField(module, "name", name);
            return module;
        }
        AbstractValue globals = state.allocate(Shape.DICT, null);
        body.get().invoke(this, Collections.singletonList(globals));
        return globals;
    }

    public AbstractValue makeDictionary(List<AbstractValue> items) {
        if (items.size() % 2 != 0) {
            throw new ModelException("make_dictionary expects keys and values, got " + items.size() + " arguments");
        }
        AbstractValue dict = state.allocate(Shape.DICT, null);
        for (int i = 0; i < items.size(); i += 2) {
            setField(dict, nameOf(items.get(i)), items.get(i + 1));
        }
        return dict;
    }

    public AbstractValue makeInt(AbstractValue arg) {
        Optional<BigInteger> value = arg.constantInt();
        return state.allocate(Shape.INT, value.orElse(null));
    }

    public void nullifyLocals(AbstractValue locals, List<AbstractValue> names) {
        AbstractValue unbound = state.allocate(Shape.NULL, null);
        for (AbstractValue name : names) {
            setField(locals, nameOf(name), unbound);
        }
    }

    public AbstractValue subscript(AbstractValue seq, AbstractValue index) {
        switch (seq.shape) {
            case TUPLE: {
                Optional<BigInteger> i = index.constantInt();
                if (!i.isPresent()) {
                    return miss("subscript of %s by non-constant %s", seq, index);
                }
                return getField(seq, "#" + i.get());
            }
            case DICT:
            case INT:
            case NONE:
            case CONSTANT:
            case UNRESOLVED_MODULE:
            case CLOSURE:
            case NULL:
            case FRESH:
                return miss("subscript of %s", seq);
        }
        throw new IllegalStateException("Unhandled shape " + seq.shape);
    }
}
