package io.github.eutro.py2ir.models;

import java.util.List;

/**
 * A procedure that closures can call.
 */
public interface CallTarget {
    /**
     * Get the names of the parameters, starting with the captured cells.
     *
     * @return The parameter names.
     */
    List<String> parameters();

    /**
     * Run the procedure.
     *
     * @param models The models, for the procedure to apply builtins with.
     * @param frame  The frame: the globals if they are {@link GlobalsOwnership#BY_MODULE owned by the module},
     *               then the locals, bound to the parameters.
     * @return The return value.
     */
    AbstractValue invoke(BuiltinModels models, List<AbstractValue> frame);
}
