package io.github.eutro.py2ir.passes.misc;

import io.github.eutro.py2ir.passes.IRPass;
import io.github.eutro.py2ir.passes.InPlaceIRPass;
import io.github.eutro.py2ir.ssa.Function;
import io.github.eutro.py2ir.ssa.Module;

/**
 * Lifts passes which operate on smaller IR parts into ones that operate on bigger parts.
 */
public class ForPass {
    /**
     * Lift a procedure pass to run over every procedure of a module.
     *
     * @param pass The procedure pass, which must be in-place.
     * @return The module pass.
     */
    public static InPlaceIRPass<Module> liftFunctions(IRPass<Function, ?> pass) {
        if (!pass.isInPlace()) {
            throw new IllegalArgumentException("Only in-place passes can be lifted");
        }
        return module -> {
            for (Function procedure : module.getProcedures()) {
                try {
                    pass.run(procedure);
                } catch (RuntimeException e) {
                    e.addSuppressed(new RuntimeException("in procedure " + procedure.qualifiedName));
                    throw e;
                }
            }
        };
    }
}
