package io.github.eutro.py2ir.passes;

/**
 * A pass which annotates or checks the IR it is given, and returns that same IR.
 * Analyses like {@link io.github.eutro.py2ir.passes.meta.ComputeDoms} attach their
 * results as exts; checks like {@link io.github.eutro.py2ir.passes.meta.VerifyIntegrity} throw.
 *
 * @param <T> The type of IR this pass operates on.
 */
public interface InPlaceIRPass<T> extends IRPass<T, T> {
    void runInPlace(T t);

    @Override
    default T run(T t) {
        runInPlace(t);
        return t;
    }

    @Override
    default boolean isInPlace() {
        return true;
    }
}
