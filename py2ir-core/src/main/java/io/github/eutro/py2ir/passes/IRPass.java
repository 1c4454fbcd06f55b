package io.github.eutro.py2ir.passes;

import io.github.eutro.py2ir.passes.misc.ChainedPass;

/**
 * A step of the pipeline from module code to IR and beyond, such as
 * {@link io.github.eutro.py2ir.passes.convert.PyToIr translation}, verification or rendering.
 *
 * @param <A> The input type.
 * @param <B> The output type.
 */
public interface IRPass<A, B> {
    B run(A a);

    /**
     * Whether this pass mutates its input and returns it, rather than producing something new.
     * Only in-place procedure passes can be lifted over a whole module.
     *
     * @return Whether the pass is in-place.
     */
    default boolean isInPlace() {
        return false;
    }

    /**
     * Compose this pass with another, e.g. {@code PyToIr.INSTANCE.then(TextDisplay.INSTANCE)}.
     *
     * @param next The pass to run on the output of this one.
     * @param <C>  The output type of the next pass.
     * @return The composed pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
