package io.github.eutro.py2ir.passes.misc;

import io.github.eutro.py2ir.passes.IRPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs a sequence of passes, each on the output of the previous one.
 * Nested chains are flattened, so a failure names its position in the whole sequence.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final List<IRPass<Object, Object>> steps;
    private final boolean inPlace;

    public ChainedPass(IRPass<A, B> first, IRPass<B, C> next) {
        List<IRPass<Object, Object>> flat = new ArrayList<>();
        flatten(flat, first);
        flatten(flat, next);
        steps = Collections.unmodifiableList(flat);
        inPlace = first.isInPlace() && next.isInPlace();
    }

    @SuppressWarnings("unchecked")
    private static void flatten(List<IRPass<Object, Object>> into, IRPass<?, ?> pass) {
        if (pass instanceof ChainedPass) {
            into.addAll(((ChainedPass<?, ?, ?>) pass).steps);
        } else {
            into.add((IRPass<Object, Object>) pass);
        }
    }

    @Override
    public boolean isInPlace() {
        return inPlace;
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        Object acc = a;
        for (int i = 0; i < steps.size(); i++) {
            IRPass<Object, Object> step = steps.get(i);
            try {
                acc = step.run(acc);
            } catch (RuntimeException e) {
                e.addSuppressed(new RuntimeException(String.format(
                        "in step %d of %d (%s)",
                        i + 1,
                        steps.size(),
                        step.getClass().getSimpleName())));
                throw e;
            }
        }
        return (C) acc;
    }
}
