package io.github.eutro.py2ir.passes.convert;

import io.github.eutro.py2ir.code.ConstCollection;
import io.github.eutro.py2ir.ssa.Const;
import io.github.eutro.py2ir.ssa.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Entries of the simulated operand stack which are not IR values.
 * <p>
 * Each is consumed by the lowering of a later instruction, and is never passed to an IR instruction.
 */
final class StackValues {
    private StackValues() {
    }

    /**
     * Pushed by {@code LOAD_METHOD}, consumed by {@code CALL_METHOD}.
     */
    static final class MethodRef {
        final Value receiver;
        final String name;

        MethodRef(Value receiver, String name) {
            this.receiver = receiver;
            this.name = name;
        }

        @Override
        public String toString() {
            return "<method " + name + " of " + receiver + ">";
        }
    }

    /**
     * Pushed when entering a {@code with} block in place of the bound {@code __exit__},
     * consumed by the exit call of every path leaving the block.
     */
    static final class ExitMarker {
        final Value manager;
        final boolean async;

        ExitMarker(Value manager, boolean async) {
            this.manager = manager;
            this.async = async;
        }

        String exitMethod() {
            return async ? "__aexit__" : "__exit__";
        }

        @Override
        public String toString() {
            return "<" + exitMethod() + " of " + manager + ">";
        }
    }

    /**
     * Pushed by {@code LOAD_BUILD_CLASS}.
     */
    static final class BuildClassMarker {
        static final BuildClassMarker INSTANCE = new BuildClassMarker();

        private BuildClassMarker() {
        }

        @Override
        public String toString() {
            return "<build class>";
        }
    }

    /**
     * A list, set or dict literal whose elements are all constants so far.
     * <p>
     * It becomes a single {@link Const} wherever it is consumed, and an explicit build instruction
     * in the block that mutates or duplicates it. A collection that reaches a block parameter is
     * built on the edges that carry it instead. Blocks may share one pending collection through
     * their entry stacks, so it is never changed in place.
     */
    static final class PendingCollection {
        /**
         * The offset of the instruction which produced this collection.
         */
        final int origin;
        final ConstCollection.Kind kind;
        final List<Object> items;

        PendingCollection(int origin, ConstCollection.Kind kind, List<?> items) {
            this.origin = origin;
            this.kind = kind;
            this.items = Collections.unmodifiableList(new ArrayList<>(items));
        }

        PendingCollection extendedWith(int origin, List<?> more) {
            List<Object> all = new ArrayList<>(items);
            all.addAll(more);
            return new PendingCollection(origin, kind, all);
        }

        Const toConst() {
            return Const.of(new ConstCollection(kind, items));
        }

        List<Value> itemValues() {
            List<Value> values = new ArrayList<>(items.size());
            for (Object item : items) {
                values.add(Const.of(item));
            }
            return values;
        }

        @Override
        public String toString() {
            return "<pending " + toConst() + ">";
        }
    }
}
