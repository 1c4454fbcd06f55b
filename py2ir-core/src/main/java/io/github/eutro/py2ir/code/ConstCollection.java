package io.github.eutro.py2ir.code;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An immutable collection constant: a tuple or frozenset from the constant pool,
 * or a literal list, set or dict whose elements are all constants.
 */
public final class ConstCollection {
    public enum Kind {
        TUPLE,
        LIST,
        SET,
        FROZENSET,
        /**
         * Items alternate between keys and values.
         */
        DICT,
    }

    public final Kind kind;
    public final List<Object> items;

    public ConstCollection(Kind kind, List<?> items) {
        if (kind == Kind.DICT && items.size() % 2 != 0) {
            throw new IllegalArgumentException("Odd number of dict items");
        }
        this.kind = kind;
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    public static ConstCollection tuple(Object... items) {
        return new ConstCollection(Kind.TUPLE, Arrays.asList(items));
    }

    public int size() {
        return kind == Kind.DICT ? items.size() / 2 : items.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConstCollection that = (ConstCollection) o;
        if (kind != that.kind || items.size() != that.items.size()) return false;
        for (int i = 0; i < items.size(); i++) {
            if (!Constants.sameConstant(items.get(i), that.items.get(i))) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = kind.hashCode();
        for (Object item : items) {
            h = 31 * h + Constants.constantHash(item);
        }
        return h;
    }

    @Override
    public String toString() {
        return Constants.repr(this);
    }
}
