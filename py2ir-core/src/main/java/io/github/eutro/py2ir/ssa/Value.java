package io.github.eutro.py2ir.ssa;

import io.github.eutro.py2ir.ext.ExtHolder;

/**
 * An argument of an instruction: either a {@link Var temporary} or an inlined {@link Const constant}.
 */
public abstract class Value extends ExtHolder {
    Value() {
    }
}
