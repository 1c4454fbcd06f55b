package io.github.eutro.py2ir.models;

/**
 * The runtime shape of an abstract value, which decides how builtins dispatch on it.
 */
public enum Shape {
    /**
     * A name-keyed mapping: a dict, a frame's locals or a module's globals.
     */
    DICT,
    /**
     * A tuple, with its elements in the fields {@code #0}, {@code #1}, ...
     */
    TUPLE,
    /**
     * A value tagged with the integer type, equal to its payload if that is not null.
     */
    INT,
    NONE,
    /**
     * A constant other than an integer or None, such as a string.
     */
    CONSTANT,
    /**
     * A module that was imported but has no translated body, with its name in the field {@code name}.
     */
    UNRESOLVED_MODULE,
    /**
     * A function value, with a {@link Closure} payload.
     */
    CLOSURE,
    /**
     * The value of a local which has been unbound.
     */
    NULL,
    /**
     * An unconstrained value, about which nothing is known.
     */
    FRESH,
}
