package io.github.eutro.py2ir.models;

/**
 * Who provides the globals of a called procedure.
 */
public enum GlobalsOwnership {
    /**
     * The caller passes the module's globals to every call, before the callee's locals.
     */
    BY_MODULE,
    /**
     * Closures own their globals, and calls only pass the callee's locals.
     */
    BY_CLOSURES,
}
