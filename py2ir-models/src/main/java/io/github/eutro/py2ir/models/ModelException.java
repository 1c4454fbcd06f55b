package io.github.eutro.py2ir.models;

/**
 * Thrown when a builtin is applied in a way the IR never produces,
 * such as a name argument which is not a constant string.
 */
public class ModelException extends RuntimeException {
    public ModelException(String message) {
        super(message);
    }
}
