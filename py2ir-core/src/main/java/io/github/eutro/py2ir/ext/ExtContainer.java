package io.github.eutro.py2ir.ext;

import org.jetbrains.annotations.Nullable;

/**
 * Something exts can be attached to. IR nodes implement this so that passes can attach
 * metadata (predecessors, dominators, source offsets) without widening the node classes.
 */
public interface ExtContainer {
    /**
     * Set the value of {@code ext} in this container, replacing any previous value.
     *
     * @param ext   The ext.
     * @param value The value.
     * @param <T>   The type of the ext.
     */
    <T> void attachExt(Ext<T> ext, T value);

    <T> void removeExt(Ext<T> ext);

    /**
     * Get the value of {@code ext} in this container.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value, or null if none was attached.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    /**
     * Get the value of {@code ext} in this container, which the pass computing it must already have attached.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value.
     * @throws IllegalStateException If no value was attached.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T value = getNullable(ext);
        if (value == null) {
            throw new IllegalStateException(ext + " has not been computed for " + this);
        }
        return value;
    }
}
