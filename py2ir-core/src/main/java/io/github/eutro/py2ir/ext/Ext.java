package io.github.eutro.py2ir.ext;

/**
 * A named metadata slot, holding values of type {@code T} in {@link ExtContainer}s.
 * Exts are compared by identity, so each should be created once and kept in a constant.
 *
 * @param <T> The type of the values.
 */
public final class Ext<T> {
    private final String name;

    private Ext(String name) {
        this.name = name;
    }

    /**
     * Create a new ext. The name is only used for error messages.
     *
     * @param name The name of the ext.
     * @param <T>  The type of its values.
     * @return The new ext.
     */
    public static <T> Ext<T> named(String name) {
        return new Ext<>(name);
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
