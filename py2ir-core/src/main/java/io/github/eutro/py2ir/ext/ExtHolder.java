package io.github.eutro.py2ir.ext;

import org.jetbrains.annotations.Nullable;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * An {@link ExtContainer} backed by an identity map, allocated on the first attachment.
 * Most temporaries and instructions never have an ext attached.
 */
public class ExtHolder implements ExtContainer {
    @Nullable
    private Map<Ext<?>, Object> exts;

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (exts == null) exts = new IdentityHashMap<>(4);
        exts.put(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (exts != null) exts.remove(ext);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        return exts == null ? null : (T) exts.get(ext);
    }
}
