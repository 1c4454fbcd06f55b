package io.github.eutro.py2ir.ops;

/**
 * The kind of an {@link Op}, like {@code $Call} or {@code load}, without any immediates.
 * <p>
 * Keys are compared by identity; every key the translator emits is a constant of {@link PyOps}.
 */
public abstract class OpKey {
    /**
     * The name the op is rendered with.
     */
    public final String mnemonic;

    protected OpKey(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
