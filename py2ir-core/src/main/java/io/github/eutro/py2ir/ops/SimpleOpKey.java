package io.github.eutro.py2ir.ops;

/**
 * A key for ops which carry no immediate. There is exactly one {@link Op} per such key,
 * so those ops can be compared with {@code ==}, as in {@code op == PyOps.CALL}.
 */
public class SimpleOpKey extends OpKey {
    private final Op singleton;

    public SimpleOpKey(String mnemonic) {
        super(mnemonic);
        singleton = new Op(this);
    }

    /**
     * @return The only op of this key.
     */
    public Op create() {
        return singleton;
    }
}
