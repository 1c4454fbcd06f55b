package io.github.eutro.py2ir.ssa;

import io.github.eutro.py2ir.ext.ExtHolder;
import io.github.eutro.py2ir.scope.ProcedureKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A procedure: the IR of one code object.
 * <p>
 * Once {@link #freeze() frozen} neither the function nor its blocks can be changed.
 */
public final class Function extends ExtHolder {
    public final String qualifiedName;
    public final String localName;
    public final ProcedureKind kind;
    public final List<String> params;
    private final List<BasicBlock> blocks = new ArrayList<>(); // [0] is entry
    private int nextVar = 0;
    private boolean frozen;

    public Function(String qualifiedName, String localName, ProcedureKind kind, List<String> params) {
        this.qualifiedName = qualifiedName;
        this.localName = localName;
        this.kind = kind;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
    }

    public Var newVar() {
        return new Var(nextVar++);
    }

    public BasicBlock newBb() {
        if (frozen) throw new IllegalStateException(qualifiedName + " is frozen");
        BasicBlock bb = new BasicBlock(blocks.size());
        blocks.add(bb);
        return bb;
    }

    public List<BasicBlock> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    public BasicBlock getEntry() {
        return blocks.get(0);
    }

    public void freeze() {
        frozen = true;
        for (BasicBlock block : blocks) {
            block.freeze();
        }
    }

    public boolean isFrozen() {
        return frozen;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(qualifiedName).append(":\n");
        for (BasicBlock block : blocks) {
            sb.append(block).append('\n');
        }
        return sb.toString();
    }
}
