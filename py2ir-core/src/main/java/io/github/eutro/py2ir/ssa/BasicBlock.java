package io.github.eutro.py2ir.ssa;

import io.github.eutro.py2ir.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class BasicBlock extends ExtHolder {
    public final int id;
    private final List<Var> params = new ArrayList<>();
    private final List<Effect> effects = new ArrayList<>();
    @Nullable
    private Control control;
    private boolean frozen;

    BasicBlock(int id) {
        this.id = id;
    }

    public List<Var> getParams() {
        return Collections.unmodifiableList(params);
    }

    public void addParam(Var param) {
        ensureMutable();
        params.add(param);
    }

    public List<Effect> getEffects() {
        return Collections.unmodifiableList(effects);
    }

    public void addEffect(Effect effect) {
        ensureMutable();
        if (control != null) {
            throw new IllegalStateException("b" + id + " is already terminated");
        }
        effects.add(effect);
    }

    @Nullable
    public Control getControl() {
        return control;
    }

    public void setControl(Control control) {
        ensureMutable();
        this.control = control;
    }

    public List<BasicBlock> successors() {
        if (control == null) return Collections.emptyList();
        List<BasicBlock> succs = new ArrayList<>(control.targets.size());
        for (Jump target : control.targets) {
            succs.add(target.target);
        }
        return succs;
    }

    void freeze() {
        frozen = true;
    }

    private void ensureMutable() {
        if (frozen) throw new IllegalStateException("b" + id + " is frozen");
    }

    /**
     * Render the label of this block, with its parameters.
     *
     * @return The label, like {@code b3(n2)}.
     */
    public String toLabelString() {
        StringBuilder sb = new StringBuilder("b").append(id);
        if (!params.isEmpty()) {
            sb.append('(');
            for (int i = 0; i < params.size(); i++) {
                if (i != 0) sb.append(", ");
                sb.append(params.get(i));
            }
            sb.append(')');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toLabelString()).append(":\n");
        for (Effect effect : effects) {
            sb.append("  ").append(effect).append('\n');
        }
        sb.append("  ").append(control);
        return sb.toString();
    }
}
