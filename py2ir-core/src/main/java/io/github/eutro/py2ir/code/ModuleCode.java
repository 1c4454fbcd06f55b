package io.github.eutro.py2ir.code;

/**
 * A module to be translated: its name and the code object of its body.
 */
public final class ModuleCode {
    public final String name;
    public final CodeObject body;

    public ModuleCode(String name, CodeObject body) {
        this.name = name;
        this.body = body;
    }
}
