package io.github.eutro.py2ir.scope;

import io.github.eutro.py2ir.code.CodeObject;
import io.github.eutro.py2ir.code.Instruction;
import io.github.eutro.py2ir.code.Opcode;
import io.github.eutro.py2ir.passes.IRPass;

import java.util.*;

/**
 * The collecting pass of scope resolution: finds every name that some procedure of
 * a module binds through a {@code global} declaration, that is, every name stored or
 * deleted with {@link Opcode#STORE_GLOBAL} or {@link Opcode#DELETE_GLOBAL} anywhere
 * in the module's code tree.
 */
public class GlobalDeclarations implements IRPass<CodeObject, Set<String>> {
    /**
     * A singleton instance of this pass.
     */
    public static final GlobalDeclarations INSTANCE = new GlobalDeclarations();

    @Override
    public Set<String> run(CodeObject moduleBody) {
        Set<String> declared = new TreeSet<>();
        Deque<CodeObject> todo = new ArrayDeque<>();
        todo.push(moduleBody);
        while (!todo.isEmpty()) {
            CodeObject code = todo.pop();
            for (Instruction insn : code.instructions) {
                if (insn.opcode == Opcode.STORE_GLOBAL || insn.opcode == Opcode.DELETE_GLOBAL) {
                    declared.add(insn.name());
                }
            }
            for (CodeObject nested : code.nestedCode()) {
                todo.push(nested);
            }
        }
        return Collections.unmodifiableSet(declared);
    }
}
