package io.github.eutro.py2ir.scope;

import io.github.eutro.py2ir.code.CodeObject;
import io.github.eutro.py2ir.code.Instruction;
import io.github.eutro.py2ir.passes.convert.TranslationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The resolving pass of scope resolution: classifies every name a procedure references.
 * <ul>
 *     <li>{@code *_FAST}: {@link Scope#LOCAL}</li>
 *     <li>{@code *_GLOBAL}: {@link Scope#GLOBAL}</li>
 *     <li>{@code *_NAME}: {@link Scope#TOPLEVEL}, except in a module body, where names that
 *     some procedure declares {@code global} are {@link Scope#GLOBAL}</li>
 *     <li>closure instructions: {@link Scope#deref(int)}, by position in the cell variables
 *     followed by the free variables</li>
 * </ul>
 */
public class ScopeResolver {
    private final Set<String> declaredGlobals;

    /**
     * @param declaredGlobals The result of {@link GlobalDeclarations} for the module.
     */
    public ScopeResolver(Set<String> declaredGlobals) {
        this.declaredGlobals = declaredGlobals;
    }

    public ScopeTable resolve(CodeObject code, ProcedureKind kind) {
        Map<String, Scope> names = new LinkedHashMap<>();
        for (String param : code.parameterNames()) {
            names.put(param, Scope.LOCAL);
        }
        for (Instruction insn : code.instructions) {
            Scope scope;
            switch (insn.opcode) {
                case LOAD_FAST:
                case STORE_FAST:
                case DELETE_FAST:
                    scope = Scope.LOCAL;
                    break;
                case LOAD_GLOBAL:
                case STORE_GLOBAL:
                case DELETE_GLOBAL:
                    scope = Scope.GLOBAL;
                    break;
                case LOAD_NAME:
                case STORE_NAME:
                case DELETE_NAME:
                    scope = kind == ProcedureKind.MODULE && declaredGlobals.contains(insn.name())
                            ? Scope.GLOBAL
                            : Scope.TOPLEVEL;
                    break;
                default:
                    continue;
            }
            Scope prev = names.putIfAbsent(insn.name(), scope);
            if (prev != null && !prev.equals(scope)) {
                throw new TranslationException(insn, String.format(
                        "name %s is both %s and %s",
                        insn.name(),
                        prev,
                        scope));
            }
        }

        List<ScopedName> cells = new ArrayList<>();
        List<String> cellNames = code.cellAndFreeVars();
        for (int i = 0; i < cellNames.size(); i++) {
            cells.add(new ScopedName(Scope.deref(i), cellNames.get(i)));
        }
        return new ScopeTable(names, cells);
    }
}
