package io.github.eutro.py2ir.test;

import io.github.eutro.py2ir.code.CodeObject;
import io.github.eutro.py2ir.code.ModuleCode;
import io.github.eutro.py2ir.passes.convert.PyToIr;
import io.github.eutro.py2ir.ssa.Diagnostic;
import io.github.eutro.py2ir.ssa.Function;
import io.github.eutro.py2ir.ssa.Module;
import io.github.eutro.py2ir.ssa.display.TextDisplay;
import org.jetbrains.annotations.NotNull;

import static org.junit.jupiter.api.Assertions.*;

public class Utils {
    public static final String MODULE_NAME = "dummy";

    @NotNull
    public static Module translate(CodeObject body) {
        return translate(PyToIr.INSTANCE, body);
    }

    @NotNull
    public static Module translate(PyToIr pass, CodeObject body) {
        return pass.run(new ModuleCode(MODULE_NAME, body));
    }

    /**
     * Translate a module, which must succeed in full, and render it.
     */
    public static String display(CodeObject body) {
        Module module = translate(body);
        assertEquals(0, module.getDiagnostics().size(), () -> "diagnostics: " + module.getDiagnostics());
        return TextDisplay.INSTANCE.run(module);
    }

    public static String display(Module module, String qualifiedName) {
        Function func = module.findProcedure(qualifiedName)
                .orElseThrow(() -> new AssertionError("no procedure " + qualifiedName + " in " + module.getProcedures()));
        return TextDisplay.INSTANCE.display(func, func == module.getToplevel());
    }

    /**
     * The expected rendering of a module: its header followed by its procedures.
     */
    public static String module(String... procedures) {
        StringBuilder sb = new StringBuilder("module ").append(MODULE_NAME).append(":\n");
        for (String procedure : procedures) {
            sb.append('\n').append(procedure);
        }
        return sb.toString();
    }

    /**
     * The expected rendering of a procedure. Lines starting with {@code b} are block labels,
     * empty lines separate blocks, and the rest are instructions.
     */
    public static String proc(String header, String... body) {
        StringBuilder sb = new StringBuilder("  ").append(header).append(":\n");
        for (String line : body) {
            if (line.isEmpty()) {
                sb.append('\n');
            } else if (line.startsWith("b")) {
                sb.append("    ").append(line).append('\n');
            } else {
                sb.append("      ").append(line).append('\n');
            }
        }
        return sb.toString();
    }

    public static Diagnostic onlyDiagnostic(Module module) {
        assertEquals(1, module.getDiagnostics().size(), () -> "diagnostics: " + module.getDiagnostics());
        return module.getDiagnostics().get(0);
    }
}
