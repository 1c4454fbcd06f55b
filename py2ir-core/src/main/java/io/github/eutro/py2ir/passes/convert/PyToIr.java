package io.github.eutro.py2ir.passes.convert;

import io.github.eutro.py2ir.code.CodeObject;
import io.github.eutro.py2ir.code.ModuleCode;
import io.github.eutro.py2ir.conf.TranslatorConfig;
import io.github.eutro.py2ir.passes.IRPass;
import io.github.eutro.py2ir.passes.meta.VerifyIntegrity;
import io.github.eutro.py2ir.scope.GlobalDeclarations;
import io.github.eutro.py2ir.scope.ProcedureKind;
import io.github.eutro.py2ir.scope.ScopeResolver;
import io.github.eutro.py2ir.scope.ScopeTable;
import io.github.eutro.py2ir.ssa.Diagnostic;
import io.github.eutro.py2ir.ssa.Function;
import io.github.eutro.py2ir.ssa.Module;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Translates a module's code tree into IR.
 * <p>
 * The module body is translated first, then every procedure it defines, recursively. A procedure
 * that fails to translate is recorded as a {@link Diagnostic}, and the procedures nested in it are
 * not attempted; its siblings are unaffected. Siblings may be translated concurrently on the
 * configured executor, but the procedures of the result are always in depth-first definition order.
 */
public class PyToIr implements IRPass<ModuleCode, Module> {
    private static final Logger LOGGER = LoggerFactory.getLogger(PyToIr.class);

    /**
     * An instance of this pass with the {@link TranslatorConfig#defaults() default configuration}.
     */
    public static final PyToIr INSTANCE = new PyToIr(TranslatorConfig.defaults());

    private final TranslatorConfig config;

    public PyToIr(TranslatorConfig config) {
        this.config = config;
    }

    private static final class Translated {
        @Nullable
        final Function function;
        @Nullable
        final Diagnostic diagnostic;
        final List<Translated> children = new ArrayList<>();

        Translated(@Nullable Function function, @Nullable Diagnostic diagnostic) {
            this.function = function;
            this.diagnostic = diagnostic;
        }
    }

    @Override
    public Module run(ModuleCode moduleCode) {
        ScopeResolver resolver = new ScopeResolver(GlobalDeclarations.INSTANCE.run(moduleCode.body));
        LexicalPath root = LexicalPath.root(moduleCode.name);

        Translated tree;
        try {
            tree = translateTree(resolver, moduleCode.body, root, true).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }

        Module module = new Module(moduleCode.name);
        if (tree.function != null) {
            module.setToplevel(tree.function);
        }
        Set<String> seen = new HashSet<>();
        Deque<Translated> todo = new ArrayDeque<>();
        todo.push(tree);
        while (!todo.isEmpty()) {
            Translated node = todo.pop();
            if (node.function != null) {
                if (!seen.add(node.function.qualifiedName)) {
                    LOGGER.atDebug()
                            .setMessage("Duplicate qualified name {} in module {}")
                            .addArgument(node.function.qualifiedName)
                            .addArgument(moduleCode.name)
                            .log();
                }
                module.addProcedure(node.function);
            } else if (node.diagnostic != null) {
                module.addDiagnostic(node.diagnostic);
            }
            for (int i = node.children.size() - 1; i >= 0; i--) {
                todo.push(node.children.get(i));
            }
        }
        return module;
    }

    private CompletableFuture<Translated> translateTree(
            ScopeResolver resolver,
            CodeObject code,
            LexicalPath path,
            boolean isModuleBody
    ) {
        return CompletableFuture.supplyAsync(() -> translateOne(resolver, code, path, isModuleBody), config.executor)
                .thenCompose(pair -> {
                    Translated node = pair.getKey();
                    List<ProcedureTranslator.Hoisted> hoisted = pair.getValue();
                    if (hoisted.isEmpty()) {
                        return CompletableFuture.completedFuture(node);
                    }
                    List<CompletableFuture<Translated>> children = new ArrayList<>(hoisted.size());
                    for (ProcedureTranslator.Hoisted child : hoisted) {
                        children.add(translateTree(resolver, child.code, child.path, false));
                    }
                    return CompletableFuture.allOf(children.toArray(new CompletableFuture[0]))
                            .thenApply(v -> {
                                for (CompletableFuture<Translated> child : children) {
                                    node.children.add(child.join());
                                }
                                return node;
                            });
                });
    }

    private Map.Entry<Translated, List<ProcedureTranslator.Hoisted>> translateOne(
            ScopeResolver resolver,
            CodeObject code,
            LexicalPath path,
            boolean isModuleBody
    ) {
        ProcedureTranslator.Result result;
        try {
            ProcedureKind kind = ProcedureKind.of(code, isModuleBody);
            ScopeTable scopes = resolver.resolve(code, kind);
            result = new ProcedureTranslator(code, kind, path, scopes, config.maxMergeRestarts).translate();
        } catch (TranslationException e) {
            return failed(new Diagnostic(
                    path.toString(),
                    e.getOffset(),
                    e.getOpcode() == null ? null : e.getOpcode().name(),
                    e.getReason()));
        }

        if (config.verify) {
            try {
                VerifyIntegrity.INSTANCE.run(result.function);
            } catch (IllegalStateException e) {
                return failed(new Diagnostic(
                        path.toString(),
                        -1,
                        null,
                        "IR verification failed: " + e.getMessage()));
            }
        }
        Function function = result.function;
        function.freeze();
        LOGGER.atDebug()
                .setMessage("Translated {} into {} blocks")
                .addArgument(path)
                .addArgument(() -> function.getBlocks().size())
                .log();
        return new AbstractMap.SimpleImmutableEntry<>(
                new Translated(function, null),
                result.children);
    }

    private static Map.Entry<Translated, List<ProcedureTranslator.Hoisted>> failed(Diagnostic diagnostic) {
        LOGGER.warn("Failed to translate {}", diagnostic);
        return new AbstractMap.SimpleImmutableEntry<>(
                new Translated(null, diagnostic),
                Collections.emptyList());
    }
}
