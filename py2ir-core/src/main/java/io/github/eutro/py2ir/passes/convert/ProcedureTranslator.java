package io.github.eutro.py2ir.passes.convert;

import io.github.eutro.py2ir.code.CodeObject;
import io.github.eutro.py2ir.scope.ProcedureKind;
import io.github.eutro.py2ir.scope.ScopeTable;
import io.github.eutro.py2ir.ssa.Function;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Translates a single code object into a procedure, leaving nested code objects to the caller.
 */
public final class ProcedureTranslator {
    /**
     * A nested code object found while translating, to be translated as its own procedure.
     */
    public static final class Hoisted {
        public final CodeObject code;
        public final LexicalPath path;

        Hoisted(CodeObject code, LexicalPath path) {
            this.code = code;
            this.path = path;
        }
    }

    public static final class Result {
        public final Function function;
        /**
         * The nested procedures, in order of definition.
         */
        public final List<Hoisted> children;

        Result(Function function, List<Hoisted> children) {
            this.function = function;
            this.children = Collections.unmodifiableList(children);
        }
    }

    final CodeObject code;
    final ProcedureKind kind;
    final LexicalPath path;
    final ScopeTable scopes;
    private final int maxMergeRestarts;

    public ProcedureTranslator(
            CodeObject code,
            ProcedureKind kind,
            LexicalPath path,
            ScopeTable scopes,
            int maxMergeRestarts
    ) {
        this.code = code;
        this.kind = kind;
        this.path = path;
        this.scopes = scopes;
        this.maxMergeRestarts = maxMergeRestarts;
    }

    Function newFunction() {
        return new Function(path.toString(), path.localName(), kind, code.parameterNames());
    }

    /**
     * Translate the code object.
     *
     * @return The procedure and the nested code objects it defines.
     * @throws TranslationException If the code object cannot be translated.
     */
    public Result translate() {
        BlockPartition partition = CfgBuilder.INSTANCE.run(code);
        Set<Long> forced = new HashSet<>();
        Set<Integer> builtOnExit = new HashSet<>();
        for (int attempt = 0; attempt <= maxMergeRestarts; attempt++) {
            ConvertState state = new ConvertState(this, partition, forced, builtOnExit);
            if (state.simulate()) {
                return state.finish();
            }
        }
        throw new TranslationException("stack merge did not converge after "
                + maxMergeRestarts + " restarts");
    }
}
