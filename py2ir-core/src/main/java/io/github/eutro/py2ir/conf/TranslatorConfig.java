package io.github.eutro.py2ir.conf;

import java.util.concurrent.Executor;

/**
 * Settings for {@link io.github.eutro.py2ir.passes.convert.PyToIr}. Immutable.
 */
public class TranslatorConfig {
    /**
     * The executor sibling procedures are translated on.
     */
    public final Executor executor;
    /**
     * Whether every procedure is checked with
     * {@link io.github.eutro.py2ir.passes.meta.VerifyIntegrity} after translation.
     */
    public final boolean verify;
    /**
     * How many times the simulation of one procedure may restart to parameterize
     * a stack slot that a back-edge disagrees on.
     */
    public final int maxMergeRestarts;

    TranslatorConfig(Executor executor, boolean verify, int maxMergeRestarts) {
        this.executor = executor;
        this.verify = verify;
        this.maxMergeRestarts = maxMergeRestarts;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TranslatorConfig defaults() {
        return builder().build();
    }

    public static class Builder {
        private Executor executor = Runnable::run;
        private boolean verify = true;
        private int maxMergeRestarts = 32;

        public Builder setExecutor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public Builder setVerify(boolean verify) {
            this.verify = verify;
            return this;
        }

        public Builder setMaxMergeRestarts(int maxMergeRestarts) {
            if (maxMergeRestarts < 0) {
                throw new IllegalArgumentException("maxMergeRestarts must not be negative");
            }
            this.maxMergeRestarts = maxMergeRestarts;
            return this;
        }

        public TranslatorConfig build() {
            return new TranslatorConfig(executor, verify, maxMergeRestarts);
        }
    }
}
