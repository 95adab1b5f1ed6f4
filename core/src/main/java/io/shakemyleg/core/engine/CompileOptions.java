package io.shakemyleg.core.engine;

import io.shakemyleg.core.spi.MachineListener;
import java.util.Objects;

/**
 * Options fixed at compile time and carried by every machine the compiler
 * produces.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param transitionCheck when {@code changeto} targets are validated
 * @param globalsRollback what a failed cycle does to globals
 * @param listener        receives cycle events; {@link MachineListener#NOOP}
 *                        when unset
 */
public record CompileOptions(
        TransitionCheck transitionCheck, GlobalsRollback globalsRollback, MachineListener listener) {

    private static final CompileOptions DEFAULTS =
            new CompileOptions(TransitionCheck.STRICT, GlobalsRollback.NONE, MachineListener.NOOP);

    public CompileOptions {
        Objects.requireNonNull(transitionCheck, "transitionCheck must not be null");
        Objects.requireNonNull(globalsRollback, "globalsRollback must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
    }

    /** Strict transition check, no globals rollback, no listener. */
    public static CompileOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Fluent builder starting from {@link #defaults()}. */
    public static final class Builder {

        private TransitionCheck transitionCheck = TransitionCheck.STRICT;
        private GlobalsRollback globalsRollback = GlobalsRollback.NONE;
        private MachineListener listener = MachineListener.NOOP;

        Builder() {}

        public Builder transitionCheck(TransitionCheck transitionCheck) {
            this.transitionCheck = transitionCheck;
            return this;
        }

        public Builder globalsRollback(GlobalsRollback globalsRollback) {
            this.globalsRollback = globalsRollback;
            return this;
        }

        public Builder listener(MachineListener listener) {
            this.listener = listener;
            return this;
        }

        public CompileOptions build() {
            return new CompileOptions(transitionCheck, globalsRollback, listener);
        }
    }
}
