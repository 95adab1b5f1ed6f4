package io.shakemyleg.standalone.config;

import io.shakemyleg.core.engine.CompileOptions;
import io.shakemyleg.core.engine.GlobalsRollback;
import io.shakemyleg.core.engine.TransitionCheck;

/**
 * Configuration of the standalone runner.
 *
 * <p>
 * Everything has a default except {@code script}. Use {@link #builder()} to
 * construct instances.
 *
 * @param script          path of the script to compile (required)
 * @param globals         optional JSON or YAML file whose object seeds the
 *                        machine's globals, or {@code null}
 * @param mode            call made for each input line
 * @param failFast        abort on the first runtime error instead of reporting
 *                        it and continuing
 * @param transitionCheck compile-time check of {@code changeto} targets
 * @param globalsRollback what a failed cycle does to globals
 * @param loggingFormat   {@code text} or {@code json}
 * @param loggingLevel    root log level
 */
public record RunnerConfig(
        String script,
        String globals,
        CycleMode mode,
        boolean failFast,
        TransitionCheck transitionCheck,
        GlobalsRollback globalsRollback,
        String loggingFormat,
        String loggingLevel) {

    /** Compile options derived from this configuration. */
    public CompileOptions compileOptions() {
        return CompileOptions.builder()
                .transitionCheck(transitionCheck)
                .globalsRollback(globalsRollback)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder with the documented defaults. */
    public static final class Builder {

        private String script;
        private String globals;
        private CycleMode mode = CycleMode.RUN;
        private boolean failFast = false;
        private TransitionCheck transitionCheck = TransitionCheck.STRICT;
        private GlobalsRollback globalsRollback = GlobalsRollback.NONE;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder script(String script) {
            this.script = script;
            return this;
        }

        public Builder globals(String globals) {
            this.globals = globals;
            return this;
        }

        public Builder mode(CycleMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder failFast(boolean failFast) {
            this.failFast = failFast;
            return this;
        }

        public Builder transitionCheck(TransitionCheck transitionCheck) {
            this.transitionCheck = transitionCheck;
            return this;
        }

        public Builder globalsRollback(GlobalsRollback globalsRollback) {
            this.globalsRollback = globalsRollback;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * @throws ConfigLoadException if {@code script} is missing or the logging
         *                             format is unknown
         */
        public RunnerConfig build() {
            if (script == null || script.isBlank()) {
                throw new ConfigLoadException("Missing required configuration: script (or SML_SCRIPT)");
            }
            if (!"text".equalsIgnoreCase(loggingFormat) && !"json".equalsIgnoreCase(loggingFormat)) {
                throw new ConfigLoadException(
                        "Invalid logging.format '" + loggingFormat + "', expected one of: text, json");
            }
            return new RunnerConfig(
                    script, globals, mode, failFast, transitionCheck, globalsRollback, loggingFormat, loggingLevel);
        }
    }
}
