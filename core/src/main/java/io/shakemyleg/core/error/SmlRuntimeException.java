package io.shakemyleg.core.error;

/**
 * Abstract parent for per-cycle evaluation errors. Thrown from {@code StateMachine.run()}, {@code
 * advance()}, {@code reinit()} and {@code globals()}. A runtime error aborts the cycle: the state
 * transition and the partially built outputs are discarded. Carries the name of the state whose
 * cycle failed once the machine has attached it.
 */
public abstract class SmlRuntimeException extends SmlException {

    private static final long serialVersionUID = 1L;

    private String stateName;

    protected SmlRuntimeException(String message) {
        super(message, Phase.RUNTIME);
    }

    protected SmlRuntimeException(String message, Throwable cause) {
        super(message, cause, Phase.RUNTIME);
    }

    /** The state that was executing when the error occurred, or {@code null} outside a cycle. */
    public String stateName() {
        return stateName;
    }

    /**
     * Records the executing state. Only the first call has an effect, so an error rethrown through
     * several frames keeps the innermost state.
     */
    public SmlRuntimeException inState(String name) {
        if (this.stateName == null) {
            this.stateName = name;
        }
        return this;
    }
}
