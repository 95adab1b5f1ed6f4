package io.shakemyleg.core.error;

/**
 * Abstract base for all shakemyleg exceptions. Never thrown directly: use the concrete subclasses
 * under {@link SmlCompileException} or {@link SmlRuntimeException}.
 */
public abstract class SmlException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        COMPILE,
        RUNTIME
    }

    private final Phase phase;

    protected SmlException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected SmlException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
