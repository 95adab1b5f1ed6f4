package io.shakemyleg.core.error;

/** Thrown when a {@code changeto} names a state that the machine does not define. */
public final class NonexistentStateException extends SmlRuntimeException {

    private static final long serialVersionUID = 1L;

    private final String targetState;

    public NonexistentStateException(String targetState) {
        super("Nonexistent state " + targetState);
        this.targetState = targetState;
    }

    /** The state name that could not be resolved. */
    public String targetState() {
        return targetState;
    }
}
