package io.shakemyleg.core.error;

/** Thrown on any attempt to assign through {@code inputs}. */
public final class InputsWriteException extends SmlRuntimeException {

    private static final long serialVersionUID = 1L;

    public InputsWriteException(String identifier) {
        super("Input store is immutable and cannot be written to (\"" + identifier + "\").");
    }
}
