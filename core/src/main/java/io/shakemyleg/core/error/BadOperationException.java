package io.shakemyleg.core.error;

/** Thrown when an operator is applied to operands of the wrong kind, or when assigning to a non-identifier. */
public final class BadOperationException extends SmlRuntimeException {

    private static final long serialVersionUID = 1L;

    public BadOperationException(String message) {
        super(message);
    }
}
