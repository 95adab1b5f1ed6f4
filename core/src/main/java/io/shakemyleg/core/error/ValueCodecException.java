package io.shakemyleg.core.error;

/** Thrown when a host value cannot be converted to or from the internal value tree. */
public final class ValueCodecException extends SmlRuntimeException {

    private static final long serialVersionUID = 1L;

    public ValueCodecException(String message) {
        super(message);
    }

    public ValueCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
