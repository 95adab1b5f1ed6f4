package io.shakemyleg.core.error;

/**
 * Thrown when an identifier path is structurally unusable: a write collides with a non-container
 * value part-way along the path, or a read lands on an object or {@code null} instead of a value.
 */
public final class IdentifierPathException extends SmlRuntimeException {

    private static final long serialVersionUID = 1L;

    public IdentifierPathException(String message) {
        super("Identifier error. " + message);
    }
}
