package io.shakemyleg.core.error;

/** Thrown when an identifier read names a path that does not exist in its store. */
public final class IdentifierNameException extends SmlRuntimeException {

    private static final long serialVersionUID = 1L;

    private final String identifier;

    public IdentifierNameException(String identifier) {
        super("Identifier \"" + identifier + "\" doesn't refer to existing value.");
        this.identifier = identifier;
    }

    /** The dotted identifier as written in the source. */
    public String identifier() {
        return identifier;
    }
}
