package io.shakemyleg.core.error;

/** Thrown when a script file cannot be read. */
public final class ScriptLoadException extends SmlCompileException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public ScriptLoadException(String message, Throwable cause, String source) {
        super(message, cause, 0, 0);
        this.source = source;
    }

    /** The file path that could not be read. */
    public String source() {
        return source;
    }
}
