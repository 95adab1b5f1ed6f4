package io.shakemyleg.core.error;

/**
 * Abstract parent for compile-time errors. Thrown by {@code BlockCompiler.compile()}; a compile
 * error is always fatal, no partial machine is produced. Carries the 1-based source position of
 * the offending text, or {@code 0} where the position is unknown.
 */
public abstract class SmlCompileException extends SmlException {

    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;

    protected SmlCompileException(String message, int line, int column) {
        super(message, Phase.COMPILE);
        this.line = line;
        this.column = column;
    }

    protected SmlCompileException(String message, Throwable cause, int line, int column) {
        super(message, cause, Phase.COMPILE);
        this.line = line;
        this.column = column;
    }

    /** 1-based source line, or {@code 0} if not known. */
    public int line() {
        return line;
    }

    /** 1-based source column, or {@code 0} if not known. */
    public int column() {
        return column;
    }
}
