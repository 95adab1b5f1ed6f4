package io.shakemyleg.core.error;

/**
 * Thrown when source text is malformed: bad block keywords, bad indentation, unmatched parens or
 * quotes, invalid operators or identifiers, invalid branch ordering, or an expression that leaves
 * zero or several values on the compiler stack.
 */
public final class SmlSyntaxError extends SmlCompileException {

    private static final long serialVersionUID = 1L;

    public SmlSyntaxError(String message, int line, int column) {
        super("Syntax error: " + message, line, column);
    }

    public SmlSyntaxError(String message, int line) {
        this(message, line, 0);
    }
}
