package io.shakemyleg.core.model;

import io.shakemyleg.core.error.BadOperationException;

/** Prefix operators. All of them bind tighter than any binary operator. */
public enum UnaryOperation {
    /** {@code !x}: boolean negation. */
    NEGATE("!"),
    /** {@code ++x}: adds one. */
    INCREMENT("++"),
    /** {@code --x}: subtracts one. */
    DECREMENT("--"),
    /** {@code -x}: arithmetic negation. */
    MINUS("-");

    private final String symbol;

    UnaryOperation(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Resolves a prefix operator symbol.
     *
     * @return the operation, or {@code null} if {@code symbol} is not a prefix
     *         operator
     */
    public static UnaryOperation fromSymbol(String symbol) {
        for (UnaryOperation op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        return null;
    }

    /**
     * Applies this operator.
     *
     * @throws BadOperationException if the operand has the wrong kind
     */
    public Value apply(Value operand) {
        if (this == NEGATE) {
            if (operand instanceof Value.Bool b) {
                return Value.of(!b.value());
            }
            throw new BadOperationException("Negation only valid for boolean operands, got " + operand.kind() + ".");
        }
        if (!(operand instanceof Value.Num n)) {
            throw new BadOperationException(
                    "'" + symbol + "' only valid for numerical operands, got " + operand.kind() + ".");
        }
        return switch (this) {
            case INCREMENT -> Value.of(n.value() + 1.0);
            case DECREMENT -> Value.of(n.value() - 1.0);
            case MINUS -> Value.of(-n.value());
            case NEGATE -> throw new IllegalStateException("negation handled above");
        };
    }
}
