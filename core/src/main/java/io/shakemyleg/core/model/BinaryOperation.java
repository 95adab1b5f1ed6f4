package io.shakemyleg.core.model;

import io.shakemyleg.core.error.BadOperationException;
import java.util.HashMap;
import java.util.Map;

/**
 * Infix operators with their precedence (lower binds tighter). Operands are
 * never coerced except through {@link Value#asBool()} for {@code && ||}.
 */
public enum BinaryOperation {
    ASSIGN("=", 4),

    // Arithmetic
    ADD("+", 2),
    SUBTRACT("-", 2),
    MULTIPLY("*", 1),
    DIVIDE("/", 1),
    POWER("^", 1),

    // Comparison and equality
    LESS_THAN("<", 3),
    LESS_THAN_OR_EQUAL("<=", 3),
    GREATER_THAN(">", 3),
    GREATER_THAN_OR_EQUAL(">=", 3),
    EQUAL("==", 3),
    NOT_EQUAL("!=", 3),

    // Boolean
    AND("&&", 3),
    OR("||", 3),

    // List
    CONTAINS("contains", 3);

    private static final Map<String, BinaryOperation> BY_SYMBOL = new HashMap<>();

    static {
        for (BinaryOperation op : values()) {
            BY_SYMBOL.put(op.symbol, op);
        }
    }

    private final String symbol;
    private final int precedence;

    BinaryOperation(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    /**
     * Resolves an infix operator symbol.
     *
     * @return the operation, or {@code null} if {@code symbol} is not an infix
     *         operator
     */
    public static BinaryOperation fromSymbol(String symbol) {
        return BY_SYMBOL.get(symbol);
    }

    /**
     * Applies this operator to already-evaluated operands. Assignment is not an
     * operator over values and is handled by {@link Expression.Binary}.
     *
     * @throws BadOperationException on an operand kind mismatch
     */
    public Value apply(Value left, Value right) {
        return switch (this) {
            case ASSIGN -> throw new IllegalStateException("assignment is evaluated by the expression tree");
            case ADD -> add(left, right);
            case SUBTRACT, MULTIPLY, DIVIDE, POWER -> arithmetic(left, right);
            case LESS_THAN, LESS_THAN_OR_EQUAL, GREATER_THAN, GREATER_THAN_OR_EQUAL -> compare(left, right);
            case EQUAL -> Value.of(left.valueEquals(right));
            case NOT_EQUAL -> Value.of(!left.valueEquals(right));
            case AND -> Value.of(left.asBool() && right.asBool());
            case OR -> Value.of(left.asBool() || right.asBool());
            case CONTAINS -> contains(left, right);
        };
    }

    private static Value add(Value left, Value right) {
        if (left instanceof Value.Num l && right instanceof Value.Num r) {
            return Value.of(l.value() + r.value());
        }
        if (left instanceof Value.ListValue list) {
            return list.append(right);
        }
        throw new BadOperationException("'+' only valid for numerical operands or to add a value to a list, got "
                + left.kind() + " + " + right.kind() + ".");
    }

    private Value arithmetic(Value left, Value right) {
        if (!(left instanceof Value.Num l) || !(right instanceof Value.Num r)) {
            throw new BadOperationException("Arithmetic only valid for numerical operands, got " + left.kind() + " "
                    + symbol + " " + right.kind() + ".");
        }
        double a = l.value();
        double b = r.value();
        return switch (this) {
            case SUBTRACT -> Value.of(a - b);
            case MULTIPLY -> Value.of(a * b);
            case DIVIDE -> Value.of(a / b);
            case POWER -> Value.of(Math.pow(a, b));
            default -> throw new IllegalStateException("not an arithmetic operator: " + this);
        };
    }

    private Value compare(Value left, Value right) {
        if (!(left instanceof Value.Num l) || !(right instanceof Value.Num r)) {
            throw new BadOperationException("Comparison only valid for numerical operands, got " + left.kind() + " "
                    + symbol + " " + right.kind() + ".");
        }
        double a = l.value();
        double b = r.value();
        return switch (this) {
            case LESS_THAN -> Value.of(a < b);
            case LESS_THAN_OR_EQUAL -> Value.of(a <= b);
            case GREATER_THAN -> Value.of(a > b);
            case GREATER_THAN_OR_EQUAL -> Value.of(a >= b);
            default -> throw new IllegalStateException("not a comparison operator: " + this);
        };
    }

    private static Value contains(Value left, Value right) {
        if (left instanceof Value.ListValue list) {
            return Value.of(list.contains(right));
        }
        throw new BadOperationException("Invalid type. Syntax is '<list> contains <value>', got " + left.kind() + ".");
    }
}
