package io.shakemyleg.core.model;

import io.shakemyleg.core.error.BadOperationException;
import java.util.Objects;

/**
 * Compiled expression tree. Nodes carry no mutable state and are re-evaluated
 * from scratch on every cycle.
 *
 * <p>
 * Binary nodes evaluate their right operand first. Assignment needs it that
 * way (the value is computed before the target is written) and the other
 * operators follow the same order.
 */
public sealed interface Expression {

    /**
     * Evaluates this expression against the cycle's stores.
     *
     * @throws io.shakemyleg.core.error.SmlRuntimeException on any evaluation error
     */
    Value evaluate(Stores stores);

    /** Literal value. */
    record Literal(Value value) implements Expression {
        public Literal {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public Value evaluate(Stores stores) {
            return value;
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    /** Read of an identifier path. */
    record Ref(Identifier identifier) implements Expression {
        public Ref {
            Objects.requireNonNull(identifier, "identifier must not be null");
        }

        @Override
        public Value evaluate(Stores stores) {
            return identifier.get(stores);
        }

        @Override
        public String toString() {
            return identifier.toString();
        }
    }

    /** Prefix operator applied to one operand. */
    record Unary(UnaryOperation op, Expression operand) implements Expression {
        public Unary {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public Value evaluate(Stores stores) {
            return op.apply(operand.evaluate(stores));
        }

        @Override
        public String toString() {
            return "(" + op.symbol() + operand + ")";
        }
    }

    /** Infix operator. Assignment requires {@link #left()} to be a {@link Ref}. */
    record Binary(BinaryOperation op, Expression left, Expression right) implements Expression {
        public Binary {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public Value evaluate(Stores stores) {
            Value rhs = right.evaluate(stores);
            if (op == BinaryOperation.ASSIGN) {
                if (!(left instanceof Ref ref)) {
                    throw new BadOperationException("can only assign to identifier, got " + left);
                }
                ref.identifier().set(stores, rhs);
                return rhs;
            }
            Value lhs = left.evaluate(stores);
            return op.apply(lhs, rhs);
        }

        @Override
        public String toString() {
            return "(" + left + " " + op.symbol() + " " + right + ")";
        }
    }
}
