package io.shakemyleg.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One conditional arm of a state.
 *
 * @param condition  evaluated through {@link Value#asBool()}; {@code always}
 *                   and {@code otherwise} compile to the literal {@code true}
 * @param body       expressions run in order when the branch is taken
 * @param transition applied after the body has run
 * @param isDefault  whether {@code advance()} forces this branch
 */
public record StateBranch(Expression condition, List<Expression> body, StateOp transition, boolean isDefault) {

    public StateBranch {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(body, "body must not be null");
        Objects.requireNonNull(transition, "transition must not be null");
        body = List.copyOf(body);
    }
}
