package io.shakemyleg.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shakemyleg.core.error.NoDefaultBranchException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A compiled state: head expressions run on every visit, followed by the first
 * branch whose condition holds.
 *
 * <p>
 * Immutable and thread-safe: created by the block compiler and shared by the
 * machine's registry and its current-state slot.
 */
public final class State {

    private final String name;
    private final List<Expression> head;
    private final List<StateBranch> branches;
    private final Integer defaultBranchIndex;

    /**
     * @param name               unique state name
     * @param head               expressions evaluated before branch selection
     * @param branches           branches in declaration order
     * @param defaultBranchIndex index into {@code branches} of the branch marked
     *                           {@code default}, or {@code null}
     */
    public State(String name, List<Expression> head, List<StateBranch> branches, Integer defaultBranchIndex) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.head = List.copyOf(head);
        this.branches = List.copyOf(branches);
        if (defaultBranchIndex != null && (defaultBranchIndex < 0 || defaultBranchIndex >= this.branches.size())) {
            throw new IllegalArgumentException("default branch index " + defaultBranchIndex + " out of range for state "
                    + name + " with " + this.branches.size() + " branches");
        }
        this.defaultBranchIndex = defaultBranchIndex;
    }

    public String name() {
        return name;
    }

    public List<Expression> head() {
        return head;
    }

    public List<StateBranch> branches() {
        return branches;
    }

    public Optional<Integer> defaultBranchIndex() {
        return Optional.ofNullable(defaultBranchIndex);
    }

    /** Result of one cycle: this cycle's outputs and the transition to apply. */
    public record Outcome(ObjectNode outputs, StateOp transition) {}

    /**
     * Runs one cycle: default head, then this state's head, then the first
     * branch whose condition is truthy. When no branch matches the transition is
     * {@link StateOp#STAY}.
     *
     * @param inputs      host input, never written
     * @param globals     the machine's globals, written in place
     * @param defaultHead expressions shared by every state, run first
     */
    public Outcome run(JsonNode inputs, ObjectNode globals, List<Expression> defaultHead) {
        Stores stores = new Stores(inputs, JsonNodeFactory.instance.objectNode(), globals);
        runHeads(stores, defaultHead);

        StateOp transition = StateOp.STAY;
        for (StateBranch branch : branches) {
            if (branch.condition().evaluate(stores).asBool()) {
                transition = runBranch(stores, branch);
                break;
            }
        }
        return new Outcome(stores.outputs(), transition);
    }

    /**
     * Same as {@link #run} but skips condition evaluation and always takes the
     * branch marked {@code default}.
     *
     * @throws NoDefaultBranchException if this state has no default branch
     */
    public Outcome runDefault(JsonNode inputs, ObjectNode globals, List<Expression> defaultHead) {
        if (defaultBranchIndex == null) {
            throw new NoDefaultBranchException(name);
        }
        Stores stores = new Stores(inputs, JsonNodeFactory.instance.objectNode(), globals);
        runHeads(stores, defaultHead);
        StateOp transition = runBranch(stores, branches.get(defaultBranchIndex));
        return new Outcome(stores.outputs(), transition);
    }

    private void runHeads(Stores stores, List<Expression> defaultHead) {
        for (Expression expr : defaultHead) {
            expr.evaluate(stores);
        }
        for (Expression expr : head) {
            expr.evaluate(stores);
        }
    }

    private static StateOp runBranch(Stores stores, StateBranch branch) {
        for (Expression expr : branch.body()) {
            expr.evaluate(stores);
        }
        return branch.transition();
    }

    @Override
    public String toString() {
        return "State[" + name + ", head=" + head.size() + ", branches=" + branches.size() + "]";
    }
}
