package io.shakemyleg.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shakemyleg.core.error.NonexistentStateException;
import io.shakemyleg.core.error.SmlRuntimeException;
import io.shakemyleg.core.model.Expression;
import io.shakemyleg.core.model.State;
import io.shakemyleg.core.model.StateOp;
import io.shakemyleg.core.spi.MachineListener;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A compiled machine: its states, the shared default head, persistent globals
 * and the current state.
 *
 * <p>
 * Each {@link #run} or {@link #advance} call is one cycle. The input is encoded
 * into an object tree, the current state runs against it (default head, state
 * head, then the selected branch), the transition target is resolved, the
 * outputs are decoded to the caller's type, and only then is the transition
 * committed. A cycle that throws leaves the current state unchanged. Globals
 * written before the failure persist unless the machine was compiled with
 * {@link GlobalsRollback#SNAPSHOT}.
 *
 * <p>
 * Once a cycle takes an {@code end} transition the machine is ended: every
 * later cycle returns {@link Optional#empty()} without evaluating anything.
 *
 * <p>
 * Not thread-safe. A machine must be driven by one thread at a time; the
 * compiled states it refers to are immutable and may be shared freely.
 */
public final class StateMachine {

    private static final Logger LOG = LoggerFactory.getLogger(StateMachine.class);

    private final StateRegistry registry;
    private final List<Expression> defaultHead;
    private final String initialState;
    private final GlobalsRollback globalsRollback;
    private final MachineListener listener;
    private final ValueCodec codec;

    private ObjectNode globals = JsonNodeFactory.instance.objectNode();
    private State current;

    /**
     * Creates a machine positioned at {@code initialState} with empty globals.
     *
     * @throws IllegalArgumentException if {@code initialState} is not in the
     *                                  registry
     */
    public StateMachine(
            StateRegistry registry, List<Expression> defaultHead, String initialState, CompileOptions options) {
        this(registry, defaultHead, initialState, options, new ValueCodec());
    }

    public StateMachine(
            StateRegistry registry,
            List<Expression> defaultHead,
            String initialState,
            CompileOptions options,
            ValueCodec codec) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.defaultHead = List.copyOf(defaultHead);
        this.current = registry.get(initialState);
        if (current == null) {
            throw new IllegalArgumentException("initial state '" + initialState + "' is not defined");
        }
        this.initialState = initialState;
        this.globalsRollback = options.globalsRollback();
        this.listener = options.listener();
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    /**
     * Runs one cycle, taking the first branch whose condition holds.
     *
     * @param input      host input, encoded as the {@code inputs} store
     * @param outputType type the {@code outputs} store is decoded into
     * @return the cycle's outputs, or empty if the machine has ended
     * @throws SmlRuntimeException if evaluation, the transition or the codec fails
     */
    public <O> Optional<O> run(Object input, Class<O> outputType) {
        return cycle(input, false, out -> codec.decode(out, outputType));
    }

    /** Tree-level {@link #run(Object, Class)}. */
    public Optional<ObjectNode> run(JsonNode input) {
        return cycle(input, false, Function.identity());
    }

    /**
     * Runs one cycle, forcing the branch marked {@code default} without
     * evaluating any branch condition.
     *
     * @throws io.shakemyleg.core.error.NoDefaultBranchException if the current
     *                                                           state has no
     *                                                           default branch
     */
    public <O> Optional<O> advance(Object input, Class<O> outputType) {
        return cycle(input, true, out -> codec.decode(out, outputType));
    }

    /** Tree-level {@link #advance(Object, Class)}. */
    public Optional<ObjectNode> advance(JsonNode input) {
        return cycle(input, true, Function.identity());
    }

    /**
     * Replaces the whole globals store. Does not change the current state, and
     * does not revive an ended machine.
     *
     * @throws io.shakemyleg.core.error.ValueCodecException if the value is not an
     *                                                      object
     */
    public void reinit(Object hostGlobals) {
        globals = codec.encode(hostGlobals, "globals").deepCopy();
        LOG.debug("globals.reinit: fields={}", globals.size());
    }

    /** Decodes the current globals into the host type. */
    public <G> G globals(Class<G> type) {
        return codec.decode(globals.deepCopy(), type);
    }

    /** A copy of the current globals tree. */
    public ObjectNode globalsTree() {
        return globals.deepCopy();
    }

    /** Name of the current state, or empty once the machine has ended. */
    public Optional<String> currentState() {
        return current == null ? Optional.empty() : Optional.of(current.name());
    }

    public boolean isEnded() {
        return current == null;
    }

    public String initialState() {
        return initialState;
    }

    /** State names in declaration order. */
    public List<String> stateNames() {
        return registry.names();
    }

    private <R> Optional<R> cycle(Object input, boolean forcedDefault, Function<ObjectNode, R> decodeOutputs) {
        if (current == null) {
            LOG.debug("cycle.skipped: machine has ended");
            return Optional.empty();
        }

        String stateName = current.name();
        long startNanos = System.nanoTime();
        ObjectNode snapshot = null;
        try {
            ObjectNode inputs = codec.encode(input, "inputs");
            if (globalsRollback == GlobalsRollback.SNAPSHOT) {
                snapshot = globals.deepCopy();
            }

            State.Outcome outcome = forcedDefault
                    ? current.runDefault(inputs, globals, defaultHead)
                    : current.run(inputs, globals, defaultHead);
            State next = resolve(outcome.transition());
            R result = decodeOutputs.apply(outcome.outputs());

            long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
            commit(stateName, outcome.transition(), next);
            LOG.debug(
                    "cycle.completed: state={}, forced_default={}, transition={}, duration_ms={}",
                    stateName,
                    forcedDefault,
                    outcome.transition(),
                    elapsedMs);
            notifyCompleted(stateName, outcome.transition(), next, forcedDefault, elapsedMs);
            if (next == null) {
                notifyEnded(stateName);
            }
            return Optional.of(result);
        } catch (SmlRuntimeException e) {
            e.inState(stateName);
            if (snapshot != null) {
                globals = snapshot;
            }
            long failedMs = (System.nanoTime() - startNanos) / 1_000_000;
            LOG.debug(
                    "cycle.failed: state={}, forced_default={}, globals_restored={}, error={}",
                    stateName,
                    forcedDefault,
                    snapshot != null,
                    e.getMessage());
            notifyFailed(stateName, forcedDefault, failedMs, e.getMessage());
            throw e;
        }
    }

    /** The state after {@code op}; null for {@code end}. */
    private State resolve(StateOp op) {
        if (op instanceof StateOp.ChangeTo changeTo) {
            State target = registry.get(changeTo.stateName());
            if (target == null) {
                throw new NonexistentStateException(changeTo.stateName());
            }
            return target;
        }
        if (op instanceof StateOp.End) {
            return null;
        }
        return current;
    }

    private void commit(String from, StateOp op, State next) {
        current = next;
        if (next == null) {
            LOG.info("machine.ended: last_state={}", from);
        } else if (op instanceof StateOp.ChangeTo) {
            LOG.info("state.transition: from={}, to={}", from, next.name());
        }
    }

    private void notifyCompleted(String state, StateOp op, State next, boolean forcedDefault, long durationMs) {
        try {
            listener.onCycleCompleted(new MachineListener.CycleCompletedEvent(
                    state, op.toString(), next == null ? null : next.name(), forcedDefault, durationMs));
        } catch (Exception e) {
            LOG.warn("MachineListener.onCycleCompleted failed", e);
        }
    }

    private void notifyFailed(String state, boolean forcedDefault, long durationMs, String errorDetail) {
        try {
            listener.onCycleFailed(
                    new MachineListener.CycleFailedEvent(state, forcedDefault, durationMs, errorDetail));
        } catch (Exception e) {
            LOG.warn("MachineListener.onCycleFailed failed", e);
        }
    }

    private void notifyEnded(String lastState) {
        try {
            listener.onMachineEnded(new MachineListener.MachineEndedEvent(lastState));
        } catch (Exception e) {
            LOG.warn("MachineListener.onMachineEnded failed", e);
        }
    }
}
