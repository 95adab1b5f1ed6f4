package io.shakemyleg.core.spi;

/**
 * SPI for observing machine cycles.
 *
 * <p>
 * Hosts implement this to bridge cycle activity to metrics or tracing. All
 * methods receive immutable event objects and default to no-ops, so an
 * implementation overrides only what it needs. Exceptions thrown by a listener
 * are caught by the machine and logged at WARN; they never affect the cycle.
 *
 * <p>
 * A listener shared by several machines must be thread-safe.
 */
public interface MachineListener {

    /** Listener that ignores every event. */
    MachineListener NOOP = new MachineListener() {};

    /**
     * Called after a cycle completed and its transition was committed.
     *
     * @param event contains state, transition, nextState, forcedDefault, durationMs
     */
    default void onCycleCompleted(CycleCompletedEvent event) {}

    /**
     * Called when a cycle failed with a runtime error. The current state is left
     * unchanged.
     *
     * @param event contains state, forcedDefault, durationMs, errorDetail
     */
    default void onCycleFailed(CycleFailedEvent event) {}

    /**
     * Called once, when a cycle takes an {@code end} transition.
     *
     * @param event contains lastState
     */
    default void onMachineEnded(MachineEndedEvent event) {}

    // --- Event records ---

    /**
     * Event emitted after a successful cycle.
     *
     * @param nextState the state after the transition, or {@code null} when the
     *                  machine ended
     */
    record CycleCompletedEvent(
            String state, String transition, String nextState, boolean forcedDefault, long durationMs) {}

    /** Event emitted when a cycle raises a runtime error. */
    record CycleFailedEvent(String state, boolean forcedDefault, long durationMs, String errorDetail) {}

    /** Event emitted when the machine reaches {@code end}. */
    record MachineEndedEvent(String lastState) {}
}
