package io.shakemyleg.core.engine;

import io.shakemyleg.core.model.State;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable name-to-state map of a compiled machine, in declaration order.
 *
 * <p>
 * Thread-safe: the map is unmodifiable and {@link State}s are immutable, so one
 * registry may back any number of machines.
 */
public final class StateRegistry {

    private final Map<String, State> states;

    /**
     * The map is copied; later changes by the caller are not seen.
     *
     * @param states states keyed by name, in declaration order
     */
    public StateRegistry(Map<String, State> states) {
        this.states = Collections.unmodifiableMap(new LinkedHashMap<>(states));
    }

    /** Returns the state with that name, or null if none is defined. */
    public State get(String name) {
        return states.get(name);
    }

    public boolean contains(String name) {
        return states.containsKey(name);
    }

    /** State names in declaration order. */
    public List<String> names() {
        return List.copyOf(states.keySet());
    }

    public int size() {
        return states.size();
    }
}
