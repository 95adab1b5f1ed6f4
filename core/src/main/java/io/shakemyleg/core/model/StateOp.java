package io.shakemyleg.core.model;

import java.util.Objects;

/**
 * What happens to the machine after a cycle: stay in the current state, move to
 * a named state, or end.
 */
public sealed interface StateOp {

    /** The shared {@link Stay} instance. */
    StateOp STAY = new Stay();

    /** The shared {@link End} instance. */
    StateOp END = new End();

    static StateOp changeTo(String stateName) {
        return new ChangeTo(stateName);
    }

    /** Remain in the current state. */
    record Stay() implements StateOp {
        @Override
        public String toString() {
            return "stay";
        }
    }

    /** Move to the named state. */
    record ChangeTo(String stateName) implements StateOp {
        public ChangeTo {
            Objects.requireNonNull(stateName, "stateName must not be null");
        }

        @Override
        public String toString() {
            return "changeto " + stateName;
        }
    }

    /** Terminate the machine. */
    record End() implements StateOp {
        @Override
        public String toString() {
            return "end";
        }
    }
}
