package io.shakemyleg.core.engine;

/**
 * When {@code changeto} targets are checked against the compiled state set.
 */
public enum TransitionCheck {

    /**
     * Reject the script at compile time if any {@code changeto} names a state that
     * is not defined. The error carries the line of the offending {@code changeto}.
     */
    STRICT,

    /**
     * Accept any target at compile time. A transition to an undefined state fails
     * the cycle that takes it with a {@code NonexistentStateException}.
     */
    LENIENT;

    /**
     * Parses a config value (case-insensitive).
     *
     * @throws IllegalArgumentException if the value is not a known mode
     */
    public static TransitionCheck fromString(String value) {
        for (TransitionCheck check : values()) {
            if (check.name().equalsIgnoreCase(value)) {
                return check;
            }
        }
        throw new IllegalArgumentException(
                "Unknown transition check '" + value + "', expected one of: strict, lenient");
    }
}
