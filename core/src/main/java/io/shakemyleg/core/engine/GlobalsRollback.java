package io.shakemyleg.core.engine;

/** What happens to globals written during a cycle that later fails. */
public enum GlobalsRollback {

    /** Writes made before the failure stay in place. */
    NONE,

    /** Globals are copied before each cycle and restored if the cycle fails. */
    SNAPSHOT;

    /**
     * Parses a config value (case-insensitive).
     *
     * @throws IllegalArgumentException if the value is not a known policy
     */
    public static GlobalsRollback fromString(String value) {
        for (GlobalsRollback rollback : values()) {
            if (rollback.name().equalsIgnoreCase(value)) {
                return rollback;
            }
        }
        throw new IllegalArgumentException(
                "Unknown globals rollback '" + value + "', expected one of: none, snapshot");
    }
}
