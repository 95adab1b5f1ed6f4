package io.shakemyleg.standalone.config;

/** Which machine call the runner makes for each input line. */
public enum CycleMode {
    /** {@code run}: take the first branch whose condition holds. */
    RUN,
    /** {@code advance}: force each state's default branch. */
    ADVANCE;

    /**
     * Parses a config value (case-insensitive).
     *
     * @throws IllegalArgumentException if the value is neither run nor advance
     */
    public static CycleMode fromString(String value) {
        for (CycleMode mode : values()) {
            if (mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown cycle mode '" + value + "', expected one of: run, advance");
    }
}
