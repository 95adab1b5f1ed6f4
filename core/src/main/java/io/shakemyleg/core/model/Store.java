package io.shakemyleg.core.model;

/**
 * The three named value-tree roots an identifier can address.
 *
 * <ul>
 * <li>{@link #INPUTS}: host-supplied, read-only for the whole cycle.</li>
 * <li>{@link #OUTPUTS}: created empty at the start of every cycle and handed
 * back to the host at its end.</li>
 * <li>{@link #GLOBALS}: owned by the machine, persists across cycles.</li>
 * </ul>
 */
public enum Store {
    INPUTS("inputs"),
    OUTPUTS("outputs"),
    GLOBALS("globals");

    private final String keyword;

    Store(String keyword) {
        this.keyword = keyword;
    }

    /** The name used in source text, e.g. {@code "globals"}. */
    public String keyword() {
        return keyword;
    }

    /** Returns the store named {@code keyword}, or {@code null} if none matches. */
    public static Store fromKeyword(String keyword) {
        for (Store store : values()) {
            if (store.keyword.equals(keyword)) {
                return store;
            }
        }
        return null;
    }
}
