package io.shakemyleg.core.error;

/** Thrown by {@code advance()} when the current state has no branch marked {@code default}. */
public final class NoDefaultBranchException extends SmlRuntimeException {

    private static final long serialVersionUID = 1L;

    public NoDefaultBranchException(String stateName) {
        super("State '" + stateName + "' has no default branch to advance through");
        inState(stateName);
    }
}
