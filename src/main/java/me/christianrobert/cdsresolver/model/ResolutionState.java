package me.christianrobert.cdsresolver.model;

/**
 * State of a reference resolution cell.
 */
public enum ResolutionState {
    /** Not attempted yet. */
    UNRESOLVED,
    /** Resolution is running; re-entering means a reference cycle. */
    IN_PROGRESS,
    /** Nothing found; a diagnostic has been reported. */
    NOT_FOUND,
    /** Several candidates were found. */
    AMBIGUOUS,
    /** Found, but not acceptable at this position (wrong kind, rejected alias). */
    REJECTED,
    /** Depends on itself. */
    CYCLIC,
    /** Bound to an artifact or member. */
    BOUND;

    public boolean isSettled() {
        return this != UNRESOLVED && this != IN_PROGRESS;
    }
}
