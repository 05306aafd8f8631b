package me.christianrobert.cdsresolver.resolve.context;

/**
 * Per-node status of an on-demand computation.
 */
public enum NodeStatus {
    UNVISITED,
    IN_PROGRESS,
    DONE,
    /** Re-entered while in progress; the node is part of a cycle. */
    POISONED
}
