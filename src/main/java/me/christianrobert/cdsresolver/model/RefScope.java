package me.christianrobert.cdsresolver.model;

/**
 * Syntactic scope marker of a reference.
 */
public enum RefScope {
    NORMAL,
    /** Fully qualified, looked up in the definitions only. */
    GLOBAL,
    /** {@code :param} reference. */
    PARAM,
    /** {@code type of} reference. */
    TYPE_OF
}
