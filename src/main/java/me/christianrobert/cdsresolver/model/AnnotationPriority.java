package me.christianrobert.cdsresolver.model;

/**
 * Priority of an annotation assignment; only the assignments with the
 * highest priority on a node take part in the layer merge.
 */
public enum AnnotationPriority {
    DEFINE(1),
    EXTEND(2),
    ANNOTATE(2),
    EDMX(3);

    private final int rank;

    AnnotationPriority(int rank) {
        this.rank = rank;
    }

    public int getRank() { return rank; }
}
