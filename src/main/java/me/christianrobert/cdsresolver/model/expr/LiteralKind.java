package me.christianrobert.cdsresolver.model.expr;

public enum LiteralKind {
    STRING,
    NUMBER,
    BOOLEAN,
    NULL,
    ENUM,
    ARRAY,
    STRUCT,
    /** The {@code ...} marker inside annotation arrays. */
    ELLIPSIS
}
