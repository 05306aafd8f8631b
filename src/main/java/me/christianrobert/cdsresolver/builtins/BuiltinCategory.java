package me.christianrobert.cdsresolver.builtins;

/**
 * Category of a builtin type.
 */
public enum BuiltinCategory {
    STRING,
    INTEGER,
    DECIMAL,
    BINARY,
    DATE_TIME,
    BOOLEAN,
    RELATION,
    GEO;

    public boolean isNumeric() {
        return this == INTEGER || this == DECIMAL;
    }

    public boolean isString() {
        return this == STRING;
    }

    public boolean isRelation() {
        return this == RELATION;
    }
}
