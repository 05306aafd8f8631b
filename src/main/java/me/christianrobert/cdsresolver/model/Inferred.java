package me.christianrobert.cdsresolver.model;

/**
 * Marks how a node or reference was created when it was not written by the user.
 */
public enum Inferred {
    WILDCARD("*"),
    INCLUDE("include"),
    EXPAND_ELEMENT("expand-element"),
    AUTOEXPOSED("autoexposed"),
    DUPLICATE_AUTOEXPOSED("duplicate-autoexposed"),
    REDIRECTED("REDIRECTED"),
    IMPLICIT("IMPLICIT"),
    REWRITE("rewrite"),
    KEYS("keys"),
    QUERY("query"),
    NAV("nav"),
    CAST("cast"),
    AS("as"),
    AUTO_ELEMENT("$autoElement");

    private final String code;

    Inferred(String code) {
        this.code = code;
    }

    public String getCode() { return code; }

    @Override
    public String toString() {
        return code;
    }
}
