package me.christianrobert.cdsresolver.model;

/**
 * Kind of a definition or member.
 */
public enum Kind {
    NAMESPACE("namespace"),
    CONTEXT("context"),
    SERVICE("service"),
    ENTITY("entity"),
    TYPE("type"),
    ASPECT("aspect"),
    EVENT("event"),
    ACTION("action"),
    FUNCTION("function"),
    ANNOTATION("annotation"),
    ELEMENT("element"),
    ENUM("enum"),
    PARAM("param"),
    KEY("key"),
    MIXIN("mixin"),
    BUILTIN("builtin"),
    USING("using"),
    ANNOTATE("annotate"),
    TABLE_ALIAS("$tableAlias"),
    NAV_ELEMENT("$navElement"),
    SELF("$self"),
    PARAMETERS("$parameters"),
    QUERY("select"),
    INLINE("$inline");

    private final String displayName;

    Kind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() { return displayName; }

    /** Kinds whose sub-artifacts form a name space ({@code artifacts}). */
    public boolean hasArtifacts() {
        return this == NAMESPACE || this == CONTEXT || this == SERVICE;
    }

    /** Kinds which can appear as entries of the model's definitions. */
    public boolean isDefinition() {
        switch (this) {
            case NAMESPACE:
            case CONTEXT:
            case SERVICE:
            case ENTITY:
            case TYPE:
            case ASPECT:
            case EVENT:
            case ACTION:
            case FUNCTION:
            case ANNOTATION:
                return true;
            default:
                return false;
        }
    }

    /**
     * The name category a member of this kind extends: {@code element},
     * {@code alias}, {@code select}, {@code param} or {@code action}.
     */
    public String nameCategory() {
        switch (this) {
            case ELEMENT:
            case ENUM:
            case KEY:
            case NAV_ELEMENT:
            case INLINE:
                return "element";
            case TABLE_ALIAS:
            case SELF:
            case MIXIN:
                return "alias";
            case QUERY:
                return "select";
            case PARAM:
                return "param";
            case ACTION:
            case FUNCTION:
                return "action";
            default:
                return null;
        }
    }

    @Override
    public String toString() {
        return displayName;
    }
}
