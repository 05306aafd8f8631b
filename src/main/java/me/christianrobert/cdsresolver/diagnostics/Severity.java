package me.christianrobert.cdsresolver.diagnostics;

/**
 * Severity of a diagnostic; lower level is more severe.
 */
public enum Severity {
    ERROR("Error", 0),
    WARNING("Warning", 1),
    INFO("Info", 2),
    DEBUG("Debug", 3);

    private final String label;
    private final int level;

    Severity(String label, int level) {
        this.label = label;
        this.level = level;
    }

    public String getLabel() { return label; }
    public int getLevel() { return level; }

    public static Severity fromString(String value) {
        if (value == null) {
            return null;
        }
        for (Severity severity : values()) {
            if (severity.name().equalsIgnoreCase(value.trim()) || severity.label.equalsIgnoreCase(value.trim())) {
                return severity;
            }
        }
        return null;
    }
}
