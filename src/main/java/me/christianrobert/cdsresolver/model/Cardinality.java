package me.christianrobert.cdsresolver.model;

/**
 * Cardinality of an association; {@code targetMax} is a number or {@code *}.
 */
public class Cardinality {
    private final String sourceMax;
    private final String targetMin;
    private final String targetMax;
    private final Location location;

    public Cardinality(String sourceMax, String targetMin, String targetMax, Location location) {
        this.sourceMax = sourceMax;
        this.targetMin = targetMin;
        this.targetMax = targetMax;
        this.location = location;
    }

    public static Cardinality toMany(Location location) {
        return new Cardinality(null, null, "*", location);
    }

    public static Cardinality toOne(Location location) {
        return new Cardinality(null, null, "1", location);
    }

    public String getSourceMax() { return sourceMax; }
    public String getTargetMin() { return targetMin; }
    public String getTargetMax() { return targetMax; }
    public Location getLocation() { return location; }

    public boolean isTargetMaxNotOne() {
        if (targetMax == null) {
            return false;
        }
        if ("*".equals(targetMax)) {
            return true;
        }
        try {
            return Integer.parseInt(targetMax) > 1;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    @Override
    public String toString() {
        return "[" + (sourceMax != null ? sourceMax + "," : "")
                + (targetMin != null ? targetMin + ".." : "")
                + (targetMax != null ? targetMax : "") + "]";
    }
}
