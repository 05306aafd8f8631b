package me.christianrobert.cdsresolver.model;

/**
 * Dependency edge user &rarr; target recorded during resolution.  Edges
 * without a location are silent: they order the cycle analysis but are never
 * reported.
 */
public class Dependency {
    private final Artifact target;
    private final Location location;

    public Dependency(Artifact target, Location location) {
        this.target = target;
        this.location = location;
    }

    public Artifact getTarget() { return target; }
    public Location getLocation() { return location; }
    public boolean isSilent() { return location == null; }

    @Override
    public String toString() {
        return "-> " + target.getName() + (isSilent() ? " (silent)" : " at " + location);
    }
}
