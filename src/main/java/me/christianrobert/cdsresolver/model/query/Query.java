package me.christianrobert.cdsresolver.model.query;

import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Location;

/**
 * A query expression: a SELECT or a set operation (UNION, ...).
 */
public abstract class Query {
    private final Location location;
    private Artifact main;

    protected Query(Location location) {
        this.location = location;
    }

    public Location getLocation() { return location; }
    public Artifact getMain() { return main; }
    public void setMain(Artifact main) { this.main = main; }

    /** The SELECT providing the elements of this query expression. */
    public abstract SelectQuery leading();
}
