package me.christianrobert.cdsresolver.model.query;

import me.christianrobert.cdsresolver.model.Location;

/**
 * Entry of a FROM clause: a table reference, a sub query or a join.
 */
public abstract class FromItem {
    private final Location location;

    protected FromItem(Location location) {
        this.location = location;
    }

    public Location getLocation() { return location; }
}
