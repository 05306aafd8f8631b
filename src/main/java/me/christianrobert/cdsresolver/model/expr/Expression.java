package me.christianrobert.cdsresolver.model.expr;

import me.christianrobert.cdsresolver.model.Location;

/**
 * Base of the closed expression tree used for values, conditions, filters and
 * annotation values.
 */
public abstract class Expression {
    private final Location location;

    protected Expression(Location location) {
        this.location = location;
    }

    public Location getLocation() { return location; }

    public abstract <R> R accept(ExpressionVisitor<R> visitor);
}
