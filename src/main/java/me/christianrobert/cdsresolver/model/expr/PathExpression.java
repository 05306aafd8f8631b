package me.christianrobert.cdsresolver.model.expr;

import me.christianrobert.cdsresolver.model.Location;
import me.christianrobert.cdsresolver.model.Reference;

/**
 * A reference used as value.  The reference can be replaced by a rewritten
 * one; the cell of a reference itself is never overwritten.
 */
public class PathExpression extends Expression {
    private Reference reference;

    public PathExpression(Reference reference) {
        this(reference, reference.getLocation());
    }

    public PathExpression(Reference reference, Location location) {
        super(location);
        this.reference = reference;
    }

    public Reference getReference() { return reference; }
    public void setReference(Reference reference) { this.reference = reference; }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitPath(this);
    }

    @Override
    public String toString() {
        return reference.toString();
    }
}
