package me.christianrobert.cdsresolver.model;

import me.christianrobert.cdsresolver.model.expr.Expression;

/**
 * One assignment {@code @name: value} to a node, together with the source
 * (layer) it was written in and its priority.
 */
public class AnnotationAssignment {
    private final String name;
    private final Expression value;     // null for the short form "@name" (= true)
    private final Location location;
    private Source source;
    private AnnotationPriority priority = AnnotationPriority.DEFINE;
    private boolean inferred;

    public AnnotationAssignment(String name, Expression value, Location location) {
        this.name = name.startsWith("@") ? name : "@" + name;
        this.value = value;
        this.location = location;
    }

    /**
     * Copy with another value; used when array values of several layers are merged.
     */
    public AnnotationAssignment withValue(Expression newValue) {
        AnnotationAssignment copy = new AnnotationAssignment(name, newValue, location);
        copy.source = source;
        copy.priority = priority;
        copy.inferred = inferred;
        return copy;
    }

    public String getName() { return name; }
    public Expression getValue() { return value; }
    public Location getLocation() { return location; }
    public Source getSource() { return source; }
    public AnnotationPriority getPriority() { return priority; }
    public boolean isInferred() { return inferred; }

    public void setSource(Source source) { this.source = source; }
    public void setPriority(AnnotationPriority priority) { this.priority = priority; }
    public void setInferred(boolean inferred) { this.inferred = inferred; }

    @Override
    public String toString() {
        return name + (value != null ? ": " + value : "");
    }
}
