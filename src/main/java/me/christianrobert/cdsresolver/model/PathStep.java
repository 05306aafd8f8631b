package me.christianrobert.cdsresolver.model;

import me.christianrobert.cdsresolver.model.expr.Expression;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One identifier of a reference path with optional arguments, filter and cardinality.
 */
public class PathStep {
    private final String id;
    private final Location location;
    private Map<String, Expression> namedArgs;
    private List<Expression> positionalArgs;
    private Expression where;
    private Cardinality cardinality;
    private Inferred inferred;
    private final ResolutionCell cell = new ResolutionCell();
    // table alias, mixin or foreign key passed by this step
    private Artifact navigation;

    public PathStep(String id, Location location) {
        this.id = id;
        this.location = location;
    }

    public PathStep(String id, Location location, Artifact boundTo) {
        this(id, location);
        cell.bind(boundTo);
    }

    /** Copy of the syntactic parts; the result cell is copied when settled. */
    public PathStep copy() {
        PathStep step = new PathStep(id, location);
        if (namedArgs != null) {
            step.namedArgs = new LinkedHashMap<>(namedArgs);
        }
        if (positionalArgs != null) {
            step.positionalArgs = new ArrayList<>(positionalArgs);
        }
        step.where = where;
        step.cardinality = cardinality;
        step.inferred = inferred;
        step.navigation = navigation;
        step.cell.copyFrom(cell);
        return step;
    }

    public String getId() { return id; }
    public Location getLocation() { return location; }
    public Map<String, Expression> getNamedArgs() { return namedArgs; }
    public List<Expression> getPositionalArgs() { return positionalArgs; }
    public Expression getWhere() { return where; }
    public Cardinality getCardinality() { return cardinality; }
    public Inferred getInferred() { return inferred; }
    public ResolutionCell getCell() { return cell; }
    public Artifact getArtifact() { return cell.getArtifact(); }
    public Artifact getNavigation() { return navigation; }

    public boolean hasArgs() {
        return (namedArgs != null && !namedArgs.isEmpty()) || (positionalArgs != null && !positionalArgs.isEmpty());
    }

    public void setNamedArgs(Map<String, Expression> namedArgs) { this.namedArgs = namedArgs; }
    public void setPositionalArgs(List<Expression> positionalArgs) { this.positionalArgs = positionalArgs; }
    public void setWhere(Expression where) { this.where = where; }
    public void setCardinality(Cardinality cardinality) { this.cardinality = cardinality; }
    public void setInferred(Inferred inferred) { this.inferred = inferred; }
    public void setNavigation(Artifact navigation) { this.navigation = navigation; }

    @Override
    public String toString() {
        return id;
    }
}
