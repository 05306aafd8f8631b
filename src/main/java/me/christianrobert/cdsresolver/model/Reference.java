package me.christianrobert.cdsresolver.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An unresolved qualified path plus its write-once resolution cell.
 */
public class Reference {
    private final List<PathStep> path;
    private final Location location;
    private RefScope scope = RefScope.NORMAL;
    // number of leading steps naming artifacts, 0 = decided by the resolution policy
    private int artifactSteps;
    private Inferred inferred;
    private final ResolutionCell cell = new ResolutionCell();

    public Reference(List<PathStep> path, Location location) {
        this.path = new ArrayList<>(path);
        this.location = location;
    }

    /**
     * Creates a reference from a dotted name; every step gets the given location.
     */
    public static Reference of(String dotted, Location location) {
        List<PathStep> steps = Arrays.stream(dotted.split("\\."))
                .map(id -> new PathStep(id, location))
                .collect(Collectors.toList());
        return new Reference(steps, location);
    }

    /**
     * Creates a single-step global reference bound to the given definition.
     */
    public static Reference bound(Artifact target, Location location, Inferred inferred) {
        Reference ref = new Reference(List.of(new PathStep(target.getName().getAbsolute(), location, target)), location);
        ref.setScope(RefScope.GLOBAL);
        ref.setInferred(inferred);
        ref.getCell().bind(target);
        return ref;
    }

    /**
     * Syntactic copy; settled results of the reference and its steps are kept.
     */
    public Reference copy() {
        List<PathStep> steps = new ArrayList<>();
        for (PathStep step : path) {
            steps.add(step.copy());
        }
        Reference ref = new Reference(steps, location);
        ref.scope = scope;
        ref.artifactSteps = artifactSteps;
        ref.inferred = inferred;
        ref.cell.copyFrom(cell);
        return ref;
    }

    public List<PathStep> getPath() { return path; }
    public Location getLocation() { return location; }
    public RefScope getScope() { return scope; }
    public int getArtifactSteps() { return artifactSteps; }
    public Inferred getInferred() { return inferred; }
    public ResolutionCell getCell() { return cell; }

    public void setScope(RefScope scope) { this.scope = scope; }
    public void setArtifactSteps(int artifactSteps) { this.artifactSteps = artifactSteps; }
    public void setInferred(Inferred inferred) { this.inferred = inferred; }

    /** The bound artifact, or {@code null} if unresolved or failed. */
    public Artifact getArtifact() {
        return cell.getArtifact();
    }

    public PathStep head() {
        return path.isEmpty() ? null : path.get(0);
    }

    public PathStep last() {
        return path.isEmpty() ? null : path.get(path.size() - 1);
    }

    public String pathName() {
        return path.stream().map(PathStep::getId).collect(Collectors.joining("."));
    }

    @Override
    public String toString() {
        return (scope == RefScope.PARAM ? ":" : "") + pathName();
    }
}
