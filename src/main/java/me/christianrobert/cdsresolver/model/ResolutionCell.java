package me.christianrobert.cdsresolver.model;

import java.util.Collections;
import java.util.List;

/**
 * Write-once result cell of a reference or path step.  Once settled it is
 * never changed; settling it again with the same outcome is a no-op.
 */
public class ResolutionCell {
    private ResolutionState state = ResolutionState.UNRESOLVED;
    private Artifact artifact;
    private List<Artifact> candidates = Collections.emptyList();

    public ResolutionState getState() { return state; }
    public Artifact getArtifact() { return artifact; }
    public List<Artifact> getCandidates() { return candidates; }

    public boolean isSettled() { return state.isSettled(); }
    public boolean isBound() { return state == ResolutionState.BOUND; }
    public boolean isInProgress() { return state == ResolutionState.IN_PROGRESS; }

    public void begin() {
        if (state != ResolutionState.UNRESOLVED) {
            throw new IllegalStateException("Resolution already started, state " + state);
        }
        state = ResolutionState.IN_PROGRESS;
    }

    public Artifact bind(Artifact target) {
        if (target == null) {
            settle(ResolutionState.NOT_FOUND, null);
            return null;
        }
        settle(ResolutionState.BOUND, target);
        return target;
    }

    public Artifact settle(ResolutionState outcome) {
        settle(outcome, null);
        return null;
    }

    public Artifact ambiguous(List<Artifact> found) {
        settle(ResolutionState.AMBIGUOUS, null);
        candidates = List.copyOf(found);
        return null;
    }

    private void settle(ResolutionState outcome, Artifact target) {
        if (!outcome.isSettled()) {
            throw new IllegalArgumentException("Not a final resolution state: " + outcome);
        }
        if (state.isSettled()) {
            if (state == outcome && artifact == target) {
                return;
            }
            throw new IllegalStateException("Resolution cell already settled to " + state
                    + (artifact != null ? " (" + artifact.getName() + ")" : "")
                    + ", refusing " + outcome);
        }
        state = outcome;
        artifact = target;
    }

    /** Copies the settled outcome of another cell into this unresolved cell. */
    public void copyFrom(ResolutionCell other) {
        if (other.state.isSettled() && !state.isSettled()) {
            state = other.state;
            artifact = other.artifact;
            candidates = other.candidates;
        }
    }

    @Override
    public String toString() {
        return artifact != null ? state + "(" + artifact.getName() + ")" : state.toString();
    }
}
