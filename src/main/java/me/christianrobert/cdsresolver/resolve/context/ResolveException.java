package me.christianrobert.cdsresolver.resolve.context;

/**
 * Internal invariant violation during the resolve pass: a structural field
 * the linker must provide is missing, a settled resolution is overwritten or a
 * phase is invoked out of order.  Modeling errors of the user are never
 * reported with this exception; they go to the diagnostics.
 */
public class ResolveException extends RuntimeException {

    private final String artifactName;
    private final String context;
    private String phase;

    public ResolveException(String message) {
        super(message);
        this.artifactName = null;
        this.context = null;
    }

    public ResolveException(String message, Throwable cause) {
        super(message, cause);
        this.artifactName = null;
        this.context = null;
    }

    public ResolveException(String message, String artifactName, String context) {
        super(message);
        this.artifactName = artifactName;
        this.context = context;
    }

    public ResolveException(String message, String artifactName, String context, Throwable cause) {
        super(message, cause);
        this.artifactName = artifactName;
        this.context = context;
    }

    public String getArtifactName() {
        return artifactName;
    }

    public String getContext() {
        return context;
    }

    /** Resolve phase that was running when the exception was raised, if known. */
    public String getPhase() {
        return phase;
    }

    /**
     * Records the running phase unless one is already set.
     *
     * @return this exception
     */
    public ResolveException inPhase(String phase) {
        if (this.phase == null) {
            this.phase = phase;
        }
        return this;
    }

    /**
     * Gets a detailed error message including phase, artifact name and context.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (phase != null) {
            sb.append("\nPhase: ").append(phase);
        }
        if (artifactName != null) {
            sb.append("\nArtifact: ").append(artifactName);
        }
        if (context != null) {
            sb.append("\nContext: ").append(context);
        }
        return sb.toString();
    }
}
