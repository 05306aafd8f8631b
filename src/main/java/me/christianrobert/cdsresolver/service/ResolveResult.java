package me.christianrobert.cdsresolver.service;

import me.christianrobert.cdsresolver.diagnostics.Diagnostic;
import me.christianrobert.cdsresolver.diagnostics.Diagnostics;
import me.christianrobert.cdsresolver.diagnostics.Severity;
import me.christianrobert.cdsresolver.model.Model;
import me.christianrobert.cdsresolver.resolve.context.ResolveException;

import java.util.Collections;
import java.util.List;

/**
 * Result of resolving a model.
 * A run fails if it aborted with an exception or reported at least one error;
 * the model is annotated in place in both cases.
 */
public class ResolveResult {

    private final boolean success;
    private final Model model;
    private final Diagnostics diagnostics;
    private final String errorMessage;
    private final int resolvedCount;

    private ResolveResult(boolean success, Model model, Diagnostics diagnostics, String errorMessage,
                          int resolvedCount) {
        this.success = success;
        this.model = model;
        this.diagnostics = diagnostics;
        this.errorMessage = errorMessage;
        this.resolvedCount = resolvedCount;
    }

    public static ResolveResult success(Model model, Diagnostics diagnostics, int resolvedCount) {
        return new ResolveResult(true, model, diagnostics, null, resolvedCount);
    }

    /**
     * Creates a result for a run which completed, but reported errors.
     */
    public static ResolveResult withErrors(Model model, Diagnostics diagnostics, int resolvedCount) {
        String message = diagnostics.count(Severity.ERROR) + " error(s) reported";
        return new ResolveResult(false, model, diagnostics, message, resolvedCount);
    }

    public static ResolveResult failure(Model model, Diagnostics diagnostics, String errorMessage) {
        return new ResolveResult(false, model, diagnostics, errorMessage, 0);
    }

    /**
     * Creates a failed result from an exception.
     */
    public static ResolveResult failure(Model model, Diagnostics diagnostics, ResolveException exception) {
        return new ResolveResult(false, model, diagnostics, exception.getDetailedMessage(), 0);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public Model getModel() {
        return model;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    public List<Diagnostic> getMessages() {
        return diagnostics != null ? diagnostics.getMessages() : Collections.emptyList();
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public int getResolvedCount() {
        return resolvedCount;
    }

    @Override
    public String toString() {
        int messages = diagnostics != null ? diagnostics.size() : 0;
        if (success) {
            return "ResolveResult{success=true, resolved=" + resolvedCount + ", messages=" + messages + "}";
        } else {
            return "ResolveResult{success=false, error='" + errorMessage + "', messages=" + messages + "}";
        }
    }
}
