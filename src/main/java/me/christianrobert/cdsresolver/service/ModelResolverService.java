package me.christianrobert.cdsresolver.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.cdsresolver.config.ResolverConfig;
import me.christianrobert.cdsresolver.diagnostics.DiagnosticJsonSerializer;
import me.christianrobert.cdsresolver.diagnostics.Diagnostics;
import me.christianrobert.cdsresolver.diagnostics.Severity;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Model;
import me.christianrobert.cdsresolver.resolve.context.ResolveContext;
import me.christianrobert.cdsresolver.resolve.context.ResolveException;
import me.christianrobert.cdsresolver.resolve.cycle.CycleDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point: resolves a parsed model in place.
 *
 * <p>Phases:
 * <pre>
 * link → includes → extensions → usings → populate views → key propagation
 *      → resolve references → rewrite associations → late extensions → cycles
 * </pre>
 *
 * <p>Usage:
 * <pre>
 * ResolveResult result = service.resolve(model);
 * if (result.isFailure()) {
 *     // report result.getMessages()
 * }
 * </pre>
 */
@ApplicationScoped
public class ModelResolverService {

    private static final Logger log = LoggerFactory.getLogger(ModelResolverService.class);

    @Inject
    ResolverConfig config;

    @Inject
    DiagnosticJsonSerializer serializer;

    public ModelResolverService() {
    }

    public ModelResolverService(ResolverConfig config) {
        this.config = config;
        this.serializer = new DiagnosticJsonSerializer();
    }

    /**
     * Resolves all definitions of {@code model}.  Messages are collected in
     * the result; the run is a failure if an error was reported.
     *
     * @param model parsed model with its sources; must not have been resolved before
     * @return ResolveResult with the diagnostics of the run
     */
    public ResolveResult resolve(Model model) {
        if (model == null) {
            return ResolveResult.failure(null, null, "Model cannot be null");
        }
        ResolverConfig effectiveConfig = config != null ? config : new ResolverConfig();
        Diagnostics diagnostics = new Diagnostics(effectiveConfig.getSeverityOverrides(),
                effectiveConfig.isEnabled(ResolverConfig.ATTACH_VALID_NAMES, false));

        log.debug("Resolving model with {} sources", model.getSources().size());

        String phase = "link";
        try {
            ResolveContext ctx = new ResolveContext(model, effectiveConfig, diagnostics);

            // STEP 1: Definitions, lexical blocks and name proxies
            log.debug("Step 1: Linking sources");
            ctx.linker().link();
            ctx.includes().expandAll();
            ctx.extensions().applyExtensions();
            int usings = ctx.linker().checkUsings();
            log.info("Linked {} definitions, checked {} usings", model.getDefinitions().size(), usings);

            // STEP 2: Elements of views and autoexposed entities
            log.debug("Step 2: Populating views");
            phase = "populate";
            for (Artifact art : new ArrayList<>(model.getDefinitions().values())) {
                ctx.queries().traverseElementEnvironments(art);
            }
            List<Artifact> exposed = ctx.drainAutoExposed();
            while (!exposed.isEmpty()) {
                for (Artifact art : exposed) {
                    ctx.queries().traverseElementEnvironments(art);
                }
                exposed = ctx.drainAutoExposed();
            }
            ctx.closeAutoExposure();
            log.info("Populated {} views", model.getEntities().size());

            // STEP 3: KEY properties of query elements
            log.debug("Step 3: Propagating key properties");
            phase = "propagate-keys";
            for (Artifact view : new ArrayList<>(model.getEntities())) {
                ctx.keyPropagator().propagateKeyProps(view);
            }

            // STEP 4: All remaining references
            log.debug("Step 4: Resolving references");
            phase = "resolve";
            int resolved = ctx.definitions().resolveAll();
            log.info("Resolved references of {} nodes", resolved);

            // STEP 5: ON conditions and foreign keys of inferred associations
            log.debug("Step 5: Rewriting associations");
            phase = "rewrite";
            rewriteAssociations(ctx, model);
            ctx.extensions().lateExtensions();
            log.info("Rewrote {} associations, applied {} extensions",
                    ctx.rewriter().getRewrittenCount(), ctx.extensions().getAppliedCount());

            // STEP 6: Illegal cycles over the collected dependencies
            log.debug("Step 6: Detecting cycles");
            phase = "cycles";
            int cyclic = new CycleDetector(ctx.links(), diagnostics).detectCycles(model.getNodes());
            if (cyclic > 0) {
                log.warn("Found {} cyclic references", cyclic);
            }

            if (serializer != null && log.isDebugEnabled()) {
                log.debug("Message summary: {}", serializer.summary(diagnostics));
            }
            if (diagnostics.hasErrors()) {
                log.warn("Resolving finished with {} errors, {} warnings",
                        diagnostics.count(Severity.ERROR), diagnostics.count(Severity.WARNING));
                return ResolveResult.withErrors(model, diagnostics, resolved);
            }
            log.info("Successfully resolved model: {} messages", diagnostics.size());
            return ResolveResult.success(model, diagnostics, resolved);

        } catch (ResolveException e) {
            e.inPhase(phase);
            log.error("Resolving failed: {}", e.getDetailedMessage(), e);
            return ResolveResult.failure(model, diagnostics, e);

        } catch (Exception e) {
            log.error("Unexpected error during resolving in phase {}", phase, e);
            String errorMsg = "Unexpected error: " + e.getMessage();
            return ResolveResult.failure(model, diagnostics, errorMsg);
        }
    }

    private void rewriteAssociations(ResolveContext ctx, Model model) {
        List<Artifact> definitions = new ArrayList<>(model.getDefinitions().values());
        for (Artifact art : definitions) {
            if (!art.isBuiltin()) {
                ctx.rewriter().rewriteSimple(art);
            }
        }
        for (Artifact view : new ArrayList<>(model.getEntities())) {
            ctx.rewriter().rewriteView(view);
            ctx.rewriteChecker().rewriteViewCheck(view);
        }
        for (Artifact art : definitions) {
            if (art.getQuery() == null && art.getIncludes() != null && !art.getIncludes().isEmpty()) {
                ctx.rewriter().rewriteView(art);
            }
        }
    }
}
