package me.christianrobert.cdsresolver.resolve.context;

import me.christianrobert.cdsresolver.config.ResolverConfig;
import me.christianrobert.cdsresolver.diagnostics.Diagnostics;
import me.christianrobert.cdsresolver.linker.ModelLinker;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.LinkTable;
import me.christianrobert.cdsresolver.model.Model;
import me.christianrobert.cdsresolver.resolve.DefinitionResolver;
import me.christianrobert.cdsresolver.resolve.IncludeExpander;
import me.christianrobert.cdsresolver.resolve.annotation.AnnotationMerger;
import me.christianrobert.cdsresolver.resolve.annotation.ExtensionApplier;
import me.christianrobert.cdsresolver.resolve.annotation.LayerGraph;
import me.christianrobert.cdsresolver.resolve.expr.ExpressionResolver;
import me.christianrobert.cdsresolver.resolve.path.PathResolver;
import me.christianrobert.cdsresolver.resolve.query.ColumnInitializer;
import me.christianrobert.cdsresolver.resolve.query.KeyPropagator;
import me.christianrobert.cdsresolver.resolve.query.QueryPopulator;
import me.christianrobert.cdsresolver.resolve.query.QueryResolver;
import me.christianrobert.cdsresolver.resolve.redirect.AutoExposer;
import me.christianrobert.cdsresolver.resolve.redirect.ForeignKeys;
import me.christianrobert.cdsresolver.resolve.redirect.ImplicitRedirector;
import me.christianrobert.cdsresolver.resolve.redirect.RedirectionChecker;
import me.christianrobert.cdsresolver.resolve.redirect.TargetResolver;
import me.christianrobert.cdsresolver.resolve.rewrite.AssociationRewriter;
import me.christianrobert.cdsresolver.resolve.rewrite.RewriteChecker;
import me.christianrobert.cdsresolver.resolve.type.EffectiveTypeEngine;
import me.christianrobert.cdsresolver.resolve.type.TypeResolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * All state of one resolve run.
 *
 * <p>A context is created per {@link Model}; it owns the per-run side tables
 * (effective types, view population status) and the resolver components.
 * The components call each other through the context because resolution is
 * on demand: resolving a path may populate a view, which resolves its FROM
 * source, which computes an effective type, which redirects an association.
 *
 * <p>Not thread-safe; a run mutates the model in place.
 */
public class ResolveContext {

    private static final Logger log = LoggerFactory.getLogger(ResolveContext.class);

    private final Model model;
    private final Diagnostics diagnostics;

    // Feature switches, read once from the configuration
    private final boolean expandElements;
    private final boolean scopedRedirections;
    private final boolean autoexposeViaComposition;
    private final boolean nestedProjections;

    // Per-node side tables
    private final StatusTable<Artifact> effectiveTypes = new StatusTable<>("effective type");
    private final StatusTable<Boolean> views = new StatusTable<>("view population");

    // Autoexposed entities created but not traversed yet
    private final List<Artifact> newAutoExposed = new ArrayList<>();
    private boolean autoExposeClosed;

    private final ModelLinker linker;
    private final PathResolver paths;
    private final ExpressionResolver expressions;
    private final EffectiveTypeEngine types;
    private final TypeResolver typeRefs;
    private final QueryPopulator queries;
    private final ColumnInitializer columns;
    private final KeyPropagator keyPropagator;
    private final QueryResolver queryResolver;
    private final ImplicitRedirector redirector;
    private final AutoExposer autoExposer;
    private final TargetResolver targets;
    private final RedirectionChecker redirections;
    private final ForeignKeys foreignKeys;
    private final AssociationRewriter rewriter;
    private final RewriteChecker rewriteChecker;
    private final LayerGraph layers;
    private final AnnotationMerger annotations;
    private final ExtensionApplier extensions;
    private final IncludeExpander includes;
    private final DefinitionResolver definitions;

    public ResolveContext(Model model, ResolverConfig config, Diagnostics diagnostics) {
        this.model = model;
        this.diagnostics = diagnostics;
        this.expandElements = config.isEnabled(ResolverConfig.EXPAND_ELEMENTS, true);
        this.scopedRedirections = config.isEnabled(ResolverConfig.SCOPED_REDIRECTIONS, true);
        this.autoexposeViaComposition = config.isEnabled(ResolverConfig.AUTOEXPOSE_VIA_COMPOSITION, true);
        this.nestedProjections = config.isEnabled(ResolverConfig.NESTED_PROJECTIONS, true);

        this.linker = new ModelLinker(this);
        this.paths = new PathResolver(this);
        this.expressions = new ExpressionResolver(this);
        this.types = new EffectiveTypeEngine(this);
        this.typeRefs = new TypeResolver(this);
        this.queries = new QueryPopulator(this);
        this.columns = new ColumnInitializer(this);
        this.keyPropagator = new KeyPropagator(this);
        this.queryResolver = new QueryResolver(this);
        this.redirector = new ImplicitRedirector(this);
        this.autoExposer = new AutoExposer(this);
        this.targets = new TargetResolver(this);
        this.redirections = new RedirectionChecker(this);
        this.foreignKeys = new ForeignKeys(this);
        this.rewriter = new AssociationRewriter(this);
        this.rewriteChecker = new RewriteChecker(this);
        this.layers = new LayerGraph(model.getSources());
        this.annotations = new AnnotationMerger(this);
        this.extensions = new ExtensionApplier(this);
        this.includes = new IncludeExpander(this);
        this.definitions = new DefinitionResolver(this);
    }

    public Model model() { return model; }
    public LinkTable links() { return model.getLinks(); }
    public Diagnostics diagnostics() { return diagnostics; }

    public boolean isExpandElements() { return expandElements; }
    public boolean isScopedRedirections() { return scopedRedirections; }
    public boolean isAutoexposeViaComposition() { return autoexposeViaComposition; }
    public boolean isNestedProjections() { return nestedProjections; }

    public StatusTable<Artifact> effectiveTypes() { return effectiveTypes; }
    public StatusTable<Boolean> views() { return views; }

    public ModelLinker linker() { return linker; }
    public PathResolver paths() { return paths; }
    public ExpressionResolver expressions() { return expressions; }
    public EffectiveTypeEngine types() { return types; }
    public TypeResolver typeRefs() { return typeRefs; }
    public QueryPopulator queries() { return queries; }
    public ColumnInitializer columns() { return columns; }
    public KeyPropagator keyPropagator() { return keyPropagator; }
    public QueryResolver queryResolver() { return queryResolver; }
    public ImplicitRedirector redirector() { return redirector; }
    public AutoExposer autoExposer() { return autoExposer; }
    public TargetResolver targets() { return targets; }
    public RedirectionChecker redirections() { return redirections; }
    public ForeignKeys foreignKeys() { return foreignKeys; }
    public AssociationRewriter rewriter() { return rewriter; }
    public RewriteChecker rewriteChecker() { return rewriteChecker; }
    public LayerGraph layers() { return layers; }
    public AnnotationMerger annotations() { return annotations; }
    public ExtensionApplier extensions() { return extensions; }
    public IncludeExpander includes() { return includes; }
    public DefinitionResolver definitions() { return definitions; }

    // ==================== AUTOEXPOSURE QUEUE ====================

    /**
     * Queues a newly created autoexposed entity for element traversal.  After
     * the population phase the queue is closed: the entity is populated on
     * creation, but its members are resolved by the reference phase only.
     */
    public void addAutoExposed(Artifact entity) {
        if (autoExposeClosed) {
            log.debug("Late autoexposure of {}, not queued", entity.getName().getAbsolute());
            return;
        }
        newAutoExposed.add(entity);
    }

    /** Takes and clears the queue of autoexposed entities created since the last call. */
    public List<Artifact> drainAutoExposed() {
        List<Artifact> drained = new ArrayList<>(newAutoExposed);
        newAutoExposed.clear();
        return drained;
    }

    public void closeAutoExposure() {
        autoExposeClosed = true;
    }

    public boolean isAutoExposeClosed() {
        return autoExposeClosed;
    }
}
