package me.christianrobert.cdsresolver.resolve.query;

import me.christianrobert.cdsresolver.diagnostics.MessageArgs;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Kind;
import me.christianrobert.cdsresolver.model.Location;
import me.christianrobert.cdsresolver.model.Members;
import me.christianrobert.cdsresolver.model.Reference;
import me.christianrobert.cdsresolver.model.query.SelectQuery;
import me.christianrobert.cdsresolver.model.query.TableRef;
import me.christianrobert.cdsresolver.resolve.context.NodeStatus;
import me.christianrobert.cdsresolver.resolve.context.ResolveContext;
import me.christianrobert.cdsresolver.resolve.path.Environment;
import me.christianrobert.cdsresolver.resolve.path.ResolutionPolicy;
import me.christianrobert.cdsresolver.resolve.path.ResolutionPolicy.AssocMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Populates views: computes the elements of every SELECT of a view from its
 * sources, after the sources themselves have been populated.
 *
 * <p>Population is on demand; a path navigating into a view populates it
 * first.  Each FROM reference is followed once, so a view selecting from
 * itself (directly or via other views) stops the source chain.
 */
public class QueryPopulator {

    private static final Logger log = LoggerFactory.getLogger(QueryPopulator.class);

    private final ResolveContext ctx;

    // FROM references already followed
    private final Set<Reference> followedFrom = Collections.newSetFromMap(new IdentityHashMap<>());

    public QueryPopulator(ResolveContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Populates {@code art} and, before it, all views it selects from.  Does
     * nothing for non-views and views which are already populated.
     */
    public void populateView(Artifact art) {
        if (art.getFromRefs().isEmpty() || ctx.views().status(art) != NodeStatus.UNVISITED) {
            return;
        }
        List<Artifact> resolveChain = new ArrayList<>();
        List<Artifact> fromChain = new ArrayList<>();
        fromChain.add(art);
        while (!fromChain.isEmpty()) {
            Artifact view = fromChain.remove(fromChain.size() - 1);
            if (ctx.views().status(view) != NodeStatus.UNVISITED) {
                continue;
            }
            resolveChain.add(view);
            for (Reference from : view.getFromRefs()) {
                if (!followedFrom.add(from)) {
                    continue;
                }
                Artifact source = ctx.paths().resolve(from, ResolutionPolicy.FROM, view);
                if (source != null && source.getMain() != null) {
                    Artifact type = ctx.types().effectiveType(source);
                    source = type != null && type.getTarget() != null ? ctx.paths().resolveTarget(type) : null;
                }
                if (source != null && !source.getFromRefs().isEmpty()
                        && ctx.views().status(source) == NodeStatus.UNVISITED) {
                    fromChain.add(source);
                }
            }
        }
        Collections.reverse(resolveChain);
        for (Artifact view : resolveChain) {
            if (ctx.views().status(view) != NodeStatus.UNVISITED) {
                continue;
            }
            ctx.views().begin(view);
            log.debug("Populating view {}", view.getName().getAbsolute());
            QueryTraversal.postOrder(view.getQuery(), false, this::populateQuery);
            if (view.getSpecifiedElements() != null) {
                mergeSpecifiedElements(view);
            }
            ctx.views().done(view, Boolean.TRUE);
            ctx.model().addEntity(view);
        }
    }

    /**
     * Specified elements ({@code entity V { a: Integer } as select ...})
     * provide annotations and doc comments for the inferred elements; each
     * side must be present in the other.
     */
    private void mergeSpecifiedElements(Artifact view) {
        Map<String, Artifact> specified = view.getSpecifiedElements();
        Map<String, Artifact> inferred = view.getElements() != null ? view.getElements() : Map.of();
        for (Map.Entry<String, Artifact> entry : inferred.entrySet()) {
            Artifact ielem = entry.getValue();
            Artifact selem = specified.get(entry.getKey());
            if (selem == null) {
                ctx.diagnostics().info("query-missing-element", ielem.getName().getLocation(), view,
                        MessageArgs.of("id", entry.getKey()));
                continue;
            }
            ielem.getAnnotationAssignments().putAll(selem.getAnnotationAssignments());
            if (selem.getDoc() != null) {
                ielem.setDoc(selem.getDoc());
            }
            selem.setReplacement(true);
        }
        for (Map.Entry<String, Artifact> entry : specified.entrySet()) {
            Artifact selem = entry.getValue();
            if (!selem.isReplacement()) {
                ctx.diagnostics().error("query-unspecified-element", selem.getName().getLocation(), selem,
                        MessageArgs.of("id", entry.getKey()));
            }
        }
    }

    /**
     * Populates {@code art} if it is a view, computes its environment and
     * does the same for all its members.
     */
    public void traverseElementEnvironments(Artifact art) {
        populateView(art);
        ctx.paths().environment(art);
        Members.forEachMember(art, this::traverseElementEnvironments);
    }

    /**
     * Computes the navigation elements of the table aliases, the combined
     * environment and the elements of a SELECT.
     */
    public void populateQuery(SelectQuery query) {
        if (query.getCombined() != null || query.getFrom() == null) {
            return;
        }
        query.setCombined(new LinkedHashMap<>());
        for (Artifact alias : new ArrayList<>(query.getTableAliases().values())) {
            resolveTabRef(query, alias);
        }
        ctx.columns().initFromColumns(query.getResult(), query.getColumns(), null);
        if (query.getExcluding() != null) {
            Environment env = Environment.combined(query.getCombined());
            for (Map.Entry<String, Location> entry : query.getExcluding().entrySet()) {
                ctx.columns().resolveExcluding(entry.getKey(), entry.getValue(), env, query.getResult());
            }
        }
    }

    private void resolveTabRef(SelectQuery query, Artifact alias) {
        if (alias.getKind() != Kind.TABLE_ALIAS) {
            return;
        }
        if (alias.getElements() == null) {
            TableRef tableRef = alias.getTableRef();
            Reference ref = tableRef != null ? tableRef.getRef() : null;
            if (!ctx.links().hasOrigin(alias) && ref != null) {
                Artifact tab = ctx.paths().resolve(ref, ResolutionPolicy.FROM, query.getResult());
                ctx.links().setOrigin(alias, tab != null
                        ? ctx.paths().navigationEnv(tab, null, null, AssocMode.DEFAULT)
                        : null);
            }
            // Set before linking: with a cyclic source the alias has no elements
            LinkedHashMap<String, Artifact> navElements = alias.ensureElements();
            Artifact source = ctx.links().origin(alias);
            if (source == null || source.getElements() == null) {
                return;
            }
            Location location = ref != null ? ref.getLocation() : null;
            for (Map.Entry<String, Artifact> entry : new ArrayList<>(source.getElements().entrySet())) {
                Artifact origin = entry.getValue();
                Artifact navElement = Members.linkToOrigin(ctx.model(), origin, entry.getKey(), alias, navElements,
                        location != null ? location : origin.getName().getLocation(), false);
                navElement.setKind(Kind.NAV_ELEMENT);
                navElement.setMasked(origin.getMasked());
            }
        }
        for (Map.Entry<String, Artifact> entry : alias.getElements().entrySet()) {
            query.getCombined().computeIfAbsent(entry.getKey(), k -> new ArrayList<>()).add(entry.getValue());
        }
    }
}
