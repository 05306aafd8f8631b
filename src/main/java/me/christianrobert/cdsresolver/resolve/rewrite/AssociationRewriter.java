package me.christianrobert.cdsresolver.resolve.rewrite;

import me.christianrobert.cdsresolver.diagnostics.MessageArgs;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Inferred;
import me.christianrobert.cdsresolver.model.Kind;
import me.christianrobert.cdsresolver.model.Location;
import me.christianrobert.cdsresolver.model.Members;
import me.christianrobert.cdsresolver.model.PathStep;
import me.christianrobert.cdsresolver.model.Reference;
import me.christianrobert.cdsresolver.model.expr.Expression;
import me.christianrobert.cdsresolver.model.expr.Expressions;
import me.christianrobert.cdsresolver.model.expr.PathExpression;
import me.christianrobert.cdsresolver.resolve.context.ResolveContext;
import me.christianrobert.cdsresolver.resolve.path.PathNavigation;
import me.christianrobert.cdsresolver.resolve.query.QueryTraversal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Rewrites the ON conditions and foreign keys of associations which are
 * taken over from another association: projected in a view, included from
 * a structure, or derived via a type.
 *
 * <p>An ON condition is copied and every path in it is rewritten to the
 * perspective of the new association: source elements become the projecting
 * view elements, the source {@code $self} becomes the {@code $self} of the
 * view.  Foreign keys are copied; with a redirected target their target
 * elements are mapped along the redirection chain.
 */
public class AssociationRewriter {

    private static final Logger log = LoggerFactory.getLogger(AssociationRewriter.class);

    private final ResolveContext ctx;
    private final BacklinkChecker backlinks;

    // ON conditions created by a rewrite (not written by the user)
    private final Set<Expression> rewrittenConditions = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<Artifact> inRewrite = Collections.newSetFromMap(new IdentityHashMap<>());

    private int rewrittenCount;

    public AssociationRewriter(ResolveContext ctx) {
        this.ctx = ctx;
        this.backlinks = new BacklinkChecker(ctx);
    }

    public boolean isRewritten(Expression on) {
        return on != null && rewrittenConditions.contains(on);
    }

    public int getRewrittenCount() {
        return rewrittenCount;
    }

    /**
     * Rewrites the associations of a definition which is neither a view nor
     * has includes; in a service, also informs about association targets
     * outside any service.
     */
    public void rewriteSimple(Artifact art) {
        boolean hasIncludes = art.getIncludes() != null && !art.getIncludes().isEmpty();
        if (!hasIncludes && art.getQuery() == null) {
            rewriteAssociation(art);
            forEachElement(art, this::rewriteAssociation);
        }
        if (ctx.links().service(art) != null) {
            forEachElement(art, this::excludeAssociation);
        }
    }

    /** Rewrites the associations of all SELECTs of a view and of an entity with includes. */
    public void rewriteView(Artifact view) {
        QueryTraversal.postOrder(view.getQuery(), false, query -> {
            if (query.getResult() != null) {
                forEachElement(query.getResult(), this::rewriteAssociation);
            }
        });
        if (view.getIncludes() != null && !view.getIncludes().isEmpty()) {
            forEachElement(view, this::rewriteAssociation);
        }
    }

    private void excludeAssociation(Artifact elem) {
        Artifact target = elem.getTarget() != null ? elem.getTarget().getArtifact() : null;
        if (target == null || ctx.links().service(target) != null) {
            return;
        }
        Location location = elem.getTarget().getLocation();
        if (elem.getInferred() == null) {
            ctx.diagnostics().warning("assoc-target-not-in-service", location, elem,
                    MessageArgs.of("target", target)
                            .variant(elem.mainOrSelf().getQuery() != null ? "select" : "define"));
        } else {
            ctx.diagnostics().info("assoc-outside-service", location, elem, MessageArgs.of("target", target));
        }
    }

    /**
     * Rewrites the association {@code element} (or its items) and its sub
     * elements.  The type derivation chain is followed to the first node
     * with an ON condition or foreign keys; its condition is then
     * rewritten node by node back to {@code element}.
     */
    public void rewriteAssociation(Artifact element) {
        Artifact elem = element.getItems() != null ? element.getItems() : element;
        if (elem.getElements() != null && ctx.isExpandElements()) {
            forEachElement(elem, this::rewriteAssociation);
        }
        if (originTarget(elem) == null) {
            return;
        }
        List<Artifact> chain = new ArrayList<>();
        Artifact current = elem;
        try {
            while (current.getOn() == null && current.getForeignKeys() == null) {
                chain.add(current);
                if (!inRewrite.add(current)) {
                    // cyclic, reported by the cycle detection
                    return;
                }
                current = ctx.types().directType(current);
                if (current == null || current.isBuiltin()) {
                    return;
                }
            }
            Collections.reverse(chain);
            for (Artifact art : chain) {
                if (current.getOn() != null) {
                    rewriteCondition(art, current);
                } else if (current.getForeignKeys() != null) {
                    rewriteKeys(art, current);
                }
                current = art;
            }
        } finally {
            chain.forEach(inRewrite::remove);
        }
    }

    private Artifact originTarget(Artifact elem) {
        Artifact assoc = elem.getExpand() == null ? ctx.types().directType(elem) : null;
        Artifact type = assoc != null ? ctx.types().effectiveType(assoc) : null;
        return type != null && type.getTarget() != null ? type.getTarget().getArtifact() : null;
    }

    // ==================== FOREIGN KEYS ====================

    private void rewriteKeys(Artifact elem, Artifact assoc) {
        LinkedHashMap<String, Artifact> foreignKeys = new LinkedHashMap<>();
        elem.setForeignKeys(foreignKeys);
        List<String> uncovered = new ArrayList<>();
        for (Map.Entry<String, Artifact> entry : assoc.getForeignKeys().entrySet()) {
            String name = entry.getKey();
            Artifact orig = entry.getValue();
            Artifact fk = Members.linkToOrigin(ctx.model(), orig, name, elem, foreignKeys, elem.getLocation(), false);
            fk.setInferred(Inferred.REWRITE);
            fk.setBlock(orig.getBlock());
            if (ctx.effectiveTypes().isSettled(orig)) {
                ctx.effectiveTypes().done(fk, ctx.effectiveTypes().value(orig));
            }
            if (orig.getTargetElement() != null) {
                Reference targetElement = rewriteTargetElement(elem, orig.getTargetElement());
                if (targetElement.getArtifact() == null && orig.getTargetElement().getArtifact() != null) {
                    uncovered.add(name);
                }
                fk.setTargetElement(targetElement);
            }
        }
        ++rewrittenCount;
        if (!uncovered.isEmpty()) {
            reportUncoveredKeys(elem, assoc, uncovered);
        }
    }

    /**
     * The target element of a copied foreign key: with a redirected target,
     * the element name is mapped through the table aliases of the
     * redirection chain to the element of the new target.
     */
    private Reference rewriteTargetElement(Artifact elem, Reference orig) {
        List<Artifact> chain = ctx.links().redirected(elem);
        if (chain == null || orig.getPath().isEmpty()) {
            return orig.copy();
        }
        PathStep head = orig.head();
        String name = mapThroughAliases(chain, head.getId(), elem);
        Map<String, Artifact> env = name != null ? ctx.paths().environment(elem) : null;
        Artifact found = env != null ? env.get(name) : null;

        List<PathStep> steps = new ArrayList<>();
        PathStep first = renamed(head, name != null ? name : head.getId());
        first.getCell().bind(found);
        steps.add(first);
        for (PathStep step : orig.getPath().subList(1, orig.getPath().size())) {
            steps.add(step.copy());
        }
        Reference ref = new Reference(steps, orig.getLocation());
        ref.setInferred(Inferred.REWRITE);
        if (found == null) {
            ref.getCell().bind(null);
        } else if (steps.size() == 1) {
            ref.getCell().bind(found);
        } else {
            ref.getCell().copyFrom(orig.getCell());
        }
        return ref;
    }

    private void reportUncoveredKeys(Artifact elem, Artifact assoc, List<String> names) {
        RewriteChecker checker = ctx.rewriteChecker();
        Artifact base = checker.assocWithExplicitSpec(assoc);
        Location location = elem.getTarget() != null ? elem.getTarget().getLocation() : elem.getLocation();
        String variant = names.size() == 1 ? "one" : null;
        if (checker.inferredForeignKeys(base.getForeignKeys(), null)) {
            Artifact target = base.getTarget() != null ? base.getTarget().getArtifact() : null;
            ctx.diagnostics().error("rewrite-key-not-covered-implicit", location, elem,
                    MessageArgs.of("names", names).and("target", target).variant(variant));
        } else {
            ctx.diagnostics().error("rewrite-key-not-covered-explicit", location, elem,
                    MessageArgs.of("names", names).and("art", base).variant(variant));
        }
    }

    // ==================== ON CONDITIONS ====================

    private void rewriteCondition(Artifact elem, Artifact assoc) {
        if (ctx.isExpandElements() && elem.getParent() != null && elem.getParent().getKind() == Kind.ELEMENT) {
            ctx.diagnostics().error("rewrite-unsupported-sub-element", elem.getLocation(), elem, MessageArgs.none());
            return;
        }
        Artifact navigation = assoc;
        Artifact tableAlias = null;
        if (elem.getMain() != null && elem.getMain().getQuery() != null) {
            PathNavigation nav = PathNavigation.of(valueRef(elem));
            navigation = nav.getNavigation();
            tableAlias = nav.getTableAlias();
        }
        Expression cond = Expressions.copy(assoc.getOn());
        elem.setOn(cond);
        rewrittenConditions.add(cond);
        ++rewrittenCount;
        if (navigation == null) {
            // $projection, $self or a constant: nothing to map
            return;
        }
        if (navigation != assoc && ctx.links().origin(navigation) != assoc) {
            boolean reported = ctx.links().isRedirected(elem) && ctx.links().redirected(elem) == null;
            if (!reported) {
                Location location = elem.getTarget() != null ? elem.getTarget().getLocation() : elem.getLocation();
                ctx.diagnostics().error("rewrite-not-supported", location, elem, MessageArgs.none());
            }
            return;
        }
        if (tableAlias != null && (tableAlias.getTableRef() == null || tableAlias.getTableRef().getRef() == null)) {
            ctx.diagnostics().error("rewrite-unsupported-subquery", elem.getValue().getLocation(), elem,
                    MessageArgs.none());
            return;
        }
        for (PathExpression path : Expressions.paths(cond)) {
            rewriteExpr(path, elem, tableAlias);
        }
        backlinks.checkBacklinks(elem, cond);
        log.trace("Rewrote ON condition of {}", elem.getName());
    }

    /**
     * Rewrites one path of a copied ON condition to the perspective of
     * {@code assoc}: from the ON of a source element reached via
     * {@code tableAlias}, of a mixin, or of an element in an included
     * structure.
     */
    private void rewriteExpr(PathExpression expr, Artifact assoc, Artifact tableAlias) {
        Reference ref = expr.getReference();
        if (ref.getPath().isEmpty() || ref.getArtifact() == null || assoc.getMain() == null) {
            return;
        }
        PathStep head = ref.head();
        if (tableAlias != null) {
            Artifact source = ctx.links().origin(tableAlias);
            Artifact root = head.getNavigation() != null ? head.getNavigation() : head.getArtifact();
            if (root == null || root.getMain() != source) {
                // neither $self nor a source element
                return;
            }
            PathStep item = root.getKind() == Kind.SELF ? second(ref) : head;
            if (item == null) {
                rewritePath(expr, null, assoc, null, true, null);
                return;
            }
            Artifact navElem = tableAlias.getElements() != null ? tableAlias.getElements().get(item.getId()) : null;
            Artifact proj = PathNavigation.navProjection(ctx.links(), navElem, assoc);
            rewritePath(expr, item, assoc, proj, navElem == null, assoc.getValue().getLocation());
        } else if (assoc.getMain().getQuery() != null) {
            PathNavigation nav = PathNavigation.of(ref);
            if (nav.getNavigation() == null && nav.getTableAlias() == null) {
                return;
            }
            Artifact proj = PathNavigation.navProjection(ctx.links(), nav.getNavigation(), assoc);
            Location location = nav.getItem() != null ? nav.getItem().getLocation() : head.getLocation();
            rewritePath(expr, nav.getItem(), assoc, proj, nav.getNavigation() == null, location);
        } else {
            Artifact root = head.getNavigation() != null ? head.getNavigation() : head.getArtifact();
            if (root == null || root.isBuiltin() || root.getKind() != Kind.SELF && root.getKind() != Kind.ELEMENT) {
                return;
            }
            PathStep item = root.getKind() == Kind.SELF ? second(ref) : head;
            if (item == null) {
                return;
            }
            Map<String, Artifact> mainElements = assoc.getMain().getElements();
            Artifact elem = mainElements != null ? mainElements.get(item.getId()) : null;
            if (elem != null && elem != item.getArtifact() && ctx.links().origin(elem) != item.getArtifact()) {
                Artifact origin = ctx.links().origin(assoc);
                ctx.diagnostics().warning("rewrite-shadowed", elem.getName().getLocation(), elem,
                        MessageArgs.of("art", origin != null ? ctx.types().effectiveType(origin) : null));
            }
            rewritePath(expr, item, assoc, elem, false, null);
        }
    }

    /**
     * Replaces the reference of {@code expr}: the root becomes {@code $self}
     * of the new parent or the projecting element {@code elem}, {@code item}
     * is renamed to {@code elem}, the following steps are mapped along the
     * redirection of {@code elem}.
     *
     * @param keep     the path navigates no source element, only the root is rebound
     * @param location where to report a non-projected element, {@code null} for no message
     */
    private void rewritePath(PathExpression expr, PathStep item, Artifact assoc, Artifact elem, boolean keep,
                             Location location) {
        Reference ref = expr.getReference();
        List<PathStep> path = ref.getPath();
        PathStep root = path.get(0);
        if (elem == null && !keep) {
            if (location != null) {
                ctx.diagnostics().error("rewrite-not-projected", location, assoc,
                        MessageArgs.of("name", assoc.getName().getId())
                                .and("art", item != null ? item.getArtifact() : null));
            }
            List<PathStep> steps = new ArrayList<>();
            PathStep unbound = renamed(root, root.getId());
            unbound.getCell().bind(null);
            steps.add(unbound);
            copyFrom(path, 1, steps);
            Reference failed = newReference(ref, steps);
            failed.getCell().bind(null);
            expr.setReference(failed);
            return;
        }

        Artifact parent = assoc.getParent();
        List<PathStep> steps = new ArrayList<>();
        int next;
        if (item != root) {
            steps.add(selfStep(root, root.getLocation(), parent));
            next = 1;
        } else if (!keep && elem.getName() != null && elem.getName().getId().startsWith("$")) {
            steps.add(selfStep(null, item.getLocation(), parent));
            next = 0;
        } else {
            next = 0;
        }
        if (keep || elem.getName() == null) {
            // own $projection or $projection.elem: only renamed to $self
            copyFrom(path, next, steps);
            Reference kept = newReference(ref, steps);
            if (path.size() == 1) {
                kept.getCell().bind(parent);
            } else {
                kept.getCell().copyFrom(ref.getCell());
            }
            expr.setReference(kept);
            return;
        }

        Artifact state = null;
        boolean keepRest = false;
        boolean failed = false;
        for (int i = next; i < path.size(); ++i) {
            PathStep step = path.get(i);
            if (state == null && !failed && !keepRest) {
                if (step == item) {
                    PathStep renamed = renamed(step, elem.getName().getId());
                    if (steps.isEmpty()) {
                        renamed.setNavigation(elem);
                    }
                    renamed.getCell().bind(elem);
                    steps.add(renamed);
                    state = elem;
                } else {
                    steps.add(step.copy());
                }
            } else if (failed || keepRest) {
                steps.add(step.copy());
            } else {
                ItemMapping mapping = rewriteItem(state, step, assoc);
                steps.add(mapping.step);
                if (mapping.keep) {
                    keepRest = true;
                } else if (mapping.artifact == null) {
                    failed = true;
                } else {
                    state = mapping.artifact;
                }
            }
        }
        Reference rewritten = newReference(ref, steps);
        if (keepRest) {
            rewritten.getCell().copyFrom(ref.getCell());
        } else {
            rewritten.getCell().bind(failed ? null : state);
        }
        expr.setReference(rewritten);
    }

    /**
     * Maps a path step following a redirected association to the name of
     * the corresponding element of the new target.
     */
    private ItemMapping rewriteItem(Artifact assocElem, PathStep step, Artifact assoc) {
        List<Artifact> chain = ctx.links().redirected(assocElem);
        if (chain == null) {
            return ItemMapping.keep(step.copy());
        }
        String name = mapThroughAliases(chain, step.getId(), assoc);
        Map<String, Artifact> env = name != null ? ctx.paths().environment(assocElem) : null;
        Artifact found = env != null ? env.get(name) : null;
        PathStep renamed = renamed(step, name != null ? name : step.getId());
        renamed.getCell().bind(found);
        if (found == null) {
            ctx.diagnostics().error("query-undefined-element", step.getLocation(), assoc,
                    MessageArgs.of("id", name != null ? name : step.getId()));
        }
        return new ItemMapping(renamed, found, false);
    }

    /** The name of the element projecting {@code name} after all table aliases of the chain. */
    private String mapThroughAliases(List<Artifact> chain, String name, Artifact preferred) {
        String current = name;
        for (Artifact alias : chain) {
            if (alias.getKind() != Kind.TABLE_ALIAS) {
                continue;
            }
            Artifact navElem = alias.getElements() != null ? alias.getElements().get(current) : null;
            Artifact proj = PathNavigation.navProjection(ctx.links(), navElem, preferred);
            current = proj != null && proj.getName() != null ? proj.getName().getId() : null;
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    private static PathStep selfStep(PathStep orig, Location location, Artifact parent) {
        PathStep self = orig != null ? renamed(orig, "$self") : new PathStep("$self", location);
        self.setNavigation(selfAlias(parent));
        self.getCell().bind(parent);
        return self;
    }

    private static Artifact selfAlias(Artifact parent) {
        if (parent == null) {
            return null;
        }
        Map<String, Artifact> aliases = parent.getKind() == Kind.QUERY && parent.getSelectQuery() != null
                ? parent.getSelectQuery().getTableAliases()
                : parent.getTableAliases();
        return aliases != null ? aliases.get("$self") : null;
    }

    /** Copy of {@code step} with another id; the result cell is left unresolved. */
    private static PathStep renamed(PathStep step, String id) {
        PathStep renamed = new PathStep(id, step.getLocation());
        renamed.setNamedArgs(step.getNamedArgs());
        renamed.setPositionalArgs(step.getPositionalArgs());
        renamed.setWhere(step.getWhere());
        renamed.setCardinality(step.getCardinality());
        renamed.setInferred(step.getInferred());
        return renamed;
    }

    private static Reference newReference(Reference orig, List<PathStep> steps) {
        Reference ref = new Reference(steps, orig.getLocation());
        ref.setScope(orig.getScope());
        ref.setInferred(Inferred.REWRITE);
        return ref;
    }

    private static void copyFrom(List<PathStep> path, int from, List<PathStep> steps) {
        for (int i = from; i < path.size(); ++i) {
            steps.add(path.get(i).copy());
        }
    }

    private static PathStep second(Reference ref) {
        return ref.getPath().size() > 1 ? ref.getPath().get(1) : null;
    }

    private static Reference valueRef(Artifact elem) {
        return elem.getValue() instanceof PathExpression ? ((PathExpression) elem.getValue()).getReference() : null;
    }

    private static void forEachElement(Artifact art, Consumer<Artifact> callback) {
        if (art.getElements() != null) {
            new ArrayList<>(art.getElements().values()).forEach(callback);
        }
    }

    /** Result of mapping one path step after a redirected association. */
    private static final class ItemMapping {
        final PathStep step;
        final Artifact artifact;
        final boolean keep;

        ItemMapping(PathStep step, Artifact artifact, boolean keep) {
            this.step = step;
            this.artifact = artifact;
            this.keep = keep;
        }

        static ItemMapping keep(PathStep step) {
            return new ItemMapping(step, null, true);
        }
    }
}
