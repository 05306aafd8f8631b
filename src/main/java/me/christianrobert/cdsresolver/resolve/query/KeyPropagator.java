package me.christianrobert.cdsresolver.resolve.query;

import me.christianrobert.cdsresolver.diagnostics.MessageArgs;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Cardinality;
import me.christianrobert.cdsresolver.model.PathStep;
import me.christianrobert.cdsresolver.model.Reference;
import me.christianrobert.cdsresolver.model.expr.Expressions;
import me.christianrobert.cdsresolver.model.expr.PathExpression;
import me.christianrobert.cdsresolver.model.query.FromItem;
import me.christianrobert.cdsresolver.model.query.SelectQuery;
import me.christianrobert.cdsresolver.model.query.TableRef;
import me.christianrobert.cdsresolver.resolve.context.ResolveContext;
import me.christianrobert.cdsresolver.resolve.path.PathNavigation;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Propagates the {@code key} property of source elements to the elements of
 * simple views (path or sub query in FROM; no JOIN, no UNION).
 *
 * <p>Keys are only propagated if the query has no explicit keys, does not
 * select from a to-many association, projects all keys of its primary
 * source and does not navigate along to-many associations in its columns.
 */
public class KeyPropagator {

    private final ResolveContext ctx;

    public KeyPropagator(ResolveContext ctx) {
        this.ctx = ctx;
    }

    public void propagateKeyProps(Artifact view) {
        QueryTraversal.postOrder(view.getQuery(), true, query -> {
            if (!withExplicitKeys(query) && inheritKeyProp(query, false) && withKeyPropagation(query)) {
                inheritKeyProp(query, true);
            }
        });
    }

    private static Map<String, Artifact> elements(SelectQuery query) {
        Artifact result = query.getResult();
        return result != null && result.getElements() != null ? result.getElements() : Map.of();
    }

    private static boolean withExplicitKeys(SelectQuery query) {
        for (Artifact elem : elements(query).values()) {
            if (elem.isKey()) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param doIt set the key property; otherwise only test whether an
     *             element would get it
     * @return with {@code doIt == false}: whether there is an element
     * projecting a key
     */
    private static boolean inheritKeyProp(SelectQuery query, boolean doIt) {
        for (Artifact elem : elements(query).values()) {
            if (!(elem.getValue() instanceof PathExpression)) {
                continue;
            }
            Reference ref = ((PathExpression) elem.getValue()).getReference();
            PathNavigation nav = PathNavigation.of(ref);
            if (nav.getNavigation() == null || nav.getItem() != ref.last()) {
                continue;
            }
            Artifact source = nav.getItem().getArtifact();
            if (source != null && source.isKey()) {
                if (!doIt) {
                    return true;
                }
                elem.setKey(Boolean.TRUE);
                elem.setKeyInferred(true);
            }
        }
        return false;
    }

    private boolean withKeyPropagation(SelectQuery query) {
        FromItem from = query.getFrom();
        if (from == null) {
            return false;
        }
        boolean propagateKeys = true;
        if (from instanceof TableRef && ((TableRef) from).getRef() != null) {
            PathStep toMany = withToManyAssociation(((TableRef) from).getRef(), true);
            if (toMany != null) {
                propagateKeys = false;
                ctx.diagnostics().info("query-from-many", toMany.getLocation(), query.getResult(),
                        MessageArgs.of("art", toMany.getArtifact()));
            }
        }

        List<String> notProjected = new ArrayList<>();
        Iterator<Artifact> aliases = query.getTableAliases().values().iterator();
        Artifact primary = aliases.hasNext() ? aliases.next() : null;
        if (primary != null && primary.getElements() != null) {
            for (Artifact nav : primary.getElements().values()) {
                Artifact origin = ctx.links().origin(nav);
                if (origin != null && origin.isKey() && ctx.links().projections(nav).isEmpty()) {
                    notProjected.add(nav.getName().getId());
                }
            }
        }
        if (!notProjected.isEmpty()) {
            propagateKeys = false;
            ctx.diagnostics().info("query-missing-keys", from.getLocation(), query.getResult(),
                    MessageArgs.of("names", notProjected).variant(notProjected.size() == 1 ? "one" : null));
        }

        for (Artifact elem : elements(query).values()) {
            if (elem.getInferred() == null && elem.getValue() != null
                    && Expressions.anyMatch(elem.getValue(), path -> navigatesToMany(path, query), q -> false)) {
                propagateKeys = false;
            }
        }
        return propagateKeys;
    }

    private boolean navigatesToMany(PathExpression path, SelectQuery query) {
        PathStep step = withToManyAssociation(path.getReference(), false);
        if (step == null) {
            return false;
        }
        ctx.diagnostics().info("query-navigate-many", step.getLocation(), query.getResult(),
                MessageArgs.of("art", step.getArtifact()));
        return true;
    }

    /**
     * The first step of {@code ref} which follows a to-many association;
     * the last step only counts with {@code alsoTestLast}.
     */
    private PathStep withToManyAssociation(Reference ref, boolean alsoTestLast) {
        List<PathStep> path = ref.getPath();
        for (PathStep item : path) {
            Artifact art = item.getArtifact();
            Artifact type = art != null ? ctx.types().effectiveType(art) : null;
            if (type != null && type.getTarget() != null && targetMaxNotOne(type, item)) {
                return alsoTestLast || item != path.get(path.size() - 1) ? item : null;
            }
        }
        return null;
    }

    /** Associations without cardinality are to-one. */
    private static boolean targetMaxNotOne(Artifact assoc, PathStep item) {
        Cardinality cardinality = item.getCardinality() != null ? item.getCardinality() : assoc.getCardinality();
        return cardinality != null && cardinality.isTargetMaxNotOne();
    }
}
