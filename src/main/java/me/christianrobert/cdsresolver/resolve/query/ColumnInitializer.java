package me.christianrobert.cdsresolver.resolve.query;

import me.christianrobert.cdsresolver.diagnostics.MessageArgs;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Inferred;
import me.christianrobert.cdsresolver.model.Kind;
import me.christianrobert.cdsresolver.model.Location;
import me.christianrobert.cdsresolver.model.Members;
import me.christianrobert.cdsresolver.model.Name;
import me.christianrobert.cdsresolver.model.PathStep;
import me.christianrobert.cdsresolver.model.Reference;
import me.christianrobert.cdsresolver.model.expr.PathExpression;
import me.christianrobert.cdsresolver.model.query.SelectQuery;
import me.christianrobert.cdsresolver.resolve.context.ResolveContext;
import me.christianrobert.cdsresolver.resolve.path.Environment;
import me.christianrobert.cdsresolver.resolve.path.PathNavigation;
import me.christianrobert.cdsresolver.resolve.path.PathResolver;
import me.christianrobert.cdsresolver.resolve.path.ResolutionPolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Creates the elements of a SELECT (or of an {@code expand}) from its
 * columns: explicit columns, wildcard expansion and {@code inline} columns.
 *
 * <p>An explicit column placed after the wildcard which has the name of a
 * source element replaces that element at the position of the wildcard.
 */
public class ColumnInitializer {

    private final ResolveContext ctx;

    // Entries already reported as duplicate definition
    private final Set<Artifact> reportedDuplicates = Collections.newSetFromMap(new IdentityHashMap<>());

    public ColumnInitializer(ResolveContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Creates the elements of {@code holder} (a query result or a column with
     * {@code expand}) from {@code columns}; {@code null} columns stand for
     * {@code *}.
     *
     * @param inlineHead the column with {@code inline} whose columns are
     *                   added to the elements of {@code holder}, {@code null} otherwise
     * @return always true: {@code holder} has its own elements now
     */
    public boolean initFromColumns(Artifact holder, List<Artifact> columns, Artifact inlineHead) {
        Artifact elemsParent = holder.getItems() != null ? holder.getItems() : holder;
        if (inlineHead == null) {
            elemsParent.setElements(new LinkedHashMap<>());
            if (isLeadingResult(holder)) {
                holder.getMain().setElements(elemsParent.getElements());
            }
        }
        List<Artifact> cols = columns != null ? columns : List.of(implicitWildcard(holder));
        for (Artifact col : cols) {
            if (col.isWildcard()) {
                Map<String, Artifact> siblings = wildcardSiblings(columns, holder);
                expandWildcard(col, siblings, inlineHead, holder);
            }
            if ((col.getExpand() != null || col.getInline() != null) && !ctx.isNestedProjections()) {
                ctx.diagnostics().error("query-unsupported-nested", col.getLocation(), holder,
                        MessageArgs.of("keyword", col.getExpand() != null ? "expand" : "inline"));
            }
            if (col.getValue() == null && col.getExpand() == null) {
                continue;
            }
            if (col.getInline() != null) {
                col.setKind(Kind.INLINE);
                if (col.getName() == null) {
                    col.setName(new Name("", col.getLocation()));
                }
                SelectQuery query = PathResolver.userQuery(holder);
                List<Artifact> inlines = query != null ? query.getInlines() : new ArrayList<>();
                inlines.add(col);
                Members.setMemberParent(col, "." + inlines.size(), holder, null);
                initFromColumns(holder, col.getInline(), col);
            } else if (!col.isReplacement()) {
                String id = ensureColumnName(col, holder);
                col.setKind(Kind.ELEMENT);
                dictAdd(elemsParent.getElements(), id, col, holder);
                Members.setMemberParent(col, id, holder, null);
            }
        }
        if (inlineHead == null) {
            for (Artifact elem : new ArrayList<>(elemsParent.getElements().values())) {
                initElem(elem, holder);
            }
        }
        return true;
    }

    private static boolean isLeadingResult(Artifact holder) {
        return holder.getKind() == Kind.QUERY && holder.getMain() != null
                && holder.getMain().getLeadingQuery() == holder.getSelectQuery();
    }

    private static Artifact implicitWildcard(Artifact holder) {
        Location location = holder.getSelectQuery() != null && holder.getSelectQuery().getFrom() != null
                ? holder.getSelectQuery().getFrom().getLocation()
                : holder.getLocation();
        Artifact wildcard = new Artifact(Kind.ELEMENT, null, location);
        wildcard.setWildcard(true);
        return wildcard;
    }

    /**
     * The name of a column: its alias, or the last step of its path; the
     * empty string for wildcards, inline columns and unnamed expressions.
     */
    String ensureColumnName(Artifact col, Artifact holder) {
        if (col.getName() != null) {
            return col.getName().getId();
        }
        if (col.getInline() != null || col.isWildcard()) {
            return "";
        }
        if (col.getValue() instanceof PathExpression) {
            Reference ref = ((PathExpression) col.getValue()).getReference();
            if (!ref.getPath().isEmpty()) {
                PathStep last = ref.last();
                Name name = new Name(last.getId(), last.getLocation());
                name.setInferred(true);
                col.setName(name);
                return last.getId();
            }
        } else if (col.getValue() != null || col.getExpand() != null) {
            Location location = col.getValue() != null && col.getValue().getLocation() != null
                    ? col.getValue().getLocation() : col.getLocation();
            ctx.diagnostics().error("query-req-name", location, holder, MessageArgs.none());
        }
        Name name = new Name("", col.getValue() != null ? col.getValue().getLocation() : col.getLocation());
        name.setInferred(true);
        col.setName(name);
        return "";
    }

    /**
     * Named columns by name; {@code null} for names used twice.  Columns
     * before the wildcard are marked as replacements: they are already
     * elements.
     */
    private Map<String, Artifact> wildcardSiblings(List<Artifact> columns, Artifact holder) {
        Map<String, Artifact> siblings = new HashMap<>();
        if (columns == null) {
            return siblings;
        }
        boolean seenWildcard = false;
        for (Artifact col : columns) {
            String id = ensureColumnName(col, holder);
            if (!id.isEmpty()) {
                col.setReplacement(!seenWildcard);
                siblings.put(id, siblings.containsKey(id) ? null : col);
            } else if (col.isWildcard()) {
                seenWildcard = true;
            }
        }
        return siblings;
    }

    private void expandWildcard(Artifact wildcard, Map<String, Artifact> siblings, Artifact colParent,
                                Artifact holder) {
        Artifact elemsParent = holder.getItems() != null ? holder.getItems() : holder;
        Map<String, Artifact> elements = elemsParent.getElements();
        Location location = wildcard.getLocation() != null ? wildcard.getLocation() : holder.getLocation();
        boolean inferredMain = holder.getMain() != null && holder.getMain().getInferred() != null;
        Map<String, Location> excluding = excludingOf(colParent != null ? colParent : holder);

        Artifact envParent = wildcard.getPathHead();
        Map<String, List<Artifact>> env = columnCandidates(envParent, holder);
        for (Map.Entry<String, List<Artifact>> entry : env.entrySet()) {
            String name = entry.getKey();
            List<Artifact> navElems = entry.getValue();
            Artifact navElem = navElems.size() == 1 ? navElems.get(0) : null;
            if (excluding.containsKey(name) || navElem != null && navElem.isMasked()) {
                continue;
            }
            Artifact sibling = siblings.get(name);
            if (sibling != null) {
                if (!inferredMain && envParent == null) {
                    reportReplacement(sibling, navElems, holder);
                }
                if (!sibling.isReplacement()) {
                    sibling.setReplacement(true);
                    sibling.setKind(Kind.ELEMENT);
                    dictAdd(elements, name, sibling, holder);
                    Members.setMemberParent(sibling, name, holder, null);
                }
            } else if (navElems.size() > 1) {
                List<String> names = navElems.stream()
                        .map(e -> e.getName().getAlias() + "." + e.getName().getElement())
                        .collect(Collectors.toList());
                ctx.diagnostics().error("wildcard-ambiguous", location, holder,
                        MessageArgs.of("id", name).and("names", names));
            } else if (navElem != null) {
                location = location != null ? location.weak() : null;
                Artifact origin = envParent != null ? navElem : ctx.links().origin(navElem);
                if (origin == null) {
                    continue;
                }
                Artifact elem = Members.linkToOrigin(ctx.model(), origin, name, holder, null, location, false);
                dictAdd(elements, name, elem, holder);
                elem.setInferred(Inferred.WILDCARD);
                elem.getName().setInferred(true);
                if (envParent != null) {
                    setWildcardExpandInline(elem, envParent, origin, name, location);
                } else {
                    setElementOrigin(elem, navElem, name, location);
                }
            }
        }
        if (envParent != null || holder.getKind() != Kind.QUERY) {
            Map<String, Location> userExcluding = excludingOf(colParent != null ? colParent : holder);
            Environment candidates = Environment.combined(env);
            for (Map.Entry<String, Location> entry : userExcluding.entrySet()) {
                resolveExcluding(entry.getKey(), entry.getValue(), candidates, holder);
            }
        }
    }

    private static Map<String, Location> excludingOf(Artifact art) {
        LinkedHashMap<String, Location> excluding = art.getKind() == Kind.QUERY && art.getSelectQuery() != null
                ? art.getSelectQuery().getExcluding()
                : art.getExcluding();
        return excluding != null ? excluding : Map.of();
    }

    /** Informs about an explicit column hiding a source element of the same name. */
    private void reportReplacement(Artifact sibling, List<Artifact> navElems, Artifact holder) {
        Reference ref = sibling.getValue() instanceof PathExpression
                ? ((PathExpression) sibling.getValue()).getReference() : null;
        boolean renamed = ref != null && !ref.getPath().isEmpty()
                && !ref.last().getId().equals(sibling.getName().getId());
        if (sibling.getTarget() != null && sibling.getTarget().getInferred() == null && !renamed) {
            return;
        }
        String id = sibling.getName().getId();
        if (navElems.size() > 1) {
            ctx.diagnostics().info("wildcard-excluding-many", sibling.getName().getLocation(), holder,
                    MessageArgs.of("id", id));
        } else {
            Artifact alias = navElems.get(0).getParent();
            ctx.diagnostics().info("wildcard-excluding-one", sibling.getName().getLocation(), holder,
                    MessageArgs.of("id", id).and("alias", alias != null ? alias.getName().getId() : null));
        }
    }

    /**
     * Names available for a column: the elements of the path head for columns
     * inside {@code expand}/{@code inline}, the combined source elements of
     * the query otherwise.
     */
    private Map<String, List<Artifact>> columnCandidates(Artifact envParent, Artifact holder) {
        if (envParent != null) {
            Artifact type = ctx.types().directType(envParent);
            Map<String, Artifact> elements = ctx.paths().environment(type != null ? type : envParent);
            Map<String, List<Artifact>> candidates = new LinkedHashMap<>();
            elements.forEach((name, elem) -> candidates.put(name, List.of(elem)));
            return candidates;
        }
        SelectQuery query = PathResolver.userQuery(holder);
        return query != null && query.getCombined() != null ? query.getCombined() : Map.of();
    }

    /** Informs about an {@code excluding} name which is no candidate. */
    public void resolveExcluding(String name, Location location, Environment env, Artifact user) {
        if (!env.lookup(name).isEmpty()) {
            return;
        }
        ctx.diagnostics().signalNotFound("ref-undefined-excluding", location, user,
                MessageArgs.of("name", name), env.validNames(false));
    }

    /**
     * The value of an element from a top-level wildcard is the path
     * {@code alias.name}, already bound.
     */
    private void setElementOrigin(Artifact queryElem, Artifact navElem, String name, Location location) {
        Artifact sourceElem = ctx.links().origin(navElem);
        Artifact alias = navElem.getParent();
        PathStep aliasStep = new PathStep(alias.getName().getId(), location, ctx.links().origin(alias));
        aliasStep.setNavigation(alias);
        PathStep elemStep = new PathStep(name, location, sourceElem);
        Reference ref = new Reference(List.of(aliasStep, elemStep), location);
        ref.getCell().bind(sourceElem);
        queryElem.setValue(new PathExpression(ref, location));
        ctx.links().addProjection(navElem, queryElem);
    }

    private void setWildcardExpandInline(Artifact queryElem, Artifact pathHead, Artifact origin, String name,
                                         Location location) {
        queryElem.setPathHead(pathHead);
        PathStep step = new PathStep(name, location, origin);
        queryElem.setValue(new PathExpression(new Reference(List.of(step), location), location));
        ctx.links().setOrigin(queryElem, origin);
    }

    /**
     * Sets the origin of an explicit column with a path value and records it
     * as projection of the navigated source element.
     */
    private void initElem(Artifact elem, Artifact holder) {
        if (elem.getType() != null && elem.getType().getInferred() == null) {
            return;
        }
        if (elem.getInferred() != null || !(elem.getValue() instanceof PathExpression)) {
            return;
        }
        Environment env = Environment.combined(columnCandidates(elem.getPathHead(), holder));
        Reference ref = ((PathExpression) elem.getValue()).getReference();
        Artifact origin = ctx.links().setOrigin(elem, ctx.paths().resolve(ref, ResolutionPolicy.EXPR, elem, env));
        if (origin == null) {
            return;
        }
        if (elem.getForeignKeys() != null) {
            elem.getForeignKeys().forEach((name, key) -> {
                key.setBlock(elem.getBlock());
                Members.setMemberParent(key, name, elem, null);
            });
        }
        PathNavigation nav = PathNavigation.of(ref);
        if (nav.getNavigation() != null && nav.getItem() == ref.last()) {
            ctx.links().addProjection(nav.getNavigation(), elem);
        }
    }

    /** Adds {@code entry}; a duplicate name is reported at both definitions and the first one kept. */
    private void dictAdd(Map<String, Artifact> dict, String name, Artifact entry, Artifact holder) {
        Artifact found = dict.get(name);
        if (found == null) {
            dict.put(name, entry);
            return;
        }
        if (found == entry || name.isEmpty()) {
            return;
        }
        if (reportedDuplicates.add(found)) {
            duplicate(name, found, holder);
        }
        duplicate(name, entry, holder);
    }

    private void duplicate(String name, Artifact entry, Artifact holder) {
        Location location = entry.getName() != null ? entry.getName().getLocation() : entry.getLocation();
        ctx.diagnostics().error("duplicate-definition", location, holder,
                MessageArgs.of("name", name).variant("element"));
    }
}
