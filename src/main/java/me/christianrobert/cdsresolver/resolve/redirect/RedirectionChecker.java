package me.christianrobert.cdsresolver.resolve.redirect;

import me.christianrobert.cdsresolver.diagnostics.MessageArgs;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Kind;
import me.christianrobert.cdsresolver.model.Location;
import me.christianrobert.cdsresolver.model.Reference;
import me.christianrobert.cdsresolver.model.expr.PathExpression;
import me.christianrobert.cdsresolver.model.query.FromItem;
import me.christianrobert.cdsresolver.model.query.Query;
import me.christianrobert.cdsresolver.model.query.SelectQuery;
import me.christianrobert.cdsresolver.model.query.TableRef;
import me.christianrobert.cdsresolver.resolve.context.ResolveContext;
import me.christianrobert.cdsresolver.resolve.path.PathNavigation;
import me.christianrobert.cdsresolver.resolve.path.ResolutionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Checks a redirection ({@code redirected to}, or an implicitly redirected
 * target) and computes the chain of table aliases and included structures
 * leading from the original target to the new one.  The ON condition or the
 * foreign keys are later rewritten along this chain.
 */
public class RedirectionChecker {

    private static final Logger log = LoggerFactory.getLogger(RedirectionChecker.class);

    private final ResolveContext ctx;

    public RedirectionChecker(ResolveContext ctx) {
        this.ctx = ctx;
    }

    public void resolveRedirected(Artifact elem, Artifact target) {
        // null chain: do not touch the path steps after the association
        ctx.links().setRedirected(elem, null);
        Location location = elem.getTarget().getLocation();
        Artifact assoc = ctx.types().directType(elem);
        Artifact origType = assoc != null ? ctx.types().effectiveType(assoc) : null;
        if (origType == null || origType.getTarget() == null) {
            ctx.diagnostics().error("redirected-no-assoc", location, elem, MessageArgs.none());
            return;
        }
        if (elem.getMain() != null && elem.getMain().getQuery() != null
                && elem.getValue() instanceof PathExpression) {
            Reference ref = ((PathExpression) elem.getValue()).getReference();
            if (PathNavigation.of(ref).getItem() != ref.last() && origType.getOn() != null) {
                ctx.diagnostics().error("rewrite-not-supported", location, elem, MessageArgs.none());
                return;
            }
        }
        Artifact origTarget = origType.getTarget().getArtifact();
        if (origTarget == null || target == null) {
            return;
        }

        List<Artifact> chain = new ArrayList<>();
        if (target == origTarget) {
            if (elem.getTarget().getInferred() == null) {
                ctx.diagnostics().info("redirected-to-same", location, elem, MessageArgs.of("art", target));
            }
            ctx.links().setRedirected(elem, chain);
            return;
        }
        if (elem.getForeignKeys() != null || elem.getOn() != null) {
            return;
        }

        Artifact current = target;
        while (current.getQuery() != null) {
            Query query = current.getQuery();
            FromItem from = query instanceof SelectQuery ? ((SelectQuery) query).getFrom() : null;
            if (query instanceof SelectQuery && from == null) {
                return;
            }
            if (!(from instanceof TableRef) || ((TableRef) from).getRef() == null) {
                ctx.diagnostics().warning("redirected-to-complex", location, elem,
                        MessageArgs.of("art", current)
                                .variant(current == elem.getTarget().getArtifact() ? "target" : null));
                break;
            }
            TableRef tableRef = (TableRef) from;
            Artifact view = current;
            current = ctx.paths().resolve(tableRef.getRef(), ResolutionPolicy.FROM, view);
            if (current == null) {
                return;
            }
            if (tableRef.getAlias() != null) {
                chain.add(tableRef.getAlias());
            }
            if (current == origTarget) {
                Collections.reverse(chain);
                ctx.links().setRedirected(elem, chain);
                log.debug("Redirection of {} via {} table aliases", elem.getName(), chain.size());
                return;
            }
        }
        Collections.reverse(chain);
        new OriginSearch(elem, location, origTarget).run(chain, current);
    }

    /**
     * Breadth-first search from the new target through query sources and
     * includes to the original target, which must be reached exactly once.
     */
    private final class OriginSearch {
        private final Artifact elem;
        private final Location location;
        private final Artifact origTarget;
        private final Set<Artifact> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        private List<Frontier> news = new ArrayList<>();

        OriginSearch(Artifact elem, Location location, Artifact origTarget) {
            this.elem = elem;
            this.location = location;
            this.origTarget = origTarget;
        }

        void run(List<Artifact> chain, Artifact start) {
            List<Artifact> redirected = null;
            boolean suppressed = false;
            news.add(new Frontier(chain, List.of(start)));
            while (!news.isEmpty()) {
                List<Frontier> outer = news;
                news = new ArrayList<>();
                for (Frontier frontier : outer) {
                    for (Artifact source : frontier.sources) {
                        boolean alias = source.getKind() == Kind.TABLE_ALIAS;
                        Artifact art = alias ? ctx.links().origin(source) : source;
                        if (art != origTarget) {
                            if (findOrig(frontier.chain, source, art) && redirected == null) {
                                suppressed = true;
                            }
                        } else if (redirected == null) {
                            redirected = alias ? prepend(source, frontier.chain) : frontier.chain;
                        } else {
                            ctx.diagnostics().error("redirected-to-ambiguous", location, elem,
                                    MessageArgs.of("art", origTarget));
                            return;
                        }
                    }
                }
            }
            if (redirected != null) {
                ctx.links().setRedirected(elem, redirected);
            } else if (!suppressed) {
                ctx.diagnostics().error("redirected-to-unrelated", location, elem,
                        MessageArgs.of("art", origTarget));
            }
        }

        /** Adds the sources of {@code art} to the next frontier; true on an unusable source. */
        private boolean findOrig(List<Artifact> chain, Artifact alias, Artifact art) {
            if (art == null || !visited.add(art)) {
                return true;
            }
            if (art.getIncludes() != null && !art.getIncludes().isEmpty()) {
                List<Artifact> includes = new ArrayList<>();
                for (Reference include : art.getIncludes()) {
                    if (include.getArtifact() != null) {
                        includes.add(include.getArtifact());
                    }
                }
                news.add(new Frontier(prepend(art, chain), includes));
            }
            SelectQuery query = art.getLeadingQuery();
            if (query == null) {
                return false;
            }
            if (query.getTableAliases().isEmpty()) {
                return true;
            }
            List<Artifact> sources = new ArrayList<>();
            for (Artifact a : query.getTableAliases().values()) {
                if (a.getKind() == Kind.TABLE_ALIAS && a.getTableRef() != null && a.getTableRef().getRef() != null) {
                    sources.add(a);
                }
            }
            news.add(new Frontier(alias.getKind() == Kind.TABLE_ALIAS ? prepend(alias, chain) : chain, sources));
            return false;
        }
    }

    private static List<Artifact> prepend(Artifact first, List<Artifact> rest) {
        List<Artifact> list = new ArrayList<>(rest.size() + 1);
        list.add(first);
        list.addAll(rest);
        return list;
    }

    private static final class Frontier {
        final List<Artifact> chain;
        final List<Artifact> sources;

        Frontier(List<Artifact> chain, List<Artifact> sources) {
            this.chain = chain;
            this.sources = sources;
        }
    }
}
