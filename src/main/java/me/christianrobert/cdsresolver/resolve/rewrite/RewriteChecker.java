package me.christianrobert.cdsresolver.resolve.rewrite;

import me.christianrobert.cdsresolver.diagnostics.MessageArgs;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Inferred;
import me.christianrobert.cdsresolver.model.Location;
import me.christianrobert.cdsresolver.resolve.context.ResolveContext;
import me.christianrobert.cdsresolver.resolve.query.QueryTraversal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks explicit ON conditions and foreign keys given with
 * {@code redirected to} against the association they redirect: the kind
 * (managed or not) must stay, explicit foreign keys must match the original
 * ones.
 */
public class RewriteChecker {

    private final ResolveContext ctx;

    public RewriteChecker(ResolveContext ctx) {
        this.ctx = ctx;
    }

    public void rewriteViewCheck(Artifact view) {
        QueryTraversal.postOrder(view.getQuery(), false, query -> {
            if (query.getResult() != null && query.getResult().getElements() != null) {
                new ArrayList<>(query.getResult().getElements().values()).forEach(this::checkAssociation);
            }
        });
    }

    private void checkAssociation(Artifact element) {
        Artifact elem = element.getItems() != null ? element.getItems() : element;
        if (elem.getElements() != null && ctx.isExpandElements()) {
            new ArrayList<>(elem.getElements().values()).forEach(this::checkAssociation);
        }
        if (elem.getTarget() == null) {
            return;
        }
        if (elem.getOn() != null && !ctx.rewriter().isRewritten(elem.getOn())) {
            Artifact assoc = ctx.types().directType(elem);
            if (assoc != null && assoc.getForeignKeys() != null) {
                ctx.diagnostics().error("rewrite-key-for-unmanaged", elem.getOn().getLocation(), elem,
                        MessageArgs.of("keyword", "on").and("art", assocWithExplicitSpec(assoc)));
            }
        } else if (elem.getForeignKeys() != null && !inferredForeignKeys(elem.getForeignKeys(), null)) {
            Artifact assoc = ctx.types().directType(elem);
            if (assoc != null && assoc.getOn() != null) {
                ctx.diagnostics().error("rewrite-on-for-managed", firstLocation(elem.getForeignKeys()), elem,
                        MessageArgs.of("art", assocWithExplicitSpec(assoc)));
            } else if (assoc != null && assoc.getForeignKeys() != null) {
                keysMatch(elem, assoc);
                keysCovered(assoc, elem);
            }
        }
    }

    /** Each explicit foreign key must have a counterpart in the redirected association. */
    private void keysMatch(Artifact thisAssoc, Artifact otherAssoc) {
        for (Map.Entry<String, Artifact> entry : thisAssoc.getForeignKeys().entrySet()) {
            String name = entry.getKey();
            if (otherAssoc.getForeignKeys().containsKey(name)) {
                continue;
            }
            Artifact key = entry.getValue();
            Artifact base = assocWithExplicitSpec(otherAssoc);
            if (inferredForeignKeys(base.getForeignKeys(), null)) {
                ctx.diagnostics().error("rewrite-key-not-matched-implicit", key.getName().getLocation(), key,
                        MessageArgs.of("name", name).and("target", targetOf(base)));
            } else {
                ctx.diagnostics().error("rewrite-key-not-matched-explicit", key.getName().getLocation(), key,
                        MessageArgs.of("name", name).and("art", base));
            }
        }
    }

    /** Each foreign key of the redirected association must be specified again. */
    private void keysCovered(Artifact thisAssoc, Artifact otherAssoc) {
        List<String> names = new ArrayList<>();
        for (String name : thisAssoc.getForeignKeys().keySet()) {
            if (!otherAssoc.getForeignKeys().containsKey(name)) {
                names.add(name);
            }
        }
        if (names.isEmpty()) {
            return;
        }
        Location location = lastLocation(otherAssoc.getForeignKeys());
        Artifact base = assocWithExplicitSpec(thisAssoc);
        String variant = names.size() == 1 ? "one" : null;
        if (inferredForeignKeys(base.getForeignKeys(), null)) {
            ctx.diagnostics().error("rewrite-key-not-covered-implicit", location, otherAssoc,
                    MessageArgs.of("names", names).and("target", targetOf(base)).variant(variant));
        } else {
            ctx.diagnostics().error("rewrite-key-not-covered-explicit", location, otherAssoc,
                    MessageArgs.of("names", names).and("art", otherAssoc).variant(variant));
        }
    }

    /**
     * The association along the type derivation chain which has the ON
     * condition or foreign keys as written by the user.
     */
    public Artifact assocWithExplicitSpec(Artifact assoc) {
        Set<Artifact> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Artifact current = assoc;
        while (visited.add(current)
                && (current.getForeignKeys() != null && inferredForeignKeys(current.getForeignKeys(), Inferred.KEYS)
                || current.getOn() != null && ctx.rewriter().isRewritten(current.getOn()))) {
            Artifact next = ctx.types().directType(current);
            if (next == null) {
                break;
            }
            current = next;
        }
        return current;
    }

    /**
     * True if the foreign keys are inferred other than by {@code ignore};
     * decided by the first key.
     */
    public boolean inferredForeignKeys(Map<String, Artifact> foreignKeys, Inferred ignore) {
        if (foreignKeys == null || foreignKeys.isEmpty()) {
            return false;
        }
        Inferred inferred = foreignKeys.values().iterator().next().getInferred();
        return inferred != null && inferred != ignore;
    }

    private static Artifact targetOf(Artifact assoc) {
        return assoc.getTarget() != null ? assoc.getTarget().getArtifact() : null;
    }

    private static Location firstLocation(Map<String, Artifact> dict) {
        return dict.isEmpty() ? null : dict.values().iterator().next().getName().getLocation();
    }

    private static Location lastLocation(Map<String, Artifact> dict) {
        Location location = null;
        for (Artifact entry : dict.values()) {
            location = entry.getName().getLocation();
        }
        return location;
    }
}
