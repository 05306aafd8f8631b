package me.christianrobert.cdsresolver.resolve.redirect;

import me.christianrobert.cdsresolver.diagnostics.MessageArgs;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Inferred;
import me.christianrobert.cdsresolver.model.Kind;
import me.christianrobert.cdsresolver.resolve.context.ResolveContext;
import me.christianrobert.cdsresolver.resolve.path.Environment;
import me.christianrobert.cdsresolver.resolve.path.ResolutionPolicy;

import java.util.LinkedHashMap;

/**
 * Resolves the target of an association together with its ON condition or
 * foreign keys.
 */
public class TargetResolver {

    private final ResolveContext ctx;

    public TargetResolver(ResolveContext ctx) {
        this.ctx = ctx;
    }

    /**
     * @param art the element or type defining the association
     * @param obj the node carrying the target: {@code art}, its items, or
     *            the origin keeping the target before a redirection
     */
    public void resolveTarget(Artifact art, Artifact obj) {
        if (art != obj && obj.getOn() != null && obj.getInferred() != Inferred.REDIRECTED) {
            ctx.diagnostics().message("assoc-in-array", obj.getOn().getLocation(), art, MessageArgs.none());
            if (!obj.getTarget().getCell().isSettled()) {
                obj.getTarget().getCell().bind(null);
            }
            return;
        }
        Artifact target = ctx.paths().resolveTarget(obj);
        if (obj.getOn() != null) {
            resolveOn(art, obj);
        } else if (art.getKind() == Kind.MIXIN) {
            ctx.diagnostics().error("assoc-in-mixin", obj.getTarget().getLocation(), art, MessageArgs.none());
        } else if (target != null && obj.getForeignKeys() == null && target.getKind() == Kind.ENTITY) {
            Artifact type = obj.getType() != null ? obj.getType().getArtifact() : null;
            if (obj.getInferred() == Inferred.REDIRECTED) {
                ctx.foreignKeys().addImplicitForeignKeys(art, obj, target);
            } else if (obj.getType() == null || obj.getType().getInferred() != null
                    || obj.getTarget().getInferred() != null) {
                ctx.redirections().resolveRedirected(art, target);
            } else if (type != null && type.isInternal()) {
                ctx.foreignKeys().addImplicitForeignKeys(art, obj, target);
            }
        } else if (target != null && obj.getForeignKeys() != null) {
            ctx.foreignKeys().resolveExplicitKeys(art, obj, target);
        }
    }

    private void resolveOn(Artifact art, Artifact obj) {
        Artifact parent = art.getParent();
        ResolutionPolicy policy = art.getKind() == Kind.MIXIN ? ResolutionPolicy.MIXIN_ON : ResolutionPolicy.ON;
        if (art.getMain() == null || parent == null || parent.getElements() == null && parent.getItems() == null
                && parent.getKind() != Kind.QUERY) {
            boolean composition = obj.isComposition();
            ctx.diagnostics().message("assoc-as-type", obj.getOn().getLocation(), art,
                    MessageArgs.none().variant(composition ? "comp" : null));
        } else if (obj.getInferred() != Inferred.REDIRECTED) {
            ctx.expressions().resolve(obj.getOn(), policy, art);
        } else {
            // the original ON sees the sibling elements, its own name denotes the original
            LinkedHashMap<String, Artifact> elements = new LinkedHashMap<>();
            if (parent.getElements() != null) {
                elements.putAll(parent.getElements());
            }
            elements.put(art.getName().getId(), obj);
            ctx.expressions().resolve(obj.getOn(), policy, art, Environment.of(elements));
        }
    }
}
