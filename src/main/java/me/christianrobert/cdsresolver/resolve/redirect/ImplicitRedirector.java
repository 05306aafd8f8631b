package me.christianrobert.cdsresolver.resolve.redirect;

import me.christianrobert.cdsresolver.diagnostics.MessageArgs;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Inferred;
import me.christianrobert.cdsresolver.model.Kind;
import me.christianrobert.cdsresolver.model.Location;
import me.christianrobert.cdsresolver.model.Reference;
import me.christianrobert.cdsresolver.resolve.annotation.AnnotationValues;
import me.christianrobert.cdsresolver.resolve.context.ResolveContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Implicit redirection: an association in a service whose target is not
 * exposed by the service is redirected to the unique projection of the
 * target in that service, or to an autoexposed entity.
 */
public class ImplicitRedirector {

    private static final Logger log = LoggerFactory.getLogger(ImplicitRedirector.class);

    public static final String REDIRECTION_TARGET = "@cds.redirection.target";

    private final ResolveContext ctx;

    public ImplicitRedirector(ResolveContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Sets the target of {@code elem}, whose effective type is the
     * association {@code assoc} (possibly {@code elem} itself), to the
     * redirected target.  An own target of {@code elem} is kept in a new
     * origin node, together with its ON condition or foreign keys.
     *
     * @return false if the target of {@code assoc} cannot be resolved
     */
    public boolean redirectImplicitly(Artifact elem, Artifact assoc) {
        if (elem.getKind() == Kind.TABLE_ALIAS) {
            return false;
        }
        Artifact target = ctx.paths().resolveTarget(assoc);
        if (target == null) {
            return false;
        }
        Location location = elem.getValue() != null ? elem.getValue().getLocation()
                : elem.getType() != null ? elem.getType().getLocation()
                : elem.getName().getLocation();
        Artifact service = ctx.links().service(elem.mainOrSelf());
        if (service != null
                && (service != ctx.links().service(assoc.mainOrSelf()) || elem == assoc || assoc.getKind() == Kind.MIXIN)
                && service != ctx.links().service(target)) {
            target = redirectIntoService(elem, assoc, target, service);
        }

        if (elem.getTarget() != null) {
            if (elem.getTarget().getArtifact() == target) {
                return true;
            }
            keepOriginalTarget(elem);
        }
        Artifact assocTarget = assoc.getTarget() != null ? assoc.getTarget().getArtifact() : null;
        Reference redirected = Reference.bound(target, location,
                target != assocTarget ? Inferred.IMPLICIT : Inferred.REWRITE);
        elem.setTarget(redirected);
        return true;
    }

    private Artifact redirectIntoService(Artifact elem, Artifact assoc, Artifact target, Artifact service) {
        Artifact elemScope = ctx.isScopedRedirections()
                ? preferredElemScope(target, service, elem, assoc.mainOrSelf())
                : null;
        List<Artifact> exposed = minimalExposure(target, service, elemScope);
        if (exposed.isEmpty()) {
            Artifact newTarget = target;
            if (ctx.autoExposer().isAutoExposed(target)) {
                newTarget = ctx.autoExposer().createAutoExposed(target, service, elemScope);
            }
            // also the target itself: no repeated attempts
            ctx.links().addDescendant(target, service.getName().getAbsolute(), newTarget);
            return newTarget;
        }
        if (exposed.size() == 1) {
            log.debug("Redirecting {} to {}", elem.getName(), exposed.get(0).getName().getAbsolute());
            return exposed.get(0);
        }
        Location location = elem.getValue() != null ? elem.getValue().getLocation() : elem.getName().getLocation();
        List<String> names = exposed.stream()
                .map(e -> e.getName().getAbsolute())
                .sorted()
                .collect(Collectors.toList());
        ctx.diagnostics().message(elem != assoc ? "redirected-implicitly-ambiguous" : "type-ambiguous-target",
                location, elem,
                MessageArgs.of("target", target)
                        .and("service", service)
                        .and("art", ctx.autoExposer().definitionScope(target))
                        .and("sorted_arts", names));
        return target;
    }

    private void keepOriginalTarget(Artifact elem) {
        Artifact origin = new Artifact(elem.getKind(), elem.getName(), elem.getTarget().getLocation());
        origin.setTarget(elem.getTarget());
        origin.setInferred(Inferred.REDIRECTED);
        origin.setParent(elem.getParent());
        origin.setMain(elem.getMain());
        origin.setBlock(elem.getBlock());
        origin.setComposition(elem.isComposition());
        origin.setCardinality(elem.getCardinality());
        ctx.model().register(origin);
        ctx.links().setOrigin(elem, origin);
        ctx.effectiveTypes().done(origin, origin);
        if (elem.getForeignKeys() != null) {
            origin.setForeignKeys(elem.getForeignKeys());
            elem.setForeignKeys(null);
        }
        if (elem.getOn() != null) {
            origin.setOn(elem.getOn());
            elem.setOn(null);
        }
    }

    /**
     * The scope whose projections are preferred as redirection target of an
     * element: the scope of the element for intra-scope associations, the
     * unique projection of the target's scope, or the (placeholder) scope
     * named like the autoexposed target scope; {@code null} for no scope.
     */
    Artifact preferredElemScope(Artifact target, Artifact service, Artifact elem, Artifact assocMain) {
        AutoExposer exposer = ctx.autoExposer();
        Artifact assocScope = exposer.definitionScope(assocMain);
        Artifact targetScope = exposer.definitionScope(target);
        Artifact main = elem.mainOrSelf();
        if (targetScope == assocScope) {
            Artifact elemScope = exposer.definitionScope(main);
            if (targetScope == target || assocScope == assocMain || elemScope != main) {
                return elemScope;
            }
        }
        if (targetScope == target) {
            return null;
        }
        List<Artifact> exposed = minimalExposure(targetScope, service, null);
        if (exposed.size() == 1) {
            return exposed.get(0);
        }
        String autoScopeName = exposer.autoExposedName(targetScope, service, null);
        return exposer.scopeFor(autoScopeName, service);
    }

    /**
     * Projections of {@code target} in {@code service}: only those with
     * {@code @cds.redirection.target} if there are any, and of those the one
     * which is an ancestor of all others; all if there is no such one.
     */
    public List<Artifact> minimalExposure(Artifact target, Artifact service, Artifact elemScope) {
        List<Artifact> descendants = scopedExposure(
                ctx.links().descendants(target, service.getName().getAbsolute()), elemScope, target);
        List<Artifact> preferred = descendants.stream()
                .filter(d -> AnnotationValues.isTrue(d, REDIRECTION_TARGET))
                .collect(Collectors.toList());
        List<Artifact> exposed = preferred.isEmpty() ? descendants : preferred;
        if (exposed.size() < 2) {
            return exposed;
        }
        Artifact min = null;
        for (Artifact e : exposed) {
            if (min == null || hasAncestor(min, e)) {
                min = e;
            } else if (!hasAncestor(e, min)) {
                return exposed;
            }
        }
        List<Artifact> result = new ArrayList<>();
        result.add(min);
        return result;
    }

    private boolean hasAncestor(Artifact art, Artifact ancestor) {
        List<Artifact> ancestors = ctx.links().ancestors(art);
        return ancestors != null && ancestors.contains(ancestor);
    }

    private List<Artifact> scopedExposure(List<Artifact> descendants, Artifact elemScope, Artifact target) {
        if (elemScope == null) {
            return descendants;
        }
        // the scope itself first, even with @cds.redirection.target: false
        if (ctx.autoExposer().isDirectProjection(elemScope, target)) {
            List<Artifact> own = new ArrayList<>();
            own.add(elemScope);
            return own;
        }
        AutoExposer exposer = ctx.autoExposer();
        List<Artifact> scoped = descendants.stream()
                .filter(d -> exposer.definitionScope(d) == elemScope)
                .collect(Collectors.toList());
        if (!scoped.isEmpty()) {
            return scoped;
        }
        return descendants.stream()
                .filter(d -> exposer.definitionScope(d) == d)
                .collect(Collectors.toList());
    }
}
