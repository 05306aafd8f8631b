package me.christianrobert.cdsresolver.resolve.redirect;

import me.christianrobert.cdsresolver.diagnostics.MessageArgs;
import me.christianrobert.cdsresolver.model.AnnotationAssignment;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Inferred;
import me.christianrobert.cdsresolver.model.Kind;
import me.christianrobert.cdsresolver.model.Location;
import me.christianrobert.cdsresolver.model.Reference;
import me.christianrobert.cdsresolver.model.query.Query;
import me.christianrobert.cdsresolver.model.query.SelectQuery;
import me.christianrobert.cdsresolver.model.query.TableRef;
import me.christianrobert.cdsresolver.resolve.annotation.AnnotationValues;
import me.christianrobert.cdsresolver.resolve.context.ResolveContext;
import me.christianrobert.cdsresolver.resolve.path.ResolutionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates projections of entities which are the target of an association in
 * a service but are not exposed by that service.
 *
 * <p>An entity is autoexposed if it (or the first entity along its FROM
 * chain which has the annotation) has {@code @cds.autoexpose}, or if it is
 * the target of a composition.
 */
public class AutoExposer {

    private static final Logger log = LoggerFactory.getLogger(AutoExposer.class);

    public static final String AUTOEXPOSE = "@cds.autoexpose";
    public static final String AUTOEXPOSED = "@cds.autoexposed";

    private final ResolveContext ctx;

    // null value: no annotation along the chain (not autoexposed)
    private final Map<Artifact, Boolean> autoexpose = new IdentityHashMap<>();

    // Scopes computed for scoped redirection which have no definition
    private final Map<String, Artifact> placeholderScopes = new HashMap<>();

    private int created;

    public AutoExposer(ResolveContext ctx) {
        this.ctx = ctx;
    }

    public int getCreatedCount() {
        return created;
    }

    public boolean isAutoExposed(Artifact target) {
        if (autoexpose.containsKey(target)) {
            return Boolean.TRUE.equals(autoexpose.get(target));
        }
        Artifact current = target;
        List<Artifact> chain = new ArrayList<>();
        Artifact source = fromSource(current);
        // setAutoExposed() records a value before the source is followed: no endless loop
        while (!autoexpose.containsKey(current) && setAutoExposed(current) && source != null) {
            chain.add(current);
            current = source;
            source = fromSource(current);
        }
        Boolean inherited = autoexpose.get(current);
        if (inherited != null) {
            for (Artifact art : chain) {
                autoexpose.put(art, inherited);
            }
        }
        return Boolean.TRUE.equals(autoexpose.get(target));
    }

    /**
     * Records the own annotation value; returns true if there is none, i.e.
     * the value might be inherited from the query source.
     */
    private boolean setAutoExposed(Artifact art) {
        Boolean flag = AnnotationValues.flag(art, AUTOEXPOSE);
        if (flag != null) {
            autoexpose.put(art, flag);
            return false;
        }
        String absolute = art.getName() != null ? art.getName().getAbsolute() : null;
        boolean compositionTarget = absolute != null && art.isMain()
                && ctx.model().getCompositionTargets().contains(absolute);
        autoexpose.put(art, compositionTarget && ctx.isAutoexposeViaComposition() ? Boolean.TRUE : null);
        return true;
    }

    private Artifact fromSource(Artifact art) {
        if (art.getFromRefs().isEmpty()) {
            return null;
        }
        return ctx.paths().resolve(art.getFromRefs().get(0), ResolutionPolicy.FROM, art);
    }

    /**
     * The scope of a definition: the last parent which is not a context,
     * service or namespace, or the definition itself.  Inside a service, it
     * is the direct child of the innermost service.
     */
    public Artifact definitionScope(Artifact art) {
        Artifact base = art;
        Artifact current = art;
        while (current.getParent() != null) {
            if (current.getParent().getKind() == Kind.SERVICE) {
                return current;
            }
            current = current.getParent();
            if (!current.getKind().hasArtifacts()) {
                base = current;
            }
        }
        return base;
    }

    /**
     * Name of the autoexposed entity: the service name plus the last name
     * segment of the target; scoped targets (like {@code Books.texts}) are
     * named after the exposed name of their scope.
     */
    public String autoExposedName(Artifact target, Artifact service, Artifact elemScope) {
        String absolute = target.getName().getAbsolute();
        Artifact base = definitionScope(target);
        String serviceName = service.getName().getAbsolute();
        if (base == target) {
            return serviceName + "." + absolute.substring(absolute.lastIndexOf('.') + 1);
        }
        List<Artifact> exposed = ctx.redirector().minimalExposure(base, service, elemScope);
        String baseName = exposed.size() == 1 && exposed.get(0) != base
                ? exposed.get(0).getName().getAbsolute()
                : autoExposedName(base, service, elemScope);
        return baseName + absolute.substring(base.getName().getAbsolute().length());
    }

    /**
     * The scope artifact for the autoexposed name {@code absolute}: an
     * existing definition or a placeholder namespace which is not added to
     * the model.
     */
    public Artifact scopeFor(String absolute, Artifact service) {
        Artifact existing = ctx.model().getDefinition(absolute);
        if (existing != null) {
            return existing;
        }
        return placeholderScopes.computeIfAbsent(absolute, name -> {
            Location location = service.getName().getLocation();
            Artifact placeholder = Artifact.definition(Kind.NAMESPACE, name, location);
            placeholder.setParent(parentDefinition(name));
            log.debug("Placeholder scope {} for scoped redirections", name);
            return placeholder;
        });
    }

    /**
     * Creates (or reuses) the autoexposed entity for {@code target} in
     * {@code service}; returns {@code target} itself if the name is taken.
     */
    public Artifact createAutoExposed(Artifact target, Artifact service, Artifact elemScope) {
        String absolute = autoExposedName(target, service, elemScope);
        Artifact existing = ctx.model().getDefinition(absolute);
        if (existing != null) {
            if (isDirectProjection(existing, target)) {
                return existing;
            }
            Location serviceLocation = service.getName().getLocation();
            ctx.diagnostics().error("duplicate-autoexposed", serviceLocation, service,
                    MessageArgs.of("target", target).and("art", absolute));
            if (existing.getInferred() != Inferred.AUTOEXPOSED) {
                return target;
            }
            Artifact firstTarget = existing.getFromRefs().isEmpty()
                    ? null : existing.getFromRefs().get(0).getArtifact();
            ctx.diagnostics().error("duplicate-autoexposed", serviceLocation, service,
                    MessageArgs.of("target", firstTarget).and("art", absolute));
            existing.setInferred(Inferred.DUPLICATE_AUTOEXPOSED);
            return target;
        }

        Location location = target.getName().getLocation();
        Artifact art = Artifact.definition(Kind.ENTITY, absolute, target.getLocation());
        art.setInferred(Inferred.AUTOEXPOSED);
        AnnotationAssignment marker = new AnnotationAssignment(AUTOEXPOSED, null, location);
        marker.setInferred(true);
        art.addAnnotationAssignment(marker);
        Reference from = Reference.bound(target, location, Inferred.AUTOEXPOSED);
        art.setQuery(new SelectQuery(new TableRef(from, null, location), null, location));
        art.setBlock(ctx.model().getInternalSource());

        Artifact placeholder = placeholderScopes.remove(absolute);
        ctx.model().addDefinition(art);
        ctx.links().setService(art, service);
        ctx.linker().linkGenerated(art, parentDefinition(absolute));
        if (placeholder != null) {
            reparent(placeholder, art);
        }
        ctx.links().dependsOn(art, target, location);
        List<Artifact> ancestors = new ArrayList<>();
        ancestors.add(target);
        ctx.links().setAncestors(art, ancestors);
        ++created;
        log.debug("Autoexposed {} as {}", target.getName().getAbsolute(), absolute);

        ctx.queries().populateView(art);
        ctx.addAutoExposed(art);
        return art;
    }

    /**
     * True if {@code proj} is an entity selecting from {@code base} only,
     * with compatible parameters.
     */
    public boolean isDirectProjection(Artifact proj, Artifact base) {
        if (proj.getKind() != Kind.ENTITY || ctx.linker().projectionAncestor(base, proj.getParams()) == null) {
            return false;
        }
        Query query = proj.getQuery();
        if (!(query instanceof SelectQuery) || !(((SelectQuery) query).getFrom() instanceof TableRef)) {
            return false;
        }
        TableRef tableRef = (TableRef) ((SelectQuery) query).getFrom();
        return tableRef.getRef() != null && proj.getFromRefs().size() == 1
                && base == ctx.paths().resolve(tableRef.getRef(), ResolutionPolicy.FROM, proj);
    }

    /** The definition or placeholder scope with the longest prefix of {@code absolute}. */
    private Artifact parentDefinition(String absolute) {
        String name = absolute;
        int dot = name.lastIndexOf('.');
        while (dot > 0) {
            name = name.substring(0, dot);
            Artifact parent = ctx.model().getDefinition(name);
            if (parent == null) {
                parent = placeholderScopes.get(name);
            }
            if (parent != null) {
                return parent;
            }
            dot = name.lastIndexOf('.');
        }
        return null;
    }

    private void reparent(Artifact placeholder, Artifact replacement) {
        for (Artifact def : ctx.model().getDefinitions().values()) {
            if (def.getParent() == placeholder) {
                def.setParent(replacement);
            }
        }
        for (Artifact scope : placeholderScopes.values()) {
            if (scope.getParent() == placeholder) {
                scope.setParent(replacement);
            }
        }
    }
}
