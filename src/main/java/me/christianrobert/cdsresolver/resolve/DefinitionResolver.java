package me.christianrobert.cdsresolver.resolve;

import me.christianrobert.cdsresolver.builtins.BuiltinCategory;
import me.christianrobert.cdsresolver.diagnostics.MessageArgs;
import me.christianrobert.cdsresolver.model.AnnotationAssignment;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Inferred;
import me.christianrobert.cdsresolver.model.Kind;
import me.christianrobert.cdsresolver.model.Members;
import me.christianrobert.cdsresolver.model.expr.Literal;
import me.christianrobert.cdsresolver.model.expr.PathExpression;
import me.christianrobert.cdsresolver.resolve.context.ResolveContext;
import me.christianrobert.cdsresolver.resolve.path.ResolutionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Resolves all remaining references of a definition and, recursively, of its
 * members: types, targets with ON condition or foreign keys, queries, default
 * values and column expressions.  Annotations are chosen afterwards, when
 * the member extensions could be applied.
 */
public class DefinitionResolver {

    private static final Logger log = LoggerFactory.getLogger(DefinitionResolver.class);

    static final String CORE_COMPUTED = "@Core.Computed";

    private final ResolveContext ctx;
    private final Set<Artifact> resolved = Collections.newSetFromMap(new IdentityHashMap<>());

    public DefinitionResolver(ResolveContext ctx) {
        this.ctx = ctx;
    }

    /** Resolves every (non-builtin) definition; returns the number of resolved nodes. */
    public int resolveAll() {
        for (Artifact art : new ArrayList<>(ctx.model().getDefinitions().values())) {
            if (!art.isBuiltin()) {
                resolveRefs(art);
            }
        }
        log.debug("Resolved references of {} nodes", resolved.size());
        return resolved.size();
    }

    public void resolveRefs(Artifact art) {
        if (!resolved.add(art)) {
            return;
        }
        Artifact parent = art.getParent();
        checkKey(art, parent);

        Artifact obj = art;
        if (obj.getType() != null) {
            ctx.typeRefs().resolveTypeExpr(obj, art);
        }
        // also creates the implicitly redirected target
        ctx.types().effectiveType(obj);
        if (obj.getItems() != null) {
            obj = obj.getItems();
            if (ctx.isExpandElements()) {
                ctx.types().effectiveType(obj);
            }
            if (obj.getType() != null) {
                ctx.typeRefs().resolveTypeExpr(obj, art);
            }
        }
        if (obj.getType() != null && !checkTypeArtifact(art, obj)) {
            return;
        }
        if (obj.getTarget() != null) {
            Artifact origin = ctx.links().origin(obj);
            if (origin != null && origin.getInferred() == Inferred.REDIRECTED) {
                ctx.targets().resolveTarget(art, origin);
            }
            if (obj.getTarget().getInferred() == null) {
                ctx.targets().resolveTarget(art, obj);
            } else {
                ctx.redirections().resolveRedirected(obj, obj.getTarget().getArtifact());
            }
        } else if (obj.getKind() == Kind.MIXIN) {
            ctx.diagnostics().error("non-assoc-in-mixin",
                    obj.getType() != null ? obj.getType().getLocation() : obj.getName().getLocation(), art,
                    MessageArgs.none());
        }

        if (art.getQuery() != null) {
            ctx.queryResolver().resolveQueryTree(art.getQuery());
        }
        if (obj.getType() != null || ctx.links().origin(obj) != null
                || obj.getValue() instanceof PathExpression || obj.getElements() != null) {
            ctx.types().effectiveType(obj);
        }
        if (obj.getElements() != null) {
            for (Artifact elem : obj.getElements().values()) {
                ctx.links().dependsOnSilent(art, elem);
            }
        }
        if (obj.getForeignKeys() != null) {
            for (Artifact key : obj.getForeignKeys().values()) {
                ctx.links().dependsOnSilent(art, key);
            }
            // reports duplicate key references
            ctx.foreignKeys().keysNavigation(obj);
        }

        ctx.expressions().resolve(art.getDefaultValue(), ResolutionPolicy.DEFAULT, art);
        ctx.expressions().resolve(art.getValue(), ResolutionPolicy.EXPR, art, null,
                art.getExpand() != null || art.getInline() != null);
        if (art.getValue() != null && art.getType() == null && art.getTarget() == null && art.getElements() == null) {
            ctx.typeRefs().inferTypeFromCast(art);
        }
        if (art.getKind() == Kind.ELEMENT || art.getKind() == Kind.MIXIN) {
            ctx.types().effectiveType(art);
        }

        ctx.extensions().annotateMembers(art);
        ctx.annotations().chooseAnnotations(art);

        Members.forEachMember(art, this::resolveRefs);
        inferComputed(art);
    }

    private void checkKey(Artifact art, Artifact parent) {
        if (!art.isKey() || art.isKeyInferred()) {
            return;
        }
        Kind mainKind = art.mainOrSelf().getKind();
        boolean allowedInMain = mainKind == Kind.ENTITY || mainKind == Kind.ASPECT;
        boolean topLevel = parent != null && parent.getKind() != Kind.ELEMENT;
        if (!(allowedInMain && topLevel)) {
            ctx.diagnostics().warning("unexpected-key", art.getLocation(), art,
                    MessageArgs.none().variant(allowedInMain ? "sub" : null));
        }
    }

    /**
     * Checks the artifact used as type: no unmanaged association, no
     * internal relation type without target.
     *
     * @return false if the node must not be resolved further
     */
    private boolean checkTypeArtifact(Artifact art, Artifact obj) {
        Artifact elemType = obj.getType().getArtifact();
        if (elemType == null) {
            return true;
        }
        if (elemType.getOn() != null) {
            ctx.diagnostics().error("assoc-as-type-of", obj.getType().getLocation(), art, MessageArgs.none());
            return false;
        }
        if (elemType.getCategory() == BuiltinCategory.RELATION && !obj.getType().getPath().isEmpty()
                && obj.getTarget() == null) {
            ctx.diagnostics().error("type-missing-target", obj.getType().getLocation(), obj,
                    MessageArgs.of("type", elemType.getName().getAbsolute()));
        }
        return true;
    }

    /** Query elements with a value other than a plain element path are computed. */
    private void inferComputed(Artifact art) {
        if (art.getKind() != Kind.ELEMENT || art.getAnnotation(CORE_COMPUTED) != null) {
            return;
        }
        boolean computed = art.isVirtual();
        if (!computed && art.getValue() != null) {
            if (!(art.getValue() instanceof PathExpression)) {
                computed = true;
            } else {
                Artifact target = ((PathExpression) art.getValue()).getReference().getArtifact();
                computed = target == null || target.getKind() == Kind.BUILTIN || target.getKind() == Kind.PARAM;
            }
        }
        if (computed) {
            AnnotationAssignment assignment = new AnnotationAssignment(CORE_COMPUTED,
                    Literal.bool(true, art.getLocation()), art.getLocation());
            assignment.setInferred(true);
            art.getAnnotations().put(CORE_COMPUTED, assignment);
        }
    }
}
