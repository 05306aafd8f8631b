package me.christianrobert.cdsresolver.resolve.type;

import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Cardinality;
import me.christianrobert.cdsresolver.model.Inferred;
import me.christianrobert.cdsresolver.model.Kind;
import me.christianrobert.cdsresolver.model.Location;
import me.christianrobert.cdsresolver.model.Members;
import me.christianrobert.cdsresolver.model.Name;
import me.christianrobert.cdsresolver.model.PathStep;
import me.christianrobert.cdsresolver.model.Reference;
import me.christianrobert.cdsresolver.model.expr.PathExpression;
import me.christianrobert.cdsresolver.model.query.SelectQuery;
import me.christianrobert.cdsresolver.resolve.context.NodeStatus;
import me.christianrobert.cdsresolver.resolve.context.ResolveContext;
import me.christianrobert.cdsresolver.resolve.context.StatusTable;
import me.christianrobert.cdsresolver.resolve.path.Environment;
import me.christianrobert.cdsresolver.resolve.path.PathResolver;
import me.christianrobert.cdsresolver.resolve.path.ResolutionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the effective type of a node: the first node of its type
 * derivation chain ({@code type}, {@code type of}, origin of a projected
 * element) which carries elements, an enum, a target or items, or which is a
 * builtin.
 *
 * <p>While the chain is walked every node on it is marked in progress; a node
 * re-entered while in progress ends the walk, and all nodes of the chain get
 * no effective type.  Intermediate nodes of a chain ending at a structure get
 * copies of its elements, nodes ending at an association are implicitly
 * redirected.
 */
public class EffectiveTypeEngine {

    private static final Logger log = LoggerFactory.getLogger(EffectiveTypeEngine.class);

    private final ResolveContext ctx;

    public EffectiveTypeEngine(ResolveContext ctx) {
        this.ctx = ctx;
    }

    /**
     * @return the effective type, {@code null} if it cannot be determined
     * (unresolved or cyclic type reference)
     */
    public Artifact effectiveType(Artifact node) {
        if (node == null) {
            return null;
        }
        StatusTable<Artifact> table = ctx.effectiveTypes();
        NodeStatus status = table.status(node);
        if (status == NodeStatus.DONE) {
            return table.value(node);
        }
        if (status != NodeStatus.UNVISITED) {
            return null;
        }

        List<Artifact> chain = new ArrayList<>();
        Artifact art = node;
        while (art != null && table.status(art) == NodeStatus.UNVISITED && isAlias(art)) {
            chain.add(art);
            table.begin(art);
            art = directType(art);
        }

        boolean cyclic = false;
        if (art != null) {
            NodeStatus terminal = table.status(art);
            if (terminal == NodeStatus.DONE) {
                art = table.value(art);
            } else if (terminal != NodeStatus.UNVISITED) {
                cyclic = true;
                art = null;
            } else {
                table.done(art, art);
                if (art.getExpand() != null && art.getValue() == null && art.getElements() == null) {
                    ctx.columns().initFromColumns(art, art.getExpand(), null);
                } else if (art.getTarget() != null && ctx.links().origin(art) == null && art.getValue() == null
                        && art.getKind() != Kind.MIXIN) {
                    ctx.redirector().redirectImplicitly(art, art);
                }
            }
        }

        Collections.reverse(chain);
        if (art == null) {
            for (Artifact a : chain) {
                if (cyclic) {
                    table.poison(a);
                } else {
                    table.done(a, null);
                }
            }
            if (cyclic && log.isDebugEnabled()) {
                log.debug("Cyclic type derivation through {}", node.getName());
            }
            return null;
        }

        Artifact eType = art.getOuter() != null ? effectiveType(art.getOuter()) : art;
        Cardinality cardinality = art.getCardinality();
        for (Artifact a : chain) {
            if (a.getCardinality() != null) {
                cardinality = a.getCardinality();
            }
            if (a.getExpand() != null && expandFromColumns(a, art, cardinality)
                    || art.getTarget() != null && ctx.redirector().redirectImplicitly(a, art)
                    || art.getElements() != null && expandElements(a, art, eType)) {
                art = a;
            }
            table.done(a, art);
        }
        return art;
    }

    /** True for nodes whose type is defined by another node. */
    private boolean isAlias(Artifact art) {
        boolean derived = art.getType() != null || ctx.links().origin(art) != null
                || art.getValue() instanceof PathExpression;
        return derived && art.getTarget() == null && art.getEnumValues() == null
                && art.getElements() == null && art.getItems() == null;
    }

    /**
     * The next node of the type derivation chain: the origin, the referred
     * type, or the artifact a query column refers to.
     */
    public Artifact directType(Artifact art) {
        if (ctx.links().origin(art) != null || art.isBuiltin()) {
            return ctx.links().origin(art);
        }
        if (art.getType() != null) {
            return ctx.typeRefs().resolveType(art.getType(), art);
        }
        if (art.getMain() == null || !(art.getValue() instanceof PathExpression)) {
            return null;
        }
        Reference ref = ((PathExpression) art.getValue()).getReference();
        if (art.getPathHead() != null) {
            return ctx.links().setOrigin(art, ctx.paths().resolve(ref, ResolutionPolicy.EXPR, art));
        }
        SelectQuery query = PathResolver.userQuery(art);
        if (query == null) {
            return null;
        }
        Environment combined = query.getCombined() != null ? Environment.combined(query.getCombined()) : null;
        return ctx.links().setOrigin(art, ctx.paths().resolve(ref, ResolutionPolicy.EXPR, art, combined));
    }

    /** The cardinality of an association, following its type chain. */
    public Cardinality getCardinality(Artifact type) {
        Artifact current = type;
        int guard = 0;
        while (current != null && guard++ < 64) {
            if (current.getCardinality() != null) {
                return current.getCardinality();
            }
            current = directType(current);
        }
        return null;
    }

    private boolean expandFromColumns(Artifact elem, Artifact assoc, Cardinality cardinality) {
        if (!(elem.getValue() instanceof PathExpression)) {
            return false;
        }
        Reference ref = ((PathExpression) elem.getValue()).getReference();
        if (ref.getArtifact() == null) {
            return false;
        }
        if (assoc.getTarget() != null) {
            PathStep last = ref.last();
            Cardinality card = last.getCardinality() != null ? last.getCardinality()
                    : cardinality != null ? cardinality : getCardinality(assoc);
            if (card != null && card.isTargetMaxNotOne() && elem.getItems() == null) {
                Artifact items = new Artifact(elem.getKind(), new Name(elem.getName().getId(),
                        elem.getLocation()), elem.getLocation());
                items.setOuter(elem);
                elem.setItems(items);
            }
        }
        return ctx.columns().initFromColumns(elem, elem.getExpand(), null);
    }

    /**
     * Copies the elements of {@code struct} into the type alias {@code art};
     * marks {@code art} as having cyclic elements if it is (in) the structure
     * itself.
     *
     * @return true if {@code art} now has its own elements
     */
    public boolean expandElements(Artifact art, Artifact struct, Artifact eType) {
        if (!ctx.isExpandElements()) {
            return false;
        }
        if (art.getElements() != null || art.getKind() == Kind.TABLE_ALIAS) {
            return false;
        }
        Kind structKind = struct.getKind();
        if (structKind != Kind.TYPE && structKind != Kind.ELEMENT && structKind != Kind.PARAM
                && struct.getOuter() == null) {
            return false;
        }
        if (struct.isElementsCyclic() || isInParents(art, eType)) {
            art.setElementsCyclic(true);
            return true;
        }
        Location location = art.getType() != null ? art.getType().getLocation()
                : art.getValue() != null ? art.getValue().getLocation()
                : art.getName().getLocation();
        LinkedHashMap<String, Artifact> elements = art.ensureElements();
        for (Map.Entry<String, Artifact> entry : struct.getElements().entrySet()) {
            Artifact elem = Members.linkToOrigin(ctx.model(), entry.getValue(), entry.getKey(), art, elements,
                    location, true);
            elem.setInferred(Inferred.EXPAND_ELEMENT);
            elem.setBlock(entry.getValue().getBlock());
        }
        return true;
    }

    /**
     * True if {@code struct} is {@code art}, the artifact containing {@code art}
     * as items, or a (transitive) parent of it.
     */
    public static boolean isInParents(Artifact art, Artifact struct) {
        if (art == struct) {
            return true;
        }
        Artifact current = art;
        while (current.getOuter() != null) {
            current = current.getOuter();
            if (current == struct) {
                return true;
            }
        }
        while (current.getMain() != null) {
            current = current.getParent();
            if (current == struct) {
                return true;
            }
        }
        return false;
    }
}
