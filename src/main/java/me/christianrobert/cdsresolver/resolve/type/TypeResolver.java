package me.christianrobert.cdsresolver.resolve.type;

import me.christianrobert.cdsresolver.diagnostics.MessageArgs;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Inferred;
import me.christianrobert.cdsresolver.model.Kind;
import me.christianrobert.cdsresolver.model.Location;
import me.christianrobert.cdsresolver.model.RefScope;
import me.christianrobert.cdsresolver.model.Reference;
import me.christianrobert.cdsresolver.model.expr.CastExpression;
import me.christianrobert.cdsresolver.model.expr.Expression;
import me.christianrobert.cdsresolver.model.expr.Literal;
import me.christianrobert.cdsresolver.model.expr.LiteralKind;
import me.christianrobert.cdsresolver.resolve.context.ResolveContext;
import me.christianrobert.cdsresolver.resolve.path.ResolutionPolicy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves type references ({@code type}, {@code type of}, cast targets) and
 * assigns type arguments like {@code String(10)} to the type properties.
 */
public class TypeResolver {

    private final ResolveContext ctx;

    public TypeResolver(ResolveContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Resolves a type reference written at {@code user}; the policy depends
     * on the kind of the user (event, action parameter, other).
     */
    public Artifact resolveType(Reference ref, Artifact user) {
        if (ref.getCell().isSettled()) {
            return ref.getArtifact();
        }
        if (ref.getScope() == RefScope.TYPE_OF) {
            Artifact struct = user;
            while (struct.getKind() == Kind.ELEMENT && struct.getParent() != null) {
                struct = struct.getParent();
            }
            if (struct.getKind() == Kind.QUERY) {
                ctx.diagnostics().error("ref-invalid-typeof", ref.getLocation(), user,
                        MessageArgs.of("keyword", "type of").variant("select"));
            } else if (struct != user.getMain()) {
                ctx.diagnostics().error("ref-invalid-typeof", ref.getLocation(), user,
                        MessageArgs.of("keyword", "type of"));
                return ref.getCell().bind(null);
            }
            return ctx.paths().resolve(ref, ResolutionPolicy.TYPE_OF, user);
        }
        Artifact owner = user;
        while (owner.getOuter() != null) {
            owner = owner.getOuter();
        }
        if (owner.getKind() == Kind.EVENT) {
            return ctx.paths().resolve(ref, ResolutionPolicy.EVENT_TYPE, owner);
        }
        if (owner.getKind() == Kind.PARAM && owner.getParent() != null
                && (owner.getParent().getKind() == Kind.ACTION || owner.getParent().getKind() == Kind.FUNCTION)) {
            return ctx.paths().resolve(ref, ResolutionPolicy.ACTION_PARAM_TYPE, owner);
        }
        return ctx.paths().resolve(ref, ResolutionPolicy.TYPE, owner);
    }

    /** Resolves the type of {@code art} and assigns its type arguments. */
    public void resolveTypeExpr(Artifact art, Artifact user) {
        if (art.getType() == null) {
            return;
        }
        Artifact typeArt = resolveType(art.getType(), user);
        if (typeArt != null) {
            Map<String, Integer> values = typeArguments(art.getTypeArguments(), typeArt, user,
                    art.getType().getLocation());
            assign(art, values, false);
            art.setTypeArguments(null);
        }
    }

    /** Resolves the type of a {@code cast} and checks its arguments. */
    public Artifact resolveCast(CastExpression cast, Artifact user) {
        if (cast.getType() == null) {
            return null;
        }
        Artifact typeArt = resolveType(cast.getType(), user);
        if (typeArt != null) {
            typeArguments(cast.getTypeArguments(), typeArt, user, cast.getLocation());
        }
        return typeArt;
    }

    /**
     * An element whose value is a {@code cast} gets the cast type (and its
     * type arguments) as inferred type.
     */
    public void inferTypeFromCast(Artifact elem) {
        if (!(elem.getValue() instanceof CastExpression)) {
            return;
        }
        CastExpression cast = (CastExpression) elem.getValue();
        Reference castType = cast.getType();
        if (castType == null || castType.getArtifact() == null || elem.getType() != null) {
            return;
        }
        Reference type = castType.copy();
        type.setInferred(Inferred.CAST);
        elem.setType(type);
        Map<String, Integer> values = argumentValues(cast.getTypeArguments(), castType.getArtifact());
        assign(elem, values, true);
    }

    /**
     * Maps positional type arguments to the parameters of the (builtin) type.
     * Surplus arguments and arguments for types without parameters are reported.
     */
    private Map<String, Integer> typeArguments(List<Expression> args, Artifact typeArt, Artifact user,
                                               Location location) {
        if (args == null || args.isEmpty()) {
            return Map.of();
        }
        List<String> parameters = typeArt.getTypeParameters();
        if (parameters == null || parameters.isEmpty()) {
            ctx.diagnostics().error("args-no-params", location(args.get(0), location), user,
                    MessageArgs.of("art", typeArt).variant("type"));
            return Map.of();
        }
        if (args.size() > parameters.size()) {
            ctx.diagnostics().warning("args-too-many", location(args.get(parameters.size()), location), user,
                    MessageArgs.of("art", typeArt));
        }
        return argumentValues(args, typeArt);
    }

    private static Map<String, Integer> argumentValues(List<Expression> args, Artifact typeArt) {
        Map<String, Integer> values = new LinkedHashMap<>();
        List<String> parameters = typeArt.getTypeParameters();
        if (args == null || parameters == null) {
            return values;
        }
        for (int i = 0; i < parameters.size() && i < args.size(); i++) {
            Expression arg = args.get(i);
            if (arg instanceof Literal && ((Literal) arg).getKind() == LiteralKind.NUMBER) {
                values.put(parameters.get(i), ((Number) ((Literal) arg).getValue()).intValue());
            }
        }
        return values;
    }

    // Explicit properties win over type arguments
    private static void assign(Artifact art, Map<String, Integer> values, boolean overwrite) {
        values.forEach((parameter, value) -> {
            switch (parameter) {
                case "length":
                    if (overwrite || art.getLength() == null) {
                        art.setLength(value);
                    }
                    break;
                case "precision":
                    if (overwrite || art.getPrecision() == null) {
                        art.setPrecision(value);
                    }
                    break;
                case "scale":
                    if (overwrite || art.getScale() == null) {
                        art.setScale(value);
                    }
                    break;
                case "srid":
                    if (overwrite || art.getSrid() == null) {
                        art.setSrid(value);
                    }
                    break;
                default:
                    break;
            }
        });
    }

    private static Location location(Expression expr, Location fallback) {
        return expr.getLocation() != null ? expr.getLocation() : fallback;
    }
}
