package me.christianrobert.cdsresolver.resolve.expr;

import me.christianrobert.cdsresolver.diagnostics.MessageArgs;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Kind;
import me.christianrobert.cdsresolver.model.Location;
import me.christianrobert.cdsresolver.model.PathStep;
import me.christianrobert.cdsresolver.model.Reference;
import me.christianrobert.cdsresolver.model.ResolutionState;
import me.christianrobert.cdsresolver.model.expr.CastExpression;
import me.christianrobert.cdsresolver.model.expr.Expression;
import me.christianrobert.cdsresolver.model.expr.ExpressionWalker;
import me.christianrobert.cdsresolver.model.expr.OperatorExpression;
import me.christianrobert.cdsresolver.model.expr.PathExpression;
import me.christianrobert.cdsresolver.model.expr.SubQueryExpression;
import me.christianrobert.cdsresolver.model.query.Query;
import me.christianrobert.cdsresolver.model.query.SelectQuery;
import me.christianrobert.cdsresolver.resolve.context.ResolveContext;
import me.christianrobert.cdsresolver.resolve.path.Environment;
import me.christianrobert.cdsresolver.resolve.path.ResolutionPolicy;

import java.util.List;
import java.util.Map;

/**
 * Resolves all references in an expression: paths with their arguments and
 * filters, cast types and sub queries.
 */
public class ExpressionResolver {

    private final ResolveContext ctx;

    public ExpressionResolver(ResolveContext ctx) {
        this.ctx = ctx;
    }

    public void resolve(Expression expr, ResolutionPolicy policy, Artifact user) {
        resolve(expr, policy, user, null, false);
    }

    public void resolve(Expression expr, ResolutionPolicy policy, Artifact user, Environment extDict) {
        resolve(expr, policy, user, extDict, false);
    }

    /**
     * @param extDict        environment for the first path step, see {@link
     *                       me.christianrobert.cdsresolver.resolve.path.PathResolver#resolve}
     * @param expandOrInline the expression is the value of a column with
     *                       {@code expand}/{@code inline}: a filter on its last step
     *                       is allowed
     */
    public void resolve(Expression expr, ResolutionPolicy policy, Artifact user, Environment extDict,
                        boolean expandOrInline) {
        if (expr == null) {
            return;
        }
        expr.accept(new Resolver(policy, user, extDict, expandOrInline));
    }

    /**
     * Resolves a reference which is not wrapped in an expression (e.g. a FROM
     * reference) together with the arguments and filters of its steps.
     */
    public Artifact resolveReference(Reference ref, ResolutionPolicy policy, Artifact user, Environment extDict,
                                     boolean expandOrInline) {
        Artifact art = ctx.paths().resolve(ref, policy, user, extDict);
        PathStep last = expandOrInline ? null : ref.last();
        for (PathStep step : ref.getPath()) {
            if ((step.hasArgs() || step.getWhere() != null || step.getCardinality() != null)
                    && step.getArtifact() != null && step.getCell().getState() != ResolutionState.AMBIGUOUS) {
                resolveParamsAndWhere(step, policy, user, extDict, step == last);
            }
        }
        return art;
    }

    /**
     * Resolves the arguments and the filter of a path step.  Both are only
     * allowed where the step navigates to an entity, i.e. not at the end of a
     * value path.
     */
    public void resolveParamsAndWhere(PathStep step, ResolutionPolicy policy, Artifact user, Environment extDict,
                                      boolean isLast) {
        Artifact alias = step.getNavigation() != null && step.getNavigation().getKind() == Kind.TABLE_ALIAS
                ? step.getNavigation() : null;
        Artifact type = alias != null ? alias : ctx.types().effectiveType(step.getArtifact());
        if (type == null) {
            return;
        }
        Artifact art = type.getTarget() != null ? type.getTarget().getArtifact() : type;
        if (art == null) {
            return;
        }
        boolean entity = art.getKind() == Kind.ENTITY
                && (!isLast || policy == ResolutionPolicy.FROM || policy == ResolutionPolicy.EXISTS);
        if (step.hasArgs()) {
            resolveParams(step, art, entity, policy, user, extDict);
        }
        if (entity) {
            if (step.getWhere() != null) {
                resolve(step.getWhere(), ResolutionPolicy.FILTER, user,
                        Environment.of(ctx.paths().environment(type)));
            }
        } else if (step.getWhere() != null || step.getCardinality() != null) {
            Location location = step.getWhere() != null ? step.getWhere().getLocation()
                    : step.getCardinality().getLocation();
            ctx.diagnostics().message("expr-no-filter", location, user,
                    MessageArgs.none().variant(policy == ResolutionPolicy.FROM ? "from" : null));
        }
    }

    private void resolveParams(PathStep step, Artifact art, boolean entity, ResolutionPolicy policy,
                               Artifact user, Environment extDict) {
        ResolutionPolicy argPolicy = policy.argumentPolicy();
        if (!entity || art.getParams() == null) {
            Location location = firstArgLocation(step);
            String variant = entity ? "entity" : policy == ResolutionPolicy.FROM ? "from" : null;
            ctx.diagnostics().message("args-no-params", location, user,
                    MessageArgs.of("art", art).variant(variant));
            return;
        }
        if (step.getPositionalArgs() != null && !step.getPositionalArgs().isEmpty()) {
            ctx.diagnostics().message("args-expected-named", firstArgLocation(step), user, MessageArgs.none());
            for (Expression arg : step.getPositionalArgs()) {
                resolve(arg, argPolicy, user, extDict);
            }
            return;
        }
        for (Map.Entry<String, Expression> entry : step.getNamedArgs().entrySet()) {
            if (!art.getParams().containsKey(entry.getKey())) {
                Location location = entry.getValue() != null ? entry.getValue().getLocation() : step.getLocation();
                ctx.diagnostics().message("args-undefined-param", location, user,
                        MessageArgs.of("art", art).and("id", entry.getKey()));
            }
            resolve(entry.getValue(), argPolicy, user, extDict);
        }
    }

    private static Location firstArgLocation(PathStep step) {
        Expression first = null;
        if (step.getNamedArgs() != null && !step.getNamedArgs().isEmpty()) {
            first = step.getNamedArgs().values().iterator().next();
        } else if (step.getPositionalArgs() != null && !step.getPositionalArgs().isEmpty()) {
            first = step.getPositionalArgs().get(0);
        }
        return first != null && first.getLocation() != null ? first.getLocation() : step.getLocation();
    }

    /**
     * Walks an expression; operands of {@code exists} are resolved with the
     * EXISTS policy.
     */
    private final class Resolver extends ExpressionWalker {
        private final ResolutionPolicy policy;
        private final Artifact user;
        private final Environment extDict;
        private final boolean expandOrInline;

        Resolver(ResolutionPolicy policy, Artifact user, Environment extDict, boolean expandOrInline) {
            this.policy = policy;
            this.user = user;
            this.extDict = extDict;
            this.expandOrInline = expandOrInline;
        }

        @Override
        public Void visitPath(PathExpression expr) {
            resolveReference(expr.getReference(), policy, user, extDict, expandOrInline);
            return null;
        }

        @Override
        public Void visitOperator(OperatorExpression expr) {
            if ("exists".equalsIgnoreCase(expr.getOp())) {
                Resolver exists = new Resolver(ResolutionPolicy.EXISTS, user, extDict, false);
                expr.getArgs().forEach(exists::walk);
                return null;
            }
            List<Expression> args = expr.getArgs();
            Resolver operands = expandOrInline ? new Resolver(policy, user, extDict, false) : this;
            args.forEach(operands::walk);
            return null;
        }

        @Override
        public Void visitCast(CastExpression expr) {
            ctx.typeRefs().resolveCast(expr, user);
            walk(expr.getValue());
            return null;
        }

        @Override
        public Void visitSubQuery(SubQueryExpression expr) {
            Query query = expr.getQuery();
            SelectQuery leading = query != null ? query.leading() : null;
            if (leading == null || leading.getResult() == null) {
                ctx.diagnostics().error("expr-no-subquery", expr.getLocation(), user, MessageArgs.none());
                return null;
            }
            ctx.queryResolver().resolveQueryTree(query);
            return null;
        }
    }
}
