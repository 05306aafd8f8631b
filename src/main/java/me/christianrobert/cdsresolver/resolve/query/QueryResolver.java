package me.christianrobert.cdsresolver.resolve.query;

import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.expr.Expression;
import me.christianrobert.cdsresolver.model.expr.PathExpression;
import me.christianrobert.cdsresolver.model.query.FromItem;
import me.christianrobert.cdsresolver.model.query.JoinItem;
import me.christianrobert.cdsresolver.model.query.Query;
import me.christianrobert.cdsresolver.model.query.SelectQuery;
import me.christianrobert.cdsresolver.model.query.SetQuery;
import me.christianrobert.cdsresolver.model.query.TableRef;
import me.christianrobert.cdsresolver.resolve.context.ResolveContext;
import me.christianrobert.cdsresolver.resolve.path.Environment;
import me.christianrobert.cdsresolver.resolve.path.ResolutionPolicy;

import java.util.List;
import java.util.Map;

/**
 * Resolves all references of a query: FROM arguments and filters, mixins,
 * columns, JOIN conditions, WHERE, GROUP BY, HAVING and ORDER BY.
 */
public class QueryResolver {

    private final ResolveContext ctx;

    public QueryResolver(ResolveContext ctx) {
        this.ctx = ctx;
    }

    /** Resolves every SELECT of the query tree, sub queries in FROM first. */
    public void resolveQueryTree(Query query) {
        QueryTraversal.postOrder(query, false, this::resolveQuery);
        resolveUnionOrderBy(query);
    }

    public void resolveQuery(SelectQuery query) {
        Artifact result = query.getResult();
        if (result == null || query.getMain() == null) {
            return;
        }
        ctx.queries().populateQuery(query);
        Artifact outer = result.getParent() != null ? result.getParent() : query.getMain();
        for (Artifact alias : query.getTableAliases().values()) {
            switch (alias.getKind()) {
                case MIXIN:
                    ctx.definitions().resolveRefs(alias);
                    break;
                case TABLE_ALIAS:
                    TableRef tableRef = alias.getTableRef();
                    if (tableRef != null && tableRef.getRef() != null) {
                        // the path itself is resolved already, now its arguments and filters
                        ctx.expressions().resolveReference(tableRef.getRef(), ResolutionPolicy.FROM, outer,
                                null, false);
                    }
                    break;
                default:
                    break;
            }
        }
        for (Artifact col : query.getInlines()) {
            ctx.expressions().resolve(col.getValue(), ResolutionPolicy.EXPR, col, null, true);
        }
        if (query.getMain().getLeadingQuery() != query && result.getElements() != null) {
            for (Artifact elem : result.getElements().values()) {
                ctx.definitions().resolveRefs(elem);
            }
        }
        Environment combined = Environment.combined(query.getCombined());
        resolveJoinOn(query.getFrom(), result, combined);
        ctx.expressions().resolve(query.getWhere(), ResolutionPolicy.EXPR, result, combined);
        for (Expression expr : query.getGroupBy()) {
            ctx.expressions().resolve(expr, ResolutionPolicy.EXPR, result);
        }
        ctx.expressions().resolve(query.getHaving(), ResolutionPolicy.EXPR, result, combined);
        // Paths in ORDER BY may also name the elements of the query
        resolveBy(query.getOrderBy(), ResolutionPolicy.EXPR, result, result.getElements());
    }

    private void resolveJoinOn(FromItem from, Artifact result, Environment combined) {
        if (!(from instanceof JoinItem)) {
            return;
        }
        JoinItem join = (JoinItem) from;
        for (FromItem arg : join.getArgs()) {
            resolveJoinOn(arg, result, combined);
        }
        ctx.expressions().resolve(join.getOn(), ResolutionPolicy.EXPR, result, combined);
    }

    /**
     * ORDER BY of a UNION: paths only see the elements of the leading query,
     * no source elements.
     */
    private void resolveUnionOrderBy(Query query) {
        if (query instanceof SetQuery) {
            SetQuery setQuery = (SetQuery) query;
            for (Query arg : setQuery.getArgs()) {
                resolveUnionOrderBy(arg);
            }
            SelectQuery leading = setQuery.leading();
            if (!setQuery.getOrderBy().isEmpty() && leading != null && leading.getResult() != null) {
                Artifact result = leading.getResult();
                Artifact user = result.getParent() != null ? result.getParent() : leading.getMain();
                resolveBy(setQuery.getOrderBy(), ResolutionPolicy.ORDER_BY_UNION, user, result.getElements());
            }
        } else if (query instanceof SelectQuery) {
            resolveUnionOrderByInFrom(((SelectQuery) query).getFrom());
        }
    }

    private void resolveUnionOrderByInFrom(FromItem from) {
        if (from instanceof TableRef && ((TableRef) from).getSubQuery() != null) {
            resolveUnionOrderBy(((TableRef) from).getSubQuery());
        } else if (from instanceof JoinItem) {
            for (FromItem arg : ((JoinItem) from).getArgs()) {
                resolveUnionOrderByInFrom(arg);
            }
        }
    }

    private void resolveBy(List<Expression> exprs, ResolutionPolicy policy, Artifact user,
                           Map<String, Artifact> pathDict) {
        for (Expression expr : exprs) {
            Environment extDict = expr instanceof PathExpression && pathDict != null ? Environment.of(pathDict) : null;
            ctx.expressions().resolve(expr, policy, user, extDict);
        }
    }
}
