package me.christianrobert.cdsresolver.resolve.query;

import me.christianrobert.cdsresolver.model.query.FromItem;
import me.christianrobert.cdsresolver.model.query.JoinItem;
import me.christianrobert.cdsresolver.model.query.Query;
import me.christianrobert.cdsresolver.model.query.SelectQuery;
import me.christianrobert.cdsresolver.model.query.SetQuery;
import me.christianrobert.cdsresolver.model.query.TableRef;

import java.util.function.Consumer;

/**
 * Post-order traversal of the SELECTs of a query tree: sub queries in FROM
 * are visited before the SELECT containing them.  Sub queries in
 * expressions are not part of the traversal.
 */
public final class QueryTraversal {

    private QueryTraversal() {
    }

    /**
     * @param simpleOnly only follow SELECTs whose FROM is a path or a sub
     *                   query; JOINs and set operations stop the traversal
     */
    public static void postOrder(Query query, boolean simpleOnly, Consumer<SelectQuery> callback) {
        if (query == null) {
            return;
        }
        if (query instanceof SetQuery) {
            if (simpleOnly) {
                return;
            }
            for (Query arg : ((SetQuery) query).getArgs()) {
                postOrder(arg, false, callback);
            }
            return;
        }
        SelectQuery select = (SelectQuery) query;
        FromItem from = select.getFrom();
        if (from == null || simpleOnly && from instanceof JoinItem) {
            return;
        }
        traverseFrom(from, simpleOnly, callback);
        callback.accept(select);
    }

    private static void traverseFrom(FromItem from, boolean simpleOnly, Consumer<SelectQuery> callback) {
        if (from instanceof TableRef) {
            Query subQuery = ((TableRef) from).getSubQuery();
            if (subQuery != null) {
                postOrder(subQuery, simpleOnly, callback);
            }
        } else if (from instanceof JoinItem) {
            for (FromItem arg : ((JoinItem) from).getArgs()) {
                traverseFrom(arg, simpleOnly, callback);
            }
        }
    }
}
