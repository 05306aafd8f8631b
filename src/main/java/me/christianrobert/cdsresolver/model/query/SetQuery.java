package me.christianrobert.cdsresolver.model.query;

import me.christianrobert.cdsresolver.model.Location;
import me.christianrobert.cdsresolver.model.expr.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * UNION / INTERSECT / EXCEPT of queries; the first operand is leading.
 */
public class SetQuery extends Query {
    private final String op;
    private final boolean all;
    private final List<Query> args;
    private final List<Expression> orderBy = new ArrayList<>();

    public SetQuery(String op, boolean all, List<? extends Query> args, Location location) {
        super(location);
        this.op = op;
        this.all = all;
        this.args = new ArrayList<>(args);
    }

    public String getOp() { return op; }
    public boolean isAll() { return all; }
    public List<Query> getArgs() { return args; }
    public List<Expression> getOrderBy() { return orderBy; }

    @Override
    public SelectQuery leading() {
        return args.isEmpty() ? null : args.get(0).leading();
    }
}
