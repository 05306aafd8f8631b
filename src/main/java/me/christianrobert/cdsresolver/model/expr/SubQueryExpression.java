package me.christianrobert.cdsresolver.model.expr;

import me.christianrobert.cdsresolver.model.Location;
import me.christianrobert.cdsresolver.model.query.Query;

public class SubQueryExpression extends Expression {
    private final Query query;

    public SubQueryExpression(Query query, Location location) {
        super(location);
        this.query = query;
    }

    public Query getQuery() { return query; }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitSubQuery(this);
    }

    @Override
    public String toString() {
        return "(subquery)";
    }
}
