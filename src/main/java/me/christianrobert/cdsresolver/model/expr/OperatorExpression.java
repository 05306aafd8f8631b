package me.christianrobert.cdsresolver.model.expr;

import me.christianrobert.cdsresolver.model.Location;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Operator application: comparisons, {@code and}/{@code or}/{@code not},
 * {@code exists}, arithmetic and the like.
 */
public class OperatorExpression extends Expression {
    private final String op;
    private final List<Expression> args;

    public OperatorExpression(String op, List<? extends Expression> args, Location location) {
        super(location);
        this.op = op;
        this.args = new ArrayList<>(args);
    }

    public String getOp() { return op; }
    public List<Expression> getArgs() { return args; }

    public boolean isEquality() {
        return "=".equals(op) && args.size() == 2;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitOperator(this);
    }

    @Override
    public String toString() {
        if (args.size() == 2) {
            return "(" + args.get(0) + " " + op + " " + args.get(1) + ")";
        }
        return op + args.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }
}
