package me.christianrobert.cdsresolver.model.expr;

import me.christianrobert.cdsresolver.model.Location;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public class FunctionCall extends Expression {
    private final String name;
    private final List<Expression> args;

    public FunctionCall(String name, List<? extends Expression> args, Location location) {
        super(location);
        this.name = name;
        this.args = new ArrayList<>(args);
    }

    public String getName() { return name; }
    public List<Expression> getArgs() { return args; }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }

    @Override
    public String toString() {
        return name + args.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }
}
