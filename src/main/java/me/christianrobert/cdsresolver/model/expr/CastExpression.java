package me.christianrobert.cdsresolver.model.expr;

import me.christianrobert.cdsresolver.model.Location;
import me.christianrobert.cdsresolver.model.Reference;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code cast(value as Type(args))}.
 */
public class CastExpression extends Expression {
    private final Expression value;
    private final Reference type;
    private final List<Expression> typeArguments;

    public CastExpression(Expression value, Reference type, List<? extends Expression> typeArguments, Location location) {
        super(location);
        this.value = value;
        this.type = type;
        this.typeArguments = typeArguments != null ? new ArrayList<>(typeArguments) : new ArrayList<>();
    }

    public Expression getValue() { return value; }
    public Reference getType() { return type; }
    public List<Expression> getTypeArguments() { return typeArguments; }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCast(this);
    }

    @Override
    public String toString() {
        return "cast(" + value + " as " + type + ")";
    }
}
