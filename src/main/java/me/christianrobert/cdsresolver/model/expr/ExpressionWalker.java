package me.christianrobert.cdsresolver.model.expr;

/**
 * Visitor which walks into all sub expressions and returns {@code null};
 * override the node types of interest.  Sub queries are not entered.
 */
public class ExpressionWalker implements ExpressionVisitor<Void> {

    public void walk(Expression expr) {
        if (expr != null) {
            expr.accept(this);
        }
    }

    @Override
    public Void visitPath(PathExpression expr) {
        return null;
    }

    @Override
    public Void visitLiteral(Literal expr) {
        if (expr.getItems() != null) {
            expr.getItems().forEach(this::walk);
        }
        if (expr.getStruct() != null) {
            expr.getStruct().values().forEach(this::walk);
        }
        return null;
    }

    @Override
    public Void visitOperator(OperatorExpression expr) {
        expr.getArgs().forEach(this::walk);
        return null;
    }

    @Override
    public Void visitFunction(FunctionCall expr) {
        expr.getArgs().forEach(this::walk);
        return null;
    }

    @Override
    public Void visitCast(CastExpression expr) {
        walk(expr.getValue());
        return null;
    }

    @Override
    public Void visitSubQuery(SubQueryExpression expr) {
        return null;
    }
}
