package me.christianrobert.cdsresolver.model.expr;

/**
 * Visitor over the expression node types.
 *
 * @param <R> result type
 */
public interface ExpressionVisitor<R> {

    R visitPath(PathExpression expr);

    R visitLiteral(Literal expr);

    R visitOperator(OperatorExpression expr);

    R visitFunction(FunctionCall expr);

    R visitCast(CastExpression expr);

    R visitSubQuery(SubQueryExpression expr);
}
