package me.christianrobert.cdsresolver.model.expr;

import me.christianrobert.cdsresolver.model.query.Query;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Utilities over expression trees.
 */
public final class Expressions {

    private Expressions() {
    }

    /**
     * Deep copy.  References are copied with their settled results; sub
     * queries are shared.
     */
    public static Expression copy(Expression expr) {
        return expr == null ? null : expr.accept(COPIER);
    }

    /**
     * Returns true if {@code pathTest} holds for a path or {@code queryTest}
     * for a sub query anywhere in the expression.  Path arguments and filters
     * are not inspected.
     */
    public static boolean anyMatch(Expression expr, Predicate<PathExpression> pathTest, Predicate<Query> queryTest) {
        if (expr == null) {
            return false;
        }
        if (expr instanceof PathExpression) {
            return pathTest.test((PathExpression) expr);
        }
        if (expr instanceof SubQueryExpression) {
            return queryTest.test(((SubQueryExpression) expr).getQuery());
        }
        List<Expression> children;
        if (expr instanceof OperatorExpression) {
            children = ((OperatorExpression) expr).getArgs();
        } else if (expr instanceof FunctionCall) {
            children = ((FunctionCall) expr).getArgs();
        } else if (expr instanceof CastExpression) {
            children = List.of(((CastExpression) expr).getValue());
        } else {
            return false;
        }
        for (Expression child : children) {
            if (anyMatch(child, pathTest, queryTest)) {
                return true;
            }
        }
        return false;
    }

    /** All path expressions, in source order, not entering sub queries. */
    public static List<PathExpression> paths(Expression expr) {
        List<PathExpression> result = new ArrayList<>();
        new ExpressionWalker() {
            @Override
            public Void visitPath(PathExpression path) {
                result.add(path);
                return null;
            }
        }.walk(expr);
        return result;
    }

    private static final ExpressionVisitor<Expression> COPIER = new ExpressionVisitor<>() {
        @Override
        public Expression visitPath(PathExpression expr) {
            return new PathExpression(expr.getReference().copy(), expr.getLocation());
        }

        @Override
        public Expression visitLiteral(Literal expr) {
            switch (expr.getKind()) {
                case ARRAY:
                    List<Expression> items = new ArrayList<>();
                    expr.getItems().forEach(item -> items.add(copy(item)));
                    return Literal.array(items, expr.getLocation());
                case STRUCT:
                    Map<String, Expression> struct = new LinkedHashMap<>();
                    expr.getStruct().forEach((name, value) -> struct.put(name, copy(value)));
                    return Literal.struct(struct, expr.getLocation());
                default:
                    return expr;
            }
        }

        @Override
        public Expression visitOperator(OperatorExpression expr) {
            return new OperatorExpression(expr.getOp(), copyAll(expr.getArgs()), expr.getLocation());
        }

        @Override
        public Expression visitFunction(FunctionCall expr) {
            return new FunctionCall(expr.getName(), copyAll(expr.getArgs()), expr.getLocation());
        }

        @Override
        public Expression visitCast(CastExpression expr) {
            return new CastExpression(copy(expr.getValue()), expr.getType(), expr.getTypeArguments(), expr.getLocation());
        }

        @Override
        public Expression visitSubQuery(SubQueryExpression expr) {
            return expr;
        }
    };

    private static List<Expression> copyAll(List<Expression> args) {
        List<Expression> result = new ArrayList<>(args.size());
        for (Expression arg : args) {
            result.add(copy(arg));
        }
        return result;
    }
}
