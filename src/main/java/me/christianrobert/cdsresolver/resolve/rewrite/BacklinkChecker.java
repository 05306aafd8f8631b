package me.christianrobert.cdsresolver.resolve.rewrite;

import me.christianrobert.cdsresolver.diagnostics.MessageArgs;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Kind;
import me.christianrobert.cdsresolver.model.PathStep;
import me.christianrobert.cdsresolver.model.Reference;
import me.christianrobert.cdsresolver.model.expr.Expression;
import me.christianrobert.cdsresolver.model.expr.ExpressionWalker;
import me.christianrobert.cdsresolver.model.expr.OperatorExpression;
import me.christianrobert.cdsresolver.model.expr.PathExpression;
import me.christianrobert.cdsresolver.resolve.context.ResolveContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks the backlink comparisons {@code $self = target.back} of a rewritten
 * ON condition.  The meaning of such a comparison is the ON condition of
 * {@code back} with source and target swapped; this is only supported if
 * the backlink is reached in one step and is not itself defined by a
 * backlink.
 */
class BacklinkChecker {

    private final ResolveContext ctx;

    BacklinkChecker(ResolveContext ctx) {
        this.ctx = ctx;
    }

    void checkBacklinks(Artifact elem, Expression cond) {
        for (Backlink backlink : backlinks(cond)) {
            List<PathStep> path = backlink.path.getReference().getPath();
            if (path.size() > 2) {
                ctx.diagnostics().error("rewrite-not-supported", backlink.path.getLocation(), elem,
                        MessageArgs.none());
                continue;
            }
            Artifact back = path.get(path.size() - 1).getArtifact();
            Artifact type = back != null ? ctx.types().effectiveType(back) : null;
            if (type != null && type.getOn() != null && !backlinks(type.getOn()).isEmpty()) {
                // the ON of the backlink is a backlink again: no swap possible
                ctx.diagnostics().error("rewrite-not-supported", backlink.path.getLocation(), elem,
                        MessageArgs.none());
            }
        }
    }

    /** Comparisons of a sole {@code $self} with a path through an association. */
    static List<Backlink> backlinks(Expression cond) {
        List<Backlink> found = new ArrayList<>();
        new ExpressionWalker() {
            @Override
            public Void visitOperator(OperatorExpression expr) {
                if (expr.isEquality()) {
                    Expression left = expr.getArgs().get(0);
                    Expression right = expr.getArgs().get(1);
                    if (isSelf(left) && right instanceof PathExpression && !isSelf(right)) {
                        found.add(new Backlink((PathExpression) right));
                    } else if (isSelf(right) && left instanceof PathExpression && !isSelf(left)) {
                        found.add(new Backlink((PathExpression) left));
                    }
                }
                return super.visitOperator(expr);
            }
        }.walk(cond);
        return found;
    }

    private static boolean isSelf(Expression expr) {
        if (!(expr instanceof PathExpression)) {
            return false;
        }
        Reference ref = ((PathExpression) expr).getReference();
        if (ref.getPath().size() != 1) {
            return false;
        }
        PathStep head = ref.head();
        if (head.getNavigation() != null) {
            return head.getNavigation().getKind() == Kind.SELF && "$self".equals(head.getNavigation().getName().getId());
        }
        return "$self".equals(head.getId());
    }

    static final class Backlink {
        final PathExpression path;

        Backlink(PathExpression path) {
            this.path = path;
        }
    }
}
