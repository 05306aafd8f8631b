package me.christianrobert.cdsresolver.resolve.annotation;

import me.christianrobert.cdsresolver.model.AnnotationAssignment;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.expr.Literal;
import me.christianrobert.cdsresolver.model.expr.LiteralKind;

import java.util.List;

/**
 * Reads flag annotations like {@code @cds.autoexpose} before or after the
 * layer merge.
 */
public final class AnnotationValues {

    private AnnotationValues() {
    }

    /**
     * The assignment deciding the value of {@code annoName} on {@code art}:
     * the chosen one after the merge, the last assignment of the highest
     * priority before it.
     */
    public static AnnotationAssignment effective(Artifact art, String annoName) {
        AnnotationAssignment chosen = art.getAnnotation(annoName);
        if (chosen != null) {
            return chosen;
        }
        List<AnnotationAssignment> assignments = art.getAnnotationAssignments().get(annoName);
        if (assignments == null || assignments.isEmpty()) {
            return null;
        }
        AnnotationAssignment best = null;
        for (AnnotationAssignment assignment : assignments) {
            if (best == null || assignment.getPriority().getRank() >= best.getPriority().getRank()) {
                best = assignment;
            }
        }
        return best;
    }

    /**
     * @return {@code null} if not assigned or assigned {@code null}, otherwise
     * the truthiness of the value (the short form counts as {@code true})
     */
    public static Boolean flag(Artifact art, String annoName) {
        AnnotationAssignment assignment = effective(art, annoName);
        if (assignment == null) {
            return null;
        }
        if (assignment.getValue() == null) {
            return Boolean.TRUE;
        }
        if (assignment.getValue() instanceof Literal) {
            Literal literal = (Literal) assignment.getValue();
            return literal.getKind() == LiteralKind.NULL ? null : literal.isTruthy();
        }
        return Boolean.TRUE;
    }

    public static boolean isTrue(Artifact art, String annoName) {
        return Boolean.TRUE.equals(flag(art, annoName));
    }

    public static boolean isFalse(Artifact art, String annoName) {
        return Boolean.FALSE.equals(flag(art, annoName));
    }
}
