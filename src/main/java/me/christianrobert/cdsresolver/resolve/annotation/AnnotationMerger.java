package me.christianrobert.cdsresolver.resolve.annotation;

import me.christianrobert.cdsresolver.diagnostics.MessageArgs;
import me.christianrobert.cdsresolver.model.AnnotationAssignment;
import me.christianrobert.cdsresolver.model.AnnotationPriority;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Source;
import me.christianrobert.cdsresolver.model.expr.Expression;
import me.christianrobert.cdsresolver.model.expr.Literal;
import me.christianrobert.cdsresolver.resolve.context.ResolveContext;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Chooses the value of each annotation on a node from the assignments of
 * all layers.
 *
 * <p>Assignments are grouped by layer.  Within a layer, array values with
 * {@code ...} of an {@code annotate} are merged with the defining
 * assignment.  Across layers, only layers not extended by another assigning
 * layer are candidates; of these exactly one assignment (of the highest
 * priority) is expected.  An array value of the chosen assignment containing
 * {@code ...} is completed with the values of the next candidate layers.
 */
public class AnnotationMerger {

    private static final String ELLIPSIS = "...";

    private final ResolveContext ctx;
    private int merged;

    public AnnotationMerger(ResolveContext ctx) {
        this.ctx = ctx;
    }

    public int getMergedCount() {
        return merged;
    }

    /** Chooses the values of all annotations assigned to {@code art}. */
    public void chooseAnnotations(Artifact art) {
        for (Map.Entry<String, List<AnnotationAssignment>> entry : art.getAnnotationAssignments().entrySet()) {
            AnnotationAssignment chosen = chooseAssignment(entry.getKey(), entry.getValue(), art);
            if (chosen != null) {
                art.getAnnotations().put(entry.getKey(), chosen);
            }
        }
    }

    AnnotationAssignment chooseAssignment(String annoName, List<AnnotationAssignment> assignments, Artifact art) {
        if (assignments.isEmpty()) {
            return null;
        }
        if (assignments.size() == 1) {
            AnnotationAssignment single = assignments.get(0);
            AnnotationAssignment cleaned = removeEllipsis(single);
            if (cleaned != single) {
                ctx.diagnostics().error("anno-unexpected-ellipsis", single.getLocation(), art,
                        MessageArgs.of("code", ELLIPSIS));
            }
            return cleaned;
        }
        merged++;
        Map<Source, List<AnnotationAssignment>> byLayer = new LinkedHashMap<>();
        for (AnnotationAssignment assignment : assignments) {
            byLayer.computeIfAbsent(ctx.layers().layer(assignment.getSource()), k -> new ArrayList<>())
                    .add(assignment);
        }
        mergeWithinLayers(byLayer, art);
        AnnotationAssignment chosen = layerCandidate(byLayer, annoName, art, true);
        return mergeLayeredArrays(chosen, byLayer, annoName, art);
    }

    /** Splices the defining array value into the {@code ...} of higher priority assignments of the same layer. */
    private void mergeWithinLayers(Map<Source, List<AnnotationAssignment>> byLayer, Artifact art) {
        for (List<AnnotationAssignment> annos : byLayer.values()) {
            int sourceIndex = -1;
            for (int i = 0; i < annos.size(); i++) {
                if (annos.get(i).getPriority() == AnnotationPriority.DEFINE) {
                    sourceIndex = i;
                    break;
                }
            }
            if (sourceIndex < 0) {
                continue;
            }
            AnnotationAssignment mergeSource = annos.get(sourceIndex);
            AnnotationAssignment cleaned = removeEllipsis(mergeSource);
            if (cleaned != mergeSource) {
                ctx.diagnostics().error("anno-unexpected-ellipsis", mergeSource.getLocation(), art,
                        MessageArgs.of("code", ELLIPSIS));
                annos.set(sourceIndex, cleaned);
                mergeSource = cleaned;
            }
            for (int i = 0; i < annos.size(); i++) {
                AnnotationAssignment mergeTarget = annos.get(i);
                if (mergeTarget.getPriority().getRank() <= AnnotationPriority.DEFINE.getRank()) {
                    continue;
                }
                int pos = findEllipsis(mergeTarget);
                if (pos < 0) {
                    continue;
                }
                if (!isArray(mergeSource)) {
                    ctx.diagnostics().error("anno-mismatched-ellipsis", mergeSource.getLocation(), art,
                            MessageArgs.of("code", ELLIPSIS));
                    return;
                }
                annos.set(i, splice(mergeTarget, pos, mergeSource));
            }
        }
    }

    private AnnotationAssignment mergeLayeredArrays(AnnotationAssignment mergeTarget,
                                                    Map<Source, List<AnnotationAssignment>> byLayer,
                                                    String annoName, Artifact art) {
        if (!isArray(mergeTarget)) {
            return mergeTarget;
        }
        Map<Source, List<AnnotationAssignment>> remaining = new LinkedHashMap<>(byLayer);
        remaining.remove(ctx.layers().layer(mergeTarget.getSource()));
        AnnotationAssignment result = mergeTarget;
        int pos = findEllipsis(result);
        while (pos >= 0 && !remaining.isEmpty()) {
            AnnotationAssignment mergeSource = layerCandidate(remaining, annoName, art, false);
            if (!isArray(mergeSource)) {
                ctx.diagnostics().error("anno-mismatched-ellipsis", mergeSource.getLocation(), art,
                        MessageArgs.of("code", ELLIPSIS));
                return result;
            }
            result = splice(result, pos, mergeSource);
            remaining.remove(ctx.layers().layer(mergeSource.getSource()));
            pos = findEllipsis(result);
        }
        // excess ellipsis without lower layer
        return removeEllipsis(result);
    }

    /**
     * The assignment of the layers no other assigning layer extends; reports
     * duplicates if there is more than one.
     */
    private AnnotationAssignment layerCandidate(Map<Source, List<AnnotationAssignment>> byLayer,
                                               String annoName, Artifact art, boolean report) {
        Set<Source> allExtended = new HashSet<>();
        for (Source layer : byLayer.keySet()) {
            allExtended.addAll(ctx.layers().extendedLayers(layer));
        }
        List<List<AnnotationAssignment>> collected = new ArrayList<>();
        for (Map.Entry<Source, List<AnnotationAssignment>> entry : byLayer.entrySet()) {
            if (entry.getKey() == null || !allExtended.contains(entry.getKey())) {
                collected.add(prioritized(entry.getValue()));
            }
        }
        if (collected.isEmpty()) {
            // every layer extended by another: only possible with cyclic layers
            collected.add(prioritized(byLayer.values().iterator().next()));
        }
        boolean justOnePerLayer = collected.stream().allMatch(annos -> annos.size() == 1);
        if (report && (!justOnePerLayer || collected.size() > 1)) {
            String id = justOnePerLayer ? "anno-duplicate-unrelated-layer" : "anno-duplicate";
            for (List<AnnotationAssignment> annos : collected) {
                for (AnnotationAssignment a : annos) {
                    ctx.diagnostics().message(id, a.getLocation(), art, MessageArgs.of("anno", annoName));
                }
            }
        }
        return collected.get(0).get(0);
    }

    /** The assignments with the highest priority. */
    private static List<AnnotationAssignment> prioritized(List<AnnotationAssignment> annos) {
        int prio = 0;
        List<AnnotationAssignment> result = new ArrayList<>();
        for (AnnotationAssignment a : annos) {
            int p = a.getPriority().getRank();
            if (p == prio) {
                result.add(a);
            } else if (p > prio) {
                result = new ArrayList<>();
                result.add(a);
                prio = p;
            }
        }
        return result;
    }

    private static boolean isArray(AnnotationAssignment a) {
        return a.getValue() instanceof Literal && ((Literal) a.getValue()).isArray();
    }

    private static int findEllipsis(AnnotationAssignment a) {
        if (!isArray(a)) {
            return -1;
        }
        List<Expression> items = ((Literal) a.getValue()).getItems();
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) instanceof Literal && ((Literal) items.get(i)).isEllipsis()) {
                return i;
            }
        }
        return -1;
    }

    /** Copy of {@code target} with the item at {@code pos} replaced by the items of {@code source}. */
    private static AnnotationAssignment splice(AnnotationAssignment target, int pos, AnnotationAssignment source) {
        Literal array = (Literal) target.getValue();
        List<Expression> items = new ArrayList<>(array.getItems().subList(0, pos));
        items.addAll(((Literal) source.getValue()).getItems());
        items.addAll(array.getItems().subList(pos + 1, array.getItems().size()));
        return target.withValue(Literal.array(items, array.getLocation()));
    }

    /** Copy without {@code ...} items, or {@code a} itself if there are none. */
    private static AnnotationAssignment removeEllipsis(AnnotationAssignment a) {
        if (findEllipsis(a) < 0) {
            return a;
        }
        Literal array = (Literal) a.getValue();
        List<Expression> items = new ArrayList<>();
        for (Expression item : array.getItems()) {
            if (!(item instanceof Literal && ((Literal) item).isEllipsis())) {
                items.add(item);
            }
        }
        return a.withValue(Literal.array(items, array.getLocation()));
    }
}
