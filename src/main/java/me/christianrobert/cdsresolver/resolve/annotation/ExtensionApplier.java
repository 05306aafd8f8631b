package me.christianrobert.cdsresolver.resolve.annotation;

import me.christianrobert.cdsresolver.diagnostics.MessageArgs;
import me.christianrobert.cdsresolver.model.AnnotationAssignment;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Extension;
import me.christianrobert.cdsresolver.model.Kind;
import me.christianrobert.cdsresolver.model.Members;
import me.christianrobert.cdsresolver.model.PathStep;
import me.christianrobert.cdsresolver.model.Reference;
import me.christianrobert.cdsresolver.resolve.context.ResolveContext;
import me.christianrobert.cdsresolver.resolve.path.ResolutionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies {@code annotate} and {@code extend} statements: their annotation
 * assignments are added to the annotated node with the priority of the
 * statement and its source as layer.
 *
 * <p>Artifacts are looked up before the queries are populated, so that
 * annotations like {@code @cds.autoexpose} take effect there.  Extensions of
 * members are applied when the member's parent is resolved, as query and
 * included elements only exist then.  Extensions of artifacts which do not
 * exist early (autoexposed entities) are applied at the end.
 */
public class ExtensionApplier {

    private static final Logger log = LoggerFactory.getLogger(ExtensionApplier.class);

    private final ResolveContext ctx;
    private final Map<Artifact, List<Extension>> memberExtensions = new IdentityHashMap<>();
    private final Map<Extension, Artifact> holders = new IdentityHashMap<>();
    private final List<Extension> late = new ArrayList<>();
    private int applied;

    public ExtensionApplier(ResolveContext ctx) {
        this.ctx = ctx;
    }

    public int getAppliedCount() {
        return applied;
    }

    /** Applies the extensions of existing artifacts; the others are kept for {@link #lateExtensions()}. */
    public void applyExtensions() {
        for (Extension ext : ctx.model().getExtensions()) {
            Reference lookup = new Reference(freshSteps(ext.getName()), ext.getName().getLocation());
            lookup.setScope(ext.getName().getScope());
            Artifact art = ctx.paths().resolve(lookup, ResolutionPolicy.EXTEND, holder(ext));
            if (art != null) {
                ext.getName().getCell().bind(art);
                apply(ext, art);
            } else {
                late.add(ext);
            }
        }
        log.debug("Applied {} extensions early, {} postponed", applied, late.size());
    }

    /**
     * Applies the remaining extensions; unknown artifacts are reported now.
     * The annotations of the annotated nodes are chosen again.
     */
    public void lateExtensions() {
        for (Extension ext : late) {
            Artifact art = ctx.paths().resolve(ext.getName(), ResolutionPolicy.ANNOTATE, holder(ext));
            if (art != null) {
                apply(ext, art);
                annotateTree(art);
                log.debug("Late extension {} applied to {}", ext, art.getName().getAbsolute());
            }
        }
        late.clear();
    }

    /** Applies the pending member extensions of {@code art} to its direct members. */
    public void annotateMembers(Artifact art) {
        List<Extension> extensions = memberExtensions.remove(art);
        if (extensions == null) {
            return;
        }
        for (Extension ext : extensions) {
            Artifact obj = art;
            while (obj.getItems() != null) {
                obj = obj.getItems();
            }
            Map<String, Artifact> elements = new LinkedHashMap<>();
            if (obj.getElements() != null) {
                elements.putAll(obj.getElements());
            }
            if (obj.getEnumValues() != null) {
                elements.putAll(obj.getEnumValues());
            }
            applyMembers(ext.getElements(), elements, art, "anno-undefined-element", "element");
            applyMembers(ext.getActions(), nonNull(art.getActions()), art, "anno-undefined-action", "action");
            applyMembers(ext.getParams(), nonNull(art.getParams()), art, "anno-undefined-param", "param");
        }
    }

    private void applyMembers(Map<String, Extension> extensions, Map<String, Artifact> dict, Artifact art,
                              String msgId, String variant) {
        for (Map.Entry<String, Extension> entry : extensions.entrySet()) {
            Extension ext = entry.getValue();
            Artifact member = dict.get(entry.getKey());
            if (member == null) {
                ctx.diagnostics().signalNotFound(msgId, ext.getLocation(), art,
                        MessageArgs.of("art", art).and("member", entry.getKey()).variant(variant),
                        dict.keySet());
                continue;
            }
            if (!ext.getName().getCell().isSettled()) {
                ext.getName().getCell().bind(member);
            }
            apply(ext, member);
        }
    }

    private void apply(Extension ext, Artifact art) {
        for (AnnotationAssignment assignment : ext.getAnnotations()) {
            assignment.setSource(ext.getSource());
            assignment.setPriority(ext.priority());
            art.addAnnotationAssignment(assignment);
        }
        if (!ext.getElements().isEmpty() || !ext.getActions().isEmpty() || !ext.getParams().isEmpty()) {
            for (Extension member : ext.getElements().values()) {
                inheritSource(member, ext);
            }
            for (Extension member : ext.getActions().values()) {
                inheritSource(member, ext);
            }
            for (Extension member : ext.getParams().values()) {
                inheritSource(member, ext);
            }
            memberExtensions.computeIfAbsent(art, k -> new ArrayList<>()).add(ext);
        }
        ext.setApplied(true);
        applied++;
    }

    /** Member extensions of a node whose members have been resolved already. */
    private void annotateTree(Artifact art) {
        annotateMembers(art);
        ctx.annotations().chooseAnnotations(art);
        Members.forEachMember(art, this::annotateTree);
    }

    private Artifact holder(Extension ext) {
        return holders.computeIfAbsent(ext, e -> {
            Artifact holder = Artifact.definition(Kind.ANNOTATE, e.getName().pathName(), e.getLocation());
            holder.setBlock(e.getSource() != null ? e.getSource() : ctx.model().getInternalSource());
            return holder;
        });
    }

    private static void inheritSource(Extension member, Extension parent) {
        if (member.getSource() == null) {
            member.setSource(parent.getSource());
        }
    }

    private static List<PathStep> freshSteps(Reference ref) {
        List<PathStep> steps = new ArrayList<>();
        for (PathStep step : ref.getPath()) {
            steps.add(new PathStep(step.getId(), step.getLocation()));
        }
        return steps;
    }

    private static Map<String, Artifact> nonNull(Map<String, Artifact> dict) {
        return dict != null ? dict : Collections.emptyMap();
    }
}
