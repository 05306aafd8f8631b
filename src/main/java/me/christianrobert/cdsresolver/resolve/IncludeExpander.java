package me.christianrobert.cdsresolver.resolve;

import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Inferred;
import me.christianrobert.cdsresolver.model.Members;
import me.christianrobert.cdsresolver.model.Reference;
import me.christianrobert.cdsresolver.resolve.context.NodeStatus;
import me.christianrobert.cdsresolver.resolve.context.ResolveContext;
import me.christianrobert.cdsresolver.resolve.context.StatusTable;
import me.christianrobert.cdsresolver.resolve.path.ResolutionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Copies the elements and actions of included structures into the including
 * definition ({@code entity E : Base { ... }}).  Included members come first,
 * in include order; an own member of the same name replaces the included one.
 */
public class IncludeExpander {

    private static final Logger log = LoggerFactory.getLogger(IncludeExpander.class);

    private final ResolveContext ctx;
    private final StatusTable<Boolean> expanded = new StatusTable<>("include expansion");
    private int includedCount;

    public IncludeExpander(ResolveContext ctx) {
        this.ctx = ctx;
    }

    public int expandAll() {
        for (Artifact art : new ArrayList<>(ctx.model().getDefinitions().values())) {
            expand(art);
        }
        log.debug("Included {} members", includedCount);
        return includedCount;
    }

    /** Expands the includes of {@code art} after those of the included structures. */
    public void expand(Artifact art) {
        if (art.getIncludes() == null || art.getIncludes().isEmpty()) {
            return;
        }
        NodeStatus status = expanded.status(art);
        if (status == NodeStatus.IN_PROGRESS) {
            // include cycle, reported with the dependencies
            expanded.poison(art);
            return;
        }
        if (status != NodeStatus.UNVISITED) {
            return;
        }
        expanded.begin(art);
        for (Reference include : art.getIncludes()) {
            Artifact struct = ctx.paths().resolve(include, ResolutionPolicy.INCLUDE, art);
            if (struct != null) {
                expand(struct);
            }
        }
        if (expanded.status(art) == NodeStatus.POISONED) {
            return;
        }
        LinkedHashMap<String, Artifact> elements = includeMembers(art, art.getElements(), true);
        if (elements != null) {
            art.setElements(elements);
        }
        LinkedHashMap<String, Artifact> actions = includeMembers(art, art.getActions(), false);
        if (actions != null) {
            art.setActions(actions);
        }
        expanded.done(art, Boolean.TRUE);
    }

    private LinkedHashMap<String, Artifact> includeMembers(Artifact art, Map<String, Artifact> own,
                                                          boolean elements) {
        LinkedHashMap<String, Artifact> members = new LinkedHashMap<>();
        boolean any = false;
        for (Reference include : art.getIncludes()) {
            Artifact template = include.getArtifact();
            Map<String, Artifact> dict = template == null ? null
                    : elements ? template.getElements() : template.getActions();
            if (dict == null) {
                continue;
            }
            for (Map.Entry<String, Artifact> entry : dict.entrySet()) {
                String name = entry.getKey();
                if (own != null && own.containsKey(name) || members.containsKey(name)) {
                    continue;
                }
                Artifact origin = entry.getValue();
                Artifact member = Members.linkToOrigin(ctx.model(), origin, name, art, members,
                        include.getLocation().weak(), true);
                member.setInferred(Inferred.INCLUDE);
                member.setKey(origin.getKey());
                member.setKeyInferred(origin.getKey() != null);
                member.setMasked(origin.getMasked());
                includedCount++;
                any = true;
            }
        }
        if (!any) {
            return null;
        }
        if (own != null) {
            members.putAll(own);
        }
        return members;
    }
}
