package me.christianrobert.cdsresolver.resolve.cycle;

import me.christianrobert.cdsresolver.diagnostics.Diagnostics;
import me.christianrobert.cdsresolver.diagnostics.MessageArgs;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Dependency;
import me.christianrobert.cdsresolver.model.LinkTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Reports illegal circular references over the dependency edges collected
 * while resolving.  Every located edge inside a strongly connected component
 * with more than one node (or with a self edge) is reported as
 * {@code ref-cyclic}; silent edges only connect.
 */
public class CycleDetector {

    private static final Logger log = LoggerFactory.getLogger(CycleDetector.class);

    private final LinkTable links;
    private final Diagnostics diagnostics;

    public CycleDetector(LinkTable links, Diagnostics diagnostics) {
        this.links = links;
        this.diagnostics = diagnostics;
    }

    /**
     * @return the number of reported edges
     */
    public int detectCycles(Collection<Artifact> nodes) {
        List<List<Artifact>> components = StronglyConnectedComponents.of(nodes, this::targets);
        int reported = 0;
        int cycles = 0;
        for (List<Artifact> component : components) {
            if (component.size() == 1 && !hasSelfEdge(component.get(0))) {
                continue;
            }
            cycles++;
            Set<Artifact> members = Collections.newSetFromMap(new IdentityHashMap<>());
            members.addAll(component);
            List<Artifact> users = new ArrayList<>(component);
            users.sort(Comparator.comparingInt(Artifact::getId));
            for (Artifact user : users) {
                for (Dependency dependency : links.dependencies(user)) {
                    if (!dependency.isSilent() && members.contains(dependency.getTarget())) {
                        report(user, dependency);
                        reported++;
                    }
                }
            }
            log.warn("Circular dependency between {} nodes, starting at {}", component.size(), users.get(0));
        }
        log.debug("Checked {} dependency edges, {} cycles", links.dependencyCount(), cycles);
        return reported;
    }

    private void report(Artifact user, Dependency dependency) {
        Artifact target = dependency.getTarget();
        MessageArgs args;
        if (target.getMain() != null && target.getName().getElement() != null) {
            args = MessageArgs.of("art", target.getMain()).and("member", target.getName().getElement())
                    .variant("element");
        } else {
            args = MessageArgs.of("art", target);
        }
        diagnostics.error("ref-cyclic", dependency.getLocation(), user, args);
    }

    private Collection<Artifact> targets(Artifact user) {
        List<Dependency> dependencies = links.dependencies(user);
        if (dependencies.isEmpty()) {
            return Collections.emptyList();
        }
        List<Artifact> targets = new ArrayList<>(dependencies.size());
        for (Dependency dependency : dependencies) {
            targets.add(dependency.getTarget());
        }
        return targets;
    }

    private boolean hasSelfEdge(Artifact node) {
        for (Dependency dependency : links.dependencies(node)) {
            if (dependency.getTarget() == node) {
                return true;
            }
        }
        return false;
    }
}
