package me.christianrobert.cdsresolver.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Side tables for the non-owning links between nodes.  The node tree itself
 * only holds ownership (parent/main); every other graph edge lives here.
 */
public class LinkTable {
    private final Map<Artifact, Artifact> origins = new IdentityHashMap<>();
    private final Map<Artifact, List<Artifact>> projections = new IdentityHashMap<>();
    private final Map<Artifact, Artifact> services = new IdentityHashMap<>();
    private final Map<Artifact, List<Artifact>> ancestors = new IdentityHashMap<>();
    private final Map<Artifact, Map<String, List<Artifact>>> descendants = new IdentityHashMap<>();
    private final Map<Artifact, List<Artifact>> redirected = new IdentityHashMap<>();
    private final Map<Artifact, List<Dependency>> dependencies = new IdentityHashMap<>();

    // Origin: the node a derived node was inferred from; null is a valid, settled value

    public boolean hasOrigin(Artifact node) { return origins.containsKey(node); }
    public Artifact origin(Artifact node) { return origins.get(node); }
    public Artifact setOrigin(Artifact node, Artifact origin) {
        origins.put(node, origin);
        return origin;
    }

    // Projections: query elements projecting a navigation element of a table alias

    public List<Artifact> projections(Artifact navElement) {
        return projections.getOrDefault(navElement, Collections.emptyList());
    }
    public void addProjection(Artifact navElement, Artifact queryElement) {
        projections.computeIfAbsent(navElement, k -> new ArrayList<>()).add(queryElement);
    }

    // Service a definition is (directly or indirectly) defined in

    public Artifact service(Artifact definition) { return services.get(definition); }
    public void setService(Artifact definition, Artifact service) { services.put(definition, service); }

    // Projection lineage

    public boolean hasAncestors(Artifact entity) { return ancestors.containsKey(entity); }
    public List<Artifact> ancestors(Artifact entity) { return ancestors.get(entity); }
    public void setAncestors(Artifact entity, List<Artifact> list) { ancestors.put(entity, list); }

    public List<Artifact> descendants(Artifact entity, String serviceName) {
        Map<String, List<Artifact>> perService = descendants.get(entity);
        return perService != null ? perService.getOrDefault(serviceName, Collections.emptyList()) : Collections.emptyList();
    }
    public boolean hasDescendants(Artifact entity, String serviceName) {
        Map<String, List<Artifact>> perService = descendants.get(entity);
        return perService != null && perService.containsKey(serviceName);
    }
    public void addDescendant(Artifact entity, String serviceName, Artifact projection) {
        descendants.computeIfAbsent(entity, k -> new LinkedHashMap<>())
                .computeIfAbsent(serviceName, k -> new ArrayList<>())
                .add(projection);
    }

    // Redirection chains (intermediate views from original to new target)

    public List<Artifact> redirected(Artifact element) { return redirected.get(element); }
    public boolean isRedirected(Artifact element) { return redirected.containsKey(element); }
    public void setRedirected(Artifact element, List<Artifact> chain) { redirected.put(element, chain); }

    // Dependencies for cycle detection

    public List<Dependency> dependencies(Artifact user) {
        return dependencies.getOrDefault(user, Collections.emptyList());
    }
    public void dependsOn(Artifact user, Artifact target, Location location) {
        dependencies.computeIfAbsent(user, k -> new ArrayList<>()).add(new Dependency(target, location));
    }
    public void dependsOnSilent(Artifact user, Artifact target) {
        dependsOn(user, target, null);
    }
    public int dependencyCount() {
        return dependencies.values().stream().mapToInt(List::size).sum();
    }
}
