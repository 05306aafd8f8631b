package me.christianrobert.cdsresolver.model;

import me.christianrobert.cdsresolver.builtins.BuiltinCatalog;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * The whole program: definitions by absolute name, the sources they come
 * from, the builtin environment and all side tables.  Resolution mutates the
 * model in place; definitions are added (autoexposure) but never removed.
 */
public class Model {
    private final LinkedHashMap<String, Artifact> definitions = new LinkedHashMap<>();
    private final List<Source> sources = new ArrayList<>();
    private final List<Extension> extensions = new ArrayList<>();
    private final BuiltinCatalog builtins;
    private final LinkTable links = new LinkTable();
    private final Source internalSource = new Source("<internal>");

    // Arena of all registered nodes; index = Artifact.getId()
    private final List<Artifact> nodes = new ArrayList<>();

    // Populated views in the order they were populated
    private final List<Artifact> entities = new ArrayList<>();
    private final Set<Artifact> populated = new HashSet<>();
    private final Set<String> compositionTargets = new HashSet<>();
    private boolean linked;

    public Model() {
        this(BuiltinCatalog.create());
    }

    public Model(BuiltinCatalog builtins) {
        this.builtins = builtins;
        builtins.getDefinitions().values().forEach(this::addDefinition);
    }

    /** Adds a node to the arena; idempotent. */
    public Artifact register(Artifact node) {
        if (node.getId() < 0) {
            node.setId(nodes.size());
            nodes.add(node);
        }
        return node;
    }

    public Artifact getDefinition(String absolute) {
        return definitions.get(absolute);
    }

    public void addDefinition(Artifact definition) {
        definitions.put(definition.getName().getAbsolute(), definition);
        register(definition);
    }

    /** Records a view as populated; returns false if it already was. */
    public boolean addEntity(Artifact view) {
        if (populated.add(view)) {
            entities.add(view);
            return true;
        }
        return false;
    }

    public LinkedHashMap<String, Artifact> getDefinitions() { return definitions; }
    public List<Source> getSources() { return sources; }
    public List<Extension> getExtensions() { return extensions; }
    public BuiltinCatalog getBuiltins() { return builtins; }
    public LinkTable getLinks() { return links; }
    public Source getInternalSource() { return internalSource; }
    public List<Artifact> getNodes() { return nodes; }
    public List<Artifact> getEntities() { return entities; }
    public Set<String> getCompositionTargets() { return compositionTargets; }
    public boolean isLinked() { return linked; }
    public void setLinked(boolean linked) { this.linked = linked; }
}
