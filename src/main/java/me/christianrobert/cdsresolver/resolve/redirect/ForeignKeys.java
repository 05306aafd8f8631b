package me.christianrobert.cdsresolver.resolve.redirect;

import me.christianrobert.cdsresolver.diagnostics.MessageArgs;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Inferred;
import me.christianrobert.cdsresolver.model.Kind;
import me.christianrobert.cdsresolver.model.Location;
import me.christianrobert.cdsresolver.model.Members;
import me.christianrobert.cdsresolver.model.Name;
import me.christianrobert.cdsresolver.model.PathStep;
import me.christianrobert.cdsresolver.model.Reference;
import me.christianrobert.cdsresolver.resolve.context.ResolveContext;
import me.christianrobert.cdsresolver.resolve.path.Environment;
import me.christianrobert.cdsresolver.resolve.path.ResolutionPolicy;

import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Foreign keys of managed associations: implicit keys for associations
 * without explicit ones, resolution of explicit keys against the target and
 * the navigation tree used when a path follows a managed association.
 */
public class ForeignKeys {

    private final ResolveContext ctx;

    private final Map<Artifact, KeysNavigation> navigations = new IdentityHashMap<>();

    public ForeignKeys(ResolveContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Creates a foreign key for every key element of {@code target}; the
     * keys are owned by {@code obj}, their names are relative to {@code art}.
     */
    public void addImplicitForeignKeys(Artifact art, Artifact obj, Artifact target) {
        LinkedHashMap<String, Artifact> foreignKeys = new LinkedHashMap<>();
        obj.setForeignKeys(foreignKeys);
        if (target.getElements() == null) {
            return;
        }
        Location location = art.getTarget() != null ? art.getTarget().getLocation() : art.getLocation();
        for (Map.Entry<String, Artifact> entry : target.getElements().entrySet()) {
            Artifact elem = entry.getValue();
            if (!elem.isKey()) {
                continue;
            }
            String name = entry.getKey();
            Name keyName = new Name(name, location);
            keyName.setInferred(true);
            Artifact key = new Artifact(Kind.KEY, keyName, location);
            key.setInferred(Inferred.KEYS);
            Reference targetElement = new Reference(List.of(new PathStep(name, location, elem)), location);
            targetElement.getCell().bind(elem);
            key.setTargetElement(targetElement);
            Members.setMemberParent(key, name, art, foreignKeys);
            ctx.model().register(key);
            ctx.effectiveTypes().done(key, ctx.types().effectiveType(elem));
            ctx.links().dependsOn(key, elem, location);
            ctx.links().dependsOnSilent(art, key);
        }
    }

    /** Resolves the target elements of explicit foreign keys. */
    public void resolveExplicitKeys(Artifact art, Artifact obj, Artifact target) {
        if (obj.getForeignKeys() == null || target == null) {
            return;
        }
        Environment env = Environment.of(ctx.paths().environment(target));
        for (Artifact key : obj.getForeignKeys().values()) {
            if (key.getTargetElement() != null && key.getInferred() == null) {
                ctx.paths().resolve(key.getTargetElement(), ResolutionPolicy.TARGET_ELEMENT, key, env);
                ctx.links().dependsOnSilent(art, key);
            }
        }
    }

    /**
     * The navigation tree of the foreign keys of a managed association; the
     * leaves carry the foreign key.  Computed once per association.
     */
    public KeysNavigation keysNavigation(Artifact assoc) {
        KeysNavigation known = navigations.get(assoc);
        if (known != null) {
            return known;
        }
        KeysNavigation root = new KeysNavigation(null);
        navigations.put(assoc, root);
        if (assoc.getForeignKeys() == null) {
            return root;
        }
        for (Artifact key : assoc.getForeignKeys().values()) {
            Reference targetElement = key.getTargetElement();
            if (targetElement == null || targetElement.getPath().isEmpty()) {
                continue;
            }
            addKeyNavigation(root, key, targetElement.getPath());
        }
        return root;
    }

    private void addKeyNavigation(KeysNavigation root, Artifact key, List<PathStep> path) {
        KeysNavigation dict = root;
        PathStep last = path.get(path.size() - 1);
        for (PathStep item : path) {
            KeysNavigation nav = dict.get(item.getId());
            if (nav == null) {
                nav = new KeysNavigation(item == last ? key : null);
                dict.children.put(item.getId(), nav);
            } else if (item == last || nav.getKey() != null) {
                ctx.diagnostics().error("duplicate-key-ref", item.getLocation(), key, MessageArgs.none());
                return;
            }
            dict = nav;
        }
    }

    /**
     * Node of the foreign key navigation tree: either a leaf with the foreign
     * key or an inner node for a structured target element.
     */
    public static class KeysNavigation {
        private final Artifact key;
        private final Map<String, KeysNavigation> children = new LinkedHashMap<>();

        KeysNavigation(Artifact key) {
            this.key = key;
        }

        public KeysNavigation get(String id) {
            return children.get(id);
        }

        public Artifact getKey() {
            return key;
        }

        public boolean isEmpty() {
            return children.isEmpty();
        }
    }
}
