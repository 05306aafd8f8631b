package me.christianrobert.cdsresolver.resolve.path;

import me.christianrobert.cdsresolver.model.Artifact;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A search environment for one name lookup: a plain dictionary (artifacts,
 * elements) or a multiset dictionary where a name may denote several
 * candidates (the combined elements of all query sources).
 */
public final class Environment {

    public static final Environment EMPTY = new Environment(Collections.emptyMap(), null, false);

    private final Map<String, Artifact> single;
    private final Map<String, List<Artifact>> multi;
    private final boolean definitions;

    private Environment(Map<String, Artifact> single, Map<String, List<Artifact>> multi, boolean definitions) {
        this.single = single;
        this.multi = multi;
        this.definitions = definitions;
    }

    public static Environment of(Map<String, Artifact> dict) {
        return dict != null ? new Environment(dict, null, false) : EMPTY;
    }

    public static Environment combined(Map<String, List<Artifact>> dict) {
        return dict != null ? new Environment(null, dict, false) : EMPTY;
    }

    /** The model definitions: names are absolute, only top-level names are offered as valid. */
    public static Environment definitions(Map<String, Artifact> dict) {
        return new Environment(dict, null, true);
    }

    /** Candidates for {@code id}: empty, one, or several for an ambiguous name. */
    public List<Artifact> lookup(String id) {
        if (multi != null) {
            List<Artifact> found = multi.get(id);
            return found != null ? found : Collections.emptyList();
        }
        Artifact found = single.get(id);
        return found != null ? List.of(found) : Collections.emptyList();
    }

    public Artifact get(String id) {
        List<Artifact> found = lookup(id);
        return found.size() == 1 ? found.get(0) : null;
    }

    public boolean isDefinitions() {
        return definitions;
    }

    public boolean isEmpty() {
        return multi != null ? multi.isEmpty() : single.isEmpty();
    }

    /**
     * Names to offer as valid alternatives: ambiguous source elements are
     * left out (a table alias is needed for them), for the definitions only
     * undotted names are offered.
     */
    public Set<String> validNames(boolean withDollar) {
        Set<String> names = new LinkedHashSet<>();
        if (multi != null) {
            multi.forEach((name, found) -> {
                if (found.size() == 1) {
                    names.add(name);
                }
            });
        } else if (definitions) {
            for (String name : single.keySet()) {
                if (!name.contains(".") && (withDollar || !name.startsWith("$"))) {
                    names.add(name);
                }
            }
        } else {
            names.addAll(single.keySet());
        }
        return names;
    }

    @Override
    public String toString() {
        return "Environment{" + (multi != null ? multi.keySet() : single.keySet()) + "}";
    }
}
