package me.christianrobert.cdsresolver.builtins;

import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.LexicalBlock;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The outermost scope of value references: {@code $user}, {@code $now}, ...
 */
public class MagicVariables implements LexicalBlock {
    private final LinkedHashMap<String, Artifact> variables = new LinkedHashMap<>();

    void add(Artifact variable) {
        variables.put(variable.getName().getId(), variable);
    }

    public Artifact get(String name) {
        return variables.get(name);
    }

    @Override
    public Map<String, Artifact> getLexicalNames() {
        return Collections.unmodifiableMap(variables);
    }

    @Override
    public LexicalBlock getOuterBlock() {
        return null;
    }
}
