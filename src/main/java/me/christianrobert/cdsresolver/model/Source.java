package me.christianrobert.cdsresolver.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed source file: the outermost lexical block of its definitions and
 * one layer for annotation merging.
 */
public class Source implements LexicalBlock {
    private final String realname;
    private String namespace;
    private final LinkedHashMap<String, Artifact> artifacts = new LinkedHashMap<>();
    private final List<Using> usings = new ArrayList<>();
    private final List<Artifact> definitions = new ArrayList<>();
    private final List<Extension> extensions = new ArrayList<>();
    private final List<Source> dependencies = new ArrayList<>();

    public Source(String realname) {
        this.realname = realname;
    }

    @Override
    public Map<String, Artifact> getLexicalNames() {
        return Collections.unmodifiableMap(artifacts);
    }

    @Override
    public LexicalBlock getOuterBlock() {
        return null;
    }

    public String getRealname() { return realname; }
    public String getNamespace() { return namespace; }
    public LinkedHashMap<String, Artifact> getArtifacts() { return artifacts; }
    public List<Using> getUsings() { return usings; }
    public List<Artifact> getDefinitions() { return definitions; }
    public List<Extension> getExtensions() { return extensions; }
    public List<Source> getDependencies() { return dependencies; }

    public void setNamespace(String namespace) { this.namespace = namespace; }

    public void addDependency(Source source) {
        if (source != this && !dependencies.contains(source)) {
            dependencies.add(source);
        }
    }

    @Override
    public String toString() {
        return "Source{" + realname + "}";
    }
}
