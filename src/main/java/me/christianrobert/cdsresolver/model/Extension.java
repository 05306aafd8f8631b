package me.christianrobert.cdsresolver.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * An {@code annotate} or {@code extend} statement, possibly with nested
 * member extensions.
 */
public class Extension {

    public enum ExtensionKind { ANNOTATE, EXTEND }

    private final ExtensionKind extensionKind;
    private final Reference name;
    private final Location location;
    private Source source;
    private final List<AnnotationAssignment> annotations = new ArrayList<>();
    private final LinkedHashMap<String, Extension> elements = new LinkedHashMap<>();
    private final LinkedHashMap<String, Extension> actions = new LinkedHashMap<>();
    private final LinkedHashMap<String, Extension> params = new LinkedHashMap<>();
    private boolean applied;

    public Extension(ExtensionKind extensionKind, Reference name, Location location) {
        this.extensionKind = extensionKind;
        this.name = name;
        this.location = location;
    }

    public ExtensionKind getExtensionKind() { return extensionKind; }
    public Reference getName() { return name; }
    public Location getLocation() { return location; }
    public Source getSource() { return source; }
    public List<AnnotationAssignment> getAnnotations() { return annotations; }
    public LinkedHashMap<String, Extension> getElements() { return elements; }
    public LinkedHashMap<String, Extension> getActions() { return actions; }
    public LinkedHashMap<String, Extension> getParams() { return params; }
    public boolean isApplied() { return applied; }

    public void setSource(Source source) { this.source = source; }
    public void setApplied(boolean applied) { this.applied = applied; }

    public AnnotationPriority priority() {
        return extensionKind == ExtensionKind.EXTEND ? AnnotationPriority.EXTEND : AnnotationPriority.ANNOTATE;
    }

    @Override
    public String toString() {
        return extensionKind.name().toLowerCase() + " " + name;
    }
}
