package me.christianrobert.cdsresolver.builtins;

import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Kind;
import me.christianrobert.cdsresolver.model.Location;
import me.christianrobert.cdsresolver.model.Name;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static builtin environment: the {@code cds} and {@code cds.hana}
 * namespaces with their types, the short names usable without {@code using},
 * and the magic variables.
 */
public class BuiltinCatalog {
    public static final String ASSOCIATION = "cds.Association";
    public static final String COMPOSITION = "cds.Composition";

    private static final Location BUILTIN_LOCATION = new Location("<built-in>", 0, 0);

    private final LinkedHashMap<String, Artifact> definitions = new LinkedHashMap<>();
    private final LinkedHashMap<String, Artifact> shortNames = new LinkedHashMap<>();
    private final MagicVariables magicVariables = new MagicVariables();

    private BuiltinCatalog() {
    }

    public static BuiltinCatalog create() {
        BuiltinCatalog catalog = new BuiltinCatalog();
        Artifact cds = catalog.namespace("cds");
        catalog.shortNames.put("cds", cds);
        catalog.type(cds, "String", BuiltinCategory.STRING, List.of("length"), false);
        catalog.type(cds, "LargeString", BuiltinCategory.STRING, null, false);
        catalog.type(cds, "Binary", BuiltinCategory.BINARY, List.of("length"), false);
        catalog.type(cds, "LargeBinary", BuiltinCategory.BINARY, null, false);
        catalog.type(cds, "Decimal", BuiltinCategory.DECIMAL, List.of("precision", "scale"), false);
        catalog.type(cds, "Integer64", BuiltinCategory.INTEGER, null, false);
        catalog.type(cds, "Integer", BuiltinCategory.INTEGER, null, false);
        catalog.type(cds, "Double", BuiltinCategory.DECIMAL, null, false);
        catalog.type(cds, "Date", BuiltinCategory.DATE_TIME, null, false);
        catalog.type(cds, "Time", BuiltinCategory.DATE_TIME, null, false);
        catalog.type(cds, "DateTime", BuiltinCategory.DATE_TIME, null, false);
        catalog.type(cds, "Timestamp", BuiltinCategory.DATE_TIME, null, false);
        catalog.type(cds, "Boolean", BuiltinCategory.BOOLEAN, null, false);
        catalog.type(cds, "UUID", BuiltinCategory.STRING, null, false);
        catalog.type(cds, "Association", BuiltinCategory.RELATION, null, true);
        catalog.type(cds, "Composition", BuiltinCategory.RELATION, null, true);

        Artifact hana = catalog.namespace("cds.hana");
        cds.ensureArtifacts().put("hana", hana);
        catalog.shortNames.put("hana", hana);
        catalog.type(hana, "SMALLINT", BuiltinCategory.INTEGER, null, false);
        catalog.type(hana, "TINYINT", BuiltinCategory.INTEGER, null, false);
        catalog.type(hana, "SMALLDECIMAL", BuiltinCategory.DECIMAL, null, false);
        catalog.type(hana, "REAL", BuiltinCategory.DECIMAL, null, false);
        catalog.type(hana, "CHAR", BuiltinCategory.STRING, List.of("length"), false);
        catalog.type(hana, "NCHAR", BuiltinCategory.STRING, List.of("length"), false);
        catalog.type(hana, "VARCHAR", BuiltinCategory.STRING, List.of("length"), false);
        catalog.type(hana, "CLOB", BuiltinCategory.STRING, null, false);
        catalog.type(hana, "BINARY", BuiltinCategory.BINARY, List.of("length"), false);
        catalog.type(hana, "ST_POINT", BuiltinCategory.GEO, List.of("srid"), false);
        catalog.type(hana, "ST_GEOMETRY", BuiltinCategory.GEO, List.of("srid"), false);

        catalog.magic("$user", List.of("id", "locale"), true, "id");
        catalog.magic("$at", List.of("from", "to"), false, null);
        catalog.magic("$now", null, false, null);
        catalog.magic("$session", null, true, null);
        return catalog;
    }

    private Artifact namespace(String absolute) {
        Artifact ns = Artifact.definition(Kind.NAMESPACE, absolute, BUILTIN_LOCATION);
        ns.setBuiltin(true);
        ns.ensureArtifacts();
        definitions.put(absolute, ns);
        return ns;
    }

    private void type(Artifact namespace, String id, BuiltinCategory category, List<String> parameters, boolean internal) {
        String absolute = namespace.getName().getAbsolute() + "." + id;
        Artifact type = Artifact.definition(Kind.TYPE, absolute, BUILTIN_LOCATION);
        type.setBuiltin(true);
        type.setCategory(category);
        type.setTypeParameters(parameters);
        type.setInternal(internal);
        type.setParent(namespace);
        namespace.getArtifacts().put(id, type);
        definitions.put(absolute, type);
        if (!internal && "cds".equals(namespace.getName().getAbsolute())) {
            shortNames.put(id, type);
        }
    }

    private void magic(String id, List<String> elements, boolean unchecked, String autoElement) {
        Artifact variable = new Artifact(Kind.BUILTIN, new Name(id, BUILTIN_LOCATION), BUILTIN_LOCATION);
        variable.getName().setElement(id);
        variable.setBuiltin(true);
        variable.setUncheckedElements(unchecked);
        variable.setAutoElement(autoElement);
        if (elements != null) {
            for (String elementId : elements) {
                Artifact element = new Artifact(Kind.BUILTIN, new Name(elementId, BUILTIN_LOCATION), BUILTIN_LOCATION);
                element.getName().setElement(id + "." + elementId);
                element.setBuiltin(true);
                element.setParent(variable);
                variable.ensureElements().put(elementId, element);
            }
        }
        magicVariables.add(variable);
    }

    /** Builtin definitions by absolute name, including the namespaces. */
    public Map<String, Artifact> getDefinitions() {
        return Collections.unmodifiableMap(definitions);
    }

    /** Names usable without qualification in type references. */
    public Map<String, Artifact> getShortNames() {
        return Collections.unmodifiableMap(shortNames);
    }

    public MagicVariables getMagicVariables() {
        return magicVariables;
    }

    public Artifact get(String absolute) {
        return definitions.get(absolute);
    }

    public boolean isNumeric(Artifact type) {
        return type != null && type.getCategory() != null && type.getCategory().isNumeric();
    }

    public boolean isString(Artifact type) {
        return type != null && type.getCategory() != null && type.getCategory().isString();
    }

    public boolean isRelation(Artifact type) {
        return type != null && type.getCategory() != null && type.getCategory().isRelation();
    }

    public boolean isComposition(Artifact type) {
        return type != null && COMPOSITION.equals(type.getName().getAbsolute());
    }
}
