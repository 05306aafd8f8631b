package me.christianrobert.cdsresolver.model;

import me.christianrobert.cdsresolver.builtins.BuiltinCategory;
import me.christianrobert.cdsresolver.model.expr.Expression;
import me.christianrobert.cdsresolver.model.query.Query;
import me.christianrobert.cdsresolver.model.query.SelectQuery;
import me.christianrobert.cdsresolver.model.query.TableRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of the model: a definition (entity, type, service, ...) or a member
 * (element, param, key, enum value, mixin, table alias, query column).
 *
 * <p>Ownership is a tree: every member has exactly one {@code parent}.  Links
 * which do not express ownership (origin, projections, redirection chains, ...)
 * are kept in the model's {@link LinkTable}.
 */
public class Artifact implements LexicalBlock {
    // Arena index, assigned by Model.register()
    private int id = -1;

    // Identity
    private Kind kind;
    private Name name;
    private Location location;
    private Inferred inferred;

    // Ownership and lexical placement
    private Artifact parent;
    private Artifact main;
    private LexicalBlock block;
    private Artifact outer;                         // for items: the artifact with the "many"

    // Type information
    private Reference type;
    private List<Expression> typeArguments;
    private Integer length;
    private Integer precision;
    private Integer scale;
    private Integer srid;
    private Artifact items;

    // Associations
    private Reference target;
    private Expression on;
    private LinkedHashMap<String, Artifact> foreignKeys;
    private Reference targetElement;                // foreign key: the referenced target element
    private Cardinality cardinality;
    private boolean composition;

    // Members
    private LinkedHashMap<String, Artifact> elements;
    private boolean elementsCyclic;
    private LinkedHashMap<String, Artifact> specifiedElements;
    private LinkedHashMap<String, Artifact> enumValues;
    private LinkedHashMap<String, Artifact> actions;
    private LinkedHashMap<String, Artifact> params;
    private LinkedHashMap<String, Artifact> artifacts;
    private Artifact returns;
    private List<Reference> includes;

    // Views and queries
    private Query query;
    private final List<SelectQuery> queries = new ArrayList<>();
    private SelectQuery leadingQuery;
    private final List<Reference> fromRefs = new ArrayList<>();
    private LinkedHashMap<String, Artifact> tableAliases;
    private SelectQuery selectQuery;                // for kind QUERY: the query whose result this is
    private TableRef tableRef;                      // for kind TABLE_ALIAS

    // Values and flags
    private Expression value;
    private Expression defaultValue;
    private Boolean key;
    private boolean keyInferred;
    private Boolean virtual;
    private Boolean notNull;
    private Boolean masked;

    // Query columns
    private boolean wildcard;
    private List<Artifact> expand;
    private List<Artifact> inline;
    private LinkedHashMap<String, Location> excluding;
    private boolean replacement;
    private Artifact pathHead;

    // Annotations: all assignments as collected, and the chosen one per name
    private final LinkedHashMap<String, List<AnnotationAssignment>> annotationAssignments = new LinkedHashMap<>();
    private final LinkedHashMap<String, AnnotationAssignment> annotations = new LinkedHashMap<>();
    private String doc;

    // Builtins
    private boolean builtin;
    private BuiltinCategory category;
    private List<String> typeParameters;
    private boolean internal;
    private boolean uncheckedElements;
    private String autoElement;

    public Artifact(Kind kind, Name name, Location location) {
        this.kind = kind;
        this.name = name;
        this.location = location;
    }

    // Convenience factories used by linker, resolver and tests

    public static Artifact definition(Kind kind, String absolute, Location location) {
        return new Artifact(kind, Name.absolute(absolute, location), location);
    }

    public static Artifact member(Kind kind, String id, Location location) {
        return new Artifact(kind, new Name(id, location), location);
    }

    // ==================== LEXICAL BLOCK ====================

    @Override
    public Map<String, Artifact> getLexicalNames() {
        if (kind.hasArtifacts()) {
            return artifacts != null ? artifacts : Collections.emptyMap();
        }
        return tableAliases != null ? tableAliases : Collections.emptyMap();
    }

    @Override
    public LexicalBlock getOuterBlock() {
        return block;
    }

    // ==================== DERIVED PROPERTIES ====================

    /** The main artifact, or this if it is a main artifact itself. */
    public Artifact mainOrSelf() {
        return main != null ? main : this;
    }

    public boolean isMain() {
        return main == null;
    }

    public boolean isKey() {
        return Boolean.TRUE.equals(key);
    }

    public boolean isVirtual() {
        return Boolean.TRUE.equals(virtual);
    }

    public boolean isMasked() {
        return Boolean.TRUE.equals(masked);
    }

    public boolean hasElements() {
        return elements != null;
    }

    /** Chosen annotation value, {@code null} if not assigned (or not merged yet). */
    public AnnotationAssignment getAnnotation(String annoName) {
        return annotations.get(annoName);
    }

    public void addAnnotationAssignment(AnnotationAssignment assignment) {
        annotationAssignments.computeIfAbsent(assignment.getName(), k -> new ArrayList<>()).add(assignment);
    }

    public LinkedHashMap<String, Artifact> ensureElements() {
        if (elements == null) {
            elements = new LinkedHashMap<>();
        }
        return elements;
    }

    public LinkedHashMap<String, Artifact> ensureArtifacts() {
        if (artifacts == null) {
            artifacts = new LinkedHashMap<>();
        }
        return artifacts;
    }

    public LinkedHashMap<String, Artifact> ensureTableAliases() {
        if (tableAliases == null) {
            tableAliases = new LinkedHashMap<>();
        }
        return tableAliases;
    }

    public LinkedHashMap<String, Artifact> ensureForeignKeys() {
        if (foreignKeys == null) {
            foreignKeys = new LinkedHashMap<>();
        }
        return foreignKeys;
    }

    // ==================== GETTERS ====================

    public int getId() { return id; }
    public Kind getKind() { return kind; }
    public Name getName() { return name; }
    public Location getLocation() { return location; }
    public Inferred getInferred() { return inferred; }
    public Artifact getParent() { return parent; }
    public Artifact getMain() { return main; }
    public LexicalBlock getBlock() { return block; }
    public Artifact getOuter() { return outer; }
    public Reference getType() { return type; }
    public List<Expression> getTypeArguments() { return typeArguments; }
    public Integer getLength() { return length; }
    public Integer getPrecision() { return precision; }
    public Integer getScale() { return scale; }
    public Integer getSrid() { return srid; }
    public Artifact getItems() { return items; }
    public Reference getTarget() { return target; }
    public Expression getOn() { return on; }
    public LinkedHashMap<String, Artifact> getForeignKeys() { return foreignKeys; }
    public Reference getTargetElement() { return targetElement; }
    public Cardinality getCardinality() { return cardinality; }
    public boolean isComposition() { return composition; }
    public LinkedHashMap<String, Artifact> getElements() { return elements; }
    public boolean isElementsCyclic() { return elementsCyclic; }
    public LinkedHashMap<String, Artifact> getSpecifiedElements() { return specifiedElements; }
    public LinkedHashMap<String, Artifact> getEnumValues() { return enumValues; }
    public LinkedHashMap<String, Artifact> getActions() { return actions; }
    public LinkedHashMap<String, Artifact> getParams() { return params; }
    public LinkedHashMap<String, Artifact> getArtifacts() { return artifacts; }
    public Artifact getReturns() { return returns; }
    public List<Reference> getIncludes() { return includes; }
    public Query getQuery() { return query; }
    public List<SelectQuery> getQueries() { return queries; }
    public SelectQuery getLeadingQuery() { return leadingQuery; }
    public List<Reference> getFromRefs() { return fromRefs; }
    public LinkedHashMap<String, Artifact> getTableAliases() { return tableAliases; }
    public SelectQuery getSelectQuery() { return selectQuery; }
    public TableRef getTableRef() { return tableRef; }
    public Expression getValue() { return value; }
    public Expression getDefaultValue() { return defaultValue; }
    public Boolean getKey() { return key; }
    public boolean isKeyInferred() { return keyInferred; }
    public Boolean getVirtual() { return virtual; }
    public Boolean getNotNull() { return notNull; }
    public Boolean getMasked() { return masked; }
    public boolean isWildcard() { return wildcard; }
    public List<Artifact> getExpand() { return expand; }
    public List<Artifact> getInline() { return inline; }
    public LinkedHashMap<String, Location> getExcluding() { return excluding; }
    public boolean isReplacement() { return replacement; }
    public Artifact getPathHead() { return pathHead; }
    public LinkedHashMap<String, List<AnnotationAssignment>> getAnnotationAssignments() { return annotationAssignments; }
    public LinkedHashMap<String, AnnotationAssignment> getAnnotations() { return annotations; }
    public String getDoc() { return doc; }
    public boolean isBuiltin() { return builtin; }
    public BuiltinCategory getCategory() { return category; }
    public List<String> getTypeParameters() { return typeParameters; }
    public boolean isInternal() { return internal; }
    public boolean isUncheckedElements() { return uncheckedElements; }
    public String getAutoElement() { return autoElement; }

    // ==================== SETTERS ====================

    public void setId(int id) { this.id = id; }
    public void setKind(Kind kind) { this.kind = kind; }
    public void setName(Name name) { this.name = name; }
    public void setLocation(Location location) { this.location = location; }
    public void setInferred(Inferred inferred) { this.inferred = inferred; }
    public void setParent(Artifact parent) { this.parent = parent; }
    public void setMain(Artifact main) { this.main = main; }
    public void setBlock(LexicalBlock block) { this.block = block; }
    public void setOuter(Artifact outer) { this.outer = outer; }
    public void setType(Reference type) { this.type = type; }
    public void setTypeArguments(List<Expression> typeArguments) { this.typeArguments = typeArguments; }
    public void setLength(Integer length) { this.length = length; }
    public void setPrecision(Integer precision) { this.precision = precision; }
    public void setScale(Integer scale) { this.scale = scale; }
    public void setSrid(Integer srid) { this.srid = srid; }
    public void setItems(Artifact items) { this.items = items; }
    public void setTarget(Reference target) { this.target = target; }
    public void setOn(Expression on) { this.on = on; }
    public void setForeignKeys(LinkedHashMap<String, Artifact> foreignKeys) { this.foreignKeys = foreignKeys; }
    public void setTargetElement(Reference targetElement) { this.targetElement = targetElement; }
    public void setCardinality(Cardinality cardinality) { this.cardinality = cardinality; }
    public void setComposition(boolean composition) { this.composition = composition; }
    public void setElements(LinkedHashMap<String, Artifact> elements) { this.elements = elements; }
    public void setElementsCyclic(boolean elementsCyclic) { this.elementsCyclic = elementsCyclic; }
    public void setSpecifiedElements(LinkedHashMap<String, Artifact> specifiedElements) { this.specifiedElements = specifiedElements; }
    public void setEnumValues(LinkedHashMap<String, Artifact> enumValues) { this.enumValues = enumValues; }
    public void setActions(LinkedHashMap<String, Artifact> actions) { this.actions = actions; }
    public void setParams(LinkedHashMap<String, Artifact> params) { this.params = params; }
    public void setArtifacts(LinkedHashMap<String, Artifact> artifacts) { this.artifacts = artifacts; }
    public void setReturns(Artifact returns) { this.returns = returns; }
    public void setIncludes(List<Reference> includes) { this.includes = includes; }
    public void setQuery(Query query) { this.query = query; }
    public void setLeadingQuery(SelectQuery leadingQuery) { this.leadingQuery = leadingQuery; }
    public void setTableAliases(LinkedHashMap<String, Artifact> tableAliases) { this.tableAliases = tableAliases; }
    public void setSelectQuery(SelectQuery selectQuery) { this.selectQuery = selectQuery; }
    public void setTableRef(TableRef tableRef) { this.tableRef = tableRef; }
    public void setValue(Expression value) { this.value = value; }
    public void setDefaultValue(Expression defaultValue) { this.defaultValue = defaultValue; }
    public void setKey(Boolean key) { this.key = key; }
    public void setKeyInferred(boolean keyInferred) { this.keyInferred = keyInferred; }
    public void setVirtual(Boolean virtual) { this.virtual = virtual; }
    public void setNotNull(Boolean notNull) { this.notNull = notNull; }
    public void setMasked(Boolean masked) { this.masked = masked; }
    public void setWildcard(boolean wildcard) { this.wildcard = wildcard; }
    public void setExpand(List<Artifact> expand) { this.expand = expand; }
    public void setInline(List<Artifact> inline) { this.inline = inline; }
    public void setExcluding(LinkedHashMap<String, Location> excluding) { this.excluding = excluding; }
    public void setReplacement(boolean replacement) { this.replacement = replacement; }
    public void setPathHead(Artifact pathHead) { this.pathHead = pathHead; }
    public void setDoc(String doc) { this.doc = doc; }
    public void setBuiltin(boolean builtin) { this.builtin = builtin; }
    public void setCategory(BuiltinCategory category) { this.category = category; }
    public void setTypeParameters(List<String> typeParameters) { this.typeParameters = typeParameters; }
    public void setInternal(boolean internal) { this.internal = internal; }
    public void setUncheckedElements(boolean uncheckedElements) { this.uncheckedElements = uncheckedElements; }
    public void setAutoElement(String autoElement) { this.autoElement = autoElement; }

    @Override
    public String toString() {
        return kind + " " + (name != null ? name.display() : "<anonymous>");
    }
}
