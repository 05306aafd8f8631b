package me.christianrobert.cdsresolver.linker;

import me.christianrobert.cdsresolver.diagnostics.MessageArgs;
import me.christianrobert.cdsresolver.model.AnnotationAssignment;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Extension;
import me.christianrobert.cdsresolver.model.Kind;
import me.christianrobert.cdsresolver.model.LexicalBlock;
import me.christianrobert.cdsresolver.model.LinkTable;
import me.christianrobert.cdsresolver.model.Location;
import me.christianrobert.cdsresolver.model.Members;
import me.christianrobert.cdsresolver.model.Model;
import me.christianrobert.cdsresolver.model.Name;
import me.christianrobert.cdsresolver.model.PathStep;
import me.christianrobert.cdsresolver.model.RefScope;
import me.christianrobert.cdsresolver.model.Reference;
import me.christianrobert.cdsresolver.model.Source;
import me.christianrobert.cdsresolver.model.Using;
import me.christianrobert.cdsresolver.model.expr.Expression;
import me.christianrobert.cdsresolver.model.expr.ExpressionWalker;
import me.christianrobert.cdsresolver.model.expr.SubQueryExpression;
import me.christianrobert.cdsresolver.model.query.FromItem;
import me.christianrobert.cdsresolver.model.query.JoinItem;
import me.christianrobert.cdsresolver.model.query.Query;
import me.christianrobert.cdsresolver.model.query.SelectQuery;
import me.christianrobert.cdsresolver.model.query.SetQuery;
import me.christianrobert.cdsresolver.model.query.TableRef;
import me.christianrobert.cdsresolver.resolve.annotation.AnnotationValues;
import me.christianrobert.cdsresolver.resolve.context.ResolveContext;
import me.christianrobert.cdsresolver.resolve.context.ResolveException;
import me.christianrobert.cdsresolver.resolve.path.ResolutionPolicy;
import me.christianrobert.cdsresolver.resolve.query.QueryTraversal;
import me.christianrobert.cdsresolver.resolve.redirect.AutoExposer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Prepares a parsed model for resolution.
 *
 * <p>The parser output only has absolute names for definitions and plain
 * member dictionaries.  Linking adds everything the resolver navigates:
 * <ul>
 *   <li>definitions in the model, with parents (missing name prefixes become namespaces),
 *       lexical blocks and services</li>
 *   <li>the top-level names of each source: definitions, {@code using} proxies,
 *       path prefixes and the own namespace</li>
 *   <li>member parents and names, {@code $self} and {@code $parameters}</li>
 *   <li>queries with their result artifacts, table aliases, mixins and FROM references</li>
 *   <li>composition targets, projection ancestors and descendants per service</li>
 * </ul>
 *
 * <p>Linking resolves no references; lookups needed here (FROM sources,
 * composition targets) only compute the absolute name.
 */
public class ModelLinker {

    private static final Logger log = LoggerFactory.getLogger(ModelLinker.class);

    static final String SELF = "$self";
    static final String PROJECTION = "$projection";
    static final String PARAMETERS = "$parameters";
    static final String REDIRECTION_TARGET = "@cds.redirection.target";

    private final ResolveContext ctx;
    private final Model model;

    // Using proxies for name prefixes, replaced by a real using with the same name
    private final Set<Artifact> pathPrefixes = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<Artifact> initialized = Collections.newSetFromMap(new IdentityHashMap<>());
    private int queryCount;

    public ModelLinker(ResolveContext ctx) {
        this.ctx = ctx;
        this.model = ctx.model();
    }

    public boolean isLinked() {
        return model.isLinked();
    }

    /** Links the whole model; must be called once before any resolution. */
    public void link() {
        if (model.isLinked()) {
            throw new ResolveException("Model has already been linked", null, "ModelLinker.link");
        }
        log.info("Linking {} sources", model.getSources().size());

        for (Source source : model.getSources()) {
            addSource(source);
        }
        for (Source source : model.getSources()) {
            initNamespaceAndUsings(source);
        }
        for (Artifact art : userDefinitions()) {
            initParentLink(art);
        }
        for (Artifact art : userDefinitions()) {
            initArtifact(art);
        }
        List<String> names = new ArrayList<>();
        for (Artifact art : userDefinitions()) {
            names.add(art.getName().getAbsolute());
        }
        // parents first
        Collections.sort(names);
        for (String name : names) {
            setService(model.getDefinition(name));
        }
        collectExtensions();
        for (Artifact art : userDefinitions()) {
            postProcessArtifact(art);
        }
        for (Artifact art : userDefinitions()) {
            exposeToAncestors(art);
        }
        model.setLinked(true);

        log.info("Linked {} definitions: {} queries, {} extensions, {} composition targets",
                userDefinitions().size(), queryCount, model.getExtensions().size(),
                model.getCompositionTargets().size());
    }

    /**
     * Checks the {@code using} declarations of all sources: each must denote
     * an existing definition.
     *
     * @return the number of checked declarations
     */
    public int checkUsings() {
        int checked = 0;
        for (Source source : model.getSources()) {
            for (Using using : source.getUsings()) {
                Artifact holder = Artifact.definition(Kind.USING, using.getExtern().pathName(), using.getLocation());
                holder.setBlock(source);
                ctx.paths().resolve(using.getExtern(), ResolutionPolicy.GLOBAL, holder);
                checked++;
            }
        }
        log.debug("Checked {} using declarations", checked);
        return checked;
    }

    /**
     * Links a definition created during resolution (an autoexposed entity)
     * under {@code parent}, which may be {@code null}.
     */
    public void linkGenerated(Artifact art, Artifact parent) {
        if (parent != null) {
            art.setParent(parent);
            parent.ensureArtifacts().putIfAbsent(art.getName().getId(), art);
        }
        initArtifact(art);
        postProcessArtifact(art);
    }

    // ==================== SOURCES AND TOP-LEVEL NAMES ====================

    private void addSource(Source source) {
        Map<String, Artifact> ownDefinitions = new HashMap<>();
        for (Artifact art : source.getDefinitions()) {
            String absolute = art.getName().getAbsolute();
            if (absolute == null) {
                throw new ResolveException("Definition without absolute name", source.getRealname(),
                        "ModelLinker.addSource");
            }
            Artifact existing = model.getDefinition(absolute);
            if (existing != null) {
                ctx.diagnostics().error("duplicate-definition", art.getName().getLocation(), art,
                        MessageArgs.of("name", absolute));
                continue;
            }
            ownDefinitions.put(absolute, art);
            model.addDefinition(art);
            setAnnotationSource(art, source);
            QueryTraversal.postOrder(art.getQuery(), false, select -> {
                if (select.getColumns() != null) {
                    for (Artifact col : select.getColumns()) {
                        if (col != null) {
                            setAnnotationSource(col, source);
                        }
                    }
                }
            });
        }
        String namespacePrefix = source.getNamespace() != null ? source.getNamespace() + "." : "";
        for (Artifact art : source.getDefinitions()) {
            if (ownDefinitions.get(art.getName().getAbsolute()) != art) {
                continue;
            }
            Artifact block = enclosingBlock(art.getName().getAbsolute(), ownDefinitions);
            if (art.getBlock() == null) {
                art.setBlock(block != null ? block : source);
            }
            if (block == null) {
                String absolute = art.getName().getAbsolute();
                String name = absolute.startsWith(namespacePrefix)
                        ? absolute.substring(namespacePrefix.length())
                        : absolute;
                source.getArtifacts().putIfAbsent(name, art);
            }
        }
        addPathPrefixes(source.getArtifacts(), namespacePrefix);
    }

    /** Assignments written with a definition belong to the layer of its source. */
    private static void setAnnotationSource(Artifact art, Source source) {
        for (List<AnnotationAssignment> assignments : art.getAnnotationAssignments().values()) {
            for (AnnotationAssignment assignment : assignments) {
                if (assignment.getSource() == null) {
                    assignment.setSource(source);
                }
            }
        }
        Members.forEachMember(art, member -> setAnnotationSource(member, source));
    }

    /** The innermost context or service of the same source containing {@code absolute}. */
    private static Artifact enclosingBlock(String absolute, Map<String, Artifact> ownDefinitions) {
        String name = absolute;
        int dot = name.lastIndexOf('.');
        while (dot > 0) {
            name = name.substring(0, dot);
            Artifact candidate = ownDefinitions.get(name);
            if (candidate != null && candidate.getKind().hasArtifacts()) {
                return candidate;
            }
            dot = name.lastIndexOf('.');
        }
        return null;
    }

    /** For a top-level name {@code A.B}, also makes {@code A} known. */
    private void addPathPrefixes(Map<String, Artifact> artifacts, String prefix) {
        for (Map.Entry<String, Artifact> entry : new ArrayList<>(artifacts.entrySet())) {
            String name = entry.getKey();
            int index = name.indexOf('.');
            if (index < 0) {
                continue;
            }
            String id = name.substring(0, index);
            if (artifacts.containsKey(id)) {
                continue;
            }
            Location location = entry.getValue().getName().getLocation();
            Artifact proxy = usingProxy(id, prefix + id, location);
            pathPrefixes.add(proxy);
            artifacts.put(id, proxy);
        }
    }

    private void initNamespaceAndUsings(Source source) {
        String namespace = source.getNamespace();
        if (namespace != null) {
            Location location = new Location(source.getRealname(), 0, 0);
            if (model.getDefinition(namespace) == null) {
                Artifact ns = Artifact.definition(Kind.NAMESPACE, namespace, location);
                ns.setBlock(source);
                model.addDefinition(ns);
            }
            String id = Name.lastSegment(namespace);
            if (!source.getArtifacts().containsKey(id)) {
                source.getArtifacts().put(id, usingProxy(id, namespace, location));
            }
        }
        for (Using using : source.getUsings()) {
            Reference extern = using.getExtern();
            if (extern == null || extern.getPath().isEmpty()) {
                continue;
            }
            String absolute = extern.pathName();
            String alias = using.getAlias() != null ? using.getAlias() : Name.lastSegment(absolute);
            Artifact proxy = usingProxy(alias, absolute, using.getLocation());
            using.setProxy(proxy);
            if (using.getFileDep() != null) {
                source.addDependency(using.getFileDep());
            }
            Artifact found = source.getArtifacts().get(alias);
            if (found == null || pathPrefixes.contains(found) && absolute.equals(found.getName().getAbsolute())) {
                source.getArtifacts().put(alias, proxy);
            } else {
                ctx.diagnostics().error("duplicate-using", using.getLocation(), null,
                        MessageArgs.of("name", alias));
            }
        }
    }

    private static Artifact usingProxy(String id, String absolute, Location location) {
        Name name = new Name(id, location);
        name.setAbsolute(absolute);
        return new Artifact(Kind.USING, name, location);
    }

    private void collectExtensions() {
        for (Source source : model.getSources()) {
            for (Extension ext : source.getExtensions()) {
                if (ext.getSource() == null) {
                    ext.setSource(source);
                }
                if (!model.getExtensions().contains(ext)) {
                    model.getExtensions().add(ext);
                }
            }
        }
    }

    // ==================== DEFINITIONS ====================

    private List<Artifact> userDefinitions() {
        List<Artifact> result = new ArrayList<>();
        for (Artifact art : model.getDefinitions().values()) {
            if (!art.isBuiltin()) {
                result.add(art);
            }
        }
        return result;
    }

    private void initParentLink(Artifact art) {
        String absolute = art.getName().getAbsolute();
        int dot = absolute.lastIndexOf('.');
        if (dot < 0 || art.getParent() != null) {
            return;
        }
        String prefix = absolute.substring(0, dot);
        Artifact parent = model.getDefinition(prefix);
        if (parent == null) {
            parent = Artifact.definition(Kind.NAMESPACE, prefix, art.getName().getLocation());
            parent.setBlock(art.getBlock());
            model.addDefinition(parent);
            initParentLink(parent);
        }
        art.setParent(parent);
        parent.ensureArtifacts().putIfAbsent(absolute.substring(dot + 1), art);
    }

    private void setService(Artifact art) {
        Artifact parent = art.getParent();
        if (parent == null) {
            return;
        }
        Artifact service = ctx.links().service(parent);
        if (service == null && parent.getKind() == Kind.SERVICE) {
            service = parent;
        }
        if (service != null) {
            ctx.links().setService(art, service);
        }
    }

    private void initArtifact(Artifact art) {
        if (!initialized.add(art)) {
            return;
        }
        initMembers(art);
        initDollarSelf(art);
        if (art.getParams() != null) {
            initParams(art);
        }
        if (art.getQuery() == null) {
            return;
        }
        if (art.getElements() != null) {
            // elements given with the query only provide annotations
            art.setSpecifiedElements(art.getElements());
            art.setElements(null);
        }
        SelectQuery leading = initQueryExpression(art.getQuery(), art, art, art, true);
        art.setLeadingQuery(leading);
        if (leading != null) {
            leading.setLexicalNext(art);
        }
    }

    private void initDollarSelf(Artifact art) {
        Name name = new Name(SELF, art.getLocation());
        name.setAlias(SELF);
        name.setAbsolute(art.getName().getAbsolute());
        Artifact self = new Artifact(Kind.SELF, name, art.getLocation());
        self.setParent(art);
        self.setMain(art);
        ctx.links().setOrigin(self, art);
        art.ensureTableAliases().put(SELF, self);
    }

    private void initParams(Artifact art) {
        Name name = new Name(PARAMETERS, art.getLocation());
        name.setParam(PARAMETERS);
        name.setAbsolute(art.getName().getAbsolute());
        Artifact parameters = new Artifact(Kind.PARAMETERS, name, art.getLocation());
        parameters.setParent(art);
        parameters.setMain(art);
        parameters.setBlock(art.getBlock());
        parameters.setElements(art.getParams());
        art.ensureTableAliases().put(PARAMETERS, parameters);
    }

    /** Sets parent and names of all (nested) members and registers them. */
    private void initMembers(Artifact art) {
        if (art.getItems() != null) {
            Artifact items = art.getItems();
            items.setOuter(art);
            items.setParent(art);
            items.setMain(art.mainOrSelf());
            if (items.getName() == null) {
                items.setName(new Name(art.getName().getId(), art.getLocation()));
            }
            model.register(items);
            initMembers(items);
        }
        initDict(art, art.getElements());
        initDict(art, art.getEnumValues());
        initDict(art, art.getForeignKeys());
        initDict(art, art.getActions());
        initDict(art, art.getParams());
        Artifact returns = art.getReturns();
        if (returns != null) {
            if (returns.getName() == null) {
                returns.setName(new Name("", returns.getLocation()));
            }
            Members.setMemberParent(returns, null, art, null);
            returns.getName().setParam("");
            model.register(returns);
            initMembers(returns);
        }
    }

    private void initDict(Artifact parent, Map<String, Artifact> dict) {
        if (dict == null) {
            return;
        }
        for (Map.Entry<String, Artifact> entry : dict.entrySet()) {
            Artifact member = entry.getValue();
            if (member.getName() == null) {
                member.setName(new Name(entry.getKey(), member.getLocation()));
            }
            Members.setMemberParent(member, entry.getKey(), parent, null);
            model.register(member);
            initMembers(member);
        }
    }

    // ==================== QUERIES ====================

    /**
     * Links a query expression.
     *
     * @param owner      the main artifact, table alias (FROM sub query) or
     *                   query result (other sub queries) containing the query
     * @param next       the lexical block searched after the query's aliases
     * @param recordFrom whether FROM references count as sources of the main artifact
     * @return the leading SELECT
     */
    private SelectQuery initQueryExpression(Query query, Artifact main, Artifact owner, LexicalBlock next,
                                            boolean recordFrom) {
        if (query == null) {
            return null;
        }
        query.setMain(main);
        if (query instanceof SetQuery) {
            SelectQuery leading = null;
            for (Query arg : ((SetQuery) query).getArgs()) {
                SelectQuery argLeading = initQueryExpression(arg, main, owner, next, recordFrom);
                if (leading == null) {
                    leading = argLeading;
                }
            }
            return leading;
        }
        SelectQuery select = (SelectQuery) query;
        main.getQueries().add(select);
        select.setNumber(main.getQueries().size());
        select.setLexicalNext(next);
        queryCount++;

        Name resultName = new Name(null, select.getLocation());
        Artifact result = new Artifact(Kind.QUERY, resultName, select.getLocation());
        Members.setMemberParent(result, null, owner, null);
        resultName.setSelect(select.getNumber());
        result.setSelectQuery(select);
        select.setResult(result);
        model.register(result);
        ctx.links().dependsOnSilent(main, result);

        initTableExpression(select.getFrom(), select, recordFrom);
        if (select.getMixins() != null) {
            for (Map.Entry<String, Artifact> entry : select.getMixins().entrySet()) {
                Artifact mixin = entry.getValue();
                Members.setMemberParent(mixin, entry.getKey(), result, null);
                mixin.getName().setAlias(entry.getKey());
                mixin.setBlock(main.getBlock());
                model.register(mixin);
                initMembers(mixin);
                addAlias(select, entry.getKey(), mixin);
            }
        }
        if (!select.getTableAliases().containsKey(SELF)) {
            Name name = new Name(SELF, select.getLocation());
            name.setAlias(SELF);
            name.setAbsolute(main.getName().getAbsolute());
            name.setSelect(select.getNumber());
            Artifact self = new Artifact(Kind.SELF, name, select.getLocation());
            self.setParent(result);
            self.setMain(main);
            ctx.links().setOrigin(self, result);
            select.getTableAliases().put(SELF, self);
            select.getTableAliases().put(PROJECTION, self);
        }
        initSelectItems(select, result, select.getColumns(), null);
        initExprForQuery(select.getWhere(), select, result);
        initExprForQuery(select.getHaving(), select, result);
        return select;
    }

    private void initTableExpression(FromItem from, SelectQuery select, boolean recordFrom) {
        if (from instanceof JoinItem) {
            JoinItem join = (JoinItem) from;
            for (FromItem arg : join.getArgs()) {
                initTableExpression(arg, select, recordFrom);
            }
            initExprForQuery(join.getOn(), select, select.getResult());
            return;
        }
        if (!(from instanceof TableRef)) {
            return;
        }
        TableRef tableRef = (TableRef) from;
        Artifact main = select.getMain();
        if (tableRef.getRef() != null) {
            if (tableRef.getRef().getPath().isEmpty()) {
                return;
            }
            Artifact alias = tableAlias(tableRef, select);
            if (recordFrom) {
                main.getFromRefs().add(tableRef.getRef());
            }
            addAlias(select, alias.getName().getId(), alias);
        } else if (tableRef.getSubQuery() != null) {
            if (tableRef.getExplicitAlias() == null) {
                ctx.diagnostics().error("query-req-alias", tableRef.getLocation(), main, MessageArgs.none());
                return;
            }
            Artifact alias = tableAlias(tableRef, select);
            addAlias(select, alias.getName().getId(), alias);
            SelectQuery leading = initQueryExpression(tableRef.getSubQuery(), main, alias, select, recordFrom);
            ctx.links().setOrigin(alias, leading != null ? leading.getResult() : null);
        }
    }

    private Artifact tableAlias(TableRef tableRef, SelectQuery select) {
        String id = tableRef.aliasName();
        Location location = tableRef.getRef() != null ? tableRef.getRef().last().getLocation() : tableRef.getLocation();
        Name name = new Name(id, location);
        name.setInferred(tableRef.getExplicitAlias() == null);
        Artifact alias = new Artifact(Kind.TABLE_ALIAS, name, tableRef.getLocation());
        Members.setMemberParent(alias, id, select.getResult(), null);
        alias.setTableRef(tableRef);
        alias.setBlock(select.getMain().getBlock());
        tableRef.setAlias(alias);
        model.register(alias);
        return alias;
    }

    private void addAlias(SelectQuery select, String id, Artifact alias) {
        if (select.getTableAliases().containsKey(id)) {
            ctx.diagnostics().error("duplicate-definition", alias.getName().getLocation(), select.getMain(),
                    MessageArgs.of("name", id).variant("$tableAlias"));
            return;
        }
        select.getTableAliases().put(id, alias);
    }

    /**
     * Columns of a SELECT or of an {@code expand}/{@code inline}: nested
     * columns get the column they are nested in as path head.
     */
    private void initSelectItems(SelectQuery select, Artifact result, List<Artifact> columns, Artifact parentCol) {
        if (columns == null) {
            return;
        }
        for (Artifact col : columns) {
            if (col == null) {
                continue;
            }
            if (parentCol != null) {
                if (parentCol.getValue() != null) {
                    col.setPathHead(parentCol);
                } else if (parentCol.getPathHead() != null) {
                    col.setPathHead(parentCol.getPathHead());
                }
            }
            model.register(col);
            if (col.isWildcard()) {
                continue;
            }
            if (col.getValue() != null || col.getExpand() != null || col.getInline() != null) {
                col.setBlock(select.getMain().getBlock());
                if (parentCol == null) {
                    initExprForQuery(col.getValue(), select, result);
                }
                initSelectItems(select, result, col.getExpand(), col);
                initSelectItems(select, result, col.getInline(), col);
            }
        }
    }

    private void initExprForQuery(Expression expr, SelectQuery select, Artifact result) {
        if (expr == null) {
            return;
        }
        new ExpressionWalker() {
            @Override
            public Void visitSubQuery(SubQueryExpression sub) {
                initQueryExpression(sub.getQuery(), select.getMain(), result, select, false);
                return null;
            }
        }.walk(expr);
    }

    // ==================== PROJECTIONS AND COMPOSITIONS ====================

    private void postProcessArtifact(Artifact art) {
        tagCompositionTargets(art);
        for (SelectQuery query : art.getQueries()) {
            if (query.getMixins() != null) {
                query.getMixins().values().forEach(this::tagCompositionTargets);
            }
        }
        if (!art.getFromRefs().isEmpty() && !ctx.links().hasAncestors(art)) {
            setProjectionAncestors(art);
        }
    }

    private void tagCompositionTargets(Artifact elem) {
        if (elem.isComposition() && elem.getTarget() != null) {
            Artifact target = lookupUnchecked(elem.getTarget(), elem);
            if (target != null) {
                model.getCompositionTargets().add(target.getName().getAbsolute());
            }
        }
        if (elem.getElements() != null) {
            elem.getElements().values().forEach(this::tagCompositionTargets);
        }
    }

    /**
     * Sets the projection ancestors along a chain of simple projections
     * {@code V1 -> V2 -> E}: the entities the projection can stand for as
     * redirection target.
     */
    private void setProjectionAncestors(Artifact art) {
        LinkTable links = ctx.links();
        boolean autoexposed = AnnotationValues.isTrue(art, AutoExposer.AUTOEXPOSED);
        boolean preferred = AnnotationValues.isTrue(art, REDIRECTION_TARGET);
        List<Artifact> chain = new ArrayList<>();
        Set<Artifact> inChain = Collections.newSetFromMap(new IdentityHashMap<>());
        Artifact current = art;
        while (current != null && !links.hasAncestors(current) && !inChain.contains(current)
                && current.getFromRefs().size() == 1 && current.getQuery() instanceof SelectQuery
                && (preferred || !AnnotationValues.isFalse(current, REDIRECTION_TARGET))) {
            chain.add(current);
            inChain.add(current);
            Artifact source = lookupUnchecked(current.getFromRefs().get(0), current);
            current = projectionAncestor(source, current.getParams());
            if (autoexposed) {
                break;
            }
        }
        List<Artifact> ancestors = null;
        if (current != null) {
            ancestors = !autoexposed && !inChain.contains(current) && links.hasAncestors(current)
                    ? links.ancestors(current)
                    : new ArrayList<>();
        }
        Collections.reverse(chain);
        for (Artifact projection : chain) {
            List<Artifact> list = new ArrayList<>();
            if (ancestors != null) {
                list.addAll(ancestors);
                list.add(current);
            }
            links.setAncestors(projection, list);
            ancestors = list;
            current = projection;
        }
    }

    /**
     * Returns {@code source} if a projection with parameters {@code params}
     * can stand for it: every source parameter is a projection parameter of
     * the same type, additional projection parameters have a default.
     */
    public Artifact projectionAncestor(Artifact source, Map<String, Artifact> params) {
        if (source == null) {
            return null;
        }
        if (params == null) {
            return source.getParams() == null ? source : null;
        }
        Map<String, Artifact> sourceParams = source.getParams() != null
                ? source.getParams() : new LinkedHashMap<>();
        for (String name : sourceParams.keySet()) {
            if (!params.containsKey(name)) {
                return null;
            }
        }
        for (Map.Entry<String, Artifact> entry : params.entrySet()) {
            Artifact pp = entry.getValue();
            Artifact sp = sourceParams.get(entry.getKey());
            if (sp == null) {
                if (pp.getDefaultValue() == null) {
                    return null;
                }
                continue;
            }
            if (sp.getDefaultValue() != null && pp.getDefaultValue() == null) {
                return null;
            }
            Artifact pt = pp.getType() != null ? lookupUnchecked(pp.getType(), pp) : null;
            Artifact st = sp.getType() != null ? lookupUnchecked(sp.getType(), sp) : null;
            if (!Objects.equals(pt, st)) {
                return null;
            }
        }
        return source;
    }

    /** Registers {@code art} as descendant of its ancestors in other services. */
    private void exposeToAncestors(Artifact art) {
        List<Artifact> ancestors = ctx.links().ancestors(art);
        Artifact service = ctx.links().service(art);
        if (ancestors == null || art.getKind() != Kind.ENTITY || service == null) {
            return;
        }
        String serviceName = service.getName().getAbsolute();
        for (Artifact ancestor : ancestors) {
            if (ctx.links().service(ancestor) != service) {
                ctx.links().addDescendant(ancestor, serviceName, art);
            }
        }
    }

    /**
     * The definition a reference denotes by name only: the first step is
     * looked up in the lexical blocks, the others are appended.  Neither
     * binds the reference nor reports anything.
     */
    Artifact lookupUnchecked(Reference ref, Artifact user) {
        if (ref == null || ref.getPath().isEmpty()) {
            return null;
        }
        if (ref.getCell().isSettled()) {
            return ref.getArtifact();
        }
        List<PathStep> path = ref.getPath();
        String head = path.get(0).getId();
        String absolute = null;
        if (ref.getScope() != RefScope.GLOBAL) {
            LexicalBlock block = user.getBlock() != null ? user.getBlock() : user.mainOrSelf().getBlock();
            while (block != null && absolute == null) {
                Artifact found = block.getLexicalNames().get(head);
                if (found != null) {
                    absolute = found.getName().getAbsolute();
                }
                block = block.getOuterBlock();
            }
            if (absolute == null && model.getBuiltins().getShortNames().containsKey(head)) {
                absolute = model.getBuiltins().getShortNames().get(head).getName().getAbsolute();
            }
        }
        StringBuilder name = new StringBuilder(absolute != null ? absolute : head);
        for (int i = 1; i < path.size(); i++) {
            name.append('.').append(path.get(i).getId());
        }
        return model.getDefinition(name.toString());
    }
}
