package me.christianrobert.cdsresolver.resolve.path;

import me.christianrobert.cdsresolver.diagnostics.Diagnostics;
import me.christianrobert.cdsresolver.diagnostics.MessageArgs;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Inferred;
import me.christianrobert.cdsresolver.model.Kind;
import me.christianrobert.cdsresolver.model.LexicalBlock;
import me.christianrobert.cdsresolver.model.Location;
import me.christianrobert.cdsresolver.model.Name;
import me.christianrobert.cdsresolver.model.PathStep;
import me.christianrobert.cdsresolver.model.RefScope;
import me.christianrobert.cdsresolver.model.Reference;
import me.christianrobert.cdsresolver.model.ResolutionCell;
import me.christianrobert.cdsresolver.model.ResolutionState;
import me.christianrobert.cdsresolver.model.query.SelectQuery;
import me.christianrobert.cdsresolver.resolve.context.ResolveContext;
import me.christianrobert.cdsresolver.resolve.path.ResolutionPolicy.AssocMode;
import me.christianrobert.cdsresolver.resolve.path.ResolutionPolicy.CheckResult;
import me.christianrobert.cdsresolver.resolve.redirect.ForeignKeys.KeysNavigation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves references: the first path step is searched in the lexical scopes
 * (or the definitions), every further step in the environment provided by
 * the artifact found by the previous step.
 *
 * <p>Resolution is idempotent: the result is stored in the write-once cell of
 * the reference, so asking again returns the stored result without any
 * further diagnostic.  A reference which is asked for while it is being
 * resolved yields {@code null}; this is how reference cycles stop.
 */
public class PathResolver {

    private static final Logger log = LoggerFactory.getLogger(PathResolver.class);

    private final ResolveContext ctx;

    public PathResolver(ResolveContext ctx) {
        this.ctx = ctx;
    }

    public Artifact resolve(Reference ref, ResolutionPolicy policy, Artifact user) {
        return resolve(ref, policy, user, null, null);
    }

    public Artifact resolve(Reference ref, ResolutionPolicy policy, Artifact user, Environment extDict) {
        return resolve(ref, policy, user, extDict, null);
    }

    /**
     * Resolves {@code ref} written at {@code user}.
     *
     * @param extDict environment searched after the lexical scopes; chosen by
     *                the policy if {@code null}
     * @param msgArt  artifact to mention in a not-found message for the first step
     * @return the bound artifact, {@code null} if not found, ambiguous,
     * rejected or cyclic (see the cell of {@code ref} for which)
     */
    public Artifact resolve(Reference ref, ResolutionPolicy policy, Artifact user,
                            Environment extDict, Artifact msgArt) {
        if (ref == null) {
            return null;
        }
        ResolutionCell cell = ref.getCell();
        if (cell.isSettled() || cell.isInProgress()) {
            return cell.getArtifact();
        }
        if (ref.getPath().isEmpty()) {
            return cell.bind(null);
        }
        cell.begin();

        ResolutionPolicy spec = policy;
        List<PathStep> path = ref.getPath();
        PathStep head = path.get(0);
        List<Map<String, Artifact>> scopes;

        if (ref.getScope() == RefScope.PARAM) {
            if (!spec.isEscapeParam()) {
                diagnostics().error("ref-unexpected-scope", ref.getLocation(), user, MessageArgs.none());
                return cell.bind(null);
            }
            spec = ResolutionPolicy.PARAM;
            Artifact parameters = lexicalAlias(user.mainOrSelf(), "$parameters");
            scopes = parameters != null && parameters.getElements() != null
                    ? List.of(parameters.getElements())
                    : blockScopes(user);
            extDict = null;
        } else if (spec.getNext() == ResolutionPolicy.Next.EMPTY) {
            scopes = Collections.emptyList();
        } else if (spec.isValueRef()) {
            SelectQuery query = spec.isLexicalMain() ? null : userQuery(user);
            LexicalBlock start = query != null ? query : user.mainOrSelf();
            scopes = valueScopes(start);
            if (extDict == null && !spec.isNoExt()) {
                if (query != null && !spec.isRootEnvElements() && query.getCombined() != null) {
                    extDict = Environment.combined(query.getCombined());
                } else {
                    extDict = Environment.of(environment(user.isMain() ? user : user.getParent()));
                }
            }
        } else {
            scopes = blockScopes(user);
        }

        Outcome root;
        if (ref.getScope() == RefScope.GLOBAL || spec.isGlobal()) {
            root = pathRoot(path, spec, user, Collections.emptyList(),
                    Environment.definitions(ctx.model().getDefinitions()), null);
        } else {
            root = pathRoot(path, spec, user, scopes, extDict, msgArt);
        }
        if (!root.isFound()) {
            return settle(cell, root);
        }
        Artifact art = root.artifact;
        boolean fromPathHead = !spec.isArtifactRef() && user.getPathHead() != null;
        if (!fromPathHead && !head.getCell().isSettled()) {
            switch (art.getKind()) {
                case MIXIN:
                    if (spec.isNoAliasOrMixin()) {
                        diagnostics().signalNotFound("ref-rejected-on", head.getLocation(), user,
                                MessageArgs.of("id", head.getId()).variant("mixin"), null);
                        return cell.settle(ResolutionState.REJECTED);
                    }
                    head.setNavigation(art);
                    head.getCell().bind(art);
                    break;
                case NAV_ELEMENT:
                    head.setNavigation(art);
                    head.getCell().bind(ctx.links().origin(art));
                    break;
                case TABLE_ALIAS:
                case SELF:
                    if (spec.isNoAliasOrMixin() && art.getKind() != Kind.SELF) {
                        diagnostics().signalNotFound("ref-rejected-on", head.getLocation(), user,
                                MessageArgs.of("id", head.getId()).variant("alias"), null);
                        return cell.settle(ResolutionState.REJECTED);
                    }
                    head.setNavigation(art);
                    Artifact origin = ctx.links().origin(art);
                    head.getCell().bind(origin);
                    if (origin == null) {
                        return cell.bind(null);
                    }
                    break;
                default:
                    head.getCell().bind(art);
                    break;
            }
        }

        int artifactItems = ref.getArtifactSteps() > 0 ? ref.getArtifactSteps() : spec.getArtifactItems();
        Outcome item = pathItems(path, spec, user, artifactItems, fromPathHead ? art : null);
        if (!item.isFound()) {
            return settle(cell, item);
        }
        art = item.artifact;

        if (art.getAutoElement() != null && art.getElements() != null) {
            PathStep step = new PathStep(art.getAutoElement(), path.get(path.size() - 1).getLocation());
            step.setInferred(Inferred.AUTO_ELEMENT);
            art = art.getElements().get(art.getAutoElement());
            step.getCell().bind(art);
            path.add(step);
        }

        CheckResult check = check(spec, art, path);
        if (check == CheckResult.FAIL) {
            diagnostics().signalNotFound(spec.getExpectedMsgId(), ref.getLocation(), user, MessageArgs.none(), null);
            return cell.settle(ResolutionState.REJECTED);
        }
        if (check == CheckResult.SLOPPY) {
            diagnostics().signalNotFound(spec.getSloppyMsgId(), ref.getLocation(), user, MessageArgs.none(), null);
        }

        if (user != null && recordsDependency(spec, art)) {
            if (art.isMain() || spec.getAssoc() != AssocMode.FROM) {
                ctx.links().dependsOn(user, art, ref.getLocation());
            } else {
                ctx.links().dependsOn(user, art.getMain(), ref.getLocation());
                environment(art, ref.getLocation(), user, AssocMode.DEFAULT);
            }
        }
        return cell.bind(art);
    }

    /**
     * Resolves the target of an association with the policy matching its
     * kind: compositions may also target aspects.
     */
    public Artifact resolveTarget(Artifact assoc) {
        ResolutionPolicy policy = assoc.isComposition()
                ? ResolutionPolicy.COMPOSITION_TARGET
                : ResolutionPolicy.TARGET;
        return resolve(assoc.getTarget(), policy, assoc);
    }

    // ==================== ENVIRONMENTS ====================

    /** Elements visible after navigating to {@code art}. */
    public Map<String, Artifact> environment(Artifact art) {
        return environment(art, null, null, AssocMode.DEFAULT);
    }

    /**
     * Elements visible after navigating to {@code art}: the elements of its
     * effective type, or of the association target.  Views are populated on
     * demand.
     */
    public Map<String, Artifact> environment(Artifact art, Location location, Artifact user, AssocMode assoc) {
        if (art == null) {
            return Collections.emptyMap();
        }
        Artifact env = navigationEnv(art, location, user, assoc);
        return env != null && env.getElements() != null ? env.getElements() : Collections.emptyMap();
    }

    /**
     * The artifact providing the elements of {@code art}: its effective type,
     * or the target entity for associations.
     */
    public Artifact navigationEnv(Artifact art, Location location, Artifact user, AssocMode assoc) {
        Artifact type = ctx.types().effectiveType(art);
        if (type == null) {
            type = art;
        }
        if (type.getTarget() != null) {
            Artifact target = resolveTarget(type);
            if (target == null) {
                if (type.getTarget().getCell().isInProgress() && location != null) {
                    Reference ref = art.getTarget() != null ? art.getTarget() : art.getType();
                    ctx.links().dependsOn(art, art, ref != null ? ref.getLocation() : location);
                }
                return null;
            }
            if (assoc == AssocMode.FORBIDDEN) {
                diagnostics().error("ref-unexpected-navigation", location, user, MessageArgs.none());
            } else if (assoc != AssocMode.DEFAULT && user != null) {
                ctx.links().dependsOn(user, target, location);
            }
            type = target;
        }
        ctx.queries().populateView(type);
        return type;
    }

    /** The query {@code user} belongs to, {@code null} outside queries. */
    public static SelectQuery userQuery(Artifact user) {
        Artifact current = user;
        while (current != null && current.getMain() != null) {
            if (current.getKind() == Kind.QUERY) {
                return current.getSelectQuery();
            }
            current = current.getParent();
        }
        return null;
    }

    // ==================== PATH ROOT ====================

    private Outcome pathRoot(List<PathStep> path, ResolutionPolicy spec, Artifact user,
                             List<Map<String, Artifact>> scopes, Environment extDict, Artifact msgArt) {
        if (!spec.isArtifactRef() && user.getPathHead() != null) {
            Artifact pathHead = user.getPathHead();
            environment(pathHead);
            return Outcome.of(ctx.links().origin(pathHead));
        }
        PathStep head = path.get(0);
        ResolutionCell headCell = head.getCell();
        if (headCell.isSettled()) {
            if (headCell.getState() == ResolutionState.AMBIGUOUS) {
                return Outcome.AMBIGUOUS;
            }
            return Outcome.of(headCell.getArtifact());
        }
        if (!spec.isValueRef() && extDict == null) {
            extDict = spec.isUseDefinitions()
                    ? Environment.definitions(ctx.model().getDefinitions())
                    : Environment.of(ctx.model().getBuiltins().getShortNames());
        }
        String id = head.getId();
        boolean expandOrInline = user != null && (user.getExpand() != null || user.getInline() != null);
        for (Map<String, Artifact> scope : scopes) {
            Artifact found = scope.get(id);
            if (found == null) {
                continue;
            }
            switch (found.getKind()) {
                case PARAMETERS:
                    if (path.size() > 1) {
                        diagnostics().message("ref-obsolete-parameters", head.getLocation(), user,
                                MessageArgs.of("code", "$parameters." + path.get(1).getId())
                                        .and("newcode", ":" + path.get(1).getId()));
                        return Outcome.of(found);
                    }
                    break;
                case SELF:
                    return Outcome.of(found);
                case USING:
                    Artifact definition = ctx.model().getDefinition(found.getName().getAbsolute());
                    headCell.bind(definition);
                    return Outcome.of(definition);
                case TABLE_ALIAS:
                    if (path.size() > 1 || expandOrInline) {
                        return Outcome.of(found);
                    }
                    break;
                default:
                    return Outcome.of(found);
            }
        }
        if (extDict != null && (!spec.isDollar() || !id.startsWith("$"))) {
            List<Artifact> found = extDict.lookup(id);
            if (found.size() > 1) {
                if (found.get(0).getKind() == Kind.NAV_ELEMENT) {
                    List<String> names = found.stream()
                            .map(e -> e.getName().getAlias() + "." + e.getName().getElement())
                            .collect(Collectors.toList());
                    diagnostics().error("ref-ambiguous", head.getLocation(), user,
                            MessageArgs.of("id", id).and("names", names));
                }
                headCell.ambiguous(found);
                return Outcome.AMBIGUOUS;
            }
            if (found.size() == 1) {
                return Outcome.of(found.get(0));
            }
        }
        if (spec.isNoMessage()) {
            return Outcome.NOT_FOUND;
        }

        Set<String> valid = new LinkedHashSet<>();
        scopes.forEach(scope -> valid.addAll(scope.keySet()));
        if (extDict != null) {
            valid.addAll(extDict.validNames(false));
        }
        if (spec.isValueRef()) {
            if (msgArt != null) {
                diagnostics().signalNotFound("ref-undefined-element", head.getLocation(), user,
                        MessageArgs.of("art", msgArt).and("member", id).variant("element"), valid);
            } else {
                diagnostics().signalNotFound("ref-undefined-var", head.getLocation(), user,
                        MessageArgs.of("id", id), valid);
            }
        } else if (spec.isGlobal()) {
            diagnostics().signalNotFound(spec.getUndefinedDefId(), head.getLocation(), user,
                    MessageArgs.of("art", id), valid);
        } else {
            diagnostics().signalNotFound(spec.getUndefinedArtId(), head.getLocation(), user,
                    MessageArgs.of("name", id), valid);
        }
        headCell.bind(null);
        return Outcome.NOT_FOUND;
    }

    // ==================== PATH ITEMS ====================

    private Outcome pathItems(List<PathStep> path, ResolutionPolicy spec, Artifact user,
                              int artifactItems, Artifact headArt) {
        Artifact art = headArt;
        int remaining = artifactItems;
        KeysNavigation keys = null;
        PathStep last = path.get(path.size() - 1);
        for (PathStep item : path) {
            --remaining;
            ResolutionCell cell = item.getCell();
            if (cell.isSettled()) {
                if (cell.getState() == ResolutionState.AMBIGUOUS) {
                    return Outcome.AMBIGUOUS;
                }
                art = cell.getArtifact();
                if (art == null) {
                    return Outcome.NOT_FOUND;
                }
                continue;
            }
            boolean artifactStep = spec.isArtifactRef() && remaining >= 0;
            Environment env = artifactStep
                    ? Environment.of(art != null ? art.getArtifacts() : null)
                    : Environment.of(environment(art, item.getLocation(), user, spec.getAssoc()));

            if (art != null && art.isUncheckedElements()) {
                Artifact known = env.get(item.getId());
                return Outcome.of(known != null ? known : uncheckedElement(art, item, path));
            }

            List<Artifact> found = env.lookup(item.getId());
            if (found.isEmpty()) {
                notFound(item, env, art, artifactStep, user, spec);
                cell.bind(null);
                return Outcome.NOT_FOUND;
            }
            if (found.size() > 1) {
                cell.ambiguous(found);
                return Outcome.AMBIGUOUS;
            }
            Artifact sub = cell.bind(found.get(0));

            if (keys != null) {
                keys = followForeignKey(keys, item.getId(), item, last, user);
            } else if (spec.isKeysNavigation() && art != null && isManagedAssociation(art)) {
                keys = followForeignKey(ctx.foreignKeys().keysNavigation(managedType(art)),
                        item.getId(), item, last, user);
            }
            art = sub;
            if (spec.isArtifactRef() && (remaining == 0 || item == last)
                    && art.getInferred() == Inferred.AUTOEXPOSED && user != null && user.getInferred() == null
                    && !spec.isAllowAutoexposed()) {
                diagnostics().message("ref-autoexposed", item.getLocation(), user, MessageArgs.of("art", art));
            }
        }
        return Outcome.of(art);
    }

    private boolean isManagedAssociation(Artifact art) {
        Artifact type = managedType(art);
        return type != null && type.getTarget() != null && type.getOn() == null && type.getForeignKeys() != null;
    }

    private Artifact managedType(Artifact art) {
        Artifact type = ctx.types().effectiveType(art);
        return type != null ? type : art;
    }

    /**
     * Follows a path step into the target of a managed association: the step
     * must name (a prefix of) the target element of a foreign key.
     *
     * @return the navigation for the next step, {@code null} if done
     */
    private KeysNavigation followForeignKey(KeysNavigation keys, String id, PathStep item, PathStep last,
                                            Artifact user) {
        KeysNavigation node = keys != null ? keys.get(id) : null;
        if (node != null) {
            if (node.getKey() != null) {
                item.setNavigation(node.getKey());
                if (item == last) {
                    return null;
                }
            } else if (item != last) {
                return node;
            }
        }
        diagnostics().error("ref-expected-foreign-key", item.getLocation(), user, MessageArgs.none());
        return null;
    }

    private Artifact uncheckedElement(Artifact art, PathStep item, List<PathStep> path) {
        Name name = new Name(item.getId(), item.getLocation());
        name.setElement(path.stream().map(PathStep::getId).collect(Collectors.joining(".")));
        Artifact element = new Artifact(Kind.BUILTIN, name, item.getLocation());
        element.setBuiltin(true);
        element.setParent(art);
        return element;
    }

    private void notFound(PathStep item, Environment env, Artifact art, boolean artifactStep, Artifact user,
                          ResolutionPolicy spec) {
        if (spec.isNoMessage()) {
            return;
        }
        Set<String> valid = env.validNames(true);
        String id = item.getId();
        if (artifactStep) {
            String name = art != null && art.getName().getAbsolute() != null
                    ? art.getName().getAbsolute() + "." + id
                    : id;
            diagnostics().signalNotFound(spec.getUndefinedDefId(), item.getLocation(), user,
                    MessageArgs.of("art", name), valid);
        } else if (art != null && art.getName().getSelect() != null && art.getName().getSelect() > 1
                && art.getKind() == Kind.QUERY) {
            diagnostics().signalNotFound("query-undefined-element", item.getLocation(), user,
                    MessageArgs.of("id", id), valid);
        } else if (art != null && art.getKind() == Kind.PARAMETERS) {
            diagnostics().signalNotFound("ref-undefined-param", item.getLocation(), user,
                    MessageArgs.of("art", art.mainOrSelf()).and("member", id).variant("param"), valid);
        } else {
            diagnostics().signalNotFound("ref-undefined-element", item.getLocation(), user,
                    MessageArgs.of("art", art).and("member", id).variant("element"), valid);
        }
    }

    // ==================== CHECKS ====================

    private CheckResult check(ResolutionPolicy spec, Artifact art, List<PathStep> path) {
        switch (spec.getCheck()) {
            case TYPE:
                return checkType(art);
            case ACTION_PARAM_TYPE:
                return checkActionParamType(art);
            case EVENT_TYPE:
                return art.getKind() == Kind.EVENT ? CheckResult.OK : checkActionParamType(art);
            case INCLUDES:
                return art.getElements() != null && art.getQuery() == null && art.getType() == null
                        && art.getParams() == null ? CheckResult.OK : CheckResult.FAIL;
            case ENTITY:
                return art.getKind() == Kind.ENTITY ? CheckResult.OK : CheckResult.FAIL;
            case TARGET:
                if (art.getKind() == Kind.ENTITY || art.getKind() == Kind.ASPECT) {
                    return CheckResult.OK;
                }
                return art.getKind() == Kind.TYPE ? CheckResult.SLOPPY : CheckResult.FAIL;
            case SOURCE:
                return checkSource(art, path);
            case CONST:
                return art.getKind() == Kind.BUILTIN || art.getKind() == Kind.PARAM
                        ? CheckResult.OK : CheckResult.FAIL;
            default:
                return CheckResult.OK;
        }
    }

    private static CheckResult checkType(Artifact art) {
        switch (art.getKind()) {
            case TYPE:
            case ELEMENT:
                return CheckResult.OK;
            case ENTITY:
            case ASPECT:
            case EVENT:
                return CheckResult.SLOPPY;
            default:
                return CheckResult.FAIL;
        }
    }

    private CheckResult checkActionParamType(Artifact art) {
        if (art.getKind() == Kind.ENTITY && ctx.links().service(art) != null) {
            return CheckResult.OK;
        }
        return checkType(art);
    }

    private CheckResult checkSource(Artifact art, List<PathStep> path) {
        if (art.getKind() == Kind.ENTITY) {
            return CheckResult.OK;
        }
        if (art.getKind() != Kind.ELEMENT) {
            return CheckResult.FAIL;
        }
        Artifact first = path.stream()
                .map(PathStep::getArtifact)
                .filter(a -> a != null && a.getMain() != null)
                .findFirst()
                .orElse(art);
        if (first.getMain().getKind() != Kind.ENTITY) {
            return CheckResult.FAIL;
        }
        environment(art);
        Artifact type = ctx.types().effectiveType(art);
        return (type != null ? type : art).getTarget() != null ? CheckResult.OK : CheckResult.FAIL;
    }

    private static boolean recordsDependency(ResolutionPolicy spec, Artifact art) {
        switch (spec.getDependency()) {
            case RECORD:
                return true;
            case UNLESS_ENTITY:
                return art.getKind() != Kind.ENTITY;
            default:
                return false;
        }
    }

    // ==================== SCOPES ====================

    private List<Map<String, Artifact>> blockScopes(Artifact user) {
        List<Map<String, Artifact>> scopes = new ArrayList<>();
        LexicalBlock block = user.getBlock() != null ? user.getBlock() : user.mainOrSelf().getBlock();
        while (block != null) {
            scopes.add(block.getLexicalNames());
            block = block.getOuterBlock();
        }
        return scopes;
    }

    /** Queries (inner to outer), the main artifact, then the magic variables. */
    private List<Map<String, Artifact>> valueScopes(LexicalBlock start) {
        List<Map<String, Artifact>> scopes = new ArrayList<>();
        LexicalBlock block = start;
        while (block instanceof SelectQuery) {
            scopes.add(block.getLexicalNames());
            block = ((SelectQuery) block).getLexicalNext();
        }
        if (block != null) {
            scopes.add(block.getLexicalNames());
        }
        scopes.add(ctx.model().getBuiltins().getMagicVariables().getLexicalNames());
        return scopes;
    }

    private static Artifact lexicalAlias(Artifact main, String id) {
        return main.getTableAliases() != null ? main.getTableAliases().get(id) : null;
    }

    private static Artifact settle(ResolutionCell cell, Outcome outcome) {
        switch (outcome.state) {
            case AMBIGUOUS:
                return cell.settle(ResolutionState.AMBIGUOUS);
            case REJECTED:
                return cell.settle(ResolutionState.REJECTED);
            case CYCLIC:
                return cell.settle(ResolutionState.CYCLIC);
            default:
                return cell.bind(null);
        }
    }

    private Diagnostics diagnostics() {
        return ctx.diagnostics();
    }

    /**
     * Result of a lookup step: found artifact or the reason for failure.
     */
    private static final class Outcome {
        static final Outcome NOT_FOUND = new Outcome(null, ResolutionState.NOT_FOUND);
        static final Outcome AMBIGUOUS = new Outcome(null, ResolutionState.AMBIGUOUS);

        final Artifact artifact;
        final ResolutionState state;

        private Outcome(Artifact artifact, ResolutionState state) {
            this.artifact = artifact;
            this.state = state;
        }

        static Outcome of(Artifact artifact) {
            return artifact != null ? new Outcome(artifact, ResolutionState.BOUND) : NOT_FOUND;
        }

        boolean isFound() {
            return artifact != null;
        }
    }
}
