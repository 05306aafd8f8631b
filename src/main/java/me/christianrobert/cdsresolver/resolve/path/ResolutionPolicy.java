package me.christianrobert.cdsresolver.resolve.path;

/**
 * How a reference is resolved, depending on where it is written.
 *
 * <p>Artifact references ({@link #isArtifactRef()}) search the lexical blocks
 * and the definitions; value references ({@link #isValueRef()}) search table
 * aliases, {@code $self}, the query or element environment and the magic
 * variables.
 */
public enum ResolutionPolicy {

    /** {@code using} declarations: fully qualified, looked up in the definitions. */
    GLOBAL(new Spec().artifacts().useDefinitions().global()),
    /** Annotation names; unknown ones are not reported. */
    ANNOTATION(new Spec().useDefinitions().noMessage().global()),
    /** Early lookup of annotated artifacts; unknown ones are reported later with {@link #ANNOTATE}. */
    EXTEND(new Spec().artifacts().useDefinitions().noMessage().allowAutoexposed()),
    ANNOTATE(new Spec().artifacts().useDefinitions()
            .messages("anno-undefined-def", "anno-undefined-art").allowAutoexposed()),
    TYPE(new Spec().artifacts().check(Check.TYPE, "expected-type", "ref-sloppy-type")),
    ACTION_PARAM_TYPE(new Spec().artifacts()
            .check(Check.ACTION_PARAM_TYPE, "expected-actionparam-type", "ref-sloppy-actionparam-type")),
    EVENT_TYPE(new Spec().artifacts()
            .check(Check.EVENT_TYPE, "expected-event-type", "ref-sloppy-event-type")),
    INCLUDE(new Spec().artifacts().check(Check.INCLUDES, "expected-struct", null)),
    TARGET(new Spec().artifacts().check(Check.ENTITY, "expected-entity", null).dependency(Dependency.NONE)),
    COMPOSITION_TARGET(new Spec().artifacts().check(Check.TARGET, "expected-target", "ref-sloppy-target")
            .dependency(Dependency.UNLESS_ENTITY)),
    FROM(new Spec().artifacts().check(Check.SOURCE, "expected-source", null).assoc(AssocMode.FROM)),

    TYPE_OF(new Spec().next(Next.LEXICAL).dollar()),
    /** Foreign key references: searched in the target only, no association navigation. */
    TARGET_ELEMENT(new Spec().next(Next.EMPTY).assoc(AssocMode.FORBIDDEN)),
    FILTER(new Spec().next(Next.LEXICAL).lexicalMain()),
    DEFAULT(new Spec().next(Next.LEXICAL).dollar().check(Check.CONST, "expected-const", null)),
    EXPR(new Spec().next(Next.LEXICAL).dollar().escapeParam().assoc(AssocMode.NAV)),
    EXISTS(new Spec().next(Next.LEXICAL).dollar().escapeParam().assoc(AssocMode.NAV)),
    ON(new Spec().next(Next.LEXICAL).dollar().noAliasOrMixin().rootEnvElements().dependency(Dependency.NONE)
            .keysNavigation()),
    MIXIN_ON(new Spec().next(Next.LEXICAL).dollar().escapeParam().dependency(Dependency.NONE)),
    REWRITE(new Spec().next(Next.LEXICAL).dollar().escapeParam().dependency(Dependency.NONE)),
    ORDER_BY_UNION(new Spec().next(Next.LEXICAL).dollar().escapeParam().dependency(Dependency.NONE).noExt()),
    /** {@code :param} references; the escape target of the value policies. */
    PARAM(new Spec().check(Check.CONST, "expected-const", null));

    /** Predicate the found artifact must satisfy. */
    public enum Check { NONE, TYPE, ACTION_PARAM_TYPE, EVENT_TYPE, INCLUDES, ENTITY, TARGET, SOURCE, CONST }

    /** Outcome of a {@link Check}. */
    public enum CheckResult { OK, SLOPPY, FAIL }

    /** Which dependency edge a found artifact produces. */
    public enum Dependency { RECORD, NONE, UNLESS_ENTITY }

    /** Whether and how associations may be followed. */
    public enum AssocMode { DEFAULT, FROM, NAV, FORBIDDEN }

    /** Where the search for the first path step starts. */
    public enum Next {
        /** Artifact reference: lexical blocks, then definitions or builtins. */
        NONE,
        /** Value reference: query, main artifact, magic variables. */
        LEXICAL,
        /** Only the explicitly provided environment. */
        EMPTY
    }

    private final Spec spec;

    ResolutionPolicy(Spec spec) {
        this.spec = spec;
    }

    public boolean isArtifactRef() { return spec.artifacts; }
    public boolean isValueRef() { return spec.next != Next.NONE; }
    public int getArtifactItems() { return spec.artifactItems; }
    public boolean isUseDefinitions() { return spec.useDefinitions; }
    public boolean isGlobal() { return spec.global; }
    public boolean isNoMessage() { return spec.noMessage; }
    public String getUndefinedDefId() { return spec.undefinedDef; }
    public String getUndefinedArtId() { return spec.undefinedArt; }
    public boolean isAllowAutoexposed() { return spec.allowAutoexposed; }
    public Check getCheck() { return spec.check; }
    public String getExpectedMsgId() { return spec.expectedMsgId; }
    public String getSloppyMsgId() { return spec.sloppyMsgId; }
    public Dependency getDependency() { return spec.dependency; }
    public AssocMode getAssoc() { return spec.assoc; }
    public Next getNext() { return spec.next; }
    public boolean isLexicalMain() { return spec.lexicalMain; }
    public boolean isDollar() { return spec.dollar; }
    public boolean isEscapeParam() { return spec.escapeParam; }
    public boolean isNoAliasOrMixin() { return spec.noAliasOrMixin; }
    public boolean isRootEnvElements() { return spec.rootEnvElements; }
    public boolean isNoExt() { return spec.noExt; }
    public boolean isKeysNavigation() { return spec.keysNavigation; }

    /** Policy used for the arguments of a path step resolved with this policy. */
    public ResolutionPolicy argumentPolicy() {
        return this == FROM ? EXPR : this;
    }

    private static final class Spec {
        private boolean artifacts;
        private int artifactItems = 1;
        private boolean useDefinitions;
        private boolean global;
        private boolean noMessage;
        private String undefinedDef = "ref-undefined-def";
        private String undefinedArt = "ref-undefined-art";
        private boolean allowAutoexposed;
        private Check check = Check.NONE;
        private String expectedMsgId;
        private String sloppyMsgId;
        private Dependency dependency = Dependency.RECORD;
        private AssocMode assoc = AssocMode.DEFAULT;
        private Next next = Next.NONE;
        private boolean lexicalMain;
        private boolean dollar;
        private boolean escapeParam;
        private boolean noAliasOrMixin;
        private boolean rootEnvElements;
        private boolean noExt;
        private boolean keysNavigation;

        // Artifact references name artifacts in every step unless the
        // reference itself says otherwise (colon notation)
        Spec artifacts() { artifacts = true; artifactItems = Integer.MAX_VALUE; return this; }
        Spec useDefinitions() { useDefinitions = true; return this; }
        Spec global() { global = true; return this; }
        Spec noMessage() { noMessage = true; return this; }
        Spec messages(String def, String art) { undefinedDef = def; undefinedArt = art; return this; }
        Spec allowAutoexposed() { allowAutoexposed = true; return this; }
        Spec check(Check c, String expected, String sloppy) {
            check = c;
            expectedMsgId = expected;
            sloppyMsgId = sloppy;
            return this;
        }
        Spec dependency(Dependency d) { dependency = d; return this; }
        Spec assoc(AssocMode a) { assoc = a; return this; }
        Spec next(Next n) { next = n; return this; }
        Spec lexicalMain() { lexicalMain = true; return this; }
        Spec dollar() { dollar = true; return this; }
        Spec escapeParam() { escapeParam = true; return this; }
        Spec noAliasOrMixin() { noAliasOrMixin = true; return this; }
        Spec rootEnvElements() { rootEnvElements = true; return this; }
        Spec noExt() { noExt = true; return this; }
        Spec keysNavigation() { keysNavigation = true; return this; }
    }
}
