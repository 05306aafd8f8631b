package me.christianrobert.cdsresolver.diagnostics;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Message ids with their default severity and text variants.
 *
 * <p>A message without registered severity gets the severity of the reporting
 * call ({@code error}, {@code warning}, {@code info}).  Texts use
 * {@code $(ARG)} placeholders; variant {@code std} is the default.
 */
public final class MessageRegistry {

    public static final String STD = "std";

    private static final Map<String, Severity> SEVERITIES = new HashMap<>();
    private static final Map<String, Map<String, String>> TEXTS = new HashMap<>();

    static {
        // Registered severities
        for (String id : new String[] {
                "anno-duplicate", "anno-duplicate-unrelated-layer",
                "args-expected-named", "args-no-params", "args-undefined-param",
                "assoc-in-array", "assoc-as-type", "expr-no-filter",
                "expected-type", "expected-actionparam-type", "expected-event-type", "expected-struct",
                "expected-const", "expected-entity", "expected-source", "expected-target",
                "ref-sloppy-type", "ref-sloppy-actionparam-type", "ref-sloppy-event-type",
                "ref-invalid-typeof", "query-undefined-element", "redirected-implicitly-ambiguous",
                "ref-autoexposed", "ref-undefined-art", "ref-undefined-def", "ref-undefined-var",
                "ref-undefined-element", "ref-undefined-param", "ref-obsolete-parameters", "ref-rejected-on",
                "rewrite-key-not-covered-explicit", "rewrite-key-not-covered-implicit",
                "rewrite-key-not-matched-explicit", "rewrite-key-not-matched-implicit",
                "rewrite-key-for-unmanaged", "rewrite-not-supported", "rewrite-on-for-managed" }) {
            SEVERITIES.put(id, Severity.ERROR);
        }
        SEVERITIES.put("ref-sloppy-target", Severity.WARNING);
        SEVERITIES.put("type-ambiguous-target", Severity.WARNING);
        for (String id : new String[] {
                "anno-undefined-action", "anno-undefined-art", "anno-undefined-def",
                "anno-undefined-element", "anno-undefined-param" }) {
            SEVERITIES.put(id, Severity.INFO);
        }

        // Name resolution
        text("ref-undefined-def", STD, "Artifact $(ART) has not been found",
                "element", "Artifact $(ART) has no element $(MEMBER)");
        text("ref-undefined-art", STD, "No artifact has been found with name $(NAME)");
        text("ref-undefined-element", STD, "Element $(ART) has not been found",
                "element", "Artifact $(ART) has no element $(MEMBER)");
        text("ref-undefined-var", STD, "Element or variable $(ID) has not been found");
        text("ref-undefined-param", STD, "Parameter $(ART) has not been found",
                "param", "Entity $(ART) has no parameter $(MEMBER)");
        text("ref-undefined-excluding", STD, "Element $(NAME) has not been found");
        text("ref-rejected-on", STD, "Do not refer to $(ID) in the explicit ON of a redirection",
                "mixin", "Do not refer to a mixin like $(ID) in the explicit ON of a redirection",
                "alias", "Do not refer to a source element (via table alias $(ID)) in the explicit ON of a redirection");
        text("ref-invalid-typeof", STD, "Do not use $(KEYWORD) for the type reference here",
                "select", "Do not use $(KEYWORD) for type references in queries");
        text("ref-obsolete-parameters", STD, "Obsolete $(CODE) - replace by $(NEWCODE)");
        text("ref-unexpected-scope", STD, "Unexpected parameter reference");
        text("ref-autoexposed", STD, "An autoexposed entity can't be referred to - expose entity $(ART) explicitly");
        text("ref-cyclic", STD, "Illegal circular reference to $(ART)",
                "element", "Illegal circular reference to element $(MEMBER) of $(ART)");
        text("ref-ambiguous", STD, "Ambiguous $(ID), replace by $(NAMES)");
        text("ref-expected-foreign-key", STD,
                "You can't follow associations other than to elements referred to in a managed association's key");
        text("ref-unexpected-navigation", STD,
                "Following an association is not allowed in an association key definition");
        text("expr-no-subquery", STD, "Subqueries are not supported here");
        text("ref-sloppy-type", STD, "A type or an element is expected here");
        text("ref-sloppy-actionparam-type", STD, "A type, an element, or a service entity is expected here");
        text("ref-sloppy-event-type", STD, "A type, an element, an event, or a service entity is expected here");
        text("ref-sloppy-target", STD, "An entity or an aspect (not type) is expected here");
        text("expected-actionparam-type", STD, "A type, an element, or a service entity is expected here");
        text("expected-const", STD, "A constant value is expected here");
        text("expected-event-type", STD, "A type, an element, an event, or a service entity is expected here");
        text("expected-entity", STD, "An entity, projection or view is expected here");
        text("expected-struct", STD, "A type, entity, aspect or event with direct elements is expected here");
        text("expected-type", STD, "A type or an element is expected here");
        text("expected-source", STD, "A query source must be an entity or an association");
        text("expected-target", STD, "An entity or an aspect is expected here");
        text("expr-no-filter", STD, "A filter can only be provided when navigating along associations",
                "from", "A filter can only be provided for the source entity or associations");
        text("args-no-params", STD, "Parameters can only be provided when navigating along associations",
                "from", "Parameters can only be provided for the source entity or associations",
                "entity", "Entity $(ART) has no parameters",
                "type", "Type $(ART) has no parameters");
        text("args-expected-named", STD, "Named parameters must be provided for the entity");
        text("args-undefined-param", STD, "Entity $(ART) has no parameter $(ID)",
                "type", "Type $(ART) has no parameter $(ID)");
        text("args-too-many", STD, "Too many arguments for type $(ART)");

        // Definitions
        text("duplicate-definition", STD, "Duplicate definition of $(NAME)",
                "element", "Duplicate definition of element $(NAME)",
                "$tableAlias", "Duplicate definition of table alias or mixin $(NAME)");
        text("duplicate-using", STD, "Duplicate definition of top-level name $(NAME)");
        text("query-req-alias", STD, "Table alias is required for this subquery");
        text("duplicate-key-ref", STD, "The same target reference has already been used in a key definition");
        text("duplicate-autoexposed", STD, "Name $(ART) of autoexposed entity for $(TARGET) collides with other definition");
        text("assoc-in-array", STD, "An association can't be used for arrays or parameters");
        text("assoc-as-type", STD, "An unmanaged association can't be defined as type",
                "comp", "An unmanaged composition can't be defined as type");
        text("assoc-in-mixin", STD, "Managed associations are not allowed for MIXIN elements");
        text("non-assoc-in-mixin", STD, "Only unmanaged associations are allowed in mixin clauses");
        text("assoc-as-type-of", STD, "An unmanaged association can't be used as type");
        text("type-missing-target", STD, "The type $(TYPE) can't be used directly because it's compiler internal");
        text("unexpected-key", STD, "KEY is only supported for elements in an entity or an aspect",
                "sub", "KEY is only supported for top-level elements");
        text("assoc-target-not-in-service", STD, "Target $(TARGET) of association is outside any service",
                "define", "Target $(TARGET) of explicitly defined association is outside any service",
                "select", "Target $(TARGET) of explicitly selected association is outside any service");
        text("assoc-outside-service", STD, "Association target $(TARGET) is outside any service");

        // Annotations
        text("anno-duplicate", STD, "Duplicate assignment with $(ANNO)");
        text("anno-duplicate-unrelated-layer", STD, "Duplicate assignment with $(ANNO)");
        text("anno-mismatched-ellipsis", STD,
                "An array with $(CODE) can only be used if there is an assignment below with an array value");
        text("anno-unexpected-ellipsis", STD, "Unexpected $(CODE) in annotation assignment");
        text("anno-undefined-def", STD, "Artifact $(ART) has not been found");
        text("anno-undefined-art", STD, "No artifact has been found with name $(NAME)");
        text("anno-undefined-element", STD, "Element $(ART) has not been found",
                "element", "Artifact $(ART) has no element $(MEMBER)");
        text("anno-undefined-action", STD, "Action $(ART) has not been found",
                "action", "Artifact $(ART) has no action $(MEMBER)");
        text("anno-undefined-param", STD, "Parameter $(ART) has not been found",
                "param", "Artifact $(ART) has no parameter $(MEMBER)");

        // Queries
        text("wildcard-ambiguous", STD, "Ambiguous wildcard, select $(ID) explicitly with $(NAMES)");
        text("wildcard-excluding-one", STD, "This select item replaces $(ID) from table alias $(ALIAS)");
        text("wildcard-excluding-many", STD, "This select item replaces $(ID) from two or more sources");
        text("query-missing-element", STD, "Element $(ID) is missing in specified elements");
        text("query-unspecified-element", STD, "Element $(ID) does not result from the query");
        text("query-from-many", STD, "Selecting from to-many association $(ART) - key properties are not propagated");
        text("query-missing-keys", STD, "Keys $(NAMES) have not been projected - key properties are not propagated",
                "one", "Key $(NAMES) has not been projected - key properties are not propagated");
        text("query-navigate-many", STD,
                "Navigating along to-many association $(ART) - key properties are not propagated");
        text("query-req-name", STD, "Alias name is required for this select item");
        text("query-undefined-element", STD, "Element $(ID) has not been found in the elements of the query");
        text("query-unsupported-nested", STD, "Nested projections with $(KEYWORD) are not supported here");

        // Redirection and rewriting
        text("redirected-implicitly-ambiguous", STD,
                "Target $(TARGET) is exposed in service $(SERVICE) by multiple projections $(SORTED_ARTS) - no implicit redirection",
                "scoped", "Target $(TARGET) is defined in scope $(ART) which exposed in service $(SERVICE) by multiple projections - no implicit redirection");
        text("type-ambiguous-target", STD,
                "Target $(TARGET) is exposed in service $(SERVICE) by multiple projections $(SORTED_ARTS) - no implicit redirection",
                "scoped", "Target $(TARGET) is defined in scope $(ART) which exposed in service $(SERVICE) by multiple projections - no implicit redirection");
        text("redirected-no-assoc", STD, "Only an association can be redirected");
        text("redirected-to-same", STD, "The redirected target is the original $(ART)");
        text("redirected-to-complex", STD, "Redirection involves the complex view $(ART)",
                "target", "The redirected target $(ART) is a complex view");
        text("redirected-to-ambiguous", STD, "The redirected target originates more than once from $(ART)");
        text("redirected-to-unrelated", STD, "The redirected target does not originate from $(ART)");
        text("rewrite-not-supported", STD, "The ON condition is not rewritten here - provide an explicit ON condition");
        text("rewrite-key-for-unmanaged", STD,
                "Do not specify an $(KEYWORD) condition when redirecting the managed association $(ART)");
        text("rewrite-on-for-managed", STD,
                "Do not specify foreign keys when redirecting the unmanaged association $(ART)");
        text("rewrite-key-not-matched-implicit", STD, "No key $(NAME) is defined in original target $(TARGET)");
        text("rewrite-key-not-matched-explicit", STD, "No foreign key $(NAME) is specified in association $(ART)");
        text("rewrite-key-not-covered-implicit", STD, "Specify keys $(NAMES) of original target $(TARGET) as foreign keys",
                "one", "Specify key $(NAMES) of original target $(TARGET) as foreign key");
        text("rewrite-key-not-covered-explicit", STD, "Specify foreign keys $(NAMES) of association $(ART)",
                "one", "Specify foreign key $(NAMES) of association $(ART)");
        text("rewrite-shadowed", STD, "This element is not originally referred to in the ON condition of association $(ART)");
        text("rewrite-not-projected", STD, "Projected association $(NAME) uses non-projected element $(ART)",
                "element", "Projected association $(NAME) uses non-projected element $(MEMBER) of $(ART)");
        text("rewrite-unsupported-sub-element", STD,
                "Rewriting the ON condition of unmanaged association in sub element is not supported");
        text("rewrite-unsupported-subquery", STD,
                "Selecting unmanaged associations from a sub query is not supported");
        text("rewrite-undefined-key", STD, "Foreign key $(ID) has not been found in target $(ART)");
    }

    private MessageRegistry() {
    }

    private static void text(String id, String... variantsAndTexts) {
        Map<String, String> texts = new LinkedHashMap<>();
        for (int i = 0; i + 1 < variantsAndTexts.length; i += 2) {
            texts.put(variantsAndTexts[i], variantsAndTexts[i + 1]);
        }
        TEXTS.put(id, Collections.unmodifiableMap(texts));
    }

    /** Registered default severity, {@code null} if the reporting call decides. */
    public static Severity defaultSeverity(String id) {
        return id != null ? SEVERITIES.get(id) : null;
    }

    public static boolean isRegistered(String id) {
        return id != null && (SEVERITIES.containsKey(id) || TEXTS.containsKey(id));
    }

    /** Text variants of a message; empty if the message has none. */
    public static Map<String, String> texts(String id) {
        Map<String, String> texts = id != null ? TEXTS.get(id) : null;
        return texts != null ? texts : Collections.emptyMap();
    }
}
