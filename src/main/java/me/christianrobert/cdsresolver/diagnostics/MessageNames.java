package me.christianrobert.cdsresolver.diagnostics;

import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Kind;
import me.christianrobert.cdsresolver.model.Name;

import java.util.ArrayList;
import java.util.List;

/**
 * Quoting and naming of artifacts in message texts.
 */
public final class MessageNames {

    private MessageNames() {
    }

    public static String quote(String name) {
        return name != null ? "“" + name + "”" : "<?>";
    }

    public static String code(String code) {
        return "«" + code + "»";
    }

    /**
     * Short name: {@code “S.E:elem”} for simple element names, the full
     * {@link #artName} otherwise.
     */
    public static String shortArtName(Artifact art) {
        Name name = art.getName();
        if (name == null) {
            return quote(null);
        }
        if (name.getSelect() == null && name.getAction() == null && name.getAlias() == null
                && name.getParam() == null && name.getAbsolute() != null) {
            return quote(name.getElement() != null ? name.getAbsolute() + ":" + name.getElement() : name.getAbsolute());
        }
        return artName(art, null);
    }

    /**
     * Full name like {@code “S.V”/query:2/element:“a.b”}; the name part given
     * by {@code omit} ({@code element}, {@code param}, {@code action}) is left out.
     */
    public static String artName(Artifact art, String omit) {
        Name name = art.getName();
        List<String> parts = new ArrayList<>();
        if (name.getAbsolute() != null) {
            parts.add(quote(name.getAbsolute()));
        }
        Integer select = name.getSelect();
        if (select != null && (select > 1 || art.getKind() != Kind.ELEMENT)) {
            parts.add("query:" + select);
        }
        if (name.getAction() != null && !"action".equals(omit)) {
            parts.add(actionKind(art) + ":" + quote(name.getAction()));
        }
        if (name.getAlias() != null) {
            parts.add((art.getKind() == Kind.MIXIN ? "mixin:" : "alias:") + quote(name.getAlias()));
        }
        if (name.getParam() != null && !"param".equals(omit)) {
            parts.add(name.getParam().isEmpty() ? "returns" : "param:" + quote(name.getParam()));
        }
        if (name.getElement() != null && !"element".equals(omit)) {
            parts.add((art.getKind() == Kind.ENUM ? "enum:" : "element:") + quote(name.getElement()));
        }
        return String.join("/", parts);
    }

    /**
     * Semantic location of a diagnostic, e.g. {@code entity:“S.E”/element:“x”}.
     */
    public static String homeName(Artifact art) {
        if (art == null) {
            return null;
        }
        if (art.getOuter() != null) {
            return homeName(art.getOuter());
        }
        if (art.getName() == null) {
            return null;
        }
        if (art.getKind() == Kind.USING) {
            return "using:" + quote(art.getName().getId());
        }
        Artifact main = art.getMain() != null ? art.getMain() : art;
        return main.getKind().getDisplayName() + ":" + artName(art, null);
    }

    private static String actionKind(Artifact art) {
        Artifact current = art;
        while (current != null && current.getMain() != null) {
            if (current.getKind() == Kind.ACTION || current.getKind() == Kind.FUNCTION) {
                return current.getKind().getDisplayName();
            }
            current = current.getParent();
        }
        return "action";
    }
}
