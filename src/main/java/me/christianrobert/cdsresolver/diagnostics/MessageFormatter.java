package me.christianrobert.cdsresolver.diagnostics;

import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Name;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders a message text: chooses the text variant and substitutes the
 * {@code $(ARG)} placeholders with the transformed arguments.
 */
public final class MessageFormatter {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\(([A-Z_]+)\\)");

    private MessageFormatter() {
    }

    public static String format(Map<String, String> texts, Map<String, Object> params) {
        MessageArgs rendered = new MessageArgs();
        Object variant = params.get(MessageArgs.VARIANT);
        if (variant != null) {
            rendered.put(MessageArgs.VARIANT, variant);
        }
        for (Map.Entry<String, Object> entry : params.entrySet()) {
            if (!MessageArgs.VARIANT.equals(entry.getKey())) {
                rendered.put(entry.getKey(), transform(entry.getKey(), entry.getValue(), rendered, params, texts));
            }
        }
        String chosen = rendered.getVariant();
        String text = chosen != null && texts.containsKey(chosen) ? texts.get(chosen) : texts.get(MessageRegistry.STD);
        if (text == null) {
            return "";
        }
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuffer sb = new StringBuffer();
        while (matcher.find()) {
            Object value = rendered.get(matcher.group(1).toLowerCase());
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value.toString() : "<?>"));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static Object transform(String key, Object value, MessageArgs rendered,
                                    Map<String, Object> params, Map<String, String> texts) {
        switch (key) {
            case "name":
            case "id":
            case "alias":
            case "member":
                return quoted(value);
            case "anno":
                String anno = String.valueOf(value);
                return MessageNames.quote(anno.startsWith("@") ? anno : "@" + anno);
            case "code":
            case "newcode":
                return MessageNames.code(String.valueOf(value));
            case "keyword":
                return String.valueOf(value).toUpperCase();
            case "names":
                return transformMany(value, false, rendered, params, texts);
            case "sorted_arts":
                return transformMany(value, true, rendered, params, texts);
            case "art":
            case "service":
            case "target":
            case "type":
                return transformArg(value, rendered, params, texts);
            default:
                return value;
        }
    }

    private static String quoted(Object value) {
        if (value instanceof Artifact) {
            Name name = ((Artifact) value).getName();
            return MessageNames.quote(name != null ? name.getId() : null);
        }
        return MessageNames.quote(value != null ? value.toString() : null);
    }

    private static String transformMany(Object value, boolean sorted, MessageArgs rendered,
                                        Map<String, Object> params, Map<String, String> texts) {
        List<String> names = new ArrayList<>();
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                names.add(item instanceof Artifact ? MessageNames.shortArtName((Artifact) item) : quoted(item));
            }
        } else {
            names.add(quoted(value));
        }
        if (names.size() == 1 && texts.containsKey("one") && !params.containsKey(MessageArgs.VARIANT)) {
            rendered.variant("one");
            return names.get(0);
        }
        if (sorted) {
            names.sort(null);
        }
        return String.join(", ", names);
    }

    private static String transformArg(Object value, MessageArgs rendered,
                                       Map<String, Object> params, Map<String, String> texts) {
        if (!(value instanceof Artifact)) {
            return quoted(value);
        }
        Artifact art = (Artifact) value;
        if (art.getOuter() != null) {
            art = art.getOuter();
        }
        if (art.getName() == null) {
            return quoted(null);
        }
        if (params.containsKey(MessageArgs.VARIANT) || params.containsKey("member")) {
            return MessageNames.shortArtName(art);
        }
        Name name = art.getName();
        String prop = null;
        String member = null;
        if (name.getElement() != null) {
            prop = "element";
            member = name.getElement();
        } else if (name.getParam() != null) {
            prop = "param";
            member = name.getParam();
        } else if (name.getAction() != null) {
            prop = "action";
            member = name.getAction();
        } else if (name.getAlias() != null) {
            prop = "alias";
            member = name.getAlias();
        }
        if (prop == null || !texts.containsKey(prop)) {
            return MessageNames.shortArtName(art);
        }
        rendered.variant(prop);
        rendered.put("member", MessageNames.quote(member));
        return MessageNames.artName(art, prop);
    }
}
