package me.christianrobert.cdsresolver.diagnostics;

import java.util.LinkedHashMap;

/**
 * Substitution arguments of a message; keys are the lower-case placeholder
 * names ({@code art} for {@code $(ART)}), {@code #} selects a text variant.
 */
public class MessageArgs extends LinkedHashMap<String, Object> {

    public static final String VARIANT = "#";

    public static MessageArgs of(String key, Object value) {
        return new MessageArgs().and(key, value);
    }

    public static MessageArgs none() {
        return new MessageArgs();
    }

    public MessageArgs and(String key, Object value) {
        put(key, value);
        return this;
    }

    public MessageArgs variant(String variant) {
        if (variant != null) {
            put(VARIANT, variant);
        }
        return this;
    }

    public String getVariant() {
        Object variant = get(VARIANT);
        return variant != null ? variant.toString() : null;
    }
}
