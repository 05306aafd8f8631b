package me.christianrobert.cdsresolver.config;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.cdsresolver.diagnostics.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@ApplicationScoped
public class ResolverConfig {

    private static final Logger log = LoggerFactory.getLogger(ResolverConfig.class);

    public static final String EXPAND_ELEMENTS = "resolve.expand-elements";
    public static final String SCOPED_REDIRECTIONS = "resolve.scoped-redirections";
    public static final String AUTOEXPOSE_VIA_COMPOSITION = "resolve.autoexpose-via-composition";
    public static final String NESTED_PROJECTIONS = "resolve.nested-projections";
    public static final String ATTACH_VALID_NAMES = "diagnostics.attach-valid-names";
    public static final String SEVERITY_OVERRIDES = "diagnostics.severity-overrides";

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ResolverConfig() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(EXPAND_ELEMENTS, true);
        configuration.put(SCOPED_REDIRECTIONS, true);
        configuration.put(AUTOEXPOSE_VIA_COMPOSITION, true);
        configuration.put(NESTED_PROJECTIONS, true);
        configuration.put(ATTACH_VALID_NAMES, false);
        configuration.put(SEVERITY_OVERRIDES, "");

        log.info("Resolver configuration initialized with default values");
    }

    public Map<String, Object> getAllConfiguration() {
        return new HashMap<>(configuration);
    }

    public Object getConfigValue(String key) {
        return configuration.get(key);
    }

    public String getConfigValueAsString(String key) {
        Object value = configuration.get(key);
        return value != null ? value.toString() : null;
    }

    public Boolean getConfigValueAsBoolean(String key) {
        Object value = configuration.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return null;
    }

    /**
     * Boolean value with fallback for unset or non-boolean entries.
     */
    public boolean isEnabled(String key, boolean defaultValue) {
        Boolean value = getConfigValueAsBoolean(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Gets a configuration value as a list of strings.
     * Supports comma-separated values: "a,b,c"; whitespace is trimmed, empty entries are dropped.
     */
    public List<String> getConfigValueAsStringList(String key) {
        String value = getConfigValueAsString(key);
        if (value == null || value.trim().isEmpty()) {
            return new ArrayList<>();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    /**
     * Parses {@code diagnostics.severity-overrides}: entries {@code message-id=severity};
     * malformed entries are skipped with a warning.
     */
    public Map<String, Severity> getSeverityOverrides() {
        Map<String, Severity> overrides = new LinkedHashMap<>();
        for (String entry : getConfigValueAsStringList(SEVERITY_OVERRIDES)) {
            int eq = entry.indexOf('=');
            Severity severity = eq > 0 ? Severity.fromString(entry.substring(eq + 1)) : null;
            if (severity == null) {
                log.warn("Ignoring malformed severity override '{}'", entry);
                continue;
            }
            overrides.put(entry.substring(0, eq).trim(), severity);
        }
        return overrides;
    }

    public void updateConfiguration(Map<String, Object> newConfig) {
        log.info("Updating configuration with {} entries", newConfig.size());

        newConfig.forEach((key, value) -> {
            Object oldValue = configuration.put(key, value);
            if (log.isDebugEnabled()) {
                log.debug("Config updated: {} = {} (was: {})", key, value, oldValue);
            }
        });
    }

    public void setConfigValue(String key, Object value) {
        Object oldValue = configuration.put(key, value);
        log.debug("Config value set: {} = {} (was: {})", key, value, oldValue);
    }

    public boolean hasConfigKey(String key) {
        return configuration.containsKey(key);
    }

    public void resetToDefaults() {
        log.info("Resetting resolver configuration to defaults");
        configuration.clear();
        initializeDefaultConfiguration();
    }
}
