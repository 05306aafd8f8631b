package me.christianrobert.cdsresolver.config;

import me.christianrobert.cdsresolver.diagnostics.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResolverConfigTest {

    private ResolverConfig config;

    @BeforeEach
    void setUp() {
        config = new ResolverConfig();
    }

    @Test
    void defaultsEnableAllFeatures() {
        assertTrue(config.isEnabled(ResolverConfig.EXPAND_ELEMENTS, false));
        assertTrue(config.isEnabled(ResolverConfig.SCOPED_REDIRECTIONS, false));
        assertTrue(config.isEnabled(ResolverConfig.AUTOEXPOSE_VIA_COMPOSITION, false));
        assertTrue(config.isEnabled(ResolverConfig.NESTED_PROJECTIONS, false));
        assertFalse(config.isEnabled(ResolverConfig.ATTACH_VALID_NAMES, true));
        assertTrue(config.getSeverityOverrides().isEmpty());
    }

    @Test
    void unknownOrNonBooleanKeysFallBackToDefault() {
        config.setConfigValue("resolve.something", 42);

        assertTrue(config.isEnabled("resolve.unknown", true));
        assertFalse(config.isEnabled("resolve.something", false));
    }

    @Test
    void stringValuesAreParsedAsBooleans() {
        config.setConfigValue(ResolverConfig.EXPAND_ELEMENTS, "false");

        assertFalse(config.isEnabled(ResolverConfig.EXPAND_ELEMENTS, true));
        assertEquals(Boolean.FALSE, config.getConfigValueAsBoolean(ResolverConfig.EXPAND_ELEMENTS));
    }

    @Test
    void severityOverridesSkipMalformedEntries() {
        config.setConfigValue(ResolverConfig.SEVERITY_OVERRIDES,
                "anno-undefined-art=warning, bogus, query-missing-keys = error, x=loud");

        Map<String, Severity> overrides = config.getSeverityOverrides();

        assertEquals(2, overrides.size());
        assertEquals(Severity.WARNING, overrides.get("anno-undefined-art"));
        assertEquals(Severity.ERROR, overrides.get("query-missing-keys"));
        assertFalse(overrides.containsKey("x"));
    }

    @Test
    void stringListTrimsAndDropsEmptyEntries() {
        config.setConfigValue("list", " a, ,b ,");

        assertEquals(List.of("a", "b"), config.getConfigValueAsStringList("list"));
        assertTrue(config.getConfigValueAsStringList("missing").isEmpty());
    }

    @Test
    void updateAndResetConfiguration() {
        config.updateConfiguration(Map.of(ResolverConfig.NESTED_PROJECTIONS, false, "custom", "value"));

        assertFalse(config.isEnabled(ResolverConfig.NESTED_PROJECTIONS, true));
        assertTrue(config.hasConfigKey("custom"));

        config.resetToDefaults();

        assertTrue(config.isEnabled(ResolverConfig.NESTED_PROJECTIONS, false));
        assertFalse(config.hasConfigKey("custom"));
    }
}
