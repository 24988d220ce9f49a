package me.golemcore.orchestrator.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ContextPruningSettingsTest {

    @Test
    void shouldReturnDefaultsWithoutOverrides() {
        assertSame(ContextPruningSettings.DEFAULTS, ContextPruningSettings.resolve(null));
        assertEquals(ContextPruningSettings.DEFAULTS,
                ContextPruningSettings.resolve(new ContextPruningSettings.Overrides()));
    }

    @Test
    void shouldMergeNestedGroupsFieldByField() {
        ContextPruningSettings.Overrides overrides = new ContextPruningSettings.Overrides();
        overrides.setEnabled(true);
        overrides.setKeepLastAssistants(1);
        overrides.getSoftTrim().setHeadChars(200);
        overrides.getHardClear().setPlaceholder("[cleared]");

        ContextPruningSettings settings = ContextPruningSettings.resolve(overrides);

        assertTrue(settings.isEnabled());
        assertEquals(1, settings.getKeepLastAssistants());
        assertEquals(0.3, settings.getSoftTrimRatio());
        assertEquals(50_000, settings.getMinPrunableToolChars());
        assertEquals(new ContextPruningSettings.SoftTrim(4_000, 200, 1_500), settings.getSoftTrim());
        assertEquals(new ContextPruningSettings.HardClear(true, "[cleared]"), settings.getHardClear());
    }

    @Test
    void shouldTolerateMissingNestedGroups() {
        ContextPruningSettings.Overrides overrides = new ContextPruningSettings.Overrides();
        overrides.setSoftTrim(null);
        overrides.setHardClear(null);
        overrides.setHardClearRatio(0.8);

        ContextPruningSettings settings = ContextPruningSettings.resolve(overrides);

        assertEquals(0.8, settings.getHardClearRatio());
        assertEquals(ContextPruningSettings.DEFAULTS.getSoftTrim(), settings.getSoftTrim());
        assertEquals(ContextPruningSettings.DEFAULT_PLACEHOLDER, settings.getHardClear().placeholder());
    }
}
