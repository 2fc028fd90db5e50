package org.prossme.bpmn.autolayout.config;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class LayoutConfigHelperTest {

    @Test
    void shouldLoadBundledDefaults() {
        LayoutConfig config = LayoutConfigHelper.loadDefault();

        assertEquals(200, config.startX());
        assertEquals(100, config.startY());
        assertEquals(80, config.horizontalSpacing());
        assertEquals(60, config.verticalSpacing());
        assertEquals(150, config.minLaneHeight());
        assertEquals(350, config.minSubProcessWidth());
        assertEquals(50, config.poolSpacing());
    }

    @Test
    void shouldMergeOverridesOverDefaults() throws IOException {
        LayoutConfig config = LayoutConfigHelper.loadConfigFile("src/test/resources/config/layout-override.json");

        assertEquals(300, config.startX());
        assertEquals(120, config.horizontalSpacing());
        assertEquals(100, config.startY());
        assertEquals(80, config.rowHeight());
    }

    @Test
    void shouldRejectInvalidValues() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> LayoutConfigHelper.loadConfigFile("src/test/resources/config/layout-invalid.json"));
        assertTrue(exception.getMessage().startsWith("Layout config is invalid"));
    }

    @Test
    void shouldFailForMissingFile() {
        assertThrows(IOException.class,
                () -> LayoutConfigHelper.loadConfigFile("src/test/resources/config/does-not-exist.json"));
    }

    @Test
    void shouldMoveOriginOnly() {
        LayoutConfig config = LayoutConfigHelper.loadDefault().withOrigin(0, 0);

        assertEquals(0, config.startX());
        assertEquals(0, config.startY());
        assertEquals(80, config.horizontalSpacing());
    }
}
