package com.vtb.nessus.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReportConfigTest {

    @Test
    void loadsBundledConfiguration() {
        ReportConfig config = ReportConfig.load();

        assertEquals(10, config.getTopLimit());
        assertEquals(10, config.getCacheCapacity());
        assertEquals(100, config.getMaxUploadMb());
        assertEquals("Nessus Assessment", config.getDefaultReportName());
        assertSame(config, ReportConfig.load(), "Конфигурация загружается один раз");
    }

    @Test
    void missingResourceFallsBackToDefaults() {
        ReportConfig config = ReportConfig.loadFrom("does-not-exist.yaml");

        assertEquals(10, config.getTopLimit());
        assertEquals(25, config.getPreviewFindings());
        assertEquals("#263746", config.getAccentColor());
        assertEquals("#B90E0A", config.colorFor("Critical"));
    }

    @Test
    void invalidValuesReplacedAndColorsMerged() {
        ReportConfig config = new ReportConfig();
        config.setTopLimit(-1);
        config.setCacheCapacity(0);
        config.setSeverityColors(Map.of("High", "#000000", "Info", " "));

        config.ensureDefaults();

        assertEquals(10, config.getTopLimit());
        assertEquals(10, config.getCacheCapacity());
        assertEquals("#000000", config.colorFor("High"));
        assertEquals("#67ACE1", config.colorFor("Info"), "Пустой цвет игнорируется");
        assertEquals(config.getAccentColor(), config.colorFor("Unknown"));
    }
}
