package com.vtb.nessus.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vtb.nessus.models.ReportMetadata;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Конфигурация генератора отчетов из report-config.yaml
 */
@Slf4j
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReportConfig {

    static final String RESOURCE = "report-config.yaml";

    private static final int DEFAULT_TOP_LIMIT = 10;
    private static final int DEFAULT_PREVIEW_FINDINGS = 25;
    private static final int DEFAULT_CACHE_CAPACITY = 10;
    private static final int DEFAULT_MAX_UPLOAD_MB = 100;

    private Integer topLimit;
    private Integer previewFindings;
    private Integer cacheCapacity;
    private Integer maxUploadMb;
    private String defaultReportName;
    private Map<String, String> severityColors;
    private String accentColor;

    private static volatile ReportConfig instance;

    /**
     * Загрузить конфигурацию из classpath (один раз на процесс)
     */
    public static ReportConfig load() {
        ReportConfig current = instance;
        if (current == null) {
            synchronized (ReportConfig.class) {
                current = instance;
                if (current == null) {
                    current = loadFrom(RESOURCE);
                    instance = current;
                }
            }
        }
        return current;
    }

    static ReportConfig loadFrom(String resource) {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try (InputStream is = ReportConfig.class.getClassLoader().getResourceAsStream(resource)) {
            ReportConfig config;
            if (is == null) {
                log.warn("{} не найден в classpath, используются значения по умолчанию", resource);
                config = new ReportConfig();
            } else {
                config = mapper.readValue(is, ReportConfig.class);
                if (config == null) {
                    config = new ReportConfig();
                }
            }
            config.ensureDefaults();
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
        }
    }

    public static ReportConfig defaults() {
        ReportConfig config = new ReportConfig();
        config.ensureDefaults();
        return config;
    }

    void ensureDefaults() {
        if (topLimit == null || topLimit <= 0) {
            topLimit = DEFAULT_TOP_LIMIT;
        }
        if (previewFindings == null || previewFindings < 0) {
            previewFindings = DEFAULT_PREVIEW_FINDINGS;
        }
        if (cacheCapacity == null || cacheCapacity <= 0) {
            cacheCapacity = DEFAULT_CACHE_CAPACITY;
        }
        if (maxUploadMb == null || maxUploadMb <= 0) {
            maxUploadMb = DEFAULT_MAX_UPLOAD_MB;
        }
        if (defaultReportName == null || defaultReportName.isBlank()) {
            defaultReportName = ReportMetadata.DEFAULT_NAME;
        }
        if (accentColor == null || accentColor.isBlank()) {
            accentColor = "#263746";
        }
        Map<String, String> colors = new LinkedHashMap<>();
        colors.put("Critical", "#B90E0A");
        colors.put("High", "#D6453D");
        colors.put("Medium", "#F0A202");
        colors.put("Low", "#4DA1A9");
        colors.put("Info", "#67ACE1");
        if (severityColors != null) {
            severityColors.forEach((label, color) -> {
                if (label != null && color != null && !color.isBlank()) {
                    colors.put(label, color);
                }
            });
        }
        severityColors = colors;
    }

    public String colorFor(String severityLabel) {
        return severityColors.getOrDefault(severityLabel, accentColor);
    }
}
