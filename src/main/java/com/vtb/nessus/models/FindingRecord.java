package com.vtb.nessus.models;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Нормализованная находка Nessus: одна проблема на одном хосте
 */
@Value
@Builder
public class FindingRecord {
    String host;
    String hostname;
    String ipAddress;
    String port;
    String protocol;
    String pluginId;
    String pluginName;
    String pluginFamily;
    int severity;
    String severityLabel;
    String riskFactor;
    /** null, если ни v3, ни v2 оценка не указана */
    Double cvssBase;
    @Builder.Default
    List<String> cves = List.of();
    @Builder.Default
    String description = "";
    @Builder.Default
    String solution = "";
    @Builder.Default
    String pluginOutput = "";

    public boolean hasCvss() {
        return cvssBase != null;
    }
}
