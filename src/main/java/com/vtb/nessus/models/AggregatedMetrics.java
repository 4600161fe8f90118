package com.vtb.nessus.models;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Ключевые метрики по всем находкам отчета
 */
@Value
@Builder
public class AggregatedMetrics {
    List<LabelCount> severityCounts;
    List<LabelCount> riskCounts;
    List<LabelCount> topHosts;
    List<LabelCount> topFamilies;
    int totalFindings;
    int affectedHosts;
    /** Среднее по находкам с CVSS, округленное до 2 знаков; null если CVSS нет ни у одной */
    Double averageCvss;

    public int severityCount(String label) {
        return severityCounts.stream()
            .filter(entry -> entry.getLabel().equals(label))
            .mapToInt(LabelCount::getCount)
            .findFirst()
            .orElse(0);
    }
}
