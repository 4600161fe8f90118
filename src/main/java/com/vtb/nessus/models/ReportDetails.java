package com.vtb.nessus.models;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Результат обработки выгрузки: метаданные, находки, сводки и метрики
 */
@Value
@Builder
public class ReportDetails {
    ReportMetadata metadata;
    List<FindingRecord> findings;
    List<HostSeveritySummary> hostSummaries;
    AggregatedMetrics aggregates;
    OffsetDateTime generatedAt;

    public boolean hasCriticalFindings() {
        return aggregates != null && aggregates.severityCount(Severity.CRITICAL.getLabel()) > 0;
    }
}
