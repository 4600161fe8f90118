package com.vtb.nessus.analysis;

import com.vtb.nessus.models.FindingRecord;
import com.vtb.nessus.models.HostSeveritySummary;
import com.vtb.nessus.models.Severity;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Строит разбивку по критичности для каждой пары (хост, IP).
 *
 * Хосты с одинаковым именем, но разными IP дают разные строки; хост без IP
 * группируется под ключом с null IP. Строки сортируются по общему числу
 * находок по убыванию, при равенстве по имени хоста и IP.
 */
public class HostSummarizer {

    private static final Comparator<HostSeveritySummary> ORDER =
        Comparator.comparingInt(HostSeveritySummary::getTotalFindings).reversed()
            .thenComparing(HostSeveritySummary::getHost, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(HostSeveritySummary::getIpAddress, Comparator.nullsFirst(Comparator.naturalOrder()));

    public List<HostSeveritySummary> summarize(List<FindingRecord> findings) {
        if (findings == null) {
            throw new IllegalArgumentException("Список находок не может быть null");
        }

        Map<HostKey, Map<String, Integer>> grouped = new LinkedHashMap<>();
        for (FindingRecord finding : findings) {
            HostKey key = new HostKey(finding.getHost(), finding.getIpAddress());
            grouped.computeIfAbsent(key, ignored -> zeroFilled())
                .merge(finding.getSeverityLabel(), 1, Integer::sum);
        }

        List<HostSeveritySummary> summaries = new ArrayList<>(grouped.size());
        grouped.forEach((key, totals) -> summaries.add(HostSeveritySummary.builder()
            .host(key.getHost())
            .ipAddress(key.getIpAddress())
            .severityTotals(Collections.unmodifiableMap(totals))
            .build()));
        summaries.sort(ORDER);
        return List.copyOf(summaries);
    }

    private static Map<String, Integer> zeroFilled() {
        Map<String, Integer> totals = new LinkedHashMap<>();
        for (String label : Severity.ORDER) {
            totals.put(label, 0);
        }
        return totals;
    }

    @Value
    private static class HostKey {
        String host;
        String ipAddress;
    }
}
