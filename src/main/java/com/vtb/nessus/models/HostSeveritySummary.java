package com.vtb.nessus.models;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Разбивка находок по критичности для пары (хост, IP)
 */
@Value
@Builder
public class HostSeveritySummary {
    String host;
    String ipAddress;
    /** Все пять меток в каноническом порядке */
    Map<String, Integer> severityTotals;

    public int getTotalFindings() {
        int total = 0;
        for (Integer count : severityTotals.values()) {
            total += count;
        }
        return total;
    }

    public int countFor(String severityLabel) {
        return severityTotals.getOrDefault(severityLabel, 0);
    }
}
