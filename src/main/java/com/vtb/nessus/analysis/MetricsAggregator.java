package com.vtb.nessus.analysis;

import com.vtb.nessus.models.AggregatedMetrics;
import com.vtb.nessus.models.FindingRecord;
import com.vtb.nessus.models.LabelCount;
import com.vtb.nessus.models.Severity;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Считает сводные метрики по всем находкам отчета.
 *
 * Группировка идет через LinkedHashMap, сортировка стабильная, поэтому при
 * равных количествах сохраняется порядок первого появления.
 * Пустой набор находок сюда не передается: он отсекается раньше.
 */
public class MetricsAggregator {

    public static final int DEFAULT_TOP_LIMIT = 10;

    private final int topLimit;

    public MetricsAggregator() {
        this(DEFAULT_TOP_LIMIT);
    }

    public MetricsAggregator(int topLimit) {
        if (topLimit <= 0) {
            throw new IllegalArgumentException("topLimit должен быть положительным: " + topLimit);
        }
        this.topLimit = topLimit;
    }

    public AggregatedMetrics aggregate(List<FindingRecord> findings) {
        if (findings == null) {
            throw new IllegalArgumentException("Список находок не может быть null");
        }
        return AggregatedMetrics.builder()
            .severityCounts(severityHistogram(findings))
            .riskCounts(sortedDescending(countBy(findings, FindingRecord::getRiskFactor)))
            .topHosts(top(countBy(findings, FindingRecord::getHost)))
            .topFamilies(top(countBy(findings, FindingRecord::getPluginFamily)))
            .totalFindings(findings.size())
            .affectedHosts(countBy(findings, FindingRecord::getHost).size())
            .averageCvss(averageCvss(findings))
            .build();
    }

    /**
     * Всегда пять записей в порядке Critical → Info, отсутствующие заполняются нулем
     */
    List<LabelCount> severityHistogram(List<FindingRecord> findings) {
        Map<String, Integer> counts = countBy(findings, FindingRecord::getSeverityLabel);
        List<LabelCount> histogram = new ArrayList<>(Severity.ORDER.size());
        for (String label : Severity.ORDER) {
            histogram.add(LabelCount.of(label, counts.getOrDefault(label, 0)));
        }
        return List.copyOf(histogram);
    }

    List<LabelCount> top(Map<String, Integer> counts) {
        List<LabelCount> sorted = sortedDescending(counts);
        return sorted.size() > topLimit ? List.copyOf(sorted.subList(0, topLimit)) : sorted;
    }

    /**
     * Среднее только по находкам с CVSS; округление как у round(x, 2)
     */
    static Double averageCvss(List<FindingRecord> findings) {
        double sum = 0.0;
        int scored = 0;
        for (FindingRecord finding : findings) {
            if (finding.hasCvss()) {
                sum += finding.getCvssBase();
                scored++;
            }
        }
        if (scored == 0) {
            return null;
        }
        double mean = sum / scored;
        if (Double.isNaN(mean) || Double.isInfinite(mean)) {
            return mean;
        }
        return new BigDecimal(mean).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }

    static Map<String, Integer> countBy(List<FindingRecord> findings, Function<FindingRecord, String> key) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (FindingRecord finding : findings) {
            counts.merge(key.apply(finding), 1, Integer::sum);
        }
        return counts;
    }

    static List<LabelCount> sortedDescending(Map<String, Integer> counts) {
        List<LabelCount> entries = new ArrayList<>(counts.size());
        counts.forEach((label, count) -> entries.add(LabelCount.of(label, count)));
        entries.sort(Comparator.comparingInt(LabelCount::getCount).reversed());
        return List.copyOf(entries);
    }
}
