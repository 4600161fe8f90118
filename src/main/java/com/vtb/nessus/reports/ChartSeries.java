package com.vtb.nessus.reports;

import com.vtb.nessus.config.ReportConfig;
import com.vtb.nessus.models.LabelCount;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Данные одного графика: подписи, значения и цвета столбцов
 */
@Value
public class ChartSeries {

    private static final List<String> RISK_PALETTE =
        List.of("#D6453D", "#F0A202", "#4DA1A9", "#67ACE1", "#B0BEC5");

    String title;
    List<String> labels;
    List<Integer> values;
    List<String> colors;

    public boolean isEmpty() {
        return values.stream().allMatch(value -> value == 0);
    }

    public int maxValue() {
        return values.stream().mapToInt(Integer::intValue).max().orElse(0);
    }

    public static ChartSeries severity(List<LabelCount> counts, ReportConfig config) {
        List<String> colors = new ArrayList<>();
        for (LabelCount entry : counts) {
            colors.add(config.colorFor(entry.getLabel()));
        }
        return of("Findings by Severity", counts, colors);
    }

    public static ChartSeries topHosts(List<LabelCount> counts, ReportConfig config) {
        return of("Top Hosts by Findings", counts, uniform(counts.size(), config.getAccentColor()));
    }

    public static ChartSeries topFamilies(List<LabelCount> counts, ReportConfig config) {
        return of("Top Plugin Families", counts, uniform(counts.size(), config.colorFor("Info")));
    }

    /**
     * Палитра обрезается по числу значений, как в исходном круговом графике
     */
    public static ChartSeries riskFactors(List<LabelCount> counts) {
        List<String> colors = new ArrayList<>();
        for (int i = 0; i < counts.size(); i++) {
            colors.add(i < RISK_PALETTE.size() ? RISK_PALETTE.get(i) : RISK_PALETTE.get(RISK_PALETTE.size() - 1));
        }
        return of("Risk Factor Distribution", counts, colors);
    }

    private static ChartSeries of(String title, List<LabelCount> counts, List<String> colors) {
        List<String> labels = new ArrayList<>(counts.size());
        List<Integer> values = new ArrayList<>(counts.size());
        for (LabelCount entry : counts) {
            labels.add(entry.getLabel());
            values.add(entry.getCount());
        }
        return new ChartSeries(title, List.copyOf(labels), List.copyOf(values), List.copyOf(colors));
    }

    private static List<String> uniform(int size, String color) {
        List<String> colors = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            colors.add(color);
        }
        return colors;
    }
}
