package com.vtb.nessus.models;

import java.util.List;

/**
 * Уровни критичности находок Nessus (0-4)
 */
public enum Severity {
    CRITICAL("Critical", 4),
    HIGH("High", 3),
    MEDIUM("Medium", 2),
    LOW("Low", 1),
    INFO("Info", 0);

    /**
     * Канонический порядок меток для гистограмм и сводок по хостам
     */
    public static final List<String> ORDER = List.of(
        CRITICAL.label, HIGH.label, MEDIUM.label, LOW.label, INFO.label);

    private final String label;
    private final int level;

    Severity(String label, int level) {
        this.label = label;
        this.level = level;
    }

    public String getLabel() {
        return label;
    }

    public int getLevel() {
        return level;
    }

    /**
     * Неизвестные значения сводятся к INFO
     */
    public static Severity fromLevel(int level) {
        for (Severity severity : values()) {
            if (severity.level == level) {
                return severity;
            }
        }
        return INFO;
    }
}
