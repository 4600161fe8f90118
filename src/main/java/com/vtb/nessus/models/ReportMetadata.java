package com.vtb.nessus.models;

import lombok.Builder;
import lombok.Value;

/**
 * Метаданные отчета, заданные пользователем
 */
@Value
@Builder
public class ReportMetadata {

    public static final String DEFAULT_NAME = "Nessus Assessment";

    String name;
    String customer;
    String scanDate;

    /**
     * Обрезает пробелы; пустое имя заменяется на {@link #DEFAULT_NAME}
     */
    public static ReportMetadata of(String name, String customer, String scanDate) {
        return of(name, customer, scanDate, DEFAULT_NAME);
    }

    public static ReportMetadata of(String name, String customer, String scanDate, String defaultName) {
        String trimmedName = trim(name);
        return ReportMetadata.builder()
            .name(trimmedName.isEmpty() ? defaultName : trimmedName)
            .customer(trim(customer))
            .scanDate(trim(scanDate))
            .build();
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}
