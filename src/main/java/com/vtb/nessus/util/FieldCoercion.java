package com.vtb.nessus.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Безопасные преобразования полей выгрузки Nessus.
 *
 * XML-дерево отдает поле либо отсутствующим, либо скаляром, либо массивом
 * (в зависимости от количества элементов), поэтому ни один метод здесь не
 * бросает исключений: некорректное поле деградирует только само себя.
 */
public final class FieldCoercion {

    /** Ключ, под которым Jackson XML кладет текст элемента с атрибутами */
    public static final String TEXT_KEY = "";

    private FieldCoercion() {
        // utility
    }

    /**
     * null/missing → пустой список, массив → его элементы, иначе список из одного элемента
     */
    public static List<JsonNode> ensureSequence(JsonNode value) {
        if (isAbsent(value)) {
            return List.of();
        }
        if (value.isArray()) {
            List<JsonNode> items = new ArrayList<>(value.size());
            value.forEach(items::add);
            return items;
        }
        return List.of(value);
    }

    /**
     * Текстовое значение узла без окружающих пробелов: скаляр как есть, текст
     * элемента с атрибутами; null для отсутствующего узла, элемента без текста
     * и текста только из пробелов
     */
    public static String text(JsonNode value) {
        if (isAbsent(value)) {
            return null;
        }
        if (value.isValueNode()) {
            return stripToNull(value.asText());
        }
        if (value.isObject()) {
            JsonNode inner = value.get(TEXT_KEY);
            return inner != null && inner.isValueNode() && !inner.isNull() ? stripToNull(inner.asText()) : null;
        }
        return null;
    }

    /**
     * Значение атрибута (или дочернего элемента) по имени
     */
    public static String field(JsonNode node, String name) {
        if (node == null || !node.isObject()) {
            return null;
        }
        return text(node.get(name));
    }

    public static int toInt(String value, int defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static int toInt(JsonNode value, int defaultValue) {
        return toInt(text(value), defaultValue);
    }

    /**
     * Пустая строка, null и мусор дают null, а не 0
     */
    public static Double toFloat(String value) {
        if (value == null) {
            return null;
        }
        String number = value.trim();
        if (number.isEmpty() || !isPlainNumber(number)) {
            return null;
        }
        try {
            return Double.parseDouble(number);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static Double toFloat(JsonNode value) {
        return toFloat(text(value));
    }

    /**
     * Пустые записи отбрасываются, остальные обрезаются; порядок источника сохраняется
     */
    public static List<String> cleanCveList(JsonNode values) {
        List<String> cleaned = new ArrayList<>();
        for (JsonNode value : ensureSequence(values)) {
            String raw = text(value);
            if (raw == null || raw.isEmpty()) {
                continue;
            }
            cleaned.add(raw.trim());
        }
        return cleaned;
    }

    /**
     * "HIGH" → "High", "data_loss" → "Data loss", отсутствие → "None"
     */
    public static String normalizeRiskFactor(String value) {
        if (value == null || value.isEmpty()) {
            return "None";
        }
        return capitalize(value.replace('_', ' ').trim());
    }

    public static String normalizeRiskFactor(JsonNode value) {
        return normalizeRiskFactor(text(value));
    }

    public static String normalizeText(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return value.trim();
    }

    public static String normalizeText(JsonNode value) {
        return normalizeText(text(value));
    }

    /**
     * Пустая строка считается отсутствием значения
     */
    public static String firstNonEmpty(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isEmpty()) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Double.parseDouble понимает суффиксы d/f и hex-запись, которых нет в CVSS
     */
    private static boolean isPlainNumber(String value) {
        char last = value.charAt(value.length() - 1);
        if (last == 'd' || last == 'D' || last == 'f' || last == 'F') {
            return false;
        }
        return value.indexOf('x') < 0 && value.indexOf('X') < 0;
    }

    private static String stripToNull(String value) {
        String stripped = value.strip();
        return stripped.isEmpty() ? null : stripped;
    }

    private static String capitalize(String value) {
        if (value.isEmpty()) {
            return value;
        }
        return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1).toLowerCase(Locale.ROOT);
    }

    private static boolean isAbsent(JsonNode value) {
        return value == null || value.isNull() || value.isMissingNode();
    }
}
