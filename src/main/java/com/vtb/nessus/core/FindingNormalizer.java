package com.vtb.nessus.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.nessus.models.FindingRecord;
import com.vtb.nessus.models.Severity;

import java.util.List;

import static com.vtb.nessus.util.FieldCoercion.cleanCveList;
import static com.vtb.nessus.util.FieldCoercion.field;
import static com.vtb.nessus.util.FieldCoercion.firstNonEmpty;
import static com.vtb.nessus.util.FieldCoercion.normalizeRiskFactor;
import static com.vtb.nessus.util.FieldCoercion.normalizeText;
import static com.vtb.nessus.util.FieldCoercion.toFloat;
import static com.vtb.nessus.util.FieldCoercion.toInt;

/**
 * Превращает один ReportItem в {@link FindingRecord}.
 * Никогда не падает: у каждого поля есть значение по умолчанию.
 */
public class FindingNormalizer {

    static final String DEFAULT_PLUGIN_ID = "0";
    static final String DEFAULT_PLUGIN_NAME = "Unnamed Plugin";
    static final String DEFAULT_PLUGIN_FAMILY = "Uncategorized";
    static final String HOST_LEVEL_PORT = "0";

    public FindingRecord normalize(JsonNode item, HostIdentity host) {
        int severity = toInt(field(item, "severity"), 0);

        return FindingRecord.builder()
            .host(host.getDisplayName())
            .hostname(host.getHostname())
            .ipAddress(host.getIpAddress())
            .port(composePort(item))
            .protocol(field(item, "protocol"))
            .pluginId(firstNonEmpty(field(item, "pluginID"), DEFAULT_PLUGIN_ID))
            .pluginName(firstNonEmpty(field(item, "pluginName"), DEFAULT_PLUGIN_NAME))
            .pluginFamily(firstNonEmpty(field(item, "pluginFamily"), DEFAULT_PLUGIN_FAMILY))
            .severity(severity)
            .severityLabel(Severity.fromLevel(severity).getLabel())
            .riskFactor(normalizeRiskFactor(field(item, "risk_factor")))
            .cvssBase(resolveCvss(item))
            .cves(List.copyOf(cleanCveList(item.path("cve"))))
            .description(normalizeText(field(item, "description")))
            .solution(normalizeText(field(item, "solution")))
            .pluginOutput(normalizeText(field(item, "plugin_output")))
            .build();
    }

    /**
     * Порт 0 означает находку уровня хоста, а не реальный порт
     */
    static String composePort(JsonNode item) {
        String port = field(item, "port");
        if (port == null || port.isEmpty() || HOST_LEVEL_PORT.equals(port)) {
            return null;
        }
        String service = field(item, "svc_name");
        return service != null && !service.isEmpty() ? port + "/" + service : port;
    }

    /**
     * CVSS v3, затем v2; null если нет ни одной оценки
     */
    static Double resolveCvss(JsonNode item) {
        Double cvss = toFloat(field(item, "cvss3_base_score"));
        if (cvss == null) {
            cvss = toFloat(field(item, "cvss_base_score"));
        }
        return cvss;
    }
}
