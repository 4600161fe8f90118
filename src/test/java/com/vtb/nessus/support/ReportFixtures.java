package com.vtb.nessus.support;

import com.vtb.nessus.core.NessusParseException;
import com.vtb.nessus.core.NessusParser;
import com.vtb.nessus.models.FindingRecord;
import com.vtb.nessus.models.ReportDetails;
import com.vtb.nessus.models.ReportMetadata;
import com.vtb.nessus.models.Severity;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Общие данные для тестов генераторов, веба и CLI
 */
public final class ReportFixtures {

    public static final Instant GENERATED_AT = Instant.parse("2026-10-12T10:15:30Z");

    private ReportFixtures() {
    }

    public static byte[] resource(String name) {
        try (InputStream in = ReportFixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalStateException("Нет фикстуры " + name);
            }
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static NessusParser parser() {
        return new NessusParser(10, Clock.fixed(GENERATED_AT, ZoneOffset.UTC));
    }

    public static ReportDetails sampleDetails(ReportMetadata metadata) throws NessusParseException {
        return parser().buildReport(metadata, resource("sample.nessus"));
    }

    public static ReportDetails sampleDetails() throws NessusParseException {
        return sampleDetails(ReportMetadata.of("Quarterly scan", "ACME Corp", "2026-10-12"));
    }

    public static FindingRecord finding(String host, String ip, Severity severity, String family,
                                        String risk, Double cvss) {
        return FindingRecord.builder()
            .host(host)
            .ipAddress(ip)
            .pluginId("1")
            .pluginName("Plugin")
            .pluginFamily(family)
            .severity(severity.getLevel())
            .severityLabel(severity.getLabel())
            .riskFactor(risk)
            .cvssBase(cvss)
            .build();
    }
}
