package com.vtb.nessus.reports;

import com.vtb.nessus.config.ReportConfig;
import com.vtb.nessus.models.AggregatedMetrics;
import com.vtb.nessus.models.FindingRecord;
import com.vtb.nessus.models.LabelCount;
import com.vtb.nessus.models.ReportDetails;
import com.vtb.nessus.models.ReportMetadata;
import com.vtb.nessus.models.Severity;
import com.vtb.nessus.support.ReportFixtures;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HtmlReportGeneratorTest {

    private final HtmlReportGenerator generator = new HtmlReportGenerator(ReportConfig.defaults());

    @Test
    void rendersSummaryChartsAndTables() throws Exception {
        String html = generator.renderHtml(ReportFixtures.sampleDetails());

        assertTrue(html.startsWith("<!DOCTYPE html>"));
        assertTrue(html.contains("<h1>Quarterly scan</h1>"));
        assertTrue(html.contains("Customer: ACME Corp"));
        assertTrue(html.contains("Scan date: 2026-10-12"));
        assertTrue(html.contains("Generated: 12.10.2026 10:15:30 UTC"));
        assertTrue(html.contains("7.20"), "Средний CVSS с двумя знаками");
        assertTrue(html.contains("<canvas id=\"severityChart\">"));
        assertTrue(html.contains("<canvas id=\"riskChart\">"));
        assertTrue(html.contains("chart.umd.min.js"));
        assertTrue(html.contains("web01.example.com"));
        assertTrue(html.contains("CVE-2021-0001, CVE-2021-0002"));
        assertTrue(html.contains("<td>N/A</td>"), "Находка без CVSS показывает N/A");
        assertTrue(html.contains("<td>9.8</td>"));
        assertFalse(html.contains("No data available"));
    }

    @Test
    void escapesUserControlledText() throws Exception {
        ReportDetails details = ReportFixtures.sampleDetails(
            ReportMetadata.of("<script>alert('x')</script>", "A & B", ""));

        String html = generator.renderHtml(details);

        assertFalse(html.contains("<script>alert('x')</script>"));
        assertTrue(html.contains("&lt;script&gt;alert(&#39;x&#39;)&lt;/script&gt;"));
        assertTrue(html.contains("Customer: A &amp; B"));
        assertFalse(html.contains("Scan date:"), "Пустая дата не выводится");
    }

    @Test
    void emptyChartsShowPlaceholder() throws Exception {
        FindingRecord finding = ReportFixtures.finding("h", null, Severity.INFO, "F", "None", null);
        AggregatedMetrics aggregates = AggregatedMetrics.builder()
            .severityCounts(List.of(
                LabelCount.of("Critical", 0), LabelCount.of("High", 0), LabelCount.of("Medium", 0),
                LabelCount.of("Low", 0), LabelCount.of("Info", 0)))
            .riskCounts(List.of())
            .topHosts(List.of())
            .topFamilies(List.of())
            .totalFindings(1)
            .affectedHosts(1)
            .averageCvss(null)
            .build();
        ReportDetails details = ReportDetails.builder()
            .metadata(ReportMetadata.of("", "", ""))
            .findings(List.of(finding))
            .hostSummaries(List.of())
            .aggregates(aggregates)
            .generatedAt(OffsetDateTime.of(2026, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC))
            .build();

        String html = generator.renderHtml(details);

        assertTrue(html.contains("No data available"));
        assertFalse(html.contains("<canvas"));
        assertTrue(html.contains("<h1>Nessus Assessment</h1>"));
        assertTrue(html.contains(">N/A</div>"), "Средний CVSS без оценок");
    }

    @Test
    void formatsCvssValues() {
        assertEquals("N/A", HtmlReportGenerator.formatCvss(null));
        assertEquals("7.5", HtmlReportGenerator.formatCvss(7.5));
        assertEquals("5.00", HtmlReportGenerator.formatAverageCvss(5.0));
        assertEquals("", HtmlReportGenerator.escapeHtml(null));
        assertEquals("html", generator.getFileExtension());
    }
}
