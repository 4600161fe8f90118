package com.vtb.nessus.reports;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.nessus.config.ReportConfig;
import com.vtb.nessus.models.AggregatedMetrics;
import com.vtb.nessus.models.FindingRecord;
import com.vtb.nessus.models.HostSeveritySummary;
import com.vtb.nessus.models.ReportDetails;
import com.vtb.nessus.models.ReportMetadata;
import com.vtb.nessus.models.Severity;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Генератор HTML отчетов с графиками Chart.js
 */
@Slf4j
public class HtmlReportGenerator implements ReportGenerator {

    static final DateTimeFormatter DATE_FORMATTER =
        DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm:ss 'UTC'");

    private final ReportConfig config;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public HtmlReportGenerator() {
        this(ReportConfig.load());
    }

    public HtmlReportGenerator(ReportConfig config) {
        this.config = config;
    }

    @Override
    public byte[] render(ReportDetails details) throws IOException {
        return renderHtml(details).getBytes(StandardCharsets.UTF_8);
    }

    public String renderHtml(ReportDetails details) throws IOException {
        if (details == null) {
            throw new IllegalArgumentException("ReportDetails не может быть null");
        }
        AggregatedMetrics aggregates = details.getAggregates();
        ReportMetadata metadata = details.getMetadata();

        StringBuilder html = new StringBuilder();
        html.append("""
            <!DOCTYPE html>
            <html lang="en">
            <head>
                <meta charset="UTF-8">
                <meta name="viewport" content="width=device-width, initial-scale=1.0">
                <title>%s</title>
                <style>
                    * { margin: 0; padding: 0; box-sizing: border-box; }
                    body { font-family: -apple-system, 'Segoe UI', Roboto, Arial, sans-serif; background: #efefef; color: %s; padding: 20px; }
                    .container { max-width: 1200px; margin: 0 auto; background: white; border-radius: 12px; box-shadow: 0 2px 8px rgba(0,0,0,0.1); }
                    .header { background: %s; color: white; padding: 36px 40px; border-radius: 12px 12px 0 0; }
                    .header h1 { font-size: 30px; margin-bottom: 8px; }
                    .header p { opacity: 0.9; font-size: 15px; }
                    .stats { display: grid; grid-template-columns: repeat(auto-fit, minmax(160px, 1fr)); gap: 18px; padding: 28px; border-bottom: 1px solid #ecf0f1; }
                    .stat-card { text-align: center; padding: 18px; background: #f8f9fa; border-radius: 8px; }
                    .stat-number { font-size: 32px; font-weight: bold; margin-bottom: 4px; }
                    .stat-label { font-size: 13px; text-transform: uppercase; letter-spacing: 0.4px; color: #5d6d7e; }
                    .charts { display: grid; grid-template-columns: repeat(auto-fit, minmax(460px, 1fr)); gap: 24px; padding: 28px; }
                    .chart-box { background: #fafbfc; border-radius: 10px; padding: 16px; }
                    .chart-empty { padding: 60px 0; text-align: center; color: #7f8c8d; }
                    .section { padding: 28px; border-top: 1px solid #ecf0f1; }
                    .section h2 { font-size: 22px; margin-bottom: 16px; }
                    table { width: 100%%; border-collapse: collapse; font-size: 14px; }
                    th, td { padding: 8px 10px; border-bottom: 1px solid #ecf0f1; text-align: left; vertical-align: top; }
                    th { background: #f4f6f8; }
                    .badge { display: inline-block; padding: 3px 10px; border-radius: 999px; color: white; font-size: 12px; font-weight: 600; }
                    details summary { cursor: pointer; color: #2980b9; }
                    pre { white-space: pre-wrap; font-size: 12px; background: #f8f9fa; padding: 8px; border-radius: 6px; }
                    .footer { padding: 20px; text-align: center; color: #7f8c8d; font-size: 13px; }
                </style>
            </head>
            <body>
            <div class="container">
            """.formatted(escapeHtml(metadata.getName()), config.getAccentColor(), config.getAccentColor()));

        appendHeader(html, details);
        appendStats(html, aggregates);

        Map<String, ChartSeries> charts = new LinkedHashMap<>();
        charts.put("severityChart", ChartSeries.severity(aggregates.getSeverityCounts(), config));
        charts.put("hostsChart", ChartSeries.topHosts(aggregates.getTopHosts(), config));
        charts.put("familiesChart", ChartSeries.topFamilies(aggregates.getTopFamilies(), config));
        charts.put("riskChart", ChartSeries.riskFactors(aggregates.getRiskCounts()));
        appendCharts(html, charts);

        appendHostSummaries(html, details.getHostSummaries());
        appendFindings(html, details.getFindings());

        html.append("""
                <div class="footer">Сгенерировано Nessus Report Generator</div>
            </div>
            """);
        appendChartScripts(html, charts);
        html.append("</body>\n</html>\n");

        log.info("HTML отчет сформирован: {} находок, {} хостов",
            aggregates.getTotalFindings(), details.getHostSummaries().size());
        return html.toString();
    }

    private void appendHeader(StringBuilder html, ReportDetails details) {
        ReportMetadata metadata = details.getMetadata();
        html.append("<div class=\"header\">\n");
        html.append("<h1>").append(escapeHtml(metadata.getName())).append("</h1>\n");
        if (!metadata.getCustomer().isEmpty()) {
            html.append("<p>Customer: ").append(escapeHtml(metadata.getCustomer())).append("</p>\n");
        }
        if (!metadata.getScanDate().isEmpty()) {
            html.append("<p>Scan date: ").append(escapeHtml(metadata.getScanDate())).append("</p>\n");
        }
        if (details.getGeneratedAt() != null) {
            html.append("<p>Generated: ").append(details.getGeneratedAt().format(DATE_FORMATTER)).append("</p>\n");
        }
        html.append("</div>\n");
    }

    private void appendStats(StringBuilder html, AggregatedMetrics aggregates) {
        html.append("<div class=\"stats\">\n");
        appendStatCard(html, String.valueOf(aggregates.getTotalFindings()), "Findings", config.getAccentColor());
        appendStatCard(html, String.valueOf(aggregates.getAffectedHosts()), "Affected hosts", config.getAccentColor());
        appendStatCard(html, formatAverageCvss(aggregates.getAverageCvss()), "Average CVSS", config.getAccentColor());
        for (String label : List.of(Severity.CRITICAL.getLabel(), Severity.HIGH.getLabel())) {
            appendStatCard(html, String.valueOf(aggregates.severityCount(label)), label, config.colorFor(label));
        }
        html.append("</div>\n");
    }

    private void appendStatCard(StringBuilder html, String value, String label, String color) {
        html.append("<div class=\"stat-card\"><div class=\"stat-number\" style=\"color:")
            .append(color).append("\">").append(escapeHtml(value))
            .append("</div><div class=\"stat-label\">").append(escapeHtml(label)).append("</div></div>\n");
    }

    private void appendCharts(StringBuilder html, Map<String, ChartSeries> charts) {
        html.append("<div class=\"charts\">\n");
        charts.forEach((id, series) -> {
            html.append("<div class=\"chart-box\">");
            if (series.isEmpty()) {
                html.append("<h3>").append(escapeHtml(series.getTitle())).append("</h3>")
                    .append("<div class=\"chart-empty\">No data available</div>");
            } else {
                html.append("<canvas id=\"").append(id).append("\"></canvas>");
            }
            html.append("</div>\n");
        });
        html.append("</div>\n");
    }

    private void appendHostSummaries(StringBuilder html, List<HostSeveritySummary> summaries) {
        html.append("<div class=\"section\">\n<h2>Host Summary</h2>\n<table>\n<tr><th>Host</th><th>IP</th>");
        for (String label : Severity.ORDER) {
            html.append("<th>").append(label).append("</th>");
        }
        html.append("<th>Total</th></tr>\n");
        for (HostSeveritySummary summary : summaries) {
            html.append("<tr><td>").append(escapeHtml(summary.getHost())).append("</td><td>")
                .append(escapeHtml(orDash(summary.getIpAddress()))).append("</td>");
            for (String label : Severity.ORDER) {
                html.append("<td>").append(summary.countFor(label)).append("</td>");
            }
            html.append("<td><strong>").append(summary.getTotalFindings()).append("</strong></td></tr>\n");
        }
        html.append("</table>\n</div>\n");
    }

    private void appendFindings(StringBuilder html, List<FindingRecord> findings) {
        html.append("<div class=\"section\">\n<h2>Findings</h2>\n<table>\n")
            .append("<tr><th>Severity</th><th>Host</th><th>Port</th><th>Plugin</th><th>Family</th>")
            .append("<th>Risk</th><th>CVSS</th><th>CVE</th></tr>\n");
        for (FindingRecord finding : findings) {
            html.append("<tr><td><span class=\"badge\" style=\"background:")
                .append(config.colorFor(finding.getSeverityLabel())).append("\">")
                .append(escapeHtml(finding.getSeverityLabel())).append("</span></td>")
                .append("<td>").append(escapeHtml(finding.getHost())).append("</td>")
                .append("<td>").append(escapeHtml(orDash(finding.getPort()))).append("</td>")
                .append("<td>").append(escapeHtml(finding.getPluginName()))
                .append(" <small>(").append(escapeHtml(finding.getPluginId())).append(")</small>");
            appendFindingDetails(html, finding);
            html.append("</td>")
                .append("<td>").append(escapeHtml(finding.getPluginFamily())).append("</td>")
                .append("<td>").append(escapeHtml(finding.getRiskFactor())).append("</td>")
                .append("<td>").append(formatCvss(finding.getCvssBase())).append("</td>")
                .append("<td>").append(escapeHtml(finding.getCves().isEmpty() ? "None" : String.join(", ", finding.getCves())))
                .append("</td></tr>\n");
        }
        html.append("</table>\n</div>\n");
    }

    private void appendFindingDetails(StringBuilder html, FindingRecord finding) {
        if (finding.getDescription().isEmpty() && finding.getSolution().isEmpty() && finding.getPluginOutput().isEmpty()) {
            return;
        }
        html.append("<details><summary>Details</summary>");
        appendBlock(html, "Description", finding.getDescription());
        appendBlock(html, "Solution", finding.getSolution());
        appendBlock(html, "Plugin output", finding.getPluginOutput());
        html.append("</details>");
    }

    private void appendBlock(StringBuilder html, String title, String text) {
        if (!text.isEmpty()) {
            html.append("<p><strong>").append(title).append(":</strong></p><pre>")
                .append(escapeHtml(text)).append("</pre>");
        }
    }

    private void appendChartScripts(StringBuilder html, Map<String, ChartSeries> charts) throws JsonProcessingException {
        html.append("<script src=\"https://cdn.jsdelivr.net/npm/chart.js@4.4.0/dist/chart.umd.min.js\"></script>\n<script>\n");
        for (Map.Entry<String, ChartSeries> entry : charts.entrySet()) {
            ChartSeries series = entry.getValue();
            if (series.isEmpty()) {
                continue;
            }
            html.append("""
                new Chart(document.getElementById('%s'), {
                    type: '%s',
                    data: { labels: %s, datasets: [{ label: 'Findings', data: %s, backgroundColor: %s }] },
                    options: { indexAxis: '%s', responsive: true, plugins: { title: { display: true, text: %s }, legend: { display: %s } } }
                });
                """.formatted(
                    entry.getKey(),
                    "riskChart".equals(entry.getKey()) ? "pie" : "bar",
                    toJson(series.getLabels()),
                    toJson(series.getValues()),
                    toJson(series.getColors()),
                    "hostsChart".equals(entry.getKey()) || "familiesChart".equals(entry.getKey()) ? "y" : "x",
                    toJson(series.getTitle()),
                    "riskChart".equals(entry.getKey())));
        }
        html.append("</script>\n");
    }

    private String toJson(Object value) throws JsonProcessingException {
        // </script> внутри данных не должен закрыть тег
        return objectMapper.writeValueAsString(value).replace("</", "<\\/");
    }

    static String formatCvss(Double cvss) {
        return cvss == null ? "N/A" : String.format(Locale.ROOT, "%.1f", cvss);
    }

    static String formatAverageCvss(Double average) {
        return average == null ? "N/A" : String.format(Locale.ROOT, "%.2f", average);
    }

    private static String orDash(String value) {
        return value == null || value.isEmpty() ? "-" : value;
    }

    @Override
    public String getFileExtension() {
        return "html";
    }

    static String escapeHtml(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;")
            .replace("\"", "&quot;")
            .replace("'", "&#39;");
    }
}
