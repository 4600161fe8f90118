package com.vtb.nessus.reports;

import com.itextpdf.kernel.colors.ColorConstants;
import com.itextpdf.kernel.colors.DeviceRgb;
import com.itextpdf.kernel.geom.PageSize;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.layout.Document;
import com.itextpdf.layout.element.AreaBreak;
import com.itextpdf.layout.element.Cell;
import com.itextpdf.layout.element.Div;
import com.itextpdf.layout.element.Paragraph;
import com.itextpdf.layout.element.Table;
import com.itextpdf.layout.element.Text;
import com.itextpdf.layout.properties.TextAlignment;
import com.itextpdf.layout.properties.UnitValue;
import com.vtb.nessus.config.ReportConfig;
import com.vtb.nessus.models.AggregatedMetrics;
import com.vtb.nessus.models.FindingRecord;
import com.vtb.nessus.models.HostSeveritySummary;
import com.vtb.nessus.models.ReportDetails;
import com.vtb.nessus.models.ReportMetadata;
import com.vtb.nessus.models.Severity;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Генератор PDF отчетов (iText): сводка, графики в виде столбцов, таблица хостов, находки
 */
@Slf4j
public class PdfReportGenerator implements ReportGenerator {

    private final ReportConfig config;

    public PdfReportGenerator() {
        this(ReportConfig.load());
    }

    public PdfReportGenerator(ReportConfig config) {
        this.config = config;
    }

    @Override
    public byte[] render(ReportDetails details) throws IOException {
        if (details == null) {
            throw new IllegalArgumentException("ReportDetails не может быть null");
        }

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            PdfDocument pdf = new PdfDocument(new PdfWriter(buffer));
            Document document = new Document(pdf, PageSize.A4);

            addTitle(document, details);
            addSummary(document, details.getAggregates());
            addChart(document, ChartSeries.severity(details.getAggregates().getSeverityCounts(), config));
            addChart(document, ChartSeries.topHosts(details.getAggregates().getTopHosts(), config));
            addChart(document, ChartSeries.topFamilies(details.getAggregates().getTopFamilies(), config));
            addChart(document, ChartSeries.riskFactors(details.getAggregates().getRiskCounts()));
            addHostSummaries(document, details.getHostSummaries());
            document.add(new AreaBreak());
            addFindings(document, details.getFindings());

            document.close();
        } catch (Exception e) {
            throw new IOException("Ошибка генерации PDF: " + e.getMessage(), e);
        }

        byte[] bytes = buffer.toByteArray();
        log.info("PDF отчет сформирован: {} байт", bytes.length);
        return bytes;
    }

    private void addTitle(Document document, ReportDetails details) {
        ReportMetadata metadata = details.getMetadata();
        document.add(new Paragraph(metadata.getName())
            .setFontSize(24)
            .setBold()
            .setFontColor(rgb(config.getAccentColor()))
            .setTextAlignment(TextAlignment.CENTER));

        Table table = new Table(UnitValue.createPercentArray(new float[]{1, 1}));
        table.setWidth(UnitValue.createPercentValue(100));
        table.addCell(createCell("Customer", orDash(metadata.getCustomer())));
        table.addCell(createCell("Scan date", orDash(metadata.getScanDate())));
        String generated = details.getGeneratedAt() != null
            ? details.getGeneratedAt().format(HtmlReportGenerator.DATE_FORMATTER)
            : "N/A";
        table.addCell(createCell("Generated", generated));
        table.addCell(createCell("Hosts", String.valueOf(details.getHostSummaries().size())));
        document.add(table.setMarginBottom(15));
    }

    private void addSummary(Document document, AggregatedMetrics aggregates) {
        addHeading(document, "Executive Summary");

        Table table = new Table(UnitValue.createPercentArray(new float[]{1, 1, 1}));
        table.setWidth(UnitValue.createPercentValue(100));
        table.addCell(createCell("Findings", String.valueOf(aggregates.getTotalFindings())));
        table.addCell(createCell("Affected hosts", String.valueOf(aggregates.getAffectedHosts())));
        table.addCell(createCell("Average CVSS", HtmlReportGenerator.formatAverageCvss(aggregates.getAverageCvss())));
        document.add(table);
    }

    /**
     * Горизонтальные столбцы, ширина пропорциональна максимальному значению серии
     */
    private void addChart(Document document, ChartSeries series) {
        addHeading(document, series.getTitle());
        if (series.isEmpty()) {
            document.add(new Paragraph("No data available").setFontColor(ColorConstants.GRAY));
            return;
        }

        int max = series.maxValue();
        Table table = new Table(UnitValue.createPercentArray(new float[]{3, 6, 1}));
        table.setWidth(UnitValue.createPercentValue(100));
        for (int i = 0; i < series.getLabels().size(); i++) {
            int value = series.getValues().get(i);
            float percent = max > 0 ? Math.max(1f, 100f * value / max) : 0f;

            table.addCell(new Cell().add(new Paragraph(series.getLabels().get(i)).setFontSize(9)).setPadding(3));
            Div bar = new Div()
                .setHeight(10)
                .setWidth(UnitValue.createPercentValue(value > 0 ? percent : 0))
                .setBackgroundColor(rgb(series.getColors().get(i)));
            table.addCell(new Cell().add(bar).setPadding(4));
            table.addCell(new Cell().add(new Paragraph(String.valueOf(value)).setFontSize(9)).setPadding(3));
        }
        document.add(table);
    }

    private void addHostSummaries(Document document, List<HostSeveritySummary> summaries) {
        addHeading(document, "Host Summary");

        Table table = new Table(UnitValue.createPercentArray(new float[]{4, 3, 1, 1, 1, 1, 1, 1}));
        table.setWidth(UnitValue.createPercentValue(100));
        table.addHeaderCell(headerCell("Host"));
        table.addHeaderCell(headerCell("IP"));
        for (String label : Severity.ORDER) {
            table.addHeaderCell(headerCell(label));
        }
        table.addHeaderCell(headerCell("Total"));

        for (HostSeveritySummary summary : summaries) {
            table.addCell(smallCell(summary.getHost()));
            table.addCell(smallCell(orDash(summary.getIpAddress())));
            for (String label : Severity.ORDER) {
                table.addCell(smallCell(String.valueOf(summary.countFor(label))));
            }
            table.addCell(smallCell(String.valueOf(summary.getTotalFindings())));
        }
        document.add(table);
    }

    private void addFindings(Document document, List<FindingRecord> findings) {
        addHeading(document, "Findings");
        for (FindingRecord finding : findings) {
            Paragraph header = new Paragraph()
                .add(new Text(finding.getSeverityLabel())
                    .setFontColor(rgb(config.colorFor(finding.getSeverityLabel())))
                    .setBold())
                .add(": " + finding.getPluginName() + " (" + finding.getPluginId() + ")")
                .setMarginTop(10)
                .setMarginBottom(2);
            document.add(header);

            Paragraph facts = new Paragraph()
                .add(new Text("Host: ").setBold())
                .add(finding.getHost() + (finding.getPort() != null ? " [" + finding.getPort() + "]" : ""))
                .add(new Text("  Family: ").setBold())
                .add(finding.getPluginFamily())
                .add(new Text("  Risk: ").setBold())
                .add(finding.getRiskFactor())
                .add(new Text("  CVSS: ").setBold())
                .add(HtmlReportGenerator.formatCvss(finding.getCvssBase()))
                .setFontSize(9);
            if (!finding.getCves().isEmpty()) {
                facts.add(new Text("  CVE: ").setBold()).add(String.join(", ", finding.getCves()));
            }
            document.add(facts);

            addText(document, "Description", finding.getDescription());
            addText(document, "Solution", finding.getSolution());
        }
    }

    private void addText(Document document, String label, String text) {
        if (text.isEmpty()) {
            return;
        }
        document.add(new Paragraph()
            .add(new Text(label + ": ").setBold())
            .add(text)
            .setFontSize(9));
    }

    private void addHeading(Document document, String title) {
        document.add(new Paragraph(title)
            .setFontSize(16)
            .setBold()
            .setFontColor(rgb(config.getAccentColor()))
            .setMarginTop(18));
    }

    private Cell createCell(String label, String value) {
        Paragraph p = new Paragraph()
            .add(new Text(label + ": ").setBold())
            .add(value);
        return new Cell().add(p).setPadding(5);
    }

    private Cell headerCell(String text) {
        return new Cell()
            .add(new Paragraph(text).setBold().setFontSize(9).setFontColor(ColorConstants.WHITE))
            .setBackgroundColor(rgb(config.getAccentColor()))
            .setPadding(3);
    }

    private Cell smallCell(String text) {
        return new Cell().add(new Paragraph(text).setFontSize(9)).setPadding(3);
    }

    private static String orDash(String value) {
        return value == null || value.isEmpty() ? "-" : value;
    }

    static DeviceRgb rgb(String hex) {
        String value = hex.startsWith("#") ? hex.substring(1) : hex;
        int color = Integer.parseInt(value, 16);
        return new DeviceRgb((color >> 16) & 0xFF, (color >> 8) & 0xFF, color & 0xFF);
    }

    @Override
    public String getFileExtension() {
        return "pdf";
    }
}
