package com.vtb.nessus.web;

import com.vtb.nessus.config.ReportConfig;
import com.vtb.nessus.models.AggregatedMetrics;
import com.vtb.nessus.models.ReportMetadata;
import com.vtb.nessus.support.ReportFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReportControllerTest {

    private ReportController controller;

    @BeforeEach
    void setUp() {
        ReportConfig config = ReportConfig.defaults();
        config.setPreviewFindings(4);
        config.setCacheCapacity(2);
        controller = new ReportController(config);
    }

    private static MockMultipartFile upload(String filename, byte[] content) {
        return new MockMultipartFile("file", filename, "application/octet-stream", content);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> body(ResponseEntity<?> response) {
        return (Map<String, Object>) response.getBody();
    }

    @Test
    void generatesReportAndServesArtifacts() {
        ResponseEntity<?> response = controller.generateReport(
            upload("scan.nessus", ReportFixtures.resource("sample.nessus")), "  Q4 review ", "ACME", "2026-10-12");

        assertEquals(200, response.getStatusCode().value());
        Map<String, Object> body = body(response);
        String reportId = (String) body.get("reportId");
        assertTrue(reportId.matches("[0-9a-f]{32}"));

        ReportMetadata metadata = (ReportMetadata) body.get("metadata");
        assertEquals("Q4 review", metadata.getName());
        assertEquals(6, ((AggregatedMetrics) body.get("aggregates")).getTotalFindings());
        assertEquals(4, ((List<?>) body.get("findings")).size(), "Превью ограничено настройкой");
        assertEquals(3, ((List<?>) body.get("hostSummaries")).size());
        assertEquals("/api/v1/reports/" + reportId + "/pdf", body.get("pdfUrl"));
        assertEquals("/api/v1/reports/" + reportId + "/html", body.get("htmlUrl"));

        ResponseEntity<?> again = controller.getReport(reportId);
        assertEquals(200, again.getStatusCode().value());
        assertEquals(reportId, body(again).get("reportId"));

        ResponseEntity<?> pdf = controller.downloadPdf(reportId);
        assertEquals(MediaType.APPLICATION_PDF, pdf.getHeaders().getContentType());
        assertEquals("attachment; filename=nessus-report-" + reportId + ".pdf",
            pdf.getHeaders().getFirst(HttpHeaders.CONTENT_DISPOSITION));
        byte[] pdfBytes = (byte[]) pdf.getBody();
        assertEquals("%PDF-", new String(pdfBytes, 0, 5, StandardCharsets.US_ASCII));

        ResponseEntity<?> html = controller.viewHtml(reportId);
        assertTrue(html.getHeaders().getContentType().isCompatibleWith(MediaType.TEXT_HTML));
        assertTrue(((String) html.getBody()).contains("Q4 review"));
    }

    @Test
    void blankReportNameFallsBackToDefault() {
        ResponseEntity<?> response = controller.generateReport(
            upload("scan.NESSUS", ReportFixtures.resource("sample.nessus")), "   ", "", "");

        assertEquals(200, response.getStatusCode().value());
        assertEquals(ReportMetadata.DEFAULT_NAME, ((ReportMetadata) body(response).get("metadata")).getName());
    }

    @Test
    void rejectsWrongExtensionAndMissingFile() {
        ResponseEntity<?> wrongExtension = controller.generateReport(
            upload("scan.xml", ReportFixtures.resource("sample.nessus")), "", "", "");
        ResponseEntity<?> missing = controller.generateReport(null, "", "", "");

        assertEquals(400, wrongExtension.getStatusCode().value());
        assertEquals("Загрузите корректную выгрузку .nessus", body(wrongExtension).get("error"));
        assertEquals(400, missing.getStatusCode().value());
    }

    @Test
    void rejectsInvalidAndEmptyExports() {
        ResponseEntity<?> invalid = controller.generateReport(
            upload("scan.nessus", ReportFixtures.resource("wrong-root.xml")), "", "", "");
        ResponseEntity<?> empty = controller.generateReport(
            upload("scan.nessus", ReportFixtures.resource("no-findings.nessus")), "", "", "");
        ResponseEntity<?> blank = controller.generateReport(
            upload("scan.nessus", new byte[0]), "", "", "");

        assertEquals(400, invalid.getStatusCode().value());
        assertEquals(400, empty.getStatusCode().value());
        assertEquals("Выгрузка Nessus не содержит ни одной находки", body(empty).get("error"));
        assertEquals(400, blank.getStatusCode().value());
        assertEquals(0, controller.getCache().size());
    }

    @Test
    void rejectsOversizedUpload() {
        ReportConfig config = ReportConfig.defaults();
        config.setMaxUploadMb(1);
        ReportController limited = new ReportController(config);

        ResponseEntity<?> response = limited.generateReport(
            upload("big.nessus", new byte[2 * 1024 * 1024]), "", "", "");

        assertEquals(400, response.getStatusCode().value());
        assertTrue(((String) body(response).get("error")).contains("1 MB"));
    }

    @Test
    void unknownReportIsNotFound() {
        assertEquals(404, controller.getReport("0123456789abcdef0123456789abcdef").getStatusCode().value());
        assertEquals(404, controller.downloadPdf("missing").getStatusCode().value());
        assertEquals(404, controller.viewHtml("missing").getStatusCode().value());
        assertEquals("Отчет не найден", body(controller.getReport("missing")).get("error"));
    }

    @Test
    void oldReportsAreEvicted() {
        byte[] sample = ReportFixtures.resource("sample.nessus");
        String first = (String) body(controller.generateReport(upload("a.nessus", sample), "", "", "")).get("reportId");
        controller.generateReport(upload("b.nessus", sample), "", "", "");
        controller.generateReport(upload("c.nessus", sample), "", "", "");

        assertEquals(404, controller.getReport(first).getStatusCode().value());
        assertEquals(2, controller.getCache().size());
    }

    @Test
    void healthReportsCacheState() {
        Map<String, Object> health = controller.health().getBody();

        assertNotNull(health);
        assertEquals("UP", health.get("status"));
        assertEquals(0, health.get("cachedReports"));
        assertEquals(2, health.get("cacheCapacity"));
    }
}
