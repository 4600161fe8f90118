package com.vtb.nessus.web;

import com.vtb.nessus.config.ReportConfig;
import com.vtb.nessus.core.EmptyReportException;
import com.vtb.nessus.core.InvalidNessusFileException;
import com.vtb.nessus.core.NessusParser;
import com.vtb.nessus.models.ReportBundle;
import com.vtb.nessus.models.ReportDetails;
import com.vtb.nessus.models.ReportMetadata;
import com.vtb.nessus.models.Severity;
import com.vtb.nessus.reports.HtmlReportGenerator;
import com.vtb.nessus.reports.PdfReportGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * REST API генератора отчетов
 *
 * Загрузить .nessus файл и получить сводку + ссылки на HTML/PDF отчет
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@CrossOrigin(origins = "*")
public class ReportController {

    private static final String NESSUS_EXTENSION = ".nessus";

    private final ReportConfig config;
    private final NessusParser parser;
    private final HtmlReportGenerator htmlGenerator;
    private final PdfReportGenerator pdfGenerator;
    private final ReportCache cache;

    public ReportController() {
        this(ReportConfig.load());
    }

    ReportController(ReportConfig config) {
        this.config = config;
        this.parser = new NessusParser(config.getTopLimit(), Clock.systemUTC());
        this.htmlGenerator = new HtmlReportGenerator(config);
        this.pdfGenerator = new PdfReportGenerator(config);
        this.cache = new ReportCache(config.getCacheCapacity());
    }

    /**
     * Сгенерировать отчет
     *
     * POST /api/v1/reports
     * Content-Type: multipart/form-data
     * file: scan.nessus, report_name, customer, scan_date
     */
    @PostMapping(value = "/reports", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> generateReport(
            @RequestParam(value = "file", required = false) MultipartFile file,
            @RequestParam(value = "report_name", defaultValue = "") String reportName,
            @RequestParam(value = "customer", defaultValue = "") String customer,
            @RequestParam(value = "scan_date", defaultValue = "") String scanDate) {

        String filename = file != null ? file.getOriginalFilename() : null;
        if (filename == null || !filename.toLowerCase(Locale.ROOT).endsWith(NESSUS_EXTENSION)) {
            return ResponseEntity.badRequest()
                .body(Map.of("error", "Загрузите корректную выгрузку .nessus"));
        }

        long maxBytes = config.getMaxUploadMb() * 1024L * 1024L;
        if (file.getSize() > maxBytes) {
            return ResponseEntity.badRequest()
                .body(Map.of("error", String.format(Locale.ROOT,
                    "Файл слишком большой: %.2f MB (максимум: %d MB)",
                    file.getSize() / (1024.0 * 1024.0), config.getMaxUploadMb())));
        }

        log.info("Получен запрос на генерацию отчета: {}", filename);
        ReportMetadata metadata = ReportMetadata.of(reportName, customer, scanDate, config.getDefaultReportName());

        try {
            ReportDetails details = parser.buildReport(metadata, file.getBytes());
            String html = htmlGenerator.renderHtml(details);
            byte[] pdf = pdfGenerator.render(details);

            ReportBundle bundle = cache.store(reportId -> ReportBundle.builder()
                .reportId(reportId)
                .details(details)
                .html(html)
                .pdfBytes(pdf)
                .build());

            log.info("Отчет {} готов: {} находок", bundle.getReportId(), details.getAggregates().getTotalFindings());
            return ResponseEntity.ok(describe(bundle));

        } catch (EmptyReportException e) {
            log.warn("Пустая выгрузка {}: {}", filename, e.getMessage());
            return ResponseEntity.badRequest()
                .body(Map.of("error", e.getMessage()));
        } catch (InvalidNessusFileException e) {
            log.error("Не удалось разобрать файл Nessus {}", filename, e);
            return ResponseEntity.badRequest()
                .body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Ошибка при генерации отчета: {}", e.getMessage(), e);
            return ResponseEntity.status(500)
                .body(Map.of("error", "Внутренняя ошибка сервера при генерации отчета"));
        }
    }

    @GetMapping(value = "/reports/{reportId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> getReport(@PathVariable("reportId") String reportId) {
        Optional<ReportBundle> bundle = cache.get(reportId);
        if (bundle.isEmpty()) {
            return notFound();
        }
        return ResponseEntity.ok(describe(bundle.get()));
    }

    @GetMapping("/reports/{reportId}/pdf")
    public ResponseEntity<?> downloadPdf(@PathVariable("reportId") String reportId) {
        Optional<ReportBundle> bundle = cache.get(reportId);
        if (bundle.isEmpty()) {
            return notFound();
        }
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=nessus-report-" + reportId + ".pdf")
            .contentType(MediaType.APPLICATION_PDF)
            .body(bundle.get().getPdfBytes());
    }

    @GetMapping("/reports/{reportId}/html")
    public ResponseEntity<?> viewHtml(@PathVariable("reportId") String reportId) {
        Optional<ReportBundle> bundle = cache.get(reportId);
        if (bundle.isEmpty()) {
            return notFound();
        }
        return ResponseEntity.ok()
            .contentType(new MediaType(MediaType.TEXT_HTML, StandardCharsets.UTF_8))
            .body(bundle.get().getHtml());
    }

    /**
     * Health check
     */
    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", "UP");
        status.put("service", "Nessus Report Generator");
        status.put("version", "1.0.0");
        status.put("cachedReports", cache.size());
        status.put("cacheCapacity", cache.getCapacity());
        return ResponseEntity.ok(status);
    }

    Map<String, Object> describe(ReportBundle bundle) {
        ReportDetails details = bundle.getDetails();
        List<?> preview = details.getFindings().subList(0,
            Math.min(config.getPreviewFindings(), details.getFindings().size()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("reportId", bundle.getReportId());
        body.put("metadata", details.getMetadata());
        body.put("generatedAt", details.getGeneratedAt().toString());
        body.put("severityOrder", Severity.ORDER);
        body.put("aggregates", details.getAggregates());
        body.put("hostSummaries", details.getHostSummaries());
        body.put("findings", preview);
        body.put("pdfUrl", "/api/v1/reports/" + bundle.getReportId() + "/pdf");
        body.put("htmlUrl", "/api/v1/reports/" + bundle.getReportId() + "/html");
        return body;
    }

    ReportCache getCache() {
        return cache;
    }

    private static ResponseEntity<Map<String, Object>> notFound() {
        return ResponseEntity.status(404).body(Map.of("error", "Отчет не найден"));
    }
}
