package com.vtb.nessus.cli;

import com.vtb.nessus.config.ReportConfig;
import com.vtb.nessus.core.EmptyReportException;
import com.vtb.nessus.core.InvalidNessusFileException;
import com.vtb.nessus.core.NessusParser;
import com.vtb.nessus.models.AggregatedMetrics;
import com.vtb.nessus.models.LabelCount;
import com.vtb.nessus.models.ReportDetails;
import com.vtb.nessus.models.ReportMetadata;
import com.vtb.nessus.reports.HtmlReportGenerator;
import com.vtb.nessus.reports.JsonReportGenerator;
import com.vtb.nessus.reports.PdfReportGenerator;
import com.vtb.nessus.reports.ReportGenerator;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Главная CLI команда генератора отчетов по выгрузкам Nessus
 */
@Slf4j
@Command(
    name = "nessus-report",
    mixinStandardHelpOptions = true,
    version = "Nessus Report Generator 1.0.0",
    description = """

        Nessus Report Generator

        Превращает выгрузку Nessus (.nessus) в отчеты JSON, HTML и PDF
        со статистикой по критичности, хостам и семействам плагинов.

        """
)
public class MainCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID_INPUT = 1;
    static final int EXIT_CRITICAL_FOUND = 2;

    @Parameters(
        index = "0",
        arity = "0..1",
        description = "Путь к файлу выгрузки Nessus (.nessus)"
    )
    private String inputPath;

    @Option(
        names = {"-o", "--output"},
        description = "Директория для сохранения отчетов (по умолчанию: ./reports)"
    )
    private String outputDir = "./reports";

    @Option(names = {"-n", "--name"}, description = "Название отчета")
    private String reportName = "";

    @Option(names = {"-c", "--customer"}, description = "Заказчик")
    private String customer = "";

    @Option(names = {"-d", "--scan-date"}, description = "Дата сканирования")
    private String scanDate = "";

    @Option(names = {"--json-only"}, description = "Генерировать только JSON отчет")
    private boolean jsonOnly = false;

    @Option(names = {"--html-only"}, description = "Генерировать только HTML отчет")
    private boolean htmlOnly = false;

    @Option(names = {"--pdf-only"}, description = "Генерировать только PDF отчет")
    private boolean pdfOnly = false;

    @Option(
        names = {"--fail-on-critical"},
        description = "Завершиться с кодом 2 при наличии Critical находок (для CI/CD)"
    )
    private boolean failOnCritical = false;

    @Option(names = {"--web"}, description = "Запустить веб-интерфейс")
    private boolean webMode = false;

    @Option(names = {"--port"}, description = "Порт для веб-интерфейса (по умолчанию: 8080)")
    private int webPort = 8080;

    private final PrintStream out;

    public MainCommand() {
        this(System.out);
    }

    MainCommand(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        if (!isWebMode(args)) {
            System.exit(exitCode);
        }
    }

    @Override
    public Integer call() throws Exception {
        if (webMode) {
            log.info("Запуск веб-интерфейса на порту {}...", webPort);
            com.vtb.nessus.web.NessusReportApplication.main(new String[]{"--server.port=" + webPort});
            return EXIT_OK;
        }

        if (inputPath == null || inputPath.isBlank()) {
            log.error("Не указан файл выгрузки Nessus");
            return EXIT_INVALID_INPUT;
        }

        Path input = Paths.get(inputPath);
        if (!Files.isRegularFile(input)) {
            log.error("Файл не найден: {}", inputPath);
            return EXIT_INVALID_INPUT;
        }

        ReportConfig config = ReportConfig.load();
        ReportMetadata metadata = ReportMetadata.of(reportName, customer, scanDate, config.getDefaultReportName());
        NessusParser parser = new NessusParser(config.getTopLimit(), Clock.systemUTC());

        ReportDetails details;
        try {
            details = parser.buildReport(metadata, Files.readAllBytes(input));
        } catch (EmptyReportException e) {
            log.warn("{}", e.getMessage());
            out.println("Находок нет: " + e.getMessage());
            return EXIT_INVALID_INPUT;
        } catch (InvalidNessusFileException e) {
            log.error("Некорректный файл {}: {}", inputPath, e.getMessage());
            out.println("Ошибка: " + e.getMessage());
            return EXIT_INVALID_INPUT;
        }

        Path outDir = Paths.get(outputDir);
        Files.createDirectories(outDir);
        String baseName = baseName(input);
        for (ReportGenerator generator : selectGenerators(config)) {
            Path target = outDir.resolve(baseName + "." + generator.getFileExtension());
            generator.generate(details, target);
            log.info("Отчет сохранен: {}", target.toAbsolutePath());
        }

        printSummary(details.getAggregates());

        if (failOnCritical && details.hasCriticalFindings()) {
            out.println("Обнаружены Critical находки: завершение с кодом " + EXIT_CRITICAL_FOUND);
            return EXIT_CRITICAL_FOUND;
        }
        return EXIT_OK;
    }

    List<ReportGenerator> selectGenerators(ReportConfig config) {
        List<ReportGenerator> generators = new ArrayList<>();
        boolean all = !jsonOnly && !htmlOnly && !pdfOnly;
        if (all || jsonOnly) {
            generators.add(new JsonReportGenerator());
        }
        if (all || htmlOnly) {
            generators.add(new HtmlReportGenerator(config));
        }
        if (all || pdfOnly) {
            generators.add(new PdfReportGenerator(config));
        }
        return generators;
    }

    private void printSummary(AggregatedMetrics aggregates) {
        out.println();
        out.println("Находок: " + aggregates.getTotalFindings() + ", хостов: " + aggregates.getAffectedHosts());
        for (LabelCount entry : aggregates.getSeverityCounts()) {
            out.printf("  %-9s %d%n", entry.getLabel(), entry.getCount());
        }
        out.println("Средний CVSS: " + (aggregates.getAverageCvss() != null ? aggregates.getAverageCvss() : "N/A"));
    }

    static String baseName(Path input) {
        String fileName = input.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static boolean isWebMode(String[] args) {
        for (String arg : args) {
            if ("--web".equals(arg)) {
                return true;
            }
        }
        return false;
    }
}
