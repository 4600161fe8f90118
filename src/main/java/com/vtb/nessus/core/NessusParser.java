package com.vtb.nessus.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.vtb.nessus.analysis.HostSummarizer;
import com.vtb.nessus.analysis.MetricsAggregator;
import com.vtb.nessus.config.ReportConfig;
import com.vtb.nessus.models.AggregatedMetrics;
import com.vtb.nessus.models.FindingRecord;
import com.vtb.nessus.models.HostSeveritySummary;
import com.vtb.nessus.models.ReportDetails;
import com.vtb.nessus.models.ReportMetadata;
import lombok.extern.slf4j.Slf4j;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static com.vtb.nessus.util.FieldCoercion.ensureSequence;

/**
 * Парсер выгрузок Nessus (.nessus, NessusClientData_v2).
 *
 * Один вызов {@link #buildReport} обрабатывает один документ целиком в памяти
 * и не разделяет изменяемого состояния с другими вызовами.
 */
@Slf4j
public class NessusParser {

    static final String ROOT_ELEMENT = "NessusClientData_v2";
    static final String REPORT_ELEMENT = "Report";

    /** Сначала максимальная критичность, затем CVSS; отсутствующий CVSS = 0.0 */
    static final Comparator<FindingRecord> FINDING_ORDER =
        Comparator.comparingInt(FindingRecord::getSeverity)
            .thenComparingDouble(NessusParser::cvssForOrdering)
            .reversed();

    private final XMLInputFactory inputFactory;
    private final XmlMapper xmlMapper;
    private final HostPropertyExtractor propertyExtractor;
    private final FindingNormalizer normalizer;
    private final MetricsAggregator aggregator;
    private final HostSummarizer hostSummarizer;
    private final Clock clock;

    public NessusParser() {
        this(ReportConfig.load().getTopLimit(), Clock.systemUTC());
    }

    public NessusParser(int topLimit, Clock clock) {
        this.inputFactory = createInputFactory();
        this.xmlMapper = new XmlMapper(inputFactory);
        this.propertyExtractor = new HostPropertyExtractor();
        this.normalizer = new FindingNormalizer();
        this.aggregator = new MetricsAggregator(topLimit);
        this.hostSummarizer = new HostSummarizer();
        this.clock = clock;
    }

    /**
     * Разобрать XML-выгрузку и построить данные отчета
     *
     * @param metadata метаданные отчета
     * @param xmlBytes содержимое файла
     * @throws InvalidNessusFileException пустой файл, битый XML или неверная структура
     * @throws EmptyReportException в выгрузке нет ни одной находки
     */
    public ReportDetails buildReport(ReportMetadata metadata, byte[] xmlBytes) throws NessusParseException {
        if (metadata == null) {
            throw new IllegalArgumentException("Метаданные отчета не могут быть null");
        }
        if (xmlBytes == null || isBlank(xmlBytes)) {
            throw new InvalidNessusFileException("Загруженный файл пуст");
        }

        log.info("Разбор выгрузки Nessus: {} байт", xmlBytes.length);
        JsonNode document = parse(xmlBytes);
        List<JsonNode> reports = extractReports(document);

        List<FindingRecord> findings = buildFindings(reports);
        if (findings.isEmpty()) {
            throw new EmptyReportException("Выгрузка Nessus не содержит ни одной находки");
        }

        AggregatedMetrics aggregates = aggregator.aggregate(findings);
        List<HostSeveritySummary> hostSummaries = hostSummarizer.summarize(findings);

        log.info("Выгрузка разобрана: {} находок на {} хостах, средний CVSS {}",
            aggregates.getTotalFindings(), aggregates.getAffectedHosts(), aggregates.getAverageCvss());

        return ReportDetails.builder()
            .metadata(metadata)
            .findings(findings)
            .hostSummaries(hostSummaries)
            .aggregates(aggregates)
            .generatedAt(OffsetDateTime.now(clock))
            .build();
    }

    JsonNode parse(byte[] xmlBytes) throws InvalidNessusFileException {
        String rootName = readRootName(xmlBytes);
        if (!ROOT_ELEMENT.equals(rootName)) {
            log.warn("Неожиданный корневой элемент: {}", rootName);
            throw new InvalidNessusFileException("Файл не является выгрузкой Nessus");
        }
        try {
            return xmlMapper.readTree(xmlBytes);
        } catch (IOException e) {
            throw new InvalidNessusFileException("Не удалось разобрать XML выгрузки Nessus", e);
        }
    }

    /**
     * Отсутствие Report означает неверную структуру; пустой Report дает
     * пустой список хостов и дальше EmptyReportException
     */
    List<JsonNode> extractReports(JsonNode document) throws InvalidNessusFileException {
        JsonNode report = document != null && document.isObject() ? document.get(REPORT_ELEMENT) : null;
        if (report == null) {
            throw new InvalidNessusFileException("Файл не является корректной выгрузкой Nessus");
        }
        return ensureSequence(report);
    }

    List<FindingRecord> buildFindings(List<JsonNode> reports) {
        List<FindingRecord> findings = new ArrayList<>();
        int hostCount = 0;
        for (JsonNode report : reports) {
            for (JsonNode host : ensureSequence(report.path("ReportHost"))) {
                hostCount++;
                HostIdentity identity = propertyExtractor.identify(host);
                for (JsonNode item : ensureSequence(host.path("ReportItem"))) {
                    findings.add(normalizer.normalize(item, identity));
                }
            }
        }
        log.debug("Хостов: {}, находок: {}", hostCount, findings.size());
        findings.sort(FINDING_ORDER);
        return List.copyOf(findings);
    }

    private String readRootName(byte[] xmlBytes) throws InvalidNessusFileException {
        XMLStreamReader reader = null;
        try {
            reader = inputFactory.createXMLStreamReader(new ByteArrayInputStream(xmlBytes));
            while (reader.hasNext()) {
                if (reader.next() == XMLStreamConstants.START_ELEMENT) {
                    return reader.getLocalName();
                }
            }
            throw new InvalidNessusFileException("XML документ не содержит корневого элемента");
        } catch (XMLStreamException e) {
            throw new InvalidNessusFileException("Не удалось разобрать XML выгрузки Nessus", e);
        } finally {
            if (reader != null) {
                try {
                    reader.close();
                } catch (XMLStreamException e) {
                    log.debug("Не удалось закрыть XMLStreamReader: {}", e.getMessage());
                }
            }
        }
    }

    private static double cvssForOrdering(FindingRecord finding) {
        return finding.hasCvss() ? finding.getCvssBase() : 0.0;
    }

    private static boolean isBlank(byte[] bytes) {
        for (byte b : bytes) {
            if (!Character.isWhitespace(b)) {
                return false;
            }
        }
        return true;
    }

    private static XMLInputFactory createInputFactory() {
        XMLInputFactory factory = XMLInputFactory.newFactory();
        // КРИТИЧНО: без DTD и внешних сущностей (XXE)
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        return factory;
    }
}
