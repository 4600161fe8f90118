package com.vtb.nessus.reports;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vtb.nessus.models.ReportDetails;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Генератор отчетов в формате JSON
 */
@Slf4j
public class JsonReportGenerator implements ReportGenerator {

    private final ObjectMapper objectMapper;

    public JsonReportGenerator() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public byte[] render(ReportDetails details) throws IOException {
        if (details == null) {
            throw new IllegalArgumentException("ReportDetails не может быть null");
        }
        byte[] json = objectMapper.writeValueAsBytes(details);
        log.info("JSON отчет сформирован: {} байт", json.length);
        return json;
    }

    @Override
    public String getFileExtension() {
        return "json";
    }
}
