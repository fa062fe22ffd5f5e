package com.vtb.posture.reports;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vtb.posture.models.ScoreReport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Генератор отчетов в формате JSON
 */
@Slf4j
public class JsonReportGenerator implements ReportGenerator {

    private final ObjectMapper objectMapper;

    public JsonReportGenerator() {
        this.objectMapper = createMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Общие настройки сериализации отчетов: даты в ISO-8601
     */
    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Override
    public void write(ScoreReport report, OutputStream out) throws IOException {
        if (report == null) {
            throw new IllegalArgumentException("ScoreReport не может быть null");
        }
        log.info("Генерация JSON отчета: {}", report.getEndpointId());
        out.write(objectMapper.writeValueAsBytes(report));
    }

    public String toJson(ScoreReport report) throws IOException {
        return objectMapper.writeValueAsString(report);
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    @Override
    public String getContentType() {
        return "application/json";
    }
}
