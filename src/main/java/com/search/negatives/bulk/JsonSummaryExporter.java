package com.search.negatives.bulk;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.search.negatives.batch.BatchReport;
import com.search.negatives.batch.UnitOutcome;
import com.search.negatives.core.model.FilterResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the analytics of a run, or of a whole batch, as pretty-printed JSON.
 * Timestamps are ISO-8601 strings.
 */
public class JsonSummaryExporter {
    private static final Logger log = LoggerFactory.getLogger(JsonSummaryExporter.class);

    private final ObjectMapper objectMapper;

    public JsonSummaryExporter() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Writes one unit's summary and its ranked candidates.
     */
    public ExportResult export(FilterResult result, Path target) {
        AtomicFileWriter.write(target, writer -> {
            objectMapper.writeValue(writer, toDocument(result));
            return 1;
        });
        return completed(target, "summary", 1);
    }

    /**
     * Writes every unit outcome of a batch with the batch status.
     */
    public ExportResult export(BatchReport report, Path target) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("batchId", report.batchId());
        doc.put("status", report.status());
        doc.put("totalUnits", report.totalUnits());
        doc.put("succeeded", report.successCount());
        doc.put("failed", report.failureCount());
        doc.put("successRate", report.successRate());
        doc.put("durationMs", report.duration().toMillis());

        List<Map<String, Object>> units = new ArrayList<>();
        for (UnitOutcome outcome : report.outcomes()) {
            Map<String, Object> unit = new LinkedHashMap<>();
            unit.put("unitId", outcome.unitId());
            unit.put("success", outcome.isSuccess());
            unit.put("durationMs", outcome.duration().toMillis());
            if (outcome.isSuccess()) {
                unit.putAll(toDocument(outcome.result()));
            } else {
                unit.put("errorKind", outcome.errorKind());
                unit.put("message", outcome.message());
            }
            units.add(unit);
        }
        doc.put("units", units);

        AtomicFileWriter.write(target, writer -> {
            objectMapper.writeValue(writer, doc);
            return units.size();
        });
        return completed(target, "batch-summary", units.size());
    }

    private static Map<String, Object> toDocument(FilterResult result) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("unitId", result.unitId());
        doc.put("summary", result.summary());
        doc.put("suggestions", result.candidates());
        return doc;
    }

    ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    private static ExportResult completed(Path target, String format, long rows) {
        ExportResult result = new ExportResult(target, format, rows);
        log.info("export.completed result={}", result);
        return result;
    }
}
