package com.search.negatives.bulk;

import com.fasterxml.jackson.databind.JsonNode;
import com.search.negatives.api.NegativeKeywordFilter;
import com.search.negatives.batch.BatchReport;
import com.search.negatives.batch.BatchUnit;
import com.search.negatives.core.model.FilterResult;
import com.search.negatives.core.model.MatchType;
import com.search.negatives.core.model.NegativeKeywordEntry;
import com.search.negatives.core.model.SearchTermRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JsonSummaryExporter Tests")
class JsonSummaryExporterTest {

    @TempDir
    Path dir;

    private final JsonSummaryExporter exporter = new JsonSummaryExporter();
    private NegativeKeywordFilter filter;

    @BeforeEach
    void setUp() {
        filter = NegativeKeywordFilter.builder()
                .clock(Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC))
                .build();
    }

    private static List<SearchTermRecord> terms() {
        return List.of(
                SearchTermRecord.builder().term("free shoes").cost(20.0).conversions(0.0).build(),
                SearchTermRecord.builder().term("leather boots").cost(15.0).conversions(0.0).build());
    }

    private JsonNode read(Path file) throws IOException {
        return exporter.getObjectMapper().readTree(file.toFile());
    }

    @Test
    @DisplayName("Unit summary carries analytics and suggestions with ISO timestamps")
    void unitSummary() throws IOException {
        FilterResult result = filter.process("brand", terms(), List.of(filter.rule("free", MatchType.EXACT)));
        Path file = dir.resolve("summary.json");

        ExportResult export = exporter.export(result, file);

        assertEquals("summary", export.format());
        JsonNode root = read(file);
        assertEquals("brand", root.get("unitId").asText());
        JsonNode summary = root.get("summary");
        assertEquals(2, summary.get("totalTerms").asInt());
        assertEquals(0, summary.get("excludedCount").asInt());
        assertEquals(35.0, summary.get("potentialSavings").asDouble(), 1e-9);
        assertEquals("2024-03-01T12:00:00Z", summary.get("generatedAt").asText());
        assertTrue(summary.get("recommendations").isArray());
        assertEquals(result.candidates().size(), root.get("suggestions").size());
        assertEquals(result.candidates().get(0).text(), root.get("suggestions").get(0).get("text").asText());
    }

    @Test
    @DisplayName("Batch summary lists every unit with its status")
    void batchSummary() throws IOException {
        BatchReport report = filter.runBatch(List.of(
                BatchUnit.of("ok", terms(), List.of(NegativeKeywordEntry.of("free", "BROAD"))),
                BatchUnit.of("bad", terms(), List.of(NegativeKeywordEntry.of("free", "WIDE")))),
                2, Duration.ofSeconds(30));
        Path file = dir.resolve("batch.json");

        ExportResult export = exporter.export(report, file);

        assertEquals(2, export.rowCount());
        JsonNode root = read(file);
        assertEquals(report.batchId(), root.get("batchId").asText());
        assertEquals("PARTIAL", root.get("status").asText());
        assertEquals(50.0, root.get("successRate").asDouble(), 1e-9);

        JsonNode ok = root.get("units").get(0);
        assertEquals("ok", ok.get("unitId").asText());
        assertTrue(ok.get("success").asBoolean());
        assertEquals(1, ok.get("summary").get("excludedCount").asInt());

        JsonNode bad = root.get("units").get(1);
        assertFalse(bad.get("success").asBoolean());
        assertEquals("INVALID_RULE", bad.get("errorKind").asText());
        assertTrue(bad.get("message").asText().contains("WIDE"));
        assertFalse(bad.has("summary"));
    }
}
