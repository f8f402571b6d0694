package com.search.negatives.bulk;

import com.search.negatives.core.model.CandidateSuggestion;
import com.search.negatives.core.model.FilterResult;
import com.search.negatives.core.model.SearchTermRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Writes the CSV reports of a filtering run.
 *
 * <ul>
 *   <li><b>review</b> - records left after exclusion, for manual review</li>
 *   <li><b>audit</b> - every record with its classification</li>
 *   <li><b>suggestions</b> - ranked negative keyword candidates with their sub-scores</li>
 *   <li><b>ads-editor</b> - candidates as negative keyword rows for Google Ads Editor import</li>
 * </ul>
 *
 * <p>Each file is written to a temp file first and moved into place.</p>
 */
public class CsvReportExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvReportExporter.class);

    private static final List<String> RECORD_COLUMNS = List.of(
            "Search term", "Impressions", "Clicks", "Cost", "Conversions", "CTR", "CPC",
            "excluded_by_negatives", "exclusion_reason", "matched_negative_keyword",
            "matched_negative_match_type", "checked_at");

    public ExportResult exportReview(FilterResult result, Path target) {
        return exportRecords(result.reviewRecords(), target, "review");
    }

    public ExportResult exportAudit(FilterResult result, Path target) {
        return exportRecords(result.auditRecords(), target, "audit");
    }

    /**
     * Writes records with one column per distinct attribute, after the fixed columns.
     */
    public ExportResult exportRecords(List<SearchTermRecord> records, Path target, String format) {
        Set<String> attributeNames = new LinkedHashSet<>();
        for (SearchTermRecord record : records) {
            attributeNames.addAll(record.getAttributes().keySet());
        }

        long rows = AtomicFileWriter.write(target, writer -> {
            List<String> header = new ArrayList<>(RECORD_COLUMNS.subList(0, 1));
            header.addAll(attributeNames);
            header.addAll(RECORD_COLUMNS.subList(1, RECORD_COLUMNS.size()));
            writeRow(writer, header);

            long count = 0;
            for (SearchTermRecord record : records) {
                List<String> row = new ArrayList<>(header.size());
                row.add(record.getTerm());
                for (String name : attributeNames) {
                    row.add(record.getAttribute(name));
                }
                row.add(CsvSupport.number(record.getImpressions()));
                row.add(CsvSupport.number(record.getClicks()));
                row.add(CsvSupport.number(record.getCost()));
                row.add(CsvSupport.number(record.getConversions()));
                row.add(String.format(Locale.ROOT, "%.2f", record.clickThroughRate()));
                row.add(String.format(Locale.ROOT, "%.2f", record.costPerClick()));
                row.add(Boolean.toString(record.isExcluded()));
                row.add(record.statusDescription());
                row.add(record.getMatchedKeyword());
                row.add(record.getMatchedMatchType() != null ? record.getMatchedMatchType().name() : "");
                row.add(record.getCheckedAt() != null ? record.getCheckedAt().toString() : "");
                writeRow(writer, row);
                count++;
            }
            return count;
        });
        return completed(target, format, rows);
    }

    public ExportResult exportSuggestions(List<CandidateSuggestion> candidates, Path target) {
        long rows = AtomicFileWriter.write(target, writer -> {
            writeRow(writer, List.of("keyword", "match_type", "confidence", "impact_rating", "occurrences",
                    "supporting_terms", "zero_conversion_count", "wasted_cost",
                    "occurrence_score", "cost_impact_score", "zero_conversion_score"));
            long count = 0;
            for (CandidateSuggestion c : candidates) {
                writeRow(writer, List.of(
                        c.text(),
                        c.suggestedMatchType().name(),
                        String.format(Locale.ROOT, "%.1f", c.confidenceScore()),
                        c.impactRating().name(),
                        Integer.toString(c.occurrenceCount()),
                        Integer.toString(c.supportingTermCount()),
                        Integer.toString(c.zeroConversionCount()),
                        String.format(Locale.ROOT, "%.2f", c.totalCostWaste()),
                        String.format(Locale.ROOT, "%.3f", c.breakdown().occurrence().value()),
                        String.format(Locale.ROOT, "%.3f", c.breakdown().costImpact().value()),
                        String.format(Locale.ROOT, "%.3f", c.breakdown().zeroConversion().value())));
                count++;
            }
            return count;
        });
        return completed(target, "suggestions", rows);
    }

    /**
     * Writes candidates as Google Ads Editor negative keyword rows. The keyword cell
     * carries the platform notation for its match type ({@code "free shipping"},
     * {@code [free]}).
     *
     * @param campaign campaign name for the Campaign column, blank for an account-level list
     */
    public ExportResult exportAdsEditor(List<CandidateSuggestion> candidates, String campaign, Path target) {
        long rows = AtomicFileWriter.write(target, writer -> {
            writeRow(writer, List.of("Campaign", "Keyword", "Criterion Type"));
            long count = 0;
            for (CandidateSuggestion c : candidates) {
                writeRow(writer, List.of(
                        campaign != null ? campaign : "",
                        notation(c),
                        "Negative " + c.suggestedMatchType().getLabel()));
                count++;
            }
            return count;
        });
        return completed(target, "ads-editor", rows);
    }

    private static String notation(CandidateSuggestion c) {
        return switch (c.suggestedMatchType()) {
            case EXACT -> "[" + c.text() + "]";
            case PHRASE -> "\"" + c.text() + "\"";
            case BROAD -> c.text();
        };
    }

    private static void writeRow(Writer writer, List<String> cells) throws IOException {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                writer.write(',');
            }
            writer.write(CsvSupport.escape(cells.get(i)));
        }
        writer.write('\n');
    }

    private static ExportResult completed(Path target, String format, long rows) {
        ExportResult result = new ExportResult(target, format, rows);
        log.info("export.completed result={}", result);
        return result;
    }
}
