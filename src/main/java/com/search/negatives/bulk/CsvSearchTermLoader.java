package com.search.negatives.bulk;

import com.search.negatives.core.model.SearchTermRecord;
import com.search.negatives.exception.InvalidRecordException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Loads a search term report exported from an ad platform.
 *
 * <p>Expected CSV format (header names are matched case-insensitively, with aliases):</p>
 * <pre>
 * Search term,Campaign,Impr.,Clicks,Cost,Conversions
 * free running shoes,Brand,"1,200",3,$4.50,0
 * </pre>
 *
 * <p>Columns other than the term and the four metrics are kept as record attributes.
 * Missing or unparsable metric values become {@code null}. A row with more cells
 * than the header is skipped and reported as a {@link LoadResult.LoadError}, or
 * fails the load in strict mode.</p>
 */
public class CsvSearchTermLoader {
    private static final Logger log = LoggerFactory.getLogger(CsvSearchTermLoader.class);
    private static final int PROGRESS_INTERVAL = 1000;

    static final List<String> TERM_ALIASES = List.of(
            "search term", "search terms", "search_term", "search keyword", "search query",
            "query", "keyword", "search");
    static final List<String> IMPRESSION_ALIASES = List.of("impressions", "impr.", "impr", "impression");
    static final List<String> CLICK_ALIASES = List.of("clicks", "click");
    static final List<String> COST_ALIASES = List.of("cost", "spend", "cost (usd)");
    static final List<String> CONVERSION_ALIASES = List.of("conversions", "conv.", "conversion");

    private final boolean strict;

    public CsvSearchTermLoader() {
        this(false);
    }

    public CsvSearchTermLoader(boolean strict) {
        this.strict = strict;
    }

    public LoadResult load(Path path) {
        return load(path, ProgressCallback.NOOP);
    }

    public LoadResult load(Path path, ProgressCallback callback) {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader, callback);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read search terms from " + path, e);
        }
    }

    /**
     * Loads records from a reader. The reader is not closed.
     *
     * @throws InvalidRecordException if no term column can be found, or in strict mode on a malformed row
     */
    public LoadResult load(Reader reader, ProgressCallback callback) throws IOException {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader);

        String headerLine = CsvSupport.stripBom(br.readLine());
        if (headerLine == null) {
            return new LoadResult(List.of(), 0, List.of());
        }
        List<String> header = CsvSupport.parseLine(headerLine);
        ColumnLayout layout = ColumnLayout.resolve(header);

        List<SearchTermRecord> records = new ArrayList<>();
        List<LoadResult.LoadError> errors = new ArrayList<>();
        long totalRows = 0;
        long lineNumber = 1;
        String line;
        while ((line = br.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            totalRows++;
            List<String> cells = CsvSupport.parseLine(line);
            if (cells.size() > header.size()) {
                String message = "Row has " + cells.size() + " cells but header has " + header.size();
                if (strict) {
                    throw new InvalidRecordException("Line " + lineNumber + ": " + message, lineNumber);
                }
                errors.add(new LoadResult.LoadError(lineNumber, line, message));
                log.warn("load.row.skipped line={} error={}", lineNumber, message);
                continue;
            }
            records.add(layout.toRecord(header, cells, lineNumber));

            if (totalRows % PROGRESS_INTERVAL == 0) {
                cb.onProgress(totalRows, -1, "Loaded " + totalRows + " rows");
            }
        }

        LoadResult result = new LoadResult(records, totalRows, errors);
        cb.onProgress(totalRows, totalRows, "Load completed");
        log.info("load.completed termColumn='{}' result={}", header.get(layout.term), result);
        return result;
    }

    /**
     * Column positions resolved from the header, -1 when absent.
     */
    private record ColumnLayout(int term, int impressions, int clicks, int cost, int conversions) {

        static ColumnLayout resolve(List<String> header) {
            int term = find(header, TERM_ALIASES);
            if (term < 0) {
                throw new InvalidRecordException("Search terms file has no search term column. Available columns: "
                        + header);
            }
            return new ColumnLayout(term,
                    find(header, IMPRESSION_ALIASES),
                    find(header, CLICK_ALIASES),
                    find(header, COST_ALIASES),
                    find(header, CONVERSION_ALIASES));
        }

        // aliases are tried in order so "Search term" wins over a later "Keyword" column
        private static int find(List<String> header, List<String> aliases) {
            for (String alias : aliases) {
                for (int i = 0; i < header.size(); i++) {
                    if (header.get(i).trim().toLowerCase(Locale.ROOT).equals(alias)) {
                        return i;
                    }
                }
            }
            return -1;
        }

        SearchTermRecord toRecord(List<String> header, List<String> cells, long lineNumber) {
            SearchTermRecord.Builder builder = SearchTermRecord.builder()
                    .term(cell(cells, term))
                    .impressions(CsvSupport.parseNumber(cell(cells, impressions)))
                    .clicks(CsvSupport.parseNumber(cell(cells, clicks)))
                    .cost(CsvSupport.parseNumber(cell(cells, cost)))
                    .conversions(CsvSupport.parseNumber(cell(cells, conversions)))
                    .lineNumber(lineNumber);
            for (int i = 0; i < header.size(); i++) {
                if (i != term && i != impressions && i != clicks && i != cost && i != conversions) {
                    builder.attribute(header.get(i).trim(), cell(cells, i));
                }
            }
            return builder.build();
        }

        private static String cell(List<String> cells, int index) {
            return index >= 0 && index < cells.size() ? cells.get(index) : null;
        }
    }
}
