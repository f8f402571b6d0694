package com.search.negatives.bulk;

import com.search.negatives.core.model.MatchType;
import com.search.negatives.core.model.NegativeKeywordEntry;
import com.search.negatives.exception.InvalidRuleException;
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
 * Loads a negative keyword list.
 *
 * <p>Expected CSV format:</p>
 * <pre>
 * negative_keyword,match_type
 * free,EXACT
 * "free shipping",PHRASE
 * </pre>
 *
 * <p>Match types are validated while loading and never coerced: an unknown value
 * raises {@link InvalidRuleException} naming the line. Blank rows are skipped.</p>
 */
public class CsvNegativeKeywordLoader {
    private static final Logger log = LoggerFactory.getLogger(CsvNegativeKeywordLoader.class);

    static final List<String> KEYWORD_ALIASES = List.of("negative_keyword", "negative keyword", "keyword", "negative");
    static final List<String> MATCH_TYPE_ALIASES = List.of("match_type", "match type", "matchtype", "type");

    public List<NegativeKeywordEntry> load(Path path) {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read negative keywords from " + path, e);
        }
    }

    /**
     * Loads entries from a reader. The reader is not closed.
     *
     * @throws InvalidRuleException if a required column is missing or a match type is invalid
     */
    public List<NegativeKeywordEntry> load(Reader reader) throws IOException {
        BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        String headerLine = CsvSupport.stripBom(br.readLine());
        if (headerLine == null) {
            return List.of();
        }
        List<String> header = CsvSupport.parseLine(headerLine);
        int keywordCol = find(header, KEYWORD_ALIASES);
        int matchTypeCol = find(header, MATCH_TYPE_ALIASES);
        if (keywordCol < 0 || matchTypeCol < 0) {
            throw new InvalidRuleException("Negative keywords file needs keyword and match type columns. "
                    + "Available columns: " + header, null, null);
        }

        List<NegativeKeywordEntry> entries = new ArrayList<>();
        long lineNumber = 1;
        String line;
        while ((line = br.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            List<String> cells = CsvSupport.parseLine(line);
            String keyword = cell(cells, keywordCol);
            String matchType = cell(cells, matchTypeCol);
            if (isBlank(keyword) && isBlank(matchType)) {
                continue;
            }
            try {
                MatchType.parse(matchType);
            } catch (InvalidRuleException e) {
                throw new InvalidRuleException("Line " + lineNumber + ": " + e.getMessage(), keyword, matchType);
            }
            entries.add(new NegativeKeywordEntry(keyword, matchType, lineNumber));
        }

        log.info("load.negatives.completed entries={}", entries.size());
        return entries;
    }

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

    private static String cell(List<String> cells, int index) {
        return index < cells.size() ? cells.get(index) : null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
