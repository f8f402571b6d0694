package com.search.negatives.bulk;

import com.search.negatives.core.model.SearchTermRecord;

import java.util.List;

/**
 * Result of loading a search term report.
 *
 * @param records   loaded records, in file order
 * @param totalRows data rows read, excluding the header and blank lines
 * @param errors    rows that were skipped
 */
public record LoadResult(List<SearchTermRecord> records, long totalRows, List<LoadError> errors) {

    public LoadResult {
        records = records != null ? List.copyOf(records) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A row that could not be loaded.
     *
     * @param lineNumber the line number in the input (1-based, header is line 1)
     * @param line       the raw line
     * @param message    why it was skipped
     */
    public record LoadError(long lineNumber, String line, String message) {}

    @Override
    public String toString() {
        return "LoadResult{rows=" + totalRows + ", records=" + records.size() + ", errors=" + errors.size() + '}';
    }
}
