package com.search.negatives.bulk;

import java.nio.file.Path;

/**
 * Result of an export.
 *
 * @param path     the file written
 * @param format   report kind, e.g. {@code review} or {@code ads-editor}
 * @param rowCount data rows written, excluding the header
 */
public record ExportResult(Path path, String format, long rowCount) {
    @Override
    public String toString() {
        return "ExportResult{format=" + format + ", rows=" + rowCount + ", path=" + path + '}';
    }
}
