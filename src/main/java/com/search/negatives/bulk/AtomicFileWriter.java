package com.search.negatives.bulk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes a file through a temp file in the same directory, then moves it into place.
 * Readers never see a partially written file; on failure the temp file is deleted.
 */
final class AtomicFileWriter {
    private static final Logger log = LoggerFactory.getLogger(AtomicFileWriter.class);

    @FunctionalInterface
    interface Body {
        long write(Writer writer) throws IOException;
    }

    private AtomicFileWriter() {
    }

    /**
     * @return the value returned by {@code body}, usually a row count
     * @throws UncheckedIOException if writing or moving fails
     */
    static long write(Path target, Body body) {
        Path absolute = target.toAbsolutePath();
        Path dir = absolute.getParent();
        Path temp = null;
        try {
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, "." + absolute.getFileName(), ".tmp");
            long rows;
            try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                rows = body.write(writer);
            }
            move(temp, absolute);
            return rows;
        } catch (IOException e) {
            deleteQuietly(temp);
            log.error("export.failed path={} error={}", absolute, e.getMessage());
            throw new UncheckedIOException("Failed to write " + absolute, e);
        } catch (RuntimeException e) {
            deleteQuietly(temp);
            throw e;
        }
    }

    private static void move(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) return;
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("export.cleanup.failed path={} error={}", temp, e.getMessage());
        }
    }
}
