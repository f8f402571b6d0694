package com.search.negatives.exception;

/**
 * Thrown for a structurally malformed search term row.
 * A merely missing field is not an error; it is repaired with a default.
 */
public class InvalidRecordException extends NegativeFilterException {

    private final long lineNumber;

    public InvalidRecordException(String message) {
        this(message, -1);
    }

    public InvalidRecordException(String message, long lineNumber) {
        super(message);
        this.lineNumber = lineNumber;
    }

    /**
     * Returns the 1-based input line, or -1 when the record did not come from a file.
     */
    public long getLineNumber() {
        return lineNumber;
    }
}
