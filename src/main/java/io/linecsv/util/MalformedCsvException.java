package io.linecsv.util;

/**
 * Thrown when the input is structurally broken: a quoted field that is still open when the input ends, a repeated
 * header name, a data row whose width differs from the header row, or stray text after a closing quote. These are
 * permanent faults of the input, so callers should not retry.
 */
public class MalformedCsvException extends CsvReaderException {
    /**
     * Constructor.
     *
     * @param message The exception message.
     */
    public MalformedCsvException(String message) {
        super(message);
    }

    /**
     * Constructor.
     *
     * @param message The exception message.
     * @param cause The inner exception.
     */
    public MalformedCsvException(String message, Throwable cause) {
        super(message, cause);
    }
}
