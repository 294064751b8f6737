package io.linecsv.util;

import java.util.Objects;

/**
 * Wraps a {@link CsvReaderException} with an unchecked exception. Thrown while pulling rows from one of the lazy
 * {@link java.util.stream.Stream}s, which cannot propagate checked exceptions.
 */
public class UncheckedCsvReaderException extends RuntimeException {
    /**
     * Constructor.
     *
     * @param cause The checked exception that was raised while producing the row.
     */
    public UncheckedCsvReaderException(CsvReaderException cause) {
        super(Objects.requireNonNull(cause).getMessage(), cause);
    }

    /**
     * @return The wrapped {@link CsvReaderException}.
     */
    @Override
    public synchronized CsvReaderException getCause() {
        return (CsvReaderException) super.getCause();
    }
}
