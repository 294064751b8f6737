package io.linecsv.reading;

import io.linecsv.CsvSpecs;
import io.linecsv.reading.headers.HeaderMapper;
import io.linecsv.reading.lines.LineSource;
import io.linecsv.reading.rows.RowTokenizer;
import io.linecsv.reading.rows.TokenizeResult;
import io.linecsv.util.CsvReaderException;
import io.linecsv.util.MalformedCsvException;
import io.linecsv.util.Renderer;
import io.linecsv.util.UncheckedCsvReaderException;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * One reading session over a {@link LineSource}. Physical lines are pulled from the source one at a time and
 * assembled into logical rows: when a line ends inside a quoted field, the text read so far is kept as leftover, the
 * line separator is put back, and the next physical line is appended before tokenizing again.
 *
 * <p>
 * A session is single-pass and not thread safe. It owns its {@link LineSource} and releases it on reaching the end of
 * the input, on a malformed tail, or on {@link #close()}. Obtain one through {@link CsvReader#open}. Example:
 *
 * <pre>
 * try (CsvFileReader reader = CsvReader.open(CsvSpecs.csv(), new FileReader("data.csv"))) {
 *     for (List&lt;String&gt; row : reader.readAll()) {
 *         // Use row
 *     }
 * }
 * </pre>
 */
public final class CsvFileReader implements Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(CsvFileReader.class);

    /**
     * Row assembly states. A call to {@link #nextRow()} starts in AWAITING_LINE (or ROW_READY, left over from the
     * previous call), loops between AWAITING_LINE and ACCUMULATING while the tokenizer reports an open quote, and ends
     * in ROW_READY, END_OF_STREAM or MALFORMED. The last two are terminal.
     */
    private enum State {
        AWAITING_LINE, ACCUMULATING, ROW_READY, END_OF_STREAM, MALFORMED
    }

    private final LineSource lineSource;
    private final RowTokenizer tokenizer;
    private final String lineSeparator;
    private final boolean ignoreEmptyLines;
    /**
     * Text of the row being assembled: the leftover from earlier physical lines plus the current line, each followed
     * by the line separator. Empty between rows.
     */
    private final StringBuilder buffer;
    private State state;
    /** The exception that put this session in the MALFORMED state; rethrown by later calls. */
    private CsvReaderException terminalError;
    private boolean sourceReleased;
    /** Number of physical lines read so far. */
    private long physicalLineNum;
    /** Number of logical rows returned so far (including a header row). */
    private long logicalRowNum;

    /**
     * Constructor.
     *
     * @param specs The {@link CsvSpecs} which control how the input is interpreted.
     * @param lineSource The input. Ownership passes to this object.
     */
    public CsvFileReader(final CsvSpecs specs, final LineSource lineSource) {
        this.lineSource = lineSource;
        this.tokenizer = RowTokenizer.of(specs);
        this.lineSeparator = specs.lineSeparator();
        this.ignoreEmptyLines = specs.ignoreEmptyLines();
        this.buffer = new StringBuilder();
        this.state = State.AWAITING_LINE;
    }

    /**
     * Read the next logical row.
     *
     * @return The fields of the row as an unmodifiable list, or null if the input ended cleanly between rows.
     * @throws MalformedCsvException If the input ends inside a quoted field.
     * @throws CsvReaderException If reading the underlying input fails.
     */
    @Nullable
    public List<String> nextRow() throws CsvReaderException {
        if (state == State.END_OF_STREAM) {
            return null;
        }
        if (state == State.MALFORMED) {
            throw terminalError;
        }
        state = State.AWAITING_LINE;
        int linesInRow = 0;
        while (true) {
            final String line = readPhysicalLine();
            if (line == null) {
                if (buffer.length() != 0) {
                    final String leftover = buffer.substring(0, buffer.length() - lineSeparator.length());
                    throw fail(new MalformedCsvException(String.format(
                            "Input ended inside a quoted field that started on physical line %d: leftover \"%s\"",
                            physicalLineNum - linesInRow + 1, Renderer.renderVisible(leftover))));
                }
                state = State.END_OF_STREAM;
                releaseSource();
                return null;
            }
            ++physicalLineNum;
            if (ignoreEmptyLines && line.isEmpty() && buffer.length() == 0) {
                continue;
            }
            state = State.ACCUMULATING;
            ++linesInRow;
            buffer.append(line).append(lineSeparator);

            // Only the newly appended line is scanned when the row continues.
            final TokenizeResult result = linesInRow == 1 ? tokenizer.tokenize(buffer) : tokenizer.resume(buffer);
            if (result.isComplete()) {
                buffer.setLength(0);
                ++logicalRowNum;
                state = State.ROW_READY;
                if (linesInRow > 1) {
                    LOGGER.debug("Row {} spans {} physical lines (ending at line {})", logicalRowNum, linesInRow,
                            physicalLineNum);
                }
                return result.fields();
            }
            // The quote is still open: keep the buffer as leftover and append the next physical line.
            state = State.AWAITING_LINE;
        }
    }

    /**
     * Read all the remaining rows. The first error aborts the whole read; no partial result is returned.
     *
     * @return The rows, in input order.
     * @throws CsvReaderException If the input is malformed or cannot be read.
     */
    public List<List<String>> readAll() throws CsvReaderException {
        final List<List<String>> rows = new ArrayList<>();
        List<String> row;
        while ((row = nextRow()) != null) {
            rows.add(row);
        }
        return rows;
    }

    /**
     * Read the first remaining row as the header row, and every following row as a map from header name to field
     * value. Empty input gives an empty list.
     *
     * @return The data rows as insertion-ordered maps, in input order.
     * @throws MalformedCsvException If a header name is repeated (detected before any data row is read), or a data row
     *         has a different number of fields than the header row.
     * @throws CsvReaderException If the input cannot be read.
     */
    public List<Map<String, String>> readAllWithHeader() throws CsvReaderException {
        final HeaderRowSupplier supplier = new HeaderRowSupplier();
        final List<Map<String, String>> rows = new ArrayList<>();
        Map<String, String> row;
        while ((row = supplier.next()) != null) {
            rows.add(row);
        }
        return rows;
    }

    /**
     * A lazy, single-pass view of the remaining rows. Nothing is read until the first element is requested, and each
     * element pulled reads exactly the physical lines that make up that row. Errors are raised, wrapped in
     * {@link UncheckedCsvReaderException}, when the offending row is reached. The stream is not restartable: calling
     * this again continues where the previous stream stopped. Closing the stream closes this session.
     *
     * @return The stream of rows.
     */
    public Stream<List<String>> readAllAsSequence() {
        return toStream(this::nextRow);
    }

    /**
     * The lazy counterpart of {@link #readAllWithHeader()}. The header row is read (and checked for duplicates) when
     * the first element is requested.
     *
     * @return The stream of data rows as insertion-ordered maps.
     */
    public Stream<Map<String, String>> readAllWithHeaderAsSequence() {
        return toStream(new HeaderRowSupplier());
    }

    /**
     * @return The number of physical lines read so far.
     */
    public long physicalLineNum() {
        return physicalLineNum;
    }

    /**
     * @return The number of logical rows read so far, including a header row.
     */
    public long logicalRowNum() {
        return logicalRowNum;
    }

    /**
     * Release the underlying {@link LineSource}. Safe to call more than once, and after any terminal state.
     *
     * @throws IOException If closing the source fails.
     */
    @Override
    public void close() throws IOException {
        if (sourceReleased) {
            return;
        }
        sourceReleased = true;
        lineSource.close();
    }

    private String readPhysicalLine() throws CsvReaderException {
        if (sourceReleased) {
            throw fail(new CsvReaderException("The session has been closed"));
        }
        try {
            return lineSource.readLine();
        } catch (IOException inner) {
            throw fail(new CsvReaderException("Caught exception", inner));
        }
    }

    /** Enter the MALFORMED state, release the source, and hand back {@code error} for the caller to throw. */
    private CsvReaderException fail(final CsvReaderException error) {
        LOGGER.debug("Aborting read after {} physical lines: {}", physicalLineNum, error.getMessage());
        state = State.MALFORMED;
        terminalError = error;
        buffer.setLength(0);
        try {
            close();
        } catch (IOException suppressed) {
            error.addSuppressed(suppressed);
        }
        return error;
    }

    private void releaseSource() throws CsvReaderException {
        try {
            close();
        } catch (IOException inner) {
            throw new CsvReaderException("Caught exception", inner);
        }
        LOGGER.debug("Reached end of input after {} physical lines and {} rows", physicalLineNum, logicalRowNum);
    }

    private void closeUnchecked() {
        try {
            close();
        } catch (IOException inner) {
            throw new UncheckedIOException(inner);
        }
    }

    private <T> Stream<T> toStream(final RowSupplier<T> supplier) {
        final Spliterator<T> spliterator =
                new Spliterators.AbstractSpliterator<T>(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL) {
                    @Override
                    public boolean tryAdvance(final Consumer<? super T> action) {
                        final T next;
                        try {
                            next = supplier.next();
                        } catch (CsvReaderException e) {
                            throw new UncheckedCsvReaderException(e);
                        }
                        if (next == null) {
                            return false;
                        }
                        action.accept(next);
                        return true;
                    }
                };
        return StreamSupport.stream(spliterator, false).onClose(this::closeUnchecked);
    }

    /** Produces one element per call, or null at the end of the input. */
    private interface RowSupplier<T> {
        T next() throws CsvReaderException;
    }

    /** Reads the header row on the first call, then maps each data row against it. */
    private final class HeaderRowSupplier implements RowSupplier<Map<String, String>> {
        private HeaderMapper mapper;

        @Override
        public Map<String, String> next() throws CsvReaderException {
            if (mapper == null) {
                final List<String> headerRow = nextRow();
                if (headerRow == null) {
                    return null;
                }
                try {
                    mapper = HeaderMapper.forHeaderRow(headerRow);
                } catch (MalformedCsvException e) {
                    throw fail(e);
                }
            }
            final List<String> fields = nextRow();
            if (fields == null) {
                return null;
            }
            try {
                return mapper.toMap(fields, logicalRowNum);
            } catch (MalformedCsvException e) {
                throw fail(e);
            }
        }
    }
}
