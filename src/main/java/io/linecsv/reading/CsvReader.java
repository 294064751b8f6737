package io.linecsv.reading;

import io.linecsv.CsvSpecs;
import io.linecsv.reading.lines.BufferedReaderLineSource;
import io.linecsv.reading.lines.LineSource;
import io.linecsv.util.CsvReaderException;
import io.linecsv.util.UncheckedCsvReaderException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Entry points for reading CSV data. Typical usage is:
 *
 * <ol>
 * <li>Build a {@link CsvSpecs} (or use {@link CsvSpecs#csv()}).
 * <li>Call one of the {@link #open} methods to get a {@link CsvFileReader} session over the input.
 * <li>Call {@link CsvFileReader#readAll()}, {@link CsvFileReader#readAllWithHeader()}, or one of the lazy variants.
 * <li>Close the session.
 * </ol>
 *
 * Example:
 *
 * <pre>
 * final CsvSpecs specs = CsvSpecs.builder().delimiter(';').build();
 * final List&lt;Map&lt;String, String&gt;&gt; rows = CsvReader.open(specs, reader, CsvFileReader::readAllWithHeader);
 * </pre>
 */
public final class CsvReader {
    /**
     * Utility class. Do not instantiate.
     */
    private CsvReader() {}

    /**
     * Open a session over character input.
     *
     * @param specs A {@link CsvSpecs} object providing options for the parse.
     * @param reader The input. Ownership passes to the session.
     * @return The session.
     */
    public static CsvFileReader open(final CsvSpecs specs, final Reader reader) {
        return open(specs, new BufferedReaderLineSource(reader));
    }

    /**
     * Open a session over byte input, decoded with {@link CsvSpecs#charset()}.
     *
     * @param specs A {@link CsvSpecs} object providing options for the parse.
     * @param stream The input. Ownership passes to the session.
     * @return The session.
     */
    public static CsvFileReader open(final CsvSpecs specs, final InputStream stream) {
        return open(specs, new InputStreamReader(stream, specs.charset()));
    }

    /**
     * Open a session over a file, decoded with {@link CsvSpecs#charset()}.
     *
     * @param specs A {@link CsvSpecs} object providing options for the parse.
     * @param path The file.
     * @return The session.
     * @throws CsvReaderException If the file cannot be opened.
     */
    public static CsvFileReader open(final CsvSpecs specs, final Path path) throws CsvReaderException {
        try {
            return open(specs, Files.newBufferedReader(path, specs.charset()));
        } catch (IOException inner) {
            throw new CsvReaderException("Can't open " + path, inner);
        }
    }

    /**
     * Open a session over an arbitrary {@link LineSource}.
     *
     * @param specs A {@link CsvSpecs} object providing options for the parse.
     * @param lineSource The input. Ownership passes to the session.
     * @return The session.
     */
    public static CsvFileReader open(final CsvSpecs specs, final LineSource lineSource) {
        return new CsvFileReader(specs, lineSource);
    }

    /**
     * Open a session over {@code reader}, run {@code action} against it, and close the session whether or not
     * {@code action} succeeds. An {@link UncheckedCsvReaderException} raised by one of the session's lazy streams
     * inside {@code action} is unwrapped and its {@link CsvReaderException} rethrown.
     *
     * @param specs A {@link CsvSpecs} object providing options for the parse.
     * @param reader The input.
     * @param action The work to do with the session.
     * @return The value returned by {@code action}.
     * @throws CsvReaderException If {@code action} fails, or closing the session fails.
     */
    public static <T> T open(final CsvSpecs specs, final Reader reader, final SessionFunction<T> action)
            throws CsvReaderException {
        final CsvFileReader session = open(specs, reader);
        try (session) {
            return action.apply(session);
        } catch (UncheckedCsvReaderException inner) {
            throw inner.getCause();
        } catch (IOException inner) {
            throw new CsvReaderException("Caught exception", inner);
        }
    }

    /**
     * Read every row of {@code text}.
     *
     * @param specs A {@link CsvSpecs} object providing options for the parse.
     * @param text The CSV text.
     * @return The rows, in input order.
     * @throws CsvReaderException If the input is malformed.
     */
    public static List<List<String>> readAll(final CsvSpecs specs, final String text) throws CsvReaderException {
        return open(specs, new StringReader(text), CsvFileReader::readAll);
    }

    /**
     * Read {@code text} as a header row followed by data rows.
     *
     * @param specs A {@link CsvSpecs} object providing options for the parse.
     * @param text The CSV text.
     * @return The data rows as maps from header name to field value.
     * @throws CsvReaderException If the input is malformed.
     */
    public static List<Map<String, String>> readAllWithHeader(final CsvSpecs specs, final String text)
            throws CsvReaderException {
        return open(specs, new StringReader(text), CsvFileReader::readAllWithHeader);
    }

    /**
     * Work done with an open session.
     *
     * @param <T> The result type.
     */
    @FunctionalInterface
    public interface SessionFunction<T> {
        T apply(CsvFileReader session) throws CsvReaderException;
    }
}
