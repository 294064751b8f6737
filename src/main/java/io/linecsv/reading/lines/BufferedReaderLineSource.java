package io.linecsv.reading.lines;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;

/**
 * A {@link LineSource} backed by a {@link BufferedReader}. A line is terminated by \n, \r, or \r\n, following
 * {@link BufferedReader#readLine()}.
 */
public final class BufferedReaderLineSource implements LineSource {
    private final BufferedReader reader;

    /**
     * Constructor. Wraps {@code reader} in a {@link BufferedReader} unless it already is one.
     *
     * @param reader The character input. Ownership passes to this object.
     */
    public BufferedReaderLineSource(final Reader reader) {
        this.reader = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
    }

    @Override
    public String readLine() throws IOException {
        return reader.readLine();
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
