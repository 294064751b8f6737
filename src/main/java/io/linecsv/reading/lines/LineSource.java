package io.linecsv.reading.lines;

import java.io.Closeable;
import java.io.IOException;

/**
 * A single-pass source of physical lines, already decoded to characters. Each line is delivered with its line
 * terminator removed.
 */
public interface LineSource extends Closeable {
    /**
     * Read the next physical line.
     *
     * @return The line without its terminator, or null at end of input. The line must not contain \n or \r.
     * @throws IOException If the underlying input fails.
     */
    String readLine() throws IOException;
}
