package io.linecsv;

import io.linecsv.annotations.BuildableStyle;
import io.linecsv.util.Renderer;
import org.immutables.value.Value.Check;
import org.immutables.value.Value.Default;
import org.immutables.value.Value.Immutable;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * A specification object for reading CSV input. Fixed for the lifetime of one reading session and shared read-only by
 * the row assembler and the tokenizer.
 */
@Immutable
@BuildableStyle
public abstract class CsvSpecs {
    /**
     * The Builder for the CsvSpecs class.
     */
    public interface Builder {
        /**
         * Copy all the parameters from {@code specs} into {@code this} builder.
         *
         * @param specs The source object
         * @return self after copying over all the properties.
         */
        Builder from(CsvSpecs specs);

        /**
         * The quote character (used when you want field or line delimiters to be interpreted as literal text). The
         * default is '{@value #defaultQuote}'. For example:
         *
         * <pre>
         * 123,"hello, there",456
         * </pre>
         *
         * Would be read as the three fields:
         *
         * <ul>
         * <li>123
         * <li>hello, there
         * <li>456
         * </ul>
         *
         * @param quote The quote property.
         * @return self after modifying the quote property.
         */
        Builder quote(char quote);

        /**
         * The field delimiter character (the character that separates one field from the next). The default is
         * '{@value #defaultDelimiter}'.
         *
         * @param delimiter The delimiter property.
         * @return self after modifying the delimiter property.
         */
        Builder delimiter(char delimiter);

        /**
         * The escape character. When it immediately precedes the quote character, the pair is read as one literal
         * quote character. No other escape sequences are recognized. The default is '{@value #defaultEscape}', which
         * gives the usual {@code ""} convention inside quoted fields.
         *
         * @param escape The escape property.
         * @return self after modifying the escape property.
         */
        Builder escape(char escape);

        /**
         * The line separator that is put back between physical lines when a quoted field spans more than one line.
         * Must be one of "\n", "\r\n" or "\r". The default is "\n".
         *
         * @param lineSeparator The lineSeparator property.
         * @return self after modifying the lineSeparator property.
         */
        Builder lineSeparator(String lineSeparator);

        /**
         * The charset used to decode byte input ({@link java.io.InputStream} and {@link java.nio.file.Path} sources).
         * Ignored for character input. The default is UTF-8.
         *
         * @param charset The charset property.
         * @return self after modifying the charset property.
         */
        Builder charset(Charset charset);

        /**
         * Whether the library should skip over empty lines that appear between rows. Empty lines inside a quoted field
         * are always part of the field. The default is false, in which case an empty line is read as a row holding a
         * single empty field.
         *
         * @param ignoreEmptyLines the ignoreEmptyLines property
         * @return self after modifying the ignoreEmptyLines property.
         */
        Builder ignoreEmptyLines(boolean ignoreEmptyLines);

        /**
         * Build the CsvSpecs object.
         *
         * @return The built object.
         */
        CsvSpecs build();
    }

    /**
     * Creates a builder for {@link CsvSpecs}.
     *
     * @return The builder.
     */
    public static Builder builder() {
        return ImmutableCsvSpecs.builder();
    }

    /**
     * Validates the {@link CsvSpecs}.
     */
    @Check
    void check() {
        // To be friendly, we report all the problems we find at once.
        final List<String> problems = new ArrayList<>();
        checkNotLineTerminator("quote", quote(), problems);
        checkNotLineTerminator("delimiter", delimiter(), problems);
        checkNotLineTerminator("escape", escape(), problems);
        if (delimiter() == quote()) {
            problems.add(String.format("delimiter and quote are both set to '%c'", delimiter()));
        }
        if (delimiter() == escape()) {
            problems.add(String.format("delimiter and escape are both set to '%c'", delimiter()));
        }
        final String sep = lineSeparator();
        if (!sep.equals("\n") && !sep.equals("\r\n") && !sep.equals("\r")) {
            problems.add(String.format("lineSeparator is set to \"%s\" but is required to be one of \\n, \\r\\n, \\r",
                    Renderer.renderVisible(sep)));
        }
        if (problems.isEmpty()) {
            return;
        }
        final String message = "CsvSpecs failed validation for the following reasons: " + Renderer.renderList(problems);
        throw new RuntimeException(message);
    }

    /**
     * A comma-separated-value delimited format.
     *
     * @return The CsvSpecs for the specified format.
     */
    public static CsvSpecs csv() {
        return builder().build();
    }

    /**
     * A tab-separated-value delimited format. Equivalent to {@code builder().delimiter('\t').build()}.
     *
     * @return The CsvSpecs for the specified format.
     */
    public static CsvSpecs tsv() {
        return builder().delimiter('\t').build();
    }

    private static final char defaultQuote = '"';

    /**
     * See {@link Builder#quote}.
     *
     * @return The caller-specified quote character.
     */
    @Default
    public char quote() {
        return defaultQuote;
    }

    private static final char defaultDelimiter = ',';

    /**
     * See {@link Builder#delimiter}.
     *
     * @return The caller-specified delimiter.
     */
    @Default
    public char delimiter() {
        return defaultDelimiter;
    }

    private static final char defaultEscape = '"';

    /**
     * See {@link Builder#escape}.
     *
     * @return The caller-specified escape character.
     */
    @Default
    public char escape() {
        return defaultEscape;
    }

    /**
     * See {@link Builder#lineSeparator}.
     *
     * @return The caller-specified line separator.
     */
    @Default
    public String lineSeparator() {
        return "\n";
    }

    /**
     * See {@link Builder#charset}.
     *
     * @return The charset used to decode byte input.
     */
    @Default
    public Charset charset() {
        return StandardCharsets.UTF_8;
    }

    /**
     * See {@link Builder#ignoreEmptyLines}.
     *
     * @return Whether the caller specified ignoring empty lines.
     */
    @Default
    public boolean ignoreEmptyLines() {
        return false;
    }

    private static void checkNotLineTerminator(String what, char c, List<String> problems) {
        if (c == '\n' || c == '\r') {
            final String message = String.format("%s is set to a line terminator character (0x%02x)", what, (int) c);
            problems.add(message);
        }
    }
}
