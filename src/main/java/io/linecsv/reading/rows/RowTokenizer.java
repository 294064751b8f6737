package io.linecsv.reading.rows;

import io.linecsv.CsvSpecs;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one chunk of text into the fields of a single logical row, understanding field delimiters, line terminators,
 * and the CSV quoting convention. The chunk is the text of one or more physical lines, each followed by a line
 * terminator. If the chunk ends while a quoted section is still open, the tokenizer returns
 * {@link TokenizeResult#INCOMPLETE} so the caller can append the next physical line and {@link #resume} the scan.
 *
 * <p>
 * Quoting works as a toggle: every quote character that is not escaped flips the scan between quoted and unquoted
 * text, wherever it appears in the field, and is itself dropped. So {@code "ab"cd} decodes to {@code abcd}, and
 * {@code x"a,b"} to {@code xa,b}. Inside quoted text the escape character immediately followed by the quote character
 * gives a literal quote; with the default escape (the quote character itself) this is the usual {@code ""}. Outside
 * quoted text the same pair is recognized only when the escape character differs from the quote character, since a
 * doubled quote there just opens and closes an empty quoted section.
 *
 * <p>
 * Instances keep scratch state between calls and are not thread safe.
 */
public final class RowTokenizer {
    /** The configured CSV quote character (typically '"'). */
    private final char quoteChar;
    /** The configured CSV field delimiter (typically ','). */
    private final char fieldDelimiter;
    /**
     * The configured escape character (typically '"'). Only recognized immediately before the quote character. When
     * it equals the quote character, this gives the usual {@code ""} convention.
     */
    private final char escapeChar;
    /** The text of the field currently being assembled, with quotes and escapes removed. */
    private final StringBuilder field;
    /** The fields of the row finished so far. */
    private List<String> fields;
    /** The chunk being tokenized. */
    private CharSequence chunk;
    /** Length of the chunk being tokenized. */
    private int size;
    /** Current offset in the chunk. */
    private int offset;
    /** Whether the scan is inside quoted text. */
    private boolean inQuotes;
    /**
     * Set when the last call returned {@link TokenizeResult#INCOMPLETE} on a chunk ending in a line terminator. The
     * scan state then describes exactly the first {@link #offset} characters, and can be continued.
     */
    private boolean resumable;

    /**
     * Constructor.
     *
     * @param quoteChar The configured quote char. Typically "
     * @param fieldDelimiter The configured field delimiter. Typically ,
     * @param escapeChar The configured escape char. Typically the same as the quote char.
     */
    public RowTokenizer(final char quoteChar, final char fieldDelimiter, final char escapeChar) {
        this.quoteChar = quoteChar;
        this.fieldDelimiter = fieldDelimiter;
        this.escapeChar = escapeChar;
        this.field = new StringBuilder();
    }

    /**
     * Make a tokenizer with the characters configured in {@code specs}.
     *
     * @param specs The specs.
     * @return The tokenizer.
     */
    public static RowTokenizer of(final CsvSpecs specs) {
        return new RowTokenizer(specs.quote(), specs.delimiter(), specs.escape());
    }

    /**
     * Try to split {@code chunk} into the fields of one row, scanning from its first character.
     *
     * @param chunk The accumulated text, normally ending in a line terminator.
     * @return The complete row, or {@link TokenizeResult#INCOMPLETE} if the chunk ends inside quoted text.
     * @throws IllegalArgumentException if there is text after an unquoted line terminator. Physical lines never
     *         contain a line terminator, so this means the chunk was not built from them.
     */
    public TokenizeResult tokenize(final CharSequence chunk) {
        fields = new ArrayList<>();
        field.setLength(0);
        offset = 0;
        inQuotes = false;
        return scan(chunk);
    }

    /**
     * Continue the scan after an {@link TokenizeResult#INCOMPLETE} result. {@code chunk} must be the previous chunk
     * with more text appended; only the appended text is scanned. If the previous call did not leave a resumable
     * state, this is the same as {@link #tokenize}.
     *
     * @param chunk The previous chunk with the next physical line appended.
     * @return The complete row, or {@link TokenizeResult#INCOMPLETE} if the chunk still ends inside quoted text.
     */
    public TokenizeResult resume(final CharSequence chunk) {
        if (!resumable || chunk.length() < offset) {
            return tokenize(chunk);
        }
        return scan(chunk);
    }

    private TokenizeResult scan(final CharSequence chunk) {
        this.chunk = chunk;
        this.size = chunk.length();
        this.resumable = false;
        try {
            while (offset != size) {
                final char ch = chunk.charAt(offset);
                if (ch == escapeChar && (inQuotes || escapeChar != quoteChar) && offset + 1 != size
                        && chunk.charAt(offset + 1) == quoteChar) {
                    // An escaped quote. With escapeChar == quoteChar this is the doubled quote "".
                    field.append(quoteChar);
                    offset += 2;
                    continue;
                }
                ++offset;
                if (ch == quoteChar) {
                    inQuotes = !inQuotes;
                    continue;
                }
                if (inQuotes) {
                    // Delimiters and line terminators are literal in here.
                    field.append(ch);
                    continue;
                }
                if (ch == fieldDelimiter) {
                    finishField();
                    continue;
                }
                if (ch == '\n' || ch == '\r') {
                    finishRow(ch);
                    break;
                }
                field.append(ch);
            }
            if (inQuotes) {
                final char last = chunk.charAt(size - 1);
                resumable = last == '\n' || last == '\r';
                return TokenizeResult.INCOMPLETE;
            }
            // Reached after a line terminator, or at the end of a chunk that has none.
            finishField();
            return TokenizeResult.complete(fields);
        } finally {
            this.chunk = null;
        }
    }

    private void finishField() {
        fields.add(field.toString());
        field.setLength(0);
    }

    /**
     * Consume the rest of the line terminator {@code ch} (\n, \r, or \r\n) and confirm that it is the last thing in
     * the chunk.
     */
    private void finishRow(final char ch) {
        if (ch == '\r' && offset != size && chunk.charAt(offset) == '\n') {
            ++offset;
        }
        if (offset != size) {
            throw new IllegalArgumentException(String.format(
                    "Unexpected text after the end of the row (offset %d of %d)", offset, size));
        }
    }
}
