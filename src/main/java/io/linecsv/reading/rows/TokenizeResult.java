package io.linecsv.reading.rows;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The outcome of {@link RowTokenizer#tokenize}: either a complete row, or {@link #INCOMPLETE}, meaning the chunk ended
 * inside a quoted field and the row continues on a later physical line.
 */
public abstract class TokenizeResult {
    /** The chunk ended inside an open quoted field. */
    public static final TokenizeResult INCOMPLETE = new Incomplete();

    /**
     * Make a result holding a complete row.
     *
     * @param fields The fields of the row, in order.
     * @return The result.
     */
    public static TokenizeResult complete(final List<String> fields) {
        return new Complete(fields);
    }

    private TokenizeResult() {}

    /**
     * @return true if this result holds a complete row.
     */
    public abstract boolean isComplete();

    /**
     * The fields of the complete row.
     *
     * @return An unmodifiable list of fields.
     * @throws IllegalStateException if this result is {@link #INCOMPLETE}.
     */
    public abstract List<String> fields();

    private static final class Complete extends TokenizeResult {
        private final List<String> fields;

        Complete(final List<String> fields) {
            this.fields = Collections.unmodifiableList(Objects.requireNonNull(fields));
        }

        @Override
        public boolean isComplete() {
            return true;
        }

        @Override
        public List<String> fields() {
            return fields;
        }

        @Override
        public String toString() {
            return "Complete" + fields;
        }
    }

    private static final class Incomplete extends TokenizeResult {
        @Override
        public boolean isComplete() {
            return false;
        }

        @Override
        public List<String> fields() {
            throw new IllegalStateException("Row is incomplete: the chunk ended inside a quoted field");
        }

        @Override
        public String toString() {
            return "Incomplete";
        }
    }
}
