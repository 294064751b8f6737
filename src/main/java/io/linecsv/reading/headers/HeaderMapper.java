package io.linecsv.reading.headers;

import io.linecsv.util.MalformedCsvException;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns data rows into maps keyed by the header row. The header row must not repeat a name, and every data row must
 * have exactly as many fields as the header row.
 */
public final class HeaderMapper {
    private final List<String> headers;

    private HeaderMapper(final List<String> headers) {
        this.headers = headers;
    }

    /**
     * Make a mapper for the given header row.
     *
     * @param headerRow The first row of the input.
     * @return The mapper.
     * @throws MalformedCsvException if a header name appears more than once. The first repeat found scanning left to
     *         right is named in the message.
     */
    public static HeaderMapper forHeaderRow(final List<String> headerRow) throws MalformedCsvException {
        final String duplicate = findDuplicate(headerRow);
        if (duplicate != null) {
            throw new MalformedCsvException(String.format("Header '%s' is duplicated", duplicate));
        }
        return new HeaderMapper(Collections.unmodifiableList(headerRow));
    }

    /**
     * @return The first header (scanning left to right) that repeats an earlier header, or null if they are unique.
     */
    static String findDuplicate(final List<String> headers) {
        final Set<String> unique = new HashSet<>();
        for (String header : headers) {
            if (!unique.add(header)) {
                return header;
            }
        }
        return null;
    }

    /**
     * @return The header names, in input order.
     */
    public List<String> headers() {
        return headers;
    }

    /**
     * Zip the header names with the fields of a data row.
     *
     * @param fields The data row.
     * @param rowNum The 1-based logical row number of the data row, for the error message.
     * @return An insertion-ordered map from header name to field value.
     * @throws MalformedCsvException if the row's field count differs from the header's.
     */
    public Map<String, String> toMap(final List<String> fields, final long rowNum) throws MalformedCsvException {
        if (fields.size() != headers.size()) {
            throw new MalformedCsvException(String.format(
                    "Row %d has %d fields but the header row has %d", rowNum, fields.size(), headers.size()));
        }
        final Map<String, String> result = new LinkedHashMap<>();
        for (int ii = 0; ii < headers.size(); ++ii) {
            result.put(headers.get(ii), fields.get(ii));
        }
        return Collections.unmodifiableMap(result);
    }
}
