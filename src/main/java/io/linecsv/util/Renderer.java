package io.linecsv.util;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Formatting helpers for diagnostic messages.
 */
public final class Renderer {
    /**
     * Utility class. Do not instantiate.
     */
    private Renderer() {}

    /**
     * Render the items as a comma-separated list.
     *
     * @param items The items to render.
     * @return The items joined with ", ".
     */
    public static <T> String renderList(final Collection<T> items) {
        return items.stream().map(Object::toString).collect(Collectors.joining(", "));
    }

    /**
     * Render text for inclusion in an error message, making line terminators visible.
     *
     * @param text The text.
     * @return The text with \r and \n shown as escapes.
     */
    public static String renderVisible(final CharSequence text) {
        final StringBuilder sb = new StringBuilder(text.length());
        for (int ii = 0; ii < text.length(); ++ii) {
            final char ch = text.charAt(ii);
            if (ch == '\n') {
                sb.append("\\n");
            } else if (ch == '\r') {
                sb.append("\\r");
            } else {
                sb.append(ch);
            }
        }
        return sb.toString();
    }
}
