package io.otlite.core;

/**
 * Code-point arithmetic over Java strings.
 * <p>
 * Positions and lengths throughout the engine count Unicode scalar values,
 * not UTF-16 chars, so a surrogate pair is one unit and can never be split
 * by an edit.
 */
public final class TextUnits {

    private TextUnits() {
        // utility
    }

    /** Number of code points in {@code s}. */
    public static int length(String s) {
        return s.codePointCount(0, s.length());
    }

    /**
     * Replace the code-point span {@code [position, position + removeCount)}
     * of {@code text} with {@code insert}.
     * Callers validate bounds first; out-of-range arguments surface as
     * IndexOutOfBoundsException from the JDK.
     */
    public static String splice(String text, int position, int removeCount, String insert) {
        int from = text.offsetByCodePoints(0, position);
        int to = text.offsetByCodePoints(from, removeCount);
        return new StringBuilder(text.length() - (to - from) + insert.length())
                .append(text, 0, from)
                .append(insert)
                .append(text, to, text.length())
                .toString();
    }

    /** Code-point substring {@code [start, end)}. */
    public static String slice(String text, int start, int end) {
        int from = text.offsetByCodePoints(0, start);
        int to = text.offsetByCodePoints(from, end - start);
        return text.substring(from, to);
    }
}
