package info.isaksson.erland.xamlmigrate.parse;

import java.util.Arrays;

/**
 * Line-start offsets over raw source text.
 *
 * <p>{@code \n}, {@code \r\n} and a bare {@code \r} each end one line. Lines are 1-based.</p>
 *
 * <p>Element locations follow the convention of reporting the column of the first character of the tag
 * name, not of {@code <}. {@link #characterPosition(int, int)} compensates for both that and 1-based
 * columns, so it maps an element location straight back to the offset of its {@code <}.</p>
 */
public final class PositionIndex {

    private final String text;
    private final int[] lineStarts;

    public PositionIndex(String text) {
        if (text == null) throw new IllegalArgumentException("text must not be null");
        this.text = text;
        this.lineStarts = computeLineStarts(text);
    }

    public String text() {
        return text;
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /** Offset of the first character of a 1-based line. */
    public int lineStart(int line) {
        if (line < 1 || line > lineStarts.length) {
            throw new IllegalArgumentException("line out of range: " + line + " (1.." + lineStarts.length + ")");
        }
        return lineStarts[line - 1];
    }

    /** {@code lineStart + column - 2}: the offset of {@code <} for an element reported at (line, column). */
    public int characterPosition(int line, int column) {
        int pos = lineStart(line) + column - 2;
        if (pos < 0 || pos > text.length()) {
            throw new IllegalArgumentException("position out of range for " + line + ":" + column);
        }
        return pos;
    }

    /** 1-based line containing the offset. */
    public int lineOf(int offset) {
        int idx = Arrays.binarySearch(lineStarts, offset);
        if (idx >= 0) return idx + 1;
        return -idx - 1;
    }

    /** Plain 1-based column of the character at the offset. */
    public int columnOf(int offset) {
        return offset - lineStarts[lineOf(offset) - 1] + 1;
    }

    /** Column to report for an element whose {@code <} is at the offset; inverse of {@link #characterPosition}. */
    public int tagNameColumnOf(int offset) {
        return columnOf(offset) + 1;
    }

    private static int[] computeLineStarts(String text) {
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\r' || c == '\n') {
                if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                if (count == starts.length) starts = Arrays.copyOf(starts, count * 2);
                starts[count++] = i + 1;
            }
            i++;
        }
        return Arrays.copyOf(starts, count);
    }
}
