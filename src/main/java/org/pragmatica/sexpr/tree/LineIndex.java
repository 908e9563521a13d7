package org.pragmatica.sexpr.tree;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;

/**
 * Maps UTF-8 byte offsets of a source buffer to line/column locations.
 */
public final class LineIndex {
    private final byte[] source;
    private final int[] lineStarts;

    private LineIndex(byte[] source, int[] lineStarts) {
        this.source = source;
        this.lineStarts = lineStarts;
    }

    public static LineIndex of(String source) {
        return of(source.getBytes(StandardCharsets.UTF_8));
    }

    public static LineIndex of(byte[] source) {
        var starts = new ArrayList<Integer>();
        starts.add(0);
        for (int i = 0; i < source.length; i++) {
            if (source[i] == '\n') {
                starts.add(i + 1);
            }
        }
        return new LineIndex(source, starts.stream().mapToInt(Integer::intValue).toArray());
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Location of the given byte offset. Offsets past the end clamp to the end of input.
     */
    public SourceLocation locate(int offset) {
        var clamped = Math.max(0, Math.min(offset, source.length));
        var lineIdx = lineOf(clamped);
        var column = 1;
        for (int i = lineStarts[lineIdx]; i < clamped; i++) {
            // continuation bytes belong to the preceding code point
            if ((source[i] & 0xC0) != 0x80) {
                column++ ;
            }
        }
        return SourceLocation.at(lineIdx + 1, column, clamped);
    }

    /**
     * Text of the 1-based line, without the line terminator.
     */
    public String line(int lineNumber) {
        if (lineNumber < 1 || lineNumber > lineStarts.length) {
            throw new IndexOutOfBoundsException("No line " + lineNumber + " in " + lineStarts.length + " lines");
        }
        var start = lineStarts[lineNumber - 1];
        var end = lineNumber < lineStarts.length
                  ? lineStarts[lineNumber] - 1
                  : source.length;
        if (end > start && source[end - 1] == '\r') {
            end-- ;
        }
        return new String(source, start, end - start, StandardCharsets.UTF_8);
    }

    private int lineOf(int offset) {
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                low = mid;
            }else {
                high = mid - 1;
            }
        }
        return low;
    }
}
