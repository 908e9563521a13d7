package org.pragmatica.sexpr.tree;

import org.pragmatica.sexpr.error.SpanRangeException;

import java.nio.charset.StandardCharsets;

/**
 * A half-open range of UTF-8 byte offsets, from start (inclusive) to end (exclusive).
 *
 * <p>The length is stored in 16 bits, so a single span never covers more than
 * {@link #MAX_LENGTH} bytes. This is a limit of the format: constructing or merging
 * into a longer span throws {@link SpanRangeException} rather than truncating.
 */
public final class Span {
    public static final int MAX_LENGTH = 0xFFFF;

    private final int start;
    private final short length;

    private Span(int start, short length) {
        this.start = start;
        this.length = length;
    }

    public static Span of(int start, int end) {
        if (start < 0) {
            throw new IllegalArgumentException("Span start must not be negative: " + start);
        }
        if (end < start) {
            throw new IllegalArgumentException("Span end " + end + " precedes start " + start);
        }
        return new Span(start, checkedLength(start, (long) end - start));
    }

    public static Span at(int offset) {
        return of(offset, offset);
    }

    public int start() {
        return start;
    }

    public int end() {
        return start + length();
    }

    public int length() {
        return Short.toUnsignedInt(length);
    }

    public boolean isEmpty() {
        return length == 0;
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end();
    }

    /**
     * Smallest span covering both this and the other span.
     */
    public Span merge(Span other) {
        var newStart = Math.min(start, other.start);
        var newEnd = Math.max(end(), other.end());
        if (newStart == start && newEnd == end()) {
            return this;
        }
        return new Span(newStart, checkedLength(newStart, (long) newEnd - newStart));
    }

    public String extract(byte[] utf8) {
        return new String(utf8, start, length(), StandardCharsets.UTF_8);
    }

    public String extract(String source) {
        return extract(source.getBytes(StandardCharsets.UTF_8));
    }

    private static short checkedLength(int start, long length) {
        if (length > MAX_LENGTH) {
            throw new SpanRangeException(start, length);
        }
        return (short) length;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Span other && start == other.start && length == other.length;
    }

    @Override
    public int hashCode() {
        return 31 * start + length;
    }

    @Override
    public String toString() {
        return "[" + start + "," + end() + ")";
    }
}
