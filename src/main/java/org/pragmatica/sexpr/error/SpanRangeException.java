package org.pragmatica.sexpr.error;

import org.pragmatica.sexpr.tree.Span;

/**
 * Thrown when a span would be longer than {@link Span#MAX_LENGTH} bytes.
 */
public final class SpanRangeException extends RuntimeException {
    private final int start;
    private final long length;

    public SpanRangeException(int start, long length) {
        super("Span starting at " + start + " is " + length + " bytes long, maximum is " + Span.MAX_LENGTH);
        this.start = start;
        this.length = length;
    }

    public int start() {
        return start;
    }

    public long length() {
        return length;
    }
}
