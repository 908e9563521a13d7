package org.pragmatica.sexpr.parser;

import org.pragmatica.sexpr.error.ParseError;
import org.pragmatica.sexpr.tree.Span;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Mutable parsing context that tracks state during a single parse call.
 * Positions are byte offsets into the UTF-8 input.
 */
public final class ParsingContext {

    private final byte[] input;
    private final ParserConfig config;

    private int pos;
    private int depth;

    private ParsingContext(byte[] input, ParserConfig config) {
        this.input = input;
        this.config = config;
        this.pos = 0;
        this.depth = 0;
    }

    public static ParsingContext create(byte[] input, ParserConfig config) {
        return new ParsingContext(input, config);
    }

    public static ParsingContext create(String input) {
        return create(input.getBytes(StandardCharsets.UTF_8), ParserConfig.DEFAULT);
    }

    // === Position Management ===

    public int pos() {
        return pos;
    }

    public boolean isAtEnd() {
        return pos >= input.length;
    }

    public int length() {
        return input.length;
    }

    // === Byte Access ===

    /**
     * Current byte as an unsigned value.
     */
    public int peek() {
        return input[pos] & 0xFF;
    }

    public boolean startsWith(String marker) {
        if (pos + marker.length() > input.length) {
            return false;
        }
        for (int i = 0; i < marker.length(); i++) {
            if (input[pos + i] != marker.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    public void advance() {
        pos++ ;
    }

    public void advance(int count) {
        pos += count;
    }

    public String substring(int start, int end) {
        return new String(input, start, end - start, StandardCharsets.UTF_8);
    }

    // === Nesting ===

    /**
     * Enter a list. Returns false, leaving the depth unchanged, when the configured limit is reached.
     */
    public boolean enterList() {
        if (depth >= config.maxDepth()) {
            return false;
        }
        depth++ ;
        return true;
    }

    public void exitList() {
        depth-- ;
    }

    public int depth() {
        return depth;
    }

    // === Errors ===

    /**
     * Syntax error at the current position.
     */
    public ParseError unexpected(List<String> expected) {
        return isAtEnd()
               ? new ParseError.UnexpectedEof(pos, expected)
               : new ParseError.UnexpectedInput(pos, currentCharacter(), expected);
    }

    private String currentCharacter() {
        int lead = peek();
        int width = lead < 0x80
                    ? 1
                    : lead >= 0xF0
                      ? 4
                      : lead >= 0xE0
                        ? 3
                        : 2;
        return substring(pos, Math.min(pos + width, input.length));
    }

    // === Accessors ===

    public ParserConfig config() {
        return config;
    }

    // === Span Creation ===

    /**
     * Span from start to the current position.
     *
     * @throws org.pragmatica.sexpr.error.SpanRangeException if the span is too long
     */
    public Span spanFrom(int start) {
        return Span.of(start, pos);
    }
}
