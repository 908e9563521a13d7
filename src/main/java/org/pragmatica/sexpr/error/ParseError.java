package org.pragmatica.sexpr.error;

import org.pragmatica.sexpr.tree.Span;

import java.util.List;

/**
 * Parse error with the byte offset it occurred at.
 */
public sealed interface ParseError {
    int offset();

    String message();

    /**
     * Syntax error: no alternative matched a character of the input.
     */
    record UnexpectedInput(
    int offset,
    String found,
    List<String> expected) implements ParseError {
        public UnexpectedInput {
            expected = List.copyOf(expected);
        }

        @Override
        public String message() {
            return "Unexpected '" + found + "' at offset " + offset + ", expected " + describe(expected);
        }
    }

    /**
     * Syntax error: input ended while alternatives were still expected.
     */
    record UnexpectedEof(
    int offset,
    List<String> expected) implements ParseError {
        public UnexpectedEof {
            expected = List.copyOf(expected);
        }

        @Override
        public String message() {
            return "Unexpected end of input at offset " + offset + ", expected " + describe(expected);
        }
    }

    /**
     * An atom starting at offset covers more bytes than a span can hold.
     */
    record SpanOutOfRange(
    int offset,
    long length) implements ParseError {
        @Override
        public String message() {
            return "Atom at offset " + offset + " spans " + length + " bytes, more than the limit of "
                   + Span.MAX_LENGTH;
        }
    }

    /**
     * A list opened at offset exceeds the configured nesting limit.
     */
    record NestingTooDeep(
    int offset,
    int limit) implements ParseError {
        @Override
        public String message() {
            return "List at offset " + offset + " exceeds maximum nesting depth of " + limit;
        }
    }

    /**
     * Human-readable form of an expected-label list.
     */
    static String describe(List<String> expected) {
        return expected.size() == 1
               ? expected.get(0)
               : "one of: " + String.join(", ", expected);
    }
}
