package org.pragmatica.sexpr.tree;

import java.util.Optional;

/**
 * Delimiter pair that enclosed a list. Carried for later stages; never changes the list shape.
 */
public enum BracketKind {
    ROUND('(', ')'),
    CURLY('{', '}'),
    SQUARE('[', ']');

    private final char open;
    private final char close;

    BracketKind(char open, char close) {
        this.open = open;
        this.close = close;
    }

    public char open() {
        return open;
    }

    public char close() {
        return close;
    }

    public static Optional<BracketKind> opening(int c) {
        for (var kind : values()) {
            if (kind.open == c) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public static boolean isClosing(int c) {
        return c == ')' || c == '}' || c == ']';
    }

    public static boolean isBracket(int c) {
        return opening(c).isPresent() || isClosing(c);
    }
}
