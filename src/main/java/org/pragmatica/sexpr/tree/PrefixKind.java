package org.pragmatica.sexpr.tree;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Quoting marker that may precede an atom.
 */
public enum PrefixKind {
    QUOTE("'"),
    QUASI_QUOTE("`"),
    UNQUOTE(","),
    UNQUOTE_SPLICING(",@");

    /**
     * All markers, longest first. A marker must be tried before any shorter marker it starts with.
     */
    public static final List<PrefixKind> LONGEST_FIRST = Stream.of(values())
                                                               .sorted(Comparator.comparingInt((PrefixKind kind) -> kind.marker.length())
                                                                                 .reversed())
                                                               .toList();

    private final String marker;

    PrefixKind(String marker) {
        this.marker = marker;
    }

    public String marker() {
        return marker;
    }
}
