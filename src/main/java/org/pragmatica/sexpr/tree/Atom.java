package org.pragmatica.sexpr.tree;

import java.util.List;
import java.util.Optional;

/**
 * One parsed s-expression: optional prefix marker, kind and the source span it covers.
 *
 * <p>The span starts at the prefix marker when one is present.
 */
public record Atom(Optional<PrefixKind> prefix, AtomKind kind, Span span) {

    public static Atom ident(String text, Span span) {
        return new Atom(Optional.empty(), new AtomKind.Ident(text), span);
    }

    public static Atom string(String text, Span span) {
        return new Atom(Optional.empty(), new AtomKind.StringLiteral(text), span);
    }

    public static Atom list(List<Atom> elements, BracketKind bracket, Span span) {
        return new Atom(Optional.empty(), new AtomKind.ListForm(elements, bracket), span);
    }

    /**
     * This atom preceded by a prefix marker located at the given span.
     */
    public Atom withPrefix(PrefixKind prefixKind, Span prefixSpan) {
        return new Atom(Optional.of(prefixKind), kind, prefixSpan.merge(span));
    }

    public boolean isIdent() {
        return kind instanceof AtomKind.Ident;
    }

    public boolean isString() {
        return kind instanceof AtomKind.StringLiteral;
    }

    public boolean isList() {
        return kind instanceof AtomKind.ListForm;
    }

    /**
     * Nested atoms of a list, empty for identifiers and strings.
     */
    public List<Atom> children() {
        return kind instanceof AtomKind.ListForm list
               ? list.elements()
               : List.of();
    }
}
