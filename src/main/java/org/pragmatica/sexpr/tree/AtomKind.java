package org.pragmatica.sexpr.tree;

import java.util.List;

/**
 * What an atom is: an identifier, a string literal or a bracketed list.
 */
public sealed interface AtomKind {

    /**
     * Identifier - any run of characters other than whitespace and brackets.
     */
    record Ident(String text) implements AtomKind {
        public Ident {
            if (text.isEmpty()) {
                throw new IllegalArgumentException("Identifier must not be empty");
            }
        }
    }

    /**
     * String literal contents, without the surrounding quotes. Backslashes are kept as written.
     */
    record StringLiteral(String text) implements AtomKind {}

    /**
     * List of nested atoms together with the brackets that enclosed it.
     */
    record ListForm(List<Atom> elements, BracketKind bracket) implements AtomKind {
        public ListForm {
            elements = List.copyOf(elements);
        }
    }
}
