package org.pragmatica.sexpr.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.sexpr.SexprParser;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AtomPrinterTest {

    @Test
    void print_leaves() {
        assertThat(AtomPrinter.print(Atom.ident("foo", Span.of(0, 3)))).isEqualTo("foo");
        assertThat(AtomPrinter.print(Atom.string("a b", Span.of(0, 5)))).isEqualTo("\"a b\"");
    }

    @Test
    void print_nestedListsWithBrackets() {
        var inner = Atom.list(List.of(Atom.ident("x", Span.of(2, 3))), BracketKind.SQUARE, Span.of(1, 4));
        var outer = Atom.list(List.of(inner, Atom.string("s", Span.of(5, 8))), BracketKind.CURLY, Span.of(0, 9));

        assertThat(AtomPrinter.print(outer)).isEqualTo("{[x] \"s\"}");
    }

    @Test
    void print_prefixes() {
        var atom = Atom.ident("x", Span.of(2, 3))
                       .withPrefix(PrefixKind.UNQUOTE_SPLICING, Span.of(0, 2));

        assertThat(AtomPrinter.print(atom)).isEqualTo(",@x");
    }

    @Test
    void print_normalizesLayout() {
        var program = SexprParser.parse("  ( define   x\n\t'( 1 2 ) )   `{ a ,b }").unwrap();

        assertThat(AtomPrinter.print(program)).isEqualTo("(define x '(1 2))\n`{a ,b}");
    }
}
