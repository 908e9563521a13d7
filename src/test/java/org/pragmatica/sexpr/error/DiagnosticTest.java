package org.pragmatica.sexpr.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.sexpr.SexprParser;
import org.pragmatica.sexpr.parser.ParserConfig;
import org.pragmatica.sexpr.tree.Span;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DiagnosticTest {

    private static Diagnostic diagnosticFor(String source) {
        return Diagnostic.of(SexprParser.parse(source)
                                        .error()
                                        .orElseThrow());
    }

    @Test
    void format_unexpectedInput() {
        var source = "(a\n  b]";

        var formatted = diagnosticFor(source).format(source, "core.lisp");

        assertThat(formatted).isEqualTo("""
            error: unexpected input
              --> core.lisp:2:4
              |
            2 |   b]
              |    ^ found ']'
              |
              = help: expected one of: prefix, list, string, ident, ')'
            """);
    }

    @Test
    void format_unexpectedEof() {
        var source = "(define x \"abc";

        var formatted = diagnosticFor(source).format(source, null);

        assertThat(formatted).startsWith("error: unexpected end of input\n  --> 1:15\n");
        assertThat(formatted).contains("1 | (define x \"abc\n");
        assertThat(formatted).contains("  |               ^ input ends here\n");
        assertThat(formatted).contains("= help: expected '\"'");
    }

    @Test
    void help_matchesExpectedTextOfError() {
        var error = SexprParser.parse("(a ]").error().orElseThrow();

        var help = Diagnostic.of(error).notes().get(0);

        assertThat(error.message()).endsWith(help.substring("help: ".length()));
        assertThat(ParseError.describe(List.of("ident"))).isEqualTo("ident");
    }

    @Test
    void format_columnsCountCharacters() {
        var source = "(λ ü ]";

        var formatted = diagnosticFor(source).format(source, "u.lisp");

        assertThat(formatted).contains("--> u.lisp:1:6\n");
        assertThat(formatted).contains("  |      ^ found ']'\n");
    }

    @Test
    void of_spanOutOfRange() {
        var diagnostic = Diagnostic.of(new ParseError.SpanOutOfRange(4, 70_000));

        assertThat(diagnostic.message()).isEqualTo("atom too long");
        assertThat(diagnostic.notes()).containsExactly("atom is 70000 bytes, a single atom may span at most 65535 bytes");
    }

    @Test
    void of_nestingTooDeep() {
        var source = "((((x))))";
        var error = SexprParser.parse(source, new ParserConfig(2))
                               .error()
                               .orElseThrow();

        var diagnostic = Diagnostic.of(error);

        assertThat(diagnostic.message()).isEqualTo("lists nested too deeply");
        assertThat(diagnostic.span().start()).isEqualTo(2);
        assertThat(diagnostic.notes()).containsExactly("maximum nesting depth is 2");
    }

    @Test
    void formatSimple_singleLine() {
        var source = "(a\n  b]";

        assertThat(diagnosticFor(source).formatSimple(source, "core.lisp"))
            .isEqualTo("core.lisp:2:4: error: unexpected input");
    }

    @Test
    void builders_doNotMutateOriginal() {
        var base = Diagnostic.error("boom", Span.at(0));
        var extended = base.withLabel("here")
                           .withHelp("try again");

        assertThat(base.labels()).isEmpty();
        assertThat(base.notes()).isEmpty();
        assertThat(extended.labels()).hasSize(1);
        assertThat(extended.notes()).containsExactly("help: try again");
    }
}
