package org.pragmatica.sexpr.error;

import org.pragmatica.sexpr.tree.LineIndex;
import org.pragmatica.sexpr.tree.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * Rust-style rendering of a parse error against its source text.
 *
 * <p>Example output:
 * <pre>
 * error: unexpected input
 *   --> core.lisp:2:4
 *   |
 * 2 |   b]
 *   |    ^ found ']'
 *   |
 *   = help: expected one of: prefix, list, string, ident, ')'
 * </pre>
 *
 * @param message Primary error message
 * @param span    Source span where the error occurred
 * @param labels  Messages attached to spans, drawn under the source line
 * @param notes   Additional notes or suggestions
 */
public record Diagnostic(
    String message,
    Span span,
    List<Label> labels,
    List<String> notes
) {
    public Diagnostic {
        labels = List.copyOf(labels);
        notes = List.copyOf(notes);
    }

    /**
     * A message attached to a span.
     */
    public record Label(Span span, String message) {}

    public static Diagnostic error(String message, Span span) {
        return new Diagnostic(message, span, List.of(), List.of());
    }

    /**
     * Diagnostic describing a parse error.
     */
    public static Diagnostic of(ParseError error) {
        var at = Span.at(error.offset());
        if (error instanceof ParseError.UnexpectedInput input) {
            return error("unexpected input", at)
                .withLabel("found '" + input.found() + "'")
                .withHelp("expected " + ParseError.describe(input.expected()));
        }
        if (error instanceof ParseError.UnexpectedEof eof) {
            return error("unexpected end of input", at)
                .withLabel("input ends here")
                .withHelp("expected " + ParseError.describe(eof.expected()));
        }
        if (error instanceof ParseError.SpanOutOfRange range) {
            return error("atom too long", at)
                .withLabel("atom starts here")
                .withNote("atom is " + range.length() + " bytes, a single atom may span at most "
                          + Span.MAX_LENGTH + " bytes");
        }
        var nesting = (ParseError.NestingTooDeep) error;
        return error("lists nested too deeply", at)
            .withLabel("list opened here")
            .withNote("maximum nesting depth is " + nesting.limit());
    }

    public Diagnostic withLabel(String labelMessage) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(new Label(span, labelMessage));
        return new Diagnostic(message, span, newLabels, notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(message, span, labels, newNotes);
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic against the source text it was produced for.
     *
     * @param source   The source text
     * @param filename Optional filename for display, may be null
     */
    public String format(String source, String filename) {
        var index = LineIndex.of(source);
        var sb = new StringBuilder();
        var location = index.locate(span.start());

        sb.append("error: ")
          .append(message)
          .append("\n");

        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename)
              .append(":");
        }
        sb.append(location.line())
          .append(":")
          .append(location.column())
          .append("\n");

        int gutterWidth = String.valueOf(location.line())
                                .length();
        var gutter = " ".repeat(gutterWidth);

        sb.append(gutter)
          .append(" |\n");
        sb.append(location.line())
          .append(" | ")
          .append(index.line(location.line()))
          .append("\n");

        // labels on the primary line, in order of appearance
        for (var label : labels) {
            var start = index.locate(label.span()
                                          .start());
            var end = index.locate(label.span()
                                        .end());
            if (start.line() != location.line()) {
                continue;
            }
            int width = end.line() == start.line()
                        ? Math.max(1, end.column() - start.column())
                        : 1;
            sb.append(gutter)
              .append(" | ")
              .append(" ".repeat(start.column() - 1))
              .append("^".repeat(width));
            if (!label.message()
                      .isEmpty()) {
                sb.append(" ")
                  .append(label.message());
            }
            sb.append("\n");
        }

        sb.append(gutter)
          .append(" |\n");
        for (var note : notes) {
            sb.append(gutter)
              .append(" = ")
              .append(note)
              .append("\n");
        }
        return sb.toString();
    }

    /**
     * Single-line format, {@code filename:line:column: error: message}.
     */
    public String formatSimple(String source, String filename) {
        var location = LineIndex.of(source)
                                .locate(span.start());
        return String.format("%s:%d:%d: error: %s", filename, location.line(), location.column(), message);
    }
}
