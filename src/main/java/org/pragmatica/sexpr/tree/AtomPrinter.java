package org.pragmatica.sexpr.tree;

import java.util.List;

/**
 * Renders atoms back to source text in canonical layout: single spaces between
 * elements, no padding inside brackets. Parsing the output yields the same kinds.
 */
public final class AtomPrinter {
    private static final int DEFAULT_CAPACITY = 64;

    private AtomPrinter() {}

    public static String print(Atom atom) {
        var sb = new StringBuilder(DEFAULT_CAPACITY);
        append(sb, atom);
        return sb.toString();
    }

    public static String print(List<Atom> program) {
        var sb = new StringBuilder(DEFAULT_CAPACITY);
        appendAll(sb, program, "\n");
        return sb.toString();
    }

    private static void append(StringBuilder sb, Atom atom) {
        atom.prefix()
            .ifPresent(prefix -> sb.append(prefix.marker()));
        var kind = atom.kind();
        if (kind instanceof AtomKind.Ident ident) {
            sb.append(ident.text());
        }else if (kind instanceof AtomKind.StringLiteral string) {
            sb.append('"')
              .append(string.text())
              .append('"');
        }else if (kind instanceof AtomKind.ListForm list) {
            sb.append(list.bracket()
                          .open());
            appendAll(sb, list.elements(), " ");
            sb.append(list.bracket()
                          .close());
        }
    }

    private static void appendAll(StringBuilder sb, List<Atom> atoms, String separator) {
        for (int i = 0; i < atoms.size(); i++) {
            if (i > 0) {
                sb.append(separator);
            }
            append(sb, atoms.get(i));
        }
    }
}
