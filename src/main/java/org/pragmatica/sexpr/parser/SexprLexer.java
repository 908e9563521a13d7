package org.pragmatica.sexpr.parser;

import org.pragmatica.sexpr.error.ParseError;
import org.pragmatica.sexpr.tree.Atom;
import org.pragmatica.sexpr.tree.BracketKind;
import org.pragmatica.sexpr.tree.PrefixKind;

import java.util.List;
import java.util.Optional;

/**
 * Lexical rules of the s-expression grammar.
 *
 * <p>Each rule starts at the context's current position and either consumes its
 * lexeme or fails at the position where the lexeme could not be completed.
 */
public final class SexprLexer {
    public static final String PREFIX = "prefix";
    public static final String LIST = "list";
    public static final String STRING = "string";
    public static final String IDENT = "ident";

    private static final List<String> CLOSING_QUOTE = List.of("'\"'");

    private SexprLexer() {}

    /**
     * Prefix marker, if one starts here. Longer markers win over shorter ones they start with.
     */
    public static Optional<PrefixKind> prefix(ParsingContext ctx) {
        for (var kind : PrefixKind.LONGEST_FIRST) {
            if (ctx.startsWith(kind.marker())) {
                ctx.advance(kind.marker()
                                .length());
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Maximal run of identifier bytes, at least one.
     */
    public static ParseResult<Atom> ident(ParsingContext ctx) {
        var start = ctx.pos();
        while (!ctx.isAtEnd() && isIdentByte(ctx.peek())) {
            ctx.advance();
        }
        if (ctx.pos() == start) {
            return ParseResult.failure(ctx.unexpected(List.of(IDENT)));
        }
        return ParseResult.success(Atom.ident(ctx.substring(start, ctx.pos()), ctx.spanFrom(start)));
    }

    /**
     * Double-quoted string. Contents are taken verbatim, the span includes both quotes.
     */
    public static ParseResult<Atom> string(ParsingContext ctx) {
        var start = ctx.pos();
        if (ctx.isAtEnd() || ctx.peek() != '"') {
            return ParseResult.failure(ctx.unexpected(List.of(STRING)));
        }
        ctx.advance();
        while (!ctx.isAtEnd() && ctx.peek() != '"') {
            ctx.advance();
        }
        if (ctx.isAtEnd()) {
            return ParseResult.failure(new ParseError.UnexpectedEof(ctx.pos(), CLOSING_QUOTE));
        }
        var text = ctx.substring(start + 1, ctx.pos());
        ctx.advance();
        return ParseResult.success(Atom.string(text, ctx.spanFrom(start)));
    }

    public static void skipWhitespace(ParsingContext ctx) {
        while (!ctx.isAtEnd() && isWhitespace(ctx.peek())) {
            ctx.advance();
        }
    }

    public static boolean isWhitespace(int c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }

    public static boolean isIdentByte(int c) {
        return !isWhitespace(c) && !BracketKind.isBracket(c);
    }
}
