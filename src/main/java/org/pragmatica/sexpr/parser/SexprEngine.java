package org.pragmatica.sexpr.parser;

import org.pragmatica.sexpr.error.ParseError;
import org.pragmatica.sexpr.error.SpanRangeException;
import org.pragmatica.sexpr.tree.Atom;
import org.pragmatica.sexpr.tree.BracketKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.pragmatica.sexpr.parser.SexprLexer.IDENT;
import static org.pragmatica.sexpr.parser.SexprLexer.LIST;
import static org.pragmatica.sexpr.parser.SexprLexer.PREFIX;
import static org.pragmatica.sexpr.parser.SexprLexer.STRING;

/**
 * Recursive descent parser for s-expression programs.
 *
 * <pre>
 * s-expression := prefix? ws* (list-round / list-curly / list-square / string / ident)
 * list         := open ws* (s-expression ws*)* close ws*
 * program      := ws* (s-expression ws*)* end-of-input
 * </pre>
 *
 * The engine only holds its configuration; all parse state lives in a per-call {@link ParsingContext}.
 */
public final class SexprEngine implements Parser {
    private static final Logger LOG = LoggerFactory.getLogger(SexprEngine.class);

    static final List<String> ATOM_START = List.of(PREFIX, LIST, STRING, IDENT);
    static final List<String> AFTER_PREFIX = List.of(LIST, STRING, IDENT);
    static final List<String> PROGRAM_CONTINUATION = List.of(PREFIX, LIST, STRING, IDENT, "end of input");

    private static final Map<BracketKind, List<String>> LIST_CONTINUATION = listContinuations();

    private final ParserConfig config;

    private SexprEngine(ParserConfig config) {
        this.config = config;
    }

    public static SexprEngine create(ParserConfig config) {
        return new SexprEngine(config);
    }

    @Override
    public ParserConfig config() {
        return config;
    }

    @Override
    public ParseResult<List<Atom>> parse(String input) {
        try{
            var encoded = StandardCharsets.UTF_8.newEncoder()
                                                .onMalformedInput(CodingErrorAction.REPORT)
                                                .onUnmappableCharacter(CodingErrorAction.REPORT)
                                                .encode(CharBuffer.wrap(input));
            var bytes = new byte[encoded.remaining()];
            encoded.get(bytes);
            return parseUtf8(bytes);
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException("Input contains an unpaired surrogate", e);
        }
    }

    @Override
    public ParseResult<List<Atom>> parse(byte[] input) {
        try{
            StandardCharsets.UTF_8.newDecoder()
                                  .onMalformedInput(CodingErrorAction.REPORT)
                                  .onUnmappableCharacter(CodingErrorAction.REPORT)
                                  .decode(ByteBuffer.wrap(input));
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException("Input is not well-formed UTF-8", e);
        }
        return parseUtf8(input);
    }

    private ParseResult<List<Atom>> parseUtf8(byte[] input) {
        LOG.debug("Parsing {} bytes, max depth {}", input.length, config.maxDepth());
        var ctx = ParsingContext.create(input, config);
        var result = parseGuarded(ctx);
        result.error()
              .ifPresentOrElse(error -> LOG.debug("Parse failed: {}", error.message()),
                               () -> LOG.debug("Parsed {} top-level atoms",
                                               result.unwrap()
                                                     .size()));
        return result;
    }

    private ParseResult<List<Atom>> parseGuarded(ParsingContext ctx) {
        try{
            return parseProgram(ctx);
        } catch (SpanRangeException e) {
            return ParseResult.failure(new ParseError.SpanOutOfRange(e.start(), e.length()));
        }
    }

    private ParseResult<List<Atom>> parseProgram(ParsingContext ctx) {
        var atoms = new ArrayList<Atom>();
        SexprLexer.skipWhitespace(ctx);
        while (!ctx.isAtEnd()) {
            if (BracketKind.isClosing(ctx.peek())) {
                return ParseResult.failure(ctx.unexpected(PROGRAM_CONTINUATION));
            }
            var atom = parseSexpr(ctx);
            if (atom instanceof ParseResult.Failure<Atom> failure) {
                return failure.retype();
            }
            atoms.add(atom.unwrap());
            SexprLexer.skipWhitespace(ctx);
        }
        return ParseResult.success(List.copyOf(atoms));
    }

    private ParseResult<Atom> parseSexpr(ParsingContext ctx) {
        var start = ctx.pos();
        var prefix = SexprLexer.prefix(ctx);
        if (prefix.isEmpty()) {
            return parseBody(ctx, ATOM_START);
        }
        var prefixSpan = ctx.spanFrom(start);
        SexprLexer.skipWhitespace(ctx);
        return parseBody(ctx, AFTER_PREFIX).map(atom -> atom.withPrefix(prefix.get(), prefixSpan));
    }

    private ParseResult<Atom> parseBody(ParsingContext ctx, List<String> expected) {
        if (ctx.isAtEnd()) {
            return ParseResult.failure(ctx.unexpected(expected));
        }
        var c = ctx.peek();
        var bracket = BracketKind.opening(c);
        if (bracket.isPresent()) {
            return parseList(ctx, bracket.get());
        }
        if (c == '"') {
            return SexprLexer.string(ctx);
        }
        if (SexprLexer.isIdentByte(c)) {
            return SexprLexer.ident(ctx);
        }
        return ParseResult.failure(ctx.unexpected(expected));
    }

    private ParseResult<Atom> parseList(ParsingContext ctx, BracketKind bracket) {
        var start = ctx.pos();
        if (!ctx.enterList()) {
            return ParseResult.failure(new ParseError.NestingTooDeep(start, config.maxDepth()));
        }
        ctx.advance();
        var open = ctx.spanFrom(start);
        SexprLexer.skipWhitespace(ctx);

        var elements = new ArrayList<Atom>();
        while (ctx.isAtEnd() || ctx.peek() != bracket.close()) {
            if (ctx.isAtEnd() || BracketKind.isClosing(ctx.peek())) {
                return ParseResult.failure(ctx.unexpected(LIST_CONTINUATION.get(bracket)));
            }
            var element = parseSexpr(ctx);
            if (element instanceof ParseResult.Failure<Atom> failure) {
                return failure.retype();
            }
            elements.add(element.unwrap());
            SexprLexer.skipWhitespace(ctx);
        }

        // closing delimiter is padded: trailing whitespace belongs to the list
        var closeStart = ctx.pos();
        ctx.advance();
        SexprLexer.skipWhitespace(ctx);
        var close = ctx.spanFrom(closeStart);
        ctx.exitList();
        return ParseResult.success(Atom.list(elements, bracket, open.merge(close)));
    }

    private static Map<BracketKind, List<String>> listContinuations() {
        var map = new EnumMap<BracketKind, List<String>>(BracketKind.class);
        for (var bracket : BracketKind.values()) {
            map.put(bracket, List.of(PREFIX, LIST, STRING, IDENT, "'" + bracket.close() + "'"));
        }
        return map;
    }
}
