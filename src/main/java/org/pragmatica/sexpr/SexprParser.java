package org.pragmatica.sexpr;

import org.pragmatica.sexpr.parser.ParseResult;
import org.pragmatica.sexpr.parser.Parser;
import org.pragmatica.sexpr.parser.ParserConfig;
import org.pragmatica.sexpr.parser.SexprEngine;
import org.pragmatica.sexpr.tree.Atom;

import java.util.List;

/**
 * Entry point for parsing s-expression source text.
 *
 * <p>Example usage:
 * <pre>{@code
 * var atoms = SexprParser.parse("(define x '(1 2 3))").unwrap();
 *
 * var parser = SexprParser.builder()
 *                         .maxDepth(64)
 *                         .build();
 * var result = parser.parse(source);
 * }</pre>
 */
public final class SexprParser {
    private static final Parser DEFAULT = SexprEngine.create(ParserConfig.DEFAULT);

    private SexprParser() {}

    /**
     * Parse source text with the default configuration.
     */
    public static ParseResult<List<Atom>> parse(String source) {
        return DEFAULT.parse(source);
    }

    /**
     * Parse source text with custom configuration.
     */
    public static ParseResult<List<Atom>> parse(String source, ParserConfig config) {
        return create(config).parse(source);
    }

    /**
     * Create a reusable parser. Parsers are immutable and may be shared between threads.
     */
    public static Parser create(ParserConfig config) {
        return SexprEngine.create(config);
    }

    /**
     * Create a builder for parser configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxDepth = ParserConfig.DEFAULT_MAX_DEPTH;

        private Builder() {}

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Parser build() {
            return create(new ParserConfig(maxDepth));
        }
    }
}
