package org.pragmatica.sexpr.parser;

/**
 * Parser configuration options.
 *
 * @param maxDepth maximum list nesting depth; deeper input fails with
 *                 {@link org.pragmatica.sexpr.error.ParseError.NestingTooDeep}
 */
public record ParserConfig(
    int maxDepth
) {
    public static final int DEFAULT_MAX_DEPTH = 1024;

    /**
     * Largest accepted {@code maxDepth}. Lists are parsed recursively, so the limit bounds stack usage.
     */
    public static final int MAX_SUPPORTED_DEPTH = 2048;

    public static final ParserConfig DEFAULT = new ParserConfig(DEFAULT_MAX_DEPTH);

    public ParserConfig {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
        if (maxDepth > MAX_SUPPORTED_DEPTH) {
            throw new IllegalArgumentException("maxDepth must be at most " + MAX_SUPPORTED_DEPTH + ", got " + maxDepth);
        }
    }
}
