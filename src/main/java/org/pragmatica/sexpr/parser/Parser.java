package org.pragmatica.sexpr.parser;

import org.pragmatica.sexpr.tree.Atom;

import java.util.List;

/**
 * Parser interface - turns one source unit into its top-level atoms.
 *
 * <p>Implementations are stateless between calls: the same input always yields an
 * equal result, and concurrent calls on different inputs need no synchronization.
 */
public interface Parser {

    /**
     * Parse source text. Spans are UTF-8 byte offsets into the encoded text.
     *
     * @throws IllegalArgumentException if the text contains an unpaired surrogate
     */
    ParseResult<List<Atom>> parse(String input);

    /**
     * Parse UTF-8 encoded source.
     *
     * @throws IllegalArgumentException if the input is not well-formed UTF-8
     */
    ParseResult<List<Atom>> parse(byte[] input);

    ParserConfig config();
}
