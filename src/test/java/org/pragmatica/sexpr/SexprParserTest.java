package org.pragmatica.sexpr;

import org.junit.jupiter.api.Test;
import org.pragmatica.sexpr.error.ParseError;
import org.pragmatica.sexpr.parser.ParserConfig;
import org.pragmatica.sexpr.tree.AtomPrinter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SexprParserTest {

    @Test
    void parse_usesDefaultConfig() {
        var result = SexprParser.parse("(define x 1)");

        assertTrue(result.isSuccess());
        assertEquals(1, result.unwrap().size());
    }

    @Test
    void parse_withConfig_appliesDepthLimit() {
        var result = SexprParser.parse("((x))", new ParserConfig(1));

        assertTrue(result.isFailure());
        var error = result.error().orElseThrow();
        assertInstanceOf(ParseError.NestingTooDeep.class, error);
        assertEquals(1, error.offset());
    }

    @Test
    void builder_defaultsToDefaultConfig() {
        var parser = SexprParser.builder().build();

        assertEquals(ParserConfig.DEFAULT, parser.config());
    }

    @Test
    void builder_setsMaxDepth() {
        var parser = SexprParser.builder()
                                .maxDepth(3)
                                .build();

        assertEquals(3, parser.config().maxDepth());
        assertTrue(parser.parse("(((x)))").isSuccess());
        assertTrue(parser.parse("((((x))))").isFailure());
    }

    @Test
    void builder_rejectsNonPositiveDepth() {
        var builder = SexprParser.builder().maxDepth(0);

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void builder_rejectsDepthAboveSupportedCeiling() {
        var builder = SexprParser.builder().maxDepth(1_000_000);

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void create_returnsReusableParser() {
        var parser = SexprParser.create(ParserConfig.DEFAULT);

        var first = parser.parse("(a b)").unwrap();
        var second = parser.parse("(a b)").unwrap();

        assertEquals(first, second);
    }

    @Test
    void sharedParser_isSafeAcrossThreads() throws Exception {
        var sources = List.of("(define (square x) (* x x))",
                              "'(1 2 3) `(a ,b ,@c)",
                              "{:key \"value\" :other [1 2 3]}",
                              "(let [x 1\n      y 2]\n  (+ x y))",
                              "(unterminated \"string)");
        var expected = new ArrayList<String>();
        for (var source : sources) {
            expected.add(SexprParser.parse(source).fold(ParseError::message, AtomPrinter::print));
        }

        var parser = SexprParser.create(ParserConfig.DEFAULT);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            var futures = new ArrayList<Future<String>>();
            for (int i = 0; i < 400; i++) {
                var source = sources.get(i % sources.size());
                futures.add(executor.submit(() -> parser.parse(source).fold(ParseError::message, AtomPrinter::print)));
            }
            for (int i = 0; i < futures.size(); i++) {
                assertEquals(expected.get(i % sources.size()), futures.get(i).get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
