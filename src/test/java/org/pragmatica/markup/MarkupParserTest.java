package org.pragmatica.markup;

import org.junit.jupiter.api.Test;
import org.pragmatica.markup.markup.BasicMarkup;
import org.pragmatica.markup.markup.MarkupExtensions;
import org.pragmatica.markup.markup.ParserBuilder;
import org.pragmatica.markup.parser.ParseResult;
import org.pragmatica.markup.parser.ParserConfig;
import org.pragmatica.markup.parser.SourceCursor;
import org.pragmatica.markup.text.PrefixedParser;
import org.pragmatica.markup.text.TextParsers;
import org.pragmatica.markup.tree.Block;
import org.pragmatica.markup.tree.BlockSequence;
import org.pragmatica.markup.tree.Emphasized;
import org.pragmatica.markup.tree.Paragraph;
import org.pragmatica.markup.tree.RootElement;
import org.pragmatica.markup.tree.Span;
import org.pragmatica.markup.tree.Text;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarkupParserTest {
    private static final MarkupParser BASIC = MarkupParser.of(BasicMarkup.INSTANCE).build();

    // === Blocks ===

    @Test
    void parse_paragraphs_areSeparatedByBlankLines() {
        var root = BASIC.parse("first line\nsecond\n\n\nnext");

        assertEquals(RootElement.of(Paragraph.of("first line\nsecond"), Paragraph.of("next")), root);
    }

    @Test
    void parse_emptyOrBlankInput_producesEmptyRoot() {
        assertEquals(RootElement.of(), BASIC.parse(""));
        assertEquals(RootElement.of(), BASIC.parse("  \n\n\t\n"));
    }

    @Test
    void parse_carriageReturns_areLineBreaks() {
        assertEquals(RootElement.of(Paragraph.of("a\nb"), Paragraph.of("c")), BASIC.parse("a\r\nb\r\rc"));
    }

    // === Spans ===

    @Test
    void parse_emphasis_isNested() {
        var root = BASIC.parse("next *em* x");

        assertEquals(RootElement.of(Paragraph.of(new Text("next "), Emphasized.of(new Text("em")), new Text(" x"))), root);
    }

    @Test
    void parse_unclosedEmphasis_staysText() {
        assertEquals(RootElement.of(Paragraph.of("a *b")), BASIC.parse("a *b"));
    }

    @Test
    void parse_escapedChar_becomesSeparateText() {
        var root = BASIC.parse("a\\*b*");

        assertEquals(RootElement.of(Paragraph.of(new Text("a"), new Text("*"), new Text("b*"))), root);
    }

    @Test
    void parse_beyondMaxNestLevel_keepsMarkupAsText() {
        var parser = MarkupParser.of(BasicMarkup.INSTANCE)
                                 .withConfig(ParserConfig.DEFAULT.withMaxNestLevel(1))
                                 .build();

        assertEquals(RootElement.of(Paragraph.of("*a*")), parser.parse("*a*"));
    }

    // === Extensions ===

    private static ParserBuilder<Span> star() {
        return ParserBuilder.prefixed(PrefixedParser.of('*', TextParsers.literal("*")
                                                                        .as(new Text("star"))));
    }

    @Test
    void using_highPrecedenceSpanParser_overridesHostParser() {
        var parser = MarkupParser.of(BasicMarkup.INSTANCE)
                                 .using(MarkupExtensions.of(List.of(), List.of(star())))
                                 .build();

        var expected = Paragraph.of(new Text("a"), new Text("star"), new Text("b"), new Text("star"));
        assertEquals(RootElement.of(expected), parser.parse("a*b*"));
    }

    @Test
    void using_lowPrecedenceSpanParser_isTriedAfterHostParser() {
        var parser = MarkupParser.of(BasicMarkup.INSTANCE)
                                 .using(MarkupExtensions.of(List.of(), List.of(star().withLowPrecedence())))
                                 .build();

        assertEquals(RootElement.of(Paragraph.of(new Text("a"), Emphasized.of(new Text("b")))), parser.parse("a*b*"));
        assertEquals(RootElement.of(Paragraph.of(new Text("a"), new Text("star"), new Text("b"))), parser.parse("a*b"));
    }

    private static ParserBuilder<Block> quote() {
        return ParserBuilder.prefixedRecursive(recursive -> {
            var lines = TextParsers.literal("> ")
                                   .keepRight(TextParsers.restOfLine())
                                   .repeat()
                                   .min(1)
                                   .map(content -> String.join("\n", content));
            return PrefixedParser.of('>', recursive.recursiveBlocks(lines)
                                                   .<Block>map(BlockSequence::new));
        });
    }

    @Test
    void using_recursiveBlockParser_parsesNestedBlocks() {
        var parser = MarkupParser.of(BasicMarkup.INSTANCE)
                                 .using(MarkupExtensions.of(List.of(quote()), List.of()))
                                 .build();

        var expected = BlockSequence.of(BlockSequence.of(Paragraph.of(new Text("x"))));
        assertEquals(RootElement.of(expected), parser.parse("> > x"));
    }

    @Test
    void using_rootOnlyBlockParser_isNotAppliedToNestedBlocks() {
        var parser = MarkupParser.of(BasicMarkup.INSTANCE)
                                 .using(MarkupExtensions.of(List.of(quote().rootOnly()), List.of()))
                                 .build();

        assertEquals(RootElement.of(BlockSequence.of(Paragraph.of("> x"))), parser.parse("> > x"));
    }

    private static ParserBuilder<Block> bang() {
        var parser = TextParsers.literal("!")
                                .keepRight(TextParsers.restOfLine())
                                .<Block>map(rest -> Paragraph.of(new Text("bang" + rest)));
        return ParserBuilder.prefixed(PrefixedParser.of('!', parser));
    }

    @Test
    void using_nestedOnlyBlockParser_isOnlyAppliedToNestedBlocks() {
        var parser = MarkupParser.of(BasicMarkup.INSTANCE)
                                 .using(MarkupExtensions.of(List.of(quote(), bang().nestedOnly()), List.of()))
                                 .build();

        assertEquals(RootElement.of(Paragraph.of("! a")), parser.parse("! a"));
        assertEquals(RootElement.of(BlockSequence.of(Paragraph.of(new Text("bang a")))), parser.parse("> ! a"));
    }

    // === Errors ===

    @Test
    void exception_carriesLocationOfFailure() {
        var failure = ParseResult.Failure.<RootElement>at(SourceCursor.of("ab\ncd").consume(4), "broken");

        var exception = new MarkupParserException(failure);

        assertEquals(2, exception.location().line());
        assertEquals(2, exception.location().column());
        assertTrue(exception.getMessage().contains("broken"));
    }
}
