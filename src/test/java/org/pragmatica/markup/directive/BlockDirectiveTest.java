package org.pragmatica.markup.directive;

import org.junit.jupiter.api.Test;
import org.pragmatica.markup.MarkupParser;
import org.pragmatica.markup.markup.BasicMarkup;
import org.pragmatica.markup.tree.Block;
import org.pragmatica.markup.tree.BlockSequence;
import org.pragmatica.markup.tree.DeferredBlock;
import org.pragmatica.markup.tree.DocumentCursor;
import org.pragmatica.markup.tree.InvalidBlock;
import org.pragmatica.markup.tree.Paragraph;
import org.pragmatica.markup.tree.RootElement;
import org.pragmatica.markup.tree.Text;
import org.pragmatica.markup.tree.TreeRewriter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class BlockDirectiveTest {
    private static final DirectiveDsl<Block> DSL = Blocks.dsl();
    private static final DocumentCursor CURSOR = DocumentCursor.of("/", Map.of("ref", "value"));

    private static Paragraph p(String text) {
        return Paragraph.of(text);
    }

    private static RootElement unresolved(Directive<Block> directive, String input) {
        return MarkupParser.of(BasicMarkup.INSTANCE)
                           .using(DirectiveSupport.extensions(List.of(directive), List.of()))
                           .build()
                           .parse(input);
    }

    private static RootElement parse(Directive<Block> directive, String input) {
        return TreeRewriter.resolveReferences(CURSOR).rewrite(unresolved(directive, input));
    }

    // === Declarations ===

    @Test
    void directive_withoutBody_replacesItsLine() {
        var directive = Blocks.create("dir", DSL.empty(p("foo")));

        assertEquals(RootElement.of(p("aa"), p("foo"), p("bb")), parse(directive, "aa\n\n@:dir\n\nbb"));
    }

    @Test
    void directive_withAttributes_isEvaluated() {
        var directive = Blocks.create("dir", Parts.all(DSL.attribute(0),
                                                       DSL.attribute("count").as(AttributeDecoder.POSITIVE_INT),
                                                       (name, count) -> p(name.repeat(count))));

        assertEquals(RootElement.of(p("abab")), parse(directive, "@:dir(ab) { count = 2 }"));
    }

    @Test
    void directive_invalidAttribute_becomesInvalidBlock() {
        var directive = Blocks.create("dir", DSL.attribute("count")
                                                .as(AttributeDecoder.POSITIVE_INT)
                                                .map(count -> p(String.valueOf(count))));

        var expected = new InvalidBlock("One or more errors processing directive 'dir': error converting attribute 'count': not a positive integer: 0",
                                        "@:dir { count = 0 }");
        assertEquals(RootElement.of(expected, p("bb")), parse(directive, "@:dir { count = 0 }\n\nbb"));
    }

    // === Body ===

    @Test
    void directive_parsedBody_isParsedAsBlocks() {
        var directive = Blocks.create("dir", DSL.parsedBody().map(BlockSequence::new));

        var expected = RootElement.of(p("aa"),
                                      BlockSequence.of(Paragraph.of(new Text("some\n"), new Text("value"), new Text("\ntext"))),
                                      p("bb"));
        assertEquals(expected, parse(directive, "aa\n\n@:dir\nsome\n${ref}\ntext\n@:@\n\nbb"));
    }

    @Test
    void directive_body_trimsLeadingAndTrailingBlankLines() {
        var directive = Blocks.create("dir", DSL.rawBody().map(body -> p(body)));

        assertEquals(RootElement.of(p("some\n\ntext")), parse(directive, "@:dir\n\nsome\n\ntext\n\n@:@"));
    }

    @Test
    void directive_customFence_endsBody() {
        var directive = Blocks.create("dir", DSL.parsedBody().map(BlockSequence::new));

        var expected = RootElement.of(BlockSequence.of(p("some\n@:@\ntext")), p("bb"));
        assertEquals(expected, parse(directive, "@:dir >>>\nsome\n@:@\ntext\n>>>\n\nbb"));
    }

    @Test
    void directive_missingBody_becomesInvalidBlock() {
        var directive = Blocks.create("dir", DSL.parsedBody().map(BlockSequence::new));

        var expected = new InvalidBlock("One or more errors processing directive 'dir': required body is missing", "@:dir");
        assertEquals(RootElement.of(expected, p("bb")), parse(directive, "@:dir\n\nbb"));
    }

    // === Separators ===

    private static Directive<Block> separatedDirective() {
        var foo = Blocks.separator("foo", DSL.parsedBody().map(BlockSequence::new))
                        .withMin(1);
        var bar = Blocks.separator("bar", Parts.all(DSL.parsedBody(), DSL.attribute(0),
                                                    (body, attr) -> {
                                                        var blocks = new ArrayList<Block>();
                                                        blocks.add(p(attr));
                                                        blocks.addAll(body);
                                                        return new BlockSequence(blocks);
                                                    }))
                        .withMax(1);
        return Blocks.create("dir", DSL.<BlockSequence>separatedBody(List.of(foo, bar))
                                       .map(multipart -> {
                                           var blocks = new ArrayList<>(multipart.mainBody());
                                           multipart.children()
                                                    .forEach(child -> blocks.addAll(child.content()));
                                           return new BlockSequence(blocks);
                                       }));
    }

    @Test
    void separatedBody_splitsBlocksAtSeparators() {
        var input = "@:dir\naaa\n\n@:foo\nbbb\n\n@:bar(baz)\nccc\n@:@";

        var expected = RootElement.of(BlockSequence.of(p("aaa"), p("bbb"), p("baz"), p("ccc")));
        assertEquals(expected, parse(separatedDirective(), input));
    }

    @Test
    void separatedBody_invalidSeparator_invalidatesParent() {
        var input = "@:dir\naaa\n\n@:foo\nbbb\n\n@:bar\nccc\n@:@";

        var expected = new InvalidBlock("One or more errors processing directive 'dir': One or more errors processing separator directive 'bar': "
                                        + "required positional attribute at index 0 is missing",
                                        input);
        assertEquals(RootElement.of(expected, p("bb")), parse(separatedDirective(), input + "\n\nbb"));
    }

    @Test
    void separator_atRootLevel_becomesOrphan() {
        var expected = new InvalidBlock("Orphaned separator directive with name 'foo'", "@:foo");

        assertEquals(RootElement.of(p("aa"), expected, p("bb")), parse(separatedDirective(), "aa\n\n@:foo\n\nbb"));
    }

    // === Cursor and unknown directives ===

    @Test
    void directive_requiringCursor_isResolvedInRewriteStep() {
        var directive = Blocks.create("dir", Parts.all(DSL.rawBody(), DSL.cursor(), (body, cursor) -> p(body + cursor.path())));

        var parsed = unresolved(directive, "@:dir\ntext\n@:@");
        assertThat(parsed.content()).singleElement().isInstanceOf(DeferredBlock.class);
        assertEquals(RootElement.of(p("text/")), TreeRewriter.resolveReferences(CURSOR).rewrite(parsed));
    }

    @Test
    void unknownDirective_becomesInvalidBlock() {
        var directive = Blocks.create("dir", DSL.empty(p("foo")));

        var expected = new InvalidBlock("One or more errors processing directive 'foo': No block directive registered with name: foo", "@:foo");
        assertEquals(RootElement.of(p("aa"), expected), parse(directive, "aa\n\n@:foo"));
    }

    @Test
    void directiveFollowedByText_isParsedAsParagraph() {
        var directive = Blocks.create("dir", DSL.empty(p("foo")));

        var root = parse(directive, "@:dir and more");
        assertThat(root.content()).singleElement().isInstanceOf(Paragraph.class);
    }
}
