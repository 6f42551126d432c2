package org.pragmatica.markup.directive;

import org.junit.jupiter.api.Test;
import org.pragmatica.markup.MarkupParser;
import org.pragmatica.markup.markup.BasicMarkup;
import org.pragmatica.markup.tree.DocumentCursor;
import org.pragmatica.markup.tree.Emphasized;
import org.pragmatica.markup.tree.InvalidSpan;
import org.pragmatica.markup.tree.Paragraph;
import org.pragmatica.markup.tree.RootElement;
import org.pragmatica.markup.tree.Span;
import org.pragmatica.markup.tree.SpanSequence;
import org.pragmatica.markup.tree.Text;
import org.pragmatica.markup.tree.TreeRewriter;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SpanDirectiveTest {
    private static final DirectiveDsl<Span> DSL = Spans.dsl();
    private static final DocumentCursor CURSOR = DocumentCursor.of("/", Map.of("ref", "value"));

    private static RootElement parse(Directive<Span> directive, String input) {
        var root = MarkupParser.of(BasicMarkup.INSTANCE)
                               .using(DirectiveSupport.extensions(List.of(), List.of(directive)))
                               .build()
                               .parse(input);
        return TreeRewriter.resolveReferences(CURSOR).rewrite(root);
    }

    private static RootElement paragraph(Span... spans) {
        return RootElement.of(Paragraph.of(spans));
    }

    // === Attributes ===

    @Test
    void directive_positionalAttribute_producesSpan() {
        var directive = Spans.create("dir", DSL.attribute(0).map(Text::new));

        assertEquals(paragraph(new Text("aa "), new Text("foo"), new Text(" bb")), parse(directive, "aa @:dir(foo) bb"));
    }

    @Test
    void directive_quotedPositionalAttributes_keepCommas() {
        var directive = Spans.create("dir", DSL.positionalAttributes().map(values -> new Text(String.join("|", values))));

        assertEquals(paragraph(new Text("aa "), new Text("a, b|c"), new Text(" bb")), parse(directive, "aa @:dir(\"a, b\", c) bb"));
    }

    @Test
    void directive_duplicateAttribute_becomesInvalidSpan() {
        var directive = Spans.create("dir", DSL.attribute("name").map(Text::new));

        var expected = new InvalidSpan("One or more errors processing directive 'dir': Duplicate attribute 'name'", "@:dir { name=a, name=b }");
        assertEquals(paragraph(new Text("aa "), expected, new Text(" bb")), parse(directive, "aa @:dir { name=a, name=b } bb"));
    }

    @Test
    void directive_missingClosingBrace_becomesInvalidSpan() {
        var directive = Spans.create("dir", DSL.attribute("name").map(Text::new));

        var expected = new InvalidSpan("One or more errors processing directive 'dir': Missing closing brace for attribute section", "@:dir { name=a bb");
        assertEquals(paragraph(new Text("aa "), expected), parse(directive, "aa @:dir { name=a bb"));
    }

    @Test
    void directive_missingPositionalAndDuplicateNamed_reportsPositionalFirst() {
        var directive = Spans.create("dir", Parts.all(DSL.attribute(0), DSL.attribute("name"), (first, name) -> new Text(first + name)));

        var expected = new InvalidSpan("One or more errors processing directive 'dir': required positional attribute at index 0 is missing, "
                                       + "Duplicate attribute 'name'",
                                       "@:dir { name=a, name=b }");
        assertEquals(paragraph(new Text("aa "), expected, new Text(" bb")), parse(directive, "aa @:dir { name=a, name=b } bb"));
    }

    @Test
    void directive_attributeAndBodyErrors_areReportedInDeclarationOrder() {
        var directive = Spans.create("dir", Parts.all(DSL.attribute(0),
                                                      DSL.attribute("name"),
                                                      DSL.parsedBody(),
                                                      (first, name, body) -> new SpanSequence(body)));

        var expected = new InvalidSpan("One or more errors processing directive 'dir': required positional attribute at index 0 is missing, "
                                       + "Duplicate attribute 'name', required body is missing",
                                       "@:dir { name=a, name=b }");
        assertEquals(paragraph(new Text("aa "), expected, new Text(" bb")), parse(directive, "aa @:dir { name=a, name=b } bb"));
    }

    // === Body ===

    @Test
    void directive_parsedBody_containsNestedMarkup() {
        var directive = Spans.create("dir", DSL.parsedBody().map(SpanSequence::new));

        var body = SpanSequence.of(new Text(" some "), Emphasized.of(new Text("em")), new Text(" "), new Text("value"), new Text(" text "));
        assertEquals(paragraph(new Text("aa "), body, new Text(" bb")), parse(directive, "aa @:dir some *em* ${ref} text @:@ bb"));
    }

    @Test
    void directive_nestedDirectiveInBody_isProcessed() {
        var directive = Spans.create("dir", DSL.parsedBody().map(SpanSequence::new));

        var inner = SpanSequence.of(new Text(" in"));
        var outer = SpanSequence.of(new Text(" a "), inner, new Text(" "));
        assertEquals(paragraph(outer), parse(directive, "@:dir a @:dir in@:@ @:@"));
    }

    @Test
    void directive_deeplyNestedBodies_areParsedOnce() {
        var directive = Spans.create("dir", DSL.parsedBody().map(SpanSequence::new));
        int depth = 25;
        var input = "@:dir ".repeat(depth) + "x" + " @:@".repeat(depth);

        var expected = SpanSequence.of(new Text(" x "));
        for (int i = 1; i < depth; i++) {
            expected = SpanSequence.of(new Text(" "), expected, new Text(" "));
        }
        var result = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> parse(directive, input));
        assertEquals(paragraph(expected), result);
    }

    @Test
    void separator_outsideParent_becomesOrphan() {
        var separator = Spans.separator("sep", DSL.parsedBody());
        var directive = Spans.create("dir", DSL.<List<Span>>separatedBody(List.of(separator))
                                               .map(multipart -> new SpanSequence(multipart.mainBody())));

        var expected = new InvalidSpan("Orphaned separator directive with name 'sep'", "@:sep");
        assertEquals(paragraph(new Text("aa "), expected, new Text(" bb")), parse(directive, "aa @:sep bb"));
    }

    @Test
    void unknownDirective_becomesInvalidSpan() {
        var directive = Spans.create("dir", DSL.empty(new Text("foo")));

        var expected = new InvalidSpan("One or more errors processing directive 'foo': No span directive registered with name: foo", "@:foo");
        assertEquals(paragraph(new Text("aa "), expected, new Text(" bb")), parse(directive, "aa @:foo bb"));
    }

    // === Context references ===

    @Test
    void contextReference_isResolvedFromCursor() {
        var directive = Spans.create("dir", DSL.empty(new Text("foo")));

        assertEquals(paragraph(new Text("aa "), new Text("value"), new Text(" bb")), parse(directive, "aa ${ref} bb"));
    }

    @Test
    void contextReference_unclosed_staysText() {
        var directive = Spans.create("dir", DSL.empty(new Text("foo")));

        assertEquals(paragraph(new Text("aa ${ref bb")), parse(directive, "aa ${ref bb"));
    }
}
