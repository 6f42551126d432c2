package org.pragmatica.markup.directive;

import org.pragmatica.markup.markup.MarkupExtensions;
import org.pragmatica.markup.parser.ParserConfig;
import org.pragmatica.markup.tree.Block;
import org.pragmatica.markup.tree.InvalidBlock;
import org.pragmatica.markup.tree.InvalidSpan;
import org.pragmatica.markup.tree.Span;
import org.pragmatica.markup.tree.TemplateElement;
import org.pragmatica.markup.tree.TemplateSpan;
import org.pragmatica.markup.tree.TreeRewriter;

import java.util.List;

/**
 * Entry point for adding directives to markup documents and templates.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = MarkupParser.of(BasicMarkup.INSTANCE)
 *                          .using(DirectiveSupport.extensions(List.of(), List.of(upper)))
 *                          .build();
 * }</pre>
 */
public final class DirectiveSupport {
    private DirectiveSupport() {}

    private static final TreeRewriter ORPHANS = TreeRewriter.of(
        span -> span instanceof SeparatorInstance separator
                ? new InvalidSpan(orphanMessage(separator), separator.source())
                : span,
        block -> block instanceof SeparatorInstance separator
                 ? new InvalidBlock(orphanMessage(separator), separator.source())
                 : block,
        span -> span instanceof SeparatorInstance separator
                ? new TemplateElement(new InvalidSpan(orphanMessage(separator), separator.source()))
                : span);

    /**
     * Parsers for block and span directives and for context references in markup, with the
     * rewrite step replacing orphaned separators.
     */
    public static MarkupExtensions extensions(List<Directive<Block>> blockDirectives, List<Directive<Span>> spanDirectives) {
        var blocks = DirectiveRegistry.of(Blocks.FAMILY, blockDirectives);
        var spans = DirectiveRegistry.of(Spans.FAMILY, spanDirectives);
        return new MarkupExtensions(List.of(BlockDirectiveParsers.blockDirective(blocks)),
                                    List.of(SpanDirectiveParsers.spanDirective(spans), SpanDirectiveParsers.contextReference()),
                                    ORPHANS);
    }

    public static TemplateParser templateParser(List<Directive<TemplateSpan>> templateDirectives) {
        return templateParser(templateDirectives, ParserConfig.DEFAULT);
    }

    public static TemplateParser templateParser(List<Directive<TemplateSpan>> templateDirectives, ParserConfig config) {
        return new TemplateParser(DirectiveRegistry.of(Templates.FAMILY, templateDirectives), config);
    }

    /**
     * Replaces separator directives which did not end up in the body of their parent directive
     * with invalid nodes.
     */
    public static TreeRewriter orphanRewriter() {
        return ORPHANS;
    }

    private static String orphanMessage(SeparatorInstance separator) {
        return "Orphaned separator directive with name '" + separator.name() + "'";
    }
}
