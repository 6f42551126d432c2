package org.pragmatica.markup.markup;

import org.pragmatica.markup.tree.Block;
import org.pragmatica.markup.tree.Span;
import org.pragmatica.markup.tree.TreeRewriter;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsers added to a host format, together with a rewrite step applied to each parsed document.
 */
public record MarkupExtensions(List<ParserBuilder<Block>> blockParsers,
                               List<ParserBuilder<Span>> spanParsers,
                               TreeRewriter rewriter) {
    public static final MarkupExtensions EMPTY = new MarkupExtensions(List.of(), List.of(), TreeRewriter.identity());

    public MarkupExtensions {
        blockParsers = List.copyOf(blockParsers);
        spanParsers = List.copyOf(spanParsers);
    }

    public static MarkupExtensions of(List<ParserBuilder<Block>> blockParsers, List<ParserBuilder<Span>> spanParsers) {
        return new MarkupExtensions(blockParsers, spanParsers, TreeRewriter.identity());
    }

    /**
     * Combine with the specified extensions, whose parsers are registered after the parsers of this instance.
     */
    public MarkupExtensions combine(MarkupExtensions other) {
        var blocks = new ArrayList<>(blockParsers);
        blocks.addAll(other.blockParsers);
        var spans = new ArrayList<>(spanParsers);
        spans.addAll(other.spanParsers);
        return new MarkupExtensions(blocks, spans, rewriter.andThen(other.rewriter));
    }
}
