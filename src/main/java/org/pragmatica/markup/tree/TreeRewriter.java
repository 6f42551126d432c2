package org.pragmatica.markup.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Top-down rewriting of a document tree.
 *
 * <p>A rewriter holds one rule per node category. Each node is first passed to the rule of its
 * category, then the children of the result are rewritten. Empty sequences produced by a rule
 * are removed from their container, and the text around them is merged. Only containers implementing {@link SpanContainer},
 * {@link BlockContainer} or {@link TemplateSpanContainer} are descended into.
 */
public final class TreeRewriter {
    private static final TreeRewriter IDENTITY = new TreeRewriter(Function.identity(), Function.identity(), Function.identity());

    private final Function<Span, Span> spanRule;
    private final Function<Block, Block> blockRule;
    private final Function<TemplateSpan, TemplateSpan> templateRule;

    private TreeRewriter(Function<Span, Span> spanRule,
                         Function<Block, Block> blockRule,
                         Function<TemplateSpan, TemplateSpan> templateRule) {
        this.spanRule = spanRule;
        this.blockRule = blockRule;
        this.templateRule = templateRule;
    }

    public static TreeRewriter identity() {
        return IDENTITY;
    }

    public static TreeRewriter of(Function<Span, Span> spanRule,
                                  Function<Block, Block> blockRule,
                                  Function<TemplateSpan, TemplateSpan> templateRule) {
        return new TreeRewriter(spanRule, blockRule, templateRule);
    }

    public static TreeRewriter forSpans(Function<Span, Span> spanRule) {
        return new TreeRewriter(spanRule, Function.identity(), Function.identity());
    }

    public static TreeRewriter forBlocks(Function<Block, Block> blockRule) {
        return new TreeRewriter(Function.identity(), blockRule, Function.identity());
    }

    public static TreeRewriter forTemplateSpans(Function<TemplateSpan, TemplateSpan> templateRule) {
        return new TreeRewriter(Function.identity(), Function.identity(), templateRule);
    }

    /**
     * Resolves context references and nodes deferred by directives with the specified cursor.
     * Missing required references become invalid nodes, missing optional ones are removed.
     */
    public static TreeRewriter resolveReferences(DocumentCursor cursor) {
        return new TreeRewriter(span -> span instanceof Resolvable<?> resolvable
                                        ? (Span) resolvable.resolve(cursor)
                                        : span,
                                block -> block instanceof Resolvable<?> resolvable
                                         ? (Block) resolvable.resolve(cursor)
                                         : block,
                                span -> span instanceof Resolvable<?> resolvable
                                        ? asTemplateSpan(resolvable.resolve(cursor))
                                        : span);
    }

    /**
     * A rewriter applying the rules of this rewriter first and those of the specified one second.
     */
    public TreeRewriter andThen(TreeRewriter next) {
        return new TreeRewriter(spanRule.andThen(next.spanRule),
                                blockRule.andThen(next.blockRule),
                                templateRule.andThen(next.templateRule));
    }

    // === Rewriting ===

    public RootElement rewrite(RootElement root) {
        return root.withContent(rewriteBlocks(root.content()));
    }

    public TemplateRoot rewrite(TemplateRoot root) {
        return root.withContent(rewriteTemplateSpans(root.content()));
    }

    public Block rewriteBlock(Block block) {
        var result = blockRule.apply(block);
        if (result instanceof BlockContainer<?> container) {
            return (Block) container.withContent(rewriteBlocks(container.content()));
        }
        if (result instanceof SpanContainer<?> container) {
            return (Block) container.withContent(rewriteSpans(container.content()));
        }
        if (result instanceof TemplateSpanContainer<?> container) {
            return (Block) container.withContent(rewriteTemplateSpans(container.content()));
        }
        return result;
    }

    public Span rewriteSpan(Span span) {
        var result = spanRule.apply(span);
        if (result instanceof SpanContainer<?> container) {
            return (Span) container.withContent(rewriteSpans(container.content()));
        }
        return result;
    }

    public TemplateSpan rewriteTemplateSpan(TemplateSpan span) {
        var result = templateRule.apply(span);
        if (result instanceof TemplateSpanContainer<?> container) {
            return (TemplateSpan) container.withContent(rewriteTemplateSpans(container.content()));
        }
        if (result instanceof TemplateElement element) {
            return new TemplateElement(rewriteSpan(element.element()));
        }
        return result;
    }

    public List<Block> rewriteBlocks(List<Block> blocks) {
        return rewriteAll(blocks,
                          this::rewriteBlock,
                          block -> block instanceof BlockSequence sequence && sequence.isEmpty(),
                          (left, right) -> Optional.empty());
    }

    /**
     * Rewrites the spans. Text on both sides of a removed span is merged into one node.
     */
    public List<Span> rewriteSpans(List<Span> spans) {
        return rewriteAll(spans, this::rewriteSpan, TreeRewriter::isEmptySequence, TreeRewriter::mergeText);
    }

    /**
     * Rewrites the template spans. Strings on both sides of a removed span are merged into one node.
     */
    public List<TemplateSpan> rewriteTemplateSpans(List<TemplateSpan> spans) {
        return rewriteAll(spans, this::rewriteTemplateSpan, TreeRewriter::isEmptySequence, TreeRewriter::mergeStrings);
    }

    private static <T> List<T> rewriteAll(List<T> nodes,
                                          Function<T, T> rewrite,
                                          Predicate<T> removed,
                                          BiFunction<T, T, Optional<T>> merge) {
        var result = new ArrayList<T>(nodes.size());
        boolean afterRemoval = false;
        for (var node : nodes) {
            var rewritten = rewrite.apply(node);
            if (removed.test(rewritten)) {
                afterRemoval = true;
                continue;
            }
            var merged = afterRemoval && !result.isEmpty()
                         ? merge.apply(result.get(result.size() - 1), rewritten)
                         : Optional.<T>empty();
            if (merged.isPresent()) {
                result.set(result.size() - 1, merged.get());
            } else {
                result.add(rewritten);
            }
            afterRemoval = false;
        }
        return result;
    }

    private static Optional<Span> mergeText(Span left, Span right) {
        if (left instanceof Text first && right instanceof Text second) {
            return Optional.of(new Text(first.content() + second.content()));
        }
        return Optional.empty();
    }

    private static Optional<TemplateSpan> mergeStrings(TemplateSpan left, TemplateSpan right) {
        if (left instanceof TemplateString first && right instanceof TemplateString second) {
            return Optional.of(new TemplateString(first.content() + second.content()));
        }
        return Optional.empty();
    }

    private static boolean isEmptySequence(Span span) {
        return span instanceof SpanSequence sequence && sequence.isEmpty()
               || span instanceof TemplateSpanSequence templateSequence && templateSequence.isEmpty();
    }

    private static TemplateSpan asTemplateSpan(Element element) {
        if (element instanceof TemplateSpan templateSpan) {
            return templateSpan;
        }
        return new TemplateElement((Span) element);
    }
}
