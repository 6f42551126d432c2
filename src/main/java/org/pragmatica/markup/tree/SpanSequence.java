package org.pragmatica.markup.tree;

import java.util.List;

/**
 * A sequence of spans without any semantics of its own. Empty sequences are dropped
 * from their container.
 */
public record SpanSequence(List<Span> content) implements Span, SpanContainer<SpanSequence> {
    public static final SpanSequence EMPTY = new SpanSequence(List.of());

    public SpanSequence {
        content = List.copyOf(content);
    }

    public static SpanSequence of(Span... spans) {
        return new SpanSequence(List.of(spans));
    }

    public boolean isEmpty() {
        return content.isEmpty();
    }

    @Override
    public SpanSequence withContent(List<Span> content) {
        return new SpanSequence(content);
    }
}
