package org.pragmatica.markup.tree;

import java.util.List;

public record Emphasized(List<Span> content) implements Span, SpanContainer<Emphasized> {

    public Emphasized {
        content = List.copyOf(content);
    }

    public static Emphasized of(Span... spans) {
        return new Emphasized(List.of(spans));
    }

    @Override
    public Emphasized withContent(List<Span> content) {
        return new Emphasized(content);
    }
}
