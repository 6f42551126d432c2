package org.pragmatica.markup.tree;

import java.util.List;

public record Paragraph(List<Span> content) implements Block, SpanContainer<Paragraph> {

    public Paragraph {
        content = List.copyOf(content);
    }

    public static Paragraph of(Span... spans) {
        return new Paragraph(List.of(spans));
    }

    /**
     * A paragraph with a single text node.
     */
    public static Paragraph of(String text) {
        return new Paragraph(List.of(new Text(text)));
    }

    @Override
    public Paragraph withContent(List<Span> content) {
        return new Paragraph(content);
    }
}
