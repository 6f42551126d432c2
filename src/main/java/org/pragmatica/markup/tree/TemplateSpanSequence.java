package org.pragmatica.markup.tree;

import java.util.List;

public record TemplateSpanSequence(List<TemplateSpan> content) implements TemplateSpan, TemplateSpanContainer<TemplateSpanSequence> {
    public static final TemplateSpanSequence EMPTY = new TemplateSpanSequence(List.of());

    public TemplateSpanSequence {
        content = List.copyOf(content);
    }

    public static TemplateSpanSequence of(TemplateSpan... spans) {
        return new TemplateSpanSequence(List.of(spans));
    }

    public boolean isEmpty() {
        return content.isEmpty();
    }

    @Override
    public TemplateSpanSequence withContent(List<TemplateSpan> content) {
        return new TemplateSpanSequence(content);
    }
}
