package org.pragmatica.markup.tree;

import java.util.List;

/**
 * The root of a parsed template.
 */
public record TemplateRoot(List<TemplateSpan> content) implements Block, TemplateSpanContainer<TemplateRoot> {

    public TemplateRoot {
        content = List.copyOf(content);
    }

    public static TemplateRoot of(TemplateSpan... spans) {
        return new TemplateRoot(List.of(spans));
    }

    @Override
    public TemplateRoot withContent(List<TemplateSpan> content) {
        return new TemplateRoot(content);
    }
}
