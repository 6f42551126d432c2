package org.pragmatica.markup.tree;

import java.util.function.Function;

public record DeferredTemplateSpan(Function<DocumentCursor, TemplateSpan> resolver, String source)
    implements TemplateSpan, Resolvable<TemplateSpan> {

    @Override
    public TemplateSpan resolve(DocumentCursor cursor) {
        return resolver.apply(cursor);
    }
}
