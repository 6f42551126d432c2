package org.pragmatica.markup.tree;

import java.util.function.Function;

/**
 * A span whose content depends on the document cursor, produced by directives requesting it.
 *
 * @param resolver produces the final node
 * @param source the original markup
 */
public record DeferredSpan(Function<DocumentCursor, Span> resolver, String source) implements Span, Resolvable<Span> {

    @Override
    public Span resolve(DocumentCursor cursor) {
        return resolver.apply(cursor);
    }
}
