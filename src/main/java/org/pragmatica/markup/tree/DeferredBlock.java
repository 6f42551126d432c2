package org.pragmatica.markup.tree;

import java.util.function.Function;

public record DeferredBlock(Function<DocumentCursor, Block> resolver, String source) implements Block, Resolvable<Block> {

    @Override
    public Block resolve(DocumentCursor cursor) {
        return resolver.apply(cursor);
    }
}
