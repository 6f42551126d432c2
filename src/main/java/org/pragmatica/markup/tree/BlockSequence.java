package org.pragmatica.markup.tree;

import java.util.List;

/**
 * A sequence of blocks without any semantics of its own.
 */
public record BlockSequence(List<Block> content) implements Block, BlockContainer<BlockSequence> {
    public static final BlockSequence EMPTY = new BlockSequence(List.of());

    public BlockSequence {
        content = List.copyOf(content);
    }

    public static BlockSequence of(Block... blocks) {
        return new BlockSequence(List.of(blocks));
    }

    public boolean isEmpty() {
        return content.isEmpty();
    }

    @Override
    public BlockSequence withContent(List<Block> content) {
        return new BlockSequence(content);
    }
}
