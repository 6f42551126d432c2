package org.pragmatica.markup.tree;

import java.util.List;

/**
 * The root of a parsed markup document.
 */
public record RootElement(List<Block> content) implements BlockContainer<RootElement> {

    public RootElement {
        content = List.copyOf(content);
    }

    public static RootElement of(Block... blocks) {
        return new RootElement(List.of(blocks));
    }

    @Override
    public RootElement withContent(List<Block> content) {
        return new RootElement(content);
    }
}
