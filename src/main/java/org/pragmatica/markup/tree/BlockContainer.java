package org.pragmatica.markup.tree;

import java.util.List;

/**
 * A node holding a list of blocks.
 */
public interface BlockContainer<Self extends BlockContainer<Self>> extends Element {

    List<Block> content();

    Self withContent(List<Block> content);
}
