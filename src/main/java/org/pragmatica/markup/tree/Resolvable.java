package org.pragmatica.markup.tree;

/**
 * A node which can only be completed once the document cursor is available.
 */
public interface Resolvable<E extends Element> {

    E resolve(DocumentCursor cursor);
}
