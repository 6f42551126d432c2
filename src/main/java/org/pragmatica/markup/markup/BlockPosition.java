package org.pragmatica.markup.markup;

/**
 * Where in the document a block parser may be applied.
 */
public enum BlockPosition {
    ANY,
    ROOT_ONLY,
    NESTED_ONLY
}
