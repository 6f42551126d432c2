package org.pragmatica.markup.tree;

/**
 * Placeholder for block markup which could not be processed.
 *
 * @param message description of all problems found
 * @param source the original markup
 */
public record InvalidBlock(String message, String source) implements Block {}
