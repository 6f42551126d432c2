package org.pragmatica.markup.tree;

/**
 * Placeholder for inline markup which could not be processed.
 *
 * @param message description of all problems found
 * @param source the original markup
 */
public record InvalidSpan(String message, String source) implements Span {}
