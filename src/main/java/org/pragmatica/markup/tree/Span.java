package org.pragmatica.markup.tree;

/**
 * Inline node, the content of a paragraph or of another span.
 */
public interface Span extends Element {}
