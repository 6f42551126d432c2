package org.pragmatica.markup.tree;

/**
 * Inline node of a template.
 */
public interface TemplateSpan extends Span {}
