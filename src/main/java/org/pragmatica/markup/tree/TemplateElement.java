package org.pragmatica.markup.tree;

/**
 * Wraps a span which is not a template span so that it can be placed into a template.
 */
public record TemplateElement(Span element) implements TemplateSpan {}
