package org.pragmatica.markup.tree;

/**
 * Literal text of a template.
 */
public record TemplateString(String content) implements TemplateSpan {

    public static TemplateString of(String content) {
        return new TemplateString(content);
    }
}
