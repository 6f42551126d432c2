package org.pragmatica.markup.tree;

/**
 * A reference to a configuration value in a template.
 */
public record TemplateContextReference(String key, boolean required) implements TemplateSpan, Resolvable<TemplateSpan> {

    @Override
    public TemplateSpan resolve(DocumentCursor cursor) {
        return cursor.config(key)
                     .<TemplateSpan>map(TemplateString::new)
                     .orElseGet(() -> required
                                      ? new TemplateElement(new InvalidSpan(MarkupContextReference.missingReference(key), source()))
                                      : TemplateSpanSequence.EMPTY);
    }

    public String source() {
        return required
               ? "${" + key + "}"
               : "${?" + key + "}";
    }
}
