package org.pragmatica.markup.tree;

/**
 * A reference to a configuration value in markup, written as {@code ${key}}, or {@code ${?key}}
 * when the value is optional.
 */
public record MarkupContextReference(String key, boolean required) implements Span, Resolvable<Span> {

    @Override
    public Span resolve(DocumentCursor cursor) {
        return cursor.config(key)
                     .<Span>map(Text::new)
                     .orElseGet(() -> required
                                      ? new InvalidSpan(missingReference(key), source())
                                      : SpanSequence.EMPTY);
    }

    public String source() {
        return required
               ? "${" + key + "}"
               : "${?" + key + "}";
    }

    static String missingReference(String key) {
        return "Missing required reference: '" + key + "'";
    }
}
