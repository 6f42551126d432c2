package org.pragmatica.markup.text;

/**
 * Outcome of scanning inline text: either the end of the span or the start of a nested span.
 */
public sealed interface InlineResult {

    String text();

    record EndDelimiter(String text) implements InlineResult {}

    record NestedDelimiter(char startChar, String text) implements InlineResult {}
}
