package org.pragmatica.markup.text;

import org.pragmatica.markup.parser.ParseResult;

/**
 * Decision of a {@link Delimiter} at one of its start characters.
 */
public sealed interface DelimiterResult<T> {

    @SuppressWarnings("unchecked")
    static <T> DelimiterResult<T> proceed() {
        return (DelimiterResult<T>) (DelimiterResult<?>) Continue.INSTANCE;
    }

    static <T> DelimiterResult<T> complete(ParseResult<T> result) {
        return new Complete<>(result);
    }

    /**
     * Scanning ends with the specified result, which may also be a failure.
     */
    record Complete<T>(ParseResult<T> result) implements DelimiterResult<T> {}

    /**
     * The start character did not complete a delimiter, scanning continues.
     */
    enum Continue implements DelimiterResult<Object> {
        INSTANCE
    }
}
