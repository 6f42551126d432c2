package org.pragmatica.markup;

import org.pragmatica.markup.parser.ParseResult;
import org.pragmatica.markup.parser.SourceLocation;

/**
 * Thrown when a document could not be parsed completely.
 */
public final class MarkupParserException extends RuntimeException {
    private final SourceLocation location;

    public MarkupParserException(ParseResult.Failure<?> failure) {
        super(failure.describe());
        this.location = failure.location();
    }

    public SourceLocation location() {
        return location;
    }
}
