package org.pragmatica.markup.parser;

import java.util.function.Function;

/**
 * Lazily rendered failure message.
 *
 * <p>Most failures are discarded by an enclosing alternative, so messages are only
 * turned into strings when somebody actually asks for them.
 */
@FunctionalInterface
public interface Message {

    String render(SourceCursor cursor);

    Message UNEXPECTED_EOF = fixed("Unexpected end of input");
    Message EXPECTED_EOF = fixed("Expected end of input");
    Message EXPECTED_EOL = fixed("Expected end of line");
    Message EXPECTED_FAILURE = fixed("Expected failure, but parser succeeded");

    static Message fixed(String message) {
        return cursor -> message;
    }

    static Message forContext(Function<SourceCursor, String> f) {
        return f::apply;
    }

    static <T> Message forRuntimeValue(T value, Function<T, String> f) {
        return cursor -> f.apply(value);
    }
}
