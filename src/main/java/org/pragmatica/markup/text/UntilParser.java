package org.pragmatica.markup.text;

import org.pragmatica.markup.parser.Message;
import org.pragmatica.markup.parser.ParseResult;
import org.pragmatica.markup.parser.Parser;
import org.pragmatica.markup.parser.SourceCursor;

/**
 * Consumes text until a delimiter parser succeeds or a stop character is reached.
 *
 * <p>When the delimiter succeeds the text excludes the delimiter and the cursor is placed behind
 * it. When a stop character is reached the text includes everything up to the stop character,
 * which is not consumed. {@link #scan()} tells both outcomes apart. Reaching the end of input
 * without either is a failure.
 */
public final class UntilParser implements Parser<String> {
    private final Parser<?> until;
    private final CharPredicate stopChars;
    private final int min;

    UntilParser(Parser<?> until) {
        this(until, CharPredicate.NONE, 0);
    }

    private UntilParser(Parser<?> until, CharPredicate stopChars, int min) {
        this.until = until;
        this.stopChars = stopChars;
        this.min = min;
    }

    public enum Termination {
        DELIMITER,
        STOP_CHAR
    }

    public record UntilResult(String text, Termination termination) {}

    /**
     * Stop at any of the specified characters.
     */
    public UntilParser stopChars(char... chars) {
        return new UntilParser(until, CharPredicate.anyOf(chars), min);
    }

    /**
     * Fail when the text before the delimiter has fewer than the specified number of characters.
     */
    public UntilParser min(int num) {
        return new UntilParser(until, stopChars, num);
    }

    public Parser<UntilResult> scan() {
        return this::scan;
    }

    @Override
    public ParseResult<String> parse(SourceCursor in) {
        return scan(in).map(UntilResult::text);
    }

    private ParseResult<UntilResult> scan(SourceCursor in) {
        var current = in;
        while (true) {
            int consumed = current.offset() - in.offset();
            if (!current.atEnd() && stopChars.test(current.peek())) {
                return complete(in, consumed, Termination.STOP_CHAR, current);
            }
            var result = until.parse(current);
            if (result instanceof ParseResult.Success<?> success) {
                return complete(in, consumed, Termination.DELIMITER, success.next());
            }
            if (current.atEnd()) {
                return ParseResult.Failure.at(current, Message.UNEXPECTED_EOF);
            }
            current = current.consume(1);
        }
    }

    private ParseResult<UntilResult> complete(SourceCursor in, int consumed, Termination termination, SourceCursor next) {
        if (consumed < min) {
            return ParseResult.Failure.at(in, Message.forRuntimeValue(consumed,
                                                                      count -> "expected at least " + min + " characters, got only " + count));
        }
        return ParseResult.Success.of(new UntilResult(in.capture(consumed), termination), next);
    }
}
