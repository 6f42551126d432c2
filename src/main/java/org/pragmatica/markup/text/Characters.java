package org.pragmatica.markup.text;

import org.pragmatica.markup.parser.Message;
import org.pragmatica.markup.parser.ParseResult;
import org.pragmatica.markup.parser.Parser;
import org.pragmatica.markup.parser.SourceCursor;

/**
 * Consumes the longest run of characters accepted by a classifier.
 *
 * <p>Without further constraints the parser always succeeds, possibly with an empty string.
 */
public final class Characters implements Parser<String> {
    private final CharPredicate predicate;
    private final int min;
    private final int max;

    Characters(CharPredicate predicate) {
        this(predicate, 0, Integer.MAX_VALUE);
    }

    private Characters(CharPredicate predicate, int min, int max) {
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("Invalid character count: min=" + min + ", max=" + max);
        }
        this.predicate = predicate;
        this.min = min;
        this.max = max;
    }

    /**
     * Fail when fewer than the specified number of characters match.
     */
    public Characters min(int num) {
        return new Characters(predicate, num, Math.max(num, max));
    }

    public Characters max(int num) {
        return new Characters(predicate, Math.min(min, num), num);
    }

    public Characters take(int num) {
        return new Characters(predicate, num, num);
    }

    /**
     * The number of matching characters instead of the characters themselves.
     */
    public Parser<Integer> count() {
        return map(String::length);
    }

    @Override
    public ParseResult<String> parse(SourceCursor in) {
        var source = in.input();
        int start = in.offset();
        int end = (int) Math.min(source.length(), (long) start + max);
        int offset = start;
        while (offset < end && predicate.test(source.charAt(offset))) {
            offset++;
        }
        int consumed = offset - start;
        if (consumed < min) {
            return ParseResult.Failure.at(in, Message.forRuntimeValue(consumed,
                                                                      count -> "expected at least " + min + " characters, got only " + count));
        }
        return ParseResult.Success.of(in.capture(consumed), in.consume(consumed));
    }
}
