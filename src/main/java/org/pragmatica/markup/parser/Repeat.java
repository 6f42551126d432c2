package org.pragmatica.markup.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Applies a parser repeatedly until it fails, collecting the results.
 *
 * <p>Any number of results is accepted by default, {@link #min(int)}, {@link #max(int)}
 * and {@link #take(int)} add constraints. The repetition also ends when the parser
 * succeeds without consuming input, so it terminates on any finite input. Such a
 * zero-width result is not collected.
 */
public final class Repeat<T> implements Parser<List<T>> {
    private final Parser<T> parser;
    private final Parser<?> separator;
    private final int min;
    private final int max;

    public Repeat(Parser<T> parser) {
        this(parser, null, 0, Integer.MAX_VALUE);
    }

    private Repeat(Parser<T> parser, Parser<?> separator, int min, int max) {
        if (min < 0 || max < 0) {
            throw new IllegalArgumentException("Repetition bounds must not be negative: min=" + min + ", max=" + max);
        }
        this.parser = parser;
        this.separator = separator;
        this.min = min;
        this.max = max;
    }

    /**
     * Fail unless the parser succeeds at least the specified number of times.
     */
    public Repeat<T> min(int num) {
        return new Repeat<>(parser, separator, num, max);
    }

    /**
     * Stop invoking the parser once the specified number of results has been collected.
     */
    public Repeat<T> max(int num) {
        return new Repeat<>(parser, separator, min, num);
    }

    public Repeat<T> take(int num) {
        return new Repeat<>(parser, separator, num, num);
    }

    /**
     * Expect the specified separator between two occurrences. A separator that is not
     * followed by another occurrence is not consumed.
     */
    public Repeat<T> separatedBy(Parser<?> separator) {
        return new Repeat<>(parser, separator, min, max);
    }

    @Override
    public ParseResult<List<T>> parse(SourceCursor in) {
        var elements = new ArrayList<T>();
        var current = in;

        while (elements.size() < max) {
            var start = current;
            if (separator != null && !elements.isEmpty()) {
                var sep = separator.parse(current);
                if (sep instanceof ParseResult.Success<?> sepSuccess) {
                    start = sepSuccess.next();
                } else {
                    break;
                }
            }
            var result = parser.parse(start);
            if (result instanceof ParseResult.Failure<T> failure) {
                if (elements.size() < min) {
                    return failure.cast();
                }
                break;
            }
            var success = (ParseResult.Success<T>) result;
            if (success.next().offset() <= current.offset()) {
                break;
            }
            elements.add(success.value());
            current = success.next();
        }

        if (elements.size() < min) {
            return ParseResult.Failure.at(current, Message.forRuntimeValue(elements.size(),
                                                                           count -> "expected at least " + min + " occurrences, got only " + count));
        }
        return ParseResult.Success.of(Collections.unmodifiableList(elements), current);
    }
}
