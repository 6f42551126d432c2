package org.pragmatica.markup.parser;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Generic combinators which are not tailored to text markup.
 */
public final class Parsers {
    private Parsers() {}

    /**
     * A parser that always succeeds with the specified value, consuming nothing.
     */
    public static <T> Parser<T> success(T value) {
        return in -> ParseResult.Success.of(value, in);
    }

    /**
     * A parser that always fails with the specified message.
     */
    public static <T> Parser<T> failure(String message) {
        return in -> ParseResult.Failure.at(in, message);
    }

    /**
     * Matches the specified literal string.
     */
    public static Parser<String> literal(String expected) {
        return new Literal(expected);
    }

    /**
     * Matches exactly the specified character.
     */
    public static Parser<Character> character(char expected) {
        return in -> {
            if (in.atEnd()) {
                return ParseResult.Failure.at(in, Message.UNEXPECTED_EOF);
            }
            char found = in.peek();
            return found == expected
                   ? ParseResult.Success.of(found, in.consume(1))
                   : ParseResult.Failure.at(in, Message.forRuntimeValue(found, c -> "'" + expected + "' expected but " + c + " found"));
        };
    }

    /**
     * Always succeeds, with an empty result when the specified parser fails.
     */
    public static <T> Parser<Optional<T>> opt(Parser<T> parser) {
        return in -> {
            var result = parser.parse(in);
            if (result instanceof ParseResult.Success<T> success) {
                return ParseResult.Success.of(Optional.ofNullable(success.value()), success.next());
            }
            return ParseResult.Success.of(Optional.empty(), in);
        };
    }

    /**
     * Succeeds only if the specified parser fails, never consumes any input.
     */
    public static Parser<Void> not(Parser<?> parser) {
        return in -> parser.parse(in)
                           .isSuccess()
                     ? ParseResult.Failure.at(in, Message.EXPECTED_FAILURE)
                     : ParseResult.Success.of(null, in);
    }

    /**
     * Applies the specified parser without consuming any input.
     */
    public static <T> Parser<T> lookAhead(Parser<T> parser) {
        return in -> {
            var result = parser.parse(in);
            if (result instanceof ParseResult.Success<T> success) {
                return ParseResult.Success.of(success.value(), in);
            }
            return result;
        };
    }

    /**
     * Succeeds only if the specified parser consumes all remaining input.
     */
    public static <T> Parser<T> consumeAll(Parser<T> parser) {
        return in -> {
            var result = parser.parse(in);
            if (result instanceof ParseResult.Success<T> success && !success.next().atEnd()) {
                return ParseResult.Failure.at(success.next(), Message.EXPECTED_EOF);
            }
            return result;
        };
    }

    /**
     * Defers construction of the parser until its first use, which allows recursive definitions.
     */
    public static <T> Parser<T> lazily(Supplier<Parser<T>> supplier) {
        return new LazyParser<>(supplier);
    }

    /**
     * Try the specified parsers in order, the first success wins.
     *
     * <p>When all alternatives fail, the failure that got furthest into the input is
     * returned, with its {@code maxOffset} raised to the maximum over all alternatives.
     */
    public static <T> Parser<T> choice(List<? extends Parser<T>> alternatives) {
        if (alternatives.isEmpty()) {
            throw new IllegalArgumentException("choice requires at least one alternative");
        }
        var candidates = List.copyOf(alternatives);
        if (candidates.size() == 1) {
            return candidates.get(0);
        }
        return in -> {
            ParseResult.Failure<T> furthest = null;
            int maxOffset = in.offset();
            for (var candidate : candidates) {
                var result = candidate.parse(in);
                if (result instanceof ParseResult.Failure<T> failure) {
                    if (furthest == null || failure.maxOffset() > furthest.maxOffset()) {
                        furthest = failure;
                    }
                    maxOffset = Math.max(maxOffset, failure.maxOffset());
                } else {
                    return result;
                }
            }
            return furthest.withMaxOffset(maxOffset);
        };
    }

    private static final class LazyParser<T> implements Parser<T> {
        private final Supplier<Parser<T>> supplier;
        private volatile Parser<T> parser;

        private LazyParser(Supplier<Parser<T>> supplier) {
            this.supplier = supplier;
        }

        @Override
        public ParseResult<T> parse(SourceCursor in) {
            var current = parser;
            if (current == null) {
                current = supplier.get();
                parser = current;
            }
            return current.parse(in);
        }
    }
}
