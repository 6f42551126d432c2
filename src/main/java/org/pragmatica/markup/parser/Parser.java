package org.pragmatica.markup.parser;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A parser is a pure function from an input cursor to a {@link ParseResult}.
 *
 * <p>Parsers never modify shared state, so a parser instance may be used by any number
 * of threads at the same time. The default methods provide the usual combinators.
 *
 * <p>Example usage:
 * <pre>{@code
 * Parser<String> key = TextParsers.anyNot('=').min(1);
 * Parser<Pair<String, String>> member = key.keepLeft(literal("=")).then(TextParsers.restOfLine());
 * }</pre>
 */
@FunctionalInterface
public interface Parser<T> {

    /**
     * Apply this parser at the specified position.
     */
    ParseResult<T> parse(SourceCursor in);

    /**
     * Apply this parser to the start of the specified input. Input left over
     * after the parser succeeded is ignored.
     */
    default ParseResult<T> parse(String input) {
        return parse(SourceCursor.of(input));
    }

    /**
     * Apply this parser to the specified input, failing if it does not consume all of it.
     */
    default ParseResult<T> parseAll(String input) {
        return Parsers.consumeAll(this).parse(SourceCursor.of(input));
    }

    // === Mapping ===

    default <U> Parser<U> map(Function<? super T, ? extends U> f) {
        return in -> parse(in).map(f);
    }

    default <U> Parser<U> as(U value) {
        return map(ignored -> value);
    }

    /**
     * Use the result of this parser to choose the parser to apply next.
     */
    default <U> Parser<U> flatMap(Function<? super T, ? extends Parser<U>> f) {
        return in -> {
            var result = parse(in);
            if (result instanceof ParseResult.Success<T> success) {
                return f.apply(success.value())
                        .parse(success.next());
            }
            return ((ParseResult.Failure<T>) result).cast();
        };
    }

    /**
     * Fail with a message derived from the value when the predicate rejects it.
     */
    default Parser<T> filter(Predicate<? super T> predicate, Function<? super T, String> message) {
        return in -> {
            var result = parse(in);
            if (result instanceof ParseResult.Success<T> success && !predicate.test(success.value())) {
                return ParseResult.Failure.at(in, Message.forRuntimeValue(success.value(), message::apply));
            }
            return result;
        };
    }

    /**
     * Validate the result of this parser, turning an invalid outcome into a parser failure
     * at the position this parser was applied at.
     */
    default <U> Parser<U> evalMap(Function<? super T, Validated<U>> f) {
        return in -> {
            var result = parse(in);
            if (result instanceof ParseResult.Success<T> success) {
                var validated = f.apply(success.value());
                if (validated instanceof Validated.Invalid<U> invalid) {
                    return ParseResult.Failure.at(in, invalid.message());
                }
                return ParseResult.Success.of(((Validated.Valid<U>) validated).value(), success.next());
            }
            return ((ParseResult.Failure<T>) result).cast();
        };
    }

    // === Sequencing ===

    /**
     * Apply this parser and then the specified one, keeping both results.
     */
    default <U> Parser<Pair<T, U>> then(Parser<U> next) {
        return in -> {
            var first = parse(in);
            if (first instanceof ParseResult.Success<T> success) {
                return next.parse(success.next())
                           .map(second -> Pair.of(success.value(), second));
            }
            return ((ParseResult.Failure<T>) first).cast();
        };
    }

    /**
     * Apply this parser and then the specified one, keeping only the result of this parser.
     */
    default Parser<T> keepLeft(Parser<?> next) {
        return then(next).map(Pair::first);
    }

    /**
     * Apply this parser and then the specified one, keeping only the result of the specified parser.
     */
    default <U> Parser<U> keepRight(Parser<U> next) {
        return then(next).map(Pair::second);
    }

    // === Alternatives ===

    /**
     * Try this parser first, and the specified one if this parser fails.
     */
    default Parser<T> or(Parser<T> alternative) {
        return Parsers.choice(List.of(this, alternative));
    }

    /**
     * Always succeeds, with an empty result when this parser fails.
     */
    default Parser<Optional<T>> optional() {
        return Parsers.opt(this);
    }

    // === Repetition ===

    default Repeat<T> repeat() {
        return new Repeat<>(this);
    }

    /**
     * Repeat this parser with the specified separator between two occurrences.
     */
    default Repeat<T> repeat(Parser<?> separator) {
        return new Repeat<>(this).separatedBy(separator);
    }

    // === Source access ===

    /**
     * Produce the consumed input instead of the result of this parser.
     */
    default Parser<String> source() {
        return withSource().map(Pair::second);
    }

    /**
     * Produce the result of this parser together with the consumed input.
     */
    default Parser<Pair<T, String>> withSource() {
        return in -> {
            var result = parse(in);
            if (result instanceof ParseResult.Success<T> success) {
                var consumed = in.capture(success.next().offset() - in.offset());
                return ParseResult.Success.of(Pair.of(success.value(), consumed), success.next());
            }
            return ((ParseResult.Failure<T>) result).cast();
        };
    }

    /**
     * Produce the result of this parser together with the cursor it was applied at.
     */
    default Parser<Pair<T, SourceCursor>> withCursor() {
        return in -> parse(in).map(value -> Pair.of(value, in));
    }
}
