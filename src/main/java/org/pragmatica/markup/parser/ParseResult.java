package org.pragmatica.markup.parser;

import java.util.Optional;
import java.util.function.Function;

/**
 * Result of applying a parser - either success with a value and the cursor
 * behind the consumed input, or failure.
 */
public sealed interface ParseResult<T> {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    <U> ParseResult<U> map(Function<? super T, ? extends U> f);

    /**
     * The value of a successful result.
     */
    Optional<T> toOptional();

    /**
     * Successful parse with the produced value and the cursor positioned
     * behind the consumed input.
     */
    record Success<T>(T value, SourceCursor next) implements ParseResult<T> {

        public static <T> Success<T> of(T value, SourceCursor next) {
            return new Success<>(value, next);
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <U> ParseResult<U> map(Function<? super T, ? extends U> f) {
            return new Success<>(f.apply(value), next);
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.ofNullable(value);
        }
    }

    /**
     * Failed parse.
     *
     * <p>{@code maxOffset} is the furthest offset any attempted branch reached before
     * failing, which is what error reporting should point at.
     */
    record Failure<T>(Message msgProvider, SourceCursor cursor, int maxOffset) implements ParseResult<T> {

        public static <T> Failure<T> at(SourceCursor cursor, Message message) {
            return new Failure<>(message, cursor, cursor.offset());
        }

        public static <T> Failure<T> at(SourceCursor cursor, String message) {
            return at(cursor, Message.fixed(message));
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        public String message() {
            return msgProvider.render(cursor);
        }

        public SourceLocation location() {
            return cursor.location();
        }

        @Override
        @SuppressWarnings("unchecked")
        public <U> ParseResult<U> map(Function<? super T, ? extends U> f) {
            return (ParseResult<U>) this;
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.empty();
        }

        /**
         * Same failure, re-typed for a parser with a different result type.
         */
        @SuppressWarnings("unchecked")
        public <U> Failure<U> cast() {
            return (Failure<U>) this;
        }

        /**
         * Keep message and position, but raise the furthest offset when the given one is larger.
         */
        public Failure<T> withMaxOffset(int offset) {
            return offset > maxOffset
                   ? new Failure<>(msgProvider, cursor, offset)
                   : this;
        }

        /**
         * Multi-line description with the source line and a caret under the failure position.
         */
        public String describe() {
            var location = location();
            return "[" + location + "] failure: " + message() + "\n\n" + location.lineContentWithCaret();
        }

        @Override
        public String toString() {
            return "Failure(" + message() + " at " + cursor.offset() + ", maxOffset=" + maxOffset + ")";
        }
    }
}
