package org.pragmatica.markup.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Either a value or a non-empty list of error messages.
 *
 * <p>Unlike {@link ParseResult}, combining two invalid results keeps the messages of both.
 */
public sealed interface Validated<T> {

    static <T> Validated<T> valid(T value) {
        return new Valid<>(value);
    }

    static <T> Validated<T> invalid(String message) {
        return new Invalid<>(List.of(message));
    }

    static <T> Validated<T> invalid(List<String> messages) {
        if (messages.isEmpty()) {
            throw new IllegalArgumentException("an invalid result needs at least one message");
        }
        return new Invalid<>(List.copyOf(messages));
    }

    boolean isValid();

    <U> Validated<U> map(Function<? super T, ? extends U> f);

    <U> Validated<U> flatMap(Function<? super T, Validated<U>> f);

    Optional<T> toOptional();

    /**
     * The error messages of this result, empty for a valid result.
     */
    List<String> errors();

    /**
     * Combine the errors of all specified results, in order.
     */
    static List<String> collectErrors(List<? extends Validated<?>> results) {
        var errors = new ArrayList<String>();
        results.forEach(result -> errors.addAll(result.errors()));
        return errors;
    }

    record Valid<T>(T value) implements Validated<T> {
        @Override
        public boolean isValid() {
            return true;
        }

        @Override
        public <U> Validated<U> map(Function<? super T, ? extends U> f) {
            return new Valid<>(f.apply(value));
        }

        @Override
        public <U> Validated<U> flatMap(Function<? super T, Validated<U>> f) {
            return f.apply(value);
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.ofNullable(value);
        }

        @Override
        public List<String> errors() {
            return List.of();
        }
    }

    record Invalid<T>(List<String> messages) implements Validated<T> {
        @Override
        public boolean isValid() {
            return false;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <U> Validated<U> map(Function<? super T, ? extends U> f) {
            return (Validated<U>) this;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <U> Validated<U> flatMap(Function<? super T, Validated<U>> f) {
            return (Validated<U>) this;
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.empty();
        }

        @Override
        public List<String> errors() {
            return messages;
        }

        public String message() {
            return String.join(", ", messages);
        }
    }
}
