package org.pragmatica.markup.parser;

import java.util.function.BiFunction;

/**
 * Result of two parsers applied in sequence.
 */
public record Pair<A, B>(A first, B second) {

    public static <A, B> Pair<A, B> of(A first, B second) {
        return new Pair<>(first, second);
    }

    public <R> R map(BiFunction<? super A, ? super B, ? extends R> f) {
        return f.apply(first, second);
    }
}
