package org.pragmatica.markup.directive;

import org.pragmatica.markup.parser.Validated;

import java.util.Set;
import java.util.function.Function;

/**
 * One piece of the definition of a directive, producing a value or error messages from the
 * directive context. Parts are combined with {@link Parts#all} and transformed with {@link #map}
 * and {@link #evalMap}.
 *
 * @param <E> the element type of the directive family
 * @param <T> the type of the produced value
 */
public class DirectivePart<E, T> {
    private final Function<DirectiveContext<E>, Validated<T>> function;
    private final boolean hasBody;
    private final boolean requiresCursor;
    private final Set<String> separators;

    protected DirectivePart(Function<DirectiveContext<E>, Validated<T>> function,
                            boolean hasBody,
                            boolean requiresCursor,
                            Set<String> separators) {
        this.function = function;
        this.hasBody = hasBody;
        this.requiresCursor = requiresCursor;
        this.separators = Set.copyOf(separators);
    }

    public static <E, T> DirectivePart<E, T> of(Function<DirectiveContext<E>, Validated<T>> function) {
        return new DirectivePart<>(function, false, false, Set.of());
    }

    static <E, T> DirectivePart<E, T> withBody(Function<DirectiveContext<E>, Validated<T>> function, Set<String> separators) {
        return new DirectivePart<>(function, true, false, separators);
    }

    static <E, T> DirectivePart<E, T> withCursor(Function<DirectiveContext<E>, Validated<T>> function) {
        return new DirectivePart<>(function, false, true, Set.of());
    }

    public Validated<T> apply(DirectiveContext<E> context) {
        return function.apply(context);
    }

    /**
     * Whether the directive using this part expects a body.
     */
    public boolean hasBody() {
        return hasBody;
    }

    /**
     * Whether the part can only be evaluated with a document cursor.
     */
    public boolean requiresCursor() {
        return requiresCursor;
    }

    /**
     * Names of the separator directives expected in the body.
     */
    public Set<String> separators() {
        return separators;
    }

    public <U> DirectivePart<E, U> map(Function<? super T, ? extends U> f) {
        return new DirectivePart<>(context -> apply(context).map(f), hasBody, requiresCursor, separators);
    }

    /**
     * Transforms the value with a function which may itself fail.
     */
    public <U> DirectivePart<E, U> evalMap(Function<? super T, Validated<U>> f) {
        return new DirectivePart<>(context -> apply(context).flatMap(f), hasBody, requiresCursor, separators);
    }
}
