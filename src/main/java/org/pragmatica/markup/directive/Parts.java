package org.pragmatica.markup.directive;

import org.pragmatica.markup.parser.Validated;

import java.util.HashSet;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Combines directive parts. All parts are always evaluated, the errors of all failed parts are
 * reported together in argument order.
 *
 * <p>Example usage:
 * <pre>{@code
 * Directive<Span> link = Spans.create("link",
 *     Parts.all(Spans.dsl().attribute(0), Spans.dsl().parsedBody(), (target, body) -> new SpanSequence(body)));
 * }</pre>
 */
public final class Parts {
    private Parts() {}

    @FunctionalInterface
    public interface Fn3<A, B, C, R> {
        R apply(A a, B b, C c);
    }

    @FunctionalInterface
    public interface Fn4<A, B, C, D, R> {
        R apply(A a, B b, C c, D d);
    }

    @FunctionalInterface
    public interface Fn5<A, B, C, D, F, R> {
        R apply(A a, B b, C c, D d, F f);
    }

    public static <E, A, B, R> DirectivePart<E, R> all(DirectivePart<E, A> a,
                                                       DirectivePart<E, B> b,
                                                       BiFunction<? super A, ? super B, ? extends R> f) {
        return combine(List.of(a, b), context -> {
            var ra = a.apply(context);
            var rb = b.apply(context);
            return collect(List.of(ra, rb), () -> f.apply(value(ra), value(rb)));
        });
    }

    public static <E, A, B, C, R> DirectivePart<E, R> all(DirectivePart<E, A> a,
                                                          DirectivePart<E, B> b,
                                                          DirectivePart<E, C> c,
                                                          Fn3<? super A, ? super B, ? super C, ? extends R> f) {
        return combine(List.of(a, b, c), context -> {
            var ra = a.apply(context);
            var rb = b.apply(context);
            var rc = c.apply(context);
            return collect(List.of(ra, rb, rc), () -> f.apply(value(ra), value(rb), value(rc)));
        });
    }

    public static <E, A, B, C, D, R> DirectivePart<E, R> all(DirectivePart<E, A> a,
                                                             DirectivePart<E, B> b,
                                                             DirectivePart<E, C> c,
                                                             DirectivePart<E, D> d,
                                                             Fn4<? super A, ? super B, ? super C, ? super D, ? extends R> f) {
        return combine(List.of(a, b, c, d), context -> {
            var ra = a.apply(context);
            var rb = b.apply(context);
            var rc = c.apply(context);
            var rd = d.apply(context);
            return collect(List.of(ra, rb, rc, rd), () -> f.apply(value(ra), value(rb), value(rc), value(rd)));
        });
    }

    public static <E, A, B, C, D, F, R> DirectivePart<E, R> all(DirectivePart<E, A> a,
                                                                DirectivePart<E, B> b,
                                                                DirectivePart<E, C> c,
                                                                DirectivePart<E, D> d,
                                                                DirectivePart<E, F> e,
                                                                Fn5<? super A, ? super B, ? super C, ? super D, ? super F, ? extends R> f) {
        return combine(List.of(a, b, c, d, e), context -> {
            var ra = a.apply(context);
            var rb = b.apply(context);
            var rc = c.apply(context);
            var rd = d.apply(context);
            var re = e.apply(context);
            return collect(List.of(ra, rb, rc, rd, re), () -> f.apply(value(ra), value(rb), value(rc), value(rd), value(re)));
        });
    }

    private static <E, R> DirectivePart<E, R> combine(List<DirectivePart<E, ?>> parts, Function<DirectiveContext<E>, Validated<R>> function) {
        var hasBody = parts.stream()
                           .anyMatch(DirectivePart::hasBody);
        var requiresCursor = parts.stream()
                                  .anyMatch(DirectivePart::requiresCursor);
        var separators = new HashSet<String>();
        parts.forEach(part -> separators.addAll(part.separators()));
        return new DirectivePart<>(function, hasBody, requiresCursor, separators);
    }

    private static <R> Validated<R> collect(List<Validated<?>> results, Supplier<? extends R> value) {
        var errors = Validated.collectErrors(results);
        return errors.isEmpty()
               ? Validated.valid(value.get())
               : Validated.invalid(errors);
    }

    private static <T> T value(Validated<T> result) {
        return ((Validated.Valid<T>) result).value();
    }
}
