package org.pragmatica.markup.directive;

import org.pragmatica.markup.tree.DeferredSpan;
import org.pragmatica.markup.tree.DocumentCursor;
import org.pragmatica.markup.tree.InvalidSpan;
import org.pragmatica.markup.tree.Span;

import java.util.function.Function;

/**
 * Span directives, used inline in the paragraphs of markup documents.
 *
 * <p>Example usage:
 * <pre>{@code
 * var dsl = Spans.dsl();
 * Directive<Span> upper = Spans.create("upper", dsl.attribute(0).map(value -> new Text(value.toUpperCase())));
 * }</pre>
 */
public final class Spans {
    private Spans() {}

    public static final DirectiveFamily<Span> FAMILY = new DirectiveFamily<>() {
        @Override
        public String description() {
            return "span";
        }

        @Override
        public Span invalid(String message, String source) {
            return new InvalidSpan(message, source);
        }

        @Override
        public Span deferred(Function<DocumentCursor, Span> resolver, String source) {
            return new DeferredSpan(resolver, source);
        }

        @Override
        public Span separatorInstance(DirectiveDeclaration declaration, String source) {
            return new SeparatorInstance(declaration, source);
        }
    };

    private static final DirectiveDsl<Span> DSL = new DirectiveDsl<>();

    public static DirectiveDsl<Span> dsl() {
        return DSL;
    }

    public static Directive<Span> create(String name, DirectivePart<Span, ? extends Span> part) {
        return new Directive<>(name, part);
    }

    /**
     * A separator without occurrence constraints, use {@link SeparatorDirective#withMin} and
     * {@link SeparatorDirective#withMax} to add them.
     */
    public static <T> SeparatorDirective<Span, T> separator(String name, DirectivePart<Span, T> part) {
        return new SeparatorDirective<>(name, part, 0, Integer.MAX_VALUE);
    }
}
