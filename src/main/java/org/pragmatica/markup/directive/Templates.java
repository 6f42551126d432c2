package org.pragmatica.markup.directive;

import org.pragmatica.markup.tree.DeferredTemplateSpan;
import org.pragmatica.markup.tree.DocumentCursor;
import org.pragmatica.markup.tree.InvalidSpan;
import org.pragmatica.markup.tree.TemplateElement;
import org.pragmatica.markup.tree.TemplateSpan;

import java.util.function.Function;

/**
 * Template directives.
 */
public final class Templates {
    private Templates() {}

    public static final DirectiveFamily<TemplateSpan> FAMILY = new DirectiveFamily<>() {
        @Override
        public String description() {
            return "template";
        }

        @Override
        public TemplateSpan invalid(String message, String source) {
            return new TemplateElement(new InvalidSpan(message, source));
        }

        @Override
        public TemplateSpan deferred(Function<DocumentCursor, TemplateSpan> resolver, String source) {
            return new DeferredTemplateSpan(resolver, source);
        }

        @Override
        public TemplateSpan separatorInstance(DirectiveDeclaration declaration, String source) {
            return new SeparatorInstance(declaration, source);
        }
    };

    private static final DirectiveDsl<TemplateSpan> DSL = new DirectiveDsl<>();

    public static DirectiveDsl<TemplateSpan> dsl() {
        return DSL;
    }

    public static Directive<TemplateSpan> create(String name, DirectivePart<TemplateSpan, ? extends TemplateSpan> part) {
        return new Directive<>(name, part);
    }

    /**
     * A separator without occurrence constraints, use {@link SeparatorDirective#withMin} and
     * {@link SeparatorDirective#withMax} to add them.
     */
    public static <T> SeparatorDirective<TemplateSpan, T> separator(String name, DirectivePart<TemplateSpan, T> part) {
        return new SeparatorDirective<>(name, part, 0, Integer.MAX_VALUE);
    }
}
