package org.pragmatica.markup.directive;

import org.pragmatica.markup.parser.Validated;

/**
 * A named directive producing an element of its family.
 */
public record Directive<E>(String name, DirectivePart<E, ? extends E> part) {

    public Directive {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Directive name must not be empty");
        }
    }

    public boolean hasBody() {
        return part.hasBody();
    }

    public boolean requiresCursor() {
        return part.requiresCursor();
    }

    public Validated<E> apply(DirectiveContext<E> context) {
        return part.apply(context)
                   .<E>map(element -> element);
    }
}
