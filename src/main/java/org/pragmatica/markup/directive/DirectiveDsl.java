package org.pragmatica.markup.directive;

import org.pragmatica.markup.parser.Validated;
import org.pragmatica.markup.tree.DocumentCursor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * The building blocks for the definition of directives of one family.
 *
 * @param <E> the element type of the family
 */
public final class DirectiveDsl<E> {
    static final String MISSING_BODY = "required body is missing";

    DirectiveDsl() {}

    /**
     * The positional attribute at the specified index.
     */
    public AttributePart<E, String> attribute(int index) {
        return AttributePart.positional(index);
    }

    /**
     * The attribute with the specified name.
     */
    public AttributePart<E, String> attribute(String name) {
        return AttributePart.named(name);
    }

    public DirectivePart<E, List<String>> positionalAttributes() {
        return DirectivePart.of(context -> Validated.valid(context.declaration()
                                                                  .positional()));
    }

    public DirectivePart<E, Attributes> allAttributes() {
        return DirectivePart.of(context -> Validated.valid(new Attributes(context.declaration()
                                                                                 .positional(),
                                                                          context.declaration()
                                                                                 .named())));
    }

    /**
     * The body parsed with the parsers of the host document.
     */
    public DirectivePart<E, List<E>> parsedBody() {
        return DirectivePart.withBody(context -> context.body()
                                                        .map(Validated::valid)
                                                        .orElseGet(() -> Validated.invalid(MISSING_BODY)),
                                      Set.of());
    }

    /**
     * The body as written in the document.
     */
    public DirectivePart<E, String> rawBody() {
        return DirectivePart.withBody(context -> context.declaration()
                                                        .body()
                                                        .map(Validated::valid)
                                                        .orElseGet(() -> Validated.invalid(MISSING_BODY)),
                                      Set.of());
    }

    /**
     * The parsed body split at the specified separator directives. Elements in front of the first
     * separator form the main body, the elements following a separator are its body.
     */
    public <T> DirectivePart<E, Multipart<E, T>> separatedBody(List<? extends SeparatorDirective<E, ? extends T>> separators) {
        var byName = new HashMap<String, SeparatorDirective<E, ? extends T>>();
        var names = new LinkedHashSet<String>();
        for (var separator : separators) {
            byName.put(separator.name(), separator);
            names.add(separator.name());
        }
        return DirectivePart.withBody(context -> context.body()
                                                        .map(body -> split(context, body, separators, byName))
                                                        .orElseGet(() -> Validated.invalid(MISSING_BODY)),
                                      names);
    }

    /**
     * The function parsing strings with the parsers of the host document.
     */
    public DirectivePart<E, Function<String, List<E>>> parser() {
        return DirectivePart.of(context -> Validated.valid(context.bodyParser()));
    }

    /**
     * The cursor of the document. Directives using it are resolved in the rewrite step.
     */
    public DirectivePart<E, DocumentCursor> cursor() {
        return DirectivePart.withCursor(context -> context.cursor()
                                                          .map(Validated::valid)
                                                          .orElseGet(() -> Validated.invalid("document cursor not available")));
    }

    /**
     * A part which always produces the specified value.
     */
    public <T> DirectivePart<E, T> empty(T value) {
        return DirectivePart.of(context -> Validated.valid(value));
    }

    private static <E, T> Validated<Multipart<E, T>> split(DirectiveContext<E> context,
                                                          List<E> body,
                                                          List<? extends SeparatorDirective<E, ? extends T>> separators,
                                                          Map<String, SeparatorDirective<E, ? extends T>> byName) {
        var mainBody = new ArrayList<E>();
        var sections = new ArrayList<Section<E>>();
        for (var element : body) {
            if (element instanceof SeparatorInstance instance && byName.containsKey(instance.name())) {
                sections.add(new Section<>(instance, new ArrayList<>()));
            } else if (sections.isEmpty()) {
                mainBody.add(element);
            } else {
                sections.get(sections.size() - 1)
                        .elements()
                        .add(element);
            }
        }

        var errors = new ArrayList<String>();
        var children = new ArrayList<T>();
        for (var section : sections) {
            var separator = byName.get(section.instance()
                                            .name());
            var result = separator.part()
                                  .apply(context.forSeparator(section.instance(), section.elements()));
            if (result instanceof Validated.Invalid<?> invalid) {
                errors.add("One or more errors processing separator directive '" + separator.name() + "': " + invalid.message());
            } else {
                children.add(((Validated.Valid<? extends T>) result).value());
            }
        }
        for (var separator : separators) {
            var count = sections.stream()
                                .filter(section -> section.instance().name()
                                                                   .equals(separator.name()))
                                .count();
            if (count < separator.min()) {
                errors.add("too few occurrences of separator directive '" + separator.name() + "': expected min: "
                           + separator.min() + ", actual: " + count);
            }
            if (count > separator.max()) {
                errors.add("too many occurrences of separator directive '" + separator.name() + "': expected max: "
                           + separator.max() + ", actual: " + count);
            }
        }
        return errors.isEmpty()
               ? Validated.valid(new Multipart<>(mainBody, children))
               : Validated.invalid(errors);
    }

    private record Section<E>(SeparatorInstance instance, List<E> elements) {}
}
