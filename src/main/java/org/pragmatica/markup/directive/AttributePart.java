package org.pragmatica.markup.directive;

import org.pragmatica.markup.parser.Validated;

import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * A single positional or named attribute, decoded with an {@link AttributeDecoder}. Attributes are
 * required and decoded as strings unless specified otherwise.
 *
 * <p>Example usage:
 * <pre>{@code
 * DirectivePart<Span, Optional<Integer>> width = Spans.dsl().attribute("width").as(AttributeDecoder.INT).optional();
 * }</pre>
 */
public final class AttributePart<E, T> extends DirectivePart<E, T> {
    private final Function<DirectiveDeclaration, Optional<String>> lookup;
    private final String description;
    private final AttributeDecoder<T> decoder;

    private AttributePart(Function<DirectiveDeclaration, Optional<String>> lookup, String description, AttributeDecoder<T> decoder) {
        super(context -> required(lookup, description, decoder, context.declaration()), false, false, Set.of());
        this.lookup = lookup;
        this.description = description;
        this.decoder = decoder;
    }

    private static final String POSITIONAL = "positional attribute at index ";

    static <E> AttributePart<E, String> positional(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Attribute index must not be negative: " + index);
        }
        Function<DirectiveDeclaration, Optional<String>> lookup = declaration -> index < declaration.positional()
                                                                                                   .size()
                                                                                 ? Optional.of(declaration.positional()
                                                                                                          .get(index))
                                                                                 : Optional.empty();
        return new AttributePart<>(lookup, POSITIONAL + index, AttributeDecoder.STRING);
    }

    static <E> AttributePart<E, String> named(String name) {
        return new AttributePart<>(declaration -> Optional.ofNullable(declaration.named()
                                                                                 .get(name)),
                                   "attribute '" + name + "'",
                                   AttributeDecoder.STRING);
    }

    /**
     * Decodes the attribute with the specified decoder instead of keeping the raw string.
     */
    public <U> AttributePart<E, U> as(AttributeDecoder<U> newDecoder) {
        return new AttributePart<>(lookup, description, newDecoder);
    }

    /**
     * Makes the attribute optional. Conversion errors of a present value are still reported.
     */
    public DirectivePart<E, Optional<T>> optional() {
        return DirectivePart.of(context -> lookup.apply(context.declaration())
                                                 .map(raw -> decode(decoder, description, raw).map(Optional::of))
                                                 .orElseGet(() -> Validated.valid(Optional.empty())));
    }

    /**
     * Whether the error message reports a missing or malformed positional attribute.
     */
    static boolean isPositionalError(String error) {
        return error.startsWith("required " + POSITIONAL) || error.startsWith("error converting " + POSITIONAL);
    }

    private static <T> Validated<T> required(Function<DirectiveDeclaration, Optional<String>> lookup,
                                             String description,
                                             AttributeDecoder<T> decoder,
                                             DirectiveDeclaration declaration) {
        return lookup.apply(declaration)
                     .map(raw -> decode(decoder, description, raw))
                     .orElseGet(() -> Validated.invalid("required " + description + " is missing"));
    }

    private static <T> Validated<T> decode(AttributeDecoder<T> decoder, String description, String raw) {
        var result = decoder.decode(raw);
        if (result instanceof Validated.Invalid<T> invalid) {
            return Validated.invalid("error converting " + description + ": " + invalid.message());
        }
        return result;
    }
}
