package org.pragmatica.markup.directive;

import org.pragmatica.markup.parser.Validated;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * All attributes of a directive, for directives accepting arbitrary attributes.
 */
public record Attributes(List<String> positional, Map<String, String> named) {

    public Attributes {
        positional = List.copyOf(positional);
        named = Collections.unmodifiableMap(new LinkedHashMap<>(named));
    }

    public Optional<String> get(String name) {
        return Optional.ofNullable(named.get(name));
    }

    public Optional<String> get(int index) {
        return index >= 0 && index < positional.size()
               ? Optional.of(positional.get(index))
               : Optional.empty();
    }

    /**
     * The decoded value of the named attribute, or an error if it is missing or cannot be decoded.
     */
    public <T> Validated<T> get(String name, AttributeDecoder<T> decoder) {
        return get(name).map(decoder::decode)
                        .orElseGet(() -> Validated.invalid("required attribute '" + name + "' is missing"));
    }
}
