package org.pragmatica.markup.directive;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A parsed but not yet validated directive occurrence.
 *
 * @param name the directive name
 * @param positional the positional attributes in declaration order
 * @param named the named attributes in declaration order, the first occurrence of a key wins
 * @param errors problems found while parsing the declaration, reported when the directive is processed
 * @param body the raw body, if present
 * @param fence the closing fence of the body
 */
public record DirectiveDeclaration(String name,
                                   List<String> positional,
                                   Map<String, String> named,
                                   List<String> errors,
                                   Optional<String> body,
                                   String fence) {
    public static final String DEFAULT_FENCE = "@:@";

    public DirectiveDeclaration {
        positional = List.copyOf(positional);
        named = Collections.unmodifiableMap(new LinkedHashMap<>(named));
        errors = List.copyOf(errors);
    }

    public static DirectiveDeclaration of(String name) {
        return new DirectiveDeclaration(name, List.of(), Map.of(), List.of(), Optional.empty(), DEFAULT_FENCE);
    }

    public DirectiveDeclaration withBody(Optional<String> newBody) {
        return new DirectiveDeclaration(name, positional, named, errors, newBody, fence);
    }
}
