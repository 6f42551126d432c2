package org.pragmatica.markup.directive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The directives of one family by name, together with the names of all separators their bodies
 * may contain. Immutable once built.
 */
public final class DirectiveRegistry<E> {
    private static final Logger log = LoggerFactory.getLogger(DirectiveRegistry.class);

    private final DirectiveFamily<E> family;
    private final Map<String, Directive<E>> directives;
    private final Set<String> separators;

    private DirectiveRegistry(DirectiveFamily<E> family, Map<String, Directive<E>> directives, Set<String> separators) {
        this.family = family;
        this.directives = directives;
        this.separators = separators;
    }

    /**
     * Registers the specified directives. When two directives share a name, the later one wins.
     */
    public static <E> DirectiveRegistry<E> of(DirectiveFamily<E> family, List<Directive<E>> directives) {
        var byName = new LinkedHashMap<String, Directive<E>>();
        var separators = new HashSet<String>();
        for (var directive : directives) {
            if (byName.put(directive.name(), directive) != null) {
                log.warn("Duplicate {} directive '{}', the last registration wins", family.description(), directive.name());
            }
            separators.addAll(directive.part()
                                       .separators());
        }
        log.debug("Registered {} {} directives {} with separators {}", byName.size(), family.description(), byName.keySet(), separators);
        return new DirectiveRegistry<>(family, Map.copyOf(byName), Set.copyOf(separators));
    }

    public DirectiveFamily<E> family() {
        return family;
    }

    public Optional<Directive<E>> directive(String name) {
        return Optional.ofNullable(directives.get(name));
    }

    public boolean isSeparator(String name) {
        return separators.contains(name);
    }

    /**
     * Whether the body of a directive with the specified name should be parsed. Separators and
     * unknown directives have no body.
     */
    public boolean hasBody(String name) {
        return !isSeparator(name) && directive(name).map(Directive::hasBody)
                                                    .orElse(false);
    }
}
