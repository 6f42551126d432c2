package org.pragmatica.markup.directive;

import org.pragmatica.markup.parser.Pair;
import org.pragmatica.markup.parser.Parser;
import org.pragmatica.markup.parser.Validated;
import org.pragmatica.markup.text.PrefixedParser;
import org.pragmatica.markup.tree.Span;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.IntFunction;

/**
 * Turns parsed directive declarations into elements of the directive family.
 *
 * <p>Processing never fails: unknown directives and directives with invalid attributes or bodies
 * become invalid nodes which keep the original markup.
 */
public final class DirectiveProcessor<E> {
    private final DirectiveRegistry<E> registry;

    public DirectiveProcessor(DirectiveRegistry<E> registry) {
        this.registry = registry;
    }

    /**
     * Creates the node for the specified declaration.
     *
     * @param source the original markup of the directive
     * @param bodyParser parses the body into elements of the family
     */
    public E process(DirectiveDeclaration declaration, String source, Function<String, List<E>> bodyParser) {
        return process(declaration, source, bodyParser, Optional.empty());
    }

    /**
     * Creates the node for the specified declaration whose body may already be parsed.
     */
    public E process(DirectiveDeclaration declaration,
                     String source,
                     Function<String, List<E>> bodyParser,
                     Optional<List<E>> parsedBody) {
        var family = registry.family();
        var trimmedSource = source.stripTrailing();
        if (registry.isSeparator(declaration.name())) {
            return family.separatorInstance(declaration, trimmedSource);
        }
        var context = DirectiveContext.of(declaration, trimmedSource, bodyParser, parsedBody);
        return registry.directive(declaration.name())
                       .map(directive -> directive.requiresCursor()
                                         ? family.deferred(cursor -> evaluate(directive, context.withCursor(cursor)), trimmedSource)
                                         : evaluate(directive, context))
                       .orElseGet(() -> family.invalid(errorMessage(declaration.name(),
                                                                    List.of("No " + family.description() + " directive registered with name: "
                                                                            + declaration.name())),
                                                       trimmedSource));
    }

    /**
     * A parser for complete directives starting with {@code @:}.
     *
     * @param declaration the parser for the directive including its body
     * @param bodyParsers creates the body parser for the nest level the directive was found at
     */
    public PrefixedParser<E> parser(Parser<DirectiveDeclaration> declaration, IntFunction<Function<String, List<E>>> bodyParsers) {
        var parser = declaration.withSource()
                                .withCursor()
                                .map(parsed -> process(parsed.first()
                                                             .first(),
                                                       parsed.first()
                                                             .second(),
                                                       bodyParsers.apply(parsed.second()
                                                                               .nestLevel())));
        return PrefixedParser.of('@', parser);
    }

    /**
     * A parser for inline directives whose body is parsed together with the declaration.
     *
     * @param directive the parser for the declaration and the parsed body
     * @param toElements converts the parsed body spans into elements of the family
     * @param bodyParsers creates the body parser for the nest level the directive was found at
     */
    public PrefixedParser<E> inlineParser(Parser<Pair<DirectiveDeclaration, Optional<List<Span>>>> directive,
                                          Function<List<Span>, List<E>> toElements,
                                          IntFunction<Function<String, List<E>>> bodyParsers) {
        var parser = directive.withSource()
                              .withCursor()
                              .map(parsed -> {
                                  var declared = parsed.first()
                                                       .first();
                                  return process(declared.first(),
                                                 parsed.first()
                                                       .second(),
                                                 bodyParsers.apply(parsed.second()
                                                                         .nestLevel()),
                                                 declared.second()
                                                         .map(toElements));
                              });
        return PrefixedParser.of('@', parser);
    }

    private E evaluate(Directive<E> directive, DirectiveContext<E> context) {
        var result = directive.apply(context);
        var errors = new ArrayList<>(result.errors());
        errors.addAll(leadingPositionalErrors(result.errors()), context.declaration()
                                                                      .errors());
        if (errors.isEmpty()) {
            return ((Validated.Valid<E>) result).value();
        }
        return registry.family()
                       .invalid(errorMessage(directive.name(), errors), context.source());
    }

    // Declaration errors concern the attribute section, so they follow the positional errors.
    private static int leadingPositionalErrors(List<String> errors) {
        int count = 0;
        while (count < errors.size() && AttributePart.isPositionalError(errors.get(count))) {
            count++;
        }
        return count;
    }

    private static String errorMessage(String name, List<String> errors) {
        return "One or more errors processing directive '" + name + "': " + String.join(", ", errors);
    }
}
