package org.pragmatica.markup.directive;

import org.pragmatica.markup.markup.EscapedTextParsers;
import org.pragmatica.markup.parser.Pair;
import org.pragmatica.markup.parser.ParseResult;
import org.pragmatica.markup.parser.Parser;
import org.pragmatica.markup.parser.Parsers;
import org.pragmatica.markup.text.PrefixedParser;
import org.pragmatica.markup.text.TextParsers;
import org.pragmatica.markup.tree.Span;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Parsers for the textual shape of directives, shared by block, span and template directives.
 *
 * <p>A directive is written as
 * <pre>{@code
 * @:name(positional, "quoted") { key = value, other = "quoted value" } body @:@
 * }</pre>
 * where the attribute list, the attribute object and the body are all optional.
 */
public final class DirectiveParsers {
    private DirectiveParsers() {}

    /**
     * Parses a directive declaration with all its attributes, but without the body.
     *
     * @param escapes the escape rules of the host format, applied to positional attributes
     * @param supportsCustomFence whether a custom closing fence of up to three characters may follow the attributes
     */
    public static Parser<DirectiveDeclaration> declaration(EscapedTextParsers escapes, boolean supportsCustomFence) {
        var name = TextParsers.literal("@:")
                              .keepRight(TextParsers.nameDecl());
        return name.then(positionalAttributes(escapes).optional())
                   .then(attributeSection().optional())
                   .then(fence(supportsCustomFence))
                   .map(parsed -> declaration(parsed.first()
                                                    .first()
                                                    .first(),
                                              parsed.first()
                                                    .first()
                                                    .second()
                                                    .orElse(List.of()),
                                              parsed.first()
                                                    .second(),
                                              parsed.second()));
    }

    /**
     * Parses a complete directive: the declaration followed by the body parsed by the parser the
     * specified function creates for the declaration.
     */
    public static Parser<DirectiveDeclaration> directiveParser(Function<DirectiveDeclaration, Parser<Optional<String>>> body,
                                                               EscapedTextParsers escapes,
                                                               boolean supportsCustomFence) {
        return declaration(escapes, supportsCustomFence).flatMap(declaration -> body.apply(declaration)
                                                                                    .map(declaration::withBody));
    }

    /**
     * Parses a complete inline directive. The body parser yields the parsed body together with its
     * raw text, so the body is parsed only once.
     */
    public static Parser<Pair<DirectiveDeclaration, Optional<List<Span>>>> inlineDirectiveParser(Function<DirectiveDeclaration, Parser<Optional<Pair<List<Span>, String>>>> body,
                                                                                                   EscapedTextParsers escapes) {
        return declaration(escapes, false).flatMap(declaration -> body.apply(declaration)
                                                                      .map(parsed -> Pair.of(declaration.withBody(parsed.map(Pair::second)),
                                                                                             parsed.map(Pair::first))));
    }

    /**
     * Parses a context reference, written as {@code ${key}}, or {@code ${?key}} when optional.
     *
     * @param reference creates the node from key and required flag
     */
    public static <T> PrefixedParser<T> contextReference(BiFunction<String, Boolean, T> reference) {
        var key = TextParsers.anyNot('}', '\n')
                             .min(1)
                             .map(String::trim);
        var parser = TextParsers.literal("${")
                                .keepRight(TextParsers.literal("?")
                                                      .optional())
                                .then(key)
                                .keepLeft(TextParsers.literal("}"))
                                .map(parsed -> reference.apply(parsed.second(), parsed.first()
                                                                                      .isEmpty()));
        return PrefixedParser.of('$', parser);
    }

    // === Declaration parts ===

    private static Parser<List<String>> positionalAttributes(EscapedTextParsers escapes) {
        var quoted = TextParsers.ws()
                                .keepRight(TextParsers.literal("\""))
                                .keepRight(escapes.escapedText(TextParsers.delimitedBy('"')))
                                .keepLeft(TextParsers.ws());
        var unquoted = escapes.escapedText(TextParsers.delimitedBy(',', ')')
                                                      .keepDelimiter())
                              .map(String::trim);
        var value = quoted.or(unquoted);
        return TextParsers.ws()
                          .keepRight(TextParsers.literal("("))
                          .keepRight(value.repeat(TextParsers.literal(",")))
                          .keepLeft(TextParsers.literal(")"))
                          .map(DirectiveParsers::withoutSingleEmptyValue);
    }

    private static List<String> withoutSingleEmptyValue(List<String> values) {
        return values.size() == 1 && values.get(0)
                                           .isEmpty()
               ? List.of()
               : values;
    }

    /**
     * The attribute object, with the error for a missing closing brace.
     */
    private static Parser<Pair<List<Pair<String, String>>, Optional<String>>> attributeSection() {
        Parser<Optional<String>> closingBrace = in -> {
            var result = TextParsers.literal("}")
                                    .parse(in);
            if (result instanceof ParseResult.Success<String> success) {
                return ParseResult.Success.of(Optional.empty(), success.next());
            }
            return ParseResult.Success.of(Optional.of("Missing closing brace for attribute section"), in);
        };
        return TextParsers.ws()
                          .keepRight(TextParsers.literal("{"))
                          .keepRight(AttributeObjectParser.members())
                          .then(closingBrace);
    }

    private static Parser<String> fence(boolean supportsCustomFence) {
        var defaultFence = Parsers.success(DirectiveDeclaration.DEFAULT_FENCE);
        if (!supportsCustomFence) {
            return defaultFence;
        }
        var customFence = TextParsers.ws()
                                     .keepRight(TextParsers.anyNot(' ', '\t', '\n', '\r')
                                                           .min(1)
                                                           .max(3))
                                     .keepLeft(Parsers.lookAhead(TextParsers.wsEol()));
        return customFence.or(defaultFence);
    }

    private static DirectiveDeclaration declaration(String name,
                                                    List<String> positional,
                                                    Optional<Pair<List<Pair<String, String>>, Optional<String>>> attributes,
                                                    String fence) {
        var named = new LinkedHashMap<String, String>();
        var errors = new ArrayList<String>();
        attributes.ifPresent(section -> {
            for (var member : section.first()) {
                if (named.containsKey(member.first())) {
                    errors.add("Duplicate attribute '" + member.first() + "'");
                } else {
                    named.put(member.first(), member.second());
                }
            }
            section.second()
                   .ifPresent(errors::add);
        });
        return new DirectiveDeclaration(name, positional, named, errors, Optional.empty(), fence);
    }
}
