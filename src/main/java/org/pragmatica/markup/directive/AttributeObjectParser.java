package org.pragmatica.markup.directive;

import org.pragmatica.markup.parser.Pair;
import org.pragmatica.markup.parser.Parser;
import org.pragmatica.markup.parser.Parsers;
import org.pragmatica.markup.text.CharGroup;
import org.pragmatica.markup.text.TextParsers;

import java.util.List;

/**
 * Grammar for the members of an attribute object: {@code key = value} or {@code key: value} pairs
 * separated by commas or line breaks. Values are either quoted strings with backslash escapes,
 * arrays in square brackets kept as written, or unquoted text up to the next separator.
 *
 * <p>The parser stops in front of the closing brace, which is handled by the directive parser.
 */
public final class AttributeObjectParser {
    private AttributeObjectParser() {}

    private static final Parser<String> KEY = TextParsers.anyOf(CharGroup.ALPHA_NUM.add('-', '_', '.'))
                                                         .min(1);

    private static final Parser<String> QUOTED = TextParsers.literal("\"")
                                                            .keepRight(TextParsers.literal("\\")
                                                                                  .keepRight(TextParsers.oneChar())
                                                                                  .or(TextParsers.anyNot('"', '\\', '\n')
                                                                                                 .min(1))
                                                                                  .repeat()
                                                                                  .map(parts -> String.join("", parts)))
                                                            .keepLeft(TextParsers.literal("\""));

    private static final Parser<String> ARRAY = TextParsers.literal("[")
                                                           .then(TextParsers.anyNot(']')
                                                                            .then(TextParsers.literal("]")))
                                                           .source();

    private static final Parser<String> UNQUOTED = TextParsers.anyNot(',', '}', '\n', '\r')
                                                              .map(String::trim);

    private static final Parser<Pair<String, String>> MEMBER =
        TextParsers.wsOrNl()
                   .keepRight(KEY)
                   .keepLeft(TextParsers.ws())
                   .keepLeft(TextParsers.oneOf('=', ':'))
                   .keepLeft(TextParsers.ws())
                   .then(Parsers.choice(List.of(QUOTED, ARRAY, UNQUOTED)))
                   .keepLeft(TextParsers.ws());

    private static final Parser<String> SEPARATOR = Parsers.choice(List.of(TextParsers.literal(","),
                                                                           TextParsers.literal("\r\n"),
                                                                           TextParsers.literal("\n")));

    private static final Parser<List<Pair<String, String>>> MEMBERS = MEMBER.repeat(SEPARATOR)
                                                                            .keepLeft(TextParsers.oneOf(',')
                                                                                                 .optional())
                                                                            .keepLeft(TextParsers.wsOrNl());

    /**
     * All members of an attribute object, in declaration order, including duplicate keys.
     */
    public static Parser<List<Pair<String, String>>> members() {
        return MEMBERS;
    }
}
