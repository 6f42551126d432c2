package org.pragmatica.markup.markup;

import org.pragmatica.markup.parser.Message;
import org.pragmatica.markup.parser.ParseResult;
import org.pragmatica.markup.parser.Parser;
import org.pragmatica.markup.parser.Parsers;
import org.pragmatica.markup.parser.SourceCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines many parsers into one which selects its candidates by looking at a single character.
 */
public final class PrefixedDispatch<T> implements Parser<T> {
    private static final Logger log = LoggerFactory.getLogger(PrefixedDispatch.class);

    private final Map<Character, Parser<T>> groups;
    private final Parser<T> fallback;

    private PrefixedDispatch(Map<Character, Parser<T>> groups, Parser<T> fallback) {
        this.groups = groups;
        this.fallback = fallback;
    }

    /**
     * Order parser definitions of the host format and its extensions by precedence:
     * extension high, host high, host low, extension low. Relative order within each
     * tier is the registration order.
     */
    public static <T> List<ParserDefinition<T>> order(List<ParserDefinition<T>> host, List<ParserDefinition<T>> extensions) {
        var result = new ArrayList<ParserDefinition<T>>(host.size() + extensions.size());
        addWithPrecedence(result, extensions, Precedence.HIGH);
        addWithPrecedence(result, host, Precedence.HIGH);
        addWithPrecedence(result, host, Precedence.LOW);
        addWithPrecedence(result, extensions, Precedence.LOW);
        return result;
    }

    /**
     * Group the prefixed definitions by start character, combining the parsers of each group by
     * ordered alternation. Unprefixed definitions are not allowed.
     */
    public static <T> Map<Character, Parser<T>> mergeByChar(List<ParserDefinition<T>> definitions) {
        var grouped = new LinkedHashMap<Character, List<Parser<T>>>();
        for (var definition : definitions) {
            if (!definition.isPrefixed()) {
                throw new IllegalArgumentException("Parser without start characters can not be dispatched by character");
            }
            for (var c : definition.startChars()) {
                grouped.computeIfAbsent(c, key -> new ArrayList<>())
                       .add(definition.parser());
            }
        }
        var result = new HashMap<Character, Parser<T>>();
        grouped.forEach((c, parsers) -> result.put(c, Parsers.choice(parsers)));
        return Map.copyOf(result);
    }

    /**
     * Merge all definitions into a single parser. The group for the current character is tried
     * first, the unprefixed definitions are tried when there is no such group or when it fails.
     */
    public static <T> PrefixedDispatch<T> merge(List<ParserDefinition<T>> definitions) {
        var prefixed = new ArrayList<ParserDefinition<T>>();
        var unprefixed = new ArrayList<Parser<T>>();
        for (var definition : definitions) {
            if (definition.isPrefixed()) {
                prefixed.add(definition);
            } else {
                unprefixed.add(definition.parser());
            }
        }
        var groups = mergeByChar(prefixed);
        var fallback = unprefixed.isEmpty()
                       ? null
                       : Parsers.choice(unprefixed);
        log.debug("Merged {} parser definitions into {} start character groups, {} unprefixed",
                  definitions.size(), groups.size(), unprefixed.size());
        return new PrefixedDispatch<>(groups, fallback);
    }

    public Map<Character, Parser<T>> groups() {
        return groups;
    }

    @Override
    public ParseResult<T> parse(SourceCursor in) {
        var group = in.atEnd()
                    ? null
                    : groups.get(in.peek());
        if (group == null) {
            return fallback == null
                   ? ParseResult.Failure.at(in, noParserAvailable(in))
                   : fallback.parse(in);
        }
        var result = group.parse(in);
        if (result.isSuccess() || fallback == null) {
            return result;
        }
        var fallbackResult = fallback.parse(in);
        if (fallbackResult instanceof ParseResult.Failure<T> fallbackFailure) {
            var groupFailure = (ParseResult.Failure<T>) result;
            return fallbackFailure.maxOffset() > groupFailure.maxOffset()
                   ? fallbackFailure
                   : groupFailure.withMaxOffset(fallbackFailure.maxOffset());
        }
        return fallbackResult;
    }

    private static Message noParserAvailable(SourceCursor in) {
        return in.atEnd()
               ? Message.UNEXPECTED_EOF
               : Message.forRuntimeValue(in.peek(), c -> "No parser available for start character '" + c + "'");
    }

    private static <T> void addWithPrecedence(List<ParserDefinition<T>> target, List<ParserDefinition<T>> source, Precedence precedence) {
        source.stream()
              .filter(definition -> definition.precedence() == precedence)
              .forEach(target::add);
    }
}
