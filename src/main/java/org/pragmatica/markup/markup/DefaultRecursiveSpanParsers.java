package org.pragmatica.markup.markup;

import org.pragmatica.markup.parser.ParseResult;
import org.pragmatica.markup.parser.Parser;
import org.pragmatica.markup.parser.ParserConfig;
import org.pragmatica.markup.parser.SourceCursor;
import org.pragmatica.markup.text.DelimitedText;
import org.pragmatica.markup.text.TextParsers;
import org.pragmatica.markup.tree.InvalidSpan;
import org.pragmatica.markup.tree.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Recursive span parsing based on a map of span parsers by start character.
 */
public abstract class DefaultRecursiveSpanParsers implements RecursiveSpanParsers {
    private static final Logger log = LoggerFactory.getLogger(DefaultRecursiveSpanParsers.class);

    static final String NEST_LEVEL_EXCEEDED = "Maximum nest level exceeded";

    private final ParserConfig config;
    private final Parser<List<Span>> defaultSpanParser;

    protected DefaultRecursiveSpanParsers(ParserConfig config) {
        this.config = config;
        this.defaultSpanParser = InlineParsers.spans(DelimitedText.UNDELIMITED, this::spanParsers, config.maxNestLevel());
    }

    /**
     * All span parsers available in nested content, by start character.
     */
    protected abstract Map<Character, Parser<Span>> spanParsers();

    @Override
    public ParserConfig config() {
        return config;
    }

    @Override
    public Parser<List<Span>> recursiveSpans(Parser<String> textParser) {
        if (textParser instanceof DelimitedText delimited) {
            return delimitedRecursiveSpans(delimited);
        }
        return reparse(textParser, defaultSpanParser);
    }

    @Override
    public Parser<List<Span>> recursiveSpans() {
        return defaultSpanParser;
    }

    @Override
    public Parser<List<Span>> delimitedRecursiveSpans(DelimitedText textParser) {
        return InlineParsers.spans(textParser, this::spanParsers, config.maxNestLevel());
    }

    @Override
    public Parser<List<Span>> delimitedRecursiveSpans(DelimitedText textParser, Map<Character, Parser<Span>> additionalParsers) {
        return InlineParsers.spans(textParser, () -> withAdditional(additionalParsers), config.maxNestLevel());
    }

    @Override
    public Function<String, List<Span>> spanParserFunction(int nestLevel) {
        return source -> {
            if (nestLevel >= config.maxNestLevel()) {
                log.warn("Maximum nest level {} reached, not parsing nested spans", config.maxNestLevel());
                return List.of(new InvalidSpan(NEST_LEVEL_EXCEEDED, source));
            }
            var result = defaultSpanParser.parse(SourceCursor.of(source, nestLevel + 1));
            if (result instanceof ParseResult.Failure<List<Span>> failure) {
                return List.of(new InvalidSpan(failure.message(), source));
            }
            return ((ParseResult.Success<List<Span>>) result).value();
        };
    }

    // === Escapes ===

    @Override
    public Parser<String> escapeSequence() {
        return TextParsers.literal("\\")
                          .keepRight(escapedChar());
    }

    @Override
    public Parser<String> escapedText(DelimitedText textParser) {
        var escapes = Map.of('\\', escapeSequence());
        return InlineParsers.text(textParser, () -> escapes, config.maxNestLevel());
    }

    @Override
    public Parser<String> escapedUntil(char... chars) {
        return escapedText(TextParsers.delimitedBy(chars)
                                      .nonEmpty());
    }

    /**
     * Parse the text produced by the first parser with the second one, one nest level deeper.
     */
    protected <T> Parser<T> reparse(Parser<String> textParser, Parser<T> contentParser) {
        return in -> {
            var text = textParser.parse(in);
            if (text instanceof ParseResult.Failure<String> failure) {
                return failure.cast();
            }
            var success = (ParseResult.Success<String>) text;
            if (in.nestLevel() >= config.maxNestLevel()) {
                log.warn("Maximum nest level {} reached at {}", config.maxNestLevel(), in.location());
                return ParseResult.Failure.at(in, NEST_LEVEL_EXCEEDED);
            }
            var content = contentParser.parse(SourceCursor.of(success.value(), in.nestLevel() + 1));
            if (content instanceof ParseResult.Failure<T> failure) {
                return ParseResult.Failure.at(in, failure.message());
            }
            return ParseResult.Success.of(((ParseResult.Success<T>) content).value(), success.next());
        };
    }

    private Map<Character, Parser<Span>> withAdditional(Map<Character, Parser<Span>> additionalParsers) {
        var merged = new HashMap<>(spanParsers());
        additionalParsers.forEach((c, parser) -> merged.merge(c, parser, (existing, additional) -> additional.or(existing)));
        return merged;
    }
}
