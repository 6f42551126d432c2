package org.pragmatica.markup.markup;

import org.pragmatica.markup.parser.Message;
import org.pragmatica.markup.parser.ParseResult;
import org.pragmatica.markup.parser.Parser;
import org.pragmatica.markup.parser.SourceCursor;
import org.pragmatica.markup.text.DelimitedScanner;
import org.pragmatica.markup.text.DelimitedText;
import org.pragmatica.markup.text.InlineDelimiter;
import org.pragmatica.markup.text.InlineResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Parses inline content up to the end delimiter of a {@link DelimitedText}, dispatching to nested
 * parsers at their start characters.
 *
 * <p>The text between nested elements is collected in a pending text buffer, together with the start
 * characters of nested parsers which failed. The buffer is flushed into a single text element whenever
 * a nested element is appended, so the result never contains two adjacent text elements created by
 * this parser. Nested elements reported as empty are dropped without flushing the buffer.
 *
 * <p>A nested parser which succeeds without consuming input, or which would exceed the maximum
 * nest level, is treated like a failed one. Only a failure of the end delimiter fails this parser.
 *
 * @param <E> the type of the nested elements
 * @param <R> the type of the result
 */
public final class InlineParser<E, R> implements Parser<R> {
    private static final Logger log = LoggerFactory.getLogger(InlineParser.class);

    private final DelimitedText textParser;
    private final Supplier<Map<Character, Parser<E>>> nestedSupplier;
    private final Accumulator<E, R> accumulator;
    private final int maxNestLevel;

    private volatile Map<Character, Parser<E>> nested;
    private volatile DelimitedScanner<InlineResult> scanner;

    /**
     * Strategy for turning text and nested elements into the result.
     */
    public interface Accumulator<E, R> {

        /**
         * The element for text collected by the inline parser.
         */
        E fromText(String text);

        /**
         * Whether a nested element should be dropped.
         */
        boolean isEmpty(E element);

        /**
         * Text to merge into the pending text, if the nested element should be merged.
         */
        default String mergeableText(E element) {
            return null;
        }

        R result(List<E> elements);
    }

    public InlineParser(DelimitedText textParser,
                        Supplier<Map<Character, Parser<E>>> nested,
                        Accumulator<E, R> accumulator,
                        int maxNestLevel) {
        this.textParser = textParser;
        this.nestedSupplier = nested;
        this.accumulator = accumulator;
        this.maxNestLevel = maxNestLevel;
    }

    @Override
    public ParseResult<R> parse(SourceCursor in) {
        var nestedParsers = nestedParsers();
        var textScanner = scanner;

        var elements = new ArrayList<E>();
        var pending = new StringBuilder();
        var current = in;

        while (true) {
            var scanned = textScanner.parse(current);
            if (scanned instanceof ParseResult.Failure<InlineResult> failure) {
                return new ParseResult.Failure<>(failure.msgProvider(), in, failure.maxOffset());
            }
            var success = (ParseResult.Success<InlineResult>) scanned;
            pending.append(success.value()
                                  .text());

            if (success.value() instanceof InlineResult.NestedDelimiter delimiter) {
                var position = success.next();
                var result = parseNested(nestedParsers.get(delimiter.startChar()), position);

                if (result instanceof ParseResult.Success<E> element) {
                    append(elements, pending, element.value());
                    current = element.next();
                } else {
                    pending.append(delimiter.startChar());
                    current = position.consume(1);
                }
            } else {
                flush(elements, pending);
                return ParseResult.Success.of(accumulator.result(elements), success.next());
            }
        }
    }

    private ParseResult<E> parseNested(Parser<E> parser, SourceCursor position) {
        int outer = position.nestLevel();
        if (outer >= maxNestLevel) {
            log.warn("Maximum nest level {} reached at {}, parsing nested markup as text", maxNestLevel, position.location());
            return ParseResult.Failure.at(position, Message.fixed("Maximum nest level exceeded"));
        }
        var result = parser.parse(position.nested());
        if (result instanceof ParseResult.Success<E> success) {
            if (success.next()
                       .offset() <= position.offset()) {
                return ParseResult.Failure.at(position, Message.fixed("Nested parser did not consume any input"));
            }
            return ParseResult.Success.of(success.value(), success.next()
                                                                  .withNestLevel(outer));
        }
        return result;
    }

    private void append(List<E> elements, StringBuilder pending, E element) {
        if (accumulator.isEmpty(element)) {
            return;
        }
        var text = accumulator.mergeableText(element);
        if (text != null) {
            pending.append(text);
            return;
        }
        flush(elements, pending);
        elements.add(element);
    }

    private void flush(List<E> elements, StringBuilder pending) {
        if (pending.length() > 0) {
            elements.add(accumulator.fromText(pending.toString()));
            pending.setLength(0);
        }
    }

    // Racy but idempotent: nested parsers are resolved on first use to allow recursive definitions.
    private Map<Character, Parser<E>> nestedParsers() {
        var current = nested;
        if (current == null) {
            current = Map.copyOf(nestedSupplier.get());
            scanner = new DelimitedScanner<>(new InlineDelimiter(current.keySet(), textParser.delimiter()));
            nested = current;
        }
        return current;
    }
}
