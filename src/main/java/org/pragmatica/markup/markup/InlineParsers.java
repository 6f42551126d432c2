package org.pragmatica.markup.markup;

import org.pragmatica.markup.parser.Parser;
import org.pragmatica.markup.text.DelimitedText;
import org.pragmatica.markup.tree.Span;
import org.pragmatica.markup.tree.SpanSequence;
import org.pragmatica.markup.tree.Text;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Factories for the two flavors of {@link InlineParser}: one producing spans and one producing text.
 */
public final class InlineParsers {
    private InlineParsers() {}

    private static final InlineParser.Accumulator<Span, List<Span>> SPANS = new InlineParser.Accumulator<>() {
        @Override
        public Span fromText(String text) {
            return new Text(text);
        }

        @Override
        public boolean isEmpty(Span element) {
            return element instanceof SpanSequence sequence && sequence.isEmpty();
        }

        @Override
        public List<Span> result(List<Span> elements) {
            return List.copyOf(elements);
        }
    };

    private static final InlineParser.Accumulator<String, String> TEXT = new InlineParser.Accumulator<>() {
        @Override
        public String fromText(String text) {
            return text;
        }

        @Override
        public boolean isEmpty(String element) {
            return element.isEmpty();
        }

        @Override
        public String mergeableText(String element) {
            return element;
        }

        @Override
        public String result(List<String> elements) {
            return String.join("", elements);
        }
    };

    /**
     * Parses spans up to the end of the specified text parser.
     *
     * @param textParser the parser for the text between nested spans, its delimiter ends the span
     * @param spanParsers the parsers for nested spans by start character, resolved on first use
     * @param maxNestLevel the nest level at which nested parsers are no longer invoked
     */
    public static Parser<List<Span>> spans(DelimitedText textParser, Supplier<Map<Character, Parser<Span>>> spanParsers, int maxNestLevel) {
        return new InlineParser<>(textParser, spanParsers, SPANS, maxNestLevel);
    }

    /**
     * Parses text up to the end of the specified text parser, replacing the input matched by
     * nested parsers with their results.
     */
    public static Parser<String> text(DelimitedText textParser, Supplier<Map<Character, Parser<String>>> nested, int maxNestLevel) {
        return new InlineParser<>(textParser, nested, TEXT, maxNestLevel);
    }
}
