package org.pragmatica.markup.markup;

import org.pragmatica.markup.parser.ParserConfig;
import org.pragmatica.markup.parser.Parser;
import org.pragmatica.markup.text.DelimitedText;
import org.pragmatica.markup.tree.Span;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Parsers for inline markup which contains nested spans of the host format.
 */
public interface RecursiveSpanParsers extends EscapedTextParsers {

    /**
     * Parses the text produced by the specified parser as spans. A {@link DelimitedText} is parsed in a
     * single pass, any other parser first produces the text which is then parsed as spans.
     */
    Parser<List<Span>> recursiveSpans(Parser<String> textParser);

    /**
     * Parses spans up to the end of input.
     */
    Parser<List<Span>> recursiveSpans();

    Parser<List<Span>> delimitedRecursiveSpans(DelimitedText textParser);

    /**
     * Parses spans with the specified parsers available in addition to those of the host format.
     * Additional parsers take precedence.
     */
    Parser<List<Span>> delimitedRecursiveSpans(DelimitedText textParser, Map<Character, Parser<Span>> additionalParsers);

    /**
     * A function parsing strings as spans, as used by directives re-parsing their body. The function never fails,
     * a failure becomes an invalid span.
     *
     * @param nestLevel the nest level of the string to parse
     */
    Function<String, List<Span>> spanParserFunction(int nestLevel);

    ParserConfig config();
}
