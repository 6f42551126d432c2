package org.pragmatica.markup.text;

import org.pragmatica.markup.parser.ParseResult;
import org.pragmatica.markup.parser.Parser;
import org.pragmatica.markup.parser.SourceCursor;

/**
 * Parser for text up to a {@link TextDelimiter}.
 *
 * <p>Besides being a parser on its own, the delimiter of this parser is used by the recursive
 * inline parsers, which combine it with the start characters of nested spans.
 */
public final class DelimitedText implements Parser<String> {
    /**
     * Consumes all remaining input.
     */
    public static final DelimitedText UNDELIMITED = new DelimitedText(TextDelimiter.undelimited());

    private final TextDelimiter delimiter;
    private final DelimitedScanner<String> scanner;

    public DelimitedText(TextDelimiter delimiter) {
        this.delimiter = delimiter;
        this.scanner = new DelimitedScanner<>(delimiter);
    }

    public TextDelimiter delimiter() {
        return delimiter;
    }

    public DelimitedText acceptEOF() {
        return new DelimitedText(delimiter.acceptEOF());
    }

    public DelimitedText nonEmpty() {
        return new DelimitedText(delimiter.nonEmpty());
    }

    public DelimitedText keepDelimiter() {
        return new DelimitedText(delimiter.keepDelimiter());
    }

    public DelimitedText failOn(char... chars) {
        return new DelimitedText(delimiter.failOn(chars));
    }

    public DelimitedText withPostCondition(Parser<?> condition) {
        return new DelimitedText(delimiter.withPostCondition(condition));
    }

    @Override
    public ParseResult<String> parse(SourceCursor in) {
        return scanner.parse(in);
    }
}
