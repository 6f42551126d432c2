package org.pragmatica.markup.text;

import org.pragmatica.markup.parser.ParseResult;
import org.pragmatica.markup.parser.Parser;
import org.pragmatica.markup.parser.SourceCursor;

/**
 * Scans input until the delimiter completes or the input ends.
 */
public final class DelimitedScanner<T> implements Parser<T> {
    private final Delimiter<T> delimiter;
    private final CharPredicate startChars;

    public DelimitedScanner(Delimiter<T> delimiter) {
        this.delimiter = delimiter;
        this.startChars = CharPredicate.anyOf(delimiter.startChars());
    }

    public Delimiter<T> delimiter() {
        return delimiter;
    }

    @Override
    public ParseResult<T> parse(SourceCursor in) {
        var source = in.input();
        int start = in.offset();
        int offset = start;

        while (offset < source.length()) {
            char c = source.charAt(offset);
            if (startChars.test(c)) {
                var result = delimiter.atStartChar(c, offset - start, in);
                if (result instanceof DelimiterResult.Complete<T> complete) {
                    return complete.result();
                }
            }
            offset++;
        }
        return delimiter.atEOF(offset - start, in);
    }
}
