package org.pragmatica.markup.text;

import org.pragmatica.markup.parser.ParseResult;
import org.pragmatica.markup.parser.SourceCursor;

import java.util.HashSet;
import java.util.Set;

/**
 * Combines the start characters of nested spans with the end delimiter of the enclosing span.
 *
 * <p>The end delimiter is checked first, so a character which both ends the span and starts
 * a nested span ends the span.
 */
public final class InlineDelimiter implements Delimiter<InlineResult> {
    private final Set<Character> nestedChars;
    private final TextDelimiter endDelimiter;
    private final Set<Character> startChars;

    public InlineDelimiter(Set<Character> nestedChars, TextDelimiter endDelimiter) {
        this.nestedChars = Set.copyOf(nestedChars);
        this.endDelimiter = endDelimiter;

        var all = new HashSet<>(nestedChars);
        all.addAll(endDelimiter.startChars());
        this.startChars = Set.copyOf(all);
    }

    @Override
    public Set<Character> startChars() {
        return startChars;
    }

    @Override
    public DelimiterResult<InlineResult> atStartChar(char startChar, int charsConsumed, SourceCursor cursor) {
        if (endDelimiter.startChars()
                        .contains(startChar)) {
            var end = endDelimiter.atStartChar(startChar, charsConsumed, cursor);
            if (end instanceof DelimiterResult.Complete<String> complete) {
                return DelimiterResult.complete(complete.result()
                                                        .map(InlineResult.EndDelimiter::new));
            }
        }
        if (nestedChars.contains(startChar)) {
            var nested = new InlineResult.NestedDelimiter(startChar, cursor.capture(charsConsumed));
            return DelimiterResult.complete(ParseResult.Success.of(nested, cursor.consume(charsConsumed)));
        }
        return DelimiterResult.proceed();
    }

    @Override
    public ParseResult<InlineResult> atEOF(int charsConsumed, SourceCursor cursor) {
        return endDelimiter.atEOF(charsConsumed, cursor)
                           .map(InlineResult.EndDelimiter::new);
    }
}
