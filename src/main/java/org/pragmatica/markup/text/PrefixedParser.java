package org.pragmatica.markup.text;

import org.pragmatica.markup.parser.Message;
import org.pragmatica.markup.parser.ParseResult;
import org.pragmatica.markup.parser.Parser;
import org.pragmatica.markup.parser.SourceCursor;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Function;

/**
 * A parser which can only succeed when the input starts with one of a known set of characters.
 *
 * <p>The parser fails immediately, without invoking the underlying parser, on any other
 * character and at the end of input. This allows dispatching to it by looking at a
 * single character.
 */
public final class PrefixedParser<T> implements Parser<T> {
    private final Set<Character> startChars;
    private final Parser<T> underlying;

    private PrefixedParser(Set<Character> startChars, Parser<T> underlying) {
        if (startChars.isEmpty()) {
            throw new IllegalArgumentException("a prefixed parser needs at least one start character");
        }
        this.startChars = Set.copyOf(startChars);
        this.underlying = underlying;
    }

    public static <T> PrefixedParser<T> of(char startChar, Parser<T> parser) {
        return new PrefixedParser<>(Set.of(startChar), parser);
    }

    public static <T> PrefixedParser<T> of(Set<Character> startChars, Parser<T> parser) {
        return new PrefixedParser<>(startChars, parser);
    }

    /**
     * A literal is prefixed by its first character.
     */
    public static PrefixedParser<String> literal(String expected) {
        return of(expected.charAt(0), TextParsers.literal(expected));
    }

    public static <T> PrefixedParser<T> of(String startChars, Parser<T> parser) {
        var set = new LinkedHashSet<Character>();
        for (char c : startChars.toCharArray()) {
            set.add(c);
        }
        return new PrefixedParser<>(set, parser);
    }

    public Set<Character> startChars() {
        return startChars;
    }

    @Override
    public ParseResult<T> parse(SourceCursor in) {
        if (in.atEnd()) {
            return ParseResult.Failure.at(in, Message.UNEXPECTED_EOF);
        }
        char c = in.peek();
        if (!startChars.contains(c)) {
            return ParseResult.Failure.at(in, Message.forRuntimeValue(c, found -> "unexpected start character '" + found + "'"));
        }
        return underlying.parse(in);
    }

    @Override
    public <U> PrefixedParser<U> map(Function<? super T, ? extends U> f) {
        return new PrefixedParser<>(startChars, underlying.map(f));
    }

    /**
     * Try this parser first, and the specified one if this parser fails. The start characters
     * of the result are the union of both.
     */
    public PrefixedParser<T> orElse(PrefixedParser<T> other) {
        var union = new HashSet<>(startChars);
        union.addAll(other.startChars);
        return new PrefixedParser<>(union, this.or(other));
    }
}
