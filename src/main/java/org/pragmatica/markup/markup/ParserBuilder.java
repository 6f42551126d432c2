package org.pragmatica.markup.markup;

import org.pragmatica.markup.parser.Parser;
import org.pragmatica.markup.text.PrefixedParser;

import java.util.Set;
import java.util.function.Function;

/**
 * Creates the definition of a block or span parser once the recursive parsers of the
 * host format are available.
 *
 * <p>Example usage:
 * <pre>{@code
 * ParserBuilder<Span> emphasis = ParserBuilder.prefixedRecursive(recursive ->
 *     PrefixedParser.of('*', literal("*").keepRight(recursive.delimitedRecursiveSpans(delimitedBy('*')))
 *                                        .map(Emphasized::new)));
 * }</pre>
 */
public final class ParserBuilder<T> {
    private final Function<RecursiveParsers, Parser<T>> factory;
    private final Function<Parser<T>, Set<Character>> startChars;
    private final boolean recursive;
    private final Precedence precedence;
    private final BlockPosition position;

    private ParserBuilder(Function<RecursiveParsers, Parser<T>> factory,
                          Function<Parser<T>, Set<Character>> startChars,
                          boolean recursive,
                          Precedence precedence,
                          BlockPosition position) {
        this.factory = factory;
        this.startChars = startChars;
        this.recursive = recursive;
        this.precedence = precedence;
        this.position = position;
    }

    /**
     * A parser which does not parse nested markup.
     */
    public static <T> ParserBuilder<T> prefixed(PrefixedParser<T> parser) {
        return new ParserBuilder<>(recursive -> parser, ParserBuilder::startCharsOf, false, Precedence.HIGH, BlockPosition.ANY);
    }

    /**
     * A parser built from the recursive parsers of the host format.
     */
    public static <T> ParserBuilder<T> prefixedRecursive(Function<RecursiveParsers, PrefixedParser<T>> factory) {
        return new ParserBuilder<>(factory::apply, ParserBuilder::startCharsOf, true, Precedence.HIGH, BlockPosition.ANY);
    }

    /**
     * A parser which may start with any character, tried when no parser claims the current character
     * or all such parsers failed.
     */
    public static <T> ParserBuilder<T> unprefixed(Parser<T> parser) {
        return new ParserBuilder<>(recursive -> parser, ignored -> Set.of(), false, Precedence.HIGH, BlockPosition.ANY);
    }

    public static <T> ParserBuilder<T> unprefixedRecursive(Function<RecursiveParsers, Parser<T>> factory) {
        return new ParserBuilder<>(factory, ignored -> Set.of(), true, Precedence.HIGH, BlockPosition.ANY);
    }

    public ParserBuilder<T> withLowPrecedence() {
        return new ParserBuilder<>(factory, startChars, recursive, Precedence.LOW, position);
    }

    public ParserBuilder<T> rootOnly() {
        return new ParserBuilder<>(factory, startChars, recursive, precedence, BlockPosition.ROOT_ONLY);
    }

    public ParserBuilder<T> nestedOnly() {
        return new ParserBuilder<>(factory, startChars, recursive, precedence, BlockPosition.NESTED_ONLY);
    }

    public Precedence precedence() {
        return precedence;
    }

    public ParserDefinition<T> createParser(RecursiveParsers recursiveParsers) {
        var parser = factory.apply(recursiveParsers);
        return new ParserDefinition<>(startChars.apply(parser), parser, precedence, recursive, position);
    }

    private static <T> Set<Character> startCharsOf(Parser<T> parser) {
        return ((PrefixedParser<T>) parser).startChars();
    }
}
