package org.pragmatica.markup.markup;

import org.pragmatica.markup.parser.Parser;

import java.util.Set;

/**
 * A parser for a single kind of block or span, ready to be merged with all other parsers
 * of the same kind.
 *
 * @param startChars the characters a match may start with, empty when any character may start a match
 * @param parser the parser
 * @param precedence the precedence among parsers with the same start character
 * @param recursive whether the parser parses nested blocks or spans
 * @param position where the parser may be applied, only relevant for block parsers
 */
public record ParserDefinition<T>(Set<Character> startChars,
                                  Parser<T> parser,
                                  Precedence precedence,
                                  boolean recursive,
                                  BlockPosition position) {

    public ParserDefinition {
        startChars = Set.copyOf(startChars);
    }

    public boolean isPrefixed() {
        return !startChars.isEmpty();
    }
}
