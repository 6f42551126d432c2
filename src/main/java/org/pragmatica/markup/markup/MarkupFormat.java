package org.pragmatica.markup.markup;

import org.pragmatica.markup.parser.Parser;
import org.pragmatica.markup.tree.Block;
import org.pragmatica.markup.tree.Span;

import java.util.List;

/**
 * A host markup language: the block and span parsers it consists of and its escaping rules.
 */
public interface MarkupFormat {

    String name();

    List<ParserBuilder<Block>> blockParsers();

    List<ParserBuilder<Span>> spanParsers();

    /**
     * The characters which may follow a backslash.
     */
    Parser<String> escapedChar();
}
