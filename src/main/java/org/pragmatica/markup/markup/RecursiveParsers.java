package org.pragmatica.markup.markup;

import org.pragmatica.markup.parser.Parser;
import org.pragmatica.markup.tree.Block;

import java.util.List;
import java.util.function.Function;

/**
 * Parsers for markup containing nested blocks and spans, passed to the builders of
 * block and span parsers.
 */
public interface RecursiveParsers extends RecursiveSpanParsers {

    /**
     * Parses the text produced by the specified parser as a list of nested blocks.
     */
    Parser<List<Block>> recursiveBlocks(Parser<String> textParser);

    /**
     * A function parsing strings as nested blocks. The function never fails, a failure becomes
     * an invalid block.
     */
    Function<String, List<Block>> blockParserFunction(int nestLevel);
}
