package org.pragmatica.markup.markup;

import org.pragmatica.markup.parser.Message;
import org.pragmatica.markup.parser.ParseResult;
import org.pragmatica.markup.parser.Parser;
import org.pragmatica.markup.parser.ParserConfig;
import org.pragmatica.markup.parser.Parsers;
import org.pragmatica.markup.parser.SourceCursor;
import org.pragmatica.markup.text.PrefixedParser;
import org.pragmatica.markup.text.TextParsers;
import org.pragmatica.markup.tree.Block;
import org.pragmatica.markup.tree.InvalidBlock;
import org.pragmatica.markup.tree.Paragraph;
import org.pragmatica.markup.tree.RootElement;
import org.pragmatica.markup.tree.Span;
import org.pragmatica.markup.tree.Text;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Assembles the block and span parsers of a host format and its extensions into the parser
 * for complete documents.
 *
 * <p>The root parser never fails: a line no block parser accepts becomes a paragraph with
 * the literal text of the line.
 */
public final class RootParser extends DefaultRecursiveSpanParsers implements RecursiveParsers {
    private static final Logger log = LoggerFactory.getLogger(RootParser.class);

    private final MarkupFormat format;
    private final MarkupExtensions extensions;
    private final Parser<Block> rootBlock;
    private final Parser<Block> nestedBlock;
    private final Parser<List<Block>> nestedBlockList;
    private final Parser<RootElement> rootElement;

    private volatile Map<Character, Parser<Span>> spanParsers;
    private volatile List<ParserDefinition<Block>> blockDefinitions;

    public RootParser(MarkupFormat format, MarkupExtensions extensions, ParserConfig config) {
        super(config);
        this.format = format;
        this.extensions = extensions;
        this.rootBlock = Parsers.lazily(() -> mergeBlocks(BlockPosition.NESTED_ONLY));
        this.nestedBlock = Parsers.lazily(() -> mergeBlocks(BlockPosition.ROOT_ONLY));
        this.nestedBlockList = blockList(nestedBlock);
        this.rootElement = blockList(rootBlock).map(RootElement::new)
                                               .map(root -> extensions.rewriter()
                                                                      .rewrite(root));
    }

    /**
     * Parser for a complete document.
     */
    public Parser<RootElement> rootElement() {
        return rootElement;
    }

    @Override
    public Parser<String> escapedChar() {
        return format.escapedChar();
    }

    @Override
    public Parser<List<Block>> recursiveBlocks(Parser<String> textParser) {
        return reparse(textParser, nestedBlockList);
    }

    @Override
    public Function<String, List<Block>> blockParserFunction(int nestLevel) {
        return source -> {
            if (nestLevel >= config().maxNestLevel()) {
                log.warn("Maximum nest level {} reached, not parsing nested blocks", config().maxNestLevel());
                return List.of(new InvalidBlock(NEST_LEVEL_EXCEEDED, source));
            }
            var result = nestedBlockList.parse(SourceCursor.of(source, nestLevel + 1));
            if (result instanceof ParseResult.Failure<List<Block>> failure) {
                return List.of(new InvalidBlock(failure.message(), source));
            }
            return ((ParseResult.Success<List<Block>>) result).value();
        };
    }

    // Racy but idempotent, parser builders may only be invoked once the recursive parsers exist.
    @Override
    protected Map<Character, Parser<Span>> spanParsers() {
        var current = spanParsers;
        if (current == null) {
            current = PrefixedDispatch.mergeByChar(createDefinitions(withEscape(format.spanParsers()), extensions.spanParsers()));
            spanParsers = current;
        }
        return current;
    }

    private List<ParserDefinition<Block>> blockDefinitions() {
        var current = blockDefinitions;
        if (current == null) {
            current = createDefinitions(format.blockParsers(), extensions.blockParsers());
            blockDefinitions = current;
        }
        return current;
    }

    private List<ParserBuilder<Span>> withEscape(List<ParserBuilder<Span>> hostParsers) {
        var escape = ParserBuilder.prefixed(PrefixedParser.of('\\', escapeSequence().<Span>map(Text::new)))
                                  .withLowPrecedence();
        var result = new ArrayList<>(hostParsers);
        result.add(escape);
        return result;
    }

    private <T> List<ParserDefinition<T>> createDefinitions(List<ParserBuilder<T>> host, List<ParserBuilder<T>> extension) {
        var hostDefinitions = host.stream()
                                  .map(builder -> builder.createParser(this))
                                  .toList();
        var extensionDefinitions = extension.stream()
                                            .map(builder -> builder.createParser(this))
                                            .toList();
        log.debug("Created {} host and {} extension parsers for format {}", hostDefinitions.size(), extensionDefinitions.size(), format.name());
        return PrefixedDispatch.order(hostDefinitions, extensionDefinitions);
    }

    private Parser<Block> mergeBlocks(BlockPosition excluded) {
        var definitions = blockDefinitions().stream()
                                            .filter(definition -> definition.position() != excluded)
                                            .toList();
        return PrefixedDispatch.merge(definitions);
    }

    private Parser<List<Block>> blockList(Parser<Block> block) {
        var fallback = TextParsers.textLine()
                                  .<Block>map(Paragraph::of);
        var next = advancing(block).or(fallback)
                                   .keepLeft(TextParsers.blankLines()
                                                        .optional());
        return TextParsers.blankLines()
                          .optional()
                          .keepRight(next.repeat());
    }

    private static <T> Parser<T> advancing(Parser<T> parser) {
        return in -> {
            var result = parser.parse(in);
            if (result instanceof ParseResult.Success<T> success && success.next()
                                                                           .offset() <= in.offset()) {
                return ParseResult.Failure.at(in, Message.fixed("Block parser did not consume any input"));
            }
            return result;
        };
    }
}
