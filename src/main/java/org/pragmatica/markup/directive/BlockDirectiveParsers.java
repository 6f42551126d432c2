package org.pragmatica.markup.directive;

import org.pragmatica.markup.markup.ParserBuilder;
import org.pragmatica.markup.markup.RecursiveParsers;
import org.pragmatica.markup.parser.Parser;
import org.pragmatica.markup.parser.Parsers;
import org.pragmatica.markup.text.PrefixedParser;
import org.pragmatica.markup.text.TextParsers;
import org.pragmatica.markup.tree.Block;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Parsers for block directives in markup documents.
 */
public final class BlockDirectiveParsers {
    private BlockDirectiveParsers() {}

    public static ParserBuilder<Block> blockDirective(DirectiveRegistry<Block> registry) {
        return ParserBuilder.prefixedRecursive(recursive -> blockDirectiveParser(registry, recursive));
    }

    public static PrefixedParser<Block> blockDirectiveParser(DirectiveRegistry<Block> registry, RecursiveParsers recursive) {
        var declaration = DirectiveParsers.directiveParser(blockBody(registry), recursive, true);
        return new DirectiveProcessor<>(registry).parser(declaration, recursive::blockParserFunction);
    }

    /**
     * The body of a block directive: the lines following the declaration up to a line holding only
     * the fence, without leading and trailing blank lines. Without a fence the directive ends with
     * the line of the declaration.
     */
    static Function<DirectiveDeclaration, Parser<Optional<String>>> blockBody(DirectiveRegistry<Block> registry) {
        Parser<Optional<String>> noBody = TextParsers.wsEol()
                                                     .as(Optional.empty());
        return declaration -> {
            if (!registry.hasBody(declaration.name())) {
                return noBody;
            }
            var closingFence = TextParsers.literal(declaration.fence())
                                          .keepLeft(TextParsers.wsEol());
            var line = Parsers.not(closingFence.or(TextParsers.eof()
                                                              .as("")))
                              .keepRight(TextParsers.restOfLine());
            var body = TextParsers.wsEol()
                                  .keepRight(line.repeat())
                                  .keepLeft(closingFence)
                                  .map(lines -> Optional.of(String.join("\n", trimBlankLines(lines))));
            return body.or(noBody);
        };
    }

    private static List<String> trimBlankLines(List<String> lines) {
        var result = new ArrayList<>(lines);
        while (!result.isEmpty() && result.get(0)
                                          .isBlank()) {
            result.remove(0);
        }
        while (!result.isEmpty() && result.get(result.size() - 1)
                                          .isBlank()) {
            result.remove(result.size() - 1);
        }
        return result;
    }
}
