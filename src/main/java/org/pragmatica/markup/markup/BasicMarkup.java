package org.pragmatica.markup.markup;

import org.pragmatica.markup.parser.Parser;
import org.pragmatica.markup.text.PrefixedParser;
import org.pragmatica.markup.text.TextParsers;
import org.pragmatica.markup.tree.Block;
import org.pragmatica.markup.tree.Emphasized;
import org.pragmatica.markup.tree.Paragraph;
import org.pragmatica.markup.tree.Span;

import java.util.List;

/**
 * A minimal markup format: paragraphs separated by blank lines, {@code *emphasis*} and backslash escapes
 * for any character.
 */
public final class BasicMarkup implements MarkupFormat {
    public static final BasicMarkup INSTANCE = new BasicMarkup();

    private BasicMarkup() {}

    @Override
    public String name() {
        return "basic";
    }

    @Override
    public List<ParserBuilder<Block>> blockParsers() {
        return List.of(paragraph());
    }

    @Override
    public List<ParserBuilder<Span>> spanParsers() {
        return List.of(emphasis());
    }

    @Override
    public Parser<String> escapedChar() {
        return TextParsers.oneChar();
    }

    private static ParserBuilder<Block> paragraph() {
        var lines = TextParsers.textLine()
                               .repeat()
                               .min(1)
                               .map(content -> String.join("\n", content));
        return ParserBuilder.unprefixedRecursive(recursive -> recursive.recursiveSpans(lines)
                                                                       .map(Paragraph::new));
    }

    private static ParserBuilder<Span> emphasis() {
        return ParserBuilder.prefixedRecursive(recursive -> {
            var content = recursive.delimitedRecursiveSpans(TextParsers.delimitedBy('*')
                                                                       .nonEmpty());
            return PrefixedParser.of('*', TextParsers.literal("*")
                                                     .keepRight(content)
                                                     .map(Emphasized::new));
        });
    }
}
