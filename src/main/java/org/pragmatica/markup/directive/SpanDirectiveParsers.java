package org.pragmatica.markup.directive;

import org.pragmatica.markup.markup.ParserBuilder;
import org.pragmatica.markup.markup.RecursiveSpanParsers;
import org.pragmatica.markup.parser.Pair;
import org.pragmatica.markup.parser.Parser;
import org.pragmatica.markup.parser.Parsers;
import org.pragmatica.markup.text.PrefixedParser;
import org.pragmatica.markup.text.TextParsers;
import org.pragmatica.markup.tree.MarkupContextReference;
import org.pragmatica.markup.tree.Span;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Parsers for span directives and context references in markup documents.
 */
public final class SpanDirectiveParsers {
    private SpanDirectiveParsers() {}

    public static ParserBuilder<Span> contextReference() {
        return ParserBuilder.prefixed(DirectiveParsers.<Span>contextReference(MarkupContextReference::new));
    }

    public static ParserBuilder<Span> spanDirective(DirectiveRegistry<Span> registry) {
        return ParserBuilder.prefixedRecursive(recursive -> spanDirectiveParser(registry, recursive));
    }

    public static PrefixedParser<Span> spanDirectiveParser(DirectiveRegistry<Span> registry, RecursiveSpanParsers recursive) {
        var directive = DirectiveParsers.inlineDirectiveParser(inlineBody(registry, recursive), recursive);
        return new DirectiveProcessor<>(registry).inlineParser(directive, spans -> spans, recursive::spanParserFunction);
    }

    /**
     * The body of an inline directive: spans up to the fence. Without a fence the directive has no body.
     */
    static Function<DirectiveDeclaration, Parser<Optional<Pair<List<Span>, String>>>> inlineBody(DirectiveRegistry<?> registry,
                                                                                                 RecursiveSpanParsers recursive) {
        return declaration -> {
            if (!registry.hasBody(declaration.name())) {
                return Parsers.success(Optional.empty());
            }
            var fence = declaration.fence();
            var body = recursive.delimitedRecursiveSpans(TextParsers.delimitedBy(fence))
                                .withSource()
                                .map(parsed -> Optional.of(Pair.of(parsed.first(),
                                                                   parsed.second()
                                                                         .substring(0, parsed.second()
                                                                                             .length() - fence.length()))));
            return body.or(Parsers.success(Optional.empty()));
        };
    }
}
