package org.pragmatica.markup.directive;

import org.pragmatica.markup.markup.DefaultRecursiveSpanParsers;
import org.pragmatica.markup.parser.ParseResult;
import org.pragmatica.markup.parser.Parser;
import org.pragmatica.markup.parser.ParserConfig;
import org.pragmatica.markup.text.TextParsers;
import org.pragmatica.markup.tree.Span;
import org.pragmatica.markup.tree.TemplateContextReference;
import org.pragmatica.markup.tree.TemplateElement;
import org.pragmatica.markup.tree.TemplateRoot;
import org.pragmatica.markup.tree.TemplateSpan;
import org.pragmatica.markup.tree.TemplateString;
import org.pragmatica.markup.tree.Text;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Parses templates: literal text with {@code ${key}} references, template directives and
 * backslash escapes. Separators left over after parsing become invalid elements.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = DirectiveSupport.templateParser(List.of(directive));
 * var root = parser.parse("<title>${title}</title>");
 * }</pre>
 */
public final class TemplateParser extends DefaultRecursiveSpanParsers {
    private final DirectiveRegistry<TemplateSpan> registry;
    private final Map<Character, Parser<Span>> spanParsers;
    private final Parser<List<TemplateSpan>> templateSpans;
    private final Parser<TemplateRoot> templateRoot;

    public TemplateParser(DirectiveRegistry<TemplateSpan> registry, ParserConfig config) {
        super(config);
        this.registry = registry;
        this.spanParsers = Map.of('$', DirectiveParsers.<Span>contextReference(TemplateContextReference::new),
                                  '@', templateDirective(),
                                  '\\', escapeSequence().<Span>map(Text::new));
        this.templateSpans = recursiveSpans().map(TemplateParser::toTemplateSpans);
        var orphans = DirectiveSupport.orphanRewriter();
        this.templateRoot = templateSpans.map(TemplateRoot::new)
                                         .map(root -> orphans.rewrite(root));
    }

    @Override
    protected Map<Character, Parser<Span>> spanParsers() {
        return spanParsers;
    }

    @Override
    public Parser<String> escapedChar() {
        return TextParsers.oneChar();
    }

    public Parser<List<TemplateSpan>> templateSpans() {
        return templateSpans;
    }

    public Parser<TemplateRoot> templateRoot() {
        return templateRoot;
    }

    /**
     * Parses a complete template. Templates have no syntax errors, markup which cannot be parsed
     * is kept as literal text.
     */
    public ParseResult<TemplateRoot> parse(String template) {
        return templateRoot.parseAll(template);
    }

    /**
     * A function parsing strings as template spans, one nest level below the specified one.
     */
    public Function<String, List<TemplateSpan>> templateParserFunction(int nestLevel) {
        var spans = spanParserFunction(nestLevel);
        return source -> toTemplateSpans(spans.apply(source));
    }

    private Parser<Span> templateDirective() {
        var directive = DirectiveParsers.inlineDirectiveParser(SpanDirectiveParsers.inlineBody(registry, this), this);
        return new DirectiveProcessor<>(registry).inlineParser(directive, TemplateParser::toTemplateSpans, this::templateParserFunction)
                                                 .<Span>map(span -> span);
    }

    private static List<TemplateSpan> toTemplateSpans(List<Span> spans) {
        return spans.stream()
                    .map(TemplateParser::toTemplateSpan)
                    .toList();
    }

    private static TemplateSpan toTemplateSpan(Span span) {
        if (span instanceof TemplateSpan templateSpan) {
            return templateSpan;
        }
        if (span instanceof Text text) {
            return new TemplateString(text.content());
        }
        return new TemplateElement(span);
    }
}
