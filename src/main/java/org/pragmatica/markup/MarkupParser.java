package org.pragmatica.markup;

import org.pragmatica.markup.markup.MarkupExtensions;
import org.pragmatica.markup.markup.MarkupFormat;
import org.pragmatica.markup.markup.RootParser;
import org.pragmatica.markup.parser.ParseResult;
import org.pragmatica.markup.parser.ParserConfig;
import org.pragmatica.markup.tree.RootElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser for complete markup documents of one host format, with optional extensions.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = MarkupParser.of(BasicMarkup.INSTANCE)
 *                          .using(DirectiveSupport.extensions(List.of(), List.of(upper)))
 *                          .withConfig(ParserConfig.DEFAULT.withMaxNestLevel(8))
 *                          .build();
 * RootElement root = parser.parse("some @:upper(text)");
 * }</pre>
 *
 * <p>Instances are immutable and may be shared between threads.
 */
public final class MarkupParser {
    private static final Logger log = LoggerFactory.getLogger(MarkupParser.class);

    private final RootParser rootParser;

    private MarkupParser(RootParser rootParser) {
        this.rootParser = rootParser;
    }

    public static Builder of(MarkupFormat format) {
        return new Builder(format);
    }

    /**
     * Parses the specified document. Markup which cannot be parsed is kept as literal text or
     * becomes invalid nodes, so parsing only fails if the parsers of the host format are broken.
     *
     * @throws MarkupParserException if the document could not be parsed completely
     */
    public RootElement parse(String input) {
        var result = rootParser.rootElement()
                               .parseAll(input);
        if (result instanceof ParseResult.Failure<RootElement> failure) {
            log.error("Failed to parse document: {}", failure.describe());
            throw new MarkupParserException(failure);
        }
        return ((ParseResult.Success<RootElement>) result).value();
    }

    public static final class Builder {
        private final MarkupFormat format;
        private MarkupExtensions extensions = MarkupExtensions.EMPTY;
        private ParserConfig config = ParserConfig.DEFAULT;

        private Builder(MarkupFormat format) {
            this.format = format;
        }

        /**
         * Adds the specified extensions, registered after those added before.
         */
        public Builder using(MarkupExtensions additional) {
            this.extensions = extensions.combine(additional);
            return this;
        }

        public Builder withConfig(ParserConfig newConfig) {
            this.config = newConfig;
            return this;
        }

        public MarkupParser build() {
            log.debug("Building parser for format {} with max nest level {}", format.name(), config.maxNestLevel());
            return new MarkupParser(new RootParser(format, extensions, config));
        }
    }
}
