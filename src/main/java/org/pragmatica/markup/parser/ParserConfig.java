package org.pragmatica.markup.parser;

/**
 * Parser configuration options.
 *
 * @param maxNestLevel maximum number of nested markup constructs, deeper nesting is parsed as literal text
 */
public record ParserConfig(int maxNestLevel) {
    public static final ParserConfig DEFAULT = new ParserConfig(32);

    public ParserConfig {
        if (maxNestLevel < 1) {
            throw new IllegalArgumentException("maxNestLevel must be positive: " + maxNestLevel);
        }
    }

    public ParserConfig withMaxNestLevel(int level) {
        return new ParserConfig(level);
    }
}
