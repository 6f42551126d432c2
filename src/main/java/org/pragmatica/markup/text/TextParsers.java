package org.pragmatica.markup.text;

import org.pragmatica.markup.parser.Literal;
import org.pragmatica.markup.parser.Message;
import org.pragmatica.markup.parser.ParseResult;
import org.pragmatica.markup.parser.Parser;
import org.pragmatica.markup.parser.Parsers;

import java.util.List;

/**
 * Entry point for the text parsers, the building blocks of all markup parsers.
 *
 * <p>Example usage:
 * <pre>{@code
 * Parser<String> key = TextParsers.anyNot('=', '\n').min(1);
 * Parser<String> value = TextParsers.restOfLine();
 * }</pre>
 */
public final class TextParsers {
    private static final CharGroup NAME_CHARS = CharGroup.ALPHA_NUM.add('-', '_');
    private static final CharPredicate REF_NAME_SYMBOLS = CharPredicate.anyOf('-', '_', '.', ':', '+');

    private TextParsers() {}

    // === Character runs ===

    /**
     * Any number of the specified characters. Always succeeds unless a minimum is set.
     */
    public static Characters anyOf(char... chars) {
        return new Characters(CharPredicate.anyOf(chars));
    }

    public static Characters anyOf(CharPredicate predicate) {
        return new Characters(predicate);
    }

    /**
     * Any number of characters except the specified ones.
     */
    public static Characters anyNot(char... chars) {
        return new Characters(CharPredicate.noneOf(chars));
    }

    public static Characters anyBut(char... chars) {
        return anyNot(chars);
    }

    public static Characters anyIn(CharRange... ranges) {
        return new Characters(CharPredicate.inRanges(ranges));
    }

    public static Characters anyWhile(CharPredicate predicate) {
        return new Characters(predicate);
    }

    /**
     * Exactly one of the specified characters.
     */
    public static Characters oneOf(char... chars) {
        return anyOf(chars).take(1);
    }

    public static Characters oneOf(CharPredicate predicate) {
        return anyOf(predicate).take(1);
    }

    public static Characters anyChars() {
        return new Characters(CharPredicate.ANY);
    }

    public static Characters oneChar() {
        return anyChars().take(1);
    }

    public static Parser<String> literal(String expected) {
        return new Literal(expected);
    }

    // === Whitespace and lines ===

    /**
     * Any number of spaces and tabs.
     */
    public static Characters ws() {
        return anyOf(' ', '\t');
    }

    public static Characters wsOrNl() {
        return anyOf(' ', '\t', '\n', '\r');
    }

    /**
     * A line break ({@code \n}, {@code \r\n} or a single {@code \r}) or the end of input.
     */
    public static Parser<Void> eol() {
        return in -> {
            if (in.atEnd()) {
                return ParseResult.Success.of(null, in);
            }
            if (in.peek() == '\n') {
                return ParseResult.Success.of(null, in.consume(1));
            }
            if (in.peek() == '\r') {
                return ParseResult.Success.of(null, in.consume(in.remaining() > 1 && in.charAt(1) == '\n' ? 2 : 1));
            }
            return ParseResult.Failure.at(in, Message.EXPECTED_EOL);
        };
    }

    public static Parser<Void> eof() {
        return in -> in.atEnd()
                     ? ParseResult.Success.of(null, in)
                     : ParseResult.Failure.at(in, Message.EXPECTED_EOF);
    }

    /**
     * Optional whitespace followed by the end of the line.
     */
    public static Parser<Void> wsEol() {
        return ws().keepRight(eol());
    }

    /**
     * A line containing only whitespace. Fails at the end of input.
     */
    public static Parser<String> blankLine() {
        return Parsers.not(eof())
                      .keepRight(wsEol())
                      .as("");
    }

    public static Parser<List<String>> blankLines() {
        return blankLine().repeat()
                          .min(1);
    }

    /**
     * The remainder of the current line, without the line break, which is consumed.
     */
    public static Parser<String> restOfLine() {
        return anyNot('\n', '\r').keepLeft(eol());
    }

    /**
     * A line which is not blank.
     */
    public static Parser<String> textLine() {
        return Parsers.not(blankLine())
                      .keepRight(Parsers.not(eof()))
                      .keepRight(restOfLine());
    }

    // === Names ===

    /**
     * A name starting with a letter, followed by letters, digits, {@code -} or {@code _}.
     */
    public static Parser<String> nameDecl() {
        return oneOf(CharGroup.ALPHA).then(anyOf(NAME_CHARS))
                                     .source();
    }

    /**
     * A reference name of alphanumerical characters with single punctuation characters
     * between them.
     */
    public static Parser<String> refName() {
        var alphaNum = anyOf(CharGroup.ALPHA_NUM).min(1);
        var symbol = oneOf(REF_NAME_SYMBOLS);
        return alphaNum.then(symbol.then(alphaNum)
                                   .repeat())
                       .source();
    }

    // === Delimited text ===

    /**
     * Text up to any of the specified characters, which are consumed.
     */
    public static DelimitedText delimitedBy(char... chars) {
        return new DelimitedText(TextDelimiter.endingWith(chars));
    }

    /**
     * Text up to the specified literal, which is consumed.
     */
    public static DelimitedText delimitedBy(String literal) {
        return new DelimitedText(TextDelimiter.endingWith(literal));
    }

    /**
     * Text up to the first position the specified parser succeeds at.
     */
    public static UntilParser anyUntil(Parser<?> until) {
        return new UntilParser(until);
    }

    public static UntilParser anyUntil(char... chars) {
        return new UntilParser(oneOf(chars));
    }
}
