package org.pragmatica.markup.markup;

import org.pragmatica.markup.parser.Parser;
import org.pragmatica.markup.text.DelimitedText;

/**
 * Parsers for text with escape sequences according to the rules of the host format.
 */
public interface EscapedTextParsers {

    /**
     * The character following a backslash.
     */
    Parser<String> escapedChar();

    /**
     * Backslash followed by the escaped character, resulting in the escaped character.
     */
    Parser<String> escapeSequence();

    /**
     * Text up to the delimiter, with escape sequences replaced by the escaped characters.
     */
    Parser<String> escapedText(DelimitedText textParser);

    /**
     * Non-empty text up to any of the specified characters, with escape sequences replaced.
     */
    Parser<String> escapedUntil(char... chars);
}
