package org.pragmatica.markup.text;

import org.pragmatica.markup.parser.ParseResult;
import org.pragmatica.markup.parser.SourceCursor;

import java.util.Set;

/**
 * End condition for a {@link DelimitedScanner}.
 *
 * <p>The scanner only consults the delimiter at the characters it declares as start characters,
 * all other characters are consumed without any further check.
 */
public interface Delimiter<T> {

    Set<Character> startChars();

    /**
     * Invoked when the scanner reached one of the start characters.
     *
     * @param startChar the character the scanner stopped at
     * @param charsConsumed the number of characters consumed since the scan started
     * @param cursor the cursor the scan started at
     */
    DelimiterResult<T> atStartChar(char startChar, int charsConsumed, SourceCursor cursor);

    /**
     * Invoked when the scanner reached the end of input without completing.
     */
    ParseResult<T> atEOF(int charsConsumed, SourceCursor cursor);
}
