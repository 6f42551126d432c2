package org.pragmatica.markup.text;

/**
 * An inclusive range of characters.
 */
public record CharRange(char from, char to) {

    public CharRange {
        if (from > to) {
            throw new IllegalArgumentException("Invalid character range: '" + from + "'-'" + to + "'");
        }
    }

    public static CharRange of(char from, char to) {
        return new CharRange(from, to);
    }

    public static CharRange single(char c) {
        return new CharRange(c, c);
    }

    public boolean contains(char c) {
        return c >= from && c <= to;
    }
}
