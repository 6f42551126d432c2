package org.pragmatica.markup.parser;

/**
 * Immutable position inside a {@link Source}.
 *
 * <p>Every parser receives a cursor and returns a new one on success, no cursor is ever
 * modified. The nest level counts how many recursive markup constructs enclose the
 * current position and is used to guard against unbounded recursion.
 */
public final class SourceCursor {
    private final Source source;
    private final int offset;
    private final int nestLevel;

    private SourceCursor(Source source, int offset, int nestLevel) {
        this.source = source;
        this.offset = offset;
        this.nestLevel = nestLevel;
    }

    public static SourceCursor of(String input) {
        return new SourceCursor(Source.of(input), 0, 0);
    }

    public static SourceCursor of(String input, int nestLevel) {
        return new SourceCursor(Source.of(input), 0, nestLevel);
    }

    public Source source() {
        return source;
    }

    public String input() {
        return source.value();
    }

    public int offset() {
        return offset;
    }

    public int nestLevel() {
        return nestLevel;
    }

    public boolean atEnd() {
        return offset >= source.length();
    }

    public int remaining() {
        return source.length() - offset;
    }

    /**
     * The character at the current offset.
     */
    public char peek() {
        return charAt(0);
    }

    public char charAt(int relativeOffset) {
        int index = offset + relativeOffset;
        if (index >= source.length() || index < 0) {
            throw new IndexOutOfBoundsException(Integer.toString(index));
        }
        return source.value().charAt(index);
    }

    /**
     * The next {@code numChars} characters, without consuming them.
     */
    public String capture(int numChars) {
        if (numChars == 0) {
            return "";
        }
        if (numChars < 0 || offset + numChars > source.length()) {
            throw new IndexOutOfBoundsException(Integer.toString(numChars));
        }
        return source.value().substring(offset, offset + numChars);
    }

    public SourceCursor consume(int numChars) {
        if (numChars == 0) {
            return this;
        }
        if (numChars < 0 || offset + numChars > source.length()) {
            throw new IndexOutOfBoundsException(Integer.toString(numChars));
        }
        return new SourceCursor(source, offset + numChars, nestLevel);
    }

    /**
     * A cursor at the same offset, one nest level deeper.
     */
    public SourceCursor nested() {
        return new SourceCursor(source, offset, nestLevel + 1);
    }

    public SourceCursor withNestLevel(int level) {
        return level == nestLevel
               ? this
               : new SourceCursor(source, offset, level);
    }

    public SourceLocation location() {
        return source.locationOf(offset);
    }

    @Override
    public String toString() {
        return "SourceCursor(" + offset + "/" + source.length() + ", nestLevel=" + nestLevel + ")";
    }
}
