package org.pragmatica.markup.parser;

/**
 * A position in source text (line and column, both 1-based) together with
 * the content of the line it points into.
 */
public record SourceLocation(int line, int column, int offset, String lineContent) {

    public static SourceLocation at(int line, int column, int offset, String lineContent) {
        return new SourceLocation(line, column, offset, lineContent);
    }

    /**
     * The content of the line, followed by a second line with a caret under the column.
     */
    public String lineContentWithCaret() {
        return lineContent + "\n" + " ".repeat(Math.max(0, column - 1)) + "^";
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
