package org.pragmatica.markup.tree;

/**
 * Plain text.
 */
public record Text(String content) implements Span {

    public static Text of(String content) {
        return new Text(content);
    }
}
