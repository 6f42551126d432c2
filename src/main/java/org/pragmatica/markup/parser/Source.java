package org.pragmatica.markup.parser;

import java.util.Arrays;

/**
 * The full input text of a single parser run.
 *
 * <p>Line starts are only computed when a location is requested, which in practice
 * means when an error message gets rendered.
 */
public final class Source {
    private final String value;
    private volatile int[] lineStarts;

    private Source(String value) {
        this.value = value;
    }

    public static Source of(String value) {
        if (value == null) {
            throw new IllegalArgumentException("source text must not be null");
        }
        return new Source(value);
    }

    public String value() {
        return value;
    }

    public int length() {
        return value.length();
    }

    /**
     * Resolve line and column for the specified offset.
     */
    public SourceLocation locationOf(int offset) {
        var starts = lineStarts();
        int index = Arrays.binarySearch(starts, offset);
        int line;
        if (index == starts.length - 1) {
            line = index;
        } else if (index < 0) {
            line = -index - 1;
        } else {
            line = index + 1;
        }
        line = Math.max(1, line);
        int lineStart = starts[line - 1];
        int lineEnd = Math.min(starts[line], value.length());
        var content = value.substring(lineStart, lineEnd);
        if (content.endsWith("\n")) {
            content = content.substring(0, content.length() - 1);
        }
        return SourceLocation.at(line, offset - lineStart + 1, offset, content);
    }

    // Racy but idempotent: concurrent callers compute the same array.
    private int[] lineStarts() {
        var starts = lineStarts;
        if (starts == null) {
            starts = computeLineStarts();
            lineStarts = starts;
        }
        return starts;
    }

    private int[] computeLineStarts() {
        int count = 2;
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) == '\n') {
                count++;
            }
        }
        var starts = new int[count];
        int index = 1;
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) == '\n') {
                starts[index++] = i + 1;
            }
        }
        starts[index] = value.length();
        return starts;
    }
}
