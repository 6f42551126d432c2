package org.pragmatica.markup.parser;

/**
 * Matches a literal string.
 */
public final class Literal implements Parser<String> {
    private final String expected;
    private final Message message;

    public Literal(String expected) {
        if (expected == null || expected.isEmpty()) {
            throw new IllegalArgumentException("literal must not be empty");
        }
        this.expected = expected;
        this.message = Message.forContext(cursor -> {
            var found = cursor.capture(Math.min(cursor.remaining(), expected.length()));
            return "'" + expected + "' expected but '" + found + "' found";
        });
    }

    public String expected() {
        return expected;
    }

    @Override
    public ParseResult<String> parse(SourceCursor in) {
        var source = in.input();
        int start = in.offset();
        int i = 0;
        while (i < expected.length() && start + i < source.length() && expected.charAt(i) == source.charAt(start + i)) {
            i++;
        }
        return i == expected.length()
               ? ParseResult.Success.of(expected, in.consume(i))
               : ParseResult.Failure.at(in, message);
    }

    @Override
    public String toString() {
        return "Literal(" + expected + ")";
    }
}
