package org.pragmatica.markup.text;

import org.pragmatica.markup.parser.Message;
import org.pragmatica.markup.parser.ParseResult;
import org.pragmatica.markup.parser.Parser;
import org.pragmatica.markup.parser.SourceCursor;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Delimiter for plain text, ending at one of a set of characters or at a literal string.
 *
 * <p>Instances are immutable, the option methods return modified copies.
 */
public final class TextDelimiter implements Delimiter<String> {
    private final Set<Character> endChars;
    private final String endLiteral;
    private final boolean acceptEOF;
    private final boolean nonEmpty;
    private final boolean keepDelimiter;
    private final Set<Character> failOn;
    private final Parser<?> postCondition;
    private final Set<Character> startChars;

    private TextDelimiter(Set<Character> endChars,
                          String endLiteral,
                          boolean acceptEOF,
                          boolean nonEmpty,
                          boolean keepDelimiter,
                          Set<Character> failOn,
                          Parser<?> postCondition) {
        this.endChars = endChars;
        this.endLiteral = endLiteral;
        this.acceptEOF = acceptEOF;
        this.nonEmpty = nonEmpty;
        this.keepDelimiter = keepDelimiter;
        this.failOn = failOn;
        this.postCondition = postCondition;

        var start = new HashSet<>(endChars);
        start.addAll(failOn);
        this.startChars = Set.copyOf(start);
    }

    /**
     * Ends at any of the specified characters.
     */
    public static TextDelimiter endingWith(char... chars) {
        var set = new LinkedHashSet<Character>();
        for (char c : chars) {
            set.add(c);
        }
        return new TextDelimiter(Set.copyOf(set), null, false, false, false, Set.of(), null);
    }

    /**
     * Ends at the specified literal string.
     */
    public static TextDelimiter endingWith(String literal) {
        if (literal == null || literal.isEmpty()) {
            throw new IllegalArgumentException("end delimiter must not be empty");
        }
        return new TextDelimiter(Set.of(literal.charAt(0)), literal, false, false, false, Set.of(), null);
    }

    /**
     * Only ends at the end of input.
     */
    public static TextDelimiter undelimited() {
        return new TextDelimiter(Set.of(), null, true, false, false, Set.of(), null);
    }

    // === Options ===

    /**
     * Succeed with the remaining text when the end of input is reached before the delimiter.
     */
    public TextDelimiter acceptEOF() {
        return new TextDelimiter(endChars, endLiteral, true, nonEmpty, keepDelimiter, failOn, postCondition);
    }

    /**
     * Fail when the delimiter is found before at least one character was consumed.
     */
    public TextDelimiter nonEmpty() {
        return new TextDelimiter(endChars, endLiteral, acceptEOF, true, keepDelimiter, failOn, postCondition);
    }

    /**
     * Leave the delimiter unconsumed on success.
     */
    public TextDelimiter keepDelimiter() {
        return new TextDelimiter(endChars, endLiteral, acceptEOF, nonEmpty, true, failOn, postCondition);
    }

    /**
     * Fail when one of the specified characters is found before the delimiter.
     */
    public TextDelimiter failOn(char... chars) {
        var set = new HashSet<>(failOn);
        for (char c : chars) {
            set.add(c);
        }
        return new TextDelimiter(endChars, endLiteral, acceptEOF, nonEmpty, keepDelimiter, Set.copyOf(set), postCondition);
    }

    /**
     * Only accept a delimiter which is followed by input matching the specified parser.
     * The input matched by the condition is not consumed.
     */
    public TextDelimiter withPostCondition(Parser<?> condition) {
        return new TextDelimiter(endChars, endLiteral, acceptEOF, nonEmpty, keepDelimiter, failOn, condition);
    }

    public Optional<String> endLiteral() {
        return Optional.ofNullable(endLiteral);
    }

    // === Delimiter ===

    @Override
    public Set<Character> startChars() {
        return startChars;
    }

    @Override
    public DelimiterResult<String> atStartChar(char startChar, int charsConsumed, SourceCursor cursor) {
        var position = cursor.consume(charsConsumed);

        int delimiterLength = delimiterLengthAt(startChar, position);
        if (delimiterLength < 0) {
            if (failOn.contains(startChar)) {
                return DelimiterResult.complete(ParseResult.Failure.at(position, Message.forRuntimeValue(startChar,
                                                                                                         c -> "unexpected character '" + c + "'")));
            }
            return DelimiterResult.proceed();
        }
        if (postCondition != null && postCondition.parse(position.consume(delimiterLength))
                                                  .isFailure()) {
            return DelimiterResult.proceed();
        }
        if (nonEmpty && charsConsumed == 0) {
            return DelimiterResult.complete(ParseResult.Failure.at(position, "expected at least 1 character before end delimiter"));
        }
        var next = keepDelimiter
                   ? position
                   : position.consume(delimiterLength);
        return DelimiterResult.complete(ParseResult.Success.of(cursor.capture(charsConsumed), next));
    }

    @Override
    public ParseResult<String> atEOF(int charsConsumed, SourceCursor cursor) {
        var end = cursor.consume(charsConsumed);
        if (!acceptEOF) {
            return ParseResult.Failure.at(end, Message.UNEXPECTED_EOF);
        }
        if (nonEmpty && charsConsumed == 0) {
            return ParseResult.Failure.at(end, "expected at least 1 character before end of input");
        }
        return ParseResult.Success.of(cursor.capture(charsConsumed), end);
    }

    // -1 when no delimiter starts at the position
    private int delimiterLengthAt(char startChar, SourceCursor position) {
        if (endLiteral == null) {
            return endChars.contains(startChar)
                   ? 1
                   : -1;
        }
        if (startChar != endLiteral.charAt(0)) {
            return -1;
        }
        return position.input()
                       .startsWith(endLiteral, position.offset())
               ? endLiteral.length()
               : -1;
    }
}
