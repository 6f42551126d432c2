package org.pragmatica.markup.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.markup.text.CharRange;
import org.pragmatica.markup.text.TextParsers;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ParsersTest {

    private static <T> ParseResult.Success<T> success(ParseResult<T> result) {
        assertTrue(result.isSuccess(), () -> "expected success but got " + result);
        return (ParseResult.Success<T>) result;
    }

    private static <T> ParseResult.Failure<T> failure(ParseResult<T> result) {
        assertTrue(result.isFailure(), () -> "expected failure but got " + result);
        return (ParseResult.Failure<T>) result;
    }

    // === Choice ===

    @Test
    void choice_firstAlternativeSucceeds_returnsItsResult() {
        var parser = Parsers.choice(List.of(TextParsers.literal("ab"), TextParsers.literal("a")));

        var result = success(parser.parse("abc"));
        assertEquals("ab", result.value());
        assertEquals(2, result.next().offset());
    }

    @Test
    void choice_allAlternativesFail_reportsFurthestFailure() {
        var shallow = TextParsers.literal("x");
        var deep = TextParsers.literal("ab").keepRight(TextParsers.literal("d"));
        var parser = Parsers.choice(List.of(shallow, deep));

        var result = failure(parser.parse("abc"));
        assertEquals(2, result.maxOffset());
        assertEquals("'d' expected but 'c' found", result.message());
    }

    @Test
    void choice_withoutAlternatives_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> Parsers.choice(List.<Parser<String>>of()));
    }

    // === Optional, not and look-ahead ===

    @Test
    void opt_failingParser_succeedsWithoutConsuming() {
        var result = success(Parsers.opt(TextParsers.literal("x")).parse("abc"));

        assertTrue(result.value().isEmpty());
        assertEquals(0, result.next().offset());
    }

    @Test
    void not_succeedingParser_fails() {
        assertTrue(Parsers.not(TextParsers.literal("a")).parse("abc").isFailure());
        assertEquals(0, success(Parsers.not(TextParsers.literal("x")).parse("abc")).next().offset());
    }

    @Test
    void lookAhead_succeedingParser_doesNotConsume() {
        var result = success(Parsers.lookAhead(TextParsers.literal("ab")).parse("abc"));

        assertEquals("ab", result.value());
        assertEquals(0, result.next().offset());
    }

    @Test
    void consumeAll_remainingInput_fails() {
        var result = failure(TextParsers.literal("ab").parseAll("abc"));

        assertEquals(2, result.cursor().offset());
        assertEquals("Expected end of input", result.message());
    }

    @Test
    void lazily_recursiveDefinition_parsesNestedInput() {
        var self = new AtomicReference<Parser<String>>();
        Parser<String> parens = TextParsers.literal("(")
                                           .keepRight(Parsers.lazily(self::get)
                                                             .optional())
                                           .keepLeft(TextParsers.literal(")"))
                                           .map(inner -> "(" + inner.orElse("") + ")");
        self.set(parens);

        assertEquals("((()))", success(parens.parse("((()))")).value());
    }

    // === Repetition ===

    @Test
    void repeat_zeroWidthParser_terminates() {
        var result = success(TextParsers.anyOf('x').repeat().parse("abc"));

        assertThat(result.value()).isEmpty();
        assertEquals(0, result.next().offset());
    }

    @Test
    void repeat_belowMinimum_fails() {
        var parser = TextParsers.literal("a").repeat().min(3);

        assertTrue(parser.parse("aab").isFailure());
        assertThat(success(parser.parse("aaab")).value()).containsExactly("a", "a", "a");
    }

    @Test
    void repeat_withMaximum_stopsEarly() {
        var result = success(TextParsers.literal("a").repeat().max(2).parse("aaaa"));

        assertThat(result.value()).hasSize(2);
        assertEquals(2, result.next().offset());
    }

    @Test
    void repeat_trailingSeparator_isNotConsumed() {
        var parser = TextParsers.anyIn(CharRange.of('a', 'z'))
                                .min(1)
                                .repeat(TextParsers.literal(","));

        var result = success(parser.parse("ab,cd,"));
        assertThat(result.value()).containsExactly("ab", "cd");
        assertEquals(5, result.next().offset());
    }

    @Test
    void repeat_voidParser_collectsNullResults() {
        var result = success(TextParsers.eol().repeat().max(2).parse("\n\nx"));

        assertThat(result.value()).hasSize(2);
    }

    // === Mapping and validation ===

    @Test
    void evalMap_invalidResult_failsAtStartPosition() {
        var number = TextParsers.anyIn(CharRange.of('0', '9'))
                                .min(1)
                                .evalMap(digits -> digits.length() > 2
                                                   ? Validated.<Integer>invalid("too long: " + digits)
                                                   : Validated.valid(Integer.parseInt(digits)));

        assertEquals(42, success(number.parse("42")).value());
        var result = failure(number.parse("1234"));
        assertEquals("too long: 1234", result.message());
        assertEquals(0, result.cursor().offset());
    }

    @Test
    void filter_rejectedValue_failsWithMessage() {
        var parser = TextParsers.anyNot(' ').filter(word -> !word.isEmpty(), word -> "empty word");

        assertEquals("empty word", failure(parser.parse(" x")).message());
    }

    @Test
    void withSource_returnsConsumedInput() {
        var parser = TextParsers.literal("a").then(TextParsers.literal("b")).withSource();

        assertEquals("ab", success(parser.parse("abc")).value().second());
    }

    // === Failure reporting ===

    @Test
    void failure_describe_pointsAtLineAndColumn() {
        var parser = TextParsers.literal("ab\n").keepRight(TextParsers.literal("xy"));

        var result = failure(parser.parse("ab\nxz"));

        assertEquals(2, result.location().line());
        assertEquals(1, result.location().column());
        assertThat(result.describe()).contains("xz\n^");
    }
}
