package org.pragmatica.markup.text;

import org.junit.jupiter.api.Test;
import org.pragmatica.markup.parser.ParseResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class TextParsersTest {

    private static <T> ParseResult.Success<T> success(ParseResult<T> result) {
        assertTrue(result.isSuccess(), () -> "expected success but got " + result);
        return (ParseResult.Success<T>) result;
    }

    // === Classifiers ===

    @Test
    void charPredicate_fewChars_matchesOnlyThose() {
        var single = CharPredicate.anyOf('a');
        var pair = CharPredicate.anyOf('a', 'b');

        assertTrue(single.test('a'));
        assertFalse(single.test('b'));
        assertTrue(pair.test('b'));
        assertFalse(pair.test('c'));
        assertFalse(CharPredicate.anyOf().test('a'));
    }

    @Test
    void charPredicate_lookupTable_rejectsCharsBeyondTable() {
        var predicate = CharPredicate.anyOf('a', 'b', 'c');

        assertTrue(predicate.test('c'));
        assertFalse(predicate.test('d'));
        assertFalse(predicate.test('一'));
    }

    @Test
    void charGroup_alphaNum_containsLettersAndDigits() {
        assertTrue(CharGroup.ALPHA_NUM.test('Q'));
        assertTrue(CharGroup.ALPHA_NUM.test('7'));
        assertFalse(CharGroup.ALPHA_NUM.test('-'));
        assertTrue(CharGroup.ALPHA_NUM.add('-').test('-'));
        assertTrue(CharGroup.HEX_DIGIT.test('f'));
        assertFalse(CharGroup.HEX_DIGIT.test('g'));
    }

    // === Character runs ===

    @Test
    void anyOf_withoutConstraints_acceptsEmptyRun() {
        var result = success(TextParsers.anyOf('x').parse("abc"));

        assertEquals("", result.value());
        assertEquals(0, result.next().offset());
    }

    @Test
    void characters_belowMinimum_failsAtStart() {
        var result = TextParsers.anyOf('a', 'b').min(2).parse("ac");

        assertTrue(result.isFailure());
        var failure = (ParseResult.Failure<String>) result;
        assertEquals("expected at least 2 characters, got only 1", failure.message());
        assertEquals(0, failure.cursor().offset());
    }

    @Test
    void characters_withMaximum_stopsAtLimit() {
        assertEquals("aa", success(TextParsers.anyOf('a').max(2).parse("aaaa")).value());
        assertEquals("abc", success(TextParsers.anyChars().take(3).parse("abcdef")).value());
        assertEquals(3, success(TextParsers.anyNot(' ').count().parse("abc def")).value());
    }

    @Test
    void oneOf_matchesSingleChar() {
        assertEquals("b", success(TextParsers.oneOf('a', 'b').parse("bb")).value());
        assertTrue(TextParsers.oneOf('a').parse("").isFailure());
    }

    // === Lines ===

    @Test
    void eol_acceptsAllLineBreaksAndEndOfInput() {
        assertEquals(1, success(TextParsers.eol().parse("\nx")).next().offset());
        assertEquals(2, success(TextParsers.eol().parse("\r\nx")).next().offset());
        assertEquals(1, success(TextParsers.eol().parse("\rx")).next().offset());
        assertEquals(0, success(TextParsers.eol().parse("")).next().offset());
        assertTrue(TextParsers.eol().parse("x").isFailure());
    }

    @Test
    void blankLines_consumeWhitespaceOnlyLines() {
        var result = success(TextParsers.blankLines().parse("  \n\t\n\ntext"));

        assertThat(result.value()).hasSize(3);
        assertEquals(6, result.next().offset());
    }

    @Test
    void blankLine_atEndOfInput_fails() {
        assertTrue(TextParsers.blankLine().parse("").isFailure());
    }

    @Test
    void textLine_blankLine_fails() {
        assertTrue(TextParsers.textLine().parse("   \nabc").isFailure());
        assertEquals("abc", success(TextParsers.textLine().parse("abc\ndef")).value());
    }

    @Test
    void restOfLine_lastLineWithoutBreak_succeeds() {
        var result = success(TextParsers.restOfLine().parse("last"));

        assertEquals("last", result.value());
        assertTrue(result.next().atEnd());
    }

    // === Names ===

    @Test
    void nameDecl_stopsAtFirstInvalidChar() {
        assertEquals("dir-name_1", success(TextParsers.nameDecl().parse("dir-name_1(foo)")).value());
        assertTrue(TextParsers.nameDecl().parse("1dir").isFailure());
    }

    @Test
    void refName_allowsSingleSymbolsBetweenWords() {
        assertEquals("config.ref-name", success(TextParsers.refName().parse("config.ref-name}")).value());
        assertEquals("a", success(TextParsers.refName().parse("a..b")).value());
    }

    // === Until ===

    @Test
    void anyUntil_delimiterFound_consumesDelimiter() {
        var result = success(TextParsers.anyUntil(TextParsers.literal("--")).parse("ab-c--de"));

        assertEquals("ab-c", result.value());
        assertEquals(6, result.next().offset());
    }

    @Test
    void anyUntil_stopChar_endsBeforeIt() {
        var result = success(TextParsers.anyUntil('x')
                                        .stopChars('\n')
                                        .scan()
                                        .parse("ab\ncx"));

        assertEquals(new UntilParser.UntilResult("ab", UntilParser.Termination.STOP_CHAR), result.value());
        assertEquals(2, result.next().offset());
    }

    @Test
    void anyUntil_endOfInput_fails() {
        assertTrue(TextParsers.anyUntil('x').parse("abc").isFailure());
    }

    @Test
    void anyUntil_belowMinimum_fails() {
        assertTrue(TextParsers.anyUntil('x').min(2).parse("ax").isFailure());
        assertEquals("ab", success(TextParsers.anyUntil('x').min(2).parse("abx")).value());
    }

    // === Prefixed parsers ===

    @Test
    void prefixedParser_otherStartChar_failsWithoutInvokingParser() {
        var invoked = new boolean[1];
        var parser = PrefixedParser.of('*', in -> {
            invoked[0] = true;
            return ParseResult.Failure.at(in, "never");
        });

        assertTrue(parser.parse("abc").isFailure());
        assertTrue(parser.parse("").isFailure());
        assertFalse(invoked[0]);
    }

    @Test
    void prefixedParser_orElse_unitesStartChars() {
        var parser = PrefixedParser.literal("*").orElse(PrefixedParser.literal("_"));

        assertThat(parser.startChars()).containsExactlyInAnyOrder('*', '_');
        assertEquals("_", success(parser.parse("_x")).value());
    }
}
