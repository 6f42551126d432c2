package org.pragmatica.markup.markup;

import org.junit.jupiter.api.Test;
import org.pragmatica.markup.parser.ParseResult;
import org.pragmatica.markup.parser.Parser;
import org.pragmatica.markup.parser.Parsers;
import org.pragmatica.markup.text.TextParsers;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PrefixedDispatchTest {

    private static ParserDefinition<String> prefixed(String literal, String result, Precedence precedence) {
        return new ParserDefinition<>(Set.of(literal.charAt(0)),
                                      TextParsers.literal(literal).as(result),
                                      precedence,
                                      false,
                                      BlockPosition.ANY);
    }

    private static ParserDefinition<String> definition(char startChar, Parser<String> parser, Precedence precedence) {
        return new ParserDefinition<>(Set.of(startChar), parser, precedence, false, BlockPosition.ANY);
    }

    private static Parser<String> starThenRest(String label) {
        return TextParsers.literal("*")
                          .keepRight(TextParsers.anyChars())
                          .map(rest -> label + rest);
    }

    private static ParserDefinition<String> unprefixed(Parser<String> parser) {
        return new ParserDefinition<>(Set.of(), parser, Precedence.HIGH, false, BlockPosition.ANY);
    }

    private static String value(ParseResult<String> result) {
        assertTrue(result.isSuccess(), () -> "expected success but got " + result);
        return ((ParseResult.Success<String>) result).value();
    }

    // === Ordering ===

    @Test
    void order_extensionHighFirst_extensionLowLast() {
        var hostHigh = prefixed("a", "host-high", Precedence.HIGH);
        var hostLow = prefixed("a", "host-low", Precedence.LOW);
        var extHigh = prefixed("a", "ext-high", Precedence.HIGH);
        var extLow = prefixed("a", "ext-low", Precedence.LOW);

        var ordered = PrefixedDispatch.order(List.of(hostLow, hostHigh), List.of(extLow, extHigh));

        assertThat(ordered).containsExactly(extHigh, hostHigh, hostLow, extLow);
    }

    @Test
    void order_sameTier_keepsRegistrationOrder() {
        var first = prefixed("a", "first", Precedence.HIGH);
        var second = prefixed("b", "second", Precedence.HIGH);

        assertThat(PrefixedDispatch.order(List.of(first, second), List.of())).containsExactly(first, second);
    }

    // === Merging ===

    @Test
    void mergeByChar_unprefixedDefinition_isRejected() {
        var definitions = List.of(unprefixed(TextParsers.anyChars()));

        assertThrows(IllegalArgumentException.class, () -> PrefixedDispatch.mergeByChar(definitions));
    }

    @Test
    void merge_sameStartChar_triesInOrder() {
        var dispatch = PrefixedDispatch.merge(List.of(prefixed("ab", "first", Precedence.HIGH),
                                                      prefixed("a", "second", Precedence.HIGH)));

        assertEquals("first", value(dispatch.parse("ab")));
        assertEquals("second", value(dispatch.parse("ac")));
        assertThat(dispatch.groups()).containsOnlyKeys('a');
    }

    @Test
    void merge_groupFails_fallsBackToUnprefixed() {
        var dispatch = PrefixedDispatch.merge(List.of(prefixed("**", "strong", Precedence.HIGH),
                                                      unprefixed(TextParsers.anyChars().min(1))));

        assertEquals("strong", value(dispatch.parse("**")));
        assertEquals("*x", value(dispatch.parse("*x")));
        assertEquals("plain", value(dispatch.parse("plain")));
    }

    @Test
    void merge_extensionHighSucceeding_winsOverFailingHostLow() {
        var hostLow = definition('*', Parsers.failure("host rejects"), Precedence.LOW);
        var extHigh = definition('*', starThenRest("ext:"), Precedence.HIGH);

        var ordered = PrefixedDispatch.order(List.of(hostLow), List.of(extHigh));

        assertEquals("ext:x", value(PrefixedDispatch.merge(ordered).parse("*x")));
        assertEquals("ext:x", value(PrefixedDispatch.mergeByChar(ordered).get('*').parse("*x")));
    }

    @Test
    void merge_failingHostHigh_fallsThroughToExtensionLow() {
        var hostHigh = definition('*', Parsers.failure("host rejects"), Precedence.HIGH);
        var extLow = definition('*', starThenRest("ext-low:"), Precedence.LOW);

        var dispatch = PrefixedDispatch.merge(PrefixedDispatch.order(List.of(hostHigh), List.of(extLow)));

        assertEquals("ext-low:x", value(dispatch.parse("*x")));
    }

    @Test
    void merge_noMatchingGroupWithoutFallback_fails() {
        var dispatch = PrefixedDispatch.merge(List.of(prefixed("*", "star", Precedence.HIGH)));

        var result = dispatch.parse("x");
        assertTrue(result.isFailure());
        assertEquals("No parser available for start character 'x'", ((ParseResult.Failure<String>) result).message());
        assertTrue(dispatch.parse("").isFailure());
    }
}
