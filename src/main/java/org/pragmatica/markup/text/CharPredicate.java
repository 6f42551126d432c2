package org.pragmatica.markup.text;

import java.util.Arrays;
import java.util.Collection;
import java.util.function.Predicate;

/**
 * Immutable classifier for single characters.
 *
 * <p>Classifiers built from a set of characters or ranges compare directly when they contain
 * one or two characters and otherwise use a lookup table sized to the largest character they
 * contain. Characters outside of the table are never matched.
 */
@FunctionalInterface
public interface CharPredicate {

    CharPredicate NONE = c -> false;
    CharPredicate ANY = c -> true;

    boolean test(char c);

    default CharPredicate or(CharPredicate other) {
        return c -> test(c) || other.test(c);
    }

    default CharPredicate negate() {
        return c -> !test(c);
    }

    static CharPredicate anyOf(char... chars) {
        return switch (chars.length) {
            case 0 -> NONE;
            case 1 -> {
                char c1 = chars[0];
                yield c -> c == c1;
            }
            case 2 -> {
                char c1 = chars[0];
                char c2 = chars[1];
                yield c -> c == c1 || c == c2;
            }
            default -> LookupTable.forChars(chars);
        };
    }

    static CharPredicate anyOf(Collection<Character> chars) {
        var array = new char[chars.size()];
        int i = 0;
        for (var c : chars) {
            array[i++] = c;
        }
        return anyOf(array);
    }

    static CharPredicate noneOf(char... chars) {
        return anyOf(chars).negate();
    }

    static CharPredicate inRanges(CharRange... ranges) {
        return LookupTable.forRanges(Arrays.asList(ranges));
    }

    static CharPredicate of(Predicate<Character> predicate) {
        return predicate::test;
    }

    /**
     * Table based classifier, one entry per character up to the largest one it matches.
     */
    final class LookupTable implements CharPredicate {
        private final boolean[] table;

        private LookupTable(boolean[] table) {
            this.table = table;
        }

        static LookupTable forChars(char... chars) {
            char max = 0;
            for (char c : chars) {
                max = (char) Math.max(max, c);
            }
            var table = new boolean[max + 1];
            for (char c : chars) {
                table[c] = true;
            }
            return new LookupTable(table);
        }

        static LookupTable forRanges(Iterable<CharRange> ranges) {
            char max = 0;
            for (var range : ranges) {
                max = (char) Math.max(max, range.to());
            }
            var table = new boolean[max + 1];
            for (var range : ranges) {
                for (int c = range.from(); c <= range.to(); c++) {
                    table[c] = true;
                }
            }
            return new LookupTable(table);
        }

        @Override
        public boolean test(char c) {
            return c < table.length && table[c];
        }
    }
}
