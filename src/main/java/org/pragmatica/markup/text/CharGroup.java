package org.pragmatica.markup.text;

import java.util.ArrayList;
import java.util.List;

/**
 * Common groups of characters, backed by a lookup table.
 */
public final class CharGroup implements CharPredicate {
    public static final CharGroup DIGIT = new CharGroup(List.of(CharRange.of('0', '9')));
    public static final CharGroup HEX_DIGIT = new CharGroup(List.of(CharRange.of('0', '9'),
                                                                    CharRange.of('a', 'f'),
                                                                    CharRange.of('A', 'F')));
    public static final CharGroup LOWER_ALPHA = new CharGroup(List.of(CharRange.of('a', 'z')));
    public static final CharGroup UPPER_ALPHA = new CharGroup(List.of(CharRange.of('A', 'Z')));
    public static final CharGroup ALPHA = LOWER_ALPHA.add(UPPER_ALPHA);
    public static final CharGroup ALPHA_NUM = ALPHA.add(DIGIT);

    private final List<CharRange> ranges;
    private final CharPredicate table;

    private CharGroup(List<CharRange> ranges) {
        this.ranges = List.copyOf(ranges);
        this.table = CharPredicate.inRanges(this.ranges.toArray(new CharRange[0]));
    }

    public static CharGroup of(CharRange... ranges) {
        return new CharGroup(List.of(ranges));
    }

    /**
     * A new group containing the characters of this group and the specified ones.
     */
    public CharGroup add(char... chars) {
        var widened = new ArrayList<>(ranges);
        for (char c : chars) {
            widened.add(CharRange.single(c));
        }
        return new CharGroup(widened);
    }

    public CharGroup add(CharGroup other) {
        var widened = new ArrayList<>(ranges);
        widened.addAll(other.ranges);
        return new CharGroup(widened);
    }

    public List<CharRange> ranges() {
        return ranges;
    }

    @Override
    public boolean test(char c) {
        return table.test(c);
    }
}
