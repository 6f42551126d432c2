package org.pragmatica.markup.directive;

import org.pragmatica.markup.parser.Validated;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Converts the raw text of an attribute value into a typed value.
 */
@FunctionalInterface
public interface AttributeDecoder<T> {

    Validated<T> decode(String raw);

    AttributeDecoder<String> STRING = Validated::valid;

    AttributeDecoder<Integer> INT = raw -> {
        try {
            return Validated.valid(Integer.parseInt(raw.trim()));
        } catch (NumberFormatException e) {
            return Validated.invalid("not an integer: " + raw);
        }
    };

    AttributeDecoder<Integer> POSITIVE_INT = INT.<Integer>flatMap(value -> value > 0
                                                                           ? Validated.valid(value)
                                                                           : Validated.invalid("not a positive integer: " + value));

    AttributeDecoder<Boolean> BOOLEAN = raw -> {
        var value = raw.trim();
        if ("true".equalsIgnoreCase(value)) {
            return Validated.valid(true);
        }
        if ("false".equalsIgnoreCase(value)) {
            return Validated.valid(false);
        }
        return Validated.invalid("not a boolean: " + raw);
    };

    AttributeDecoder<Double> DOUBLE = raw -> {
        try {
            return Validated.valid(Double.parseDouble(raw.trim()));
        } catch (NumberFormatException e) {
            return Validated.invalid("not a number: " + raw);
        }
    };

    /**
     * Decodes an array written as {@code [a, b, "c"]} into its trimmed elements, surrounding quotes removed.
     * A value without brackets is a list with one element.
     */
    static AttributeDecoder<List<String>> stringList() {
        return raw -> {
            var value = raw.trim();
            if (!value.startsWith("[")) {
                return Validated.valid(List.of(unquote(value)));
            }
            if (!value.endsWith("]")) {
                return Validated.invalid("not an array: " + raw);
            }
            var content = value.substring(1, value.length() - 1)
                               .trim();
            if (content.isEmpty()) {
                return Validated.valid(List.of());
            }
            return Validated.valid(Arrays.stream(content.split(","))
                                         .map(String::trim)
                                         .map(AttributeDecoder::unquote)
                                         .toList());
        };
    }

    default <U> AttributeDecoder<U> map(Function<? super T, ? extends U> f) {
        return raw -> decode(raw).map(f);
    }

    default <U> AttributeDecoder<U> flatMap(Function<? super T, Validated<U>> f) {
        return raw -> decode(raw).flatMap(f);
    }

    private static String unquote(String value) {
        return value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")
               ? value.substring(1, value.length() - 1)
               : value;
    }
}
