package org.pragmatica.markup.directive;

/**
 * A directive which can only appear in the body of its parent directive, splitting the body
 * into parts.
 *
 * @param min the minimum number of occurrences in the body
 * @param max the maximum number of occurrences in the body
 */
public record SeparatorDirective<E, T>(String name, DirectivePart<E, T> part, int min, int max) {

    public SeparatorDirective {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Separator name must not be empty");
        }
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("Invalid occurrence bounds: min=" + min + ", max=" + max);
        }
    }

    public SeparatorDirective<E, T> withMin(int newMin) {
        return new SeparatorDirective<>(name, part, newMin, max);
    }

    public SeparatorDirective<E, T> withMax(int newMax) {
        return new SeparatorDirective<>(name, part, min, newMax);
    }
}
